package com.kinshipkeeper.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A stored relationship. For parentOf, person1 is the parent and person2 the child.
 */
public record Relationship(
    Long id,
    Long person1Id,
    Long person2Id,
    Kinship kinship,
    String ownerId,
    LocalDateTime createdAt
) {
    public KinshipType type() {
        return kinship.type();
    }

    public ParentRole parentRole() {
        return kinship.roleOrNull();
    }

    public boolean involves(Long personId) {
        return Objects.equals(person1Id, personId) || Objects.equals(person2Id, personId);
    }

    public boolean isParentRoleOf(Long childId, ParentRole role) {
        return kinship instanceof Kinship.ParentOf parentOf
            && parentOf.role() == role
            && Objects.equals(person2Id, childId);
    }

    /**
     * True when both relationships have the same kinship type and link the same two people,
     * in either orientation.
     */
    public boolean linksSamePair(Relationship other) {
        if (type() != other.type()) {
            return false;
        }
        boolean forward = Objects.equals(person1Id, other.person1Id) && Objects.equals(person2Id, other.person2Id);
        boolean reverse = Objects.equals(person1Id, other.person2Id) && Objects.equals(person2Id, other.person1Id);
        return forward || reverse;
    }

    public Relationship withEndpointReplaced(Long from, Long to) {
        Long newPerson1 = Objects.equals(person1Id, from) ? to : person1Id;
        Long newPerson2 = Objects.equals(person2Id, from) ? to : person2Id;
        return new Relationship(id, newPerson1, newPerson2, kinship, ownerId, createdAt);
    }

    public Relationship withId(Long newId) {
        return new Relationship(newId, person1Id, person2Id, kinship, ownerId, createdAt);
    }
}
