package com.kinshipkeeper.service;

import com.kinshipkeeper.model.Kinship;
import com.kinshipkeeper.model.NormalizedRelationship;
import com.kinshipkeeper.model.Person;
import com.kinshipkeeper.model.Rejection;
import com.kinshipkeeper.model.Relationship;
import com.kinshipkeeper.repository.FamilyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a relationship may be written. Checks run in a fixed order and the first
 * failure wins; every call re-reads the graph, nothing is cached between calls.
 */
@Service
public class RelationshipValidator {

    private static final Logger log = LoggerFactory.getLogger(RelationshipValidator.class);

    private final FamilyGraph familyGraph;
    private final RelationshipNormalizer normalizer;

    public RelationshipValidator(FamilyGraph familyGraph, RelationshipNormalizer normalizer) {
        this.familyGraph = familyGraph;
        this.normalizer = normalizer;
    }

    public Relationship validateAndPrepare(String ownerId, Long person1Id, Long person2Id, String verb) {
        return validateAndPrepare(ownerId, person1Id, person2Id, verb, null, null);
    }

    /**
     * Validate a relationship write and return it ready to persist (no id yet).
     *
     * @param parentRole         only read when {@code verb} is "parentOf"
     * @param excludeRelationshipId the relationship being updated, ignored by the cardinality and duplicate checks
     * @throws RejectionException on the first rule the request breaks
     */
    public Relationship validateAndPrepare(String ownerId, Long person1Id, Long person2Id,
                                           String verb, String parentRole, Long excludeRelationshipId) {
        if (person1Id == null || person2Id == null) {
            throw reject(Rejection.INVALID_PARAMETER, "person1Id and person2Id are required");
        }

        if (Kinship.fromVerb(verb, parentRole).isEmpty()) {
            throw reject(Rejection.INVALID_KINSHIP_TYPE,
                "Invalid relationship type '" + verb + "'. Must be: mother, father, or spouse");
        }

        if (person1Id.equals(person2Id)) {
            throw reject(Rejection.SELF_RELATION_NOT_ALLOWED, "A person cannot be related to themselves");
        }

        Optional<Person> person1 = familyGraph.findPerson(person1Id);
        Optional<Person> person2 = familyGraph.findPerson(person2Id);
        boolean bothOwned = person1.map(p -> p.isOwnedBy(ownerId)).orElse(false)
            && person2.map(p -> p.isOwnedBy(ownerId)).orElse(false);
        if (!bothOwned) {
            throw reject(Rejection.OWNERSHIP_VIOLATION,
                "One or both persons do not exist or do not belong to you");
        }

        NormalizedRelationship normalized = normalizer.normalize(person1Id, person2Id, verb, parentRole);
        Relationship candidate = new Relationship(
            null, normalized.person1Id(), normalized.person2Id(), normalized.kinship(), ownerId, null);

        List<Relationship> existing = familyGraph.findRelationshipsOf(normalized.person2Id()).stream()
            .filter(rel -> !Objects.equals(rel.id(), excludeRelationshipId))
            .toList();

        if (normalized.kinship() instanceof Kinship.ParentOf parentOf) {
            boolean roleTaken = existing.stream()
                .anyMatch(rel -> rel.isParentRoleOf(normalized.person2Id(), parentOf.role()));
            if (roleTaken) {
                throw reject(Rejection.DUPLICATE_PARENT_ROLE,
                    "Person already has a " + parentOf.role().label());
            }
        }

        // parentOf and spouse are both checked in either orientation
        if (existing.stream().anyMatch(candidate::linksSamePair)) {
            throw reject(Rejection.DUPLICATE_RELATIONSHIP, "This relationship already exists");
        }

        return candidate;
    }

    private RejectionException reject(Rejection rejection, String message) {
        log.debug("Relationship rejected ({}): {}", rejection.code(), message);
        return new RejectionException(rejection, message);
    }
}
