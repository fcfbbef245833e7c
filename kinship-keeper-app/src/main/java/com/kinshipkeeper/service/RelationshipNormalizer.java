package com.kinshipkeeper.service;

import com.kinshipkeeper.model.Kinship;
import com.kinshipkeeper.model.NormalizedRelationship;
import com.kinshipkeeper.model.Relationship;
import org.springframework.stereotype.Component;

/**
 * Maps boundary kinship verbs to the stored form and back.
 *
 * <ul>
 *   <li>"mother" / "father" become parentOf with that role; person1 is the parent, person2 the child</li>
 *   <li>"spouse" stays spouse with no role</li>
 *   <li>"parentOf" passes through when a role is supplied</li>
 * </ul>
 */
@Component
public class RelationshipNormalizer {

    public NormalizedRelationship normalize(Long person1Id, Long person2Id, String verb) {
        return normalize(person1Id, person2Id, verb, null);
    }

    /**
     * @throws IllegalArgumentException for a verb the validator should already have refused
     */
    public NormalizedRelationship normalize(Long person1Id, Long person2Id, String verb, String parentRole) {
        Kinship kinship = Kinship.fromVerb(verb, parentRole)
            .orElseThrow(() -> new IllegalArgumentException("Not a kinship verb: " + verb));
        return new NormalizedRelationship(person1Id, person2Id, kinship);
    }

    public String denormalize(Relationship relationship) {
        return relationship.kinship().verb();
    }
}
