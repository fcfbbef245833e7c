package com.kinshipkeeper.model;

/**
 * A relationship request after verb normalization, before any storage checks.
 */
public record NormalizedRelationship(
    Long person1Id,
    Long person2Id,
    Kinship kinship
) {
    public KinshipType kinshipType() {
        return kinship.type();
    }

    public ParentRole role() {
        return kinship.roleOrNull();
    }
}
