package com.kinshipkeeper.model;

public enum Rejection {
    INVALID_KINSHIP_TYPE("InvalidKinshipType"),
    INVALID_PARAMETER("InvalidParameter"),
    SELF_RELATION_NOT_ALLOWED("SelfRelationNotAllowed"),
    DUPLICATE_PARENT_ROLE("DuplicateParentRole"),
    DUPLICATE_RELATIONSHIP("DuplicateRelationship"),
    // covers both "does not exist" and "belongs to someone else"
    OWNERSHIP_VIOLATION("OwnershipViolation");

    private final String code;

    Rejection(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
