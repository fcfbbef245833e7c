package com.kinshipkeeper.model;

public record FieldComparison(
    Object source,
    Object target,
    Object merged,
    boolean conflict
) {}
