package com.kinshipkeeper.model;

import java.util.List;
import java.util.Map;

/**
 * What merging {@code source} into {@code target} would do. Nothing is written.
 */
public record MergePreview(
    boolean canMerge,
    List<String> validationErrors,
    List<String> validationWarnings,
    List<String> conflictFields,
    Person mergedRecord,
    Map<String, FieldComparison> perFieldComparison,
    List<Relationship> relationshipsToTransfer,
    List<Relationship> existingRelationshipsOnTarget
) {}
