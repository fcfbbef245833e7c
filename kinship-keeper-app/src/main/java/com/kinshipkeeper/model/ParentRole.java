package com.kinshipkeeper.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The parental role the first endpoint of a parentOf relationship plays toward the child.
 */
public enum ParentRole {
    MOTHER("mother"),
    FATHER("father");

    private final String label;

    ParentRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<ParentRole> fromLabel(String label) {
        return Arrays.stream(values())
            .filter(role -> role.label.equals(label))
            .findFirst();
    }
}
