package com.kinshipkeeper.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Stored kinship category, as written to the {@code relationship.type} column.
 */
public enum KinshipType {
    PARENT_OF("parentOf"),
    SPOUSE("spouse");

    private final String storedValue;

    KinshipType(String storedValue) {
        this.storedValue = storedValue;
    }

    public String storedValue() {
        return storedValue;
    }

    public static Optional<KinshipType> fromStoredValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.storedValue.equals(value))
            .findFirst();
    }
}
