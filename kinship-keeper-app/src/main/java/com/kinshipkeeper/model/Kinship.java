package com.kinshipkeeper.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.Optional;

/**
 * What a relationship says about its two endpoints.
 *
 * <p>Storage keeps a coarse {@link KinshipType} plus an optional {@link ParentRole};
 * the API speaks in verbs ("mother", "father", "spouse"). Both directions of that
 * mapping live here and nowhere else.
 */
public sealed interface Kinship permits Kinship.ParentOf, Kinship.Spouse {

    String VERB_SPOUSE = "spouse";
    String VERB_PARENT_OF = "parentOf";

    KinshipType type();

    /** The boundary verb for this kinship: "mother", "father" or "spouse". */
    @JsonValue
    String verb();

    default ParentRole roleOrNull() {
        return this instanceof ParentOf parentOf ? parentOf.role() : null;
    }

    record ParentOf(ParentRole role) implements Kinship {
        public ParentOf {
            Objects.requireNonNull(role, "role");
        }

        @Override
        public KinshipType type() {
            return KinshipType.PARENT_OF;
        }

        @Override
        public String verb() {
            return role.label();
        }
    }

    record Spouse() implements Kinship {
        @Override
        public KinshipType type() {
            return KinshipType.SPOUSE;
        }

        @Override
        public String verb() {
            return VERB_SPOUSE;
        }
    }

    static Kinship mother() {
        return new ParentOf(ParentRole.MOTHER);
    }

    static Kinship father() {
        return new ParentOf(ParentRole.FATHER);
    }

    static Kinship spouse() {
        return new Spouse();
    }

    /**
     * Parse a boundary verb. "parentOf" is accepted only together with an explicit role.
     */
    static Optional<Kinship> fromVerb(String verb, String parentRole) {
        if (verb == null) {
            return Optional.empty();
        }
        if (VERB_SPOUSE.equals(verb)) {
            return Optional.of(spouse());
        }
        if (VERB_PARENT_OF.equals(verb)) {
            return ParentRole.fromLabel(parentRole).map(ParentOf::new);
        }
        return ParentRole.fromLabel(verb).map(ParentOf::new);
    }

    /**
     * Rebuild a kinship from its stored columns.
     *
     * @throws IllegalStateException if the columns break the type/role pairing
     */
    static Kinship fromStored(KinshipType type, ParentRole role) {
        if (type == KinshipType.SPOUSE && role == null) {
            return spouse();
        }
        if (type == KinshipType.PARENT_OF && role != null) {
            return new ParentOf(role);
        }
        throw new IllegalStateException("Invalid stored kinship: type=" + type + ", role=" + role);
    }
}
