package com.kinshipkeeper.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record Person(
    Long id,
    String firstName,
    String lastName,
    String birthSurname,
    String nickname,
    LocalDate birthDate,
    LocalDate deathDate,
    String gender,
    String photoUrl,
    String ownerId,
    LocalDateTime createdAt
) {
    public String displayName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        String full = (first + " " + last).trim();
        return full.isEmpty() ? "Unknown" : full;
    }

    public boolean isOwnedBy(String owner) {
        return ownerId != null && ownerId.equals(owner);
    }
}
