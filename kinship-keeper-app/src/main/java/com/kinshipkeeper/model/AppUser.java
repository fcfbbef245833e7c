package com.kinshipkeeper.model;

/**
 * An account that owns person and relationship records.
 * Users are configured under {@code kinship.users}, no database table.
 *
 * @param profilePersonId the person record that stands for the account holder, or null
 */
public record AppUser(
    String username,
    String password,
    String displayName,
    String role,
    Long profilePersonId
) {}
