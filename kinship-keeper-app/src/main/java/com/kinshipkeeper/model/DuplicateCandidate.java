package com.kinshipkeeper.model;

import java.util.List;

public record DuplicateCandidate(
    Person personA,
    Person personB,
    int confidence,
    List<String> matchingFields  // "name", "birthDate", "parents"
) {}
