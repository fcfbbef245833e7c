package com.kinshipkeeper.repository;

import com.kinshipkeeper.model.Person;
import com.kinshipkeeper.model.Relationship;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the stored family graph, as needed by relationship validation.
 */
public interface FamilyGraph {

    Optional<Person> findPerson(Long personId);

    /** All relationships with the given person at either endpoint. */
    List<Relationship> findRelationshipsOf(Long personId);
}
