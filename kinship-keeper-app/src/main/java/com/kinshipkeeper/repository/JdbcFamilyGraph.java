package com.kinshipkeeper.repository;

import com.kinshipkeeper.model.Person;
import com.kinshipkeeper.model.Relationship;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcFamilyGraph implements FamilyGraph {

    private final PersonRepository personRepository;
    private final RelationshipRepository relationshipRepository;

    public JdbcFamilyGraph(PersonRepository personRepository, RelationshipRepository relationshipRepository) {
        this.personRepository = personRepository;
        this.relationshipRepository = relationshipRepository;
    }

    @Override
    public Optional<Person> findPerson(Long personId) {
        return personRepository.findById(personId);
    }

    @Override
    public List<Relationship> findRelationshipsOf(Long personId) {
        return relationshipRepository.findByPerson(personId);
    }
}
