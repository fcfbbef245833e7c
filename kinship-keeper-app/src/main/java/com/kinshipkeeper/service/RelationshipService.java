package com.kinshipkeeper.service;

import com.kinshipkeeper.model.Rejection;
import com.kinshipkeeper.model.Relationship;
import com.kinshipkeeper.repository.RelationshipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Relationship writes: validate, then persist, inside one serializable transaction so two
 * concurrent requests cannot both claim the same parent role. The schema's unique indexes
 * back this up; a violation they catch, or a serialization failure raised by the write, is
 * reported like the equivalent validation failure.
 */
@Service
public class RelationshipService {

    private static final Logger log = LoggerFactory.getLogger(RelationshipService.class);

    private final RelationshipRepository relationshipRepository;
    private final RelationshipValidator validator;

    public RelationshipService(RelationshipRepository relationshipRepository, RelationshipValidator validator) {
        this.relationshipRepository = relationshipRepository;
        this.validator = validator;
    }

    @Transactional(readOnly = true)
    public List<Relationship> listRelationships(String ownerId) {
        return relationshipRepository.findByOwner(ownerId);
    }

    @Transactional(readOnly = true)
    public Relationship getRelationship(String ownerId, Long relationshipId) {
        return findOwned(ownerId, relationshipId);
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public Relationship createRelationship(String ownerId, Long person1Id, Long person2Id, String verb) {
        return createRelationship(ownerId, person1Id, person2Id, verb, null);
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public Relationship createRelationship(String ownerId, Long person1Id, Long person2Id,
                                           String verb, String parentRole) {
        Relationship prepared = validator.validateAndPrepare(ownerId, person1Id, person2Id, verb, parentRole, null);
        Long id = persist(() -> relationshipRepository.save(prepared), prepared);
        log.info("Created {} relationship {} ({} -> {}) for {}",
            prepared.kinship().verb(), id, prepared.person1Id(), prepared.person2Id(), ownerId);
        return reload(id);
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public Relationship updateRelationship(String ownerId, Long relationshipId,
                                           Long person1Id, Long person2Id, String verb) {
        return updateRelationship(ownerId, relationshipId, person1Id, person2Id, verb, null);
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public Relationship updateRelationship(String ownerId, Long relationshipId,
                                           Long person1Id, Long person2Id, String verb, String parentRole) {
        findOwned(ownerId, relationshipId);
        Relationship prepared = validator.validateAndPrepare(
            ownerId, person1Id, person2Id, verb, parentRole, relationshipId);
        persist(() -> {
            relationshipRepository.update(relationshipId, prepared);
            return relationshipId;
        }, prepared);
        log.info("Updated relationship {} to {} ({} -> {})",
            relationshipId, prepared.kinship().verb(), prepared.person1Id(), prepared.person2Id());
        return reload(relationshipId);
    }

    @Transactional
    public void deleteRelationship(String ownerId, Long relationshipId) {
        findOwned(ownerId, relationshipId);
        relationshipRepository.delete(relationshipId);
        log.info("Deleted relationship {} for {}", relationshipId, ownerId);
    }

    private Relationship findOwned(String ownerId, Long relationshipId) {
        return relationshipRepository.findById(relationshipId)
            .filter(rel -> ownerId != null && ownerId.equals(rel.ownerId()))
            .orElseThrow(() -> new RejectionException(Rejection.OWNERSHIP_VIOLATION,
                "Relationship does not exist or does not belong to you"));
    }

    private Relationship reload(Long id) {
        return relationshipRepository.findById(id)
            .orElseThrow(() -> new IllegalStateException("Relationship " + id + " vanished after write"));
    }

    private Long persist(Write write, Relationship prepared) {
        try {
            return write.run();
        } catch (DuplicateKeyException | PessimisticLockingFailureException e) {
            // a serialization failure means a concurrent writer claimed the same slot first
            log.warn("Storage rejected relationship {} -> {}: {}",
                prepared.person1Id(), prepared.person2Id(), e.getMessage());
            if (prepared.parentRole() != null) {
                throw new RejectionException(Rejection.DUPLICATE_PARENT_ROLE,
                    "Person already has a " + prepared.parentRole().label());
            }
            throw new RejectionException(Rejection.DUPLICATE_RELATIONSHIP, "This relationship already exists");
        }
    }

    @FunctionalInterface
    private interface Write {
        Long run();
    }
}
