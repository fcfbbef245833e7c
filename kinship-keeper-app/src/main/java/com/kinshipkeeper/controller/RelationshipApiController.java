package com.kinshipkeeper.controller;

import com.kinshipkeeper.model.ParentRole;
import com.kinshipkeeper.model.Relationship;
import com.kinshipkeeper.service.RelationshipNormalizer;
import com.kinshipkeeper.service.RelationshipService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/relationships")
public class RelationshipApiController {

    private final RelationshipService relationshipService;
    private final RelationshipNormalizer normalizer;

    public RelationshipApiController(RelationshipService relationshipService, RelationshipNormalizer normalizer) {
        this.relationshipService = relationshipService;
        this.normalizer = normalizer;
    }

    @GetMapping
    public List<RelationshipResponse> listRelationships(@AuthenticationPrincipal UserDetails user) {
        return relationshipService.listRelationships(user.getUsername()).stream()
            .map(this::toResponse)
            .toList();
    }

    @GetMapping("/{id}")
    public RelationshipResponse getRelationship(@AuthenticationPrincipal UserDetails user, @PathVariable Long id) {
        return toResponse(relationshipService.getRelationship(user.getUsername(), id));
    }

    /**
     * Body: {person1Id, person2Id, type: mother|father|spouse|parentOf, parentRole?}.
     * For mother/father, person1 is the parent and person2 the child.
     */
    @PostMapping
    public ResponseEntity<RelationshipResponse> createRelationship(@AuthenticationPrincipal UserDetails user,
                                                                   @RequestBody Map<String, Object> body) {
        Relationship created = relationshipService.createRelationship(
            user.getUsername(),
            RequestBodies.id(body, "person1Id"),
            RequestBodies.id(body, "person2Id"),
            RequestBodies.text(body, "type"),
            RequestBodies.text(body, "parentRole")
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
    }

    @PutMapping("/{id}")
    public RelationshipResponse updateRelationship(@AuthenticationPrincipal UserDetails user,
                                                   @PathVariable Long id,
                                                   @RequestBody Map<String, Object> body) {
        Relationship updated = relationshipService.updateRelationship(
            user.getUsername(),
            id,
            RequestBodies.id(body, "person1Id"),
            RequestBodies.id(body, "person2Id"),
            RequestBodies.text(body, "type"),
            RequestBodies.text(body, "parentRole")
        );
        return toResponse(updated);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteRelationship(@AuthenticationPrincipal UserDetails user, @PathVariable Long id) {
        relationshipService.deleteRelationship(user.getUsername(), id);
        return ResponseEntity.noContent().build();
    }

    private RelationshipResponse toResponse(Relationship relationship) {
        ParentRole role = relationship.parentRole();
        return new RelationshipResponse(
            relationship.id(),
            relationship.person1Id(),
            relationship.person2Id(),
            normalizer.denormalize(relationship),
            role != null ? role.label() : null,
            relationship.createdAt()
        );
    }

    /**
     * API shape of a relationship: parentOf is shown as its role ("mother"/"father").
     */
    public record RelationshipResponse(
        Long id,
        Long person1Id,
        Long person2Id,
        String type,
        String parentRole,
        LocalDateTime createdAt
    ) {}
}
