package com.kinshipkeeper.controller;

import com.kinshipkeeper.config.UsersConfig;
import com.kinshipkeeper.model.AppUser;
import com.kinshipkeeper.model.DuplicateCandidate;
import com.kinshipkeeper.model.MergePreview;
import com.kinshipkeeper.model.Person;
import com.kinshipkeeper.model.Rejection;
import com.kinshipkeeper.model.Relationship;
import com.kinshipkeeper.repository.RelationshipRepository;
import com.kinshipkeeper.service.DuplicateDetectionService;
import com.kinshipkeeper.service.MergePreviewService;
import com.kinshipkeeper.service.PersonService;
import com.kinshipkeeper.service.RejectionException;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Duplicate candidates and merge previews, always within the caller's own records.
 */
@RestController
@RequestMapping("/api/people")
public class DuplicateApiController {

    private final PersonService personService;
    private final RelationshipRepository relationshipRepository;
    private final DuplicateDetectionService duplicateDetectionService;
    private final MergePreviewService mergePreviewService;
    private final UsersConfig usersConfig;

    public DuplicateApiController(PersonService personService,
                                  RelationshipRepository relationshipRepository,
                                  DuplicateDetectionService duplicateDetectionService,
                                  MergePreviewService mergePreviewService,
                                  UsersConfig usersConfig) {
        this.personService = personService;
        this.relationshipRepository = relationshipRepository;
        this.duplicateDetectionService = duplicateDetectionService;
        this.mergePreviewService = mergePreviewService;
        this.usersConfig = usersConfig;
    }

    // ========== DUPLICATES ==========

    @GetMapping("/duplicates")
    public List<DuplicateCandidate> listDuplicates(@AuthenticationPrincipal UserDetails user,
                                                   @RequestParam(required = false) String threshold,
                                                   @RequestParam(required = false) String limit) {
        int minConfidence = thresholdOrDefault(threshold);
        Integer maxResults = RequestBodies.intParam("limit", limit);

        String ownerId = user.getUsername();
        return duplicateDetectionService.findAllDuplicates(
            personService.listPersons(ownerId),
            relationshipRepository.findByOwner(ownerId),
            minConfidence,
            maxResults
        );
    }

    @GetMapping("/{id}/duplicates")
    public ResponseEntity<List<DuplicateCandidate>> listDuplicatesForPerson(
            @AuthenticationPrincipal UserDetails user,
            @PathVariable Long id,
            @RequestParam(required = false) String threshold,
            @RequestParam(required = false) String limit) {

        int minConfidence = thresholdOrDefault(threshold);
        Integer maxResults = RequestBodies.intParam("limit", limit);

        String ownerId = user.getUsername();
        Optional<Person> target = personService.getPerson(ownerId, id);
        if (target.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        return ResponseEntity.ok(duplicateDetectionService.findDuplicatesForPerson(
            target.get(),
            personService.listPersons(ownerId),
            relationshipRepository.findByOwner(ownerId),
            minConfidence,
            maxResults
        ));
    }

    // ========== MERGE PREVIEW ==========

    /**
     * Body: {sourceId, targetId}. Source is the record that would disappear.
     */
    @PostMapping("/merge/preview")
    public ResponseEntity<MergePreview> previewMerge(@AuthenticationPrincipal UserDetails user,
                                                     @RequestBody Map<String, Object> body) {
        Long sourceId = RequestBodies.id(body, "sourceId");
        Long targetId = RequestBodies.id(body, "targetId");
        if (sourceId == null || targetId == null) {
            throw new RejectionException(Rejection.INVALID_PARAMETER, "sourceId and targetId are required");
        }

        String ownerId = user.getUsername();
        Optional<Person> source = personService.getPerson(ownerId, sourceId);
        Optional<Person> target = personService.getPerson(ownerId, targetId);
        if (source.isEmpty() || target.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        List<Relationship> sourceRelationships = relationshipRepository.findByPerson(sourceId);
        List<Relationship> targetRelationships = relationshipRepository.findByPerson(targetId);

        Long profilePersonId = usersConfig.findUser(ownerId)
            .map(AppUser::profilePersonId)
            .orElse(null);

        return ResponseEntity.ok(mergePreviewService.previewMerge(
            source.get(), target.get(), profilePersonId, sourceRelationships, targetRelationships));
    }

    private int thresholdOrDefault(String raw) {
        Integer parsed = RequestBodies.intParam("threshold", raw);
        return parsed != null ? parsed : duplicateDetectionService.defaultThreshold();
    }
}
