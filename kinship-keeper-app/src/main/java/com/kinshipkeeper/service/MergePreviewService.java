package com.kinshipkeeper.service;

import com.kinshipkeeper.model.FieldComparison;
import com.kinshipkeeper.model.Kinship;
import com.kinshipkeeper.model.MergePreview;
import com.kinshipkeeper.model.ParentRole;
import com.kinshipkeeper.model.Person;
import com.kinshipkeeper.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Previews merging a source person into a target person.
 *
 * <p>Field values follow keep-target: when both records hold different values the target's
 * wins and the field is reported as a conflict, with the source's value kept alongside for a
 * manual override. A value only the source holds is adopted without conflict. Relationships
 * are re-expressed against the target but nothing is written; committing the merge is
 * someone else's job.
 */
@Service
public class MergePreviewService {

    private static final Logger log = LoggerFactory.getLogger(MergePreviewService.class);

    private static final String GENDER_UNSPECIFIED = "unspecified";

    public MergePreview previewMerge(Person source, Person target,
                                     List<Relationship> sourceRelationships,
                                     List<Relationship> targetRelationships) {
        return previewMerge(source, target, null, sourceRelationships, targetRelationships);
    }

    /**
     * @param profilePersonId the caller's own person record, which may never be merged either way; may be null
     */
    public MergePreview previewMerge(Person source, Person target, Long profilePersonId,
                                     List<Relationship> sourceRelationships,
                                     List<Relationship> targetRelationships) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> conflictFields = new ArrayList<>();

        if (Objects.equals(source.id(), target.id())) {
            errors.add("Cannot merge a person into themselves");
        }
        if (!Objects.equals(source.ownerId(), target.ownerId())) {
            errors.add("Cannot merge records across different users");
        }
        if (profilePersonId != null && profilePersonId.equals(source.id())) {
            errors.add("Cannot merge your profile person into another person");
        }
        if (profilePersonId != null && profilePersonId.equals(target.id())) {
            errors.add("Cannot merge into your profile person");
        }
        if (gendersContradict(source.gender(), target.gender())) {
            errors.add("Gender mismatch: Cannot merge " + source.gender() + " into " + target.gender());
        }

        Map<String, FieldComparison> comparison = new LinkedHashMap<>();
        String firstName = compare("firstName", source, target, Person::firstName, comparison, conflictFields);
        String lastName = compare("lastName", source, target, Person::lastName, comparison, conflictFields);
        LocalDate birthDate = compare("birthDate", source, target, Person::birthDate, comparison, conflictFields);
        LocalDate deathDate = compare("deathDate", source, target, Person::deathDate, comparison, conflictFields);
        String gender = compare("gender", source, target, p -> specifiedGender(p.gender()), comparison, conflictFields);
        String photoUrl = compare("photoUrl", source, target, Person::photoUrl, comparison, conflictFields);
        String birthSurname = compare("birthSurname", source, target, Person::birthSurname, comparison, conflictFields);
        String nickname = compare("nickname", source, target, Person::nickname, comparison, conflictFields);

        // "unspecified" never conflicts, but survives when neither side says more
        if (gender == null && (GENDER_UNSPECIFIED.equals(target.gender()) || GENDER_UNSPECIFIED.equals(source.gender()))) {
            gender = GENDER_UNSPECIFIED;
        }
        comparison.put("gender", new FieldComparison(
            source.gender(), target.gender(), gender, comparison.get("gender").conflict()));

        Person merged = new Person(
            target.id(), firstName, lastName, birthSurname, nickname,
            birthDate, deathDate, gender, photoUrl,
            target.ownerId(), target.createdAt()
        );

        for (ParentRole role : ParentRole.values()) {
            Optional<Long> sourceParent = parentOf(source.id(), role, sourceRelationships);
            Optional<Long> targetParent = parentOf(target.id(), role, targetRelationships);
            if (sourceParent.isPresent() && targetParent.isPresent() && !sourceParent.equals(targetParent)) {
                conflictFields.add(role.label());
                warnings.add("Both people have different " + role.label() + "s - resolve before merging");
            }
        }

        List<Relationship> toTransfer = new ArrayList<>();
        for (Relationship rel : sourceRelationships) {
            if (!rel.involves(source.id())) {
                continue;
            }
            if (rel.involves(target.id())) {
                warnings.add("Source and target are linked as " + rel.kinship().verb()
                    + " (relationship " + rel.id() + "); it will be dropped rather than become a self-relation");
                continue;
            }
            toTransfer.add(rel.withEndpointReplaced(source.id(), target.id()));
        }

        List<Relationship> collisions = new ArrayList<>();
        for (Relationship existing : targetRelationships) {
            Optional<Relationship> duplicate = toTransfer.stream()
                .filter(transferred -> transferred.linksSamePair(existing))
                .findFirst();
            if (duplicate.isPresent()) {
                collisions.add(existing);
                warnings.add("Target already has this " + existing.kinship().verb()
                    + " relationship (relationship " + existing.id() + "); relationship "
                    + duplicate.get().id() + " would duplicate it");
                continue;
            }
            Optional<Relationship> secondParent = toTransfer.stream()
                .filter(transferred -> claimsSameParentRole(transferred, existing))
                .findFirst();
            if (secondParent.isPresent()) {
                collisions.add(existing);
                warnings.add("Relationship " + secondParent.get().id() + " would give person "
                    + existing.person2Id() + " a second " + existing.kinship().verb()
                    + " alongside relationship " + existing.id());
            }
        }

        if (!toTransfer.isEmpty()) {
            warnings.add(0, toTransfer.size() + " relationship(s) will be moved from "
                + source.displayName() + " to " + target.displayName());
        }

        boolean canMerge = errors.isEmpty();
        log.debug("Merge preview {} -> {}: canMerge={}, conflicts={}, transfers={}",
            source.id(), target.id(), canMerge, conflictFields, toTransfer.size());

        return new MergePreview(
            canMerge,
            List.copyOf(errors),
            List.copyOf(warnings),
            List.copyOf(conflictFields),
            merged,
            comparison,
            List.copyOf(toTransfer),
            List.copyOf(collisions)
        );
    }

    private static <T> T compare(String field, Person source, Person target, Function<Person, T> getter,
                                 Map<String, FieldComparison> comparison, List<String> conflictFields) {
        T sourceValue = present(getter.apply(source));
        T targetValue = present(getter.apply(target));

        boolean conflict = sourceValue != null && targetValue != null && !sourceValue.equals(targetValue);
        T merged = targetValue != null ? targetValue : sourceValue;

        if (conflict) {
            conflictFields.add(field);
        }
        comparison.put(field, new FieldComparison(getter.apply(source), getter.apply(target), merged, conflict));
        return merged;
    }

    // blank strings count as missing
    private static <T> T present(T value) {
        if (value instanceof String s && s.isBlank()) {
            return null;
        }
        return value;
    }

    private static String specifiedGender(String gender) {
        return GENDER_UNSPECIFIED.equals(gender) ? null : gender;
    }

    private static boolean gendersContradict(String sourceGender, String targetGender) {
        String s = present(specifiedGender(sourceGender));
        String t = present(specifiedGender(targetGender));
        return s != null && t != null && !s.equals(t);
    }

    // one mother and one father per child
    private static boolean claimsSameParentRole(Relationship transferred, Relationship existing) {
        return existing.kinship() instanceof Kinship.ParentOf parentOf
            && transferred.isParentRoleOf(existing.person2Id(), parentOf.role());
    }

    private static Optional<Long> parentOf(Long childId, ParentRole role, List<Relationship> relationships) {
        return relationships.stream()
            .filter(rel -> rel.kinship() instanceof Kinship.ParentOf && rel.isParentRoleOf(childId, role))
            .map(Relationship::person1Id)
            .findFirst();
    }
}
