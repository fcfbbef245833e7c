package com.kinshipkeeper.service;

import com.kinshipkeeper.model.FieldComparison;
import com.kinshipkeeper.model.Kinship;
import com.kinshipkeeper.model.MergePreview;
import com.kinshipkeeper.model.Person;
import com.kinshipkeeper.model.Relationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MergePreviewServiceTest {

    private static final String OWNER = "alice";
    private static final Long TARGET = 1L;
    private static final Long SOURCE = 2L;
    private static final Long MARY = 10L;
    private static final Long SUSAN = 12L;
    private static final Long PETER = 11L;

    private MergePreviewService service;

    private Person target;
    private Person source;

    @BeforeEach
    void setUp() {
        service = new MergePreviewService();
        target = person(TARGET, "John", "Smith", LocalDate.of(1950, 1, 15), "male", null, "Jack", OWNER);
        source = person(SOURCE, "Jon", "Smith", LocalDate.of(1950, 1, 15), "male", "/photos/jon.jpg", null, OWNER);
    }

    private static Person person(Long id, String firstName, String lastName, LocalDate birthDate,
                                 String gender, String photoUrl, String nickname, String ownerId) {
        return new Person(id, firstName, lastName, null, nickname, birthDate, null, gender, photoUrl, ownerId, null);
    }

    private static Relationship rel(Long id, Long person1Id, Long person2Id, Kinship kinship) {
        return new Relationship(id, person1Id, person2Id, kinship, OWNER, null);
    }

    @Nested
    @DisplayName("field merging")
    class Fields {

        @Test
        void targetWinsConflictsAndSourceFillsGaps() {
            MergePreview preview = service.previewMerge(source, target, List.of(), List.of());

            assertThat(preview.canMerge()).isTrue();
            assertThat(preview.validationErrors()).isEmpty();
            assertThat(preview.conflictFields()).containsExactly("firstName");

            Person merged = preview.mergedRecord();
            assertThat(merged.id()).isEqualTo(TARGET);
            assertThat(merged.ownerId()).isEqualTo(OWNER);
            assertThat(merged.firstName()).isEqualTo("John");
            assertThat(merged.nickname()).isEqualTo("Jack");
            assertThat(merged.photoUrl()).isEqualTo("/photos/jon.jpg");
        }

        @Test
        void missingLastNameIsFilledFromTargetWithoutConflict() {
            Person bareJane = person(SOURCE, "Jane", null, null, null, null, null, OWNER);
            Person janeSmith = person(TARGET, "Jane", "Smith", null, null, null, null, OWNER);

            MergePreview preview = service.previewMerge(bareJane, janeSmith, List.of(), List.of());

            assertThat(preview.mergedRecord().lastName()).isEqualTo("Smith");
            assertThat(preview.conflictFields()).doesNotContain("lastName");
            assertThat(preview.perFieldComparison().get("lastName").conflict()).isFalse();
        }

        @Test
        void comparisonKeepsBothSidesForOverride() {
            MergePreview preview = service.previewMerge(source, target, List.of(), List.of());

            assertThat(preview.perFieldComparison().get("firstName"))
                .isEqualTo(new FieldComparison("Jon", "John", "John", true));
            assertThat(preview.perFieldComparison().get("photoUrl"))
                .isEqualTo(new FieldComparison("/photos/jon.jpg", null, "/photos/jon.jpg", false));
            assertThat(preview.perFieldComparison()).containsKeys(
                "firstName", "lastName", "birthDate", "deathDate", "gender", "photoUrl", "birthSurname", "nickname");
        }

        @Test
        void differentBirthDatesConflictAndKeepTarget() {
            Person older = person(SOURCE, "John", "Smith", LocalDate.of(1949, 12, 1), "male", null, null, OWNER);

            MergePreview preview = service.previewMerge(older, target, List.of(), List.of());

            assertThat(preview.conflictFields()).containsExactly("birthDate");
            assertThat(preview.mergedRecord().birthDate()).isEqualTo(LocalDate.of(1950, 1, 15));
            assertThat(preview.canMerge()).isTrue();
        }

        @Test
        void blankValuesCountAsMissing() {
            Person blankPhoto = person(SOURCE, "John", "Smith", null, null, "  ", null, OWNER);
            Person blankTarget = person(TARGET, "John", "Smith", null, null, null, "", OWNER);

            MergePreview preview = service.previewMerge(blankPhoto, blankTarget, List.of(), List.of());

            assertThat(preview.conflictFields()).isEmpty();
            assertThat(preview.mergedRecord().photoUrl()).isNull();
            assertThat(preview.mergedRecord().nickname()).isNull();
        }

        @Test
        void unspecifiedGenderNeverConflicts() {
            Person unspecified = person(SOURCE, "John", "Smith", null, "unspecified", null, null, OWNER);

            MergePreview preview = service.previewMerge(unspecified, target, List.of(), List.of());

            assertThat(preview.canMerge()).isTrue();
            assertThat(preview.conflictFields()).doesNotContain("gender");
            assertThat(preview.mergedRecord().gender()).isEqualTo("male");
            assertThat(preview.perFieldComparison().get("gender").source()).isEqualTo("unspecified");
        }

        @Test
        void unspecifiedSurvivesWhenNothingMoreIsKnown() {
            Person unspecified = person(SOURCE, "John", "Smith", null, "unspecified", null, null, OWNER);
            Person noGender = person(TARGET, "John", "Smith", null, null, null, null, OWNER);

            MergePreview preview = service.previewMerge(unspecified, noGender, List.of(), List.of());

            assertThat(preview.mergedRecord().gender()).isEqualTo("unspecified");
        }
    }

    @Nested
    @DisplayName("blocking errors")
    class Errors {

        @Test
        void personCannotMergeIntoThemselves() {
            MergePreview preview = service.previewMerge(target, target, List.of(), List.of());

            assertThat(preview.canMerge()).isFalse();
            assertThat(preview.validationErrors()).contains("Cannot merge a person into themselves");
        }

        @Test
        void profilePersonCannotBeMergedAway() {
            MergePreview preview = service.previewMerge(source, target, SOURCE, List.of(), List.of());

            assertThat(preview.canMerge()).isFalse();
            assertThat(preview.validationErrors()).containsExactly("Cannot merge your profile person into another person");
        }

        @Test
        void nothingMergesIntoProfilePerson() {
            MergePreview preview = service.previewMerge(source, target, TARGET, List.of(), List.of());

            assertThat(preview.canMerge()).isFalse();
            assertThat(preview.validationErrors()).containsExactly("Cannot merge into your profile person");
        }

        @Test
        void unrelatedProfilePersonDoesNotBlock() {
            MergePreview preview = service.previewMerge(source, target, PETER, List.of(), List.of());

            assertThat(preview.canMerge()).isTrue();
        }

        @Test
        void ownersMustMatch() {
            Person foreign = person(SOURCE, "John", "Smith", null, "male", null, null, "bob");

            MergePreview preview = service.previewMerge(foreign, target, List.of(), List.of());

            assertThat(preview.canMerge()).isFalse();
            assertThat(preview.validationErrors()).contains("Cannot merge records across different users");
        }

        @Test
        void contradictoryGendersBlockMerge() {
            Person female = person(SOURCE, "Joan", "Smith", null, "female", null, null, OWNER);

            MergePreview preview = service.previewMerge(female, target, List.of(), List.of());

            assertThat(preview.canMerge()).isFalse();
            assertThat(preview.validationErrors()).containsExactly("Gender mismatch: Cannot merge female into male");
            assertThat(preview.conflictFields()).contains("gender");
        }
    }

    @Nested
    @DisplayName("relationships")
    class Relationships {

        @Test
        void sourceRelationshipsMoveToTarget() {
            List<Relationship> sourceRels = List.of(
                rel(100L, MARY, SOURCE, Kinship.mother()),
                rel(101L, SOURCE, PETER, Kinship.spouse()));

            MergePreview preview = service.previewMerge(source, target, sourceRels, List.of());

            assertThat(preview.relationshipsToTransfer()).containsExactly(
                rel(100L, MARY, TARGET, Kinship.mother()),
                rel(101L, TARGET, PETER, Kinship.spouse()));
            assertThat(preview.relationshipsToTransfer())
                .allSatisfy(r -> assertThat(r.involves(SOURCE)).isFalse());
            assertThat(preview.validationWarnings().get(0))
                .isEqualTo("2 relationship(s) will be moved from Jon Smith to John Smith");
        }

        @Test
        void transferThatDuplicatesTargetIsReported() {
            Relationship targetMother = rel(200L, MARY, TARGET, Kinship.mother());

            MergePreview preview = service.previewMerge(source, target,
                List.of(rel(100L, MARY, SOURCE, Kinship.mother())), List.of(targetMother));

            assertThat(preview.existingRelationshipsOnTarget()).containsExactly(targetMother);
            assertThat(preview.validationWarnings()).anyMatch(w -> w.contains("relationship 100 would duplicate it"));
            assertThat(preview.conflictFields()).doesNotContain("mother");
        }

        @Test
        void reversedSpouseOnTargetIsACollision() {
            Relationship targetSpouse = rel(201L, PETER, TARGET, Kinship.spouse());

            MergePreview preview = service.previewMerge(source, target,
                List.of(rel(101L, SOURCE, PETER, Kinship.spouse())), List.of(targetSpouse));

            assertThat(preview.existingRelationshipsOnTarget()).containsExactly(targetSpouse);
        }

        @Test
        void differentMothersAreFlagged() {
            MergePreview preview = service.previewMerge(source, target,
                List.of(rel(100L, MARY, SOURCE, Kinship.mother())),
                List.of(rel(200L, SUSAN, TARGET, Kinship.mother())));

            assertThat(preview.canMerge()).isTrue();
            assertThat(preview.conflictFields()).contains("mother");
            assertThat(preview.validationWarnings())
                .contains("Both people have different mothers - resolve before merging");
        }

        @Test
        void secondMotherForTargetIsACollision() {
            Relationship targetMother = rel(200L, SUSAN, TARGET, Kinship.mother());

            MergePreview preview = service.previewMerge(source, target,
                List.of(rel(100L, MARY, SOURCE, Kinship.mother())), List.of(targetMother));

            assertThat(preview.existingRelationshipsOnTarget()).containsExactly(targetMother);
            assertThat(preview.validationWarnings())
                .contains("Relationship 100 would give person 1 a second mother alongside relationship 200");
        }

        @Test
        void motherAndFatherDoNotCollide() {
            Relationship targetFather = rel(201L, PETER, TARGET, Kinship.father());

            MergePreview preview = service.previewMerge(source, target,
                List.of(rel(100L, MARY, SOURCE, Kinship.mother())), List.of(targetFather));

            assertThat(preview.existingRelationshipsOnTarget()).isEmpty();
        }

        @Test
        void directLinkBetweenSourceAndTargetIsDropped() {
            Relationship link = rel(102L, TARGET, SOURCE, Kinship.spouse());

            MergePreview preview = service.previewMerge(source, target, List.of(link), List.of(link));

            assertThat(preview.relationshipsToTransfer()).isEmpty();
            assertThat(preview.validationWarnings()).singleElement()
                .satisfies(w -> assertThat(w).contains("relationship 102"));
        }

        @Test
        void noRelationshipsMeansNoTransferWarning() {
            MergePreview preview = service.previewMerge(source, target, List.of(), List.of());

            assertThat(preview.validationWarnings()).isEmpty();
            assertThat(preview.relationshipsToTransfer()).isEmpty();
        }
    }
}
