package com.kinshipkeeper.service;

import com.kinshipkeeper.model.Person;
import com.kinshipkeeper.model.Rejection;
import com.kinshipkeeper.repository.PersonRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = "/smith-family.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
@Transactional
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class PersonServiceTest {

    @Autowired
    private PersonService personService;

    @SpyBean
    private PersonRepository personRepository;

    // Test data IDs from smith-family.sql
    private static final Long JOHN = 1000L;
    private static final Long MARY = 1002L;
    private static final Long BOBS_JOHN = 2000L;

    private static final String ALICE = "alice";
    private static final String BOB = "bob";

    @Nested
    @DisplayName("parseDate")
    class ParseDate {

        @Test
        void parsesIsoDate() {
            assertThat(personService.parseDate("birthDate", "1975-09-30")).isEqualTo(LocalDate.of(1975, 9, 30));
        }

        @Test
        void returnsNullForBlankInput() {
            assertThat(personService.parseDate("birthDate", null)).isNull();
            assertThat(personService.parseDate("birthDate", "   ")).isNull();
        }

        @Test
        void rejectsOtherFormats() {
            assertThatThrownBy(() -> personService.parseDate("birthDate", "30 09 1975"))
                .isInstanceOf(RejectionException.class)
                .hasMessageStartingWith("birthDate must be in YYYY-MM-DD format");
        }

        @Test
        void rejectsImpossibleCalendarDate() {
            assertThatThrownBy(() -> personService.parseDate("deathDate", "2001-02-30"))
                .isInstanceOf(RejectionException.class);
        }
    }

    @Nested
    @DisplayName("getPerson")
    class GetPerson {

        @Test
        void findsOwnPerson() {
            Optional<Person> result = personService.getPerson(ALICE, MARY);

            assertThat(result).isPresent();
            assertThat(result.get().birthSurname()).isEqualTo("Jones");
        }

        @Test
        void otherOwnersPersonLooksMissing() {
            assertThat(personService.getPerson(ALICE, BOBS_JOHN)).isEmpty();
            assertThat(personService.getPerson(BOB, JOHN)).isEmpty();
        }

        @Test
        void listIsScopedToOwner() {
            assertThat(personService.listPersons(BOB))
                .extracting(Person::id)
                .containsExactlyInAnyOrder(2000L, 2001L);
        }
    }

    @Nested
    @DisplayName("createPerson")
    class CreatePerson {

        @Test
        void storesFieldsForOwner() {
            Map<String, Object> body = new HashMap<>();
            body.put("firstName", " William ");
            body.put("lastName", "Smith");
            body.put("nickname", "Bill");
            body.put("gender", "male");
            body.put("birthDate", "1990-03-15");

            Person created = personService.createPerson(ALICE, body);

            assertThat(created.id()).isNotNull();
            assertThat(created.firstName()).isEqualTo("William");
            assertThat(created.ownerId()).isEqualTo(ALICE);

            verify(personRepository).save(
                eq("William"), eq("Smith"), eq(null), eq("Bill"),
                eq(LocalDate.of(1990, 3, 15)), eq(null), eq("male"), eq(null),
                eq(ALICE)
            );
        }

        @Test
        void requiresNames() {
            Map<String, Object> body = new HashMap<>();
            body.put("firstName", "William");

            assertThatThrownBy(() -> personService.createPerson(ALICE, body))
                .isInstanceOf(RejectionException.class)
                .hasMessageContaining("lastName is required");

            verify(personRepository, never()).save(any(), any(), any(), any(), any(), any(), any(), any(), any());
        }

        @Test
        void rejectsDeathBeforeBirth() {
            Map<String, Object> body = new HashMap<>();
            body.put("firstName", "William");
            body.put("lastName", "Smith");
            body.put("birthDate", "1990-03-15");
            body.put("deathDate", "1980-01-01");

            assertThatThrownBy(() -> personService.createPerson(ALICE, body))
                .hasMessage("deathDate cannot be before birthDate");
        }

        @Test
        void rejectsUnknownGender() {
            Map<String, Object> body = new HashMap<>();
            body.put("firstName", "William");
            body.put("lastName", "Smith");
            body.put("gender", "M");

            assertThatThrownBy(() -> personService.createPerson(ALICE, body))
                .isInstanceOf(RejectionException.class)
                .extracting(e -> ((RejectionException) e).getRejection())
                .isEqualTo(Rejection.INVALID_PARAMETER);
        }

        @Test
        void rejectsNonStringField() {
            Map<String, Object> body = new HashMap<>();
            body.put("firstName", 42);
            body.put("lastName", "Smith");

            assertThatThrownBy(() -> personService.createPerson(ALICE, body))
                .hasMessage("firstName must be a string");
        }
    }

    @Nested
    @DisplayName("updatePerson")
    class UpdatePerson {

        @Test
        void replacesFields() {
            Map<String, Object> updates = new HashMap<>();
            updates.put("firstName", "Johnny");
            updates.put("lastName", "Smith");
            updates.put("birthDate", "1950-01-15");

            Optional<Person> result = personService.updatePerson(ALICE, JOHN, updates);

            assertThat(result).isPresent();
            assertThat(result.get().firstName()).isEqualTo("Johnny");
            assertThat(result.get().nickname()).isNull();
            verify(personRepository).update(
                eq(JOHN), eq("Johnny"), eq("Smith"), any(), any(),
                eq(LocalDate.of(1950, 1, 15)), any(), any(), any()
            );
        }

        @Test
        void cannotUpdateAnotherOwnersPerson() {
            Map<String, Object> updates = new HashMap<>();
            updates.put("firstName", "Hijacked");
            updates.put("lastName", "Smith");

            assertThat(personService.updatePerson(ALICE, BOBS_JOHN, updates)).isEmpty();
            verify(personRepository, never()).update(any(), any(), any(), any(), any(), any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("deletePerson")
    class DeletePerson {

        @Test
        void deletesOwnPerson() {
            assertThat(personService.deletePerson(ALICE, JOHN)).isTrue();
            assertThat(personService.getPerson(ALICE, JOHN)).isEmpty();
        }

        @Test
        void returnsFalseForOtherOwner() {
            assertThat(personService.deletePerson(BOB, JOHN)).isFalse();
            assertThat(personService.getPerson(ALICE, JOHN)).isPresent();
        }
    }
}
