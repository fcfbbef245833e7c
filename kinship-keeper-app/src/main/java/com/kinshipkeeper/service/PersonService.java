package com.kinshipkeeper.service;

import com.kinshipkeeper.model.Person;
import com.kinshipkeeper.model.Rejection;
import com.kinshipkeeper.repository.PersonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
public class PersonService {

    private static final Logger log = LoggerFactory.getLogger(PersonService.class);

    private final PersonRepository personRepository;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final Set<String> GENDERS = Set.of("male", "female", "other", "unspecified");

    public PersonService(PersonRepository personRepository) {
        this.personRepository = personRepository;
    }

    public List<Person> listPersons(String ownerId) {
        return personRepository.findByOwner(ownerId);
    }

    /**
     * Find a person owned by {@code ownerId}. Someone else's person looks exactly like a missing one.
     */
    public Optional<Person> getPerson(String ownerId, Long id) {
        return personRepository.findById(id).filter(person -> person.isOwnedBy(ownerId));
    }

    /**
     * Create a new person owned by {@code ownerId}.
     *
     * @param body map containing person fields (firstName, lastName, birthDate, etc.)
     * @return the stored Person
     */
    @Transactional
    public Person createPerson(String ownerId, Map<String, Object> body) {
        PersonFields fields = readFields(body);
        Long id = personRepository.save(fields.firstName, fields.lastName, fields.birthSurname, fields.nickname,
                                        fields.birthDate, fields.deathDate, fields.gender, fields.photoUrl,
                                        ownerId);
        log.info("Created person {} ({} {}) for {}", id, fields.firstName, fields.lastName, ownerId);
        return personRepository.findById(id)
            .orElseThrow(() -> new IllegalStateException("Person " + id + " vanished after insert"));
    }

    /**
     * Replace an existing person's fields.
     *
     * @param id   the person ID to update
     * @param body map containing field values
     * @return the updated Person, or empty if not found for this owner
     */
    @Transactional
    public Optional<Person> updatePerson(String ownerId, Long id, Map<String, Object> body) {
        if (getPerson(ownerId, id).isEmpty()) {
            return Optional.empty();
        }

        PersonFields fields = readFields(body);
        personRepository.update(id, fields.firstName, fields.lastName, fields.birthSurname, fields.nickname,
                                fields.birthDate, fields.deathDate, fields.gender, fields.photoUrl);

        return personRepository.findById(id);
    }

    /**
     * @return false if the person does not exist for this owner
     */
    @Transactional
    public boolean deletePerson(String ownerId, Long id) {
        if (getPerson(ownerId, id).isEmpty()) {
            return false;
        }
        personRepository.delete(id);
        log.info("Deleted person {} for {}", id, ownerId);
        return true;
    }

    /**
     * Parse a date string in ISO "yyyy-MM-dd" format.
     *
     * @return LocalDate or null if input is null/blank
     * @throws RejectionException if the value is not a real calendar date
     */
    public LocalDate parseDate(String field, String dateStr) {
        if (dateStr == null || dateStr.isBlank()) return null;
        try {
            return LocalDate.parse(dateStr.trim(), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new RejectionException(Rejection.INVALID_PARAMETER,
                field + " must be in YYYY-MM-DD format and a valid calendar date");
        }
    }

    private PersonFields readFields(Map<String, Object> body) {
        String firstName = text(body, "firstName");
        String lastName = text(body, "lastName");
        if (firstName == null || firstName.isBlank()) {
            throw new RejectionException(Rejection.INVALID_PARAMETER,
                "firstName is required and must be a non-empty string");
        }
        if (lastName == null || lastName.isBlank()) {
            throw new RejectionException(Rejection.INVALID_PARAMETER,
                "lastName is required and must be a non-empty string");
        }

        LocalDate birthDate = parseDate("birthDate", text(body, "birthDate"));
        LocalDate deathDate = parseDate("deathDate", text(body, "deathDate"));
        if (birthDate != null && deathDate != null && deathDate.isBefore(birthDate)) {
            throw new RejectionException(Rejection.INVALID_PARAMETER, "deathDate cannot be before birthDate");
        }

        String gender = text(body, "gender");
        if (gender != null && gender.isEmpty()) {
            gender = null;
        }
        if (gender != null && !GENDERS.contains(gender)) {
            throw new RejectionException(Rejection.INVALID_PARAMETER,
                "gender must be one of: male, female, other, unspecified (lowercase)");
        }

        return new PersonFields(firstName.trim(), lastName.trim(),
            text(body, "birthSurname"), text(body, "nickname"),
            birthDate, deathDate, gender, text(body, "photoUrl"));
    }

    private static String text(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null) return null;
        if (!(value instanceof String s)) {
            throw new RejectionException(Rejection.INVALID_PARAMETER, key + " must be a string");
        }
        return s;
    }

    private record PersonFields(
        String firstName,
        String lastName,
        String birthSurname,
        String nickname,
        LocalDate birthDate,
        LocalDate deathDate,
        String gender,
        String photoUrl
    ) {}
}
