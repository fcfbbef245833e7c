package com.kinshipkeeper.service;

import com.kinshipkeeper.config.DuplicateDetectionConfig;
import com.kinshipkeeper.model.DuplicateCandidate;
import com.kinshipkeeper.model.Kinship;
import com.kinshipkeeper.model.Person;
import com.kinshipkeeper.model.Rejection;
import com.kinshipkeeper.model.Relationship;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Finds person records that probably describe the same individual.
 *
 * <p>Every pair in the set is scored (O(n²); person sets are owner-scoped and stay small).
 * Each signal scores 0-100 and the weighted sum is the pair's confidence:
 * <pre>
 *   name       Levenshtein similarity of "first last", case-insensitive
 *   birthDate  100 exact, 75 same month, 50 same year
 *   parents    100 when both share a recorded mother or father
 * </pre>
 * Results are ordered by confidence, highest first; equal scores keep discovery order.
 */
@Service
public class DuplicateDetectionService {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetectionService.class);

    public static final String FIELD_NAME = "name";
    public static final String FIELD_BIRTH_DATE = "birthDate";
    public static final String FIELD_PARENTS = "parents";

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private final DuplicateDetectionConfig config;

    public DuplicateDetectionService(DuplicateDetectionConfig config) {
        this.config = config;
    }

    public int defaultThreshold() {
        return config.getDefaultThreshold();
    }

    public List<DuplicateCandidate> findAllDuplicates(List<Person> persons, int threshold, Integer limit) {
        return findAllDuplicates(persons, List.of(), threshold, limit);
    }

    /**
     * All candidate pairs within {@code persons} at or above {@code threshold}.
     *
     * @param relationships used only for the shared-parent signal; may be empty
     * @param limit         maximum number of pairs, or null for all
     * @throws RejectionException with {@link Rejection#INVALID_PARAMETER} before any comparison
     */
    public List<DuplicateCandidate> findAllDuplicates(List<Person> persons, List<Relationship> relationships,
                                                      int threshold, Integer limit) {
        checkParameters(threshold, limit);
        Map<Long, Set<Long>> parents = parentsByChild(relationships);

        List<DuplicateCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < persons.size(); i++) {
            for (int j = i + 1; j < persons.size(); j++) {
                DuplicateCandidate candidate = score(persons.get(i), persons.get(j), parents);
                if (candidate.confidence() >= threshold) {
                    candidates.add(candidate);
                }
            }
        }

        log.debug("Duplicate scan over {} people found {} pairs at threshold {}",
            persons.size(), candidates.size(), threshold);
        return sortAndLimit(candidates, limit);
    }

    public List<DuplicateCandidate> findDuplicatesForPerson(Person target, List<Person> persons,
                                                            int threshold, Integer limit) {
        return findDuplicatesForPerson(target, persons, List.of(), threshold, limit);
    }

    /**
     * Candidate pairs that contain {@code target}. The target is always {@code personA}.
     */
    public List<DuplicateCandidate> findDuplicatesForPerson(Person target, List<Person> persons,
                                                            List<Relationship> relationships,
                                                            int threshold, Integer limit) {
        checkParameters(threshold, limit);
        Map<Long, Set<Long>> parents = parentsByChild(relationships);

        List<DuplicateCandidate> candidates = new ArrayList<>();
        for (Person other : persons) {
            if (Objects.equals(other.id(), target.id())) {
                continue;
            }
            DuplicateCandidate candidate = score(target, other, parents);
            if (candidate.confidence() >= threshold) {
                candidates.add(candidate);
            }
        }
        return sortAndLimit(candidates, limit);
    }

    /**
     * Score a single pair. Symmetric: swapping the arguments gives the same confidence.
     */
    public DuplicateCandidate score(Person a, Person b, Map<Long, Set<Long>> parentsByChild) {
        List<String> matchingFields = new ArrayList<>();

        int nameScore = compareNames(fullName(a), fullName(b));
        if (nameScore > config.getFieldMatchCutoff()) {
            matchingFields.add(FIELD_NAME);
        }

        int dateScore = compareDates(a.birthDate(), b.birthDate());
        if (dateScore > config.getFieldMatchCutoff()) {
            matchingFields.add(FIELD_BIRTH_DATE);
        }

        int parentScore = compareParents(
            parentsByChild.getOrDefault(a.id(), Set.of()),
            parentsByChild.getOrDefault(b.id(), Set.of()));
        if (parentScore > 0) {
            matchingFields.add(FIELD_PARENTS);
        }

        double total = nameScore * config.getNameWeight()
            + dateScore * config.getDateWeight()
            + parentScore * config.getParentWeight();
        int confidence = (int) Math.max(0, Math.min(100, Math.round(total)));

        return new DuplicateCandidate(a, b, confidence, List.copyOf(matchingFields));
    }

    /**
     * Name similarity 0-100. Exact (case-insensitive) match is 100; otherwise
     * {@code (1 - distance / longerLength) * 100}, so small typos stay high.
     */
    int compareNames(String name1, String name2) {
        if (name1 == null || name2 == null) {
            return 0;
        }
        String n1 = name1.toLowerCase().trim();
        String n2 = name2.toLowerCase().trim();
        if (n1.isEmpty() || n2.isEmpty()) {
            return 0;
        }
        if (n1.equals(n2)) {
            return 100;
        }
        int distance = LEVENSHTEIN.apply(n1, n2);
        int maxLength = Math.max(n1.length(), n2.length());
        double similarity = (1 - (double) distance / maxLength) * 100;
        // floor keeps any near miss strictly below an exact match
        return (int) Math.max(0, Math.min(99, Math.floor(similarity)));
    }

    int compareDates(LocalDate date1, LocalDate date2) {
        if (date1 == null || date2 == null) {
            return 0;
        }
        if (date1.equals(date2)) {
            return 100;
        }
        if (date1.getYear() != date2.getYear()) {
            return 0;
        }
        return date1.getMonth() == date2.getMonth() ? 75 : 50;
    }

    int compareParents(Set<Long> parents1, Set<Long> parents2) {
        if (parents1.isEmpty() || parents2.isEmpty()) {
            return 0;
        }
        for (Long parent : parents1) {
            if (parents2.contains(parent)) {
                return 100;
            }
        }
        return 0;
    }

    private static String fullName(Person person) {
        String first = person.firstName() != null ? person.firstName() : "";
        String last = person.lastName() != null ? person.lastName() : "";
        return (first + " " + last).trim();
    }

    static Map<Long, Set<Long>> parentsByChild(List<Relationship> relationships) {
        Map<Long, Set<Long>> parents = new HashMap<>();
        for (Relationship rel : relationships) {
            if (rel.kinship() instanceof Kinship.ParentOf) {
                parents.computeIfAbsent(rel.person2Id(), id -> new HashSet<>()).add(rel.person1Id());
            }
        }
        return parents;
    }

    private void checkParameters(int threshold, Integer limit) {
        if (threshold < 0 || threshold > 100) {
            throw new RejectionException(Rejection.INVALID_PARAMETER,
                "Invalid threshold parameter (must be 0-100)");
        }
        if (limit != null && limit < 1) {
            throw new RejectionException(Rejection.INVALID_PARAMETER,
                "Invalid limit parameter (must be positive integer)");
        }
    }

    private static List<DuplicateCandidate> sortAndLimit(List<DuplicateCandidate> candidates, Integer limit) {
        // List.sort is stable, so ties stay in discovery order
        candidates.sort(Comparator.comparingInt(DuplicateCandidate::confidence).reversed());
        if (limit != null && candidates.size() > limit) {
            return List.copyOf(candidates.subList(0, limit));
        }
        return List.copyOf(candidates);
    }
}
