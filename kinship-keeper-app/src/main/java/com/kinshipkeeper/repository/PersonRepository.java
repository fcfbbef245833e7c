package com.kinshipkeeper.repository;

import com.kinshipkeeper.model.Person;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public class PersonRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Person> PERSON_MAPPER = (rs, rowNum) -> {
        Date birthDate = rs.getDate("birth_date");
        Date deathDate = rs.getDate("death_date");
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new Person(
            rs.getLong("id"),
            rs.getString("first_name"),
            rs.getString("last_name"),
            rs.getString("birth_surname"),
            rs.getString("nickname"),
            birthDate != null ? birthDate.toLocalDate() : null,
            deathDate != null ? deathDate.toLocalDate() : null,
            rs.getString("gender"),
            rs.getString("photo_url"),
            rs.getString("owner_id"),
            createdAt != null ? createdAt.toLocalDateTime() : null
        );
    };

    public PersonRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Person> findById(Long id) {
        List<Person> results = jdbc.query(
            "SELECT * FROM person WHERE id = ?",
            PERSON_MAPPER,
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Person> findByOwner(String ownerId) {
        return jdbc.query(
            "SELECT * FROM person WHERE owner_id = ? ORDER BY id",
            PERSON_MAPPER,
            ownerId
        );
    }

    public Long save(String firstName, String lastName, String birthSurname, String nickname,
                     LocalDate birthDate, LocalDate deathDate, String gender, String photoUrl,
                     String ownerId) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement("""
                INSERT INTO person (first_name, last_name, birth_surname, nickname,
                                    birth_date, death_date, gender, photo_url, owner_id)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """, new String[] {"id"});
            ps.setString(1, firstName);
            ps.setString(2, lastName);
            ps.setString(3, birthSurname);
            ps.setString(4, nickname);
            ps.setObject(5, birthDate != null ? Date.valueOf(birthDate) : null, Types.DATE);
            ps.setObject(6, deathDate != null ? Date.valueOf(deathDate) : null, Types.DATE);
            ps.setString(7, gender);
            ps.setString(8, photoUrl);
            ps.setString(9, ownerId);
            return ps;
        }, keyHolder);
        return keyHolder.getKey().longValue();
    }

    public void update(Long id, String firstName, String lastName, String birthSurname, String nickname,
                       LocalDate birthDate, LocalDate deathDate, String gender, String photoUrl) {
        jdbc.update("""
            UPDATE person SET
                first_name = ?, last_name = ?, birth_surname = ?, nickname = ?,
                birth_date = ?, death_date = ?, gender = ?, photo_url = ?
            WHERE id = ?
            """,
            firstName, lastName, birthSurname, nickname,
            birthDate != null ? Date.valueOf(birthDate) : null,
            deathDate != null ? Date.valueOf(deathDate) : null,
            gender, photoUrl, id
        );
    }

    public void delete(Long id) {
        // relationship rows go with it (ON DELETE CASCADE)
        jdbc.update("DELETE FROM person WHERE id = ?", id);
    }
}
