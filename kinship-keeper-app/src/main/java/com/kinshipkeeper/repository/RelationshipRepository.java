package com.kinshipkeeper.repository;

import com.kinshipkeeper.model.Kinship;
import com.kinshipkeeper.model.KinshipType;
import com.kinshipkeeper.model.ParentRole;
import com.kinshipkeeper.model.Relationship;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public class RelationshipRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Relationship> RELATIONSHIP_MAPPER = (rs, rowNum) -> {
        String rawType = rs.getString("type");
        KinshipType type = KinshipType.fromStoredValue(rawType)
            .orElseThrow(() -> new IllegalStateException("Unknown relationship type: " + rawType));
        String rawRole = rs.getString("parent_role");
        ParentRole role = rawRole != null ? ParentRole.fromLabel(rawRole).orElse(null) : null;
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new Relationship(
            rs.getLong("id"),
            rs.getLong("person1_id"),
            rs.getLong("person2_id"),
            Kinship.fromStored(type, role),
            rs.getString("owner_id"),
            createdAt != null ? createdAt.toLocalDateTime() : null
        );
    };

    public RelationshipRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Relationship> findById(Long id) {
        List<Relationship> results = jdbc.query(
            "SELECT * FROM relationship WHERE id = ?",
            RELATIONSHIP_MAPPER,
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Relationship> findByOwner(String ownerId) {
        return jdbc.query(
            "SELECT * FROM relationship WHERE owner_id = ? ORDER BY id",
            RELATIONSHIP_MAPPER,
            ownerId
        );
    }

    /**
     * Every relationship where the person is either endpoint.
     */
    public List<Relationship> findByPerson(Long personId) {
        return jdbc.query(
            "SELECT * FROM relationship WHERE person1_id = ? OR person2_id = ? ORDER BY id",
            RELATIONSHIP_MAPPER,
            personId, personId
        );
    }

    public Long save(Relationship relationship) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement("""
                INSERT INTO relationship (person1_id, person2_id, type, parent_role, owner_id)
                VALUES (?, ?, ?, ?, ?)
                """, new String[] {"id"});
            ps.setLong(1, relationship.person1Id());
            ps.setLong(2, relationship.person2Id());
            ps.setString(3, relationship.type().storedValue());
            ps.setString(4, roleLabel(relationship));
            ps.setString(5, relationship.ownerId());
            return ps;
        }, keyHolder);
        return keyHolder.getKey().longValue();
    }

    public void update(Long id, Relationship relationship) {
        jdbc.update("""
            UPDATE relationship SET person1_id = ?, person2_id = ?, type = ?, parent_role = ?
            WHERE id = ?
            """,
            relationship.person1Id(), relationship.person2Id(),
            relationship.type().storedValue(), roleLabel(relationship),
            id
        );
    }

    public void delete(Long id) {
        jdbc.update("DELETE FROM relationship WHERE id = ?", id);
    }

    private static String roleLabel(Relationship relationship) {
        ParentRole role = relationship.parentRole();
        return role != null ? role.label() : null;
    }
}
