package com.tenantseed.repository;

import com.tenantseed.model.fixture.TitleDefinitionFixture;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class TitleDefinitionRepository {

    private final JdbcTemplate jdbc;

    public TitleDefinitionRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findId(String species, String abbreviation, String organization) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM title_definition WHERE species = ? AND abbreviation = ? AND organization = ?",
            Long.class, species, abbreviation, organization
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<Long> findIdByAbbreviation(String species, String abbreviation) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM title_definition WHERE species = ? AND abbreviation = ? ORDER BY id",
            Long.class, species, abbreviation
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(TitleDefinitionFixture definition) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO title_definition (species, abbreviation, full_name, category, organization,
                                          is_prefix, points_required)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            definition.species(), definition.abbreviation(), definition.fullName(), definition.category(),
            definition.organization(), definition.prefix(), definition.pointsRequired()
        );
    }

    /**
     * @return true if the parent link changed
     */
    public boolean updateParent(long id, long parentId) {
        return jdbc.update("""
            UPDATE title_definition SET parent_title_id = ?
            WHERE id = ? AND (parent_title_id IS NULL OR parent_title_id <> ?)
            """,
            parentId, id, parentId
        ) > 0;
    }
}
