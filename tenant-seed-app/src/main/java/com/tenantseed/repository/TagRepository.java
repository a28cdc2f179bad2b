package com.tenantseed.repository;

import com.tenantseed.model.TagModule;
import com.tenantseed.model.TagTarget;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class TagRepository {

    private final JdbcTemplate jdbc;

    public TagRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findTagId(long tenantId, TagModule module, String name) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM tag WHERE tenant_id = ? AND tag_module = ? AND name = ?",
            Long.class, tenantId, module.name(), name
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long saveTag(long tenantId, TagModule module, String name, String color) {
        return JdbcInserts.insert(jdbc,
            "INSERT INTO tag (tenant_id, tag_module, name, color) VALUES (?, ?, ?, ?)",
            tenantId, module.name(), name, color);
    }

    public Optional<Long> findAssignmentId(long tagId, TagTarget target) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM tag_assignment WHERE tag_id = ? AND target_kind = ? AND target_id = ?",
            Long.class, tagId, target.kind().name(), target.id()
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long saveAssignment(long tagId, TagTarget target) {
        return JdbcInserts.insert(jdbc,
            "INSERT INTO tag_assignment (tag_id, target_kind, target_id) VALUES (?, ?, ?)",
            tagId, target.kind().name(), target.id());
    }
}
