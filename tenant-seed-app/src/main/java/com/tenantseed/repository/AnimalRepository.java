package com.tenantseed.repository;

import com.tenantseed.model.PrivacySettings;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Animals plus their one-to-one genetics and privacy rows.
 */
@Repository
public class AnimalRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<PrivacySettings> PRIVACY_MAPPER = (rs, rowNum) -> new PrivacySettings(
        rs.getBoolean("show_name"),
        rs.getBoolean("show_photo"),
        rs.getBoolean("show_full_dob"),
        rs.getBoolean("show_registry_full"),
        rs.getBoolean("enable_health_sharing"),
        rs.getBoolean("enable_genetics_sharing"),
        rs.getBoolean("show_breeder"),
        rs.getBoolean("allow_cross_tenant_matching")
    );

    public AnimalRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findId(long tenantId, String name, String species) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM animal WHERE tenant_id = ? AND name = ? AND species = ?",
            Long.class, tenantId, name, species
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<PrivacySettings> findPrivacy(long animalId) {
        List<PrivacySettings> results = jdbc.query(
            "SELECT * FROM animal_privacy_settings WHERE animal_id = ?", PRIVACY_MAPPER, animalId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long tenantId, String name, String species, String sex, String breed,
                     LocalDate birthDate, String notes, Long sireId, Long damId) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO animal (tenant_id, name, species, sex, breed, birth_date, notes, status, sire_id, dam_id)
            VALUES (?, ?, ?, ?, ?, ?, ?, 'ACTIVE', ?, ?)
            """,
            tenantId, name, species, sex, breed, birthDate, notes, sireId, damId
        );
    }

    public long saveGenetics(long animalId, String testProvider, LocalDate testDate, String coatColorJson,
                             String coatTypeJson, String physicalTraitsJson, String eyeColorJson,
                             String healthJson) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO animal_genetics (animal_id, test_provider, test_date, coat_color_json, coat_type_json,
                                         physical_traits_json, eye_color_json, health_json)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """,
            animalId, testProvider, testDate, coatColorJson, coatTypeJson, physicalTraitsJson,
            eyeColorJson, healthJson
        );
    }

    public long savePrivacy(long animalId, PrivacySettings privacy) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO animal_privacy_settings (animal_id, show_name, show_photo, show_full_dob,
                show_registry_full, enable_health_sharing, enable_genetics_sharing, show_breeder,
                allow_cross_tenant_matching)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            animalId, privacy.showName(), privacy.showPhoto(), privacy.showFullDob(),
            privacy.showRegistryFull(), privacy.enableHealthSharing(), privacy.enableGeneticsSharing(),
            privacy.showBreeder(), privacy.allowCrossTenantMatching()
        );
    }
}
