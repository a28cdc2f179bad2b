package com.tenantseed.repository;

import com.tenantseed.model.fixture.AnimalTitleFixture;
import com.tenantseed.model.fixture.CompetitionFixture;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Earned titles and competition results for animals.
 */
@Repository
public class AnimalTitleRepository {

    private final JdbcTemplate jdbc;

    public AnimalTitleRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findTitleId(long animalId, long titleDefinitionId) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM animal_title WHERE animal_id = ? AND title_definition_id = ?",
            Long.class, animalId, titleDefinitionId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long saveTitle(long animalId, long titleDefinitionId, AnimalTitleFixture title) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO animal_title (animal_id, title_definition_id, date_earned, event_name,
                                      event_location, handler_name, points_earned, major_wins)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """,
            animalId, titleDefinitionId, title.dateEarned(), title.eventName(), title.eventLocation(),
            title.handlerName(), title.pointsEarned(), title.majorWins()
        );
    }

    public Optional<Long> findCompetitionId(long animalId, String eventName, LocalDate eventDate) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM competition_entry WHERE animal_id = ? AND event_name = ? AND event_date = ?",
            Long.class, animalId, eventName, eventDate
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long saveCompetition(long animalId, CompetitionFixture entry) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO competition_entry (animal_id, event_name, event_date, location, organization,
                competition_type, class_name, placement, placement_label, points_earned, major_win, judge_name)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            animalId, entry.eventName(), entry.eventDate(), entry.location(), entry.organization(),
            entry.competitionType(), entry.className(), entry.placement(), entry.placementLabel(),
            entry.pointsEarned(), entry.majorWin(), entry.judgeName()
        );
    }
}
