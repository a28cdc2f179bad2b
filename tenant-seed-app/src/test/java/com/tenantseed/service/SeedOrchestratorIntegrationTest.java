package com.tenantseed.service;

import com.tenantseed.model.DraftChannel;
import com.tenantseed.model.EntityKind;
import com.tenantseed.model.LineageParentType;
import com.tenantseed.model.LinkMethod;
import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.SeedReport;
import com.tenantseed.model.TenantFailure;
import com.tenantseed.model.fixture.AnimalFixture;
import com.tenantseed.model.fixture.CrossTenantLinkFixture;
import com.tenantseed.model.fixture.DraftFixture;
import com.tenantseed.model.fixture.SeedCatalogue;
import com.tenantseed.model.fixture.TenantFixture;
import com.tenantseed.model.fixture.TitleDefinitionFixture;
import com.tenantseed.repository.TitleDefinitionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = "/clean-schema.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
class SeedOrchestratorIntegrationTest {

    private static final String TABLE_COUNTS = """
        SELECT (SELECT COUNT(*) FROM tenant) + (SELECT COUNT(*) FROM app_user)
             + (SELECT COUNT(*) FROM tenant_membership) + (SELECT COUNT(*) FROM party)
             + (SELECT COUNT(*) FROM organization) + (SELECT COUNT(*) FROM contact)
             + (SELECT COUNT(*) FROM animal) + (SELECT COUNT(*) FROM animal_genetics)
             + (SELECT COUNT(*) FROM animal_privacy_settings) + (SELECT COUNT(*) FROM title_definition)
             + (SELECT COUNT(*) FROM animal_title) + (SELECT COUNT(*) FROM competition_entry)
             + (SELECT COUNT(*) FROM breeding_plan) + (SELECT COUNT(*) FROM marketplace_listing)
             + (SELECT COUNT(*) FROM tag) + (SELECT COUNT(*) FROM tag_assignment)
             + (SELECT COUNT(*) FROM portal_access) + (SELECT COUNT(*) FROM waitlist_entry)
             + (SELECT COUNT(*) FROM invoice) + (SELECT COUNT(*) FROM party_email)
             + (SELECT COUNT(*) FROM party_activity) + (SELECT COUNT(*) FROM message_thread)
             + (SELECT COUNT(*) FROM message_participant) + (SELECT COUNT(*) FROM thread_message)
             + (SELECT COUNT(*) FROM draft) + (SELECT COUNT(*) FROM offspring_group)
             + (SELECT COUNT(*) FROM offspring) + (SELECT COUNT(*) FROM cross_tenant_animal_link)
        """;

    @Autowired
    private SeedOrchestrator orchestrator;

    @Autowired
    private FixtureCatalogueLoader loader;

    @Autowired
    private JdbcTemplate jdbc;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private TitleDefinitionRepository titles;

    private SeedCatalogue catalogue;
    private List<TitleDefinitionFixture> titleDefinitions;

    @BeforeEach
    void loadFixtures() {
        catalogue = loader.loadCatalogue(new ClassPathResource("fixtures/catalogue-test.json"));
        titleDefinitions = loader.loadTitleDefinitions(new ClassPathResource("fixtures/title-definitions-test.json"));
    }

    private SeedReport seed(SeedCatalogue fixtures) {
        return orchestrator.run(SeedEnvironment.DEV, fixtures, titleDefinitions);
    }

    private long tenantId(String slug) {
        return jdbc.queryForObject("SELECT id FROM tenant WHERE slug = ?", Long.class, slug);
    }

    private String setting(String slug, String namespace) {
        return jdbc.queryForObject(
            "SELECT settings_json FROM tenant_setting WHERE tenant_id = ? AND namespace = ?",
            String.class, tenantId(slug), namespace);
    }

    @Nested
    @DisplayName("re-running")
    class ReRunning {

        @Test
        void secondRunCreatesNothing() {
            SeedReport first = seed(catalogue);
            Long rowsAfterFirst = jdbc.queryForObject(TABLE_COUNTS, Long.class);

            SeedReport second = seed(catalogue);

            assertThat(first.succeeded()).isTrue();
            assertThat(first.tally().totalCreated()).isPositive();
            assertThat(second.succeeded()).isTrue();
            assertThat(second.tally().totalCreated()).isZero();
            assertThat(second.tally().existing(EntityKind.ANIMAL)).isEqualTo(6);
            assertThat(jdbc.queryForObject(TABLE_COUNTS, Long.class)).isEqualTo(rowsAfterFirst);
        }

        @Test
        void settingsAreRewrittenNotDuplicated() {
            seed(catalogue);
            SeedReport second = seed(catalogue);

            assertThat(second.tally().existing(EntityKind.TENANT_SETTING)).isEqualTo(2);
            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM tenant_setting", Integer.class)).isEqualTo(2);
            assertThat(setting("dev-shire", "theme")).contains("\"primaryColor\":\"#3A5F0B\"");
            assertThat(setting("dev-shire", "lineage-visibility")).contains("allowCrossTenantMatching");
        }
    }

    @Nested
    @DisplayName("environment qualification")
    class Qualification {

        @Test
        void qualifiesSlugNamesAndEmails() {
            seed(catalogue);

            assertThat(jdbc.queryForObject("SELECT name FROM tenant WHERE slug = 'dev-shire'", String.class))
                .isEqualTo("[DEV] The Shire");
            assertThat(jdbc.queryForList("SELECT email FROM contact ORDER BY id", String.class))
                .containsExactly("merry.dev@buckland.local", "pippin.dev@tookland.local", "rosie.dev@bywater.local");
        }

        @Test
        void ownerGetsHashedPasswordAndOwnerMembership() {
            seed(catalogue);

            Map<String, Object> owner = jdbc.queryForMap(
                "SELECT id, password_hash, default_tenant_id FROM app_user WHERE email = 'frodo.dev@shire.local'");
            long ownerId = ((Number) owner.get("id")).longValue();
            assertThat(passwordEncoder.matches("Shire123!", (String) owner.get("password_hash"))).isTrue();
            assertThat(((Number) owner.get("default_tenant_id")).longValue()).isEqualTo(tenantId("dev-shire"));
            assertThat(jdbc.queryForObject(
                "SELECT role FROM tenant_membership WHERE user_id = ?", String.class, ownerId))
                .isEqualTo("OWNER");
        }

        @Test
        void missingDefaultTenantIsRestored() {
            seed(catalogue);
            jdbc.update("UPDATE app_user SET default_tenant_id = NULL WHERE email = 'frodo.dev@shire.local'");

            SeedReport second = seed(catalogue);

            assertThat(second.tally().totalCreated()).isZero();
            assertThat(jdbc.queryForObject(
                "SELECT default_tenant_id FROM app_user WHERE email = 'frodo.dev@shire.local'", Long.class))
                .isEqualTo(tenantId("dev-shire"));
        }
    }

    @Nested
    @DisplayName("lineage")
    class Lineage {

        @Test
        void parentsPointToTheRightAnimals() {
            seed(catalogue);

            Map<String, String[]> parents = parentNames(tenantId("dev-shire"));
            assertThat(parents.get("Maggot Pup")).containsExactly("Grip Junior", "Fang Lass");
            assertThat(parents.get("Grip Junior")).containsExactly("Grip", "Fang");
            assertThat(parents.get("Fang Lass")).containsExactly("Wolf", "Fang");
            assertThat(parents.get("Grip")).containsExactly(null, null);
        }

        @Test
        void creationOrderOfTheListDoesNotMatter() {
            TenantFixture shire = catalogue.tenants().get(0);
            List<AnimalFixture> reversed = new ArrayList<>(shire.animals());
            Collections.reverse(reversed);
            SeedCatalogue both = new SeedCatalogue(catalogue.marketplaceUsers(),
                List.of(shire, withSlugAndAnimals(shire, "shire-reversed", reversed)), null);

            SeedReport report = seed(both);

            assertThat(report.succeeded()).isTrue();
            Map<String, String[]> listed = parentNames(tenantId("dev-shire"));
            Map<String, String[]> flipped = parentNames(tenantId("dev-shire-reversed"));
            assertThat(flipped).hasSameSizeAs(listed);
            listed.forEach((name, pair) -> assertThat(flipped.get(name)).containsExactly(pair));
        }

        private Map<String, String[]> parentNames(long tenantId) {
            Map<String, String[]> result = new HashMap<>();
            jdbc.query("""
                SELECT a.name, s.name AS sire, d.name AS dam
                FROM animal a
                LEFT JOIN animal s ON s.id = a.sire_id
                LEFT JOIN animal d ON d.id = a.dam_id
                WHERE a.tenant_id = ?
                """, rs -> {
                result.put(strip(rs.getString("name")),
                    new String[]{strip(rs.getString("sire")), strip(rs.getString("dam"))});
            }, tenantId);
            return result;
        }

        private String strip(String qualified) {
            return qualified == null ? null : qualified.substring("[DEV] ".length());
        }
    }

    @Nested
    @DisplayName("animal records")
    class AnimalRecords {

        @Test
        void privacyOverrideWinsOverTenantPolicy() {
            seed(catalogue);

            Map<String, Object> privacy = jdbc.queryForMap("""
                SELECT p.* FROM animal_privacy_settings p
                JOIN animal a ON a.id = p.animal_id
                WHERE a.name = '[DEV] Grip'
                """);
            assertThat(privacy.get("enable_genetics_sharing")).isEqualTo(false);
            assertThat(privacy.get("enable_health_sharing")).isEqualTo(true);
            assertThat(privacy.get("show_name")).isEqualTo(true);
        }

        @Test
        void missingTitleDefinitionIsSkipped() {
            SeedReport report = seed(catalogue);

            assertThat(report.succeeded()).isTrue();
            assertThat(jdbc.queryForList("""
                SELECT d.abbreviation FROM animal_title t
                JOIN title_definition d ON d.id = t.title_definition_id
                JOIN animal a ON a.id = t.animal_id
                WHERE a.name = '[DEV] Grip'
                """, String.class)).containsExactly("CH");
            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM competition_entry", Integer.class)).isEqualTo(1);
        }

        @Test
        void geneticsTestDateFollowsBirthDate() {
            seed(catalogue);

            Map<String, Object> row = jdbc.queryForMap("""
                SELECT a.birth_date, g.test_provider, g.test_date FROM animal a
                JOIN animal_genetics g ON g.animal_id = a.id
                WHERE a.name = '[DEV] Grip'
                """);
            assertThat(row.get("test_provider")).isEqualTo("Embark");
            assertThat(row.get("birth_date").toString()).isEqualTo("2015-06-15");
            assertThat(row.get("test_date").toString()).isEqualTo("2015-12-12");
        }

        @Test
        void prerequisiteTitlesAreLinked() {
            seed(catalogue);

            long gch = titles.findIdByAbbreviation("DOG", "GCH").orElseThrow();
            long ch = titles.findIdByAbbreviation("DOG", "CH").orElseThrow();
            assertThat(parentTitleId(gch)).isEqualTo(ch);
            assertThat(parentTitleId(ch)).isNull();
        }

        @Test
        void sharedAbbreviationResolvesToTheFirstOrganization() {
            TitleDefinitionFixture ukc = new TitleDefinitionFixture("DOG", "CH", "Champion", "CONFORMATION", "UKC",
                true, 100, null);
            List<TitleDefinitionFixture> withUkc = new ArrayList<>(titleDefinitions);
            withUkc.add(ukc);

            SeedReport report = orchestrator.run(SeedEnvironment.DEV, catalogue, withUkc);

            assertThat(report.succeeded()).isTrue();
            assertThat(jdbc.queryForObject(
                "SELECT COUNT(*) FROM title_definition WHERE abbreviation = 'CH'", Integer.class)).isEqualTo(2);
            assertThat(jdbc.queryForObject("""
                SELECT d.organization FROM animal_title t
                JOIN title_definition d ON d.id = t.title_definition_id
                JOIN animal a ON a.id = t.animal_id
                WHERE a.name = '[DEV] Grip'
                """, String.class)).isEqualTo("AKC");
            long gch = titles.findIdByAbbreviation("DOG", "GCH").orElseThrow();
            assertThat(jdbc.queryForObject("SELECT organization FROM title_definition WHERE id = ?",
                String.class, parentTitleId(gch))).isEqualTo("AKC");
        }

        private Long parentTitleId(long id) {
            return jdbc.queryForObject("SELECT parent_title_id FROM title_definition WHERE id = ?", Long.class, id);
        }
    }

    @Nested
    @DisplayName("clients")
    class Clients {

        @Test
        void depositPaidContactGetsWaitlistEntryAndOneDepositInvoice() {
            seed(catalogue);
            seed(catalogue);

            long pippin = jdbc.queryForObject(
                "SELECT party_id FROM contact WHERE email = 'pippin.dev@tookland.local'", Long.class);
            Map<String, Object> entry = jdbc.queryForMap(
                "SELECT status, priority, deposit_paid_cents FROM waitlist_entry WHERE client_party_id = ?", pippin);
            assertThat(entry.get("status")).isEqualTo("DEPOSIT_PAID");
            assertThat(((Number) entry.get("priority")).intValue()).isEqualTo(1);
            assertThat(((Number) entry.get("deposit_paid_cents")).intValue()).isEqualTo(50000);

            List<Map<String, Object>> invoices = jdbc.queryForList(
                "SELECT category, amount_cents, invoice_number, reference_number, status FROM invoice WHERE client_party_id = ?", pippin);
            assertThat(invoices).hasSize(1);
            assertThat(invoices.get(0).get("category")).isEqualTo("DEPOSIT");
            assertThat(((Number) invoices.get(0).get("amount_cents")).intValue()).isEqualTo(50000);
            assertThat(invoices.get(0).get("reference_number")).isEqualTo("DEP-DEV-SHIRE-2");
            assertThat(invoices.get(0).get("invoice_number"))
                .isEqualTo("INV-" + LocalDate.now(ZoneOffset.UTC).getYear() + "-SHI-DEP0002");
        }

        @Test
        void paidWaitlistEntryWasApprovedBeforeTheDepositWasPaid() {
            Instant before = Instant.now();
            seed(catalogue);

            Map<String, Object> entry = jdbc.queryForMap("SELECT approved_at, deposit_paid_at FROM waitlist_entry");
            Instant approved = ((Timestamp) entry.get("approved_at")).toInstant();
            Instant paid = ((Timestamp) entry.get("deposit_paid_at")).toInstant();

            assertThat(approved).isBefore(paid);
            assertThat(Duration.between(paid, before).toDays()).isEqualTo(19);
            assertThat(Duration.between(approved, before).toDays()).isEqualTo(29);
        }

        @Test
        void contactWithoutPartyIsRelinkedOnTheNextRun() {
            seed(catalogue);
            jdbc.update("UPDATE contact SET party_id = NULL WHERE email = 'rosie.dev@bywater.local'");

            SeedReport second = seed(catalogue);

            assertThat(second.succeeded()).isTrue();
            assertThat(second.tally().created(EntityKind.PARTY)).isEqualTo(1);
            assertThat(jdbc.queryForObject("""
                SELECT p.email FROM contact c JOIN party p ON p.id = c.party_id
                WHERE c.email = 'rosie.dev@bywater.local'
                """, String.class)).isEqualTo("rosie.dev@bywater.local");
        }

        @Test
        void everyContactAndOrganizationHasExactlyOneParty() {
            seed(catalogue);

            assertThat(jdbc.queryForObject(
                "SELECT COUNT(*) FROM contact c JOIN party p ON p.id = c.party_id", Integer.class)).isEqualTo(3);
            assertThat(jdbc.queryForObject(
                "SELECT COUNT(*) FROM organization o JOIN party p ON p.id = o.party_id", Integer.class)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("communications")
    class Communications {

        @Test
        void threadLastMessageTimeIsTheNewestMessage() {
            seed(catalogue);

            Timestamp last = jdbc.queryForObject(
                "SELECT last_message_at FROM message_thread WHERE subject = 'Mushroom-hunting dogs'", Timestamp.class);
            Timestamp newest = jdbc.queryForObject("SELECT MAX(created_at) FROM thread_message", Timestamp.class);
            Timestamp listedLast = jdbc.queryForObject(
                "SELECT created_at FROM thread_message WHERE body = 'They find trespassers mostly.'", Timestamp.class);

            assertThat(last).isEqualTo(newest);
            assertThat(listedLast).isBefore(last);
        }

        @Test
        void threadHasBothParticipants() {
            seed(catalogue);

            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM message_participant", Integer.class)).isEqualTo(2);
            assertThat(jdbc.queryForObject(
                "SELECT COUNT(*) FROM party WHERE email = 'lotho.dev@sackville.local'", Integer.class)).isEqualTo(1);
        }

        @Test
        void emailIsLoggedAsActivity() {
            seed(catalogue);

            assertThat(jdbc.queryForObject("SELECT to_email FROM party_email", String.class))
                .isEqualTo("rosie.dev@bywater.local");
            assertThat(jdbc.queryForObject("SELECT title FROM party_activity", String.class))
                .isEqualTo("Sent: Litter news");
        }

        @Test
        void draftIsAddressedToItsContact() {
            seed(catalogue);

            Map<String, Object> draft = jdbc.queryForMap("SELECT channel, to_addresses, subject FROM draft");
            assertThat(draft.get("channel")).isEqualTo("dm");
            assertThat(draft.get("to_addresses")).isEqualTo("merry.dev@buckland.local");
            assertThat(draft.get("subject")).isNull();
        }

        @Test
        void subjectlessDraftsWithDifferentBodiesAreBothKept() {
            TenantFixture shire = catalogue.tenants().get(0);
            List<DraftFixture> drafts = List.of(
                new DraftFixture(null, DraftChannel.DM, null, "Remember to close the gate before the hounds get out tonight.", 1),
                new DraftFixture(null, DraftChannel.DM, null, "Remember to close the gate before the hounds get out tomorrow.", 2),
                new DraftFixture(null, DraftChannel.DM, null, "A different DM body", 1));
            SeedCatalogue withDrafts = new SeedCatalogue(catalogue.marketplaceUsers(),
                List.of(withDrafts(shire, drafts)), null);

            SeedReport first = seed(withDrafts);
            SeedReport second = seed(withDrafts);

            assertThat(first.succeeded()).isTrue();
            assertThat(first.tally().created(EntityKind.DRAFT)).isEqualTo(3);
            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM draft", Integer.class)).isEqualTo(3);
            assertThat(second.tally().existing(EntityKind.DRAFT)).isEqualTo(3);
            assertThat(second.tally().created(EntityKind.DRAFT)).isZero();
        }
    }

    @Nested
    @DisplayName("breeding plans")
    class BreedingPlans {

        @Test
        void planWithUnknownParentIsSkipped() {
            SeedReport report = seed(catalogue);

            assertThat(report.succeeded()).isTrue();
            assertThat(jdbc.queryForList("SELECT name FROM breeding_plan", String.class))
                .containsExactly("[DEV] Shire Litter");
            assertThat(jdbc.queryForList("""
                SELECT t.name FROM tag_assignment ta JOIN tag t ON t.id = ta.tag_id
                WHERE ta.target_kind = 'BREEDING_PLAN'
                """, String.class)).containsExactly("High Priority");
        }
    }

    @Nested
    @DisplayName("offspring groups")
    class OffspringGroups {

        @Test
        void groupsWithResolvedParentsAreSeededWithTheirOffspring() {
            SeedReport report = seed(catalogue);

            assertThat(report.succeeded()).isTrue();
            assertThat(jdbc.queryForList("SELECT name FROM offspring_group ORDER BY id", String.class))
                .containsExactly("[DEV] Shire Spring Litter", "[DEV] Shire Autumn Litter");
            assertThat(report.tally().created(EntityKind.OFFSPRING)).isEqualTo(5);
            assertThat(jdbc.queryForObject("""
                SELECT d.name FROM offspring_group g JOIN animal d ON d.id = g.dam_id
                WHERE g.name = '[DEV] Shire Spring Litter'
                """, String.class)).isEqualTo("[DEV] Fang Lass");
        }

        @Test
        void offspringDatesFollowTheGroup() {
            seed(catalogue);

            Map<String, Object> sam = offspring("[DEV] Sam Pup");
            assertThat(sam.get("born_at").toString()).isEqualTo("2024-03-01");
            assertThat(sam.get("collar_assigned_at").toString()).isEqualTo("2024-03-01");
            assertThat(sam.get("placement_state")).isEqualTo("RESERVED");
            assertThat(sam.get("placed_at")).isNull();

            Map<String, Object> hamfast = offspring("[DEV] Hamfast Pup");
            assertThat(hamfast.get("collar_assigned_at")).isNull();
            assertThat(hamfast.get("placed_at").toString()).isEqualTo("2019-11-20");
            assertThat(hamfast.get("paid_in_full_at").toString()).isEqualTo("2019-11-20");

            Map<String, Object> lily = offspring("[DEV] Lily Pup");
            assertThat(lily.get("placed_at").toString()).isEqualTo("2019-11-20");
            assertThat(lily.get("paid_in_full_at")).isNull();
        }

        @Test
        void groupsAndOffspringAreTaggedFromTheirState() {
            seed(catalogue);

            assertThat(jdbc.queryForList("""
                SELECT g.name || ':' || t.name FROM tag_assignment ta
                JOIN tag t ON t.id = ta.tag_id
                JOIN offspring_group g ON g.id = ta.target_id
                WHERE ta.target_kind = 'OFFSPRING_GROUP'
                """, String.class)).containsExactlyInAnyOrder(
                "[DEV] Shire Spring Litter:Available",
                "[DEV] Shire Spring Litter:Photos Needed",
                "[DEV] Shire Autumn Litter:All Reserved");
            assertThat(jdbc.queryForList("""
                SELECT o.name || ':' || t.name FROM tag_assignment ta
                JOIN tag t ON t.id = ta.tag_id
                JOIN offspring o ON o.id = ta.target_id
                WHERE ta.target_kind = 'OFFSPRING'
                """, String.class)).containsExactlyInAnyOrder(
                "[DEV] Sam Pup:Reserved",
                "[DEV] Bell Pup:Keeper",
                "[DEV] Daisy Pup:Available",
                "[DEV] Hamfast Pup:Reserved",
                "[DEV] Lily Pup:Reserved");
        }

        @Test
        void removedOffspringIsPutBack() {
            seed(catalogue);
            jdbc.update("DELETE FROM offspring WHERE name = '[DEV] Daisy Pup'");

            SeedReport second = seed(catalogue);

            assertThat(second.tally().existing(EntityKind.OFFSPRING_GROUP)).isEqualTo(2);
            assertThat(second.tally().existing(EntityKind.OFFSPRING)).isEqualTo(4);
            assertThat(second.tally().created(EntityKind.OFFSPRING)).isEqualTo(1);
            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM offspring", Integer.class)).isEqualTo(5);
        }

        private Map<String, Object> offspring(String name) {
            return jdbc.queryForMap("SELECT * FROM offspring WHERE name = ?", name);
        }
    }

    @Nested
    @DisplayName("cross-tenant links")
    class CrossTenantLinks {

        private SeedCatalogue twoTenants(List<CrossTenantLinkFixture> links) {
            TenantFixture shire = catalogue.tenants().get(0);
            return new SeedCatalogue(catalogue.marketplaceUsers(),
                List.of(shire, withSlugAndAnimals(shire, "shire-north", shire.animals())), links);
        }

        private CrossTenantLinkFixture link(String child, String parent, LineageParentType type, LinkMethod method) {
            return new CrossTenantLinkFixture("shire-north", child, "shire", parent, "DOG", type, method);
        }

        @Test
        void linkIsCreatedOnceBetweenMatchingAnimals() {
            SeedCatalogue fixtures = twoTenants(List.of(link("Maggot Pup", "Grip", LineageParentType.SIRE, null)));

            SeedReport first = seed(fixtures);
            SeedReport second = seed(fixtures);

            assertThat(first.succeeded()).isTrue();
            assertThat(first.tally().created(EntityKind.CROSS_TENANT_LINK)).isEqualTo(1);
            assertThat(second.tally().existing(EntityKind.CROSS_TENANT_LINK)).isEqualTo(1);
            Map<String, Object> row = jdbc.queryForMap("SELECT * FROM cross_tenant_animal_link");
            assertThat(((Number) row.get("child_tenant_id")).longValue()).isEqualTo(tenantId("dev-shire-north"));
            assertThat(((Number) row.get("parent_tenant_id")).longValue()).isEqualTo(tenantId("dev-shire"));
            assertThat(row.get("parent_type")).isEqualTo("SIRE");
            assertThat(row.get("link_method")).isEqualTo("MANUAL");
            assertThat(row.get("active")).isEqualTo(true);
        }

        @Test
        void animalsThatDoNotAllowMatchingAreNotLinked() {
            SeedReport report = seed(twoTenants(List.of(
                link("Fang Lass", "Wolf", LineageParentType.SIRE, LinkMethod.SEARCH),
                link("Maggot Pup", "Nobody", LineageParentType.DAM, LinkMethod.SEARCH),
                new CrossTenantLinkFixture("gondor", "Grip", "shire", "Fang", "DOG", LineageParentType.DAM, null))));

            assertThat(report.succeeded()).isTrue();
            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM cross_tenant_animal_link", Integer.class)).isZero();
        }

        @Test
        void conflictingLinksFailTheLinkPassOnly() {
            SeedReport report = seed(twoTenants(List.of(
                link("Maggot Pup", "Grip", LineageParentType.SIRE, LinkMethod.MANUAL),
                link("Maggot Pup", "Grip Junior", LineageParentType.SIRE, LinkMethod.MANUAL))));

            assertThat(report.tenantsProcessed()).isEqualTo(2);
            assertThat(report.failures()).extracting(TenantFailure::tenantSlug).containsExactly("cross-tenant-links");
            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM cross_tenant_animal_link", Integer.class)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("shipped catalogues")
    class ShippedCatalogues {

        @Test
        void devCatalogueSeedsAndReRunsCleanly() {
            assertSeedsTwice(SeedEnvironment.DEV, "fixtures/catalogue-dev.json");

            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM cross_tenant_animal_link", Integer.class)).isEqualTo(2);
        }

        @Test
        void prodCatalogueSeedsAndReRunsCleanly() {
            assertSeedsTwice(SeedEnvironment.PROD, "fixtures/catalogue-prod.json");

            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM tenant WHERE slug LIKE 'dev-%'", Integer.class)).isZero();
        }

        private void assertSeedsTwice(SeedEnvironment env, String path) {
            SeedCatalogue shipped = loader.loadCatalogue(new ClassPathResource(path));
            List<TitleDefinitionFixture> definitions =
                loader.loadTitleDefinitions(new ClassPathResource("fixtures/title-definitions.json"));

            SeedReport first = orchestrator.run(env, shipped, definitions);
            SeedReport second = orchestrator.run(env, shipped, definitions);

            assertThat(first.failures()).isEmpty();
            assertThat(first.tally().created(EntityKind.OFFSPRING_GROUP)).isPositive();
            assertThat(second.failures()).isEmpty();
            assertThat(second.tally().totalCreated()).isZero();
        }
    }

    @Test
    void brokenTenantDoesNotStopTheNextOne() {
        TenantFixture shire = catalogue.tenants().get(0);
        AnimalFixture orphan = new AnimalFixture("Orphan", "DOG", "FEMALE", "Mastiff", 1, "Nobody", null, 2020,
            null, null, null, null, null, null);
        TenantFixture broken = withSlugAndAnimals(shire, "bree", List.of(orphan));

        SeedReport report = seed(new SeedCatalogue(catalogue.marketplaceUsers(), List.of(broken, shire), null));

        assertThat(report.tenantsProcessed()).isEqualTo(2);
        assertThat(report.failures()).hasSize(1);
        assertThat(report.failures().get(0).tenantSlug()).isEqualTo("dev-bree");
        assertThat(report.failures().get(0).message()).contains("Nobody");
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM animal WHERE tenant_id = ?", Integer.class,
            tenantId("dev-shire"))).isEqualTo(6);
    }

    static TenantFixture withSlugAndAnimals(TenantFixture base, String slug, List<AnimalFixture> animals) {
        return copy(base, slug, animals, base.drafts());
    }

    static TenantFixture withDrafts(TenantFixture base, List<DraftFixture> drafts) {
        return copy(base, base.slug(), base.animals(), drafts);
    }

    private static TenantFixture copy(TenantFixture base, String slug, List<AnimalFixture> animals,
                                      List<DraftFixture> drafts) {
        return new TenantFixture(slug, base.theme(), base.marketplaceVisibility(), base.lineageVisibility(),
            base.species(), base.owner(), base.organizations(), base.contacts(), animals, base.breedingPlans(),
            base.listings(), base.portalAccess(), base.contactMeta(), base.emails(), base.threads(), drafts,
            base.offspringGroups());
    }
}
