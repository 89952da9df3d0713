package com.valan.harvester.crawl.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.valan.harvester.crawl.model.AwardEnrichment;
import com.valan.harvester.crawl.model.PublicationRecord;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PublicationJdbcRepositoryUpsertTest {

  @Autowired private PublicationJdbcRepository repository;

  @Autowired private NamedParameterJdbcTemplate jdbc;

  @Test
  void tenderUpsertIsIdempotentPerSourceId() {
    long id = 910001L;

    assertTrue(repository.upsertTender(record(id, "Schoonmaak", "Aankondiging van een opdracht")));
    assertTrue(repository.upsertTender(record(id, "Schoonmaak en glasbewassing", "Aankondiging van een opdracht")));

    Integer rows =
        jdbc.queryForObject(
            "SELECT COUNT(*) FROM registry_tenders WHERE source_id = :id",
            new MapSqlParameterSource("id", id),
            Integer.class);
    String title =
        jdbc.queryForObject(
            "SELECT title FROM registry_tenders WHERE source_id = :id",
            new MapSqlParameterSource("id", id),
            String.class);
    String codes =
        jdbc.queryForObject(
            "SELECT cpv_codes FROM registry_tenders WHERE source_id = :id",
            new MapSqlParameterSource("id", id),
            String.class);
    assertEquals(1, rows);
    assertEquals("Schoonmaak en glasbewassing", title);
    assertEquals("90910000-9,90911200-8", codes);
    assertTrue(repository.exists(id));
  }

  @Test
  void awardUpsertKeepsKnownSupplierWhenNewEnrichmentIsEmpty() {
    long id = 910002L;
    PublicationRecord award = record(id, "Afvalinzameling", "Aankondiging van een gegunde opdracht");
    AwardEnrichment enrichment =
        new AwardEnrichment(
            "Acme B.V.", "12345678", 250000.0, "info@acme.nl", "Stationsstraat 1", "Utrecht", "1234 AB");

    assertTrue(repository.upsertAward(award, enrichment));
    assertTrue(repository.upsertAward(award, AwardEnrichment.EMPTY));

    Map<String, Object> row =
        jdbc.queryForMap(
            """
                SELECT supplier_name, kvk_number, award_value, supplier_city, needs_enrichment
                FROM registry_awards
                WHERE source_id = :id
                """,
            new MapSqlParameterSource("id", id));
    assertEquals("Acme B.V.", row.get("supplier_name"));
    assertEquals("12345678", row.get("kvk_number"));
    assertEquals(250000.0, ((Number) row.get("award_value")).doubleValue(), 0.001);
    assertEquals("Utrecht", row.get("supplier_city"));
    assertEquals(Boolean.FALSE, row.get("needs_enrichment"));
  }

  @Test
  void awardWithoutSupplierNeedsEnrichment() {
    long id = 910003L;

    assertTrue(
        repository.upsertAward(
            record(id, "Groenonderhoud", "Aankondiging van een gegunde opdracht"),
            AwardEnrichment.EMPTY));

    Boolean needsEnrichment =
        jdbc.queryForObject(
            "SELECT needs_enrichment FROM registry_awards WHERE source_id = :id",
            new MapSqlParameterSource("id", id),
            Boolean.class);
    String detailUrl =
        jdbc.queryForObject(
            "SELECT detail_url FROM registry_awards WHERE source_id = :id",
            new MapSqlParameterSource("id", id),
            String.class);
    assertEquals(Boolean.TRUE, needsEnrichment);
    assertNotNull(detailUrl);
    assertTrue(detailUrl.endsWith("/" + id));
  }

  @Test
  void maxKnownIdSpansTendersAndAwards() {
    repository.upsertTender(record(920010L, "Tender", "Aankondiging van een opdracht"));
    repository.upsertAward(
        record(920020L, "Award", "Aankondiging van een gegunde opdracht"), AwardEnrichment.EMPTY);

    assertTrue(repository.maxKnownId() >= 920020L);
    assertTrue(repository.exists(920020L));
    assertFalse(repository.exists(920030L));
  }

  @Test
  void databaseIsReachable() {
    assertTrue(repository.isReachable());
  }

  private static PublicationRecord record(long id, String title, String noticeType) {
    return new PublicationRecord(
        id,
        title,
        "Gemeente Utrecht",
        noticeType,
        OffsetDateTime.of(2024, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC),
        null,
        true,
        List.of("90910000-9", "90911200-8"),
        "90910000-9",
        List.of("NL310"),
        "Openbaar",
        "Diensten",
        "Korte omschrijving",
        "REF-" + id,
        null,
        null,
        Map.of("kenmerk", "REF-" + id));
  }
}
