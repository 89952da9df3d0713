package com.valan.harvester.crawl.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.valan.harvester.config.HarvesterProperties;
import com.valan.harvester.crawl.model.AwardEnrichment;
import com.valan.harvester.crawl.model.PublicationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Repository
public class PublicationJdbcRepository implements PublicationStore {
    private static final Logger log = LoggerFactory.getLogger(PublicationJdbcRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final HarvesterProperties properties;
    private final boolean postgres;

    public PublicationJdbcRepository(
        NamedParameterJdbcTemplate jdbc,
        TransactionTemplate transactionTemplate,
        ObjectMapper objectMapper,
        HarvesterProperties properties
    ) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.postgres = detectPostgres(jdbc);
    }

    @Override
    public boolean isReachable() {
        try {
            Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
            return value != null && value == 1;
        } catch (DataAccessException e) {
            log.error("Database not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public long maxKnownId() {
        Long max = jdbc.queryForObject(
            """
                SELECT GREATEST(
                    COALESCE((SELECT MAX(source_id) FROM registry_tenders WHERE source = :source), 0),
                    COALESCE((SELECT MAX(source_id) FROM registry_awards WHERE source = :source), 0)
                )
                """,
            new MapSqlParameterSource("source", properties.getSource()),
            Long.class
        );
        return max == null ? 0L : max;
    }

    @Override
    public boolean exists(long id) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", properties.getSource())
            .addValue("sourceId", id);
        try {
            List<Integer> hits = jdbc.queryForList(
                """
                    SELECT 1 FROM registry_tenders WHERE source = :source AND source_id = :sourceId
                    UNION
                    SELECT 1 FROM registry_awards WHERE source = :source AND source_id = :sourceId
                    """,
                params,
                Integer.class
            );
            return !hits.isEmpty();
        } catch (DataAccessException e) {
            log.warn("Existence check failed for {}: {}", id, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean upsertTender(PublicationRecord record) {
        MapSqlParameterSource params = baseParams(record)
            .addValue("nutsCodes", joinCodes(record.nutsCodes()))
            .addValue("contractType", record.contractType())
            .addValue("deadline", record.deadline());
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (postgres) {
                    jdbc.update(
                        """
                            INSERT INTO registry_tenders (
                                source, source_id, title, short_description, buyer_name,
                                cpv_codes, cpv_primary, nuts_codes, notice_type, procurement_method,
                                contract_type, published_at, deadline, is_above_threshold,
                                ted_nummer, kenmerk, detail_url, source_metadata, fetched_at
                            )
                            VALUES (
                                :source, :sourceId, :title, :description, :buyerName,
                                :cpvCodes, :cpvPrimary, :nutsCodes, :noticeType, :procedure,
                                :contractType, :publishedAt, :deadline, :aboveThreshold,
                                :tedNumber, :reference, :detailUrl, :metadata, :fetchedAt
                            )
                            ON CONFLICT (source, source_id)
                            DO UPDATE SET
                                title = EXCLUDED.title,
                                short_description = EXCLUDED.short_description,
                                buyer_name = EXCLUDED.buyer_name,
                                cpv_codes = EXCLUDED.cpv_codes,
                                cpv_primary = EXCLUDED.cpv_primary,
                                nuts_codes = EXCLUDED.nuts_codes,
                                notice_type = EXCLUDED.notice_type,
                                procurement_method = EXCLUDED.procurement_method,
                                contract_type = EXCLUDED.contract_type,
                                deadline = EXCLUDED.deadline,
                                is_above_threshold = EXCLUDED.is_above_threshold,
                                ted_nummer = EXCLUDED.ted_nummer,
                                kenmerk = EXCLUDED.kenmerk,
                                source_metadata = EXCLUDED.source_metadata,
                                fetched_at = EXCLUDED.fetched_at,
                                updated_at = NOW()
                            """,
                        params
                    );
                    return;
                }
                jdbc.update(
                    """
                        MERGE INTO registry_tenders (
                            source, source_id, title, short_description, buyer_name,
                            cpv_codes, cpv_primary, nuts_codes, notice_type, procurement_method,
                            contract_type, published_at, deadline, is_above_threshold,
                            ted_nummer, kenmerk, detail_url, source_metadata, fetched_at, updated_at
                        )
                        KEY(source, source_id)
                        VALUES (
                            :source, :sourceId, :title, :description, :buyerName,
                            :cpvCodes, :cpvPrimary, :nutsCodes, :noticeType, :procedure,
                            :contractType, :publishedAt, :deadline, :aboveThreshold,
                            :tedNumber, :reference, :detailUrl, :metadata, :fetchedAt, CURRENT_TIMESTAMP()
                        )
                        """,
                    params
                );
            });
            return true;
        } catch (DataAccessException e) {
            log.error("DB error tender {}: {}", record.id(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean upsertAward(PublicationRecord record, AwardEnrichment enrichment) {
        AwardEnrichment safe = enrichment == null ? AwardEnrichment.EMPTY : enrichment;
        MapSqlParameterSource params = baseParams(record)
            .addValue("awardDate", record.publishedAt())
            .addValue("supplierName", safe.supplierName())
            .addValue("kvkNumber", safe.registrationNumber())
            .addValue("awardValue", safe.awardValue())
            .addValue("supplierEmail", safe.supplierEmail())
            .addValue("supplierAddress", safe.supplierAddress())
            .addValue("supplierCity", safe.supplierCity())
            .addValue("supplierPostalCode", safe.supplierPostalCode())
            .addValue("needsEnrichment", safe.supplierName() == null);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (postgres) {
                    jdbc.update(
                        """
                            INSERT INTO registry_awards (
                                source, source_id, title, short_description, buyer_name,
                                cpv_codes, cpv_primary, notice_type, procurement_method, award_date,
                                is_above_threshold, ted_nummer, kenmerk, detail_url,
                                supplier_name, kvk_number, award_value, supplier_email,
                                supplier_address, supplier_city, supplier_postal_code,
                                needs_enrichment, source_metadata, fetched_at
                            )
                            VALUES (
                                :source, :sourceId, :title, :description, :buyerName,
                                :cpvCodes, :cpvPrimary, :noticeType, :procedure, :awardDate,
                                :aboveThreshold, :tedNumber, :reference, :detailUrl,
                                :supplierName, :kvkNumber, :awardValue, :supplierEmail,
                                :supplierAddress, :supplierCity, :supplierPostalCode,
                                :needsEnrichment, :metadata, :fetchedAt
                            )
                            ON CONFLICT (source, source_id)
                            DO UPDATE SET
                                title = EXCLUDED.title,
                                short_description = EXCLUDED.short_description,
                                buyer_name = EXCLUDED.buyer_name,
                                cpv_codes = EXCLUDED.cpv_codes,
                                cpv_primary = EXCLUDED.cpv_primary,
                                notice_type = EXCLUDED.notice_type,
                                procurement_method = EXCLUDED.procurement_method,
                                is_above_threshold = EXCLUDED.is_above_threshold,
                                ted_nummer = EXCLUDED.ted_nummer,
                                kenmerk = EXCLUDED.kenmerk,
                                supplier_name = COALESCE(EXCLUDED.supplier_name, registry_awards.supplier_name),
                                kvk_number = COALESCE(EXCLUDED.kvk_number, registry_awards.kvk_number),
                                award_value = COALESCE(EXCLUDED.award_value, registry_awards.award_value),
                                supplier_email = COALESCE(EXCLUDED.supplier_email, registry_awards.supplier_email),
                                supplier_address = COALESCE(EXCLUDED.supplier_address, registry_awards.supplier_address),
                                supplier_city = COALESCE(EXCLUDED.supplier_city, registry_awards.supplier_city),
                                supplier_postal_code = COALESCE(EXCLUDED.supplier_postal_code, registry_awards.supplier_postal_code),
                                needs_enrichment = COALESCE(EXCLUDED.supplier_name, registry_awards.supplier_name) IS NULL,
                                source_metadata = EXCLUDED.source_metadata,
                                fetched_at = EXCLUDED.fetched_at,
                                updated_at = NOW()
                            """,
                        params
                    );
                    return;
                }
                int updated = jdbc.update(
                    """
                        UPDATE registry_awards
                        SET title = :title,
                            short_description = :description,
                            buyer_name = :buyerName,
                            cpv_codes = :cpvCodes,
                            cpv_primary = :cpvPrimary,
                            notice_type = :noticeType,
                            procurement_method = :procedure,
                            is_above_threshold = :aboveThreshold,
                            ted_nummer = :tedNumber,
                            kenmerk = :reference,
                            supplier_name = COALESCE(:supplierName, supplier_name),
                            kvk_number = COALESCE(:kvkNumber, kvk_number),
                            award_value = COALESCE(:awardValue, award_value),
                            supplier_email = COALESCE(:supplierEmail, supplier_email),
                            supplier_address = COALESCE(:supplierAddress, supplier_address),
                            supplier_city = COALESCE(:supplierCity, supplier_city),
                            supplier_postal_code = COALESCE(:supplierPostalCode, supplier_postal_code),
                            needs_enrichment = COALESCE(:supplierName, supplier_name) IS NULL,
                            source_metadata = :metadata,
                            fetched_at = :fetchedAt,
                            updated_at = CURRENT_TIMESTAMP()
                        WHERE source = :source
                          AND source_id = :sourceId
                        """,
                    params
                );
                if (updated == 0) {
                    jdbc.update(
                        """
                            INSERT INTO registry_awards (
                                source, source_id, title, short_description, buyer_name,
                                cpv_codes, cpv_primary, notice_type, procurement_method, award_date,
                                is_above_threshold, ted_nummer, kenmerk, detail_url,
                                supplier_name, kvk_number, award_value, supplier_email,
                                supplier_address, supplier_city, supplier_postal_code,
                                needs_enrichment, source_metadata, fetched_at
                            )
                            VALUES (
                                :source, :sourceId, :title, :description, :buyerName,
                                :cpvCodes, :cpvPrimary, :noticeType, :procedure, :awardDate,
                                :aboveThreshold, :tedNumber, :reference, :detailUrl,
                                :supplierName, :kvkNumber, :awardValue, :supplierEmail,
                                :supplierAddress, :supplierCity, :supplierPostalCode,
                                :needsEnrichment, :metadata, :fetchedAt
                            )
                            """,
                        params
                    );
                }
            });
            return true;
        } catch (DataAccessException e) {
            log.error("DB error award {}: {}", record.id(), e.getMessage());
            return false;
        }
    }

    private MapSqlParameterSource baseParams(PublicationRecord record) {
        return new MapSqlParameterSource()
            .addValue("source", properties.getSource())
            .addValue("sourceId", record.id())
            .addValue("title", record.title() == null ? "" : record.title())
            .addValue("description", record.description())
            .addValue("buyerName", record.buyerName())
            .addValue("cpvCodes", joinCodes(record.cpvCodes()))
            .addValue("cpvPrimary", record.cpvPrimary())
            .addValue("noticeType", record.noticeType())
            .addValue("procedure", record.procedure())
            .addValue("publishedAt", record.publishedAt())
            .addValue("aboveThreshold", record.aboveThreshold())
            .addValue("tedNumber", record.tedNumber())
            .addValue("reference", record.reference())
            .addValue("detailUrl", detailUrl(record.id()))
            .addValue("metadata", toJson(record.metadata()))
            .addValue("fetchedAt", OffsetDateTime.now(ZoneOffset.UTC));
    }

    private String detailUrl(long id) {
        String template = properties.getRegistry().getDetailUrlTemplate();
        if (template == null || template.isBlank()) {
            return null;
        }
        return template.replace("{id}", Long.toString(id));
    }

    private String joinCodes(List<String> codes) {
        return codes == null || codes.isEmpty() ? null : String.join(",", codes);
    }

    private String toJson(Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(map);
        } catch (Exception e) {
            log.warn("Metadata not serializable: {}", e.getMessage());
            return null;
        }
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; using portable upserts", e);
            return false;
        }
    }
}
