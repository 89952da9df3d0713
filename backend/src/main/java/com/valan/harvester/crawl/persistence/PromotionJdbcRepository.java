package com.valan.harvester.crawl.persistence;

import com.valan.harvester.config.HarvesterProperties;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.regex.Pattern;

/**
 * Calls the downstream feed functions that copy staged rows into the master tables.
 * The functions themselves live in the target database and are opaque here.
 */
@Repository
public class PromotionJdbcRepository {
    private static final Pattern FUNCTION_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_.]*");

    private final NamedParameterJdbcTemplate jdbc;
    private final HarvesterProperties properties;

    public PromotionJdbcRepository(NamedParameterJdbcTemplate jdbc, HarvesterProperties properties) {
        this.jdbc = jdbc;
        this.properties = properties;
    }

    /** Rows of {@code table} not yet fed to the master tables. */
    public long countPending(String table) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM " + requireIdentifier(table) + " WHERE source = :source AND fed_to_master = FALSE",
            new MapSqlParameterSource("source", properties.getSource()),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public long callFeedFunction(String functionName) {
        Number fed = jdbc.getJdbcTemplate().queryForObject(
            "SELECT " + requireIdentifier(functionName) + "()",
            Number.class
        );
        return fed == null ? 0L : fed.longValue();
    }

    static String requireIdentifier(String name) {
        if (name == null || !FUNCTION_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }
}
