package dev.univer.worktracker.migration;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * information_schema look-ups that read the same on PostgreSQL and H2.
 * Names are compared lower-cased and limited to the current schema.
 */
@Component
@RequiredArgsConstructor
public class SchemaInspector {

    private final JdbcTemplate jdbc;

    public boolean tableExists(String table) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM information_schema.tables " +
                "WHERE LOWER(table_name) = ? AND LOWER(table_schema) = LOWER(CURRENT_SCHEMA)",
                Integer.class, lower(table));
        return n != null && n > 0;
    }

    public boolean columnExists(String table, String column) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM information_schema.columns " +
                "WHERE LOWER(table_name) = ? AND LOWER(column_name) = ? AND LOWER(table_schema) = LOWER(CURRENT_SCHEMA)",
                Integer.class, lower(table), lower(column));
        return n != null && n > 0;
    }

    public boolean uniqueConstraintExists(String table, String constraint) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM information_schema.table_constraints " +
                "WHERE LOWER(table_name) = ? AND LOWER(constraint_name) = ? AND constraint_type = 'UNIQUE' " +
                "AND LOWER(constraint_schema) = LOWER(CURRENT_SCHEMA)",
                Integer.class, lower(table), lower(constraint));
        return n != null && n > 0;
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
