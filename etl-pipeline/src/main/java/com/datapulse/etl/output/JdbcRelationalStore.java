package com.datapulse.etl.output;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link RelationalStore} on PostgreSQL. Inserts use {@code ON CONFLICT DO NOTHING} so that
 * reloading the same natural or content key never creates a second row.
 *
 * Table and column names are checked against a strict pattern since they cannot be bound
 * as parameters; values always are.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcRelationalStore implements RelationalStore {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final int LOOKUP_CHUNK = 500;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Long insert(String table, String idColumn, Map<String, Object> fields) {
        String sql = insertSql(table, fields.keySet()) + " ON CONFLICT DO NOTHING RETURNING " + identifier(idColumn);
        try {
            return jdbcTemplate.query(sql, rs -> rs.next() ? rs.getLong(1) : null, fields.values().toArray());
        } catch (DataAccessException e) {
            throw PersistenceException.from("Insert into " + table, e);
        }
    }

    @Override
    public boolean insertLink(String table, Map<String, Object> fields) {
        String sql = insertSql(table, fields.keySet()) + " ON CONFLICT DO NOTHING";
        try {
            return jdbcTemplate.update(sql, fields.values().toArray()) > 0;
        } catch (DataAccessException e) {
            throw PersistenceException.from("Insert into " + table, e);
        }
    }

    @Override
    public Map<String, Long> lookupIds(String table, String idColumn, String keyColumn, Collection<String> keys) {
        if (keys.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Long> ids = new HashMap<>();
        List<String> all = new ArrayList<>(keys);
        for (int i = 0; i < all.size(); i += LOOKUP_CHUNK) {
            List<String> chunk = all.subList(i, Math.min(i + LOOKUP_CHUNK, all.size()));
            String sql = "SELECT " + identifier(keyColumn) + ", " + identifier(idColumn)
                    + " FROM " + identifier(table)
                    + " WHERE " + identifier(keyColumn) + " IN ("
                    + chunk.stream().map(k -> "?").collect(Collectors.joining(", ")) + ")";
            try {
                jdbcTemplate.query(sql, rs -> {
                    ids.put(rs.getString(1), rs.getLong(2));
                }, chunk.toArray());
            } catch (DataAccessException e) {
                throw PersistenceException.from("Lookup in " + table, e);
            }
        }
        return ids;
    }

    @Override
    public List<Map<String, Object>> query(String sql, Object... args) {
        try {
            return jdbcTemplate.queryForList(sql, args);
        } catch (DataAccessException e) {
            throw PersistenceException.from("Query", e);
        }
    }

    private static String insertSql(String table, Collection<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No columns to insert into " + table);
        }
        return "INSERT INTO " + identifier(table)
                + " (" + columns.stream().map(JdbcRelationalStore::identifier).collect(Collectors.joining(", ")) + ")"
                + " VALUES (" + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
    }

    static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Illegal SQL identifier: " + name);
        }
        return name;
    }
}
