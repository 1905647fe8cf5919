package com.datapulse.etl.output;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Narrow write/read interface over the relational store. Implementations report failures
 * as {@link PersistenceException}.
 */
public interface RelationalStore {

    /**
     * Inserts a row unless it collides with a unique constraint.
     *
     * @return generated value of {@code idColumn}, or null when the row already existed
     */
    Long insert(String table, String idColumn, Map<String, Object> fields);

    /**
     * Inserts a row without a generated key, typically an association.
     *
     * @return false when the row already existed
     */
    boolean insertLink(String table, Map<String, Object> fields);

    /** Maps each existing {@code keyColumn} value among {@code keys} to its id. */
    Map<String, Long> lookupIds(String table, String idColumn, String keyColumn, Collection<String> keys);

    List<Map<String, Object>> query(String sql, Object... args);
}
