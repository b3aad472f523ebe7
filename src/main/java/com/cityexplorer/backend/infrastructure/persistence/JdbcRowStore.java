package com.cityexplorer.backend.infrastructure.persistence;

import com.cityexplorer.backend.domain.exception.StoreReadException;
import com.cityexplorer.backend.domain.exception.StoreWriteException;
import com.cityexplorer.backend.domain.model.CacheKey;
import com.cityexplorer.backend.domain.model.CachedRow;
import com.cityexplorer.backend.domain.model.ResourcePolicy;
import com.cityexplorer.backend.domain.port.out.RowStore;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * Table-per-resource row store on top of {@link JdbcTemplate}.
 * Values are always bound as parameters; identifiers come from the registry's policies.
 */
@Repository
public class JdbcRowStore implements RowStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcRowStore.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcRowStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<CachedRow> findByKey(ResourcePolicy policy, CacheKey key) {
        String sql = "SELECT id, " + String.join(", ", policy.fields()) + ", created_at"
                + " FROM " + policy.tableName()
                + " WHERE " + policy.keyKind().column() + " = ?"
                + " ORDER BY id";

        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(policy, key, rs), key.value());
        } catch (DataAccessException e) {
            logger.error("Database error while reading {} rows for [{}]", policy.resourceType(), key, e);
            throw new StoreReadException("Failed to read " + policy.resourceType() + " rows", e);
        }
    }

    @Override
    public CachedRow insert(ResourcePolicy policy, CacheKey key, Map<String, Object> fields, Instant createdAt) {
        for (String name : fields.keySet()) {
            if (!policy.fields().contains(name)) {
                throw new IllegalArgumentException("Unknown field '" + name + "' for " + policy.resourceType());
            }
        }

        List<String> columns = new ArrayList<>(policy.fields());
        columns.add(policy.keyKind().column());
        columns.add("created_at");

        List<Object> values = new ArrayList<>(columns.size());
        policy.fields().forEach(name -> values.add(fields.get(name)));
        values.add(key.value());
        values.add(createdAt.toEpochMilli());

        String sql = "INSERT INTO " + policy.tableName()
                + " (" + String.join(", ", columns) + ")"
                + " VALUES (" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";

        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(sql, new String[] {"id"});
                for (int i = 0; i < values.size(); i++) {
                    ps.setObject(i + 1, values.get(i));
                }
                return ps;
            }, keyHolder);
        } catch (DataAccessException e) {
            logger.error("Error inserting {} row for [{}]", policy.resourceType(), key, e);
            throw new StoreWriteException("Failed to insert " + policy.resourceType() + " row", e);
        }

        Number id = keyHolder.getKey();
        if (id == null) {
            throw new StoreWriteException("No id generated for " + policy.resourceType() + " row", null);
        }

        Map<String, Object> stored = new LinkedHashMap<>();
        policy.fields().forEach(name -> stored.put(name, fields.get(name)));
        return CachedRow.of(id.longValue(), key, stored, Instant.ofEpochMilli(createdAt.toEpochMilli()));
    }

    @Override
    public int deleteByKey(ResourcePolicy policy, CacheKey key) {
        String sql = "DELETE FROM " + policy.tableName() + " WHERE " + policy.keyKind().column() + " = ?";

        try {
            int deleted = jdbcTemplate.update(sql, key.value());
            logger.debug("Deleted {} {} rows for [{}]", deleted, policy.resourceType(), key);
            return deleted;
        } catch (DataAccessException e) {
            logger.error("Error deleting {} rows for [{}]", policy.resourceType(), key, e);
            throw new StoreWriteException("Failed to delete " + policy.resourceType() + " rows", e);
        }
    }

    private CachedRow mapRow(ResourcePolicy policy, CacheKey key, ResultSet rs) throws SQLException {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (String name : policy.fields()) {
            fields.put(name, rs.getObject(name));
        }
        return CachedRow.of(rs.getLong("id"), key, fields, Instant.ofEpochMilli(rs.getLong("created_at")));
    }
}
