package com.weft.discovery.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weft.discovery.GoalIndexEntry;
import com.weft.discovery.IndexedPlugin;
import com.weft.discovery.PluginStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * JDBC implementation of {@link DiscoveryStore}. Persists to tables weft_plugin_metadata and
 * weft_goal_mapping; list columns (tags, capabilities, goals) are stored as JSON arrays. Uses only
 * portable SQL so the same store runs against embedded H2 or PostgreSQL. Create the tables first
 * with {@link com.weft.discovery.schema.DiscoverySchemaBootstrapper}.
 */
public final class JdbcDiscoveryStore implements DiscoveryStore {

    private static final String TABLE_PLUGIN = "weft_plugin_metadata";
    private static final String TABLE_GOAL = "weft_goal_mapping";
    private static final String PLUGIN_COLUMNS = "plugin_id, description, summary, category, tags_json, capabilities_json, "
            + "goals_json, content_hash, usage_count, success_rate, avg_execution_time, last_indexed";
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final Logger log = LoggerFactory.getLogger(JdbcDiscoveryStore.class);

    private final DiscoveryConnectionProvider connectionProvider;
    private final ObjectMapper mapper;

    public JdbcDiscoveryStore(DiscoveryConnectionProvider connectionProvider) {
        this(connectionProvider, new ObjectMapper());
    }

    public JdbcDiscoveryStore(DiscoveryConnectionProvider connectionProvider, ObjectMapper mapper) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.mapper = mapper != null ? mapper : new ObjectMapper();
    }

    @Override
    public Optional<IndexedPlugin> findPlugin(String pluginId) {
        String sql = "SELECT " + PLUGIN_COLUMNS + " FROM " + TABLE_PLUGIN + " WHERE plugin_id=?";
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, pluginId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readPlugin(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw failure("findPlugin", "pluginId=" + pluginId, e);
        }
    }

    @Override
    public List<IndexedPlugin> listPlugins() {
        String sql = "SELECT " + PLUGIN_COLUMNS + " FROM " + TABLE_PLUGIN + " ORDER BY plugin_id";
        try (Connection c = connectionProvider.getConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<IndexedPlugin> out = new ArrayList<>();
            while (rs.next()) {
                out.add(readPlugin(rs));
            }
            return out;
        } catch (SQLException e) {
            throw failure("listPlugins", "", e);
        }
    }

    @Override
    public void replacePlugin(IndexedPlugin plugin, List<GoalIndexEntry> goals) {
        String deleteGoals = "DELETE FROM " + TABLE_GOAL + " WHERE plugin_id=?";
        String deletePlugin = "DELETE FROM " + TABLE_PLUGIN + " WHERE plugin_id=?";
        String insertPlugin = "INSERT INTO " + TABLE_PLUGIN + " (" + PLUGIN_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
        String insertGoal = "INSERT INTO " + TABLE_GOAL + " (goal_pattern, plugin_id, relevance) VALUES (?,?,?)";
        try (Connection c = connectionProvider.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(deleteGoals)) {
                    ps.setString(1, plugin.getPluginId());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(deletePlugin)) {
                    ps.setString(1, plugin.getPluginId());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(insertPlugin)) {
                    PluginStatistics stats = plugin.getStatistics();
                    ps.setString(1, plugin.getPluginId());
                    ps.setString(2, plugin.getDescription());
                    ps.setString(3, plugin.getSummary());
                    ps.setString(4, plugin.getCategory());
                    ps.setString(5, toJson(plugin.getTags()));
                    ps.setString(6, toJson(plugin.getCapabilities()));
                    ps.setString(7, toJson(plugin.getGoals()));
                    ps.setString(8, plugin.getContentHash());
                    ps.setLong(9, stats.getUsageCount());
                    ps.setDouble(10, stats.getSuccessRate());
                    ps.setDouble(11, stats.getAverageExecutionTime());
                    ps.setTimestamp(12, plugin.getLastIndexed() != null ? Timestamp.from(plugin.getLastIndexed()) : null);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(insertGoal)) {
                    for (GoalIndexEntry g : goals) {
                        ps.setString(1, g.getGoalPattern());
                        ps.setString(2, plugin.getPluginId());
                        ps.setDouble(3, g.getRelevance());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                c.commit();
                log.debug("Discovery entry replaced | {} | pluginId={} goals={}", TABLE_PLUGIN, plugin.getPluginId(), goals.size());
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw failure("replacePlugin", "pluginId=" + plugin.getPluginId(), e);
        }
    }

    @Override
    public List<GoalIndexEntry> goalMappings(String pluginId) {
        String sql = "SELECT goal_pattern, plugin_id, relevance FROM " + TABLE_GOAL + " WHERE plugin_id=? ORDER BY goal_pattern";
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, pluginId);
            return readGoals(ps);
        } catch (SQLException e) {
            throw failure("goalMappings", "pluginId=" + pluginId, e);
        }
    }

    @Override
    public List<GoalIndexEntry> findGoalMappings(String goal, String firstToken) {
        StringBuilder sql = new StringBuilder("SELECT goal_pattern, plugin_id, relevance FROM ").append(TABLE_GOAL)
                .append(" WHERE goal_pattern LIKE ? ESCAPE '\\'")
                .append(" OR CAST(? AS VARCHAR) LIKE CONCAT('%', goal_pattern, '%')");
        if (firstToken != null) {
            sql.append(" OR goal_pattern LIKE ? ESCAPE '\\'");
        }
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            ps.setString(1, "%" + escapeLike(goal) + "%");
            ps.setString(2, goal);
            if (firstToken != null) {
                ps.setString(3, "%" + escapeLike(firstToken) + "%");
            }
            return readGoals(ps);
        } catch (SQLException e) {
            throw failure("findGoalMappings", "goal=" + goal, e);
        }
    }

    @Override
    public Set<String> findPluginsMentioning(String keyword) {
        String sql = "SELECT plugin_id FROM " + TABLE_PLUGIN
                + " WHERE LOWER(description) LIKE ? ESCAPE '\\' OR LOWER(summary) LIKE ? ESCAPE '\\'"
                + " OR LOWER(tags_json) LIKE ? ESCAPE '\\' OR LOWER(capabilities_json) LIKE ? ESCAPE '\\'";
        String pattern = "%" + escapeLike(keyword.toLowerCase(Locale.ROOT)) + "%";
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 1; i <= 4; i++) {
                ps.setString(i, pattern);
            }
            Set<String> out = new TreeSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw failure("findPluginsMentioning", "keyword=" + keyword, e);
        }
    }

    @Override
    public boolean updateStatistics(String pluginId, PluginStatistics statistics) {
        String sql = "UPDATE " + TABLE_PLUGIN + " SET usage_count=?, success_rate=?, avg_execution_time=? WHERE plugin_id=?";
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, statistics.getUsageCount());
            ps.setDouble(2, statistics.getSuccessRate());
            ps.setDouble(3, statistics.getAverageExecutionTime());
            ps.setString(4, pluginId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("updateStatistics", "pluginId=" + pluginId, e);
        }
    }

    @Override
    public boolean deletePlugin(String pluginId) {
        try (Connection c = connectionProvider.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + TABLE_GOAL + " WHERE plugin_id=?")) {
                    ps.setString(1, pluginId);
                    ps.executeUpdate();
                }
                int removed;
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + TABLE_PLUGIN + " WHERE plugin_id=?")) {
                    ps.setString(1, pluginId);
                    removed = ps.executeUpdate();
                }
                c.commit();
                return removed > 0;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw failure("deletePlugin", "pluginId=" + pluginId, e);
        }
    }

    private IndexedPlugin readPlugin(ResultSet rs) throws SQLException {
        PluginStatistics stats = new PluginStatistics(
                rs.getLong("usage_count"), rs.getDouble("success_rate"), rs.getDouble("avg_execution_time"));
        Timestamp lastIndexed = rs.getTimestamp("last_indexed");
        return new IndexedPlugin(
                rs.getString("plugin_id"),
                rs.getString("description"),
                rs.getString("summary"),
                rs.getString("category"),
                fromJson(rs.getString("tags_json")),
                fromJson(rs.getString("capabilities_json")),
                fromJson(rs.getString("goals_json")),
                rs.getString("content_hash"),
                stats,
                lastIndexed != null ? lastIndexed.toInstant() : null);
    }

    private static List<GoalIndexEntry> readGoals(PreparedStatement ps) throws SQLException {
        List<GoalIndexEntry> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new GoalIndexEntry(rs.getString(1), rs.getString(2), rs.getDouble(3)));
            }
        }
        return out;
    }

    private String toJson(List<String> values) {
        try {
            return mapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new DiscoveryStoreException("toJson", "Cannot encode list column: " + e.getMessage(), e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return mapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new DiscoveryStoreException("fromJson", "Cannot decode list column: " + e.getMessage(), e);
        }
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static DiscoveryStoreException failure(String operation, String detail, SQLException e) {
        log.error("Discovery store failed: {} {} error={} SQLState={}", operation, detail, e.getMessage(), e.getSQLState(), e);
        return new DiscoveryStoreException(operation, "Discovery " + operation + " failed: " + e.getMessage(), e);
    }
}
