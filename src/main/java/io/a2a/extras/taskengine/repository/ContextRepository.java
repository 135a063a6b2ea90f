package io.a2a.extras.taskengine.repository;

import io.a2a.extras.taskengine.jdbc.JsonUtils;
import io.a2a.extras.taskengine.jdbc.JsonbAdapter;
import io.a2a.extras.taskengine.model.Context;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class ContextRepository {

    private static final String INSERT_IF_ABSENT_SQL = """
            INSERT INTO a2a_contexts (id, context_data, message_history, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

    private static final String UPDATE_CONTEXT_SQL = """
            UPDATE a2a_contexts
            SET context_data = ?, message_history = ?, updated_at = ?
            WHERE id = ?
            """;

    private static final String SELECT_CONTEXT_BY_ID =
            "SELECT id, context_data, message_history, created_at, updated_at FROM a2a_contexts WHERE id = ?";

    private static final String SELECT_CONTEXT_BY_ID_FOR_UPDATE = SELECT_CONTEXT_BY_ID + " FOR UPDATE";

    private static final String SELECT_CONTEXTS = """
            SELECT id, context_data, message_history, created_at, updated_at
            FROM a2a_contexts
            ORDER BY created_at DESC, id DESC
            """;

    private static final String DELETE_CONTEXT_SQL = "DELETE FROM a2a_contexts WHERE id = ?";

    private static final String DELETE_ALL_CONTEXTS = "DELETE FROM a2a_contexts";

    private final JdbcTemplate jdbcTemplate;
    private final JsonbAdapter jsonbAdapter;
    private final RowMapper<Context> rowMapper = new ContextRowMapper();

    public ContextRepository(JdbcTemplate jdbcTemplate, JsonbAdapter jsonbAdapter) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonbAdapter = jsonbAdapter;
    }

    /**
     * @return {@code true} when the row was created, {@code false} when it already existed
     */
    public boolean insertIfAbsent(Context context) {
        return jdbcTemplate.update(
                INSERT_IF_ABSENT_SQL,
                context.id(),
                jsonbAdapter.adapt(JsonUtils.toJson(context.contextData())),
                jsonbAdapter.adapt(JsonUtils.toJson(context.messageHistory())),
                context.createdAt(),
                context.updatedAt()
        ) > 0;
    }

    public void update(Context context) {
        jdbcTemplate.update(
                UPDATE_CONTEXT_SQL,
                jsonbAdapter.adapt(JsonUtils.toJson(context.contextData())),
                jsonbAdapter.adapt(JsonUtils.toJson(context.messageHistory())),
                context.updatedAt(),
                context.id()
        );
    }

    public Optional<Context> findById(UUID contextId) {
        return queryForOptional(SELECT_CONTEXT_BY_ID, contextId);
    }

    public Optional<Context> findByIdForUpdate(UUID contextId) {
        return queryForOptional(SELECT_CONTEXT_BY_ID_FOR_UPDATE, contextId);
    }

    public List<Context> findAll(Integer limit) {
        return jdbcTemplate.query(TaskRepository.withLimit(SELECT_CONTEXTS, limit), rowMapper);
    }

    public boolean delete(UUID contextId) {
        return jdbcTemplate.update(DELETE_CONTEXT_SQL, contextId) > 0;
    }

    public void deleteAll() {
        jdbcTemplate.update(DELETE_ALL_CONTEXTS);
    }

    private Optional<Context> queryForOptional(String sql, Object... args) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(sql, rowMapper, args));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    private static class ContextRowMapper implements RowMapper<Context> {
        @Override
        public Context mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Context(
                    rs.getObject("id", UUID.class),
                    JsonUtils.fromJson(rs.getString("context_data"), JsonUtils.MAP_TYPE).orElse(Map.of()),
                    JsonUtils.fromJson(rs.getString("message_history"), JsonUtils.MESSAGE_LIST_TYPE).orElse(List.of()),
                    rs.getObject("created_at", OffsetDateTime.class),
                    rs.getObject("updated_at", OffsetDateTime.class)
            );
        }
    }
}
