package io.a2a.extras.taskengine.repository;

import io.a2a.extras.taskengine.jdbc.JsonUtils;
import io.a2a.extras.taskengine.jdbc.JsonbAdapter;
import io.a2a.extras.taskengine.model.Task;
import io.a2a.extras.taskengine.model.TaskState;
import io.a2a.extras.taskengine.model.TaskStatus;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class TaskRepository {

    private static final String TASK_COLUMNS = """
            id, context_id, kind, state, state_timestamp, history, artifacts, metadata, created_at, updated_at
            """;

    private static final String INSERT_TASK_SQL = """
            INSERT INTO a2a_tasks
            (id, context_id, kind, state, state_timestamp, history, artifacts, metadata, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_TASK_SQL = """
            UPDATE a2a_tasks
            SET state = ?, state_timestamp = ?, history = ?, artifacts = ?, metadata = ?, updated_at = ?
            WHERE id = ?
            """;

    private static final String SELECT_TASK_BY_ID = "SELECT " + TASK_COLUMNS + " FROM a2a_tasks WHERE id = ?";

    private static final String SELECT_TASK_BY_ID_FOR_UPDATE = SELECT_TASK_BY_ID + " FOR UPDATE";

    private static final String SELECT_TASKS = "SELECT " + TASK_COLUMNS + """
             FROM a2a_tasks
            ORDER BY created_at DESC, id DESC
            """;

    private static final String SELECT_TASKS_BY_CONTEXT = "SELECT " + TASK_COLUMNS + """
             FROM a2a_tasks
            WHERE context_id = ?
            ORDER BY created_at DESC, id DESC
            """;

    private static final String SELECT_TASKS_BY_CONTEXT_AND_STATES = "SELECT " + TASK_COLUMNS + """
             FROM a2a_tasks
            WHERE context_id = ? AND state IN (%s)
            ORDER BY created_at DESC, id DESC
            """;

    private static final String LOCK_TASK_IDS_BY_CONTEXT =
            "SELECT id FROM a2a_tasks WHERE context_id = ? FOR UPDATE";

    private static final String DELETE_TASKS_BY_CONTEXT = "DELETE FROM a2a_tasks WHERE context_id = ?";

    private static final String DELETE_ALL_TASKS = "DELETE FROM a2a_tasks";

    private final JdbcTemplate jdbcTemplate;
    private final JsonbAdapter jsonbAdapter;
    private final RowMapper<Task> rowMapper = new TaskRowMapper();

    public TaskRepository(JdbcTemplate jdbcTemplate, JsonbAdapter jsonbAdapter) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonbAdapter = jsonbAdapter;
    }

    public void insert(Task task) {
        jdbcTemplate.update(
                INSERT_TASK_SQL,
                task.id(),
                task.contextId(),
                task.kind(),
                task.state().asString(),
                task.status().timestamp(),
                jsonbAdapter.adapt(JsonUtils.toJson(task.history())),
                jsonbAdapter.adapt(JsonUtils.toJson(task.artifacts())),
                jsonbAdapter.adapt(JsonUtils.toJson(task.metadata())),
                task.createdAt(),
                task.updatedAt()
        );
    }

    public void update(Task task) {
        jdbcTemplate.update(
                UPDATE_TASK_SQL,
                task.state().asString(),
                task.status().timestamp(),
                jsonbAdapter.adapt(JsonUtils.toJson(task.history())),
                jsonbAdapter.adapt(JsonUtils.toJson(task.artifacts())),
                jsonbAdapter.adapt(JsonUtils.toJson(task.metadata())),
                task.updatedAt(),
                task.id()
        );
    }

    public Optional<Task> findById(UUID taskId) {
        return queryForOptional(SELECT_TASK_BY_ID, taskId);
    }

    /**
     * Loads the task and holds its row lock until the surrounding transaction ends.
     */
    public Optional<Task> findByIdForUpdate(UUID taskId) {
        return queryForOptional(SELECT_TASK_BY_ID_FOR_UPDATE, taskId);
    }

    public List<Task> findAll(Integer limit) {
        return jdbcTemplate.query(withLimit(SELECT_TASKS, limit), rowMapper);
    }

    public List<Task> findByContextId(UUID contextId, Integer limit) {
        return jdbcTemplate.query(withLimit(SELECT_TASKS_BY_CONTEXT, limit), rowMapper, contextId);
    }

    public List<Task> findByContextIdAndStates(UUID contextId, Collection<TaskState> states, Integer limit) {
        String placeholders = String.join(", ", Collections.nCopies(states.size(), "?"));
        List<Object> args = new ArrayList<>(states.size() + 1);
        args.add(contextId);
        states.forEach(state -> args.add(state.asString()));
        return jdbcTemplate.query(withLimit(SELECT_TASKS_BY_CONTEXT_AND_STATES.formatted(placeholders), limit),
                rowMapper, args.toArray());
    }

    public List<UUID> lockIdsByContextId(UUID contextId) {
        return jdbcTemplate.query(LOCK_TASK_IDS_BY_CONTEXT, (rs, rowNum) -> rs.getObject("id", UUID.class), contextId);
    }

    public int deleteByContextId(UUID contextId) {
        return jdbcTemplate.update(DELETE_TASKS_BY_CONTEXT, contextId);
    }

    public void deleteAll() {
        jdbcTemplate.update(DELETE_ALL_TASKS);
    }

    private Optional<Task> queryForOptional(String sql, Object... args) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(sql, rowMapper, args));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    static String withLimit(String sql, Integer limit) {
        return limit == null ? sql : sql + " LIMIT " + limit;
    }

    private static class TaskRowMapper implements RowMapper<Task> {
        @Override
        public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Task.Builder()
                    .id(rs.getObject("id", UUID.class))
                    .contextId(rs.getObject("context_id", UUID.class))
                    .kind(rs.getString("kind"))
                    .status(new TaskStatus(
                            TaskState.fromString(rs.getString("state")),
                            rs.getObject("state_timestamp", OffsetDateTime.class)))
                    .history(JsonUtils.fromJson(rs.getString("history"), JsonUtils.MESSAGE_LIST_TYPE).orElse(List.of()))
                    .artifacts(JsonUtils.fromJson(rs.getString("artifacts"), JsonUtils.ARTIFACT_LIST_TYPE).orElse(List.of()))
                    .metadata(JsonUtils.fromJson(rs.getString("metadata"), JsonUtils.MAP_TYPE).orElse(Map.of()))
                    .createdAt(rs.getObject("created_at", OffsetDateTime.class))
                    .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
                    .build();
        }
    }
}
