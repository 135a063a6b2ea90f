package io.a2a.extras.taskengine.repository;

import io.a2a.extras.taskengine.jdbc.JsonUtils;
import io.a2a.extras.taskengine.jdbc.JsonbAdapter;
import io.a2a.extras.taskengine.model.TaskFeedback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class FeedbackRepository {

    private static final String INSERT_FEEDBACK_SQL = """
            INSERT INTO a2a_task_feedback (id, task_id, feedback_data, created_at)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SELECT_FEEDBACK_BY_TASK = """
            SELECT id, task_id, feedback_data, created_at
            FROM a2a_task_feedback
            WHERE task_id = ?
            ORDER BY created_at, seq
            """;

    private final JdbcTemplate jdbcTemplate;
    private final JsonbAdapter jsonbAdapter;

    public FeedbackRepository(JdbcTemplate jdbcTemplate, JsonbAdapter jsonbAdapter) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonbAdapter = jsonbAdapter;
    }

    public void insert(TaskFeedback feedback) {
        jdbcTemplate.update(
                INSERT_FEEDBACK_SQL,
                feedback.id(),
                feedback.taskId(),
                jsonbAdapter.adapt(JsonUtils.toJson(feedback.feedbackData())),
                feedback.createdAt()
        );
    }

    public List<TaskFeedback> findByTaskId(UUID taskId) {
        return jdbcTemplate.query(SELECT_FEEDBACK_BY_TASK, (rs, rowNum) -> new TaskFeedback(
                rs.getObject("id", UUID.class),
                rs.getObject("task_id", UUID.class),
                JsonUtils.fromJson(rs.getString("feedback_data"), JsonUtils.MAP_TYPE).orElse(Map.of()),
                rs.getObject("created_at", OffsetDateTime.class)
        ), taskId);
    }
}
