package io.a2a.extras.taskengine.repository;

import io.a2a.extras.taskengine.jdbc.JsonUtils;
import io.a2a.extras.taskengine.jdbc.JsonbAdapter;
import io.a2a.extras.taskengine.model.PushNotificationConfig;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public class WebhookConfigRepository {

    private static final String INSERT_IF_ABSENT_SQL = """
            INSERT INTO a2a_webhook_configs (task_id, config, created_at, updated_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

    private static final String UPDATE_CONFIG_SQL =
            "UPDATE a2a_webhook_configs SET config = ?, updated_at = ? WHERE task_id = ?";

    private static final String SELECT_CONFIG_BY_TASK =
            "SELECT task_id, config FROM a2a_webhook_configs WHERE task_id = ?";

    private static final String SELECT_ALL_CONFIGS =
            "SELECT task_id, config FROM a2a_webhook_configs ORDER BY created_at";

    private static final String DELETE_CONFIG_SQL = "DELETE FROM a2a_webhook_configs WHERE task_id = ?";

    private static final String DELETE_CONFIGS_BY_CONTEXT = """
            DELETE FROM a2a_webhook_configs
            WHERE task_id IN (SELECT id FROM a2a_tasks WHERE context_id = ?)
            """;

    private static final String DELETE_ALL_CONFIGS = "DELETE FROM a2a_webhook_configs";

    private final JdbcTemplate jdbcTemplate;
    private final JsonbAdapter jsonbAdapter;

    public WebhookConfigRepository(JdbcTemplate jdbcTemplate, JsonbAdapter jsonbAdapter) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonbAdapter = jsonbAdapter;
    }

    /**
     * Insert-or-replace. Must run inside a transaction.
     */
    public void save(UUID taskId, PushNotificationConfig config, OffsetDateTime now) {
        Object json = jsonbAdapter.adapt(JsonUtils.toJson(config));
        int inserted = jdbcTemplate.update(INSERT_IF_ABSENT_SQL, taskId, json, now, now);
        if (inserted == 0) {
            jdbcTemplate.update(UPDATE_CONFIG_SQL, json, now, taskId);
        }
    }

    public Optional<PushNotificationConfig> findByTaskId(UUID taskId) {
        List<PushNotificationConfig> configs = jdbcTemplate.query(SELECT_CONFIG_BY_TASK,
                (rs, rowNum) -> JsonUtils.fromJson(rs.getString("config"), JsonUtils.WEBHOOK_CONFIG_TYPE).orElse(null),
                taskId);
        return configs.stream().filter(Objects::nonNull).findFirst();
    }

    public Map<UUID, PushNotificationConfig> findAll() {
        Map<UUID, PushNotificationConfig> configs = new LinkedHashMap<>();
        jdbcTemplate.query(SELECT_ALL_CONFIGS, rs -> {
            UUID taskId = rs.getObject("task_id", UUID.class);
            JsonUtils.fromJson(rs.getString("config"), JsonUtils.WEBHOOK_CONFIG_TYPE)
                    .ifPresent(config -> configs.put(taskId, config));
        });
        return configs;
    }

    public void delete(UUID taskId) {
        jdbcTemplate.update(DELETE_CONFIG_SQL, taskId);
    }

    public int deleteByContextId(UUID contextId) {
        return jdbcTemplate.update(DELETE_CONFIGS_BY_CONTEXT, contextId);
    }

    public void deleteAll() {
        jdbcTemplate.update(DELETE_ALL_CONFIGS);
    }
}
