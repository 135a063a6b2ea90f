package io.a2a.extras.taskengine.jdbc;

import io.a2a.extras.taskengine.A2aTaskEngineProperties;
import io.a2a.extras.taskengine.repository.ContextRepository;
import io.a2a.extras.taskengine.repository.FeedbackRepository;
import io.a2a.extras.taskengine.repository.TaskRepository;
import io.a2a.extras.taskengine.repository.WebhookConfigRepository;
import io.a2a.extras.taskengine.storage.JdbcStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Wires a {@link JdbcStorage} over a {@link DataSource}: platform detection, optional schema
 * migration, statement and transaction timeouts and the retry policy.
 */
@Slf4j
public final class JdbcStorageFactory {

    private JdbcStorageFactory() {
    }

    /**
     * @param finalizedTasks cache for tasks in a final state, may be null
     * @param ownedResource  closed together with the storage, e.g. a private pool; may be null
     */
    public static JdbcStorage create(DataSource dataSource,
                                     A2aTaskEngineProperties properties,
                                     Cache finalizedTasks,
                                     Clock clock,
                                     AutoCloseable ownedResource) {
        A2aTaskEngineProperties.JdbcProperties jdbc = properties.getJdbc();
        DatabasePlatform platform = DatabasePlatform.detect(dataSource);
        if (jdbc.isAutoMigrate()) {
            new SchemaInitializer(dataSource, platform).initialize();
        }

        int commandTimeoutSeconds = (int) Math.max(1, jdbc.getCommandTimeout().toSeconds());
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(commandTimeoutSeconds);
        jdbcTemplate.setFetchSize(properties.getBatchSize());

        DataSourceTransactionManager transactionManager = new DataSourceTransactionManager(dataSource);
        TransactionTemplate transactions = new TransactionTemplate(transactionManager);
        transactions.setTimeout(commandTimeoutSeconds);
        TransactionTemplate readOnlyTransactions = new TransactionTemplate(transactionManager);
        readOnlyTransactions.setTimeout(commandTimeoutSeconds);
        readOnlyTransactions.setReadOnly(true);

        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxRetries(jdbc.getMaxRetries())
                .initialDelay(jdbc.getRetryDelay())
                .backoffMultiplier(jdbc.getRetryBackoffMultiplier())
                .maxDelay(jdbc.getRetryMaxDelay())
                .build();

        JsonbAdapter jsonbAdapter = platform.jsonbAdapter();
        log.info("Using JDBC task storage on {} with {}", platform, retryPolicy);
        return new JdbcStorage(
                new TaskRepository(jdbcTemplate, jsonbAdapter),
                new ContextRepository(jdbcTemplate, jsonbAdapter),
                new FeedbackRepository(jdbcTemplate, jsonbAdapter),
                new WebhookConfigRepository(jdbcTemplate, jsonbAdapter),
                new JdbcOperationExecutor(transactions, readOnlyTransactions, retryPolicy),
                finalizedTasks,
                clock,
                ownedResource
        );
    }
}
