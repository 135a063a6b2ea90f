package io.a2a.extras.taskengine.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.a2a.extras.taskengine.A2aTaskEngineProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the private Hikari pool used when {@code a2a.taskengine.jdbc.url} is configured.
 */
@Slf4j
public final class JdbcDataSourceFactory {

    static final String POOL_NAME = "a2a-taskengine";

    private JdbcDataSourceFactory() {
    }

    public static HikariDataSource create(A2aTaskEngineProperties.JdbcProperties jdbc) {
        if (jdbc.getPoolMin() < 0 || jdbc.getPoolMax() < 1 || jdbc.getPoolMin() > jdbc.getPoolMax()) {
            throw new IllegalStateException("Invalid pool bounds: min=" + jdbc.getPoolMin() + ", max=" + jdbc.getPoolMax());
        }
        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setJdbcUrl(jdbc.getUrl());
        config.setUsername(jdbc.getUsername());
        config.setPassword(jdbc.getPassword());
        config.setMinimumIdle(jdbc.getPoolMin());
        config.setMaximumPoolSize(jdbc.getPoolMax());
        config.setConnectionTimeout(jdbc.getConnectTimeout().toMillis());
        config.setAutoCommit(true);
        log.info("Creating A2A task engine connection pool (min={}, max={})", jdbc.getPoolMin(), jdbc.getPoolMax());
        return new HikariDataSource(config);
    }
}
