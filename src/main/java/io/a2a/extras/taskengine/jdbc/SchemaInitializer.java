package io.a2a.extras.taskengine.jdbc;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Applies the bundled schema script. Every statement is {@code IF NOT EXISTS}, so running it
 * against an initialized database is a no-op.
 */
@Slf4j
public class SchemaInitializer {

    private final DataSource dataSource;
    private final DatabasePlatform platform;

    public SchemaInitializer(DataSource dataSource, DatabasePlatform platform) {
        this.dataSource = dataSource;
        this.platform = platform;
    }

    public void initialize() {
        Resource script = new DefaultResourceLoader().getResource(platform.schemaLocation());
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(script);
        populator.setSqlScriptEncoding("UTF-8");
        DatabasePopulatorUtils.execute(populator, dataSource);
        log.info("Applied A2A task engine schema for {}", platform);
    }
}
