package io.a2a.extras.taskengine.jdbc;

import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;

import javax.sql.DataSource;
import java.sql.DatabaseMetaData;

/**
 * Databases the durable backend ships a schema for.
 */
public enum DatabasePlatform {

    POSTGRESQL("jdbc:postgresql:", "classpath:db/a2a-taskengine/schema-postgresql.sql") {
        @Override
        public JsonbAdapter jsonbAdapter() {
            return new JsonbAdapter.PostgresJsonbAdapter();
        }
    },
    H2("jdbc:h2:", "classpath:db/a2a-taskengine/schema-h2.sql") {
        @Override
        public JsonbAdapter jsonbAdapter() {
            return new JsonbAdapter.TextJsonbAdapter();
        }
    };

    private final String urlPrefix;
    private final String schemaLocation;

    DatabasePlatform(String urlPrefix, String schemaLocation) {
        this.urlPrefix = urlPrefix;
        this.schemaLocation = schemaLocation;
    }

    public abstract JsonbAdapter jsonbAdapter();

    public String schemaLocation() {
        return schemaLocation;
    }

    public static DatabasePlatform fromJdbcUrl(String jdbcUrl) {
        if (jdbcUrl != null) {
            for (DatabasePlatform platform : values()) {
                if (jdbcUrl.startsWith(platform.urlPrefix)) {
                    return platform;
                }
            }
        }
        throw new IllegalStateException("Unsupported database for the A2A task engine: " + jdbcUrl);
    }

    public static DatabasePlatform detect(DataSource dataSource) {
        try {
            String url = JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getURL);
            return fromJdbcUrl(url);
        } catch (MetaDataAccessException e) {
            throw new IllegalStateException("Unable to detect database platform", e);
        }
    }
}
