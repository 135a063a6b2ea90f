package io.a2a.extras.taskengine;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "a2a.taskengine")
public class A2aTaskEngineProperties {

    private boolean enabled = true;
    private Backend backend = Backend.MEMORY;
    private int batchSize = 100;
    private JdbcProperties jdbc = new JdbcProperties();
    private CacheProperties cache = new CacheProperties();
    private PushProperties push = new PushProperties();

    public enum Backend {
        MEMORY,
        JDBC
    }

    @Data
    public static class JdbcProperties {
        /**
         * When set, the engine owns a private connection pool instead of using the application DataSource.
         */
        private String url;
        private String username;
        private String password;
        private int poolMin = 2;
        private int poolMax = 10;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration commandTimeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofMillis(200);
        private double retryBackoffMultiplier = 2.0;
        private Duration retryMaxDelay = Duration.ofSeconds(5);
        private boolean autoMigrate = false;
    }

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private int ttlMinutes = 60;
        private int maxSize = 1000;
        private boolean recordStats = true;
    }

    @Data
    public static class PushProperties {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(10);
        private int dispatcherThreads = 4;
        private String globalWebhookUrl;
        private String globalWebhookToken;
    }
}
