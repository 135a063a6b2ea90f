package io.a2a.extras.taskengine.autoconfigure;

import com.zaxxer.hikari.HikariDataSource;
import io.a2a.extras.taskengine.A2aTaskEngineProperties;
import io.a2a.extras.taskengine.cache.CacheConfig;
import io.a2a.extras.taskengine.handler.A2aMethodDispatcher;
import io.a2a.extras.taskengine.handler.A2aRequestHandler;
import io.a2a.extras.taskengine.jdbc.JdbcDataSourceFactory;
import io.a2a.extras.taskengine.jdbc.JdbcStorageFactory;
import io.a2a.extras.taskengine.lifecycle.TaskLifecycleCoordinator;
import io.a2a.extras.taskengine.model.PushNotificationConfig;
import io.a2a.extras.taskengine.push.HttpPushNotificationSender;
import io.a2a.extras.taskengine.push.PushNotificationManager;
import io.a2a.extras.taskengine.push.PushNotificationSender;
import io.a2a.extras.taskengine.storage.InMemoryStorage;
import io.a2a.extras.taskengine.storage.Storage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import javax.sql.DataSource;
import java.net.http.HttpClient;
import java.time.Clock;

@Slf4j
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnProperty(prefix = "a2a.taskengine", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(A2aTaskEngineProperties.class)
@Import(CacheConfig.class)
public class A2aTaskEngineAutoConfiguration {

    public static final String PUSH_EXECUTOR_BEAN = "a2aPushNotificationExecutor";

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Storage a2aTaskEngineStorage(A2aTaskEngineProperties properties,
                                        ObjectProvider<DataSource> dataSource,
                                        @Qualifier(CacheConfig.CACHE_MANAGER_BEAN) ObjectProvider<CacheManager> cacheManager) {
        if (properties.getBackend() == A2aTaskEngineProperties.Backend.MEMORY) {
            log.info("Using in-memory task storage");
            return new InMemoryStorage();
        }

        Cache finalizedTasks = cacheManager.stream()
                .map(manager -> manager.getCache(CacheConfig.TASK_CACHE))
                .findFirst()
                .orElse(null);
        A2aTaskEngineProperties.JdbcProperties jdbc = properties.getJdbc();
        if (StringUtils.hasText(jdbc.getUrl())) {
            HikariDataSource pool = JdbcDataSourceFactory.create(jdbc);
            try {
                return JdbcStorageFactory.create(pool, properties, finalizedTasks, Clock.systemUTC(), pool);
            } catch (RuntimeException e) {
                pool.close();
                throw e;
            }
        }

        DataSource applicationDataSource = dataSource.getIfAvailable();
        if (applicationDataSource == null) {
            throw new IllegalStateException(
                    "a2a.taskengine.backend=jdbc requires a2a.taskengine.jdbc.url or a DataSource bean");
        }
        return JdbcStorageFactory.create(applicationDataSource, properties, finalizedTasks, Clock.systemUTC(), null);
    }

    @Bean(PUSH_EXECUTOR_BEAN)
    @ConditionalOnMissingBean(name = PUSH_EXECUTOR_BEAN)
    public ThreadPoolTaskExecutor a2aPushNotificationExecutor(A2aTaskEngineProperties properties) {
        A2aTaskEngineProperties.PushProperties push = properties.getPush();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("a2a-push-");
        executor.setCorePoolSize(push.getDispatcherThreads());
        executor.setMaxPoolSize(push.getDispatcherThreads());
        executor.setQueueCapacity(1000);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(push.getTimeout().toMillis());
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public PushNotificationSender a2aPushNotificationSender(A2aTaskEngineProperties properties) {
        A2aTaskEngineProperties.PushProperties push = properties.getPush();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(push.getTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(push.getTimeout());
        return new HttpPushNotificationSender(RestClient.builder().requestFactory(requestFactory).build());
    }

    @Bean(initMethod = "initialize")
    @ConditionalOnMissingBean
    public PushNotificationManager a2aPushNotificationManager(
            Storage storage,
            PushNotificationSender sender,
            @Qualifier(PUSH_EXECUTOR_BEAN) ThreadPoolTaskExecutor executor,
            A2aTaskEngineProperties properties) {
        A2aTaskEngineProperties.PushProperties push = properties.getPush();
        PushNotificationConfig globalWebhook = null;
        if (StringUtils.hasText(push.getGlobalWebhookUrl())) {
            globalWebhook = PushNotificationManager.normalize(
                    new PushNotificationConfig(null, push.getGlobalWebhookUrl(), push.getGlobalWebhookToken(), null));
            log.info("Global push notification webhook configured");
        }
        return new PushNotificationManager(storage, sender, executor, globalWebhook, push.isEnabled(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskLifecycleCoordinator a2aTaskLifecycleCoordinator(Storage storage,
                                                                PushNotificationManager pushNotificationManager) {
        return new TaskLifecycleCoordinator(storage, pushNotificationManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public A2aRequestHandler a2aRequestHandler(TaskLifecycleCoordinator coordinator,
                                               PushNotificationManager pushNotificationManager) {
        return new A2aRequestHandler(coordinator, pushNotificationManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public A2aMethodDispatcher a2aMethodDispatcher(A2aRequestHandler handler) {
        return new A2aMethodDispatcher(handler);
    }
}
