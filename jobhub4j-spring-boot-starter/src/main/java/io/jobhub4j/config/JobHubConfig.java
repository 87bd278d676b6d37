package io.jobhub4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhub4j.JobHandler;
import io.jobhub4j.JobManager;
import io.jobhub4j.core.JobHandlerRegistry;
import io.jobhub4j.core.JobRepository;
import io.jobhub4j.core.NoopJobRepository;
import io.jobhub4j.events.JobEventStream;
import io.jobhub4j.handlers.ProcessJobHandler;
import io.jobhub4j.internal.DefaultJobManager;
import io.jobhub4j.internal.mongo.MongoJobRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;
import java.util.Locale;

/**
 * Spring Boot auto-configuration entrypoint for JobHub components.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(JobManager.class)
@ConditionalOnProperty(prefix = "jobhub", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobHubConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "jobhub")
    public JobHubProperties jobHubProperties() {
        return new JobHubProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "jobhub", name = "process-handler-enabled", havingValue = "true", matchIfMissing = true)
    public ProcessJobHandler processJobHandler() {
        return new ProcessJobHandler();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    /**
     * {@code jobhub.persistence=none} keeps everything in memory; {@code mongo} stores jobs and history
     * through the application's {@link MongoTemplate}.
     */
    @Bean
    @ConditionalOnMissingBean
    public JobRepository jobRepository(JobHubProperties props, ObjectProvider<MongoTemplate> mongoTemplate) {
        String persistence = props.getPersistence() == null ? "none" : props.getPersistence().trim().toLowerCase(Locale.ROOT);
        return switch (persistence) {
            case "none", "" -> NoopJobRepository.INSTANCE;
            case "mongo" -> {
                MongoTemplate template = mongoTemplate.getIfAvailable();
                if (template == null) {
                    throw new IllegalStateException("jobhub.persistence=mongo requires a MongoTemplate bean");
                }
                yield new MongoJobRepository(template);
            }
            default -> throw new IllegalStateException("unknown jobhub.persistence: " + props.getPersistence());
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public JobManager jobManager(JobHubProperties props,
                                 JobHandlerRegistry registry,
                                 JobRepository repository,
                                 ObjectProvider<ObjectMapper> objectMapper) {
        return new DefaultJobManager(props, registry, objectMapper.getIfAvailable(ObjectMapper::new), repository);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobEventStream jobEventStream(JobManager jobManager,
                                         JobHubProperties props,
                                         ObjectProvider<ObjectMapper> objectMapper) {
        return new JobEventStream(jobManager, objectMapper.getIfAvailable(ObjectMapper::new), props.getKeepAliveInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHubLifecycle jobHubLifecycle(JobManager jobManager, JobHubProperties props) {
        return new JobHubLifecycle(jobManager, props);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "jobhub", name = "persistence", havingValue = "mongo")
    static class MongoIndexConfig {

        @Bean
        @ConditionalOnMissingBean
        public JobHubMongoIndexConfig jobHubMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new JobHubMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "jobhub", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton jobHubIndexesInitializer(JobHubMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }
}
