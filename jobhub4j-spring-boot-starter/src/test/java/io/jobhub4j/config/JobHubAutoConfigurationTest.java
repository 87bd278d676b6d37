package io.jobhub4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhub4j.JobContext;
import io.jobhub4j.JobHandler;
import io.jobhub4j.JobManager;
import io.jobhub4j.core.Job;
import io.jobhub4j.core.JobHandlerRegistry;
import io.jobhub4j.core.JobRepository;
import io.jobhub4j.core.NoopJobRepository;
import io.jobhub4j.core.ScheduleType;
import io.jobhub4j.events.JobEventStream;
import io.jobhub4j.handlers.ProcessJobHandler;
import io.jobhub4j.internal.mongo.MongoJobRepository;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class JobHubAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JobHubConfig.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(DemoJobHandler.class, DemoJobHandler::new)
            .withPropertyValues(
                    "jobhub.tick-interval=500ms",
                    "jobhub.shutdown-timeout=2s"
            );

    @Test
    void shouldAutoConfigureJobHubBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(JobManager.class);
            assertThat(context).hasSingleBean(JobHubLifecycle.class);
            assertThat(context).hasSingleBean(JobHubProperties.class);
            assertThat(context).hasSingleBean(JobEventStream.class);
            assertThat(context).hasSingleBean(ProcessJobHandler.class);
            assertThat(context).doesNotHaveBean(JobHubMongoIndexConfig.class);
            assertThat(context.getBean(JobRepository.class)).isSameAs(NoopJobRepository.INSTANCE);
            assertThat(context.getBean(JobHandlerRegistry.class).types()).containsExactlyInAnyOrder("demo", "process");
            assertThat(context.getBean(JobHubProperties.class).getTickInterval()).isEqualTo(Duration.ofMillis(500));
            assertThat(context.getBean(JobManager.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldRegisterConfiguredJobsOnStartup() {
        contextRunner
                .withPropertyValues(
                        "jobhub.jobs[0].id=database-optimize",
                        "jobhub.jobs[0].name=Database Optimize",
                        "jobhub.jobs[0].type=demo",
                        "jobhub.jobs[0].category=maintenance",
                        "jobhub.jobs[0].tags[0]=database",
                        "jobhub.jobs[1].id=missing-files-check",
                        "jobhub.jobs[1].name=Missing Files Check",
                        "jobhub.jobs[1].type=demo",
                        "jobhub.jobs[1].schedule-type=interval",
                        "jobhub.jobs[1].schedule=1 hour",
                        "jobhub.jobs[1].config.greeting=hello"
                )
                .run(context -> {
                    JobManager manager = context.getBean(JobManager.class);
                    assertThat(manager.getJobs()).extracting(Job::id)
                            .containsExactly("database-optimize", "missing-files-check");

                    Job optimize = manager.getJob("database-optimize");
                    assertThat(optimize.schedule().type()).isEqualTo(ScheduleType.MANUAL);
                    assertThat(optimize.tags()).containsExactly("database");

                    Job missingFiles = manager.getJob("missing-files-check");
                    assertThat(missingFiles.schedule().type()).isEqualTo(ScheduleType.INTERVAL);
                    assertThat(missingFiles.nextRunAt()).isNotNull();
                    assertThat(missingFiles.config()).containsEntry("greeting", "hello");
                });
    }

    @Test
    void invalidConfiguredJobShouldFailStartup() {
        contextRunner
                .withPropertyValues(
                        "jobhub.jobs[0].id=broken",
                        "jobhub.jobs[0].name=Broken",
                        "jobhub.jobs[0].type=no-such-type"
                )
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void mongoPersistenceShouldUseMongoRepository() {
        contextRunner
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .withPropertyValues("jobhub.persistence=mongo")
                .run(context -> {
                    assertThat(context).hasSingleBean(JobHubMongoIndexConfig.class);
                    assertThat(context.getBean(JobRepository.class)).isInstanceOf(MongoJobRepository.class);
                });
    }

    @Test
    void processHandlerCanBeDisabled() {
        contextRunner
                .withPropertyValues("jobhub.process-handler-enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ProcessJobHandler.class);
                    assertThat(context.getBean(JobHandlerRegistry.class).types()).containsExactly("demo");
                });
    }

    @Test
    void disabledPropertyShouldSkipAutoConfiguration() {
        contextRunner
                .withPropertyValues("jobhub.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(JobManager.class));
    }

    static class DemoJobHandler implements JobHandler<Map<String, Object>> {
        @Override
        public String type() {
            return "demo";
        }

        @Override
        @SuppressWarnings("unchecked")
        public Class<Map<String, Object>> configClass() {
            return (Class<Map<String, Object>>) (Class<?>) Map.class;
        }

        @Override
        public void execute(Map<String, Object> config, JobContext context) {
            // no-op for context bootstrap test
        }
    }
}
