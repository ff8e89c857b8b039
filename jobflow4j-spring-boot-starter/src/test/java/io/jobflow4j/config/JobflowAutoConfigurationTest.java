package io.jobflow4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobflow4j.JobFunction;
import io.jobflow4j.Jobflow;
import io.jobflow4j.core.JobFunctionRegistry;
import io.jobflow4j.internal.file.FileJobStore;
import io.jobflow4j.internal.jdbc.SqliteJobStore;
import io.jobflow4j.internal.mongo.MongoJobStore;
import io.jobflow4j.store.JobStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class JobflowAutoConfigurationTest {

    @TempDir
    Path tempDir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(JobflowConfig.class))
                .withBean(ObjectMapper.class, ObjectMapper::new)
                .withBean(JobFunction.class, DemoFunction::new)
                .withPropertyValues(
                        "jobflow.executor.max-workers=2",
                        "jobflow.cleanup.enabled=false"
                );
    }

    @Test
    void shouldAutoConfigureJobflowBeans() {
        contextRunner()
                .withPropertyValues(
                        "jobflow.storage.type=file",
                        "jobflow.storage.path=" + tempDir.resolve("jobs"))
                .run(context -> {
                    assertThat(context).hasSingleBean(Jobflow.class);
                    assertThat(context).hasSingleBean(JobflowLifecycle.class);
                    assertThat(context).hasSingleBean(JobflowProperties.class);
                    assertThat(context).getBean(JobStore.class).isInstanceOf(FileJobStore.class);
                    assertThat(context).doesNotHaveBean(JobflowMongoIndexConfig.class);

                    JobflowProperties props = context.getBean(JobflowProperties.class);
                    assertThat(props.getExecutor().getMaxWorkers()).isEqualTo(2);
                    assertThat(context.getBean(JobFunctionRegistry.class).find("demo::main")).isPresent();
                    assertThat(context.getBean(Jobflow.class).isRunning()).isTrue();
                });
    }

    @Test
    void shouldUseSqliteStoreByDefault() {
        contextRunner()
                .withPropertyValues("jobflow.storage.path=" + tempDir.resolve("jobs.db"))
                .run(context -> assertThat(context).getBean(JobStore.class).isInstanceOf(SqliteJobStore.class));
    }

    @Test
    void shouldUseMongoStoreWhenConfigured() {
        contextRunner()
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .withPropertyValues("jobflow.storage.type=mongo", "jobflow.scheduler.enabled=false")
                .run(context -> {
                    assertThat(context).getBean(JobStore.class).isInstanceOf(MongoJobStore.class);
                    assertThat(context).hasSingleBean(JobflowMongoIndexConfig.class);
                });
    }

    @Test
    void shouldFailWhenMongoStoreHasNoTemplate() {
        contextRunner()
                .withPropertyValues("jobflow.storage.type=mongo")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner()
                .withPropertyValues("jobflow.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(Jobflow.class);
                    assertThat(context).doesNotHaveBean(JobflowLifecycle.class);
                });
    }

    static class DemoFunction implements JobFunction {
        @Override
        public String name() {
            return "demo::main";
        }

        @Override
        public Object call(Map<String, Object> parameters) {
            return "ok";
        }
    }
}
