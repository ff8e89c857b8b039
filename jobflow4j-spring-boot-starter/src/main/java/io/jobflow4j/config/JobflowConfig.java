package io.jobflow4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobflow4j.JobFunction;
import io.jobflow4j.Jobflow;
import io.jobflow4j.core.JobFunctionRegistry;
import io.jobflow4j.internal.DefaultJobflow;
import io.jobflow4j.internal.file.FileJobStore;
import io.jobflow4j.internal.jdbc.SqliteJobStore;
import io.jobflow4j.internal.mongo.MongoJobStore;
import io.jobflow4j.store.JobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for Jobflow components.
 *
 * <p>The job store follows {@code jobflow.storage.type}: {@code sqlite} (default), {@code file}
 * or {@code mongo}. The mongo store needs a {@link MongoTemplate} bean.
 */
@AutoConfiguration
@ConditionalOnClass(Jobflow.class)
@EnableConfigurationProperties(JobflowProperties.class)
@ConditionalOnProperty(prefix = "jobflow", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobflowConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(JobflowProperties props,
                             ObjectMapper objectMapper,
                             ObjectProvider<MongoTemplate> mongoTemplate) {
        JobflowProperties.Storage storage = props.getStorage();
        return switch (storage.getType()) {
            case SQLITE -> new SqliteJobStore(Path.of(storage.resolvedPath()), objectMapper);
            case FILE -> new FileJobStore(Path.of(storage.resolvedPath()), objectMapper);
            case MONGO -> new MongoJobStore(mongoTemplate.getIfAvailable(() -> {
                throw new IllegalStateException("jobflow.storage.type=mongo requires a MongoTemplate bean");
            }), objectMapper);
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public JobFunctionRegistry jobFunctionRegistry(ObjectProvider<List<JobFunction>> functionsProvider) {
        List<JobFunction> functions = functionsProvider.getIfAvailable(List::of);
        return new JobFunctionRegistry(functions);
    }

    @Bean
    @ConditionalOnMissingBean
    public Jobflow jobflow(JobflowProperties props, JobStore jobStore, JobFunctionRegistry registry, ObjectMapper om) {
        return new DefaultJobflow(props, jobStore, registry, om);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobflowLifecycle jobflowLifecycle(Jobflow jobflow) {
        return new JobflowLifecycle(jobflow);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "jobflow.storage", name = "type", havingValue = "mongo")
    static class MongoIndexConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MongoTemplate.class)
        protected JobflowMongoIndexConfig jobflowMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new JobflowMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "jobflow.storage", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton jobflowIndexesInitializer(ObjectProvider<JobflowMongoIndexConfig> indexConfig) {
            return () -> indexConfig.ifAvailable(JobflowMongoIndexConfig::ensureIndexes);
        }
    }
}
