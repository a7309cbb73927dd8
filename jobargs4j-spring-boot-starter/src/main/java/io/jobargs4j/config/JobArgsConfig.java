package io.jobargs4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobargs4j.JobWorker;
import io.jobargs4j.TypedJobs;
import io.jobargs4j.core.ArgumentCodec;
import io.jobargs4j.core.SchemaRegistry;
import io.jobargs4j.core.WorkerRegistry;
import io.jobargs4j.internal.DefaultTypedJobs;
import io.jobargs4j.internal.memory.InMemoryJobBroker;
import io.jobargs4j.internal.mongo.MongoJobBroker;
import io.jobargs4j.internal.mongo.MongoJobRunner;
import io.jobargs4j.internal.mongo.MongoJobStore;
import io.jobargs4j.spi.JobBroker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for typed jobs backed by MongoDB.
 */
@AutoConfiguration
@ConditionalOnClass({TypedJobs.class, MongoTemplate.class})
@EnableConfigurationProperties(JobArgsProperties.class)
@ConditionalOnProperty(prefix = "jobargs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobArgsConfig {

    @Bean
    @ConditionalOnMissingBean
    public SchemaRegistry schemaRegistry(ObjectProvider<ObjectMapper> objectMapper) {
        return new SchemaRegistry(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ArgumentCodec argumentCodec(ObjectProvider<ObjectMapper> objectMapper, SchemaRegistry schemaRegistry) {
        return new ArgumentCodec(objectMapper.getIfAvailable(ObjectMapper::new), schemaRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerRegistry workerRegistry(ObjectProvider<List<JobWorker<?>>> workersProvider) {
        List<JobWorker<?>> workers = workersProvider.getIfAvailable(List::of);
        return new WorkerRegistry(workers);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected JobArgsMongoIndexConfig jobArgsMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new JobArgsMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobBroker jobBroker(MongoJobStore jobStore, ArgumentCodec codec) {
        return new MongoJobBroker(jobStore, codec);
    }

    @Bean
    @ConditionalOnMissingBean
    public TypedJobs typedJobs(WorkerRegistry workerRegistry, JobBroker broker, SchemaRegistry schemaRegistry, ArgumentCodec codec) {
        DefaultTypedJobs typedJobs = new DefaultTypedJobs(workerRegistry, broker, schemaRegistry, codec);
        if (broker instanceof InMemoryJobBroker memory && !memory.hasDispatcher()) {
            memory.attach(typedJobs);
        }
        return typedJobs;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "jobargs", name = "process-jobs", havingValue = "true", matchIfMissing = true)
    public MongoJobRunner mongoJobRunner(JobArgsProperties props, MongoJobStore jobStore, TypedJobs typedJobs, ArgumentCodec codec) {
        return new MongoJobRunner(props, jobStore, typedJobs, codec);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "jobargs", name = "process-jobs", havingValue = "true", matchIfMissing = true)
    public JobArgsLifecycle jobArgsLifecycle(MongoJobRunner runner) {
        return new JobArgsLifecycle(runner);
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobargs", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton jobArgsIndexesInitializer(JobArgsMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
