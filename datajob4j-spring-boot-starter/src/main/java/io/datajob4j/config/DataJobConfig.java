package io.datajob4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.datajob4j.JobManager;
import io.datajob4j.JobRegistry;
import io.datajob4j.JobRunner;
import io.datajob4j.Scheduler;
import io.datajob4j.internal.CronScheduler;
import io.datajob4j.internal.DefaultJobManager;
import io.datajob4j.internal.PipelineJobRunner;
import io.datajob4j.internal.fetch.DefaultDataFetcher;
import io.datajob4j.internal.file.FileJobRegistry;
import io.datajob4j.internal.format.CsvResultFormatter;
import io.datajob4j.internal.mongo.MongoJobRegistry;
import io.datajob4j.internal.notify.EmailNotifier;
import io.datajob4j.internal.transform.ScriptTransformRunner;
import io.datajob4j.pipeline.DataFetcher;
import io.datajob4j.pipeline.Notifier;
import io.datajob4j.pipeline.ResultFormatter;
import io.datajob4j.pipeline.TransformRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;

/**
 * Spring Boot auto-configuration entrypoint for the data job runtime.
 *
 * <p>Every bean backs off when the application defines its own, so any pipeline stage can be replaced.
 */
@AutoConfiguration
@ConditionalOnClass(Scheduler.class)
@EnableConfigurationProperties(DataJobProperties.class)
@ConditionalOnProperty(prefix = "datajob", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DataJobConfig {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({MongoTemplate.class, MongoJobRegistry.class})
    @ConditionalOnProperty(prefix = "datajob", name = "registry-type", havingValue = "mongo")
    static class MongoRegistryConfig {

        @Bean
        @ConditionalOnMissingBean(JobRegistry.class)
        public MongoJobRegistry mongoJobRegistry(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
            return new MongoJobRegistry(mongoTemplate, objectMapper);
        }
    }

    @Bean
    @ConditionalOnMissingBean(JobRegistry.class)
    @ConditionalOnProperty(prefix = "datajob", name = "registry-type", havingValue = "file", matchIfMissing = true)
    public FileJobRegistry fileJobRegistry(DataJobProperties props, ObjectMapper objectMapper) {
        return new FileJobRegistry(Path.of(props.getRegistryPath()), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public DataFetcher dataFetcher(DataJobProperties props, ObjectMapper objectMapper) {
        return new DefaultDataFetcher(props, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public TransformRunner transformRunner(DataJobProperties props, ObjectMapper objectMapper) {
        return new ScriptTransformRunner(props, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultFormatter resultFormatter() {
        return new CsvResultFormatter();
    }

    @Bean
    @ConditionalOnMissingBean
    public Notifier notifier(DataJobProperties props) {
        return new EmailNotifier(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRunner jobRunner(DataFetcher fetcher,
                               TransformRunner transformRunner,
                               ResultFormatter formatter,
                               Notifier notifier,
                               JobRegistry registry) {
        return new PipelineJobRunner(fetcher, transformRunner, formatter, notifier, registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(DataJobProperties props, JobRunner runner) {
        return new CronScheduler(props, runner);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobManager jobManager(JobRegistry registry, Scheduler scheduler, JobRunner runner) {
        return new DefaultJobManager(registry, scheduler, runner);
    }

    @Bean
    @ConditionalOnMissingBean
    public DataJobLifecycle dataJobLifecycle(JobManager jobManager, Scheduler scheduler, DataJobProperties props) {
        return new DataJobLifecycle(jobManager, scheduler, props);
    }
}
