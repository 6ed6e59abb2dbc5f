package io.datajob4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.datajob4j.JobManager;
import io.datajob4j.JobRegistry;
import io.datajob4j.Scheduler;
import io.datajob4j.core.Dataset;
import io.datajob4j.internal.CronScheduler;
import io.datajob4j.internal.file.FileJobRegistry;
import io.datajob4j.internal.mongo.MongoJobRegistry;
import io.datajob4j.pipeline.ResultFormatter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class DataJobAutoConfigurationTest {

    @TempDir
    Path dir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(DataJobConfig.class))
                .withBean(ObjectMapper.class, ObjectMapper::new)
                .withPropertyValues(
                        "datajob.registry-path=" + dir.resolve("jobs.json"),
                        "datajob.process-every=500ms",
                        "datajob.misfire-grace-time=1m",
                        "datajob.timezone=Asia/Taipei",
                        "datajob.dry-run=true"
                );
    }

    @Test
    void shouldAutoConfigureRuntimeWithFileRegistry() {
        contextRunner().run(context -> {
            assertThat(context).hasSingleBean(JobManager.class);
            assertThat(context).hasSingleBean(DataJobLifecycle.class);
            assertThat(context).getBean(JobRegistry.class).isInstanceOf(FileJobRegistry.class);
            assertThat(context).getBean(Scheduler.class).isInstanceOf(CronScheduler.class);

            DataJobProperties props = context.getBean(DataJobProperties.class);
            assertThat(props.getProcessEvery()).isEqualTo(Duration.ofMillis(500));
            assertThat(props.getMisfireGraceTime()).isEqualTo(Duration.ofMinutes(1));
            assertThat(props.isDryRun()).isTrue();
            assertThat(context.getBean(DataJobLifecycle.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldUseMongoRegistryWhenSelected() {
        contextRunner()
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .withPropertyValues("datajob.registry-type=mongo")
                .run(context -> {
                    assertThat(context).hasSingleBean(JobRegistry.class);
                    assertThat(context).getBean(JobRegistry.class).isInstanceOf(MongoJobRegistry.class);
                });
    }

    @Test
    void shouldKeepUserDefinedStage() {
        ResultFormatter custom = new ResultFormatter() {
            @Override
            public String format(Dataset dataset) {
                return "custom";
            }

            @Override
            public Dataset parse(String text) {
                return Dataset.empty();
            }
        };

        contextRunner()
                .withBean(ResultFormatter.class, () -> custom)
                .run(context -> assertThat(context.getBean(ResultFormatter.class)).isSameAs(custom));
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner()
                .withPropertyValues("datajob.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(JobManager.class);
                    assertThat(context).doesNotHaveBean(DataJobLifecycle.class);
                });
    }
}
