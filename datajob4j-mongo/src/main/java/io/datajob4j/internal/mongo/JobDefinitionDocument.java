package io.datajob4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for persisted job definitions. The job name is the document id.
 */
@Document(collection = "data_jobs")
public class JobDefinitionDocument {

    @Id
    private String name;

    @Field("schedule_time")
    private String cron;

    @Field("data_source")
    private Map<String, Object> dataSource;

    @Field("processing_script")
    private String transform;

    @Field("consumer_emails")
    private List<String> recipients;

    @Field("created_at")
    private Instant createdAt;

    @Field(name = "last_run", write = Field.Write.ALWAYS)
    private Instant lastRun;

    public JobDefinitionDocument() {
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public Map<String, Object> getDataSource() {
        return dataSource;
    }

    public void setDataSource(Map<String, Object> dataSource) {
        this.dataSource = dataSource;
    }

    public String getTransform() {
        return transform;
    }

    public void setTransform(String transform) {
        this.transform = transform;
    }

    public List<String> getRecipients() {
        return recipients;
    }

    public void setRecipients(List<String> recipients) {
        this.recipients = recipients;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }
}
