package io.datajob4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.datajob4j.JobRegistry;
import io.datajob4j.core.DataSource;
import io.datajob4j.core.JobDefinition;
import io.datajob4j.core.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB job registry. One document per job in {@code data_jobs}, keyed by job name.
 *
 * <p>Every call maps to a single document operation, so concurrent writers never lose each other's updates.
 * Documents that no longer form a valid definition are skipped on read and left untouched.
 */
public class MongoJobRegistry implements JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(MongoJobRegistry.class);

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobRegistry(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public List<JobDefinition> findAll() {
        List<JobDefinitionDocument> docs = access("list jobs", () ->
                mongoTemplate.find(new Query().with(Sort.by("createdAt", "name")), JobDefinitionDocument.class));
        List<JobDefinition> jobs = new ArrayList<>(docs.size());
        for (JobDefinitionDocument doc : docs) {
            JobDefinition job = toJob(doc);
            if (job != null) {
                jobs.add(job);
            }
        }
        return jobs;
    }

    @Override
    public Optional<JobDefinition> find(String name) {
        Objects.requireNonNull(name, "name must not be null");
        JobDefinitionDocument doc = access("find job " + name, () ->
                mongoTemplate.findById(name.trim(), JobDefinitionDocument.class));
        return doc == null ? Optional.empty() : Optional.ofNullable(toJob(doc));
    }

    @Override
    public boolean exists(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return access("check job " + name, () -> mongoTemplate.exists(byName(name), JobDefinitionDocument.class));
    }

    /**
     * Plain insert. The {@code _id} unique index turns a taken name into a duplicate key error.
     */
    @Override
    public boolean insert(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        try {
            access("insert job " + job.name(), () -> mongoTemplate.insert(toDocument(job)));
        } catch (RegistryException e) {
            if (e.getCause() instanceof DuplicateKeyException) {
                log.debug("datajob registry insert rejected, name taken name={}", job.name());
                return false;
            }
            throw e;
        }
        log.debug("datajob registry inserted name={}", job.name());
        return true;
    }

    /**
     * Upsert by name. Returns true when the document was inserted.
     */
    @Override
    public boolean save(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");

        Update u = new Update();
        u.set("cron", job.cron());
        u.set("dataSource", toMap(job.source()));
        u.set("transform", job.transform());
        u.set("recipients", job.recipients());
        u.set("createdAt", job.createdAt());
        if (job.lastRun() != null) {
            u.set("lastRun", job.lastRun());
        } else {
            u.unset("lastRun");
        }

        UpdateResult result = access("save job " + job.name(), () ->
                mongoTemplate.upsert(byName(job.name()), u, JobDefinitionDocument.class));
        boolean created = result.getUpsertedId() != null;
        log.debug("datajob registry saved name={} created={}", job.name(), created);
        return created;
    }

    @Override
    public boolean delete(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return access("delete job " + name, () ->
                mongoTemplate.remove(byName(name), JobDefinitionDocument.class).getDeletedCount() > 0);
    }

    @Override
    public boolean updateLastRun(String name, Instant lastRun) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(lastRun, "lastRun must not be null");
        return access("update last_run of " + name, () ->
                mongoTemplate.updateFirst(byName(name), Update.update("lastRun", lastRun), JobDefinitionDocument.class)
                        .getMatchedCount() > 0);
    }

    private static Query byName(String name) {
        return new Query(Criteria.where("_id").is(name.trim()));
    }

    private Map<String, Object> toMap(DataSource source) {
        return objectMapper.convertValue(source, MAP);
    }

    private JobDefinitionDocument toDocument(JobDefinition job) {
        JobDefinitionDocument doc = new JobDefinitionDocument();
        doc.setName(job.name());
        doc.setCron(job.cron());
        doc.setDataSource(toMap(job.source()));
        doc.setTransform(job.transform());
        doc.setRecipients(job.recipients());
        doc.setCreatedAt(job.createdAt());
        doc.setLastRun(job.lastRun());
        return doc;
    }

    // Stored fields are taken as they are: a document without created_at is invalid, not stamped with now.
    private JobDefinition toJob(JobDefinitionDocument doc) {
        try {
            return new JobDefinition(
                    doc.getName(),
                    doc.getCron(),
                    objectMapper.convertValue(doc.getDataSource(), DataSource.class),
                    doc.getTransform(),
                    doc.getRecipients(),
                    doc.getCreatedAt(),
                    doc.getLastRun());
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("datajob registry document skipped name={} msg={}", doc.getName(), e.getMessage());
            return null;
        }
    }

    private static <T> T access(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new RegistryException("Failed to " + what + ": " + e.getMessage(), e);
        }
    }
}
