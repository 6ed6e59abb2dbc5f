package io.datajob4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.datajob4j.core.ApiSource;
import io.datajob4j.core.FileFormat;
import io.datajob4j.core.FileSource;
import io.datajob4j.core.JobDefinition;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobRegistryIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoJobRegistry registry;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "datajob4j_test");
        mongoTemplate.dropCollection(JobDefinitionDocument.class);
        registry = new MongoJobRegistry(mongoTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDefinitionDocument.class);
    }

    private static JobDefinition apiJob(String name, Instant createdAt) {
        return JobDefinition.builder()
                .name(name)
                .cron("*/15 * * * *")
                .apiSource("https://api.example.com/" + name)
                .transform("output = input.filter(function (r) { return r.active; });")
                .recipients(List.of("a@example.com", "b@example.com"))
                .createdAt(createdAt)
                .build();
    }

    @Test
    void saveShouldUpsertByName() {
        JobDefinition job = apiJob("orders", Instant.parse("2026-01-01T00:00:00Z"));

        assertTrue(registry.save(job));
        assertFalse(registry.save(job.withLastRun(Instant.parse("2026-01-02T00:00:00Z"))));

        assertEquals(1, mongoTemplate.count(new Query(), JobDefinitionDocument.class));
        JobDefinition stored = registry.find("orders").orElseThrow();
        assertEquals(new ApiSource("https://api.example.com/orders"), stored.source());
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), stored.lastRun());
    }

    @Test
    void insertShouldRejectTakenName() {
        JobDefinition first = apiJob("orders", Instant.parse("2026-01-01T00:00:00Z"));
        JobDefinition second = JobDefinition.builder()
                .name("orders")
                .cron("0 6 * * *")
                .apiSource("https://api.example.com/other")
                .transform("output = input;")
                .recipient("other@example.com")
                .createdAt(Instant.parse("2026-01-05T00:00:00Z"))
                .build();

        assertTrue(registry.insert(first));
        assertFalse(registry.insert(second));

        assertEquals(1, mongoTemplate.count(new Query(), JobDefinitionDocument.class));
        assertEquals(first, registry.find("orders").orElseThrow());
    }

    @Test
    void documentWithoutCreatedAtShouldBeSkipped() {
        mongoTemplate.getCollection("data_jobs").insertOne(new Document("_id", "nodate")
                .append("schedule_time", "0 6 * * *")
                .append("data_source", new Document("source_type", "api").append("location", "https://api.example.com/x"))
                .append("processing_script", "output = input;")
                .append("consumer_emails", List.of("ops@example.com")));

        assertTrue(registry.findAll().isEmpty());
        assertTrue(registry.find("nodate").isEmpty());
        assertTrue(registry.exists("nodate"));
    }

    @Test
    void documentShouldUseRegistryFieldNames() {
        JobDefinition job = JobDefinition.builder()
                .name("stock")
                .cron("0 6 * * 1-5")
                .fileSource("/data/stock.json", FileFormat.JSON)
                .transform("output = input;")
                .recipient("ops@example.com")
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
        registry.save(job);

        Document raw = mongoTemplate.getCollection("data_jobs").find().first();
        assertEquals("stock", raw.getString("_id"));
        assertEquals("0 6 * * 1-5", raw.getString("schedule_time"));
        Document source = raw.get("data_source", Document.class);
        assertEquals("file", source.getString("source_type"));
        assertEquals("json", source.getString("file_type"));

        assertEquals(new FileSource("/data/stock.json", FileFormat.JSON), registry.find("stock").orElseThrow().source());
    }

    @Test
    void findAllShouldListByCreationTimeAndSkipInvalidDocuments() {
        registry.save(apiJob("second", Instant.parse("2026-01-02T00:00:00Z")));
        registry.save(apiJob("first", Instant.parse("2026-01-01T00:00:00Z")));
        mongoTemplate.getCollection("data_jobs").insertOne(new Document("_id", "broken").append("schedule_time", "nope"));

        List<String> names = registry.findAll().stream().map(JobDefinition::name).collect(Collectors.toList());

        assertEquals(List.of("first", "second"), names);
        assertTrue(registry.exists("broken"));
    }

    @Test
    void updateLastRunAndDelete() {
        registry.save(apiJob("orders", Instant.parse("2026-01-01T00:00:00Z")));
        Instant at = Instant.parse("2026-03-01T06:00:00Z");

        assertTrue(registry.updateLastRun("orders", at));
        assertFalse(registry.updateLastRun("ghost", at));
        assertEquals(at, registry.find("orders").orElseThrow().lastRun());

        assertTrue(registry.delete("orders"));
        assertFalse(registry.delete("orders"));
        assertFalse(registry.exists("orders"));
        assertNull(registry.find("orders").orElse(null));
    }
}
