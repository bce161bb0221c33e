package com.example.dyncms.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.dyncms.config.DynamoTableInitializer;
import com.example.dyncms.models.ContentEntry;
import com.example.dyncms.models.EntryState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class DynamoContentEntryAccessTest {

    private static final DockerImageName LOCALSTACK_IMAGE = DockerImageName.parse("localstack/localstack:3.6");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-02T08:00:00Z"), ZoneOffset.UTC);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Container
    private static final LocalStackContainer LOCALSTACK = new LocalStackContainer(LOCALSTACK_IMAGE)
            .withServices(LocalStackContainer.Service.DYNAMODB);

    private DynamoDbTable<ContentEntry> rawTable;
    private ContentEntryAccess entryAccess;

    @BeforeAll
    void init() {
        AwsBasicCredentials creds = AwsBasicCredentials.create(
                LOCALSTACK.getAccessKey(), LOCALSTACK.getSecretKey());
        DynamoDbClient dynamo = DynamoDbClient.builder()
                .endpointOverride(LOCALSTACK.getEndpointOverride(LocalStackContainer.Service.DYNAMODB))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .region(Region.of(LOCALSTACK.getRegion()))
                .build();
        new DynamoTableInitializer(dynamo).createTables();

        DynamoDbEnhancedClient enhancedClient = DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();
        rawTable = enhancedClient.table(DynamoContentEntryAccess.TABLE, TableSchema.fromBean(ContentEntry.class));
        entryAccess = new DynamoContentEntryAccess(enhancedClient);
    }

    @BeforeEach
    void cleanup() {
        rawTable.scan().items().forEach(rawTable::deleteItem);
    }

    @Test
    @DisplayName("save then findById round-trips the stored document and state")
    void saveAndFind() {
        ContentEntry entry = createEntry("article", "Hello");
        entry.setState(EntryState.PUBLISHED);
        entryAccess.save(entry);

        Optional<ContentEntry> found = entryAccess.findById("article", entry.getEntryId());

        assertTrue(found.isPresent());
        assertEquals("Hello", found.get().getData().get("title").asText());
        assertEquals(EntryState.PUBLISHED, found.get().getState());
        assertEquals("editor-1", found.get().getCreatedBy());
        assertEquals(CLOCK.millis(), found.get().getCreatedAt());
    }

    @Test
    @DisplayName("findById is scoped to the content type")
    void findByIdScopedToType() {
        ContentEntry entry = createEntry("article", "Hello");
        entryAccess.save(entry);

        assertTrue(entryAccess.findById("page", entry.getEntryId()).isEmpty());
    }

    @Test
    @DisplayName("findAllByApiId and hasEntries only see entries of the queried type")
    void findAllByApiId() {
        entryAccess.save(createEntry("article", "One"));
        entryAccess.save(createEntry("article", "Two"));
        entryAccess.save(createEntry("page", "About"));

        List<ContentEntry> articles = entryAccess.findAllByApiId("article");

        assertEquals(2, articles.size());
        assertTrue(articles.stream().allMatch(e -> e.getApiId().equals("article")));
        assertTrue(entryAccess.hasEntries("page"));
        assertFalse(entryAccess.hasEntries("product"));
    }

    @Test
    @DisplayName("delete reports whether an entry was removed")
    void deleteReportsRemoval() {
        ContentEntry entry = createEntry("article", "Bye");
        entryAccess.save(entry);

        assertTrue(entryAccess.delete("article", entry.getEntryId()));
        assertFalse(entryAccess.delete("article", entry.getEntryId()));
        assertTrue(entryAccess.findById("article", entry.getEntryId()).isEmpty());
    }

    @Test
    @DisplayName("deleteAllByApiId removes every entry of one type and leaves the others")
    void deleteAllByApiId() {
        entryAccess.save(createEntry("article", "One"));
        entryAccess.save(createEntry("article", "Two"));
        entryAccess.save(createEntry("article", "Three"));
        entryAccess.save(createEntry("page", "About"));

        int deleted = entryAccess.deleteAllByApiId("article");

        assertEquals(3, deleted);
        assertFalse(entryAccess.hasEntries("article"));
        assertEquals(1, entryAccess.findAllByApiId("page").size());
    }

    private ContentEntry createEntry(String apiId, String title) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("title", title);
        return ContentEntry.builder()
                .apiId(apiId)
                .entryId(UUID.randomUUID().toString())
                .data(data)
                .createdBy("editor-1")
                .createdAt(CLOCK.millis())
                .updatedAt(CLOCK.millis())
                .build();
    }
}
