package com.example.dyncms.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.dyncms.access.ContentTypeAccess;
import com.example.dyncms.config.DynamoTableInitializer;
import com.example.dyncms.models.ContentTypeDefinition;
import com.example.dyncms.models.FieldDefinition;
import com.example.dyncms.models.FieldType;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class ModelRegistryInitializerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-02T08:00:00Z"), ZoneOffset.UTC);

    private final ModelRegistry registry = new ModelRegistry();
    private final ModelSynthesizer synthesizer = new ModelSynthesizer(registry, CLOCK);
    private final ContentTypeAccess contentTypeAccess = mock(ContentTypeAccess.class);

    @Test
    @DisplayName("tables are created before stored definitions are replayed")
    void createsTablesBeforeReplay() {
        DynamoTableInitializer tables = mock(DynamoTableInitializer.class);
        when(contentTypeAccess.findAll()).thenReturn(List.of(definition("article"), definition("page")));
        StaticListableBeanFactory beans = new StaticListableBeanFactory(Map.of("tables", tables));

        new ModelRegistryInitializer(beans.getBeanProvider(DynamoTableInitializer.class), contentTypeAccess, synthesizer)
                .afterSingletonsInstantiated();

        InOrder order = inOrder(tables, contentTypeAccess);
        order.verify(tables).createTables();
        order.verify(contentTypeAccess).findAll();
        assertEquals(2, registry.size());
        assertEquals("title", registry.require("page").fields().get(0).name());
    }

    @Test
    @DisplayName("replay works when table creation is disabled")
    void replaysWithoutTableInitializer() {
        when(contentTypeAccess.findAll()).thenReturn(List.of());
        StaticListableBeanFactory beans = new StaticListableBeanFactory();

        new ModelRegistryInitializer(beans.getBeanProvider(DynamoTableInitializer.class), contentTypeAccess, synthesizer)
                .afterSingletonsInstantiated();

        assertTrue(registry.apiIds().isEmpty());
    }

    private static ContentTypeDefinition definition(String apiId) {
        return ContentTypeDefinition.builder()
                .apiId(apiId)
                .displayName(apiId)
                .fields(List.of(FieldDefinition.builder().name("title").displayName("Title").type(FieldType.TEXT).build()))
                .createdAt(CLOCK.millis())
                .updatedAt(CLOCK.millis())
                .build();
    }
}
