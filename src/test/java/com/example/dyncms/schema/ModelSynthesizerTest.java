package com.example.dyncms.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.dyncms.models.ContentTypeDefinition;
import com.example.dyncms.models.FieldDefinition;
import com.example.dyncms.models.FieldType;
import com.example.dyncms.models.StoragePrimitive;
import com.example.dyncms.service.CmsException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ModelSynthesizerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-01T00:00:00Z"), ZoneOffset.UTC);

    private ModelRegistry registry;
    private ModelSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry();
        synthesizer = new ModelSynthesizer(registry, CLOCK);
    }

    @Test
    @DisplayName("compile maps every field to its storage primitive in declared order")
    void compileMapsFields() {
        CompiledModel model = synthesizer.compile(definition("product",
                FieldDefinition.builder().name("name").type(FieldType.TEXT).required(true).build(),
                FieldDefinition.builder().name("price").type(FieldType.NUMBER).build(),
                FieldDefinition.builder().name("launch").type(FieldType.DATE).build(),
                FieldDefinition.builder().name("specs").type(FieldType.JSON).build(),
                FieldDefinition.builder().name("photos").type(FieldType.MEDIA).multiple(true)
                        .relationTo("ignored").build(),
                FieldDefinition.builder().name("kind").type(FieldType.ENUM).options(List.of("a", "b")).build()));

        assertEquals("product", model.apiId());
        assertEquals(List.of(StoragePrimitive.STRING, StoragePrimitive.NUMBER, StoragePrimitive.TIMESTAMP,
                        StoragePrimitive.STRUCTURED, StoragePrimitive.REFERENCE, StoragePrimitive.STRING),
                model.fields().stream().map(CompiledField::primitive).toList());
        CompiledField photos = model.field("photos").orElseThrow();
        assertTrue(photos.many());
        assertNull(photos.relationTo());
        assertEquals(List.of("a", "b"), model.field("kind").orElseThrow().options());
        assertEquals(CLOCK.millis(), model.compiledAt());
    }

    @Test
    @DisplayName("synthesize replaces the registered model atomically")
    void synthesizeReplaces() {
        CompiledModel first = synthesizer.synthesize(definition("page",
                FieldDefinition.builder().name("title").type(FieldType.TEXT).build()));
        assertSame(first, registry.require("page"));

        CompiledModel second = synthesizer.synthesize(definition("page",
                FieldDefinition.builder().name("title").type(FieldType.TEXT).build(),
                FieldDefinition.builder().name("body").type(FieldType.RICHTEXT).build()));

        assertSame(second, registry.require("page"));
        assertFalse(first.hasField("body"));
        assertTrue(second.hasField("body"));
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("drop unregisters the model")
    void dropUnregisters() {
        synthesizer.synthesize(definition("page", FieldDefinition.builder().name("title").type(FieldType.TEXT).build()));

        synthesizer.drop("page");

        CmsException ex = assertThrows(CmsException.class, () -> registry.require("page"));
        assertEquals(CmsException.Code.NOT_FOUND, ex.getCode());
    }

    private static ContentTypeDefinition definition(String apiId, FieldDefinition... fields) {
        return ContentTypeDefinition.builder()
                .apiId(apiId)
                .displayName(apiId)
                .fields(List.of(fields))
                .createdAt(CLOCK.millis())
                .updatedAt(CLOCK.millis())
                .build();
    }
}
