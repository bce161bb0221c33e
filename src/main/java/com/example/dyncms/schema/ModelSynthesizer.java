package com.example.dyncms.schema;

import com.example.dyncms.models.ContentTypeDefinition;
import com.example.dyncms.models.FieldDefinition;
import com.example.dyncms.models.FieldType;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Compiles content type definitions into {@link CompiledModel}s and keeps the
 * {@link ModelRegistry} in step with definition changes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelSynthesizer {

    private final ModelRegistry registry;
    private final Clock clock;

    /**
     * Compiles the definition and atomically installs it, replacing the previous model for the
     * same apiId.
     */
    public CompiledModel synthesize(ContentTypeDefinition definition) {
        CompiledModel model = compile(definition);
        boolean replaced = registry.register(model).isPresent();
        log.info("{} model for content type {} ({} fields)",
                replaced ? "Recompiled" : "Compiled", model.apiId(), model.fields().size());
        return model;
    }

    public void drop(String apiId) {
        registry.unregister(apiId)
                .ifPresent(m -> log.info("Dropped model for content type {}", apiId));
    }

    public CompiledModel compile(ContentTypeDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        List<CompiledField> fields = definition.getFields().stream()
                .map(ModelSynthesizer::compileField)
                .toList();
        return new CompiledModel(definition.getApiId(), fields, clock.millis());
    }

    public static CompiledField compileField(FieldDefinition field) {
        FieldType type = Objects.requireNonNull(field.type(), "type");
        return new CompiledField(
                field.name(),
                type,
                type.primitive(),
                field.required(),
                field.unique(),
                field.defaultValue(),
                type == FieldType.ENUM ? field.options() : null,
                type == FieldType.RELATION ? field.relationTo() : null,
                field.holdsMany()
        );
    }
}
