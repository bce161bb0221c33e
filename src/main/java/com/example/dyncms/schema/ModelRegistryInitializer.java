package com.example.dyncms.schema;

import com.example.dyncms.access.ContentTypeAccess;
import com.example.dyncms.config.DynamoTableInitializer;
import com.example.dyncms.models.ContentTypeDefinition;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Compiles every stored content type once all beans exist and before the web server starts
 * accepting requests. Tables are created first when table creation is enabled.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelRegistryInitializer implements SmartInitializingSingleton {

    private final ObjectProvider<DynamoTableInitializer> tableInitializer;
    private final ContentTypeAccess contentTypeAccess;
    private final ModelSynthesizer synthesizer;

    @Override
    public void afterSingletonsInstantiated() {
        tableInitializer.ifAvailable(DynamoTableInitializer::createTables);
        List<ContentTypeDefinition> definitions = contentTypeAccess.findAll();
        definitions.forEach(synthesizer::synthesize);
        log.info("Loaded {} content type models", definitions.size());
    }
}
