package com.example.dyncms.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.dyncms.models.EntryIds;
import com.example.dyncms.models.FieldDefinition;
import com.example.dyncms.models.FieldType;
import com.example.dyncms.schema.CompiledModel;
import com.example.dyncms.schema.ModelSynthesizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReferenceNormalizerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ID = "3f2a1b4c-5d6e-4f70-8a9b-0c1d2e3f4a5b";

    private final ReferenceNormalizer normalizer = new ReferenceNormalizer();
    private final CompiledModel model = new CompiledModel("post", List.of(
            ModelSynthesizer.compileField(FieldDefinition.builder().name("title").type(FieldType.TEXT).build()),
            ModelSynthesizer.compileField(FieldDefinition.builder().name("author").type(FieldType.RELATION)
                    .relationTo("person").build()),
            ModelSynthesizer.compileField(FieldDefinition.builder().name("tags").type(FieldType.RELATION)
                    .relationTo("tag").relationMany(true).build()),
            ModelSynthesizer.compileField(FieldDefinition.builder().name("cover").type(FieldType.MEDIA).build())
    ), 0L);

    @Test
    @DisplayName("placeholder scalars drop the field")
    void dropsPlaceholders() throws Exception {
        for (String placeholder : List.of("\"\"", "null", "\"null\"", "\"undefined\"", "\"not-an-id\"")) {
            ObjectNode result = normalize("{\"author\":" + placeholder + "}");
            assertFalse(result.has("author"), placeholder);
        }
    }

    @Test
    @DisplayName("lists lose blank and malformed ids and vanish when empty")
    void cleansLists() throws Exception {
        String malformed = "zzzzzzzz-zzzz-zzzz-zzzz-zzzzzzzzzzzz";
        assertEquals(EntryIds.LENGTH, malformed.length());

        ObjectNode result = normalize("{\"tags\":[\"\",null,\"null\",\"" + malformed + "\",{\"id\":\"" + ID + "\"}]}");
        assertEquals(MAPPER.readTree("[\"" + ID + "\"]"), result.get("tags"));

        assertFalse(normalize("{\"tags\":[]}").has("tags"));
        assertFalse(normalize("{\"tags\":[\"undefined\",\"\"]}").has("tags"));
    }

    @Test
    @DisplayName("short garbage list elements are left for validation to reject")
    void keepsShortGarbage() throws Exception {
        ObjectNode result = normalize("{\"tags\":[\"oops\"]}");
        assertEquals("oops", result.get("tags").get(0).textValue());
    }

    @Test
    @DisplayName("populated objects are unwrapped and ids lowercased")
    void unwrapsObjects() throws Exception {
        ObjectNode result = normalize("{\"author\":{\"id\":\"" + ID.toUpperCase() + "\",\"name\":\"Ada\"}}");
        assertEquals(ID, result.get("author").textValue());
    }

    @Test
    @DisplayName("non-reference fields and the input are left untouched")
    void leavesOtherFieldsAlone() throws Exception {
        ObjectNode input = (ObjectNode) MAPPER.readTree("{\"title\":\"\",\"cover\":\"\"}");

        ObjectNode result = normalizer.normalize(model, input);

        assertTrue(result.has("title"));
        assertFalse(result.has("cover"));
        assertTrue(input.has("cover"));
    }

    private ObjectNode normalize(String json) throws Exception {
        return normalizer.normalize(model, (ObjectNode) MAPPER.readTree(json));
    }
}
