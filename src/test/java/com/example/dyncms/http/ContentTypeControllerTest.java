package com.example.dyncms.http;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.dyncms.models.ContentTypeDefinition;
import com.example.dyncms.models.FieldDefinition;
import com.example.dyncms.models.FieldType;
import com.example.dyncms.requests.PutContentTypeServiceRequest;
import com.example.dyncms.service.CallerIdentity;
import com.example.dyncms.service.CmsException;
import com.example.dyncms.service.ContentTypeService;
import com.example.dyncms.service.ContentTypeService.ContentTypeDeletionResult;
import com.example.dyncms.service.Role;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = ContentTypeController.class)
@Import({RequestIdFilter.class, CallerIdentityResolver.class, WebConfig.class})
class ContentTypeControllerTest {

    private static final CallerIdentity ADMIN = new CallerIdentity("admin-1", Role.ADMINISTRATOR);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ContentTypeService contentTypeService;

    @Test
    @DisplayName("POST defines a content type and reports its field count")
    void createContentType() throws Exception {
        when(contentTypeService.define(any(), any())).thenReturn(definition("blog_post"));

        String body = "{" +
                "\"apiId\":\"blog_post\"," +
                "\"displayName\":\"Blog post\"," +
                "\"fields\":[{\"name\":\"title\",\"displayName\":\"Title\",\"type\":\"text\",\"required\":true}]" +
                "}";

        mockMvc.perform(MockMvcRequestBuilders.post("/content-types")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "administrator")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(MockMvcResultMatchers.status().isCreated())
                .andExpect(MockMvcResultMatchers.jsonPath("$.apiId", equalTo("blog_post")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.fieldCount", equalTo(2)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.fields[0].type", equalTo("text")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.createdAt", equalTo("2024-09-01T10:00:00Z")));

        ArgumentCaptor<PutContentTypeServiceRequest> captor = ArgumentCaptor.forClass(PutContentTypeServiceRequest.class);
        verify(contentTypeService).define(captor.capture(), eq(ADMIN));
        assertEquals("blog_post", captor.getValue().apiId());
        assertEquals("text", captor.getValue().fields().get(0).type());
        assertEquals(Boolean.TRUE, captor.getValue().fields().get(0).required());
    }

    @Test
    @DisplayName("POST maps invalid definitions to 400")
    void createInvalid() throws Exception {
        when(contentTypeService.define(any(), any()))
                .thenThrow(CmsException.invalidDefinition("At least one field is required"));

        mockMvc.perform(MockMvcRequestBuilders.post("/content-types")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "administrator")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"apiId\":\"empty\",\"displayName\":\"Empty\",\"fields\":[]}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INVALID_DEFINITION")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.message", equalTo("At least one field is required")));
    }

    @Test
    @DisplayName("POST maps duplicates to 409")
    void createDuplicate() throws Exception {
        when(contentTypeService.define(any(), any())).thenThrow(CmsException.contentTypeAlreadyExists("page"));

        mockMvc.perform(MockMvcRequestBuilders.post("/content-types")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "administrator")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"apiId\":\"page\",\"displayName\":\"Page\",\"fields\":[]}"))
                .andExpect(MockMvcResultMatchers.status().isConflict())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("CONFLICT")));
    }

    @Test
    @DisplayName("GET lists definitions")
    void listContentTypes() throws Exception {
        when(contentTypeService.list()).thenReturn(List.of(definition("article"), definition("page")));

        mockMvc.perform(MockMvcRequestBuilders.get("/content-types"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$", hasSize(2)))
                .andExpect(MockMvcResultMatchers.jsonPath("$[1].apiId", equalTo("page")));
    }

    @Test
    @DisplayName("PUT falls back to the path apiId when the body omits it")
    void replaceUsesPathApiId() throws Exception {
        when(contentTypeService.replace(eq("page"), any(), any())).thenReturn(definition("page"));

        mockMvc.perform(MockMvcRequestBuilders.put("/content-types/page")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "administrator")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"displayName\":\"Page\",\"fields\":[{\"name\":\"title\",\"displayName\":\"T\",\"type\":\"text\"}]}"))
                .andExpect(MockMvcResultMatchers.status().isOk());

        ArgumentCaptor<PutContentTypeServiceRequest> captor = ArgumentCaptor.forClass(PutContentTypeServiceRequest.class);
        verify(contentTypeService).replace(eq("page"), captor.capture(), eq(ADMIN));
        assertEquals("page", captor.getValue().apiId());
    }

    @Test
    @DisplayName("DELETE reports how many entries went with the type")
    void deleteContentType() throws Exception {
        when(contentTypeService.remove("page", ADMIN))
                .thenReturn(new ContentTypeDeletionResult(definition("page"), 4));

        mockMvc.perform(MockMvcRequestBuilders.delete("/content-types/page")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "administrator"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.apiId", equalTo("page")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.entriesDeleted", equalTo(4)));
    }

    @Test
    @DisplayName("GET of an unknown type is 404")
    void getUnknown() throws Exception {
        when(contentTypeService.get("ghost")).thenThrow(CmsException.contentTypeNotFound("ghost"));

        mockMvc.perform(MockMvcRequestBuilders.get("/content-types/ghost"))
                .andExpect(MockMvcResultMatchers.status().isNotFound())
                .andExpect(MockMvcResultMatchers.jsonPath("$.message", equalTo("Content type 'ghost' not found")));
    }

    private static ContentTypeDefinition definition(String apiId) {
        long at = Instant.parse("2024-09-01T10:00:00Z").toEpochMilli();
        return ContentTypeDefinition.builder()
                .apiId(apiId)
                .displayName(apiId)
                .fields(List.of(
                        FieldDefinition.builder().name("title").displayName("Title").type(FieldType.TEXT)
                                .required(true).build(),
                        FieldDefinition.builder().name("body").displayName("Body").type(FieldType.RICHTEXT).build()))
                .createdAt(at)
                .updatedAt(at)
                .build();
    }
}
