package com.example.dyncms.http;

import com.example.dyncms.models.ContentEntry;
import com.example.dyncms.requests.CreateEntryServiceRequest;
import com.example.dyncms.requests.EntryStateHttpRequest;
import com.example.dyncms.requests.ListEntriesServiceRequest;
import com.example.dyncms.requests.TransitionEntryServiceRequest;
import com.example.dyncms.requests.UpdateEntryServiceRequest;
import com.example.dyncms.schema.FieldValueCodec;
import com.example.dyncms.service.CallerIdentity;
import com.example.dyncms.service.ContentEntryService;
import com.example.dyncms.service.ContentEntryService.EntryPage;
import com.example.dyncms.service.ContentEntryService.ResolvedEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.Valid;
import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Generic REST surface for entries of any content type. The body of a create or update is a flat
 * JSON object keyed by field name.
 */
@RestController
public class ContentEntryController {

    private final ContentEntryService entryService;

    public ContentEntryController(ContentEntryService entryService) {
        this.entryService = entryService;
    }

    @GetMapping("/content/{apiId}")
    public ResponseEntity<EntryPageResponse> list(
            @PathVariable String apiId,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "sort", required = false) String sort
    ) {
        EntryPage result = entryService.list(new ListEntriesServiceRequest(apiId, page, limit, search, sort));
        return ResponseEntity.ok(new EntryPageResponse(
                result.entries().stream().map(this::map).toList(),
                result.totalCount(),
                result.page(),
                result.limit(),
                result.pages()));
    }

    @PostMapping("/content/{apiId}")
    public ResponseEntity<ObjectNode> create(
            @PathVariable String apiId,
            @RequestBody JsonNode body,
            CallerIdentity caller
    ) {
        ResolvedEntry entry = entryService.create(new CreateEntryServiceRequest(apiId, body, caller));
        return ResponseEntity.status(HttpStatus.CREATED).body(map(entry));
    }

    @GetMapping("/content/{apiId}/{id}")
    public ResponseEntity<ObjectNode> get(@PathVariable String apiId, @PathVariable String id) {
        return ResponseEntity.ok(map(entryService.getById(apiId, id)));
    }

    @PutMapping("/content/{apiId}/{id}")
    public ResponseEntity<ObjectNode> update(
            @PathVariable String apiId,
            @PathVariable String id,
            @RequestBody JsonNode body,
            CallerIdentity caller
    ) {
        ResolvedEntry entry = entryService.update(new UpdateEntryServiceRequest(apiId, id, body, caller));
        return ResponseEntity.ok(map(entry));
    }

    @PutMapping("/content/{apiId}/{id}/state")
    public ResponseEntity<ObjectNode> transition(
            @PathVariable String apiId,
            @PathVariable String id,
            @Valid @RequestBody EntryStateHttpRequest request,
            CallerIdentity caller
    ) {
        ResolvedEntry entry = entryService.transition(
                new TransitionEntryServiceRequest(apiId, id, request.state(), caller));
        return ResponseEntity.ok(map(entry));
    }

    @DeleteMapping("/content/{apiId}/{id}")
    public ResponseEntity<Void> delete(
            @PathVariable String apiId,
            @PathVariable String id,
            CallerIdentity caller
    ) {
        entryService.delete(apiId, id, caller);
        return ResponseEntity.noContent().build();
    }

    private ObjectNode map(ResolvedEntry resolved) {
        ContentEntry entry = resolved.entry();
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", entry.getEntryId());
        resolved.values().forEach((name, value) -> node.set(name, FieldValueCodec.encode(value)));
        node.put("state", entry.getState().wireName());
        node.put("createdBy", entry.getCreatedBy());
        node.put("createdAt", Instant.ofEpochMilli(entry.getCreatedAt()).toString());
        node.put("updatedAt", Instant.ofEpochMilli(entry.getUpdatedAt()).toString());
        return node;
    }
}
