package com.example.dyncms.http;

import com.example.dyncms.models.ContentTypeDefinition;
import com.example.dyncms.requests.ContentTypeHttpRequest;
import com.example.dyncms.requests.PutContentTypeServiceRequest;
import com.example.dyncms.service.CallerIdentity;
import com.example.dyncms.service.ContentTypeService;
import com.example.dyncms.service.ContentTypeService.ContentTypeDeletionResult;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for the schema registry. Reads are open to any caller; mutations are limited
 * to administrators by the service.
 */
@RestController
public class ContentTypeController {

    private final ContentTypeService contentTypeService;

    public ContentTypeController(ContentTypeService contentTypeService) {
        this.contentTypeService = contentTypeService;
    }

    @GetMapping("/content-types")
    public ResponseEntity<List<ContentTypeResponse>> list() {
        return ResponseEntity.ok(contentTypeService.list().stream()
                .map(ContentTypeResponse::from)
                .toList());
    }

    @PostMapping("/content-types")
    public ResponseEntity<ContentTypeResponse> create(
            @RequestBody ContentTypeHttpRequest request,
            CallerIdentity caller
    ) {
        ContentTypeDefinition definition = contentTypeService.define(
                PutContentTypeServiceRequest.from(request, null), caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(ContentTypeResponse.from(definition));
    }

    @GetMapping("/content-types/{apiId}")
    public ResponseEntity<ContentTypeResponse> get(@PathVariable String apiId) {
        return ResponseEntity.ok(ContentTypeResponse.from(contentTypeService.get(apiId)));
    }

    @PutMapping("/content-types/{apiId}")
    public ResponseEntity<ContentTypeResponse> replace(
            @PathVariable String apiId,
            @RequestBody ContentTypeHttpRequest request,
            CallerIdentity caller
    ) {
        ContentTypeDefinition definition = contentTypeService.replace(
                apiId, PutContentTypeServiceRequest.from(request, apiId), caller);
        return ResponseEntity.ok(ContentTypeResponse.from(definition));
    }

    @DeleteMapping("/content-types/{apiId}")
    public ResponseEntity<ContentTypeDeletionResponse> delete(
            @PathVariable String apiId,
            CallerIdentity caller
    ) {
        ContentTypeDeletionResult result = contentTypeService.remove(apiId, caller);
        return ResponseEntity.ok(new ContentTypeDeletionResponse(
                result.definition().getApiId(),
                result.entriesDeleted()));
    }
}
