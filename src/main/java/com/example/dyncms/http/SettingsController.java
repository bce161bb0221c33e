package com.example.dyncms.http;

import com.example.dyncms.requests.PermissionsHttpRequest;
import com.example.dyncms.service.CallerIdentity;
import com.example.dyncms.service.SettingsService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping("/settings/permissions")
    public ResponseEntity<PermissionsResponse> getPermissions() {
        return ResponseEntity.ok(new PermissionsResponse(settingsService.isContentApprovalRequired()));
    }

    @PutMapping("/settings/permissions")
    public ResponseEntity<PermissionsResponse> updatePermissions(
            @Valid @RequestBody PermissionsHttpRequest request,
            CallerIdentity caller
    ) {
        boolean contentApproval = settingsService.updateContentApproval(request.contentApproval(), caller);
        return ResponseEntity.ok(new PermissionsResponse(contentApproval));
    }
}
