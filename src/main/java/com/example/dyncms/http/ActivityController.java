package com.example.dyncms.http;

import com.example.dyncms.service.ActivityLogService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ActivityController {

    private final ActivityLogService activityLogService;

    public ActivityController(ActivityLogService activityLogService) {
        this.activityLogService = activityLogService;
    }

    @GetMapping("/activities")
    public ResponseEntity<List<ActivityResponse>> recent(
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(activityLogService.recent(limit).stream()
                .map(ActivityResponse::from)
                .toList());
    }
}
