package com.cohort.dispatch.api;

import com.cohort.core.briefing.BriefingService;
import com.cohort.core.model.InboxItem;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /api/v1/users/{userId}/inbox: Briefing notifications and feedback requests.
 */
@RestController
@RequestMapping("/api/v1/users")
public class InboxController {

    private final BriefingService briefingService;

    public InboxController(BriefingService briefingService) {
        this.briefingService = briefingService;
    }

    @GetMapping("/{userId}/inbox")
    public ResponseEntity<List<InboxItem>> inbox(@PathVariable String userId) {
        return ResponseEntity.ok(briefingService.inbox(userId));
    }
}
