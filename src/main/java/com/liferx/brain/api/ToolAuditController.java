package com.liferx.brain.api;

import com.liferx.brain.audit.ToolAuditLog;
import com.liferx.brain.audit.ToolAuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read access to the tool audit trail, newest first.
 *
 * GET /api/v1/tool-logs/session/{sessionId}
 * GET /api/v1/tool-logs/org/{orgId}?tool=brain.search_items
 */
@RestController
@RequestMapping("/api/v1/tool-logs")
@RequiredArgsConstructor
public class ToolAuditController {

    private final ToolAuditService auditService;
    private final InternalSecretVerifier secretVerifier;

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<ToolAuditLog>> bySession(
            @RequestHeader(value = InternalSecretVerifier.HEADER, required = false) String secret,
            @PathVariable String sessionId) {
        secretVerifier.verify(secret);
        return ResponseEntity.ok(auditService.findBySession(sessionId));
    }

    @GetMapping("/org/{orgId}")
    public ResponseEntity<List<ToolAuditLog>> byOrg(
            @RequestHeader(value = InternalSecretVerifier.HEADER, required = false) String secret,
            @PathVariable String orgId,
            @RequestParam(value = "tool", required = false) String tool) {
        secretVerifier.verify(secret);
        return ResponseEntity.ok(auditService.findByOrg(orgId, tool));
    }
}
