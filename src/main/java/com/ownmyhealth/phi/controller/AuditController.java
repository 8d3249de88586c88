package com.ownmyhealth.phi.controller;

import com.ownmyhealth.phi.audit.AuditContext;
import com.ownmyhealth.phi.audit.AuditLogPage;
import com.ownmyhealth.phi.audit.AuditLogQuery;
import com.ownmyhealth.phi.audit.AuditLogService;
import com.ownmyhealth.phi.audit.AuditSnapshot;
import com.ownmyhealth.phi.audit.AuditStats;
import com.ownmyhealth.phi.exception.NotFoundException;
import com.ownmyhealth.phi.filter.SecurityContext;
import com.ownmyhealth.phi.model.AuditAction;
import com.ownmyhealth.phi.model.AuditLog;
import com.ownmyhealth.phi.security.TokenClaims;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative view of the audit trail. Listing never decrypts value
 * snapshots; decryption is a separate call that is itself audited.
 */
@RestController
@RequestMapping(value={"/api/v1/admin/audit-logs"})
@PreAuthorize(value="hasAuthority('PERM_VIEW_AUDIT')")
public class AuditController {
    private static final Logger log = LoggerFactory.getLogger(AuditController.class);
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AuditController(AuditLogService auditLogService, Clock clock) {
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @GetMapping
    public Map<String, Object> query(@RequestParam(value="userId", required=false) String userId,
            @RequestParam(value="resourceType", required=false) String resourceType,
            @RequestParam(value="resourceId", required=false) String resourceId,
            @RequestParam(value="action", required=false) AuditAction action,
            @RequestParam(value="startDate", required=false) @DateTimeFormat(iso=DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(value="endDate", required=false) @DateTimeFormat(iso=DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(value="limit", required=false) Integer limit,
            @RequestParam(value="offset", required=false) Integer offset) {
        AuditLogQuery query = new AuditLogQuery(userId, resourceType, resourceId, action, startDate, endDate, limit, offset);
        AuditLogPage page = this.auditLogService.queryLogs(query);
        List<Map<String, Object>> logs = new ArrayList<>();
        for (AuditLog entry : page.logs()) {
            logs.add(this.view(entry));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("logs", logs);
        body.put("total", page.total());
        body.put("limit", query.effectiveLimit());
        body.put("offset", query.effectiveOffset());
        return body;
    }

    @GetMapping(value={"/stats"})
    public AuditStats stats(@RequestParam(value="days", defaultValue="30") int days) {
        int window = Math.max(1, Math.min(days, 3650));
        return this.auditLogService.getStats(this.clock.instant().minus(Duration.ofDays(window)));
    }

    @PostMapping(value={"/{id}/decrypt"})
    @PreAuthorize(value="hasAuthority('PERM_DECRYPT_AUDIT')")
    public AuditSnapshot decrypt(@PathVariable(value="id") String id, HttpServletRequest request) {
        AuditLog entry = this.auditLogService.findById(id).orElseThrow(() -> new NotFoundException("Audit log not found"));
        TokenClaims claims = SecurityContext.getCurrentClaims();
        AuditContext requester = this.auditLogService.extractContext(request).withUser(claims != null ? claims.userId() : null);
        log.info("Audit snapshot {} decrypted by {}", id, SecurityContext.getCurrentUserId());
        return this.auditLogService.decryptSnapshot(entry, requester);
    }

    private Map<String, Object> view(AuditLog entry) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", entry.getId());
        view.put("createdAt", entry.getCreatedAt());
        view.put("action", entry.getAction());
        view.put("actorType", entry.getActorType());
        view.put("userId", entry.getUserId());
        view.put("ipAddress", entry.getIpAddress());
        view.put("correlationId", entry.getCorrelationId());
        view.put("resourceType", entry.getResourceType());
        view.put("resourceId", entry.getResourceId());
        view.put("success", entry.isSuccess());
        view.put("errorMessage", entry.getErrorMessage());
        view.put("hasSnapshot", entry.getPreviousValueEncrypted() != null || entry.getNewValueEncrypted() != null);
        this.auditLogService.readMetadata(entry).ifPresent(metadata -> view.put("metadata", metadata));
        return view;
    }
}
