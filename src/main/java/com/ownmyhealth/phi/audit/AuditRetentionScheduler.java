package com.ownmyhealth.phi.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily audit retention sweep. Safe to run on several instances at once;
 * a second run simply finds nothing left to delete.
 */
@Component
public class AuditRetentionScheduler {
    private static final Logger log = LoggerFactory.getLogger(AuditRetentionScheduler.class);
    private final AuditLogService auditLogService;

    public AuditRetentionScheduler(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @Scheduled(cron="${app.audit.cleanup-cron:0 30 3 * * *}")
    public void purgeExpiredRecords() {
        try {
            this.auditLogService.cleanupOldLogs();
        } catch (RuntimeException e) {
            log.error("Audit retention cleanup failed: {}", e.getMessage(), e);
        }
    }
}
