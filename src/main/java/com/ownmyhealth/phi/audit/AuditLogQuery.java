package com.ownmyhealth.phi.audit;

import com.ownmyhealth.phi.model.AuditAction;
import java.time.Instant;

/**
 * Filters for {@link AuditLogService#queryLogs}. Null fields do not filter.
 */
public record AuditLogQuery(String userId, String resourceType, String resourceId, AuditAction action,
        Instant startDate, Instant endDate, Integer limit, Integer offset) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public static AuditLogQuery all() {
        return new AuditLogQuery(null, null, null, null, null, null, null, null);
    }

    public int effectiveLimit() {
        if (this.limit == null || this.limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(this.limit, MAX_LIMIT);
    }

    public int effectiveOffset() {
        return this.offset == null || this.offset < 0 ? 0 : this.offset;
    }
}
