package com.ownmyhealth.phi.audit;

import java.time.Instant;
import java.util.Map;

public record AuditStats(Instant since, long total, long failures, Map<String, Long> byAction) {
}
