package com.ownmyhealth.phi.audit;

import com.ownmyhealth.phi.model.AuditLog;
import java.util.List;

public record AuditLogPage(List<AuditLog> logs, long total) {
}
