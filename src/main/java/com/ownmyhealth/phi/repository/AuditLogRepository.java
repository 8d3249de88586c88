package com.ownmyhealth.phi.repository;

import com.ownmyhealth.phi.model.AuditLog;
import java.time.Instant;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Audit records are append-only: this repository is used for inserts and the
 * retention sweep. Filtered queries go through {@code MongoTemplate}.
 */
@Repository
public interface AuditLogRepository extends MongoRepository<AuditLog, String> {

    long deleteByCreatedAtBefore(Instant cutoff);
}
