package com.ownmyhealth.phi.repository;

import com.ownmyhealth.phi.model.Session;
import java.time.Instant;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SessionRepository extends MongoRepository<Session, String> {

    List<Session> findByUserIdAndExpiresAtAfterOrderByCreatedAtDesc(String userId, Instant now);

    long deleteByUserId(String userId);

    long deleteByExpiresAtBefore(Instant cutoff);
}
