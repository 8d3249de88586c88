package com.ownmyhealth.phi.repository;

import com.ownmyhealth.phi.model.SystemConfig;
import java.util.Optional;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SystemConfigRepository extends MongoRepository<SystemConfig, String> {

    Optional<SystemConfig> findByKey(String key);
}
