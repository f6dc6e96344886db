package com.liferx.brain.knowledge;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BrainItemRepository extends MongoRepository<BrainItem, String> {

    Optional<BrainItem> findByOrgIdAndCanonicalKey(String orgId, String canonicalKey);
}
