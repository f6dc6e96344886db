package com.liferx.brain.audit;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ToolAuditLogRepository extends MongoRepository<ToolAuditLog, String> {

    List<ToolAuditLog> findBySessionIdOrderByStartedAtDesc(String sessionId);

    List<ToolAuditLog> findByOrgIdOrderByStartedAtDesc(String orgId);

    List<ToolAuditLog> findByOrgIdAndToolNameOrderByStartedAtDesc(String orgId, String toolName);
}
