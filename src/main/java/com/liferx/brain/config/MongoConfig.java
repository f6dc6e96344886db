package com.liferx.brain.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate and @LastModifiedDate
 * are populated on knowledge item saves.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.liferx.brain.audit",
    "com.liferx.brain.knowledge"
})
public class MongoConfig {
}
