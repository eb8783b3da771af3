package com.movi.agent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate and @LastModifiedDate
 * are populated on thread metadata and turn traces.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.movi.agent.audit",
    "com.movi.agent.observability"
})
public class MongoConfig {
}
