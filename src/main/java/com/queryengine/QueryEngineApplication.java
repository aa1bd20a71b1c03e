package com.queryengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Multi-tenant Analytics Query Engine
 *
 * Turns declarative analytics requests into parameterized SQL over
 * pre-aggregated, tenant-partitioned tables.
 *
 * Architecture:
 * - Whitelist validation of tables, fields and operators
 * - Value sanitization, values only ever travel as bound parameters
 * - Tenant and sub-entity predicates injected into every statement
 * - Redis caching of results (short TTL) and metadata (long TTL)
 * - Multi-series consolidation into a single statement
 * - Concurrent period comparison
 */
@SpringBootApplication
public class QueryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryEngineApplication.class, args);
    }
}
