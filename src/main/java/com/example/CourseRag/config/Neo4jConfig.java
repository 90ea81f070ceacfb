package com.example.CourseRag.config;

import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Neo4j driver for the concept graph. The driver connects on first use, so a missing
 * graph store does not prevent startup.
 */
@Configuration
public class Neo4jConfig {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(@Value("${neo4j.uri:bolt://localhost:7687}") String uri,
                              @Value("${neo4j.user:neo4j}") String user,
                              @Value("${neo4j.password:neo4j}") String password,
                              RagProperties properties) {
        long timeoutMs = properties.getGraph().getTimeout().toMillis();
        Config config = Config.builder()
                .withConnectionTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .withConnectionAcquisitionTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
        return GraphDatabase.driver(uri, AuthTokens.basic(user, password), config);
    }
}
