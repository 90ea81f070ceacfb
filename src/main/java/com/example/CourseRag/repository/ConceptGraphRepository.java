package com.example.CourseRag.repository;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.model.RelatedConcept;
import com.example.CourseRag.model.TopicAssignments;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only Cypher queries over the concept graph.
 * Each call opens one session and closes it before returning.
 */
@Repository
public class ConceptGraphRepository {

    private static final String RELATED_CYPHER = """
            MATCH (s:Topic)-[:RELATES_TO]->(t:Topic)
            WHERE s.id IN $topics
            RETURN DISTINCT s.id AS sourceId,
                   coalesce(s.label, s.id) AS sourceLabel,
                   t.id AS targetId,
                   coalesce(t.label, t.id) AS targetLabel
            LIMIT $limit
            """;

    private static final String ASSIGNMENTS_CYPHER = """
            MATCH (a:Assignment)-[:ASSOCIATED_WITH]->(t:Topic)
            WHERE t.id IN $topics
            WITH t, a ORDER BY a.title
            WITH t, collect(DISTINCT a.title) AS titles
            RETURN t.id AS topicId,
                   coalesce(t.label, t.id) AS label,
                   titles[0..$perTopic] AS titles
            """;

    private final Driver driver;
    private final String database;

    public ConceptGraphRepository(Driver driver, RagProperties properties) {
        this.driver = driver;
        this.database = properties.getGraph().getDatabase();
    }

    /**
     * Outgoing RELATES_TO edges whose source topic is one of {@code topics}.
     */
    public List<RelatedConcept> findRelated(Collection<String> topics, int limit) {
        try (Session session = driver.session(SessionConfig.forDatabase(database))) {
            return session.executeRead(tx -> tx.run(RELATED_CYPHER, Map.of("topics", List.copyOf(topics), "limit", limit))
                    .list(record -> new RelatedConcept(
                            record.get("sourceId").asString(),
                            record.get("sourceLabel").asString(),
                            record.get("targetId").asString(),
                            record.get("targetLabel").asString())));
        }
    }

    /**
     * Up to {@code perTopic} assignment titles per topic, alphabetically.
     */
    public List<TopicAssignments> findAssignments(Collection<String> topics, int perTopic) {
        try (Session session = driver.session(SessionConfig.forDatabase(database))) {
            return session.executeRead(tx -> tx.run(ASSIGNMENTS_CYPHER, Map.of("topics", List.copyOf(topics), "perTopic", perTopic))
                    .list(record -> new TopicAssignments(
                            record.get("topicId").asString(),
                            record.get("label").asString(),
                            record.get("titles").asList(Value::asString))));
        }
    }
}
