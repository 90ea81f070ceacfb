package com.example.CourseRag.service;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.model.ConceptEdge;
import com.example.CourseRag.model.ConceptNode;
import com.example.CourseRag.model.GraphContext;
import com.example.CourseRag.model.RelatedConcept;
import com.example.CourseRag.model.TopicAssignments;
import com.example.CourseRag.repository.ConceptGraphRepository;
import com.example.CourseRag.util.OneTimeWarnings;
import org.neo4j.driver.exceptions.Neo4jException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Expands the topics of a response into their concept neighbourhood.
 *
 * Never fails the request: no topics, a disabled or unreachable graph store, or an empty
 * result all give {@link Optional#empty()}.
 */
@Service
public class GraphContextService {

    private static final Logger log = LoggerFactory.getLogger(GraphContextService.class);

    private final ConceptGraphRepository graphRepository;
    private final boolean enabled;
    private final int maxEdges;
    private final int maxAssignmentsPerTopic;
    private final OneTimeWarnings warnings = new OneTimeWarnings(log);

    public GraphContextService(ConceptGraphRepository graphRepository, RagProperties properties) {
        this.graphRepository = graphRepository;
        this.enabled = properties.getGraph().isEnabled();
        this.maxEdges = properties.getGraph().getMaxEdges();
        this.maxAssignmentsPerTopic = properties.getGraph().getMaxAssignmentsPerTopic();
    }

    public Optional<GraphContext> build(Set<String> topics) {
        if (!enabled || topics == null || topics.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(expand(topics));
        } catch (Neo4jException e) {
            warnings.warn("neo4j", "Graph store unavailable, answering without concept context: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private GraphContext expand(Set<String> topics) {
        Map<String, ConceptNode> nodes = new LinkedHashMap<>();
        Set<ConceptEdge> edges = new LinkedHashSet<>();

        for (RelatedConcept related : graphRepository.findRelated(topics, maxEdges)) {
            if (edges.size() >= maxEdges) {
                break;
            }
            nodes.putIfAbsent(related.sourceId(), node(related.sourceId(), related.sourceLabel(), topics));
            nodes.putIfAbsent(related.targetId(), node(related.targetId(), related.targetLabel(), topics));
            edges.add(new ConceptEdge(related.sourceId(), related.targetId()));
        }

        Set<String> lookup = new LinkedHashSet<>(topics);
        lookup.addAll(nodes.keySet());
        for (TopicAssignments assignments : graphRepository.findAssignments(lookup, maxAssignmentsPerTopic)) {
            if (assignments.titles() == null || assignments.titles().isEmpty()) {
                continue;
            }
            List<String> titles = assignments.titles().size() > maxAssignmentsPerTopic
                    ? assignments.titles().subList(0, maxAssignmentsPerTopic)
                    : assignments.titles();
            ConceptNode current = nodes.computeIfAbsent(assignments.topicId(),
                    id -> node(id, assignments.label(), topics));
            nodes.put(current.topicId(), current.withAssignments(titles));
        }

        if (nodes.isEmpty()) {
            return null;
        }
        log.debug("Graph context: {} nodes, {} edges for topics {}", nodes.size(), edges.size(), topics);
        return new GraphContext(List.copyOf(nodes.values()), List.copyOf(edges));
    }

    private static ConceptNode node(String topicId, String label, Set<String> primaryTopics) {
        return new ConceptNode(topicId, label == null ? topicId : label, List.of(), primaryTopics.contains(topicId));
    }
}
