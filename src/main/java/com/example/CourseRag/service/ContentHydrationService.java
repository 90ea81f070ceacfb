package com.example.CourseRag.service;

import com.example.CourseRag.model.Candidate;
import com.example.CourseRag.model.ContentChunk;
import com.example.CourseRag.model.MaterialRecord;
import com.example.CourseRag.repository.CourseMaterialRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Resolves search candidates into full chunks from the relational store.
 *
 * Output keeps candidate order; candidates with a missing or malformed document id, or with
 * no stored row, are dropped.
 */
@Service
@RequiredArgsConstructor
public class ContentHydrationService {

    private static final Logger log = LoggerFactory.getLogger(ContentHydrationService.class);
    private static final Pattern HEX_32 = Pattern.compile("[0-9a-fA-F]{32}");

    private final CourseMaterialRepository materialRepository;

    public List<ContentChunk> hydrate(List<Candidate> candidates, int limit) {
        Set<UUID> ids = new LinkedHashSet<>();
        for (Candidate candidate : candidates) {
            parseId(candidate).ifPresent(ids::add);
        }
        if (ids.isEmpty()) {
            log.debug("Hydration: none of {} candidates carries a valid document id", candidates.size());
            return List.of();
        }

        Map<UUID, MaterialRecord> records = materialRepository.findByIds(ids);

        List<ContentChunk> chunks = new ArrayList<>();
        for (Candidate candidate : candidates) {
            Optional<UUID> id = parseId(candidate);
            if (id.isEmpty()) {
                continue;
            }
            MaterialRecord record = records.get(id.get());
            if (record == null) {
                continue;
            }
            chunks.add(record.toChunk(candidate.score()));
            if (chunks.size() >= limit) {
                break;
            }
        }
        return chunks;
    }

    /**
     * Accepts the spellings document ids arrive in: hyphenated or plain 32-digit hex, optionally
     * braced or prefixed with {@code urn:uuid:}, any case. Anything else is malformed.
     */
    static Optional<UUID> parseId(Candidate candidate) {
        String raw = candidate.documentId();
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        String hex = raw.replace("urn:", "").replace("uuid:", "");
        hex = stripBraces(hex).replace("-", "");
        if (!HEX_32.matcher(hex).matches()) {
            return Optional.empty();
        }
        return Optional.of(new UUID(
                Long.parseUnsignedLong(hex.substring(0, 16), 16),
                Long.parseUnsignedLong(hex.substring(16), 16)));
    }

    private static String stripBraces(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '{') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '}') {
            end--;
        }
        return value.substring(start, end);
    }
}
