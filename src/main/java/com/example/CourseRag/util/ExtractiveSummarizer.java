package com.example.CourseRag.util;

import com.example.CourseRag.model.ContentChunk;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks highlight sentences out of retrieved chunks without any model.
 */
public final class ExtractiveSummarizer {

    public static final int MAX_HIGHLIGHTS = 5;
    public static final int MIN_HIGHLIGHT_LENGTH = 20;

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?…]+");
    private static final String STRIP_CHARS = ";-–—";

    private ExtractiveSummarizer() {
    }

    /**
     * Sentences of at least {@value #MIN_HIGHLIGHT_LENGTH} characters, in chunk order,
     * without case-insensitive duplicates, at most {@value #MAX_HIGHLIGHTS}.
     */
    public static List<String> highlights(List<ContentChunk> chunks) {
        List<String> highlights = new ArrayList<>();
        if (chunks == null) {
            return highlights;
        }
        Set<String> seen = new HashSet<>();
        for (ContentChunk chunk : chunks) {
            if (chunk.content() == null) {
                continue;
            }
            for (String sentence : SENTENCE_END.split(chunk.content())) {
                String normalized = trim(sentence);
                if (normalized.codePointCount(0, normalized.length()) < MIN_HIGHLIGHT_LENGTH) {
                    continue;
                }
                if (!seen.add(normalized.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                highlights.add(normalized);
                if (highlights.size() >= MAX_HIGHLIGHTS) {
                    return highlights;
                }
            }
        }
        return highlights;
    }

    static String trim(String segment) {
        int start = 0;
        int end = segment.length();
        while (start < end && isStrippable(segment.charAt(start))) {
            start++;
        }
        while (end > start && isStrippable(segment.charAt(end - 1))) {
            end--;
        }
        return segment.substring(start, end);
    }

    private static boolean isStrippable(char c) {
        return Character.isWhitespace(c) || STRIP_CHARS.indexOf(c) >= 0;
    }
}
