package com.example.CourseRag.util;

import com.example.CourseRag.model.ContentChunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Markdown layout shared by both synthesis tiers.
 * Section order: summary heading, body, source listing, closing invitation.
 */
public final class AnswerMarkdown {

    public static final String SUMMARY_HEADING = "#### Главное";
    public static final String SOURCES_HEADING = "#### Использованные фрагменты";
    public static final String PLACEHOLDER_HIGHLIGHT = "Материалы подтверждают базовые определения и шаги RAG.";
    public static final String OUTRO = """
            #### Что дальше?
            Если нужен пошаговый план или хочется раскрыть конкретный шаг, задай уточняющий вопрос, \
            и я подберу дополнительные материалы.""";

    private AnswerMarkdown() {
    }

    /**
     * Single-line heading; line breaks in the question are folded into spaces.
     */
    public static String intro(String question) {
        return "### Короткий ответ на запрос «" + question.strip().replaceAll("\\s+", " ") + "»";
    }

    /**
     * Extractive answer: bullet list of highlights, or the placeholder when there are none.
     */
    public static String extractive(String question, List<String> highlights, List<ContentChunk> sources) {
        List<String> body = new ArrayList<>();
        body.add(SUMMARY_HEADING);
        body.add("");
        if (highlights.isEmpty()) {
            body.add("- " + PLACEHOLDER_HIGHLIGHT);
        } else {
            highlights.forEach(h -> body.add("- " + h));
        }
        return compose(question, body, sources);
    }

    /**
     * Generated answer: model prose under the summary heading.
     */
    public static String generative(String question, String generated, List<ContentChunk> sources) {
        return compose(question, List.of(SUMMARY_HEADING, "", generated.strip()), sources);
    }

    public static String sourceListing(List<ContentChunk> sources) {
        List<String> lines = new ArrayList<>();
        lines.add(SOURCES_HEADING);
        lines.add("");
        for (int i = 0; i < sources.size(); i++) {
            ContentChunk src = sources.get(i);
            StringBuilder item = new StringBuilder();
            item.append(i + 1).append(". **").append(meta(src)).append("**").append(sourceHint(src));
            String content = src.content() == null ? "" : src.content().strip();
            for (String line : content.split("\\R", -1)) {
                item.append("\n   > ").append(line.strip());
            }
            lines.add(item.toString());
        }
        return String.join("\n", lines);
    }

    /**
     * "title · topic (source, chunk #n)", used to tag fragments in prompts.
     */
    public static String provenance(ContentChunk chunk) {
        return meta(chunk) + sourceHint(chunk);
    }

    private static String compose(String question, List<String> body, List<ContentChunk> sources) {
        List<String> sections = new ArrayList<>();
        sections.add(intro(question));
        sections.add("");
        sections.addAll(body);
        sections.add("");
        sections.add(sourceListing(sources));
        sections.add("");
        sections.add(OUTRO);
        return String.join("\n", sections);
    }

    private static String meta(ContentChunk chunk) {
        if (chunk.topic() == null || chunk.topic().isBlank()) {
            return chunk.assignmentTitle();
        }
        return chunk.assignmentTitle() + " · " + chunk.topic();
    }

    private static String sourceHint(ContentChunk chunk) {
        if (chunk.source() == null || chunk.source().isBlank()) {
            return "";
        }
        if (chunk.chunkNumber() == null) {
            return " (" + chunk.source() + ")";
        }
        return " (" + chunk.source() + ", chunk #" + chunk.chunkNumber() + ")";
    }
}
