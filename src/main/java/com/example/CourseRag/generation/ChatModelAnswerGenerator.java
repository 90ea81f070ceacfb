package com.example.CourseRag.generation;

import com.example.CourseRag.model.ContentChunk;
import com.example.CourseRag.util.AnswerMarkdown;
import com.example.CourseRag.util.BackendHandle;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.util.List;
import java.util.Optional;

/**
 * Asks a chat model for the answer prose.
 *
 * Prompt layout: fixed system instruction, one worked example (user + assistant), then the
 * live question with the retrieved fragments. Each fragment is cut to a character budget and
 * tagged with its provenance.
 */
public class ChatModelAnswerGenerator implements AnswerGenerator {

    private final BackendHandle<ChatClient> chatClient;
    private final double temperature;
    private final int maxTokens;
    private final int chunkCharBudget;

    public ChatModelAnswerGenerator(BackendHandle<ChatClient> chatClient,
                                    double temperature,
                                    int maxTokens,
                                    int chunkCharBudget) {
        this.chatClient = chatClient;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.chunkCharBudget = chunkCharBudget;
    }

    @Override
    public String name() {
        return chatClient.name();
    }

    @Override
    public GenerationResult generate(String question, List<ContentChunk> chunks) {
        Optional<ChatClient> client = chatClient.get();
        if (client.isEmpty()) {
            return GenerationResult.failed(new IllegalStateException("No chat model is available"));
        }
        try {
            String content = client.get().prompt()
                    .messages(buildMessages(question, chunks))
                    .options(ChatOptions.builder()
                            .temperature(temperature)
                            .maxTokens(maxTokens)
                            .build())
                    .call()
                    .content();
            if (content == null || content.isBlank()) {
                return GenerationResult.failed(new IllegalStateException("Chat model returned an empty answer"));
            }
            return GenerationResult.ok(content.strip());
        } catch (RuntimeException e) {
            return GenerationResult.failed(e);
        }
    }

    List<Message> buildMessages(String question, List<ContentChunk> chunks) {
        return List.of(
                new SystemMessage(AnswerPrompts.SYSTEM_PROMPT),
                new UserMessage(AnswerPrompts.EXAMPLE_QUESTION),
                new AssistantMessage(AnswerPrompts.EXAMPLE_ANSWER),
                new UserMessage(AnswerPrompts.QUESTION_TEMPLATE.formatted(question.strip(), buildContext(chunks)))
        );
    }

    /**
     * Numbered fragment block:
     * <pre>
     * [1] title · topic (source, chunk #n)
     * shortened content
     * </pre>
     */
    String buildContext(List<ContentChunk> chunks) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            ContentChunk chunk = chunks.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            sb.append('[').append(i + 1).append("] ")
                    .append(AnswerMarkdown.provenance(chunk))
                    .append('\n')
                    .append(shorten(chunk.content(), chunkCharBudget));
        }
        return sb.toString();
    }

    static String shorten(String text, int budget) {
        if (text == null) {
            return "";
        }
        String normalized = text.strip().replaceAll("\\s+", " ");
        if (normalized.length() <= budget) {
            return normalized;
        }
        int cut = normalized.lastIndexOf(' ', budget);
        if (cut < budget / 2) {
            cut = budget;
        }
        return normalized.substring(0, cut).stripTrailing() + "…";
    }
}
