package com.example.CourseRag.controller;

import com.example.CourseRag.model.ChatRequest;
import com.example.CourseRag.model.ChatResponse;
import com.example.CourseRag.service.RagChatService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "chat")
public class RagChatController {

    private final RagChatService ragChatService;

    /**
     * POST /api/chat
     * {
     *   "message": "Как устроен RAG-пайплайн?",
     *   "limit": 4
     * }
     */
    @PostMapping("/api/chat")
    public ChatResponse chat(@RequestBody ChatRequest request) {
        return ragChatService.answer(request.message(), request.limit());
    }

    @GetMapping("/api/examples")
    public Map<String, List<String>> examples() {
        return Map.of("examples", ragChatService.examplePrompts());
    }

    @GetMapping("/healthz")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
