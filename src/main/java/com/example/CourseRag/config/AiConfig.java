package com.example.CourseRag.config;

import com.example.CourseRag.embedding.EmbeddingStrategy;
import com.example.CourseRag.embedding.HashEmbeddingStrategy;
import com.example.CourseRag.embedding.ModelEmbeddingStrategy;
import com.example.CourseRag.generation.AnswerGenerator;
import com.example.CourseRag.generation.ChatModelAnswerGenerator;
import com.example.CourseRag.generation.DisabledAnswerGenerator;
import com.example.CourseRag.util.BackendHandle;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class AiConfig {

    /**
     * Chat client for the generative tier, resolved on first use.
     * The configured provider wins; otherwise whichever chat model exists.
     * Empty when no chat model is configured (spring.ai.model.chat=none).
     */
    @Bean
    public BackendHandle<ChatClient> chatClientHandle(
            RagProperties properties,
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        String provider = properties.getGeneration().getProvider();
        return new BackendHandle<>("chat-model:" + provider, () -> {
            ChatModel model = "openai".equalsIgnoreCase(provider)
                    ? firstAvailable(openAiProvider.getIfAvailable(), deepSeekProvider.getIfAvailable())
                    : firstAvailable(deepSeekProvider.getIfAvailable(), openAiProvider.getIfAvailable());
            return model == null ? null : ChatClient.builder(model).build();
        });
    }

    @Bean
    public BackendHandle<EmbeddingModel> embeddingModelHandle(ObjectProvider<EmbeddingModel> embeddingModelProvider) {
        return new BackendHandle<>("embedding-model", embeddingModelProvider::getIfAvailable);
    }

    @Bean
    public HashEmbeddingStrategy hashEmbeddingStrategy(RagProperties properties) {
        return new HashEmbeddingStrategy(properties.getEmbedding().getDimension());
    }

    /**
     * The strategy named by rag.embedding.strategy, chosen once at startup.
     */
    @Bean
    @Primary
    public EmbeddingStrategy embeddingStrategy(
            RagProperties properties,
            BackendHandle<EmbeddingModel> embeddingModelHandle,
            HashEmbeddingStrategy hashEmbeddingStrategy
    ) {
        return switch (properties.getEmbedding().getStrategy()) {
            case MODEL -> new ModelEmbeddingStrategy(embeddingModelHandle, properties.getEmbedding().getDimension());
            case FALLBACK -> hashEmbeddingStrategy;
        };
    }

    @Bean
    public AnswerGenerator answerGenerator(RagProperties properties, BackendHandle<ChatClient> chatClientHandle) {
        RagProperties.Generation generation = properties.getGeneration();
        return switch (generation.getMode()) {
            case GENERATIVE -> new ChatModelAnswerGenerator(
                    chatClientHandle,
                    generation.getTemperature(),
                    generation.getMaxTokens(),
                    generation.getChunkCharBudget());
            case EXTRACTIVE -> new DisabledAnswerGenerator();
        };
    }

    private static ChatModel firstAvailable(ChatModel preferred, ChatModel alternative) {
        return preferred != null ? preferred : alternative;
    }
}
