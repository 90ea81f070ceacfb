package com.example.CourseRag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class QdrantConfig {

    @Bean
    public RestClient qdrantRestClient(RestClient.Builder builder, RagProperties properties) {
        RagProperties.Qdrant qdrant = properties.getQdrant();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(qdrant.getTimeout());
        requestFactory.setReadTimeout(qdrant.getTimeout());

        RestClient.Builder configured = builder.clone()
                .baseUrl(qdrant.getUrl())
                .requestFactory(requestFactory);
        if (qdrant.getApiKey() != null && !qdrant.getApiKey().isBlank()) {
            configured.defaultHeader("api-key", qdrant.getApiKey());
        }
        return configured.build();
    }
}
