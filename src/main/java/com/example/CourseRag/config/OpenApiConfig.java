package com.example.CourseRag.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI courseRagOpenApi(RagProperties properties) {
        return new OpenAPI()
                .info(new Info()
                        .title("CourseRag API")
                        .version("v1")
                        .description("Answers questions about course materials from the '"
                                + properties.getQdrant().getCollection() + "' collection. "
                                + "Answers are Markdown with the fragments used and, when available, related concepts."))
                .addTagsItem(new Tag().name("chat").description("Question answering and example prompts"));
    }
}
