package com.jreinhal.knowledge.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation served at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:knowledge-agent}")
    private String appName;

    @Bean
    public OpenAPI knowledgeAgentOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title(appName + " API")
                        .description("""
                                Conversational knowledge agent.

                                - Query: answer questions from long-term memory and thread context
                                - Ingest: store the useful parts of a chat thread as memories
                                - Tasks: inspect background sub-agent work
                                """)
                        .version("1.0.0"))
                .components(new Components()
                        .addSecuritySchemes("apiKey", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-API-Key")))
                .security(List.of(new SecurityRequirement().addList("apiKey")))
                .tags(List.of(
                        new Tag().name("Query").description("Question answering"),
                        new Tag().name("Ingest").description("Thread ingestion"),
                        new Tag().name("System").description("Health and background tasks")));
    }
}
