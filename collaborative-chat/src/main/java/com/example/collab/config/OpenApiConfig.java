package com.example.collab.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Collaborative Chat API",
                        version = "1.0",
                        description = "Prompt lock, invites, membership and ownership of shared AI chat sessions.",
                        contact = @Contact(name = "Collaborative Chat Team", email = "collab@example.com")))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi collaborativeApi() {
        return GroupedOpenApi.builder()
                .group("collaborative")
                .pathsToMatch("/api/collaborative/**")
                .build();
    }
}
