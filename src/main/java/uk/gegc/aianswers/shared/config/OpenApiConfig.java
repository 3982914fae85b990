package uk.gegc.aianswers.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI aiAnswersOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("AI Questions API")
                        .version("1.0.0")
                        .description("Stores each user's answers to the AI onboarding questions"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("Firebase ID token")));
    }

    @Bean
    public GroupedOpenApi answersGroup() {
        return GroupedOpenApi.builder()
                .group("answers")
                .displayName("AI Answers")
                .pathsToMatch("/api/ai-answers/**", "/api/ai-answers")
                .build();
    }
}
