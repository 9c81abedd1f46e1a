package com.example.safespace.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "SafeSpace API",
        version = "v1",
        description = "Anonymous sessions, supportive chat and incident report generation."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("SafeSpace API")
            .version("v1")
            .description("Swagger UI for the session, chat and report endpoints.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi safespaceApi() {
    return GroupedOpenApi.builder()
        .group("safespace")
        .packagesToScan("com.example.safespace.controller")
        .pathsToMatch("/api/v1/**")
        .build();
  }

  @Bean
  public GroupedOpenApi healthApi() {
    return GroupedOpenApi.builder()
        .group("health")
        .pathsToMatch("/", "/health/**", "/actuator/**")
        .build();
  }
}
