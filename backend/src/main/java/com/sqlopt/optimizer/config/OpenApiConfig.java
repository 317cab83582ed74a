package com.sqlopt.optimizer.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;

/** OpenAPI document for the optimizer endpoints, served by springdoc. */
@Configuration
public class OpenApiConfig {

  static final String TRINO_EXPLAIN_DOCS = "https://trino.io/docs/current/sql/explain.html";

  @Value("${springdoc.info.title:SQL Optimizer API}")
  private String title;

  @Value("${springdoc.info.version:0.1.0}")
  private String version;

  @Value("${server.port:8080}")
  private String serverPort;

  @Bean
  public OpenAPI optimizerOpenAPI(OptimizerProperties optimizerProperties) {
    String description =
        String.format(
            "Rewrites Trino SQL with a language model. A rewrite is returned only after EXPLAIN"
                + " accepts it and its row estimate stays within %.0f%% of the original"
                + " (up to %d fix attempts, read-only mode %s).",
            optimizerProperties.getImprovementTolerance() * 100,
            optimizerProperties.getMaxFixAttempts(),
            optimizerProperties.isReadOnlyMode() ? "on" : "off");

    return new OpenAPI()
        .info(new Info().title(title).version(version).description(description))
        .externalDocs(
            new ExternalDocumentation().description("Trino EXPLAIN").url(TRINO_EXPLAIN_DOCS))
        .servers(List.of(new Server().url("http://localhost:" + serverPort)));
  }
}
