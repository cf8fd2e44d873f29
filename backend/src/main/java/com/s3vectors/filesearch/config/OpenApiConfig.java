package com.s3vectors.filesearch.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;

@Configuration
public class OpenApiConfig {

  @Value("${springdoc.info.title:S3 Vector File Search API}")
  private String title;

  @Value("${springdoc.info.version:1.0.0}")
  private String version;

  @Value(
      "${springdoc.info.description:Upload files as embedding vectors to Amazon S3 Vectors and search them by similarity.}")
  private String description;

  @Value("${server.port:8080}")
  private String serverPort;

  @Bean
  public OpenAPI customOpenAPI() {
    return new OpenAPI()
        .info(new Info().title(title).version(version).description(description))
        .servers(
            List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description("Local development server")));
  }
}
