package com.aiusage.canonicalizer.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;

@Configuration
public class OpenApiConfig {

  @Value("${springdoc.info.title:AI Usage Survey Canonicalizer API}")
  private String title;

  @Value("${springdoc.info.version:1.0.0}")
  private String version;

  @Value(
      "${springdoc.info.description:Maps inconsistent survey headers and answers onto a canonical schema and reports usage, tool and feedback distributions.}")
  private String description;

  @Value("${springdoc.info.license.name:Apache 2.0}")
  private String licenseName;

  @Value("${springdoc.info.license.url:https://www.apache.org/licenses/LICENSE-2.0}")
  private String licenseUrl;

  @Value("${server.port:8080}")
  private String serverPort;

  @Bean
  public OpenAPI customOpenAPI() {
    return new OpenAPI()
        .info(
            new Info()
                .title(title)
                .version(version)
                .description(description)
                .license(new License().name(licenseName).url(licenseUrl)))
        .servers(
            List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description("Local development server")));
  }
}
