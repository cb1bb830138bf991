package com.rhythm360.monitor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Rhythm Monitor API")
            .version("v1")
            .description("Live heart-rate monitoring sessions, multi-model assessments, trends "
                + "and CSV exports. Assessments are rule-based and not a medical diagnosis.")
            .contact(new Contact().name("Rhythm 360 Team")))
        .servers(List.of(new Server().url("/")));
  }
}
