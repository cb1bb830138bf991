package com.rhythm360.monitor;

import static org.assertj.core.api.Assertions.assertThat;

import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
class MonitorApplicationSmokeTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16");

  @DynamicPropertySource
  static void configureDataSource(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
  }

  @Autowired
  private TestRestTemplate restTemplate;

  @Test
  void pingRespondsWithPong() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/v1/ping",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("pong", true);
  }

  @Test
  void openapiDocumentIsServedAndValid() {
    String yaml = restTemplate.getForObject("/v3/api-docs.yaml", String.class);
    assertThat(yaml).contains("openapi:").contains("/v1/sessions/{deviceId}/start");

    ParseOptions options = new ParseOptions();
    options.setResolve(true);
    SwaggerParseResult result = new OpenAPIV3Parser().readContents(yaml, null, options);
    assertThat(result.getMessages()).as("validation messages").isEmpty();
    assertThat(result.getOpenAPI()).isNotNull();
  }

  @Test
  void monitoringRoundTripPersistsAndCaches() {
    String base = "/v1/sessions/watch-smoke";
    assertThat(restTemplate.postForEntity(base + "/start", null, Map.class).getStatusCode())
        .isEqualTo(HttpStatus.OK);
    try {
      for (int i = 0; i < 20; i++) {
        ResponseEntity<Map> pushed = restTemplate.postForEntity(
            "/v1/sensors/watch-smoke/samples", Map.of("value", 68 + (i % 5)), Map.class);
        assertThat(pushed.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
      }

      ResponseEntity<Map<String, Object>> report = restTemplate.exchange(
          base + "/assessments",
          HttpMethod.POST,
          null,
          new ParameterizedTypeReference<>() {});
      assertThat(report.getStatusCode()).isEqualTo(HttpStatus.OK);
      assertThat(report.getBody()).containsEntry("persisted", true);

      ResponseEntity<Map> latest = restTemplate.getForEntity("/v1/assessments/latest", Map.class);
      assertThat(latest.getStatusCode()).isEqualTo(HttpStatus.OK);

      ResponseEntity<String> csv = restTemplate.getForEntity(
          "/v1/exports/assessments?days=1", String.class);
      assertThat(csv.getStatusCode()).isEqualTo(HttpStatus.OK);
      assertThat(csv.getBody()).startsWith("Date,Time,HeartRate");
    } finally {
      restTemplate.postForEntity(base + "/stop", null, Map.class);
    }
  }
}
