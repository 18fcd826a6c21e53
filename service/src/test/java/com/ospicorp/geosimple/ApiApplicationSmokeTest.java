package com.ospicorp.geosimple;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.geosimple.support.PostgisContainerTestBase;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ApiApplicationSmokeTest extends PostgisContainerTestBase {

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
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody()).containsEntry("pong", true);
    assertThat(response.getHeaders().getFirst("X-Request-Id")).isNotBlank();
  }

  @Test
  void healthReportsCompanySchema() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/actuator/health",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).containsEntry("status", "UP");
    @SuppressWarnings("unchecked")
    Map<String, Object> components = (Map<String, Object>) body.get("components");
    @SuppressWarnings("unchecked")
    Map<String, Object> schema = (Map<String, Object>) components.get("companySchema");
    assertThat(schema).containsEntry("status", "UP");
  }
}
