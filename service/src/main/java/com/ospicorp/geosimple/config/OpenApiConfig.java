package com.ospicorp.geosimple.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
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
            .title("Geosimple Company API")
            .version("v1")
            .description("Company records with a point geometry derived from latitude and longitude")
            .contact(new Contact().name("Geosimple Team").email("api-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
