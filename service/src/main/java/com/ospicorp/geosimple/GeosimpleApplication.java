package com.ospicorp.geosimple;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GeosimpleApplication {

  public static void main(String[] args) {
    SpringApplication.run(GeosimpleApplication.class, args);
  }
}
