package com.ospicorp.geosimple.config;

import com.ospicorp.geosimple.company.CoordinateDerivation;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GeometryConfig {

  @Bean
  public GeometryFactory geometryFactory() {
    return new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING),
        CoordinateDerivation.SRID);
  }
}
