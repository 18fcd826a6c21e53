package com.ospicorp.geosimple.company;

import java.util.List;
import org.locationtech.jts.geom.Point;

public record PointDto(
    String type,
    int srid,
    List<Double> coordinates,
    String wkt
) {

  public static PointDto from(Point point) {
    if (point == null || point.isEmpty()) {
      return null;
    }
    return new PointDto("Point", point.getSRID(), List.of(point.getX(), point.getY()),
        point.toText());
  }
}
