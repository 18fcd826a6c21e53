package com.ospicorp.geosimple.company;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.springframework.stereotype.Component;

/**
 * Derives the {@code geom} column of a company from its raw coordinates.
 *
 * <p>Called by {@link CompanyService} immediately before every insert, and again on update.
 * The point is built longitude first, latitude second, and carries the SRID of the
 * {@link GeometryFactory} (4326). A missing coordinate clears the geometry; a non-finite or
 * out-of-range coordinate fails the write with {@link InvalidCoordinateException}.
 */
@Component
public class CoordinateDerivation {

  public static final int SRID = 4326;

  private final GeometryFactory geometryFactory;

  public CoordinateDerivation(GeometryFactory geometryFactory) {
    if (geometryFactory.getSRID() != SRID) {
      throw new IllegalArgumentException(
          "GeometryFactory must use SRID " + SRID + " but uses " + geometryFactory.getSRID());
    }
    this.geometryFactory = geometryFactory;
  }

  public Company derive(Company company) {
    Double latitude = company.getLatitude();
    Double longitude = company.getLongitude();
    if (latitude == null || longitude == null) {
      company.setGeom(null);
      return company;
    }
    validate(latitude, longitude);
    Point point = geometryFactory.createPoint(new Coordinate(longitude, latitude));
    company.setGeom(point);
    return company;
  }

  private static void validate(double latitude, double longitude) {
    if (!Double.isFinite(latitude) || latitude < -90d || latitude > 90d) {
      throw new InvalidCoordinateException(
          "Invalid latitude " + latitude + ". Supported range: -90 to 90.");
    }
    if (!Double.isFinite(longitude) || longitude < -180d || longitude > 180d) {
      throw new InvalidCoordinateException(
          "Invalid longitude " + longitude + ". Supported range: -180 to 180.");
    }
  }
}
