package com.ospicorp.geosimple.company;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.geosimple.support.PostgisContainerTestBase;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class CompanyStoreTest extends PostgisContainerTestBase {

  private static final double LAT = 45.543;
  private static final double LON = -74.456;

  @Autowired
  private CompanyService companyService;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM company");
  }

  @Test
  void insertSelectDeleteRoundTrip() {
    Company stored = companyService.insert(new Company(10001, "geosimple", LAT, LON));
    assertThat(stored.getId()).isEqualTo(10001);
    assertThat(stored.getGeom()).isNotNull();

    Company selected = companyService.select(10001);
    assertThat(selected.getId()).isEqualTo(10001);
    assertThat(selected.getName()).isEqualTo("geosimple");
    assertThat(selected.getLatitude()).isEqualTo(LAT);
    assertThat(selected.getLongitude()).isEqualTo(LON);
    assertThat(selected.getGeom()).isNotNull();
    assertThat(selected.getGeom().getX()).isEqualTo(LON);
    assertThat(selected.getGeom().getY()).isEqualTo(LAT);
    assertThat(selected.getGeom().getSRID()).isEqualTo(4326);

    Map<String, Object> row = jdbcTemplate.queryForMap("SELECT * FROM company WHERE id = 10001");
    assertThat(row).hasSize(5);

    companyService.delete(10001);

    assertThatThrownBy(() -> companyService.select(10001))
        .isInstanceOf(CompanyNotFoundException.class);
  }

  @Test
  void storedGeomDecodesLongitudeFirst() {
    companyService.insert(new Company(10001, "geosimple", LAT, LON));

    Map<String, Object> point = jdbcTemplate.queryForMap("""
        SELECT ST_X(geom) AS x, ST_Y(geom) AS y, ST_SRID(geom) AS srid, ST_AsText(geom) AS wkt
        FROM company WHERE id = 10001
        """);
    assertThat(point).containsEntry("x", LON)
        .containsEntry("y", LAT)
        .containsEntry("srid", 4326)
        .containsEntry("wkt", "POINT(-74.456 45.543)");
  }

  @Test
  void insertWithoutCoordinatesSucceedsWithNullGeom() {
    Company noLongitude = companyService.insert(new Company(null, "no-lon", LAT, null));
    Company noLatitude = companyService.insert(new Company(null, "no-lat", null, LON));
    Company neither = companyService.insert(new Company(null, "neither", null, null));

    assertThat(companyService.select(noLongitude.getId()).getGeom()).isNull();
    assertThat(companyService.select(noLatitude.getId()).getGeom()).isNull();
    assertThat(companyService.select(neither.getId()).getGeom()).isNull();
  }

  @Test
  void insertWithoutIdGeneratesOne() {
    Company first = companyService.insert(new Company(null, "first", 1d, 2d));
    Company second = companyService.insert(new Company(null, "second", 3d, 4d));

    assertThat(first.getId()).isNotNull().isPositive();
    assertThat(second.getId()).isNotNull().isNotEqualTo(first.getId());
    assertThat(companyService.select(second.getId()).getGeom()).isNotNull();
  }

  @Test
  void generatedIdSkipsIdsTakenByCallers() {
    long next = jdbcTemplate.queryForObject(
        "SELECT CASE WHEN is_called THEN last_value + 1 ELSE last_value END FROM company_id_seq",
        Long.class);
    int taken = Math.toIntExact(next);
    companyService.insert(new Company(taken, "manual", LAT, LON));
    companyService.insert(new Company(taken + 1, "manual-next", LAT, LON));

    Company generated = companyService.insert(new Company(null, "generated", 1d, 2d));

    assertThat(generated.getId()).isNotIn(taken, taken + 1);
    assertThat(companyService.select(taken).getName()).isEqualTo("manual");
    assertThat(companyService.select(generated.getId()).getName()).isEqualTo("generated");
  }

  @Test
  void duplicateIdIsRejectedAndOriginalKept() {
    companyService.insert(new Company(10001, "geosimple", LAT, LON));

    assertThatThrownBy(() -> companyService.insert(new Company(10001, "imposter", 0d, 0d)))
        .isInstanceOfSatisfying(CompanyConstraintException.class,
            ex -> assertThat(ex.reason()).isEqualTo(CompanyConstraintException.Reason.DUPLICATE_ID));

    assertThat(companyService.select(10001).getName()).isEqualTo("geosimple");
  }

  @Test
  void invalidCoordinatePersistsNothing() {
    assertThatThrownBy(() -> companyService.insert(new Company(10001, "offworld", 91d, 0d)))
        .isInstanceOf(InvalidCoordinateException.class);

    Integer count = jdbcTemplate.queryForObject("SELECT count(*) FROM company", Integer.class);
    assertThat(count).isZero();
  }

  @Test
  void missingNameIsRejected() {
    assertThatThrownBy(() -> companyService.insert(new Company(10001, null, LAT, LON)))
        .isInstanceOf(CompanyConstraintException.class);

    Integer count = jdbcTemplate.queryForObject("SELECT count(*) FROM company", Integer.class);
    assertThat(count).isZero();
  }

  @Test
  void updateRederivesGeom() {
    companyService.insert(new Company(10001, "geosimple", LAT, LON));

    companyService.update(10001, new Company(null, "moved", 10d, 20d));

    Map<String, Object> point = jdbcTemplate.queryForMap(
        "SELECT name, ST_X(geom) AS x, ST_Y(geom) AS y FROM company WHERE id = 10001");
    assertThat(point).containsEntry("name", "moved")
        .containsEntry("x", 20d)
        .containsEntry("y", 10d);
  }

  @Test
  void updateClearingCoordinateClearsGeom() {
    companyService.insert(new Company(10001, "geosimple", LAT, LON));

    companyService.update(10001, new Company(null, "geosimple", LAT, null));

    assertThat(companyService.select(10001).getGeom()).isNull();
  }

  @Test
  void deleteMissingIsNotFound() {
    assertThatThrownBy(() -> companyService.delete(10001))
        .isInstanceOf(CompanyNotFoundException.class);
  }
}
