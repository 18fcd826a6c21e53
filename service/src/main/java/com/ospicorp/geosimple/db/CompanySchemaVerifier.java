package com.ospicorp.geosimple.db;

import com.ospicorp.geosimple.company.SchemaMissingException;
import com.ospicorp.geosimple.company.StoreUnavailableException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Checks that the bootstrap migration left the store usable: postgis enabled, the company
 * table with its five columns, and the before-insert derivation trigger.
 */
@Component
public class CompanySchemaVerifier {
  private static final Logger log = LoggerFactory.getLogger(CompanySchemaVerifier.class);

  static final String EXTENSION = "postgis";
  static final String TABLE = "company";
  static final String TRIGGER = "add_company_geom";
  static final List<String> COLUMNS = List.of("id", "name", "latitude", "longitude", "geom");

  private final JdbcTemplate jdbc;

  public CompanySchemaVerifier(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  public SchemaReport inspect() {
    try {
      Boolean extension = jdbc.queryForObject(
          "SELECT EXISTS (SELECT 1 FROM pg_extension WHERE extname = ?)", Boolean.class, EXTENSION);
      List<String> columns = jdbc.queryForList("""
          SELECT column_name FROM information_schema.columns
          WHERE table_schema = current_schema() AND table_name = ?
          """, String.class, TABLE);
      Boolean trigger = jdbc.queryForObject("""
          SELECT EXISTS (
            SELECT 1 FROM pg_trigger t
            JOIN pg_class c ON c.oid = t.tgrelid
            WHERE c.relname = ? AND t.tgname = ? AND NOT t.tgisinternal
          )
          """, Boolean.class, TABLE, TRIGGER);
      List<String> missingColumns = COLUMNS.stream()
          .filter(column -> !columns.contains(column))
          .toList();
      return new SchemaReport(Boolean.TRUE.equals(extension), missingColumns,
          Boolean.TRUE.equals(trigger));
    } catch (DataAccessResourceFailureException ex) {
      throw new StoreUnavailableException("Company store unavailable: " + ex.getMessage(), ex);
    } catch (DataAccessException ex) {
      throw new SchemaMissingException("Unable to inspect company schema: " + ex.getMessage(), ex);
    }
  }

  public SchemaReport verify() {
    SchemaReport report = inspect();
    if (!report.complete()) {
      log.error("Company schema incomplete, missing: {}", report.missing());
      throw new SchemaMissingException(report.missing());
    }
    log.info("Company schema verified: extension {}, table {}, trigger {}", EXTENSION, TABLE,
        TRIGGER);
    return report;
  }
}
