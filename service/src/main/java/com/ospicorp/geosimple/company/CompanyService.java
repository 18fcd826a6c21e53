package com.ospicorp.geosimple.company;

import java.sql.SQLException;
import java.util.Set;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Entry point for company operations. Sits outside the transaction of {@link CompanyStore} so
 * that failures raised while opening or committing it are translated too.
 */
@Service
public class CompanyService {

  static final String INVALID_PARAMETER_VALUE = "22023";
  static final String UNIQUE_VIOLATION = "23505";
  // undefined_table, undefined_function, undefined_column, undefined_object
  private static final Set<String> SCHEMA_STATES = Set.of("42P01", "42883", "42703", "42704");

  private final CompanyStore store;

  public CompanyService(CompanyStore store) {
    this.store = store;
  }

  public Company insert(Company company) {
    return translated(() -> store.insert(company));
  }

  public Company select(int id) {
    return translated(() -> store.select(id));
  }

  public Company update(int id, Company changes) {
    return translated(() -> store.update(id, changes));
  }

  public void delete(int id) {
    translated(() -> {
      store.delete(id);
      return null;
    });
  }

  private static <T> T translated(Supplier<T> operation) {
    try {
      return operation.get();
    } catch (CannotCreateTransactionException ex) {
      throw new StoreUnavailableException(
          "Company store unavailable: " + ex.getMostSpecificCause().getMessage(), ex);
    } catch (DataAccessException ex) {
      throw translate(ex);
    }
  }

  static RuntimeException translate(DataAccessException ex) {
    String sqlState = sqlState(ex);
    String message = ex.getMostSpecificCause().getMessage();
    if (INVALID_PARAMETER_VALUE.equals(sqlState)) {
      return new InvalidCoordinateException(message, ex);
    }
    if (sqlState != null && SCHEMA_STATES.contains(sqlState)) {
      return new SchemaMissingException("Company schema not installed: " + message, ex);
    }
    if (ex instanceof DataIntegrityViolationException) {
      CompanyConstraintException.Reason reason = UNIQUE_VIOLATION.equals(sqlState)
          ? CompanyConstraintException.Reason.DUPLICATE_ID
          : CompanyConstraintException.Reason.INTEGRITY;
      return new CompanyConstraintException(reason, message, ex);
    }
    if (ex instanceof DataAccessResourceFailureException) {
      return new StoreUnavailableException("Company store unavailable: " + message, ex);
    }
    return ex;
  }

  private static String sqlState(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
        return sqlException.getSQLState();
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return null;
  }
}
