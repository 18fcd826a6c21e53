package com.ospicorp.geosimple.config;

import com.ospicorp.geosimple.company.CompanyConstraintException;
import com.ospicorp.geosimple.company.InvalidCoordinateException;
import com.ospicorp.geosimple.company.SchemaMissingException;
import com.ospicorp.geosimple.company.StoreUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final String PROBLEM_BASE = "https://docs.geosimple.dev/problems/";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.UNAUTHORIZED, "unauthorized",
      HttpStatus.FORBIDDEN, "forbidden",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.CONFLICT, "constraint-violation",
      HttpStatus.UNPROCESSABLE_ENTITY, "invalid-coordinate",
      HttpStatus.SERVICE_UNAVAILABLE, "store-unavailable",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class,
      IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(CompanyConstraintException.class)
  public ResponseEntity<ProblemDetail> handleConstraint(CompanyConstraintException ex,
      HttpServletRequest request) {
    HttpStatus status = ex.reason() == CompanyConstraintException.Reason.MISSING_FIELD
        ? HttpStatus.BAD_REQUEST
        : HttpStatus.CONFLICT;
    ResponseEntity<ProblemDetail> response = buildProblem(status, ex, request);
    response.getBody().setProperty("reason", ex.reason().name());
    return response;
  }

  @ExceptionHandler(InvalidCoordinateException.class)
  public ResponseEntity<ProblemDetail> handleInvalidCoordinate(InvalidCoordinateException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, ex, request);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleStoreUnavailable(StoreUnavailableException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
  }

  @ExceptionHandler(SchemaMissingException.class)
  public ResponseEntity<ProblemDetail> handleSchemaMissing(SchemaMissingException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response =
        buildProblem(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
    response.getBody().setType(URI.create(PROBLEM_BASE + "schema-missing"));
    return response;
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleUnauthorized(AuthenticationException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.UNAUTHORIZED, ex, request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(AccessDeniedException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.FORBIDDEN, ex, request);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return buildProblem(status, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_BASE + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          request.getMethod(),
          Requests.uriWithQuery(request),
          Requests.clientIp(request),
          status.value(),
          errorMessage,
          ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          request.getMethod(),
          Requests.uriWithQuery(request),
          Requests.clientIp(request),
          status.value(),
          errorMessage);
    }
  }
}
