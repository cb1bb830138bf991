package com.rhythm360.monitor.config;

import com.rhythm360.monitor.assessment.InsufficientDataException;
import com.rhythm360.monitor.session.MonitoringConfigurationException;
import com.rhythm360.monitor.session.SessionNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String PROBLEM_BASE = "https://docs.rhythm360.dev/problems/";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.UNAUTHORIZED, "unauthorized",
      HttpStatus.FORBIDDEN, "forbidden",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.UNPROCESSABLE_ENTITY, "insufficient-data",
      HttpStatus.SERVICE_UNAVAILABLE, "sensor-unavailable",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
      HandlerMethodValidationException.class, HttpMessageNotReadableException.class,
      IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler({SessionNotFoundException.class, NoSuchElementException.class})
  public ResponseEntity<ProblemDetail> handleNotFound(RuntimeException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ProblemDetail> handleUnmapped(NoResourceFoundException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(MonitoringConfigurationException.class)
  public ResponseEntity<ProblemDetail> handleSensorUnavailable(
      MonitoringConfigurationException ex, HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response =
        buildProblem(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
    if (response.getBody() != null) {
      response.getBody().setProperty("deviceId", ex.deviceId());
    }
    return response;
  }

  @ExceptionHandler(InsufficientDataException.class)
  public ResponseEntity<ProblemDetail> handleInsufficientData(InsufficientDataException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response =
        buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, ex, request);
    if (response.getBody() != null) {
      response.getBody().setProperty("deviceId", ex.deviceId());
    }
    return response;
  }

  @ExceptionHandler(CompletionException.class)
  public ResponseEntity<ProblemDetail> handleAsyncFailure(CompletionException ex,
      HttpServletRequest request) {
    Throwable cause = ex.getCause();
    if (cause instanceof SessionNotFoundException notFound) {
      return handleNotFound(notFound, request);
    }
    if (cause instanceof InsufficientDataException insufficient) {
      return handleInsufficientData(insufficient, request);
    }
    if (cause instanceof IllegalArgumentException illegal) {
      return handleBadRequest(illegal, request);
    }
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR,
        cause instanceof Exception e ? e : ex, request);
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
    String method = request.getMethod();
    String uri = RequestDescriptions.uriWithQuery(request);
    String clientIp = RequestDescriptions.clientIp(request);
    String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      message = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      if (status == HttpStatus.SERVICE_UNAVAILABLE) {
        log.warn("Request {} {} from {} returned status {}: {}", method, uri, clientIp,
            status.value(), message);
      } else {
        log.error("Request {} {} from {} failed with status {}: {}", method, uri, clientIp,
            status.value(), message, ex);
      }
    } else {
      log.warn("Request {} {} from {} returned status {}: {}", method, uri, clientIp,
          status.value(), message);
    }
  }
}
