package com.assetplatform.assetapi.config;

import com.assetplatform.assetapi.assets.AssetConcurrentModificationException;
import com.assetplatform.assetapi.assets.AssetNotFoundException;
import com.assetplatform.assetapi.assets.AssetValidationException;
import com.assetplatform.assetapi.siteareas.SiteAreaNotFoundException;
import com.assetplatform.assetapi.telemetry.AssetConnectorNotConfiguredException;
import com.assetplatform.assetapi.telemetry.InvalidAssetOperationException;
import com.assetplatform.domain.assets.AssetDomainException;
import com.assetplatform.integration.connector.AssetConnectorException;
import com.assetplatform.integration.connector.ConnectorErrors;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final String TYPE_PREFIX = "/problems/";

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    ProblemDetail problem =
        problem(
            HttpStatus.BAD_REQUEST,
            "Request validation failed",
            "validation-error",
            "Validation Error");
    problem.setProperty(
        "errors",
        ex.getFieldErrors().stream()
            .map(
                fe ->
                    new FieldError(
                        fe.getField(),
                        fe.getDefaultMessage(),
                        String.valueOf(fe.getRejectedValue())))
            .toList());
    return problem;
  }

  @ExceptionHandler(AssetValidationException.class)
  public ProblemDetail handleAssetValidation(AssetValidationException ex) {
    return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "validation-error", "Validation Error");
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ProblemDetail handleMissingParam(MissingServletRequestParameterException ex) {
    return problem(
        HttpStatus.BAD_REQUEST, ex.getMessage(), "missing-parameter", "Missing Parameter");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    String detail =
        String.format(
            "Parameter '%s' should be of type '%s'",
            ex.getName(),
            ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");
    return problem(HttpStatus.BAD_REQUEST, detail, "type-mismatch", "Type Mismatch");
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ProblemDetail handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
    return problem(
        HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(), "method-not-allowed", "Method Not Allowed");
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ProblemDetail handleNotFound(NoResourceFoundException ex) {
    return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "not-found", "Not Found");
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
    return problem(
        HttpStatus.FORBIDDEN,
        "You do not have permission to access this resource",
        "access-denied",
        "Access Denied");
  }

  @ExceptionHandler({
    AuthenticationException.class,
    AuthenticationCredentialsNotFoundException.class
  })
  public ProblemDetail handleAuthentication(Exception ex) {
    return problem(
        HttpStatus.UNAUTHORIZED,
        "Authentication is required to access this resource",
        "unauthorized",
        "Unauthorized");
  }

  @ExceptionHandler(AssetDomainException.class)
  public ProblemDetail handleAssetDomain(AssetDomainException ex) {
    return problem(
        HttpStatus.BAD_REQUEST, ex.getMessage(), "asset-domain-error", "Asset Validation Error");
  }

  @ExceptionHandler(AssetNotFoundException.class)
  public ProblemDetail handleAssetNotFound(AssetNotFoundException ex) {
    return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "asset-not-found", "Asset Not Found");
  }

  @ExceptionHandler(SiteAreaNotFoundException.class)
  public ProblemDetail handleSiteAreaNotFound(SiteAreaNotFoundException ex) {
    return problem(
        HttpStatus.NOT_FOUND, ex.getMessage(), "site-area-not-found", "Site Area Not Found");
  }

  @ExceptionHandler(AssetConnectorNotConfiguredException.class)
  public ProblemDetail handleNotConfigured(AssetConnectorNotConfiguredException ex) {
    ProblemDetail problem =
        problem(
            HttpStatus.UNPROCESSABLE_ENTITY,
            ex.getMessage(),
            "connector-not-configured",
            "Connector Not Configured");
    if (ex.connectionId() != null) {
      problem.setProperty("connectionId", ex.connectionId());
    }
    return problem;
  }

  @ExceptionHandler(InvalidAssetOperationException.class)
  public ProblemDetail handleInvalidOperation(InvalidAssetOperationException ex) {
    return problem(
        HttpStatus.CONFLICT, ex.getMessage(), "invalid-asset-operation", "Invalid Asset Operation");
  }

  @ExceptionHandler(AssetConcurrentModificationException.class)
  public ProblemDetail handleConcurrentModification(AssetConcurrentModificationException ex) {
    return problem(
        HttpStatus.CONFLICT, ex.getMessage(), "concurrent-modification", "Concurrent Modification");
  }

  @ExceptionHandler(AssetConnectorException.class)
  public ProblemDetail handleConnectorFailure(AssetConnectorException ex) {
    ProblemDetail problem =
        problem(
            HttpStatus.BAD_GATEWAY,
            ConnectorErrors.sanitizeMessage(ex),
            "connector-failure",
            "Connector Failure");
    problem.setProperty("code", ConnectorErrors.errorCode(ex));
    return problem;
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleUnexpected(Exception ex) {
    log.error("Unhandled exception", ex);
    return problem(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "An unexpected error occurred. Please try again later.",
        "internal-error",
        "Internal Server Error");
  }

  private static ProblemDetail problem(
      HttpStatus status, String detail, String typeSlug, String title) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setType(URI.create(TYPE_PREFIX + typeSlug));
    problem.setTitle(title);
    return problem;
  }

  private record FieldError(String field, String message, String rejectedValue) {}
}
