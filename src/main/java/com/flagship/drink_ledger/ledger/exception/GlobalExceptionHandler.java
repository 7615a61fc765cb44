package com.flagship.drink_ledger.ledger.exception;

import com.flagship.drink_ledger.config.LedgerProperties;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the ledger API.
 *
 * Maps the ledger failure taxonomy to HTTP status codes with a consistent
 * error body. Interactive clients (those accepting HTML) are redirected to
 * the login page instead of receiving a bare 401.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final LedgerProperties properties;

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e, HttpServletRequest request) {
        log.info("Unauthenticated request to {}: {}", request.getRequestURI(), e.getMessage());

        if (acceptsHtml(request)) {
            return ResponseEntity.status(HttpStatus.SEE_OTHER)
                .location(URI.create(properties.getIdentity().getLoginUrl()))
                .build();
        }
        return respond(HttpStatus.UNAUTHORIZED, e);
    }

    @ExceptionHandler({ForbiddenException.class, InactiveException.class})
    public ResponseEntity<ErrorResponse> handleForbidden(LedgerException e) {
        log.warn("Rejected: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("Ledger store unavailable", e);

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getError())
            .message("The ledger store is currently unavailable")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message("Request body is missing or malformed")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(TypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(TypeMismatchException e) {
        log.warn("Type mismatch for {}: {}", e.getPropertyName(), e.getValue());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message(String.format("Invalid value '%s' for %s", e.getValue(), e.getPropertyName()))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Request-level failures raised by Spring MVC itself: unknown path, wrong
     * method, unsupported content type, missing parameters. They carry their
     * own status and headers (such as {@code Allow}).
     */
    @ExceptionHandler({ServletException.class, ErrorResponseException.class})
    public ResponseEntity<ErrorResponse> handleFrameworkException(Exception e, HttpServletRequest request) {
        HttpStatusCode status = HttpStatus.BAD_REQUEST;
        HttpHeaders headers = new HttpHeaders();
        String message = e.getMessage();
        if (e instanceof org.springframework.web.ErrorResponse response) {
            status = response.getStatusCode();
            headers.putAll(response.getHeaders());
            if (response.getBody().getDetail() != null) {
                message = response.getBody().getDetail();
            }
        }

        if (status.is5xxServerError()) {
            log.error("Request to {} failed", request.getRequestURI(), e);
        } else {
            log.warn("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(), status.value(), message);
        }

        HttpStatus resolved = HttpStatus.resolve(status.value());
        ErrorResponse error = ErrorResponse.builder()
            .error(resolved != null ? resolved.getReasonPhrase() : "Error")
            .message(message)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).headers(headers).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, LedgerException e) {
        ErrorResponse error = ErrorResponse.builder()
            .error(e.getError())
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    private boolean acceptsHtml(HttpServletRequest request) {
        String accept = request.getHeader(HttpHeaders.ACCEPT);
        if (accept == null || accept.isBlank()) {
            return false;
        }
        List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
        return mediaTypes.stream().anyMatch(type -> type.isCompatibleWith(MediaType.TEXT_HTML)
            && !type.isWildcardType());
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
