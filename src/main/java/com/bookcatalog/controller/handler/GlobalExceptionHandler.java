package com.bookcatalog.controller.handler;

import com.bookcatalog.dto.response.ErrorResponse;
import com.bookcatalog.exception.DuplicateIsbnException;
import com.bookcatalog.exception.ResourceNotFoundException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import jakarta.servlet.http.HttpServletRequest;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Maps exceptions raised while handling a request to {@link ErrorResponse} bodies.
 *
 * <p>Validation failures of every origin (request body constraints, query
 * parameter constraints, unreadable JSON, JSON values of the wrong type, missing or
 * unparseable parameters) become 422. Unsupported content types get 415.
 * Field names in {@code field_errors} use the same snake_case names as the JSON
 * payload. Anything not explicitly mapped is logged and answered with a generic 500
 * that carries no exception details.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String VALIDATION_ERROR = "Validation Error";
    private static final String ISBN_INDEX = "idx_books_isbn";

    private static final PropertyNamingStrategies.NamingBase FIELD_NAMING =
        new PropertyNamingStrategies.SnakeCaseStrategy();

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex,
                                                        HttpServletRequest request) {
        log.debug("Book id={} not found on {}", ex.getId(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
            new ErrorResponse(404, "Not Found", ex.getMessage(),
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(DuplicateIsbnException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateIsbn(DuplicateIsbnException ex,
                                                             HttpServletRequest request) {
        log.warn("Duplicate ISBN {} rejected on {}", ex.getIsbn(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
            new ErrorResponse(409, "Conflict", ex.getMessage(),
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors()
            .stream()
            .map(fe -> new ErrorResponse.FieldError(jsonName(fe.getField()), fe.getDefaultMessage()))
            .toList();
        return validationFailure(fieldErrors, request);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex,
                                                                HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getAllValidationResults().stream()
            .flatMap(result -> {
                RequestParam param = result.getMethodParameter().getParameterAnnotation(RequestParam.class);
                String name = param != null && !param.name().isEmpty()
                    ? param.name()
                    : jsonName(result.getMethodParameter().getParameterName());
                return result.getResolvableErrors().stream()
                    .map(error -> new ErrorResponse.FieldError(name, error.getDefaultMessage()));
            })
            .toList();
        return validationFailure(fieldErrors, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        if (ex.getCause() instanceof MismatchedInputException mismatch) {
            String field = jsonPath(mismatch);
            if (field != null) {
                String msg = "Expected " + typeName(mismatch.getTargetType());
                return validationFailure(List.of(new ErrorResponse.FieldError(field, msg)), request);
            }
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(
            new ErrorResponse(422, VALIDATION_ERROR, "Malformed request body",
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                HttpServletRequest request) {
        String msg = "Required parameter '" + ex.getParameterName() + "' is missing";
        return validationFailure(msg, List.of(new ErrorResponse.FieldError(ex.getParameterName(), msg)), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        String msg = String.format("Invalid value '%s' for parameter '%s'",
                                   ex.getValue(), ex.getName());
        return validationFailure(msg, List.of(new ErrorResponse.FieldError(ex.getName(), msg)), request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex,
                                                             HttpServletRequest request) {
        if (violatesIsbnIndex(ex)) {
            log.warn("Duplicate ISBN rejected by database on {}", request.getRequestURI());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(
                new ErrorResponse(409, "Conflict", "ISBN already exists",
                                  Instant.now(), request.getRequestURI()));
        }
        return handleGeneral(ex, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex,
                                                          HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
            new ErrorResponse(404, "Not Found", "No endpoint " + request.getRequestURI(),
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex,
                                                                  HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(
            new ErrorResponse(405, "Method Not Allowed", ex.getMessage(),
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex,
                                                                     HttpServletRequest request) {
        log.debug("Unsupported content type {} on {}", ex.getContentType(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).body(
            new ErrorResponse(415, "Unsupported Media Type",
                              "Content type '" + ex.getContentType() + "' is not supported; use application/json",
                              Instant.now(), request.getRequestURI()));
    }

    // No body: the client accepts no representation an ErrorResponse could be written in.
    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    public ResponseEntity<Void> handleMediaTypeNotAcceptable(HttpMediaTypeNotAcceptableException ex,
                                                             HttpServletRequest request) {
        log.debug("Not acceptable on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_ACCEPTABLE).build();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            new ErrorResponse(500, "Internal Server Error", "An unexpected error occurred",
                              Instant.now(), request.getRequestURI()));
    }

    private ResponseEntity<ErrorResponse> validationFailure(List<ErrorResponse.FieldError> fieldErrors,
                                                            HttpServletRequest request) {
        return validationFailure("Validation failed", fieldErrors, request);
    }

    private ResponseEntity<ErrorResponse> validationFailure(String message,
                                                            List<ErrorResponse.FieldError> fieldErrors,
                                                            HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(
            new ErrorResponse(422, VALIDATION_ERROR, message,
                              Instant.now(), request.getRequestURI(), fieldErrors));
    }

    private boolean violatesIsbnIndex(DataIntegrityViolationException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ConstraintViolationException cve
                && containsIsbnIndex(cve.getConstraintName())) {
            return true;
        }
        return containsIsbnIndex(ex.getMostSpecificCause().getMessage());
    }

    private static boolean containsIsbnIndex(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(ISBN_INDEX);
    }

    private static String jsonPath(JsonMappingException ex) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference ref : ex.getPath()) {
            if (ref.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                path.append('[').append(ref.getIndex()).append(']');
            }
        }
        return path.length() == 0 ? null : path.toString();
    }

    private static String typeName(Class<?> type) {
        if (type == null) {
            return "a value of another type";
        }
        if (Integer.class == type || int.class == type || Long.class == type || long.class == type) {
            return "an integer";
        }
        if (CharSequence.class.isAssignableFrom(type)) {
            return "a string";
        }
        return "a value of type " + type.getSimpleName();
    }

    private static String jsonName(String javaName) {
        return javaName == null ? null : FIELD_NAMING.translate(javaName);
    }
}
