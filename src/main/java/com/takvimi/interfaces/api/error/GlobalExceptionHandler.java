package com.takvimi.interfaces.api.error;

import com.takvimi.application.exception.ApplicationException;
import com.takvimi.application.exception.PageTableUnavailableException;
import com.takvimi.application.exception.UseCaseValidationException;
import com.takvimi.domain.exception.CalendarPdfNotFoundException;
import com.takvimi.domain.exception.DomainException;
import com.takvimi.domain.exception.PdfDirectoryNotFoundException;
import com.takvimi.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps a missing calendar PDF to a 404 response.
     */
    @ExceptionHandler(CalendarPdfNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePdfNotFound(CalendarPdfNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "PDF_NOT_FOUND", rejected(ex));
    }

    @ExceptionHandler(PdfDirectoryNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePdfDirectoryNotFound(PdfDirectoryNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "PDF_DIRECTORY_NOT_FOUND", rejected(ex));
    }

    /**
     * Maps a page export without table to a 404 response; the message carries the page text.
     */
    @ExceptionHandler(PageTableUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleNoTable(PageTableUnavailableException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "NO_TABLE_FOUND", ex.details());
    }

    /**
     * Maps generic domain validation exceptions to a 400 response.
     *
     * @param ex      thrown domain exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR", rejected(ex));
    }

    /**
     * Maps use-case validation failures to a 400 response.
     */
    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR", ex.details());
    }

    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR", ex.details());
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR",
                Map.of("cause", String.valueOf(ex.rootCauseMessage())));
    }

    /**
     * Fallback for unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", Map.of());
    }

    // Always JSON, also for endpoints that otherwise produce CSV.
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode,
                                                       Map<String, Object> details) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(),
                request.getRequestURI(), details);
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(response);
    }

    private static Map<String, Object> rejected(DomainException ex) {
        return ex.rejectedValue() == null ? Map.of() : Map.of("rejected_value", ex.rejectedValue());
    }
}
