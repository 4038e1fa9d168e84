package com.statusbridge.alertbridge.infrastructure.web;

import com.statusbridge.alertbridge.infrastructure.alertmanager.MalformedNotificationException;
import com.statusbridge.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://statusbridge.io/errors/malformed-notification",
 *   "title": "Malformed Notification",
 *   "status": 400,
 *   "detail": "Notification has no alerts list",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Alerts dropped inside a well-formed batch are not errors and never reach this handler.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MalformedNotificationException.class)
    public ProblemDetail handleMalformedNotification(MalformedNotificationException ex) {
        log.warn("Malformed notification: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed Notification", "malformed-notification", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed Notification", "malformed-notification",
                "Request body is missing or unreadable");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Spring MVC's own exceptions (unknown path, wrong method, ...) keep their status.
            ProblemDetail problem = errorResponse.getBody();
            enrichWithCorrelation(problem);
            return problem;
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://statusbridge.io/errors/" + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    /** Adds correlation ID and timestamp so callers can reference the log entries. */
    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
