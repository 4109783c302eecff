package ai.shield.api;

import ai.shield.audit.EventLogUnavailableException;
import ai.shield.llm.RequestCancelledException;
import ai.shield.policy.ConfigException;
import ai.shield.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException ex) {
        return Map.of("error", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException ex) {
        return Map.of("error", "Please provide a JSON body with a 'prompt' field.");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return Map.of("error", "'" + ex.getName() + "' has an invalid value.");
    }

    @ExceptionHandler(ConfigException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleConfig(ConfigException ex) {
        return Map.of("error", ex.getMessage());
    }

    @ExceptionHandler(RequestCancelledException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleCancelled(RequestCancelledException ex) {
        return Map.of("error", "Request was cancelled before it completed.");
    }

    @ExceptionHandler(EventLogUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleEventLog(EventLogUnavailableException ex) {
        log.error("event=event_log_unavailable reason={}", ex.getMessage(), ex);
        return Map.of("error", "Audit log is unavailable; the request was not completed.");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("event=unhandled_error type={}", ex.getClass().getName(), ex);
        return Map.of("error", "Internal error while processing the request.");
    }
}
