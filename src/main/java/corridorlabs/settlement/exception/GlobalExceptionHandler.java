package corridorlabs.settlement.exception;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps engine failures onto HTTP responses of the form
 * {@code {success:false, code, message, details}}.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SettlementValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(SettlementValidationException ex) {
        log.warn("Rejected request [{}]: {}", ex.getCode().getWireValue(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(UnauthorizedOperationException.class)
    public ResponseEntity<Map<String, Object>> handleUnauthorized(UnauthorizedOperationException ex) {
        log.warn("Unauthorized operation: {}", ex.getOperation());
        return error(HttpStatus.FORBIDDEN, ex);
    }

    @ExceptionHandler(CorridorConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleCorridorConfiguration(CorridorConfigurationException ex) {
        log.warn("Corridor configuration error [{}]: {}", ex.getCode().getWireValue(), ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(IntentStateException.class)
    public ResponseEntity<Map<String, Object>> handleIntentState(IntentStateException ex) {
        HttpStatus status = ex.getCode() == SettlementErrorCode.NOT_FOUND ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
        log.info("Intent state conflict [{}]: {}", ex.getCode().getWireValue(), ex.getMessage());
        return error(status, ex);
    }

    /**
     * Handles validation errors from @Valid annotations
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", "Validation failed");
        response.put("errors", errors);

        log.warn("Validation error: {}", errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", "Malformed request body");

        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", ex.getMessage());

        log.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", "An unexpected error occurred");

        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, SettlementException ex) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("code", ex.getCode().getWireValue());
        response.put("message", ex.getMessage());
        response.put("details", ex.getDetails());
        return ResponseEntity.status(status).body(response);
    }
}
