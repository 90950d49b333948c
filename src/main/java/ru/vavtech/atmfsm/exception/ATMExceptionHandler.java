package ru.vavtech.atmfsm.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Глобальный обработчик исключений для REST API банкомата.
 * Автомат переходов исключений не бросает, сюда попадают только ошибки входных данных драйвера.
 */
@Slf4j
@ControllerAdvice
public class ATMExceptionHandler {
    
    /**
     * Обработка общих исключений
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex, WebRequest request) {
        log.error("Необработанная ошибка в банкомате", ex);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Техническая ошибка банкомата",
                "Попробуйте позже или обратитесь в службу поддержки", request);
    }
    
    /**
     * Неизвестная клавиша, некорректный PIN и прочие ошибки данных
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex, WebRequest request) {
        log.warn("Ошибка в данных запроса: {}", ex.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "Ошибка в данных запроса", ex.getMessage(), request);
    }
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex,
                                                                         WebRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Ошибка валидации: {}", message);
        return errorResponse(HttpStatus.BAD_REQUEST, "Ошибка валидации", message, request);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableMessage(HttpMessageNotReadableException ex,
                                                                       WebRequest request) {
        log.warn("Некорректное тело запроса: {}", ex.getMostSpecificCause().getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "Ошибка в данных запроса",
                "Некорректное тело запроса", request);
    }
    
    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error,
                                                              String message, WebRequest request) {
        Map<String, Object> errorDetails = Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message,
                "path", request.getDescription(false)
        );
        return ResponseEntity.status(status).body(errorDetails);
    }
}
