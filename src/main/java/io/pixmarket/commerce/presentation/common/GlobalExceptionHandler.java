package io.pixmarket.commerce.presentation.common;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        HttpStatus status = mapErrorCodeToHttpStatus(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Business exception occurred: code={}, message={}", e.getCode(), e.getMessage());
        } else {
            log.warn("Business exception occurred: code={}, message={}", e.getCode(), e.getMessage());
        }

        ErrorResponse errorResponse = ErrorResponse.of(
                e.getCode(),
                e.getMessage()
        );
        return ResponseEntity.status(status).body(errorResponse);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = e.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fieldError -> String.valueOf(fieldError.getDefaultMessage()),
                        (first, second) -> first
                ));
        log.warn("Validation failed: {}", fieldErrors);

        return ResponseEntity.badRequest().body(ErrorResponse.of(
                ErrorCode.INVALID_INPUT.getCode(),
                ErrorCode.INVALID_INPUT.getMessage(),
                fieldErrors
        ));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());

        return ResponseEntity.badRequest().body(ErrorResponse.of(
                ErrorCode.INVALID_INPUT.getCode(),
                ErrorCode.INVALID_INPUT.getMessage()
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected exception occurred", e);

        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.INTERNAL_SERVER_ERROR.getCode(),
                ErrorCode.INTERNAL_SERVER_ERROR.getMessage()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private HttpStatus mapErrorCodeToHttpStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case PHOTO_NOT_FOUND, UNKNOWN_SESSION ->
                    HttpStatus.NOT_FOUND;
            case ALREADY_PURCHASED ->
                    HttpStatus.CONFLICT;
            case EMPTY_CART, INVALID_SIGNATURE, INVALID_INPUT ->
                    HttpStatus.BAD_REQUEST;
            case PAYMENT_GATEWAY_ERROR ->
                    HttpStatus.BAD_GATEWAY;
            case RECONCILIATION_CONFLICT ->
                    HttpStatus.SERVICE_UNAVAILABLE;
            default ->
                    HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
