package com.example.cliporganizer.common.exception;

import com.example.cliporganizer.api.response.ApiResponse;
import com.example.cliporganizer.common.util.LogSanitizer;
import javax.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CatalogUnavailableException.class)
    public ApiResponse<Void> handleCatalogUnavailable(CatalogUnavailableException e) {
        log.error("SYNC_CATALOG_UNAVAILABLE reason={}", LogSanitizer.sanitize(e.getMessage()), e);
        return ApiResponse.fail(e);
    }

    @ExceptionHandler(RootNotFoundException.class)
    public ApiResponse<Void> handleRootNotFound(RootNotFoundException e) {
        log.warn("SYNC_ROOT_NOT_FOUND root={} reason={}",
                LogSanitizer.sanitizePath(e.getRootFolderPath()), e.getMessage());
        return ApiResponse.fail(e);
    }

    @ExceptionHandler(BusinessException.class)
    public ApiResponse<Void> handleBusinessException(BusinessException e) {
        return ApiResponse.fail(e);
    }

    @ExceptionHandler(BindException.class)
    public ApiResponse<Void> handleBindException(BindException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String detail = fieldError == null
                ? "Invalid request parameters"
                : fieldError.getField() + " " + fieldError.getDefaultMessage();
        return ApiResponse.fail("400", detail);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ApiResponse<Void> handleConstraintViolation(ConstraintViolationException e) {
        return ApiResponse.fail("400", "Invalid request parameters");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ApiResponse<Void> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ApiResponse.fail("400", "Request body is not valid JSON");
    }

    @ExceptionHandler(Exception.class)
    public ApiResponse<Void> handleException(Exception e) {
        log.error("Unhandled exception", e);
        return ApiResponse.fail("500", "Internal server error");
    }
}
