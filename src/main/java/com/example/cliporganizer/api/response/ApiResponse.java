package com.example.cliporganizer.api.response;

import com.example.cliporganizer.common.exception.BusinessException;
import com.example.cliporganizer.common.logging.AccessLogFilter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * Envelope of every API answer. {@code code} is {@code "0"} on success; {@code traceId} is the request id
 * also written to the access log.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String SUCCESS_CODE = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String traceId;

    private ApiResponse(String code, String message, T data, String userAction) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.userAction = userAction;
        this.traceId = MDC.get(AccessLogFilter.MDC_REQUEST_ID);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "OK", data, null);
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return new ApiResponse<>(code, message, null, null);
    }

    public static <T> ApiResponse<T> fail(BusinessException e) {
        return new ApiResponse<>(e.getCode(), e.getMessage(), null, e.getUserAction());
    }
}
