package com.techStack.accessSys.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;

/**
 * Standardized API Response Wrapper
 *
 * Provides consistent response structure across all API endpoints.
 * Timestamps come from the injected Clock.
 *
 * @param <T> Type of the data in success response
 */
@Setter
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /* =========================
       Response Fields
       ========================= */

    private boolean success;
    private String message;
    private String errorCode;
    private T data;
    private Instant timestamp;

    /* =========================
       Constructors
       ========================= */

    public ApiResponse() {
    }

    public ApiResponse(boolean success, String message, String errorCode, T data, Instant timestamp) {
        this.success = success;
        this.message = message;
        this.errorCode = errorCode;
        this.data = data;
        this.timestamp = timestamp;
    }

    /* =========================
       Success Factory Methods
       ========================= */

    public static <T> ApiResponse<T> success(String message, T data, Instant timestamp) {
        return new ApiResponse<>(true, message, null, data, timestamp);
    }

    public static ApiResponse<Void> success(String message, Instant timestamp) {
        return new ApiResponse<>(true, message, null, null, timestamp);
    }

    /* =========================
       Error Factory Methods
       ========================= */

    public static ApiResponse<Void> error(String message, String errorCode, Instant timestamp) {
        return new ApiResponse<>(false, message, errorCode, null, timestamp);
    }

    public static <T> ApiResponse<T> error(String message, String errorCode, T data, Instant timestamp) {
        return new ApiResponse<>(false, message, errorCode, data, timestamp);
    }

    @Override
    public String toString() {
        return "ApiResponse{" +
                "success=" + success +
                ", message='" + message + '\'' +
                ", errorCode='" + errorCode + '\'' +
                ", data=" + data +
                ", timestamp=" + timestamp +
                '}';
    }
}
