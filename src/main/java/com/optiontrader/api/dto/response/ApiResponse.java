package com.optiontrader.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.optiontrader.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Getter;

/**
 * Envelope for every JSON response: {@code data} on success, {@code error} on failure.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Failure error;
    private final Instant timestamp = Instant.now();

    private ApiResponse(boolean success, T data, Failure error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static ApiResponse<Void> failure(ErrorCode errorCode, String message, Map<String, Object> details) {
        return new ApiResponse<>(false, null, new Failure(errorCode.name(), message, details));
    }

    @Getter
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class Failure {
        private final String code;
        private final String message;
        private final Map<String, Object> details;

        private Failure(String code, String message, Map<String, Object> details) {
            this.code = code;
            this.message = message;
            this.details = details;
        }
    }
}
