package com.treepickup.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standardized API response wrapper
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private Boolean ok;
    private T data;
    private String error;
    private String elapsed;

    public static <T> ApiResponse<T> success(T data, String elapsed) {
        return ApiResponse.<T>builder()
                .ok(true)
                .data(data)
                .elapsed(elapsed)
                .build();
    }

    public static <T> ApiResponse<T> error(String error) {
        return ApiResponse.<T>builder()
                .ok(false)
                .error(error)
                .build();
    }
}
