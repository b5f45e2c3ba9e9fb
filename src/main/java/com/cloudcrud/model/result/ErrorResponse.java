package com.cloudcrud.model.result;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body returned over HTTP when a cloud function fails
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private Boolean success;
    private Integer code;
    private String error;

    public static ErrorResponse of(int code, String error) {
        return ErrorResponse.builder()
                .success(false)
                .code(code)
                .error(error)
                .build();
    }
}
