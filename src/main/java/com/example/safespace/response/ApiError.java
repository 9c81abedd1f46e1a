package com.example.safespace.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/** Error body shared by every endpoint. Optional parts are left out of the JSON when unset. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    String error;
    String message;
    List<String> details;
    Boolean dataPreserved;
    UUID reportId;

    public static ApiError of(String error, String message) {
        return ApiError.builder().error(error).message(message).build();
    }
}
