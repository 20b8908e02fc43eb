package com.meteocache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String status = "error";
    private String message;

    public static ErrorResponse of(String message) {
        return new ErrorResponse("error", message);
    }
}
