package com.translogistics.router.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {
    private String status;
    private String message;

    public static ApiError of(String message) {
        return new ApiError("error", message);
    }
}
