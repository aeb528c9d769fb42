package com.componenttracker.dto;

public record ErrorResponse(boolean success, String code, String error) {

    public static ErrorResponse of(String code, String error) {
        return new ErrorResponse(false, code, error);
    }
}
