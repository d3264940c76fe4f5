package com.outreachagent.interfaces.api.dto;

public record ErrorResponse(String status, String code, String message) {

    public ErrorResponse(String code, String message) {
        this("error", code, message);
    }
}
