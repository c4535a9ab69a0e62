package com.example.excelops.web;

public record ApiError(
        String code,
        String message
) {
}
