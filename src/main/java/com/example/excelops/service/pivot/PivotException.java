package com.example.excelops.service.pivot;

public class PivotException extends IllegalStateException {

    public PivotException(String message) {
        super(message);
    }

    public PivotException(String message, Throwable cause) {
        super(message, cause);
    }
}
