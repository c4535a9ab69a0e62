package com.example.excelops.service.pipeline;

public class UnknownSheetException extends IllegalArgumentException {

    public UnknownSheetException(String name) {
        super("No sheet named '" + name + "'.");
    }
}
