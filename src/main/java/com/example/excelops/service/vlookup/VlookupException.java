package com.example.excelops.service.vlookup;

import lombok.Getter;

@Getter
public class VlookupException extends IllegalStateException {

    private final JoinFailure reason;

    public VlookupException(JoinFailure reason, String message) {
        super(message);
        this.reason = reason;
    }

    public VlookupException(JoinFailure reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
