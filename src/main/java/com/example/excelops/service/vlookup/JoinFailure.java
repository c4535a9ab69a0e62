package com.example.excelops.service.vlookup;

/**
 * Why a VLOOKUP was refused. The working dataset is untouched in every case.
 */
public enum JoinFailure {
    EMPTY_SOURCE,
    DUPLICATE_COLUMNS,
    UNKNOWN_COLUMN,
    KEY_ARITY_MISMATCH,
    MERGE_FAILED
}
