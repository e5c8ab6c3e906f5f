package com.tsingest.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    IO_ERROR("IO_ERROR"),
    FORMAT_ERROR("FORMAT_ERROR"),
    EMPTY_RESULT("EMPTY_RESULT"),
    REPAIR_FAILURE("REPAIR_FAILURE"),
    INTERNAL_ERROR("INTERNAL_ERROR");

    private final String code;
}
