package com.tsingest.exception;

import java.nio.file.Path;
import java.util.Map;

public class EmptyResultException extends BaseException {

    public EmptyResultException(Path path) {
        super(ErrorCode.EMPTY_RESULT, "No data rows parsed from " + path, Map.of("path", String.valueOf(path)));
    }
}
