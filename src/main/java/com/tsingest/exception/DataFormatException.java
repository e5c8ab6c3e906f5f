package com.tsingest.exception;

import java.nio.file.Path;
import java.util.Map;

/**
 * Unsupported extension or content that cannot be parsed into a dataset.
 */
public class DataFormatException extends BaseException {

    public DataFormatException(Path path, String message) {
        super(ErrorCode.FORMAT_ERROR, message, Map.of("path", String.valueOf(path)));
    }

    public DataFormatException(Path path, String message, Throwable cause) {
        super(ErrorCode.FORMAT_ERROR, message, Map.of("path", String.valueOf(path)), cause);
    }
}
