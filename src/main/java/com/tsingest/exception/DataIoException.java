package com.tsingest.exception;

import java.nio.file.Path;
import java.util.Map;

/**
 * The source path is missing or cannot be read.
 */
public class DataIoException extends BaseException {

    public DataIoException(Path path, String message) {
        super(ErrorCode.IO_ERROR, message, Map.of("path", String.valueOf(path)));
    }

    public DataIoException(Path path, String message, Throwable cause) {
        super(ErrorCode.IO_ERROR, message, Map.of("path", String.valueOf(path)), cause);
    }
}
