package com.tsingest.ingest.columnar;

import java.io.IOException;

/**
 * The bytes are readable but do not form a valid columnar or Parquet file.
 */
public class CorruptColumnarFileException extends IOException {

    public CorruptColumnarFileException(String message) {
        super(message);
    }

    public CorruptColumnarFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
