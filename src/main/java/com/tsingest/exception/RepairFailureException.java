package com.tsingest.exception;

import java.util.Map;

/**
 * Raised by a gap filler that could not repair a dataset. The coordinator keeps the
 * unrepaired dataset when it sees this.
 */
public class RepairFailureException extends BaseException {

    public RepairFailureException(String algorithm, String message) {
        super(ErrorCode.REPAIR_FAILURE, message, Map.of("algorithm", algorithm));
    }

    public RepairFailureException(String algorithm, String message, Throwable cause) {
        super(ErrorCode.REPAIR_FAILURE, message, Map.of("algorithm", algorithm), cause);
    }
}
