package com.quantpricer.exception;

import java.util.Map;

/** The curve snapshot is missing, unreadable or has no usable rows. */
public class CurveSnapshotException extends BaseException {

    public CurveSnapshotException(String message) {
        super(ErrorCode.SNAPSHOT_ERROR, message);
    }

    public CurveSnapshotException(String message, Throwable cause) {
        super(ErrorCode.SNAPSHOT_ERROR, message, cause);
    }

    public CurveSnapshotException(String message, String location, Throwable cause) {
        super(ErrorCode.SNAPSHOT_ERROR, message, Map.of("location", location), cause);
    }
}
