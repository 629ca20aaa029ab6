package com.landingzone.orchestrator.engine;

/**
 * What one step reports back to the {@link StepChainExecutor}.
 *
 * @param status          OK, FAILED or TIMED_OUT
 * @param errorKind       null when status is OK
 * @param detail          human-readable summary or remote error text
 * @param objectsAffected objects moved by an archive step, 0 for other kinds
 */
public record ExecutionResult(
        ResultStatus status,
        ErrorKind    errorKind,
        String       detail,
        int          objectsAffected
) {
    public static ExecutionResult ok(String detail) {
        return new ExecutionResult(ResultStatus.OK, null, detail, 0);
    }

    public static ExecutionResult archived(int objectsMoved, String detail) {
        return new ExecutionResult(ResultStatus.OK, null, detail, objectsMoved);
    }

    public static ExecutionResult failed(ErrorKind kind, String detail) {
        return new ExecutionResult(ResultStatus.FAILED, kind, detail, 0);
    }

    public static ExecutionResult timedOut(String detail) {
        return new ExecutionResult(ResultStatus.TIMED_OUT, ErrorKind.SENSE_TIMEOUT, detail, 0);
    }

    public boolean isOk() {
        return status == ResultStatus.OK;
    }
}
