package com.weft.admission;

/** Type and message of a failed execution, kept as the ledger's last error. */
public record ExecutionErrorInfo(String type, String message) {

    public static ExecutionErrorInfo of(Throwable t) {
        if (t == null) return null;
        return new ExecutionErrorInfo(t.getClass().getSimpleName(), t.getMessage());
    }
}
