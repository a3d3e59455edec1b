package com.weft.admission;

/**
 * Caller's warning channel. Registered on {@link AdmissionGate#addListener(AdmissionListener)};
 * invoked on the evaluating thread.
 */
public interface AdmissionListener {

    /** Execution proceeds, but the plugin's confidence is low. */
    default void onWarning(String pluginId, String message, ConfidenceRecord record) {
    }

    /** Execution was vetoed. */
    default void onBlocked(AdmissionDecision decision) {
    }
}
