package com.weft.admission;

/**
 * Admission state of a plugin. A ledger is UNSCORED until its first static analysis and SCORED
 * afterwards; each evaluation of a scored plugin yields ALLOWED, WARNED or BLOCKED.
 */
public enum AdmissionState {
    UNSCORED,
    SCORED,
    ALLOWED,
    WARNED,
    BLOCKED
}
