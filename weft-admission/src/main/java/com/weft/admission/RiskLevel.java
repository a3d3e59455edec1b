package com.weft.admission;

/** Risk assigned to a plugin by static analysis. */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** HIGH and CRITICAL block execution unless the user overrides. */
    public boolean isBlocking() {
        return this == HIGH || this == CRITICAL;
    }
}
