package com.weft.admission;

import java.util.List;

/** Improvement advice for one plugin, derived from its confidence ledger. */
public final class Recommendation {

    public enum Type {
        NO_DATA,
        LOW_CONFIDENCE,
        PERFORMANCE,
        RELIABILITY,
        SAFETY
    }

    public enum Priority {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL
    }

    private final Type type;
    private final Priority priority;
    private final String message;
    private final List<String> actions;

    Recommendation(Type type, Priority priority, String message, List<String> actions) {
        this.type = type;
        this.priority = priority;
        this.message = message;
        this.actions = List.copyOf(actions);
    }

    public Type getType() {
        return type;
    }

    public Priority getPriority() {
        return priority;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getActions() {
        return actions;
    }

    @Override
    public String toString() {
        return type + "(" + priority + "): " + message;
    }
}
