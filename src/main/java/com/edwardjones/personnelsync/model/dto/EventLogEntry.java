package com.edwardjones.personnelsync.model.dto;

/**
 * A single progress or error event produced while applying a change set.
 */
public record EventLogEntry(Severity severity, String message) {

    /**
     * Syslog priorities, most severe first.
     */
    public enum Severity {
        EMERGENCY("Emerg"),
        ALERT("Alert"),
        CRITICAL("Critical"),
        ERROR("Error"),
        WARNING("Warning"),
        NOTICE("Notice"),
        INFO("Info"),
        DEBUG("Debug");

        private final String label;

        Severity(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        public boolean isAtLeast(Severity other) {
            return ordinal() <= other.ordinal();
        }
    }

    public static EventLogEntry info(String message) {
        return new EventLogEntry(Severity.INFO, message);
    }

    public static EventLogEntry warning(String message) {
        return new EventLogEntry(Severity.WARNING, message);
    }

    public static EventLogEntry error(String message) {
        return new EventLogEntry(Severity.ERROR, message);
    }

    @Override
    public String toString() {
        return severity.getLabel() + ": " + message;
    }
}
