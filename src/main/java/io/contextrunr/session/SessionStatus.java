package io.contextrunr.session;

/**
 * Lifecycle status of a session. Transitions only move forward:
 * {@code ACTIVE -> INACTIVE -> ARCHIVED}.
 */
public enum SessionStatus {
    ACTIVE,
    INACTIVE,
    ARCHIVED;

    public boolean canTransitionTo(SessionStatus next) {
        return next.ordinal() >= ordinal();
    }

    public String wireName() {
        return name().toLowerCase();
    }

    public static SessionStatus fromString(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Session status is required");
        }
        return switch (s.trim().toLowerCase()) {
            case "active" -> ACTIVE;
            case "inactive" -> INACTIVE;
            case "archived" -> ARCHIVED;
            default -> throw new IllegalArgumentException("Unknown session status: " + s);
        };
    }
}
