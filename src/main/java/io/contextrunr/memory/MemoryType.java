package io.contextrunr.memory;

/**
 * Kinds of long-term memory.
 *
 * <ul>
 *   <li>{@code DECLARATIVE}: facts and preferences ("knowing what").</li>
 *   <li>{@code PROCEDURAL}: processes and techniques ("knowing how").</li>
 * </ul>
 */
public enum MemoryType {
    DECLARATIVE,
    PROCEDURAL;

    public String wireName() {
        return name().toLowerCase();
    }

    public static MemoryType fromString(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Memory type is required");
        }
        return switch (s.trim().toLowerCase()) {
            case "declarative" -> DECLARATIVE;
            case "procedural" -> PROCEDURAL;
            default -> throw new IllegalArgumentException("Unknown memory type: " + s);
        };
    }
}
