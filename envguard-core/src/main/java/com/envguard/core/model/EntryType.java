package com.envguard.core.model;

/**
 * Value kinds an {@link EntrySpec} can declare.
 *
 * <p>
 * Type names are compared exactly. Unknown, absent or differently cased names
 * fall back to {@link #STRING}, so a typo in a declaration yields the raw
 * trimmed string rather than an error.
 * </p>
 *
 * @since 1.0.0
 */
public enum EntryType {

    STRING("string"),
    INT("int"),
    ENUM("enum");

    private final String id;

    EntryType(String id) {
        this.id = id;
    }

    /**
     * @return the lowercase name used in spec documents
     */
    public String id() {
        return id;
    }

    /**
     * Map a declared type name onto a kind.
     *
     * @param type declared type, may be {@code null}
     * @return matching kind, {@link #STRING} when unknown
     */
    public static EntryType of(String type) {
        if (type == null) {
            return STRING;
        }
        return switch (type) {
            case "int" -> INT;
            case "enum" -> ENUM;
            default -> STRING;
        };
    }
}
