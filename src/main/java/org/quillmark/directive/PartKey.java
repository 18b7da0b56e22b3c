package org.quillmark.directive;

/**
 * Identifies a single part of a directive: an attribute or a body, either the
 * unnamed default part or a named one.
 *
 * @param type The kind of part.
 * @param name The name of the part, or {@code null} for the default part.
 */
public record PartKey(PartType type, String name) {

    /**
     * The kind of a directive part.
     */
    public enum PartType {
        ATTRIBUTE("attribute"),
        BODY("body");

        private final String label;

        PartType(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static PartKey attribute() {
        return new PartKey(PartType.ATTRIBUTE, null);
    }

    public static PartKey attribute(String name) {
        return new PartKey(PartType.ATTRIBUTE, name);
    }

    public static PartKey body() {
        return new PartKey(PartType.BODY, null);
    }

    public static PartKey body(String name) {
        return new PartKey(PartType.BODY, name);
    }

    public boolean isDefault() {
        return name == null;
    }

    /**
     * @return A description for error messages, like {@code attribute: type} or {@code default body}.
     */
    public String description() {
        return isDefault() ? "default " + type.label() : type.label() + ": " + name;
    }
}
