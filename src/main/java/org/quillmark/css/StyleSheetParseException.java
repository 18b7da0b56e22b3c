package org.quillmark.css;

import org.quillmark.parse.Position;

/**
 * Thrown when a style sheet cannot be parsed completely.
 * Style sheets are never partially applied.
 */
public class StyleSheetParseException extends Exception {

    private final String path;
    private final transient Position position;

    /**
     * @param message The reason of the failure.
     * @param path The path of the style sheet.
     * @param position The position where parsing stopped.
     */
    public StyleSheetParseException(String message, String path, Position position) {
        super(String.format("%s at %s%s: %s", message, path, position, position.lineContent()), null);
        this.path = path;
        this.position = position;
    }

    public String getPath() {
        return path;
    }

    public Position getPosition() {
        return position;
    }
}
