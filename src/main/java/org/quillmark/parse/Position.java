package org.quillmark.parse;

/**
 * A 1-based line and column within a parsed input.
 *
 * @param line The line number, starting at 1.
 * @param column The column number, starting at 1.
 * @param lineContent The text of the line, without the line break.
 */
public record Position(int line, int column, String lineContent) {

    static Position of(String input, int offset) {
        int line = 1;
        int lineStart = 0;
        int end = Math.min(offset, input.length());
        for (int i = 0; i < end; i++) {
            if (input.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int lineEnd = input.indexOf('\n', lineStart);
        if (lineEnd < 0) lineEnd = input.length();
        return new Position(line, end - lineStart + 1, input.substring(lineStart, lineEnd));
    }

    @Override
    public String toString() {
        return "[" + line + "." + column + "]";
    }
}
