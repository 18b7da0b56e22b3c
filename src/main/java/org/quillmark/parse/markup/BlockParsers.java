package org.quillmark.parse.markup;

import org.quillmark.parse.Parsed;
import org.quillmark.parse.Parser;
import org.quillmark.parse.ParserContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented helpers for block grammars.
 */
public final class BlockParsers {

    private BlockParsers() {}

    /**
     * Parses the rest of the current line plus all following lines that are indented
     * by at least one space or tab. Blank lines are included when an indented line
     * follows them. The common indentation of the following lines is removed and the
     * lines are joined with {@code '\n'}. Consumes the line break of the last line.
     *
     * @return The parser for the indented block.
     */
    public static Parser<String> indentedBlock() {
        return in -> {
            List<String> lines = new ArrayList<>();
            int offset = in.offset();
            String source = in.input();
            int lineEnd = endOfLine(source, offset);
            lines.add(source.substring(offset, lineEnd));
            offset = nextLine(source, lineEnd);

            List<String> pendingBlank = new ArrayList<>();
            List<String> indented = new ArrayList<>();
            int consumedTo = offset;
            while (offset < source.length()) {
                lineEnd = endOfLine(source, offset);
                String line = source.substring(offset, lineEnd);
                if (line.isBlank()) {
                    pendingBlank.add("");
                } else if (line.charAt(0) == ' ' || line.charAt(0) == '\t') {
                    indented.addAll(pendingBlank);
                    pendingBlank.clear();
                    indented.add(line);
                    consumedTo = nextLine(source, lineEnd);
                } else {
                    break;
                }
                offset = nextLine(source, lineEnd);
            }
            lines.addAll(removeIndentation(indented));
            ParserContext next = in.consume(consumedTo - in.offset());
            return new Parsed.Success<>(String.join("\n", lines), next);
        };
    }

    private static List<String> removeIndentation(List<String> lines) {
        int minIndent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isEmpty()) continue;
            int indent = 0;
            while (indent < line.length() && (line.charAt(indent) == ' ' || line.charAt(indent) == '\t')) indent++;
            minIndent = Math.min(minIndent, indent);
        }
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(line.isEmpty() ? line : line.substring(minIndent));
        }
        return result;
    }

    private static int endOfLine(String source, int offset) {
        int end = source.indexOf('\n', offset);
        return end < 0 ? source.length() : end;
    }

    private static int nextLine(String source, int lineEnd) {
        return lineEnd < source.length() ? lineEnd + 1 : lineEnd;
    }
}
