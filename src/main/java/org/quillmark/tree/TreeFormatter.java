package org.quillmark.tree;

/**
 * Renders a tree as indented text, one element per line, for debugging and the {@code dump} command.
 */
public final class TreeFormatter {

    private static final String INDENT = ". ";

    private TreeFormatter() {}

    public static String format(Element element) {
        StringBuilder builder = new StringBuilder();
        format(element, 0, builder);
        return builder.toString();
    }

    private static void format(Element element, int level, StringBuilder builder) {
        builder.append(INDENT.repeat(level)).append(describe(element)).append('\n');
        for (Element child : element.children()) {
            format(child, level + 1, builder);
        }
    }

    private static String describe(Element element) {
        if (element instanceof Text text) return "Text - '" + text.content() + "'";
        if (element instanceof Literal literal) return "Literal - '" + literal.content() + "'";
        if (element instanceof LiteralBlock block) return "LiteralBlock - '" + block.content() + "'";
        if (element instanceof StyledSpan styled) return "StyledSpan(" + styled.style() + ")";
        if (element instanceof Callout callout) return "Callout(" + callout.type() + ")";
        if (element instanceof Fragment fragment) return "Fragment(" + fragment.name() + ")";
        if (element instanceof Invalid invalid) {
            return element.getClass().getSimpleName() + " - " + invalid.message().level() + ": "
                    + invalid.message().content() + " - fallback: " + invalid.fallback();
        }
        if (element instanceof SpanResolver || element instanceof BlockResolver) return element.toString();
        return element.getClass().getSimpleName();
    }
}
