package org.quillmark.parse.markup;

/**
 * A {@link ResultBuilder} that concatenates all elements into a single string.
 */
public class TextBuilder implements ResultBuilder<String, String> {

    private final StringBuilder builder = new StringBuilder();

    @Override
    public String fromString(String text) {
        return text;
    }

    @Override
    public void append(String item) {
        builder.append(item);
    }

    @Override
    public String result() {
        return builder.toString();
    }
}
