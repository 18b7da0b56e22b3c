package org.quillmark.css;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The styles applying to all elements matching a selector.
 *
 * @param selector The selector.
 * @param styles The style values by name, in declaration order.
 */
public record StyleDeclaration(Selector selector, Map<String, String> styles) {

    public StyleDeclaration {
        styles = Collections.unmodifiableMap(new LinkedHashMap<>(styles));
    }

    public StyleDeclaration increaseOrderBy(int amount) {
        return new StyleDeclaration(selector.withOrder(selector.order() + amount), styles);
    }
}
