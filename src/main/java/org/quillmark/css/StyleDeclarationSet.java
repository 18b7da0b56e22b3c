package org.quillmark.css;

import java.util.Comparator;
import java.util.List;

/**
 * All style declarations of a style sheet.
 *
 * @param path The path the style sheet was read from.
 * @param declarations The declarations in order of appearance.
 */
public record StyleDeclarationSet(String path, List<StyleDeclaration> declarations) {

    public StyleDeclarationSet {
        declarations = List.copyOf(declarations);
    }

    /**
     * @return The declarations ordered by ascending specificity, so that later entries take precedence.
     */
    public List<StyleDeclaration> bySpecificity() {
        return declarations.stream()
                .sorted(Comparator.comparing(d -> d.selector().specificity()))
                .toList();
    }
}
