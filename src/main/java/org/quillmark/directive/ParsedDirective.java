package org.quillmark.directive;

import java.util.List;

/**
 * The dialect-independent result of parsing a directive declaration.
 * The parts may contain duplicate keys; they are rejected when the directive is applied.
 *
 * @param name The name of the directive.
 * @param parts The attributes and bodies in declaration order: default attribute, named
 *              attributes, default body, named bodies.
 */
public record ParsedDirective(String name, List<Part> parts) {

    public ParsedDirective {
        parts = List.copyOf(parts);
    }
}
