package org.quillmark.directive;

import org.quillmark.rewrite.DocumentCursor;

import java.util.Map;
import java.util.Optional;

/**
 * The parts of a single directive occurrence, passed to the directive implementation.
 * Keys are unique; duplicates are rejected before a context is created.
 */
public class DirectiveContext {

    private final Map<PartKey, String> parts;
    private final Optional<DocumentCursor> cursor;

    public DirectiveContext(Map<PartKey, String> parts, Optional<DocumentCursor> cursor) {
        this.parts = Map.copyOf(parts);
        this.cursor = cursor;
    }

    public Map<PartKey, String> parts() {
        return parts;
    }

    /**
     * @return The cursor into the assembled tree, present only for directives that require it.
     */
    public Optional<DocumentCursor> cursor() {
        return cursor;
    }

    public Optional<String> part(PartKey key) {
        return Optional.ofNullable(parts.get(key));
    }

    public Optional<String> attribute(String name) {
        return part(PartKey.attribute(name));
    }

    public Optional<String> defaultAttribute() {
        return part(PartKey.attribute());
    }

    public Optional<String> body() {
        return part(PartKey.body());
    }

    /**
     * Gets a part that the directive cannot do without.
     * @param key The key of the part.
     * @return The content, or a failure naming the missing part.
     */
    public DirectiveResult<String> required(PartKey key) {
        return part(key)
                .map(DirectiveResult::success)
                .orElseGet(() -> DirectiveResult.failure("required " + key.description() + " is missing"));
    }

    public DirectiveResult<DocumentCursor> requiredCursor() {
        return cursor
                .map(DirectiveResult::success)
                .orElseGet(() -> DirectiveResult.failure("no document cursor available"));
    }
}
