package org.quillmark.directive;

/**
 * The base interface for all directive implementations.
 * Each implementation turns the parts of one directive occurrence into a tree element.
 *
 * @param <E> The kind of element produced.
 * @param <C> The context type the directive receives.
 */
public interface IDirective<E, C extends DirectiveContext> {

    /**
     * Processes a directive occurrence.
     *
     * @param context The parts of the occurrence and, for directives that require it,
     *                the cursor into the assembled document tree.
     * @return The produced element, or the error messages.
     */
    DirectiveResult<E> apply(C context);

    /**
     * Directives that need the assembled document tree return {@code true}. They are
     * applied after parsing, through a placeholder, and always receive a cursor.
     *
     * @return {@code true} if the directive must be deferred.
     */
    default boolean requiresContext() {
        return false;
    }
}
