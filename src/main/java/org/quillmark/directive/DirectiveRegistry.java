package org.quillmark.directive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable registry of directives of one kind, keyed by name.
 * Names are case-sensitive.
 *
 * @param <D> The kind of directive.
 */
public final class DirectiveRegistry<D extends IDirective<?, ?>> {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveRegistry.class);

    private final Map<String, D> directives;

    private DirectiveRegistry(Map<String, D> directives) {
        this.directives = Map.copyOf(directives);
    }

    public static <D extends IDirective<?, ?>> DirectiveRegistry<D> empty() {
        return new DirectiveRegistry<>(Map.of());
    }

    public static <D extends IDirective<?, ?>> Builder<D> builder() {
        return new Builder<>();
    }

    /**
     * Gets the directive for a given name.
     * @param name The name of the directive.
     * @return An {@link Optional} containing the directive if it exists, otherwise empty.
     */
    public Optional<D> get(String name) {
        return Optional.ofNullable(directives.get(name));
    }

    public Set<String> names() {
        return directives.keySet();
    }

    /**
     * Creates a registry containing the directives of this registry and the given one.
     * The given registry wins for names registered in both.
     */
    public DirectiveRegistry<D> merge(DirectiveRegistry<D> other) {
        Builder<D> builder = new Builder<>();
        directives.forEach(builder::register);
        other.directives.forEach(builder::register);
        return builder.build();
    }

    /**
     * Collects directives for a new registry.
     */
    public static final class Builder<D extends IDirective<?, ?>> {

        private final Map<String, D> directives = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers a directive. A directive registered earlier under the same name is replaced.
         * @param name The name of the directive (e.g., "callout").
         * @param directive The directive implementation.
         * @return This builder.
         */
        public Builder<D> register(String name, D directive) {
            if (directives.put(name, directive) != null) {
                LOG.debug("Directive '{}' replaced by a later registration", name);
            }
            return this;
        }

        public DirectiveRegistry<D> build() {
            return new DirectiveRegistry<>(directives);
        }
    }
}
