package org.quillmark.css;

import java.util.Optional;
import java.util.Set;

/**
 * A selector: a set of predicates an element must satisfy, plus an optional
 * selector for one of its ancestors.
 *
 * @param predicates The predicates; empty for the universal selector {@code *}.
 * @param parent The ancestor selector, or {@code null}.
 * @param order The position of the declaration within its style sheet.
 */
public record Selector(Set<StylePredicate> predicates, ParentSelector parent, int order) {

    public Selector {
        predicates = Set.copyOf(predicates);
    }

    public Selector(Set<StylePredicate> predicates) {
        this(predicates, null, 0);
    }

    public Optional<ParentSelector> parentSelector() {
        return Optional.ofNullable(parent);
    }

    public Selector withParent(ParentSelector newParent) {
        return new Selector(predicates, newParent, order);
    }

    public Selector withOrder(int newOrder) {
        return new Selector(predicates, parent, newOrder);
    }

    /**
     * @return The specificity of this selector including all ancestor selectors.
     */
    public Specificity specificity() {
        int ids = 0;
        int styleNames = 0;
        int types = 0;
        for (StylePredicate predicate : predicates) {
            if (predicate instanceof StylePredicate.Id) ids++;
            else if (predicate instanceof StylePredicate.StyleName) styleNames++;
            else types++;
        }
        Specificity own = new Specificity(ids, styleNames, types, order);
        return parent == null ? own : own.add(parent.selector().specificity());
    }
}
