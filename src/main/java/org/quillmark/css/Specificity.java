package org.quillmark.css;

import java.util.Comparator;

/**
 * The precedence of a selector. Ids count more than style names, style names more
 * than element types; between equal selectors the later declaration wins.
 *
 * @param ids The number of id predicates.
 * @param styleNames The number of style name predicates.
 * @param types The number of element type predicates.
 * @param order The position of the declaration within its style sheet.
 */
public record Specificity(int ids, int styleNames, int types, int order) implements Comparable<Specificity> {

    private static final Comparator<Specificity> ORDER = Comparator
            .comparingInt(Specificity::ids)
            .thenComparingInt(Specificity::styleNames)
            .thenComparingInt(Specificity::types)
            .thenComparingInt(Specificity::order);

    /**
     * Adds the counts of another specificity, keeping the order of this one.
     */
    public Specificity add(Specificity other) {
        return new Specificity(ids + other.ids, styleNames + other.styleNames, types + other.types, order);
    }

    @Override
    public int compareTo(Specificity other) {
        return ORDER.compare(this, other);
    }
}
