package org.tessera.compiler.directive;

import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;

/**
 * Describes how an attribute directive merges with the attributes already present on its host.
 *
 * @param mode            The merge mode.
 * @param targetAttribute The attribute name the policy applies to, {@code null} for spreads.
 * @param combinator      For {@link MergeMode#MERGE_NAMED}: combines the existing value expression with the
 *                        directive expression into one Java expression.
 * @param excluder        For {@link MergeMode#EXCLUDE_NAMED}: builds the spread expression from the directive
 *                        expression and the names to leave out.
 */
public record AttributeMergePolicy(
        MergeMode mode,
        String targetAttribute,
        BinaryOperator<String> combinator,
        BiFunction<String, Set<String>, String> excluder
) {

    public AttributeMergePolicy {
        Objects.requireNonNull(mode, "mode");
        if (mode == MergeMode.MERGE_NAMED && (targetAttribute == null || combinator == null)) {
            throw new IllegalArgumentException("MERGE_NAMED requires a target attribute and a combinator");
        }
        if (mode == MergeMode.EXCLUDE_NAMED && excluder == null) {
            throw new IllegalArgumentException("EXCLUDE_NAMED requires an excluder");
        }
    }

    /**
     * @param targetAttribute The attribute to replace.
     * @return A policy replacing the named attribute.
     */
    public static AttributeMergePolicy replace(String targetAttribute) {
        return new AttributeMergePolicy(MergeMode.REPLACE, targetAttribute, null, null);
    }

    /**
     * @param targetAttribute The attribute to merge into.
     * @param combinator Builds the merged expression from the existing and the directive expression.
     * @return A policy merging into the named attribute.
     */
    public static AttributeMergePolicy mergeNamed(String targetAttribute, BinaryOperator<String> combinator) {
        return new AttributeMergePolicy(MergeMode.MERGE_NAMED, targetAttribute, combinator, null);
    }

    /**
     * @param excluder Builds the spread expression from the directive expression and the excluded names.
     * @return A policy for spreads that skip explicitly written attributes.
     */
    public static AttributeMergePolicy excludeNamed(BiFunction<String, Set<String>, String> excluder) {
        return new AttributeMergePolicy(MergeMode.EXCLUDE_NAMED, null, null, excluder);
    }

    /**
     * @param existingExpression The Java expression of the attribute already on the element.
     * @param directiveExpression The directive expression.
     * @return The merged Java expression.
     */
    public String merge(String existingExpression, String directiveExpression) {
        return combinator.apply(existingExpression, directiveExpression);
    }

    /**
     * @param directiveExpression The directive expression.
     * @param excludedNames The attribute names already present on the element.
     * @return The spread expression.
     */
    public String exclude(String directiveExpression, Set<String> excludedNames) {
        return excluder.apply(directiveExpression, excludedNames);
    }
}
