package org.tessera.compiler.directive;

/**
 * How an attribute directive's output combines with the host element's attributes.
 */
public enum MergeMode {
    /** The compiled attribute replaces an existing attribute of the same name. */
    REPLACE,
    /** The compiled attribute is combined with an existing attribute of the same name. */
    MERGE_NAMED,
    /** The compiled spread omits every attribute already named on the element. */
    EXCLUDE_NAMED
}
