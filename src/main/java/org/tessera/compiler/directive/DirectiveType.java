package org.tessera.compiler.directive;

/**
 * Classifies how a directive takes part in extraction.
 */
public enum DirectiveType {
    /** Wraps its host in a generated control structure. At most one per element. */
    CONTROL_FLOW,
    /** Compiles inline into attributes of its host element. */
    ATTRIBUTE,
    /** Replaces the body of its host element. At most one per element. */
    CONTENT,
    /** Accepted by validation but handled by other stages; the attribute is kept as-is. */
    PASS_THROUGH
}
