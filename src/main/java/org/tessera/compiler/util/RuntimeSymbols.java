package org.tessera.compiler.util;

/**
 * Fully qualified names of the runtime helpers that generated render bodies call.
 * The helpers themselves ship with the runtime library, not with the compiler.
 */
public final class RuntimeSymbols {

    public static final String RUNTIME_PACKAGE = "org.tessera.runtime";

    /** Context escapers: {@code html}, {@code attribute}, {@code javascript}, {@code css}, {@code url}, {@code json}. */
    public static final String ESCAPER = RUNTIME_PACKAGE + ".Escaper";
    /** Class-name composition and attribute spreading. */
    public static final String HTML_ATTRIBUTES = RUNTIME_PACKAGE + ".HtmlAttributes";
    /** Tag-name validation for dynamic tags. */
    public static final String HTML_TAGS = RUNTIME_PACKAGE + ".HtmlTags";
    /** Emptiness checks. */
    public static final String VALUES = RUNTIME_PACKAGE + ".Values";
    /** Iteration adapters for arrays, iterables, streams and maps. */
    public static final String LOOPS = RUNTIME_PACKAGE + ".Loops";
    /** Per-loop metadata (index, first, last, parent). */
    public static final String LOOP_METADATA = RUNTIME_PACKAGE + ".LoopMetadata";

    /** The name of the output sink parameter of a render body. */
    public static final String OUT = "out";

    private RuntimeSymbols() {}
}
