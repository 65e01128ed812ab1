package org.tessera.compiler.directive;

import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.directive.features.attribute.BooleanAttributeDirective;
import org.tessera.compiler.directive.features.attribute.ClassDirective;
import org.tessera.compiler.directive.features.attribute.SpreadDirective;
import org.tessera.compiler.directive.features.conditional.ElseDirective;
import org.tessera.compiler.directive.features.conditional.IfDirective;
import org.tessera.compiler.directive.features.conditional.IssetDirective;
import org.tessera.compiler.directive.features.conditional.UnlessDirective;
import org.tessera.compiler.directive.features.content.ContentDirective;
import org.tessera.compiler.directive.features.content.IfContentDirective;
import org.tessera.compiler.directive.features.content.NoWrapDirective;
import org.tessera.compiler.directive.features.emptiness.EmptyDirective;
import org.tessera.compiler.directive.features.emptiness.NotEmptyDirective;
import org.tessera.compiler.directive.features.loop.ForeachDirective;
import org.tessera.compiler.directive.features.loop.ForelseDirective;
import org.tessera.compiler.directive.features.loop.TimesDirective;
import org.tessera.compiler.directive.features.loop.WhileDirective;
import org.tessera.compiler.directive.features.passthrough.PassThroughDirective;
import org.tessera.compiler.directive.features.switchcase.CaseDirective;
import org.tessera.compiler.directive.features.switchcase.SwitchDirective;
import org.tessera.compiler.directive.features.tag.TagDirective;
import org.tessera.compiler.directive.features.trycatch.FinallyDirective;
import org.tessera.compiler.directive.features.trycatch.TryDirective;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A registry mapping directive names (without prefix) to their compilers.
 * <p>
 * Compilers are registered as factories and instantiated on first lookup; the instance is then
 * cached for the lifetime of the registry.
 */
public class DirectiveRegistry {

    private final Map<String, Supplier<? extends IDirectiveCompiler>> factories = new LinkedHashMap<>();
    private final Map<String, IDirectiveCompiler> resolved = new HashMap<>();

    /**
     * Registers a directive compiler factory, replacing any earlier registration of the name.
     * @param name The directive name, e.g. {@code "if"}.
     * @param factory Creates the compiler on first use.
     */
    public void register(String name, Supplier<? extends IDirectiveCompiler> factory) {
        factories.put(name, factory);
        resolved.remove(name);
    }

    /**
     * Gets the compiler for a directive, creating it on first access.
     * @param name The directive name.
     * @return An {@link Optional} containing the compiler if the name is registered, otherwise empty.
     */
    public Optional<IDirectiveCompiler> get(String name) {
        IDirectiveCompiler compiler = resolved.get(name);
        if (compiler == null) {
            Supplier<? extends IDirectiveCompiler> factory = factories.get(name);
            if (factory == null) {
                return Optional.empty();
            }
            compiler = factory.get();
            resolved.put(name, compiler);
        }
        return Optional.of(compiler);
    }

    /**
     * @param name The directive name.
     * @return {@code true} if a compiler is registered for the name.
     */
    public boolean has(String name) {
        return factories.containsKey(name);
    }

    /**
     * @return All registered names in registration order.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /**
     * Creates a registry with all built-in directives.
     * @param config The compiler configuration; its slot and bind markers are registered as pass-through.
     * @return A new registry.
     */
    public static DirectiveRegistry withDefaults(CompilerConfig config) {
        DirectiveRegistry registry = new DirectiveRegistry();

        // Conditionals
        registry.register("if", () -> new IfDirective("if"));
        registry.register("elseif", () -> new IfDirective("elseif"));
        registry.register("else", ElseDirective::new);
        registry.register("unless", UnlessDirective::new);
        registry.register("isset", IssetDirective::new);
        registry.register("empty", EmptyDirective::new);
        registry.register("notempty", NotEmptyDirective::new);

        // Loops
        registry.register("foreach", ForeachDirective::new);
        registry.register("forelse", ForelseDirective::new);
        registry.register("while", WhileDirective::new);
        registry.register("times", TimesDirective::new);

        // Switch and exception handling
        registry.register("switch", SwitchDirective::new);
        registry.register("case", () -> new CaseDirective("case"));
        registry.register("default", () -> new CaseDirective("default"));
        registry.register("try", TryDirective::new);
        registry.register("finally", FinallyDirective::new);

        // Attributes
        registry.register("class", ClassDirective::new);
        registry.register("spread", SpreadDirective::new);
        registry.register("attr", SpreadDirective::new);
        registry.register("checked", () -> new BooleanAttributeDirective("checked"));
        registry.register("selected", () -> new BooleanAttributeDirective("selected"));
        registry.register("disabled", () -> new BooleanAttributeDirective("disabled"));
        registry.register("tag", TagDirective::new);

        // Content
        registry.register("text", () -> new ContentDirective(true));
        registry.register("html", () -> new ContentDirective(false));
        registry.register("nowrap", NoWrapDirective::new);
        registry.register("ifcontent", IfContentDirective::new);

        // Handled by other stages
        registry.register(config.slotAttribute(), PassThroughDirective::new);
        registry.register(config.bindAttribute(), PassThroughDirective::new);
        registry.register("raw", PassThroughDirective::new);

        return registry;
    }
}
