package org.tessera.compiler.directive;

import java.util.Optional;
import java.util.Set;

/**
 * The optional capabilities of a directive, declared up front instead of discovered by type checks.
 * Instances are immutable and created through {@link #builder()}.
 */
public final class DirectiveDescriptor {

    /** A descriptor without any capability. */
    public static final DirectiveDescriptor NONE = builder().build();

    private final Set<String> pairedWith;
    private final ElementClaim elementClaim;
    private final IElementExtractor customExtraction;
    private final AttributeMergePolicy mergePolicy;
    private final String enclosingDirective;
    private final Boolean contentWrapping;

    private DirectiveDescriptor(Builder builder) {
        this.pairedWith = Set.copyOf(builder.pairedWith);
        this.elementClaim = builder.elementClaim;
        this.customExtraction = builder.customExtraction;
        this.mergePolicy = builder.mergePolicy;
        this.enclosingDirective = builder.enclosingDirective;
        this.contentWrapping = builder.contentWrapping;
    }

    /**
     * @return The names of directives that may follow this one as its alternate branch.
     */
    public Set<String> getPairedWith() {
        return pairedWith;
    }

    public boolean isPaired() {
        return !pairedWith.isEmpty();
    }

    public Optional<ElementClaim> getElementClaim() {
        return Optional.ofNullable(elementClaim);
    }

    public Optional<IElementExtractor> getCustomExtraction() {
        return Optional.ofNullable(customExtraction);
    }

    public Optional<AttributeMergePolicy> getMergePolicy() {
        return Optional.ofNullable(mergePolicy);
    }

    /**
     * @return The directive this one must be nested in (e.g. {@code switch} for {@code case}).
     */
    public Optional<String> getEnclosingDirective() {
        return Optional.ofNullable(enclosingDirective);
    }

    /**
     * @return For content modifiers: whether the content directive keeps its host element.
     */
    public Optional<Boolean> getContentWrapping() {
        return Optional.ofNullable(contentWrapping);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Set<String> pairedWith = Set.of();
        private ElementClaim elementClaim;
        private IElementExtractor customExtraction;
        private AttributeMergePolicy mergePolicy;
        private String enclosingDirective;
        private Boolean contentWrapping;

        private Builder() {
        }

        public Builder pairedWith(String... names) {
            this.pairedWith = Set.of(names);
            return this;
        }

        public Builder elementClaim(ElementClaim claim) {
            this.elementClaim = claim;
            return this;
        }

        public Builder customExtraction(IElementExtractor extractor) {
            this.customExtraction = extractor;
            return this;
        }

        public Builder mergePolicy(AttributeMergePolicy policy) {
            this.mergePolicy = policy;
            return this;
        }

        public Builder enclosingDirective(String name) {
            this.enclosingDirective = name;
            return this;
        }

        public Builder contentWrapping(boolean wrap) {
            this.contentWrapping = wrap;
            return this;
        }

        public DirectiveDescriptor build() {
            return new DirectiveDescriptor(this);
        }
    }
}
