package org.tessera.compiler.api;

/**
 * Receives every external template a compilation consumed, so that a compiled-template cache can
 * invalidate dependents when one of them changes.
 */
public interface DependencySink {

    /** A sink that ignores all reports. */
    DependencySink NONE = new DependencySink() {
        @Override
        public void addDependency(String path) {
        }

        @Override
        public void addComponent(String path) {
        }
    };

    /**
     * Records a template the compiled output depends on (layouts, includes).
     * @param path The canonical template path.
     */
    void addDependency(String path);

    /**
     * Records a component template the compiled output depends on.
     * @param path The canonical template path.
     */
    void addComponent(String path);
}
