package io.github.eutro.durawasm.embed;

/**
 * Declares that a method corresponds to a function defined in the
 * <a href="https://webassembly.github.io/spec/core/appendix/embedding.html">embedding</a>
 * section of the WebAssembly specification.
 * <p>
 * These are the stable entry points for manipulating a {@link Store} from the host.
 */
public @interface Embedding {
    /**
     * Returns the name of the function implemented.
     *
     * @return The name of the function implemented.
     */
    String value();
}
