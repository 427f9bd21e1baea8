package io.github.eutro.durawasm.tree;

import org.jetbrains.annotations.Nullable;

/**
 * A custom section. Only the payload of the {@code name} section is kept.
 */
public class CustomNode {
    public final String name;
    public final byte @Nullable [] payload;
    public final SourceLocation location;

    public CustomNode(String name, byte @Nullable [] payload, SourceLocation location) {
        this.name = name;
        this.payload = payload;
        this.location = location;
    }
}
