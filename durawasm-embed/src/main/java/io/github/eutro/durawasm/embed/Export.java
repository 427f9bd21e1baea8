package io.github.eutro.durawasm.embed;

/**
 * An export from a module, which is a name and its type.
 */
public class Export {
    public final String name;
    public final ExternType type;

    public Export(String name, ExternType type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public String toString() {
        return type + " '" + name + "'";
    }
}
