package io.github.eutro.durawasm.embed;

import io.github.eutro.durawasm.tree.CodeNode;
import io.github.eutro.durawasm.tree.TypeNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A function instance in a {@link Store}.
 */
public interface Func {
    /**
     * Get the type of this function.
     *
     * @return The type of the function.
     */
    @NotNull
    TypeNode getType();

    /**
     * A function defined by a module, closing over its instance.
     */
    final class ModuleFunc implements Func {
        private final ModuleInstance instance;
        private final int index;
        private final TypeNode type;
        private final CodeNode code;

        ModuleFunc(ModuleInstance instance, int index, TypeNode type, CodeNode code) {
            this.instance = instance;
            this.index = index;
            this.type = type;
            this.code = code;
        }

        public ModuleInstance getInstance() {
            return instance;
        }

        /**
         * @return The index of this function in its module's function index space.
         */
        public int getIndex() {
            return index;
        }

        public CodeNode getCode() {
            return code;
        }

        @Override
        public @NotNull TypeNode getType() {
            return type;
        }

        @Override
        public String toString() {
            return "func " + index + " of instance " + instance.getId();
        }
    }

    /**
     * A function provided by the host.
     * <p>
     * If it has no {@link HostFunction implementation}, calling it suspends execution until the host supplies
     * the results.
     */
    final class HostFunc implements Func {
        private final String module;
        private final String name;
        private final TypeNode type;
        private final @Nullable HostFunction impl;

        public HostFunc(String module, String name, TypeNode type, @Nullable HostFunction impl) {
            this.module = module;
            this.name = name;
            this.type = type;
            this.impl = impl;
        }

        public String getModule() {
            return module;
        }

        public String getName() {
            return name;
        }

        public @Nullable HostFunction getImpl() {
            return impl;
        }

        @Override
        public @NotNull TypeNode getType() {
            return type;
        }

        @Override
        public String toString() {
            return "host func '" + module + "'.'" + name + "'";
        }
    }
}
