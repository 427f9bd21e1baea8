package io.github.eutro.durawasm.embed.exec;

import io.github.eutro.durawasm.embed.Value;
import io.github.eutro.durawasm.tree.TypeNode;

import java.util.Arrays;

/**
 * A call to a host function that execution is suspended on.
 */
public final class HostCall {
    private final String module;
    private final String name;
    private final int funcAddr;
    private final TypeNode type;
    private final Value[] args;

    public HostCall(String module, String name, int funcAddr, TypeNode type, Value[] args) {
        this.module = module;
        this.name = name;
        this.funcAddr = funcAddr;
        this.type = type;
        this.args = args.clone();
    }

    public String getModule() {
        return module;
    }

    public String getName() {
        return name;
    }

    public int getFuncAddr() {
        return funcAddr;
    }

    public TypeNode getType() {
        return type;
    }

    public Value[] getArgs() {
        return args.clone();
    }

    @Override
    public String toString() {
        return "'" + module + "'.'" + name + "'" + Arrays.toString(args);
    }
}
