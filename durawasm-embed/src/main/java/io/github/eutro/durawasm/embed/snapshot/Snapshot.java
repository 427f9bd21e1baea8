package io.github.eutro.durawasm.embed.snapshot;

import io.github.eutro.durawasm.embed.Value;
import io.github.eutro.durawasm.embed.exec.ExecutionState;
import io.github.eutro.durawasm.embed.exec.Label;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A captured {@link ExecutionState}, as plain data.
 * <p>
 * Functions and module instances are referred to by address and id, and each instance referenced is recorded
 * with the fingerprint of its module, so that restoring into a store holding different modules fails.
 */
public final class Snapshot {
    /**
     * The version of the snapshot layout. Snapshots of other versions are refused.
     */
    public static final int FORMAT_VERSION = 1;

    private final int version;
    private final ExecutionState.Status status;
    private final int entry;
    private final SortedMap<Integer, String> fingerprints;
    private final List<Value> stack;
    private final List<FrameImage> frames;
    private final @Nullable CallImage pending;

    public Snapshot(int version,
                    ExecutionState.Status status,
                    int entry,
                    Map<Integer, String> fingerprints,
                    List<Value> stack,
                    List<FrameImage> frames,
                    @Nullable CallImage pending) {
        this.version = version;
        this.status = status;
        this.entry = entry;
        this.fingerprints = Collections.unmodifiableSortedMap(new TreeMap<>(fingerprints));
        this.stack = Collections.unmodifiableList(new ArrayList<>(stack));
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
        this.pending = pending;
    }

    public int getVersion() {
        return version;
    }

    public ExecutionState.Status getStatus() {
        return status;
    }

    public int getEntry() {
        return entry;
    }

    /**
     * @return The module fingerprint of each instance referenced, by instance id.
     */
    public SortedMap<Integer, String> getFingerprints() {
        return fingerprints;
    }

    public List<Value> getStack() {
        return stack;
    }

    public List<FrameImage> getFrames() {
        return frames;
    }

    public @Nullable CallImage getPending() {
        return pending;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Snapshot that = (Snapshot) o;
        return version == that.version
                && entry == that.entry
                && status == that.status
                && fingerprints.equals(that.fingerprints)
                && stack.equals(that.stack)
                && frames.equals(that.frames)
                && Objects.equals(pending, that.pending);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, status, entry, fingerprints, stack, frames, pending);
    }

    public static final class FrameImage {
        private final int funcAddr;
        private final int instanceId;
        private final int arity;
        private final List<Value> locals;
        private final List<LabelImage> labels;

        public FrameImage(int funcAddr, int instanceId, int arity, List<Value> locals, List<LabelImage> labels) {
            this.funcAddr = funcAddr;
            this.instanceId = instanceId;
            this.arity = arity;
            this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
            this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
        }

        public int getFuncAddr() {
            return funcAddr;
        }

        public int getInstanceId() {
            return instanceId;
        }

        public int getArity() {
            return arity;
        }

        public List<Value> getLocals() {
            return locals;
        }

        public List<LabelImage> getLabels() {
            return labels;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            FrameImage that = (FrameImage) o;
            return funcAddr == that.funcAddr
                    && instanceId == that.instanceId
                    && arity == that.arity
                    && locals.equals(that.locals)
                    && labels.equals(that.labels);
        }

        @Override
        public int hashCode() {
            return Objects.hash(funcAddr, instanceId, arity, locals, labels);
        }
    }

    /**
     * A label, without its instruction sequence, which is found again from {@link #getOrigin() origins}.
     */
    public static final class LabelImage {
        private final Label.Kind kind;
        private final int arity;
        private final int height;
        private final int cursor;
        private final int origin;
        private final boolean elseBranch;

        public LabelImage(Label.Kind kind, int arity, int height, int cursor, int origin, boolean elseBranch) {
            this.kind = kind;
            this.arity = arity;
            this.height = height;
            this.cursor = cursor;
            this.origin = origin;
            this.elseBranch = elseBranch;
        }

        public Label.Kind getKind() {
            return kind;
        }

        public int getArity() {
            return arity;
        }

        public int getHeight() {
            return height;
        }

        public int getCursor() {
            return cursor;
        }

        public int getOrigin() {
            return origin;
        }

        public boolean isElseBranch() {
            return elseBranch;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            LabelImage that = (LabelImage) o;
            return arity == that.arity
                    && height == that.height
                    && cursor == that.cursor
                    && origin == that.origin
                    && elseBranch == that.elseBranch
                    && kind == that.kind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, arity, height, cursor, origin, elseBranch);
        }
    }

    /**
     * The host call a suspended state waits on.
     */
    public static final class CallImage {
        private final String module;
        private final String name;
        private final int funcAddr;
        private final List<Value> args;

        public CallImage(String module, String name, int funcAddr, List<Value> args) {
            this.module = module;
            this.name = name;
            this.funcAddr = funcAddr;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
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

        public List<Value> getArgs() {
            return args;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            CallImage that = (CallImage) o;
            return funcAddr == that.funcAddr
                    && module.equals(that.module)
                    && name.equals(that.name)
                    && args.equals(that.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(module, name, funcAddr, args);
        }
    }
}
