package io.github.eutro.durawasm.embed.snapshot;

import io.github.eutro.durawasm.Opcodes;
import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.embed.Func;
import io.github.eutro.durawasm.embed.ModuleInstance;
import io.github.eutro.durawasm.embed.Store;
import io.github.eutro.durawasm.embed.Value;
import io.github.eutro.durawasm.embed.exec.ExecutionState;
import io.github.eutro.durawasm.embed.exec.Frame;
import io.github.eutro.durawasm.embed.exec.HostCall;
import io.github.eutro.durawasm.embed.exec.Label;
import io.github.eutro.durawasm.tree.AbstractInsnNode;
import io.github.eutro.durawasm.tree.BlockInsnNode;
import io.github.eutro.durawasm.tree.ExprNode;
import io.github.eutro.durawasm.tree.TypeNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Captures execution states as {@link Snapshot}s, and restores them against a store.
 */
public final class SnapshotCodec {
    private static final Logger LOGGER = LogManager.getLogger();

    private SnapshotCodec() {
    }

    /**
     * Capture a running or suspended state. The state is not changed.
     *
     * @param state The state.
     * @return The snapshot.
     * @throws IllegalStateException If the state has finished.
     */
    public static Snapshot capture(ExecutionState state) {
        if (state.isFinished()) {
            throw new IllegalStateException("Cannot snapshot finished execution: " + state.getStatus());
        }
        Map<Integer, String> fingerprints = new TreeMap<>();
        List<Snapshot.FrameImage> frames = new ArrayList<>();
        for (Frame frame : state.getFrames()) {
            ModuleInstance instance = frame.getInstance();
            fingerprints.put(instance.getId(), instance.getModule().getFingerprint());
            List<Snapshot.LabelImage> labels = new ArrayList<>();
            for (Label label : frame.getLabels()) {
                labels.add(new Snapshot.LabelImage(label.getKind(), label.getArity(), label.getHeight(),
                        label.getCursor(), label.getOrigin(), label.isElseBranch()));
            }
            frames.add(new Snapshot.FrameImage(frame.getFuncAddr(), instance.getId(), frame.getArity(),
                    Arrays.asList(frame.getLocals()), labels));
        }
        HostCall call = state.getPendingCall();
        Snapshot.CallImage pending = call == null
                ? null
                : new Snapshot.CallImage(call.getModule(), call.getName(), call.getFuncAddr(), Arrays.asList(call.getArgs()));
        Snapshot snapshot = new Snapshot(Snapshot.FORMAT_VERSION, state.getStatus(), state.getEntry(), fingerprints,
                state.getStack(), frames, pending);
        LOGGER.debug("Captured snapshot with {} frames and {} values", frames.size(), state.getStack().size());
        return snapshot;
    }

    /**
     * Rebuild a state from a snapshot, against a store holding the same module instances at the same addresses.
     *
     * @param snapshot The snapshot.
     * @param store    The store.
     * @return The restored state, ready to step or resume.
     * @throws SnapshotMismatchException If the snapshot does not fit the store.
     */
    public static ExecutionState restore(Snapshot snapshot, Store store) {
        if (snapshot.getVersion() != Snapshot.FORMAT_VERSION) {
            throw new SnapshotMismatchException("Unsupported snapshot format version " + snapshot.getVersion());
        }
        if (snapshot.getStatus() != ExecutionState.Status.RUNNING
                && snapshot.getStatus() != ExecutionState.Status.SUSPENDED) {
            throw new SnapshotMismatchException("Snapshot of finished execution: " + snapshot.getStatus());
        }
        for (Map.Entry<Integer, String> entry : snapshot.getFingerprints().entrySet()) {
            ModuleInstance instance = instance(store, entry.getKey());
            String actual = instance.getModule().getFingerprint();
            if (!actual.equals(entry.getValue())) {
                throw new SnapshotMismatchException(String.format("Module fingerprint mismatch for instance %d: expected %s, got %s",
                        entry.getKey(), entry.getValue(), actual));
            }
        }
        if (snapshot.getEntry() != -1) func(store, snapshot.getEntry());

        int stackSize = snapshot.getStack().size();
        int floor = 0;
        List<Frame> frames = new ArrayList<>();
        for (Snapshot.FrameImage image : snapshot.getFrames()) {
            Frame frame = restoreFrame(snapshot, store, image, stackSize, floor);
            floor = frame.getLabels().get(frame.getLabels().size() - 1).getHeight();
            frames.add(frame);
        }

        HostCall pending = null;
        Snapshot.CallImage call = snapshot.getPending();
        if (snapshot.getStatus() == ExecutionState.Status.SUSPENDED) {
            if (call == null) throw new SnapshotMismatchException("Suspended snapshot without a pending host call");
            Func func = func(store, call.getFuncAddr());
            if (!(func instanceof Func.HostFunc)
                    || !((Func.HostFunc) func).getModule().equals(call.getModule())
                    || !((Func.HostFunc) func).getName().equals(call.getName())) {
                throw new SnapshotMismatchException(String.format("Function %d is not host function '%s'.'%s'",
                        call.getFuncAddr(), call.getModule(), call.getName()));
            }
            checkTypes(func.getType().params, call.getArgs(), "host call arguments");
            pending = new HostCall(call.getModule(), call.getName(), call.getFuncAddr(), func.getType(),
                    call.getArgs().toArray(new Value[0]));
        } else if (call != null) {
            throw new SnapshotMismatchException("Running snapshot with a pending host call");
        }

        ExecutionState state = ExecutionState.restore(snapshot.getStack(), frames, snapshot.getEntry(), pending,
                snapshot.getStatus());
        LOGGER.debug("Restored snapshot with {} frames and {} values", frames.size(), stackSize);
        return state;
    }

    private static ModuleInstance instance(Store store, int id) {
        if (id < 0 || id >= store.instanceCount()) {
            throw new SnapshotMismatchException("No module instance " + id + " in the store");
        }
        return store.instance(id);
    }

    private static Func func(Store store, int addr) {
        if (addr < 0 || addr >= store.funcCount()) {
            throw new SnapshotMismatchException("No function at address " + addr + " in the store");
        }
        return store.func(addr);
    }

    private static void checkTypes(ValType[] types, List<Value> values, String what) {
        if (types.length != values.size()) {
            throw new SnapshotMismatchException(String.format("Expected %d %s, got %d", types.length, what, values.size()));
        }
        for (int i = 0; i < types.length; i++) {
            if (values.get(i).getType() != types[i]) {
                throw new SnapshotMismatchException(String.format("Expected %s at %d of %s, got %s",
                        types[i], i, what, values.get(i)));
            }
        }
    }

    private static Frame restoreFrame(Snapshot snapshot, Store store, Snapshot.FrameImage image, int stackSize, int floor) {
        Func func = func(store, image.getFuncAddr());
        if (!(func instanceof Func.ModuleFunc)) {
            throw new SnapshotMismatchException("Function " + image.getFuncAddr() + " is not a module function");
        }
        Func.ModuleFunc moduleFunc = (Func.ModuleFunc) func;
        ModuleInstance instance = moduleFunc.getInstance();
        if (instance.getId() != image.getInstanceId() || !snapshot.getFingerprints().containsKey(instance.getId())) {
            throw new SnapshotMismatchException(String.format("Function %d belongs to instance %d, not %d",
                    image.getFuncAddr(), instance.getId(), image.getInstanceId()));
        }
        TypeNode type = moduleFunc.getType();
        if (image.getArity() != type.results.length) {
            throw new SnapshotMismatchException("Frame arity does not match function " + image.getFuncAddr());
        }
        ValType[] declared = moduleFunc.getCode().locals;
        ValType[] localTypes = Arrays.copyOf(type.params, type.params.length + declared.length);
        System.arraycopy(declared, 0, localTypes, type.params.length, declared.length);
        checkTypes(localTypes, image.getLocals(), "locals of function " + image.getFuncAddr());

        List<Snapshot.LabelImage> images = image.getLabels();
        if (images.isEmpty()) throw new SnapshotMismatchException("Frame without labels");
        List<Label> labels = new ArrayList<>();
        List<TypeNode> types = instance.getModule().getNode().types;
        ExprNode parent = null;
        int parentCursor = -1;
        int height = floor;
        for (Snapshot.LabelImage li : images) {
            ExprNode body;
            int arity;
            if (parent == null) {
                if (li.getKind() != Label.Kind.FUNCTION || li.getOrigin() != -1 || li.isElseBranch()) {
                    throw new SnapshotMismatchException("Frame does not start with its function body");
                }
                body = moduleFunc.getCode().expr;
                arity = type.results.length;
            } else {
                if (li.getOrigin() < 0 || li.getOrigin() >= parent.size() || li.getOrigin() != parentCursor - 1) {
                    throw new SnapshotMismatchException("Label origin " + li.getOrigin() + " is out of place");
                }
                AbstractInsnNode insn = parent.get(li.getOrigin());
                if (!(insn instanceof BlockInsnNode) || kindOf(insn.opcode) != li.getKind()) {
                    throw new SnapshotMismatchException("Label origin " + li.getOrigin() + " is not a " + li.getKind());
                }
                BlockInsnNode block = (BlockInsnNode) insn;
                if (li.isElseBranch()) {
                    if (block.elseBody == null) throw new SnapshotMismatchException("Else label of an if without else");
                    body = block.elseBody;
                } else {
                    body = block.body;
                }
                TypeNode blockType = block.blockType.expand(types);
                arity = li.getKind() == Label.Kind.LOOP ? blockType.params.length : blockType.results.length;
            }
            if (li.getArity() != arity) {
                throw new SnapshotMismatchException("Label arity " + li.getArity() + " does not match its block");
            }
            if (li.getCursor() < 0 || li.getCursor() > body.size()) {
                throw new SnapshotMismatchException("Label cursor " + li.getCursor() + " is out of range");
            }
            if (li.getHeight() < height || li.getHeight() > stackSize) {
                throw new SnapshotMismatchException("Label height " + li.getHeight() + " is out of range");
            }
            labels.add(new Label(li.getKind(), li.getArity(), li.getHeight(), body, li.getOrigin(), li.isElseBranch(),
                    li.getCursor()));
            parent = body;
            parentCursor = li.getCursor();
            height = li.getHeight();
        }
        return new Frame(image.getFuncAddr(), instance, image.getLocals().toArray(new Value[0]), image.getArity(), labels);
    }

    private static Label.Kind kindOf(byte opcode) {
        switch (opcode) {
            case Opcodes.BLOCK:
                return Label.Kind.BLOCK;
            case Opcodes.LOOP:
                return Label.Kind.LOOP;
            case Opcodes.IF:
                return Label.Kind.IF;
            default:
                return null;
        }
    }
}
