package io.github.eutro.durawasm.embed.snapshot;

import io.github.eutro.durawasm.embed.ModuleInstance;
import io.github.eutro.durawasm.embed.Store;
import io.github.eutro.durawasm.embed.Value;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * The mutable contents of a {@link Store}: memories, tables, globals and dropped segments.
 * <p>
 * A {@link Snapshot} only refers into the store by address, so to move an execution into a fresh store the embedder
 * re-instantiates the same modules in the same order, allocates the same host objects, and then applies the image
 * captured alongside the snapshot.
 */
public final class StoreImage {
    private static final Logger LOGGER = LogManager.getLogger();

    private final int funcCount;
    private final SortedMap<Integer, String> fingerprints;
    private final List<byte[]> memories;
    private final List<List<Value>> tables;
    private final List<Value> globals;
    private final SortedSet<Integer> droppedElems;
    private final SortedSet<Integer> droppedDatas;

    public StoreImage(int funcCount,
                      Map<Integer, String> fingerprints,
                      List<byte[]> memories,
                      List<List<Value>> tables,
                      List<Value> globals,
                      Set<Integer> droppedElems,
                      Set<Integer> droppedDatas) {
        this.funcCount = funcCount;
        this.fingerprints = Collections.unmodifiableSortedMap(new TreeMap<>(fingerprints));
        List<byte[]> mems = new ArrayList<>();
        for (byte[] memory : memories) mems.add(memory.clone());
        this.memories = Collections.unmodifiableList(mems);
        List<List<Value>> tabs = new ArrayList<>();
        for (List<Value> table : tables) tabs.add(Collections.unmodifiableList(new ArrayList<>(table)));
        this.tables = Collections.unmodifiableList(tabs);
        this.globals = Collections.unmodifiableList(new ArrayList<>(globals));
        this.droppedElems = Collections.unmodifiableSortedSet(new TreeSet<>(droppedElems));
        this.droppedDatas = Collections.unmodifiableSortedSet(new TreeSet<>(droppedDatas));
    }

    /**
     * Capture the contents of a store.
     *
     * @param store The store.
     * @return The image.
     */
    public static StoreImage capture(Store store) {
        Map<Integer, String> fingerprints = new TreeMap<>();
        for (int i = 0; i < store.instanceCount(); i++) {
            ModuleInstance instance = store.instance(i);
            fingerprints.put(instance.getId(), instance.getModule().getFingerprint());
        }
        List<byte[]> memories = new ArrayList<>();
        for (int i = 0; i < store.memCount(); i++) memories.add(store.memory(i).contents());
        List<List<Value>> tables = new ArrayList<>();
        for (int i = 0; i < store.tableCount(); i++) tables.add(Arrays.asList(store.table(i).elements()));
        List<Value> globals = new ArrayList<>();
        for (int i = 0; i < store.globalCount(); i++) globals.add(store.global(i).get());
        Set<Integer> droppedElems = new TreeSet<>();
        for (int i = 0; i < store.elemCount(); i++) {
            if (store.elem(i).isDropped()) droppedElems.add(i);
        }
        Set<Integer> droppedDatas = new TreeSet<>();
        for (int i = 0; i < store.dataCount(); i++) {
            if (store.data(i).isDropped()) droppedDatas.add(i);
        }
        LOGGER.debug("Captured store image of {} instances", fingerprints.size());
        return new StoreImage(store.funcCount(), fingerprints, memories, tables, globals, droppedElems, droppedDatas);
    }

    /**
     * Overwrite the contents of a store with this image.
     * <p>
     * The store must hold the same functions, instances, memories, tables and globals, by address, as the store the
     * image was captured from.
     *
     * @param store The store.
     * @throws SnapshotMismatchException If the store's shape does not match the image.
     */
    public void applyTo(Store store) {
        checkCount("function", funcCount, store.funcCount());
        checkCount("module instance", fingerprints.size(), store.instanceCount());
        checkCount("memory", memories.size(), store.memCount());
        checkCount("table", tables.size(), store.tableCount());
        checkCount("global", globals.size(), store.globalCount());
        for (Map.Entry<Integer, String> entry : fingerprints.entrySet()) {
            int id = entry.getKey();
            if (id < 0 || id >= store.instanceCount()) {
                throw new SnapshotMismatchException("No module instance " + id + " in the store");
            }
            String actual = store.instance(id).getModule().getFingerprint();
            if (!actual.equals(entry.getValue())) {
                throw new SnapshotMismatchException(String.format("Module fingerprint mismatch for instance %d: expected %s, got %s",
                        id, entry.getValue(), actual));
            }
        }
        for (int addr : droppedElems) {
            if (addr < 0 || addr >= store.elemCount()) {
                throw new SnapshotMismatchException("No element segment at address " + addr);
            }
        }
        for (int addr : droppedDatas) {
            if (addr < 0 || addr >= store.dataCount()) {
                throw new SnapshotMismatchException("No data segment at address " + addr);
            }
        }
        for (int i = 0; i < globals.size(); i++) {
            Value value = globals.get(i);
            if (store.global(i).get().getType() != value.getType()) {
                throw new SnapshotMismatchException("Global " + i + " has type " + store.global(i).get().getType()
                        + ", image holds " + value);
            }
        }

        try {
            for (int i = 0; i < memories.size(); i++) store.memory(i).overwrite(memories.get(i));
            for (int i = 0; i < tables.size(); i++) store.table(i).overwrite(tables.get(i).toArray(new Value[0]));
        } catch (IllegalArgumentException e) {
            throw new SnapshotMismatchException("Store image does not fit the store", e);
        }
        for (int i = 0; i < globals.size(); i++) store.global(i).overwrite(globals.get(i));
        for (int addr : droppedElems) store.elem(addr).drop();
        for (int addr : droppedDatas) store.data(addr).drop();
        LOGGER.debug("Applied store image of {} instances", fingerprints.size());
    }

    private static void checkCount(String what, int expected, int actual) {
        if (expected != actual) {
            throw new SnapshotMismatchException(String.format("Expected %d %s entries in the store, got %d",
                    expected, what, actual));
        }
    }

    public int getFuncCount() {
        return funcCount;
    }

    public SortedMap<Integer, String> getFingerprints() {
        return fingerprints;
    }

    /**
     * @return The contents of each memory. The arrays must not be modified.
     */
    public List<byte[]> getMemories() {
        return memories;
    }

    public List<List<Value>> getTables() {
        return tables;
    }

    public List<Value> getGlobals() {
        return globals;
    }

    public SortedSet<Integer> getDroppedElems() {
        return droppedElems;
    }

    public SortedSet<Integer> getDroppedDatas() {
        return droppedDatas;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoreImage that = (StoreImage) o;
        if (funcCount != that.funcCount || memories.size() != that.memories.size()) return false;
        for (int i = 0; i < memories.size(); i++) {
            if (!Arrays.equals(memories.get(i), that.memories.get(i))) return false;
        }
        return fingerprints.equals(that.fingerprints)
                && tables.equals(that.tables)
                && globals.equals(that.globals)
                && droppedElems.equals(that.droppedElems)
                && droppedDatas.equals(that.droppedDatas);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(funcCount, fingerprints, tables, globals, droppedElems, droppedDatas);
        for (byte[] memory : memories) result = 31 * result + Arrays.hashCode(memory);
        return result;
    }
}
