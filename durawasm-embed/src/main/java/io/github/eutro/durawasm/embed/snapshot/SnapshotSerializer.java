package io.github.eutro.durawasm.embed.snapshot;

import co.nstant.in.cbor.CborDecoder;
import co.nstant.in.cbor.CborEncoder;
import co.nstant.in.cbor.CborException;
import co.nstant.in.cbor.model.Array;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.Map;
import co.nstant.in.cbor.model.NegativeInteger;
import co.nstant.in.cbor.model.SimpleValue;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;
import io.github.eutro.durawasm.ValType;
import io.github.eutro.durawasm.embed.Value;
import io.github.eutro.durawasm.embed.exec.ExecutionState;
import io.github.eutro.durawasm.embed.exec.Label;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * Converts {@link Snapshot}s and {@link StoreImage}s to and from CBOR.
 * <p>
 * Both are encoded as CBOR maps with string keys. A value is a two-element array of its type byte and its bits as a
 * signed integer; a label is an array {@code [kind, arity, height, cursor, origin, else]}.
 */
public final class SnapshotSerializer {
    private static final String VERSION = "version";
    private static final String STATUS = "status";
    private static final String ENTRY = "entry";
    private static final String FINGERPRINTS = "fingerprints";
    private static final String STACK = "stack";
    private static final String FRAMES = "frames";
    private static final String PENDING = "pending";
    private static final String FUNC_COUNT = "funcs";
    private static final String MEMORIES = "memories";
    private static final String TABLES = "tables";
    private static final String GLOBALS = "globals";
    private static final String DROPPED_ELEMS = "droppedElems";
    private static final String DROPPED_DATAS = "droppedDatas";

    private SnapshotSerializer() {
    }

    /**
     * Encode a snapshot.
     *
     * @param snapshot The snapshot.
     * @return The CBOR bytes.
     */
    public static byte[] serialize(Snapshot snapshot) {
        Map map = new Map();
        map.put(new UnicodeString(VERSION), integer(snapshot.getVersion()));
        map.put(new UnicodeString(STATUS), new UnicodeString(snapshot.getStatus().name()));
        map.put(new UnicodeString(ENTRY), integer(snapshot.getEntry()));
        map.put(new UnicodeString(FINGERPRINTS), fingerprints(snapshot.getFingerprints()));
        map.put(new UnicodeString(STACK), values(snapshot.getStack()));
        Array frames = new Array();
        for (Snapshot.FrameImage frame : snapshot.getFrames()) {
            Array labels = new Array();
            for (Snapshot.LabelImage label : frame.getLabels()) {
                labels.add(new Array()
                        .add(new UnicodeString(label.getKind().name()))
                        .add(integer(label.getArity()))
                        .add(integer(label.getHeight()))
                        .add(integer(label.getCursor()))
                        .add(integer(label.getOrigin()))
                        .add(label.isElseBranch() ? SimpleValue.TRUE : SimpleValue.FALSE));
            }
            frames.add(new Array()
                    .add(integer(frame.getFuncAddr()))
                    .add(integer(frame.getInstanceId()))
                    .add(integer(frame.getArity()))
                    .add(values(frame.getLocals()))
                    .add(labels));
        }
        map.put(new UnicodeString(FRAMES), frames);
        Snapshot.CallImage call = snapshot.getPending();
        map.put(new UnicodeString(PENDING), call == null
                ? SimpleValue.NULL
                : new Array()
                .add(new UnicodeString(call.getModule()))
                .add(new UnicodeString(call.getName()))
                .add(integer(call.getFuncAddr()))
                .add(values(call.getArgs())));
        return encode(map);
    }

    /**
     * Decode a snapshot.
     *
     * @param bytes The CBOR bytes.
     * @return The snapshot.
     * @throws SnapshotMismatchException If the bytes are not a well-formed snapshot.
     */
    public static Snapshot deserializeSnapshot(byte[] bytes) {
        Map map = asMap(decode(bytes));
        int version = asInt(field(map, VERSION));
        if (version != Snapshot.FORMAT_VERSION) {
            throw new SnapshotMismatchException("Unsupported snapshot format version " + version);
        }
        ExecutionState.Status status = asEnum(ExecutionState.Status.class, field(map, STATUS));
        int entry = asInt(field(map, ENTRY));
        java.util.Map<Integer, String> fingerprints = asFingerprints(field(map, FINGERPRINTS));
        List<Value> stack = asValues(field(map, STACK));
        List<Snapshot.FrameImage> frames = new ArrayList<>();
        for (DataItem frameItem : asArray(field(map, FRAMES))) {
            List<DataItem> frame = asTuple(frameItem, 5);
            List<Snapshot.LabelImage> labels = new ArrayList<>();
            for (DataItem labelItem : asArray(frame.get(4))) {
                List<DataItem> label = asTuple(labelItem, 6);
                labels.add(new Snapshot.LabelImage(
                        asEnum(Label.Kind.class, label.get(0)),
                        asInt(label.get(1)),
                        asInt(label.get(2)),
                        asInt(label.get(3)),
                        asInt(label.get(4)),
                        asBoolean(label.get(5))));
            }
            frames.add(new Snapshot.FrameImage(
                    asInt(frame.get(0)),
                    asInt(frame.get(1)),
                    asInt(frame.get(2)),
                    asValues(frame.get(3)),
                    labels));
        }
        DataItem pendingItem = field(map, PENDING);
        Snapshot.CallImage pending = null;
        if (!SimpleValue.NULL.equals(pendingItem)) {
            List<DataItem> call = asTuple(pendingItem, 4);
            pending = new Snapshot.CallImage(
                    asString(call.get(0)),
                    asString(call.get(1)),
                    asInt(call.get(2)),
                    asValues(call.get(3)));
        }
        return new Snapshot(version, status, entry, fingerprints, stack, frames, pending);
    }

    /**
     * Encode a store image.
     *
     * @param image The image.
     * @return The CBOR bytes.
     */
    public static byte[] serialize(StoreImage image) {
        Map map = new Map();
        map.put(new UnicodeString(VERSION), integer(Snapshot.FORMAT_VERSION));
        map.put(new UnicodeString(FUNC_COUNT), integer(image.getFuncCount()));
        map.put(new UnicodeString(FINGERPRINTS), fingerprints(image.getFingerprints()));
        Array memories = new Array();
        for (byte[] memory : image.getMemories()) memories.add(new ByteString(memory));
        map.put(new UnicodeString(MEMORIES), memories);
        Array tables = new Array();
        for (List<Value> table : image.getTables()) tables.add(values(table));
        map.put(new UnicodeString(TABLES), tables);
        map.put(new UnicodeString(GLOBALS), values(image.getGlobals()));
        map.put(new UnicodeString(DROPPED_ELEMS), integers(image.getDroppedElems()));
        map.put(new UnicodeString(DROPPED_DATAS), integers(image.getDroppedDatas()));
        return encode(map);
    }

    /**
     * Decode a store image.
     *
     * @param bytes The CBOR bytes.
     * @return The image.
     * @throws SnapshotMismatchException If the bytes are not a well-formed store image.
     */
    public static StoreImage deserializeStoreImage(byte[] bytes) {
        Map map = asMap(decode(bytes));
        int version = asInt(field(map, VERSION));
        if (version != Snapshot.FORMAT_VERSION) {
            throw new SnapshotMismatchException("Unsupported store image format version " + version);
        }
        List<byte[]> memories = new ArrayList<>();
        for (DataItem item : asArray(field(map, MEMORIES))) {
            if (!(item instanceof ByteString)) throw corrupt("byte string", item);
            memories.add(((ByteString) item).getBytes());
        }
        List<List<Value>> tables = new ArrayList<>();
        for (DataItem item : asArray(field(map, TABLES))) tables.add(asValues(item));
        return new StoreImage(
                asInt(field(map, FUNC_COUNT)),
                asFingerprints(field(map, FINGERPRINTS)),
                memories,
                tables,
                asValues(field(map, GLOBALS)),
                asIntegers(field(map, DROPPED_ELEMS)),
                asIntegers(field(map, DROPPED_DATAS)));
    }

    private static byte[] encode(DataItem item) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            new CborEncoder(out).encode(item);
        } catch (CborException e) {
            throw new IllegalStateException("Failed to encode CBOR", e);
        }
        return out.toByteArray();
    }

    private static DataItem decode(byte[] bytes) {
        List<DataItem> items;
        try {
            items = CborDecoder.decode(bytes);
        } catch (CborException | RuntimeException e) {
            throw new SnapshotMismatchException("Malformed CBOR", e);
        }
        if (items.size() != 1) {
            throw new SnapshotMismatchException("Expected exactly one CBOR item, got " + items.size());
        }
        return items.get(0);
    }

    private static DataItem integer(long value) {
        return value >= 0 ? new UnsignedInteger(value) : new NegativeInteger(value);
    }

    private static Array integers(Set<Integer> values) {
        Array array = new Array();
        for (int value : values) array.add(integer(value));
        return array;
    }

    private static Array values(List<Value> values) {
        Array array = new Array();
        for (Value value : values) {
            array.add(new Array()
                    .add(integer(Byte.toUnsignedInt(value.getType().getOpcode())))
                    .add(integer(value.getBits())));
        }
        return array;
    }

    private static Map fingerprints(java.util.Map<Integer, String> fingerprints) {
        Map map = new Map();
        for (java.util.Map.Entry<Integer, String> entry : fingerprints.entrySet()) {
            map.put(integer(entry.getKey()), new UnicodeString(entry.getValue()));
        }
        return map;
    }

    private static SnapshotMismatchException corrupt(String expected, DataItem item) {
        return new SnapshotMismatchException("Corrupt snapshot: expected " + expected + ", got " + item);
    }

    private static DataItem field(Map map, String key) {
        DataItem item = map.get(new UnicodeString(key));
        if (item == null) throw new SnapshotMismatchException("Corrupt snapshot: missing field '" + key + "'");
        return item;
    }

    private static Map asMap(DataItem item) {
        if (!(item instanceof Map)) throw corrupt("map", item);
        return (Map) item;
    }

    private static List<DataItem> asArray(DataItem item) {
        if (!(item instanceof Array)) throw corrupt("array", item);
        return ((Array) item).getDataItems();
    }

    private static List<DataItem> asTuple(DataItem item, int size) {
        List<DataItem> items = asArray(item);
        if (items.size() != size) throw corrupt("array of " + size, item);
        return items;
    }

    private static long asLong(DataItem item) {
        if (!(item instanceof co.nstant.in.cbor.model.Number)) throw corrupt("integer", item);
        try {
            return ((co.nstant.in.cbor.model.Number) item).getValue().longValueExact();
        } catch (ArithmeticException e) {
            throw corrupt("64-bit integer", item);
        }
    }

    private static int asInt(DataItem item) {
        long value = asLong(item);
        if (value != (int) value) throw corrupt("32-bit integer", item);
        return (int) value;
    }

    private static String asString(DataItem item) {
        if (!(item instanceof UnicodeString)) throw corrupt("string", item);
        return ((UnicodeString) item).getString();
    }

    private static boolean asBoolean(DataItem item) {
        if (SimpleValue.TRUE.equals(item)) return true;
        if (SimpleValue.FALSE.equals(item)) return false;
        throw corrupt("boolean", item);
    }

    private static <E extends Enum<E>> E asEnum(Class<E> type, DataItem item) {
        String name = asString(item);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw corrupt(type.getSimpleName(), item);
        }
    }

    private static Value asValue(DataItem item) {
        List<DataItem> pair = asTuple(item, 2);
        long typeByte = asLong(pair.get(0));
        if (typeByte < 0 || typeByte > 0xFF) throw corrupt("value type", pair.get(0));
        try {
            return Value.fromBits(ValType.fromOpcode((byte) typeByte), asLong(pair.get(1)));
        } catch (IllegalArgumentException e) {
            throw new SnapshotMismatchException("Corrupt snapshot: bad value " + item, e);
        }
    }

    private static List<Value> asValues(DataItem item) {
        List<Value> values = new ArrayList<>();
        for (DataItem element : asArray(item)) values.add(asValue(element));
        return values;
    }

    private static Set<Integer> asIntegers(DataItem item) {
        Set<Integer> values = new HashSet<>();
        for (DataItem element : asArray(item)) values.add(asInt(element));
        return values;
    }

    private static java.util.Map<Integer, String> asFingerprints(DataItem item) {
        Map map = asMap(item);
        java.util.Map<Integer, String> fingerprints = new TreeMap<>();
        for (DataItem key : map.getKeys()) {
            fingerprints.put(asInt(key), asString(map.get(key)));
        }
        return fingerprints;
    }
}
