package resqpack.core.arrays;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * An in-memory n-dimensional numeric array: a shape, an element type and the
 * element bytes in row-major (C) order, little endian.
 *
 * Instances are immutable; factories copy their input.
 */
public final class ArrayData {
    private final int[] shape;
    private final ElementType elementType;
    private final byte[] bytes;

    private ArrayData(int[] shape, ElementType elementType, byte[] bytes) {
        this.shape = ArrayHandle.validateShape(shape);
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        long expected = ArrayHandle.elementCount(this.shape) * elementType.getByteSize();
        if (expected != bytes.length) {
            throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " of " + elementType.getTypeName()
                    + " needs " + expected + " bytes, got " + bytes.length);
        }
        this.bytes = bytes;
    }

    /**
     * Wraps raw little-endian element bytes. The array is copied.
     */
    public static ArrayData ofBytes(int[] shape, ElementType elementType, byte[] bytes) {
        return new ArrayData(shape, elementType, bytes.clone());
    }

    static ArrayData wrap(int[] shape, ElementType elementType, byte[] bytes) {
        return new ArrayData(shape, elementType, bytes);
    }

    public static ArrayData ofDoubles(int[] shape, double... values) {
        ByteBuffer buffer = allocate(values.length, ElementType.FLOAT64);
        buffer.asDoubleBuffer().put(values);
        return new ArrayData(shape, ElementType.FLOAT64, buffer.array());
    }

    public static ArrayData ofFloats(int[] shape, float... values) {
        ByteBuffer buffer = allocate(values.length, ElementType.FLOAT32);
        buffer.asFloatBuffer().put(values);
        return new ArrayData(shape, ElementType.FLOAT32, buffer.array());
    }

    public static ArrayData ofLongs(int[] shape, long... values) {
        ByteBuffer buffer = allocate(values.length, ElementType.INT64);
        buffer.asLongBuffer().put(values);
        return new ArrayData(shape, ElementType.INT64, buffer.array());
    }

    public static ArrayData ofInts(int[] shape, int... values) {
        ByteBuffer buffer = allocate(values.length, ElementType.INT32);
        buffer.asIntBuffer().put(values);
        return new ArrayData(shape, ElementType.INT32, buffer.array());
    }

    public static ArrayData ofBooleans(int[] shape, boolean... values) {
        byte[] raw = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            raw[i] = (byte) (values[i] ? 1 : 0);
        }
        return new ArrayData(shape, ElementType.BOOL, raw);
    }

    /**
     * An array of the given shape and type with every element zero.
     */
    public static ArrayData zeros(int[] shape, ElementType elementType) {
        long size = ArrayHandle.elementCount(shape) * elementType.getByteSize();
        return new ArrayData(shape, elementType, new byte[Math.toIntExact(size)]);
    }

    public int[] getShape() {
        return shape.clone();
    }

    public ElementType getElementType() {
        return elementType;
    }

    public int getElementCount() {
        return bytes.length / elementType.getByteSize();
    }

    public int getByteSize() {
        return bytes.length;
    }

    /**
     * Copy of the little-endian element bytes.
     */
    public byte[] toBytes() {
        return bytes.clone();
    }

    byte[] rawBytes() {
        return bytes;
    }

    public boolean hasShape(int[] otherShape) {
        return Arrays.equals(shape, otherShape);
    }

    public double getDouble(int index) {
        ByteBuffer buffer = view();
        int offset = index * elementType.getByteSize();
        switch (elementType) {
            case FLOAT64:
                return buffer.getDouble(offset);
            case FLOAT32:
                return buffer.getFloat(offset);
            default:
                return getLong(index);
        }
    }

    public long getLong(int index) {
        ByteBuffer buffer = view();
        int offset = index * elementType.getByteSize();
        switch (elementType) {
            case FLOAT64:
                return (long) buffer.getDouble(offset);
            case FLOAT32:
                return (long) buffer.getFloat(offset);
            case INT64:
                return buffer.getLong(offset);
            case INT32:
                return buffer.getInt(offset);
            case INT16:
                return buffer.getShort(offset);
            case INT8:
            case BOOL:
                return buffer.get(offset);
            case UINT8:
                return buffer.get(offset) & 0xff;
            default:
                throw new IllegalStateException("Unhandled element type " + elementType);
        }
    }

    public boolean getBoolean(int index) {
        return getLong(index) != 0;
    }

    public double[] toDoubleArray() {
        double[] result = new double[getElementCount()];
        for (int i = 0; i < result.length; i++) {
            result[i] = getDouble(i);
        }
        return result;
    }

    public long[] toLongArray() {
        long[] result = new long[getElementCount()];
        for (int i = 0; i < result.length; i++) {
            result[i] = getLong(i);
        }
        return result;
    }

    public int[] toIntArray() {
        int[] result = new int[getElementCount()];
        for (int i = 0; i < result.length; i++) {
            result[i] = Math.toIntExact(getLong(i));
        }
        return result;
    }

    private ByteBuffer view() {
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static ByteBuffer allocate(int count, ElementType type) {
        return ByteBuffer.allocate(count * type.getByteSize()).order(ByteOrder.LITTLE_ENDIAN);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        ArrayData other = (ArrayData) obj;
        return elementType == other.elementType
                && Arrays.equals(shape, other.shape)
                && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, Arrays.hashCode(shape), Arrays.hashCode(bytes));
    }

    @Override
    public String toString() {
        return "ArrayData{shape=" + Arrays.toString(shape) + ", type=" + elementType.getTypeName() + "}";
    }
}
