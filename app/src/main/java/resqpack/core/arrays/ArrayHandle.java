package resqpack.core.arrays;

import java.util.Arrays;
import java.util.Objects;

import resqpack.core.identity.Oid;

/**
 * Describes one externally stored array without holding its payload.
 *
 * A handle is a value: two handles with the same path, shape, element type
 * and compression are interchangeable. The checksum is informational and is
 * not part of equality, since it only becomes known once data is written.
 */
public final class ArrayHandle {
    public static final String PATH_PREFIX = "arrays/";
    public static final String PATH_SUFFIX = ".bin";

    private final String name;
    private final int[] shape;
    private final ElementType elementType;
    private final String path;
    private final Compression compression;
    private final String checksum;

    public ArrayHandle(String name, int[] shape, ElementType elementType, String path, Compression compression,
            String checksum) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Array name cannot be null or blank");
        }
        this.name = name;
        this.shape = validateShape(shape);
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.path = Objects.requireNonNull(path, "path");
        this.compression = compression != null ? compression : Compression.NONE;
        this.checksum = checksum;
    }

    /**
     * Canonical storage path of array {@code name} owned by {@code owner}.
     */
    public static String pathFor(Oid owner, String name) {
        return PATH_PREFIX + owner + "/" + name + PATH_SUFFIX;
    }

    public String getName() {
        return name;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    public ElementType getElementType() {
        return elementType;
    }

    public String getPath() {
        return path;
    }

    public Compression getCompression() {
        return compression;
    }

    /**
     * Hex SHA-256 of the element bytes, or null if never written.
     */
    public String getChecksum() {
        return checksum;
    }

    public long getElementCount() {
        return elementCount(shape);
    }

    public long getByteSize() {
        return getElementCount() * elementType.getByteSize();
    }

    public boolean hasShape(int[] otherShape) {
        return Arrays.equals(shape, otherShape);
    }

    public ArrayHandle withChecksum(String newChecksum) {
        return new ArrayHandle(name, shape, elementType, path, compression, newChecksum);
    }

    public ArrayHandle withPath(String newPath) {
        return new ArrayHandle(name, shape, elementType, newPath, compression, checksum);
    }

    public static long elementCount(int[] shape) {
        long count = 1;
        for (int dim : shape) {
            count = Math.multiplyExact(count, dim);
        }
        return count;
    }

    public static String shapeToString(int[] shape) {
        return Arrays.toString(shape);
    }

    static int[] validateShape(int[] shape) {
        if (shape == null || shape.length == 0) {
            throw new IllegalArgumentException("Array shape must have at least one dimension");
        }
        for (int dim : shape) {
            if (dim <= 0) {
                throw new IllegalArgumentException("Array dimensions must be positive: " + Arrays.toString(shape));
            }
        }
        return shape.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        ArrayHandle other = (ArrayHandle) obj;
        return name.equals(other.name)
                && Arrays.equals(shape, other.shape)
                && elementType == other.elementType
                && path.equals(other.path)
                && compression == other.compression;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, Arrays.hashCode(shape), elementType, path, compression);
    }

    @Override
    public String toString() {
        return "ArrayHandle{path=" + path + ", shape=" + Arrays.toString(shape) + ", type="
                + elementType.getTypeName() + ", compression=" + compression.getMarker() + "}";
    }
}
