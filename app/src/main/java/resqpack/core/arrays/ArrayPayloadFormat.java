package resqpack.core.arrays;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

// @formatter:off
/**
 * Binary layout of one array payload part.
 *
 * ┌──────────────────────────────────────────────────────────────────┐
 * │ "RQA1" │ type │ flags │ rank (u16) │ dim 0 (i64) … dim n-1 │ data │
 * └──────────────────────────────────────────────────────────────────┘
 *    4 B     1 B    1 B      2 B            8 B × rank
 *
 * The header is big endian; the element data that follows is little endian,
 * row-major. The header lets a reader check shape and element type against
 * the handle without touching the element data.
 */
// @formatter:on
public final class ArrayPayloadFormat {
    private static final byte[] MAGIC = "RQA1".getBytes(StandardCharsets.US_ASCII);
    private static final int MAX_RANK = 32;

    private ArrayPayloadFormat() {
    }

    public static int headerSize(int rank) {
        return MAGIC.length + 1 + 1 + 2 + 8 * rank;
    }

    public static void writeHeader(OutputStream out, ElementType elementType, int[] shape) throws IOException {
        DataOutputStream data = new DataOutputStream(out);
        data.write(MAGIC);
        data.writeByte(elementType.getCode());
        data.writeByte(0);
        data.writeShort(shape.length);
        for (int dim : shape) {
            data.writeLong(dim);
        }
        data.flush();
    }

    /**
     * Writes header and element bytes of {@code array}.
     */
    public static void write(OutputStream out, ArrayData array) throws IOException {
        writeHeader(out, array.getElementType(), array.getShape());
        out.write(array.rawBytes());
    }

    /**
     * Reads and decodes a header, leaving {@code in} positioned at the first
     * element byte.
     *
     * @throws IOException if the bytes are not a payload header
     */
    public static Header readHeader(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        byte[] magic = new byte[MAGIC.length];
        data.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("Not an array payload: bad magic");
        }
        int code = data.readUnsignedByte();
        data.readUnsignedByte();
        int rank = data.readUnsignedShort();
        if (rank == 0 || rank > MAX_RANK) {
            throw new IOException("Invalid array rank in payload header: " + rank);
        }
        int[] shape = new int[rank];
        for (int i = 0; i < rank; i++) {
            long dim = data.readLong();
            if (dim <= 0 || dim > Integer.MAX_VALUE) {
                throw new IOException("Invalid array dimension in payload header: " + dim);
            }
            shape[i] = (int) dim;
        }
        ElementType elementType;
        try {
            elementType = ElementType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
        return new Header(elementType, shape);
    }

    /**
     * Reads exactly {@code length} bytes.
     */
    static byte[] readBytes(InputStream in, int length) throws IOException {
        byte[] buffer = new byte[length];
        int offset = 0;
        while (offset < length) {
            int count = in.read(buffer, offset, length - offset);
            if (count < 0) {
                throw new EOFException("Payload truncated: expected " + length + " bytes, got " + offset);
            }
            offset += count;
        }
        return buffer;
    }

    static void skipFully(InputStream in, long count) throws IOException {
        long remaining = count;
        while (remaining > 0) {
            long skipped = in.skip(remaining);
            if (skipped <= 0) {
                if (in.read() < 0) {
                    throw new EOFException("Payload truncated while skipping " + count + " bytes");
                }
                skipped = 1;
            }
            remaining -= skipped;
        }
    }

    /**
     * Decoded payload header.
     */
    public static final class Header {
        private final ElementType elementType;
        private final int[] shape;

        Header(ElementType elementType, int[] shape) {
            this.elementType = elementType;
            this.shape = shape;
        }

        public ElementType getElementType() {
            return elementType;
        }

        public int[] getShape() {
            return shape.clone();
        }

        public boolean matches(ArrayHandle handle) {
            return elementType == handle.getElementType() && handle.hasShape(shape);
        }

        @Override
        public String toString() {
            return elementType.getTypeName() + Arrays.toString(shape);
        }
    }
}
