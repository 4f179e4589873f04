package resqpack.core.arrays;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import resqpack.core.PackageOptions;
import resqpack.core.identity.Oid;
import resqpack.exceptions.CorruptionException;
import resqpack.exceptions.NotFoundException;
import resqpack.exceptions.ResqException;
import resqpack.exceptions.ShapeMismatchException;
import resqpack.utils.crypto.HashUtils;

// @formatter:off
/**
 * Array store: owns every external array payload of one package.
 *
 * Each storage path has a slot in one of three states:
 *
 * ┌────────────┐ write  ┌────────────┐  save  ┌────────────────────┐
 * │ ALLOCATED  │ ─────► │ IN MEMORY  │ ─────► │ BACKED BY SOURCE   │
 * │ (no data)  │        │ (dirty)    │        │ (lazy, cached once │
 * └────────────┘        └────────────┘        │  read)             │
 *                             ▲               └────────────────────┘
 *                             └──────── write ───────┘
 *
 * Obtaining a handle never touches the payload. {@link #read} materializes
 * it and caches it; the cache is dropped by the next {@link #write}. Arrays
 * above the configured chunk threshold are not cached and can be consumed
 * with {@link #readSlice} or {@link #forEachChunk} without full
 * materialization.
 *
 * Writers to the same handle are serialized by a per-handle lock. Reads may
 * run on any thread, including through {@link #readAsync}.
 */
// @formatter:on
public final class ArrayStore {
    private static final Logger log = LoggerFactory.getLogger(ArrayStore.class);

    private final PackageOptions options;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    public ArrayStore(PackageOptions options) {
        this.options = options;
    }

    public ArrayHandle allocate(Oid owner, String name, int[] shape, ElementType elementType) {
        return allocate(owner, name, shape, elementType, options.getDefaultCompression());
    }

    /**
     * Reserves a storage path for array {@code name} of {@code owner}. The
     * payload stays absent until the first {@link #write}.
     *
     * @throws IllegalArgumentException if the path is already allocated
     */
    public ArrayHandle allocate(Oid owner, String name, int[] shape, ElementType elementType,
            Compression compression) {
        ArrayHandle handle = new ArrayHandle(name, shape, elementType, ArrayHandle.pathFor(owner, name),
                compression, null);
        Slot slot = new Slot(handle);
        if (slots.putIfAbsent(handle.getPath(), slot) != null) {
            throw new IllegalArgumentException("Array already allocated: " + handle.getPath());
        }
        log.debug("Allocated {}", handle);
        return handle;
    }

    /**
     * Registers a handle whose payload already exists in {@code source}. No
     * payload bytes are read.
     */
    public void attach(ArrayHandle handle, PayloadSource source) {
        Slot slot = new Slot(handle);
        slot.source = source;
        slots.put(handle.getPath(), slot);
    }

    public boolean contains(String path) {
        return slots.containsKey(path);
    }

    /**
     * Current handle for {@code path}, including the checksum of the last write.
     */
    public ArrayHandle handle(String path) throws NotFoundException {
        Slot slot = require(path);
        synchronized (slot) {
            return slot.handle;
        }
    }

    public Collection<ArrayHandle> handles() {
        List<ArrayHandle> result = new ArrayList<>();
        for (Slot slot : slots.values()) {
            synchronized (slot) {
                result.add(slot.handle);
            }
        }
        return result;
    }

    /**
     * True if a payload has been written or a source attached.
     */
    public boolean hasPayload(ArrayHandle handle) {
        Slot slot = slots.get(handle.getPath());
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            return slot.data != null || slot.source != null;
        }
    }

    /**
     * True if the payload is held in memory, either written or cached.
     */
    public boolean isMaterialized(ArrayHandle handle) {
        Slot slot = slots.get(handle.getPath());
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            return slot.data != null;
        }
    }

    public boolean isDirty(ArrayHandle handle) {
        Slot slot = slots.get(handle.getPath());
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            return slot.dirty;
        }
    }

    /**
     * Replaces the payload. The data must have exactly the shape and element
     * type the handle was allocated with; on mismatch the stored payload is
     * left untouched.
     */
    public void write(ArrayHandle handle, ArrayData data) throws NotFoundException, ShapeMismatchException {
        Slot slot = require(handle.getPath());
        slot.writeLock.lock();
        try {
            ArrayHandle current;
            synchronized (slot) {
                current = slot.handle;
            }
            if (!current.hasShape(handle.getShape()) || current.getElementType() != handle.getElementType()) {
                throw new ShapeMismatchException(handle.getPath(), "Handle " + handle + " does not match stored "
                        + current);
            }
            if (!data.hasShape(current.getShape()) || data.getElementType() != current.getElementType()) {
                throw new ShapeMismatchException(handle.getPath(), "Cannot write " + data + " to " + current);
            }
            String checksum = HashUtils.sha256Hex(data.rawBytes());
            synchronized (slot) {
                slot.handle = current.withChecksum(checksum);
                slot.data = data;
                slot.dirty = true;
                slot.source = null;
                slot.version++;
            }
            log.debug("Wrote {} ({} bytes)", handle.getPath(), data.getByteSize());
        } finally {
            slot.writeLock.unlock();
        }
    }

    /**
     * Full payload, materialized on first access and cached until the next
     * write.
     */
    public ArrayData read(ArrayHandle handle) throws ResqException {
        Slot slot = require(handle.getPath());
        ArrayHandle current;
        PayloadSource source;
        long version;
        synchronized (slot) {
            if (slot.data != null) {
                return slot.data;
            }
            current = slot.handle;
            source = slot.source;
            version = slot.version;
        }
        if (source == null) {
            throw new NotFoundException(handle.getPath(), "Array " + handle.getPath() + " was allocated but never written");
        }
        long byteSize = current.getByteSize();
        if (byteSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Array " + current.getPath() + " is too large to materialize ("
                    + byteSize + " bytes); use readSlice or forEachChunk");
        }

        ArrayData data = load(current, source);

        if (byteSize <= options.getChunkThresholdBytes()) {
            synchronized (slot) {
                if (slot.version == version && slot.data == null) {
                    slot.data = data;
                }
            }
        } else {
            log.debug("Not caching {} ({} bytes above chunk threshold)", current.getPath(), byteSize);
        }
        return data;
    }

    /**
     * Reads the payload on {@code executor}. Failures complete the future
     * exceptionally with the original {@link ResqException} as cause.
     */
    public CompletableFuture<ArrayData> readAsync(ArrayHandle handle, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return read(handle);
            } catch (ResqException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Reads {@code count} consecutive elements in flat row-major order starting
     * at {@code firstElement}, as a one dimensional array. Never caches and
     * never materializes the rest of the payload.
     */
    public ArrayData readSlice(ArrayHandle handle, long firstElement, int count) throws ResqException {
        Slot slot = require(handle.getPath());
        ArrayHandle current;
        PayloadSource source;
        ArrayData data;
        synchronized (slot) {
            current = slot.handle;
            source = slot.source;
            data = slot.data;
        }
        long total = current.getElementCount();
        if (firstElement < 0 || count <= 0 || firstElement + count > total) {
            throw new IllegalArgumentException("Slice [" + firstElement + ", " + (firstElement + count)
                    + ") out of range for " + current.getPath() + " with " + total + " elements");
        }
        int size = current.getElementType().getByteSize();
        int byteCount = byteLength(count, size, current);
        if (data != null) {
            int from = byteLength(firstElement, size, current);
            byte[] slice = Arrays.copyOfRange(data.rawBytes(), from, from + byteCount);
            return ArrayData.wrap(new int[] { count }, current.getElementType(), slice);
        }
        if (source == null) {
            throw new NotFoundException(handle.getPath(), "Array " + handle.getPath() + " was allocated but never written");
        }
        try (InputStream in = source.open()) {
            checkHeader(current, ArrayPayloadFormat.readHeader(in));
            ArrayPayloadFormat.skipFully(in, Math.multiplyExact(firstElement, (long) size));
            byte[] slice = ArrayPayloadFormat.readBytes(in, byteCount);
            return ArrayData.wrap(new int[] { count }, current.getElementType(), slice);
        } catch (IOException e) {
            throw new CorruptionException(current.getPath(), "Failed to read slice of " + current.getPath()
                    + " from " + source.describe() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Byte length of {@code elements} elements of {@code size} bytes, if it
     * fits a byte array.
     */
    private static int byteLength(long elements, int size, ArrayHandle handle) {
        if (elements > Integer.MAX_VALUE / size) {
            throw new IllegalArgumentException(elements + " elements of " + handle.getPath() + " take "
                    + "more than " + Integer.MAX_VALUE + " bytes; use forEachChunk");
        }
        return (int) (elements * size);
    }

    /**
     * Reads rows {@code [first, first + count)} along the slowest axis, keeping
     * the remaining dimensions.
     */
    public ArrayData readRows(ArrayHandle handle, int first, int count) throws ResqException {
        int[] shape = handle(handle.getPath()).getShape();
        if (first < 0 || count <= 0 || first + count > shape[0]) {
            throw new IllegalArgumentException("Rows [" + first + ", " + (first + count) + ") out of range for "
                    + handle.getPath() + " with " + shape[0] + " rows");
        }
        long rowElements = ArrayHandle.elementCount(shape) / shape[0];
        long elements = Math.multiplyExact(count, rowElements);
        if (elements > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Rows [" + first + ", " + (first + count) + ") of " + handle.getPath()
                    + " hold " + elements + " elements, more than one read can return; use forEachChunk");
        }
        ArrayData flat = readSlice(handle, first * rowElements, (int) elements);
        int[] rowShape = shape.clone();
        rowShape[0] = count;
        return ArrayData.wrap(rowShape, flat.getElementType(), flat.rawBytes());
    }

    /**
     * Callback for chunked reads.
     */
    @FunctionalInterface
    public interface ChunkConsumer {
        void accept(long firstElement, ArrayData chunk) throws ResqException;
    }

    /**
     * Streams the payload in chunks of the configured number of elements,
     * opening the payload once.
     */
    public void forEachChunk(ArrayHandle handle, ChunkConsumer consumer) throws ResqException {
        Slot slot = require(handle.getPath());
        ArrayHandle current;
        PayloadSource source;
        ArrayData data;
        synchronized (slot) {
            current = slot.handle;
            source = slot.source;
            data = slot.data;
        }
        long total = current.getElementCount();
        int chunk = options.getChunkElements();
        int size = current.getElementType().getByteSize();

        if (data != null) {
            for (long first = 0; first < total; first += chunk) {
                int count = (int) Math.min(chunk, total - first);
                byte[] bytes = Arrays.copyOfRange(data.rawBytes(), (int) (first * size), (int) ((first + count) * size));
                consumer.accept(first, ArrayData.wrap(new int[] { count }, current.getElementType(), bytes));
            }
            return;
        }
        if (source == null) {
            throw new NotFoundException(handle.getPath(), "Array " + handle.getPath() + " was allocated but never written");
        }
        try (InputStream in = source.open()) {
            checkHeader(current, ArrayPayloadFormat.readHeader(in));
            for (long first = 0; first < total; first += chunk) {
                int count = (int) Math.min(chunk, total - first);
                byte[] bytes = ArrayPayloadFormat.readBytes(in, count * size);
                consumer.accept(first, ArrayData.wrap(new int[] { count }, current.getElementType(), bytes));
            }
        } catch (IOException e) {
            throw new CorruptionException(current.getPath(), "Failed to stream " + current.getPath() + " from "
                    + source.describe() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the payload header against the handle without reading element
     * data.
     */
    public void verifyHeader(ArrayHandle handle) throws ResqException {
        Slot slot = require(handle.getPath());
        PayloadSource source;
        synchronized (slot) {
            if (slot.data != null) {
                return;
            }
            source = slot.source;
        }
        if (source == null) {
            throw new NotFoundException(handle.getPath(), "No payload for array " + handle.getPath());
        }
        try (InputStream in = source.open()) {
            checkHeader(handle, ArrayPayloadFormat.readHeader(in));
        } catch (IOException e) {
            throw new CorruptionException(handle.getPath(), "Unreadable payload header for " + handle.getPath()
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the complete payload (header and elements) of {@code handle} to
     * {@code out}. Payloads that were never materialized are copied straight
     * from their source.
     */
    public void transferTo(ArrayHandle handle, OutputStream out) throws IOException, NotFoundException {
        Slot slot = require(handle.getPath());
        ArrayData data;
        PayloadSource source;
        synchronized (slot) {
            data = slot.data;
            source = slot.source;
        }
        if (data != null) {
            ArrayPayloadFormat.write(out, data);
        } else if (source != null) {
            try (InputStream in = source.open()) {
                in.transferTo(out);
            }
        } else {
            throw new NotFoundException(handle.getPath(), "No payload for array " + handle.getPath());
        }
    }

    /**
     * Points a clean slot at a new source, typically the container just saved.
     * In-memory data is kept as cache.
     */
    public void rebind(String path, PayloadSource source) {
        Slot slot = slots.get(path);
        if (slot == null) {
            return;
        }
        synchronized (slot) {
            slot.source = source;
            slot.dirty = false;
            long byteSize = slot.handle.getByteSize();
            if (byteSize > options.getChunkThresholdBytes()) {
                slot.data = null;
            }
        }
    }

    /**
     * Drops any cached copy of a source-backed payload.
     */
    public void evict(ArrayHandle handle) {
        Slot slot = slots.get(handle.getPath());
        if (slot == null) {
            return;
        }
        synchronized (slot) {
            if (!slot.dirty && slot.source != null) {
                slot.data = null;
            }
        }
    }

    /**
     * Forgets the handle and its payload.
     */
    public void release(ArrayHandle handle) {
        if (slots.remove(handle.getPath()) != null) {
            log.debug("Released {}", handle.getPath());
        }
    }

    private ArrayData load(ArrayHandle handle, PayloadSource source) throws ResqException {
        log.debug("Materializing {} from {}", handle.getPath(), source.describe());
        try (InputStream in = source.open()) {
            checkHeader(handle, ArrayPayloadFormat.readHeader(in));
            byte[] bytes = ArrayPayloadFormat.readBytes(in, (int) handle.getByteSize());
            if (in.read() >= 0) {
                throw new CorruptionException(handle.getPath(), "Trailing bytes after payload of " + handle.getPath());
            }
            if (options.isVerifyChecksums() && handle.getChecksum() != null) {
                String actual = HashUtils.sha256Hex(bytes);
                if (!actual.equals(handle.getChecksum())) {
                    throw new CorruptionException(handle.getPath(), "Checksum mismatch for " + handle.getPath()
                            + ": expected " + handle.getChecksum() + ", got " + actual);
                }
            }
            return ArrayData.wrap(handle.getShape(), handle.getElementType(), bytes);
        } catch (IOException e) {
            throw new CorruptionException(handle.getPath(), "Failed to read " + handle.getPath() + " from "
                    + source.describe() + ": " + e.getMessage(), e);
        }
    }

    private static void checkHeader(ArrayHandle handle, ArrayPayloadFormat.Header header)
            throws ShapeMismatchException {
        if (!header.matches(handle)) {
            throw new ShapeMismatchException(handle.getPath(), "Payload of " + handle.getPath() + " is " + header
                    + " but its handle declares " + handle.getElementType().getTypeName()
                    + ArrayHandle.shapeToString(handle.getShape()));
        }
    }

    private Slot require(String path) throws NotFoundException {
        Slot slot = slots.get(path);
        if (slot == null) {
            throw new NotFoundException(path, "No array at " + path);
        }
        return slot;
    }

    private static final class Slot {
        final ReentrantLock writeLock = new ReentrantLock();
        ArrayHandle handle;
        ArrayData data;
        PayloadSource source;
        boolean dirty;
        long version;

        Slot(ArrayHandle handle) {
            this.handle = handle;
        }
    }
}
