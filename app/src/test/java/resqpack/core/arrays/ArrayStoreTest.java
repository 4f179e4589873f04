package resqpack.core.arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import resqpack.core.PackageOptions;
import resqpack.core.identity.Oid;
import resqpack.exceptions.CorruptionException;
import resqpack.exceptions.NotFoundException;
import resqpack.exceptions.ShapeMismatchException;
import resqpack.utils.crypto.HashUtils;

class ArrayStoreTest {
    private final Oid owner = Oid.random();
    private ArrayStore store;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = new ArrayStore(PackageOptions.builder().chunkElements(4).build());
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    /**
     * Serves a fixed payload and counts how often it was opened.
     */
    private static final class CountingSource implements PayloadSource {
        private final byte[] payload;
        private final AtomicInteger opens = new AtomicInteger();

        CountingSource(ArrayData data) throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ArrayPayloadFormat.write(out, data);
            this.payload = out.toByteArray();
        }

        @Override
        public InputStream open() {
            opens.incrementAndGet();
            return new ByteArrayInputStream(payload);
        }

        @Override
        public String describe() {
            return "memory";
        }
    }

    private ArrayHandle attached(ArrayData data, CountingSource source, String checksum) {
        ArrayHandle handle = new ArrayHandle("Values", data.getShape(), data.getElementType(),
                ArrayHandle.pathFor(owner, "Values"), Compression.DEFLATE, checksum);
        store.attach(handle, source);
        return handle;
    }

    @Test
    void attachDoesNotTouchPayloadUntilRead() throws Exception {
        ArrayData data = ArrayData.ofDoubles(new int[] { 2, 3 }, 1, 2, 3, 4, 5, 6);
        CountingSource source = new CountingSource(data);
        ArrayHandle handle = attached(data, source, null);

        assertThat(store.handle(handle.getPath()).getShape()).containsExactly(2, 3);
        assertThat(source.opens.get()).isZero();

        assertThat(store.read(handle)).isEqualTo(data);
        assertThat(store.read(handle)).isEqualTo(data);
        assertThat(source.opens.get()).isEqualTo(1);
        assertThat(store.isMaterialized(handle)).isTrue();
        assertThat(store.isDirty(handle)).isFalse();
    }

    @Test
    void writeWithWrongShapeLeavesPayloadUntouched() throws Exception {
        ArrayHandle handle = store.allocate(owner, "Values", new int[] { 2, 2 }, ElementType.FLOAT64);
        ArrayData original = ArrayData.ofDoubles(new int[] { 2, 2 }, 1, 2, 3, 4);
        store.write(handle, original);

        assertThatThrownBy(() -> store.write(handle, ArrayData.ofDoubles(new int[] { 4 }, 9, 9, 9, 9)))
                .isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> store.write(handle, ArrayData.ofFloats(new int[] { 2, 2 }, 9, 9, 9, 9)))
                .isInstanceOf(ShapeMismatchException.class);

        assertThat(store.read(handle)).isEqualTo(original);
    }

    @Test
    void writeRecordsChecksum() throws Exception {
        ArrayHandle handle = store.allocate(owner, "Values", new int[] { 3 }, ElementType.INT32);
        ArrayData data = ArrayData.ofInts(new int[] { 3 }, 7, 8, 9);

        store.write(handle, data);

        assertThat(store.handle(handle.getPath()).getChecksum()).isEqualTo(HashUtils.sha256Hex(data.toBytes()));
        assertThat(store.isDirty(handle)).isTrue();
    }

    @Test
    void readOfUnwrittenArrayIsNotFound() {
        ArrayHandle handle = store.allocate(owner, "Values", new int[] { 3 }, ElementType.INT32);

        assertThat(store.hasPayload(handle)).isFalse();
        assertThatThrownBy(() -> store.read(handle)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void allocateTwiceIsRejected() {
        store.allocate(owner, "Values", new int[] { 3 }, ElementType.INT32);

        assertThatThrownBy(() -> store.allocate(owner, "Values", new int[] { 3 }, ElementType.INT32))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void checksumMismatchIsCorruption() throws Exception {
        ArrayData data = ArrayData.ofDoubles(new int[] { 2 }, 1, 2);
        ArrayHandle handle = attached(data, new CountingSource(data), "00");

        assertThatThrownBy(() -> store.read(handle))
                .isInstanceOf(CorruptionException.class)
                .hasMessageContaining("Checksum mismatch");
    }

    @Test
    void headerDisagreeingWithHandleIsShapeMismatch() throws Exception {
        ArrayData stored = ArrayData.ofDoubles(new int[] { 4 }, 1, 2, 3, 4);
        ArrayHandle handle = new ArrayHandle("Values", new int[] { 2, 2 }, ElementType.FLOAT64,
                ArrayHandle.pathFor(owner, "Values"), Compression.NONE, null);
        store.attach(handle, new CountingSource(stored));

        assertThatThrownBy(() -> store.verifyHeader(handle)).isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void sliceAndRowsReadOnlyWhatIsAsked() throws Exception {
        ArrayData data = ArrayData.ofLongs(new int[] { 3, 2 }, 10, 11, 20, 21, 30, 31);
        CountingSource source = new CountingSource(data);
        ArrayHandle handle = attached(data, source, null);

        assertThat(store.readSlice(handle, 2, 3).toLongArray()).containsExactly(20, 21, 30);
        ArrayData rows = store.readRows(handle, 1, 2);
        assertThat(rows.getShape()).containsExactly(2, 2);
        assertThat(rows.toLongArray()).containsExactly(20, 21, 30, 31);
        assertThat(store.isMaterialized(handle)).isFalse();

        assertThatThrownBy(() -> store.readSlice(handle, 5, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void oversizedSliceIsRefusedBeforeReading() {
        ArrayHandle flat = store.allocate(owner, "Big", new int[] { 300_000_000 }, ElementType.FLOAT64);
        ArrayHandle rows = store.allocate(owner, "Rows", new int[] { 2, 200_000_000 }, ElementType.FLOAT64);

        assertThatThrownBy(() -> store.readSlice(flat, 0, 300_000_000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("forEachChunk");
        assertThatThrownBy(() -> store.readRows(rows, 0, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("forEachChunk");
    }

    @Test
    void forEachChunkCoversEveryElementOnce() throws Exception {
        double[] values = new double[10];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        ArrayData data = ArrayData.ofDoubles(new int[] { 10 }, values);
        CountingSource source = new CountingSource(data);
        ArrayHandle handle = attached(data, source, null);

        List<Long> starts = new ArrayList<>();
        List<Double> seen = new ArrayList<>();
        store.forEachChunk(handle, (first, chunk) -> {
            starts.add(first);
            for (double d : chunk.toDoubleArray()) {
                seen.add(d);
            }
        });

        assertThat(starts).containsExactly(0L, 4L, 8L);
        assertThat(seen).hasSize(10).startsWith(0.0, 1.0).endsWith(9.0);
        assertThat(source.opens.get()).isEqualTo(1);
    }

    @Test
    void readAsyncDeliversOnExecutor() throws Exception {
        ArrayData data = ArrayData.ofBooleans(new int[] { 3 }, true, false, true);
        ArrayHandle handle = attached(data, new CountingSource(data), null);

        ArrayData result = store.readAsync(handle, executor).get(5, TimeUnit.SECONDS);

        assertThat(result.getBoolean(0)).isTrue();
        assertThat(result.getBoolean(1)).isFalse();
    }

    @Test
    void transferToCopiesSourceBytesWithoutMaterializing() throws Exception {
        ArrayData data = ArrayData.ofInts(new int[] { 2 }, 1, 2);
        CountingSource source = new CountingSource(data);
        ArrayHandle handle = attached(data, source, null);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        store.transferTo(handle, out);

        assertThat(out.toByteArray()).isEqualTo(source.payload);
        assertThat(store.isMaterialized(handle)).isFalse();
    }

    @Test
    void rebindMarksClean() throws Exception {
        ArrayHandle handle = store.allocate(owner, "Values", new int[] { 2 }, ElementType.INT32);
        ArrayData data = ArrayData.ofInts(new int[] { 2 }, 1, 2);
        store.write(handle, data);

        store.rebind(handle.getPath(), new CountingSource(data));

        assertThat(store.isDirty(handle)).isFalse();
        assertThat(store.read(handle)).isEqualTo(data);
    }
}
