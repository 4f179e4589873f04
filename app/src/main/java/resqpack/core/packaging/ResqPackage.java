package resqpack.core.packaging;

import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import resqpack.core.PackageOptions;
import resqpack.core.arrays.ArrayStore;
import resqpack.core.identity.IdentityCatalog;
import resqpack.core.metadata.MetadataStore;
import resqpack.core.metadata.SchemaLookup;

// @formatter:off
/**
 * Root aggregate of one in-memory package.
 *
 * ┌─ ResqPackage ─────────────────────────────────────────┐
 * │  IdentityCatalog   OID → type, part, references        │
 * │  MetadataStore     OID → current document (revisioned) │
 * │  ArrayStore        path → payload (lazy)               │
 * │  ReentrantReadWriteLock guarding all three             │
 * └───────────────────────────────────────────────────────┘
 *
 * One thread is expected to own a package and mutate it. Reads from other
 * threads are safe under the read lock; every mutation spanning more than one
 * store runs inside a {@link TransactionScope}.
 */
// @formatter:on
public final class ResqPackage {
    private final PackageOptions options;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final IdentityCatalog catalog;
    private final ArrayStore arrays;
    private final MetadataStore metadata;
    private volatile Path source;

    public ResqPackage(PackageOptions options, SchemaLookup schemas) {
        this.options = options;
        this.catalog = new IdentityCatalog();
        this.arrays = new ArrayStore(options);
        this.metadata = new MetadataStore(catalog, arrays, schemas, lock, options.isStrictTypes());
    }

    public PackageOptions getOptions() {
        return options;
    }

    public IdentityCatalog getCatalog() {
        return catalog;
    }

    public ArrayStore getArrays() {
        return arrays;
    }

    public MetadataStore getMetadata() {
        return metadata;
    }

    /**
     * Container this package was last loaded from or saved to, null for a new
     * package.
     */
    public Path getSource() {
        return source;
    }

    void setSource(Path source) {
        this.source = source;
    }

    public TransactionScope beginTransaction(String description) {
        return new TransactionScope(lock.writeLock(), description);
    }

    /**
     * Runs {@code reader} under the read lock.
     */
    public <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    ReentrantReadWriteLock lock() {
        return lock;
    }
}
