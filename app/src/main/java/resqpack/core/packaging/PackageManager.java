package resqpack.core.packaging;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import resqpack.core.PackageOptions;
import resqpack.core.arrays.ArrayData;
import resqpack.core.arrays.ArrayHandle;
import resqpack.core.arrays.ArrayStore;
import resqpack.core.container.ContainerLayout;
import resqpack.core.container.ContainerPayloadSource;
import resqpack.core.container.ContainerReader;
import resqpack.core.container.ContainerWriter;
import resqpack.core.container.ContentTypes;
import resqpack.core.container.OutputStreamFactory;
import resqpack.core.container.Relationship;
import resqpack.core.container.Relationships;
import resqpack.core.identity.CatalogEntry;
import resqpack.core.identity.Citation;
import resqpack.core.identity.IdentityCatalog;
import resqpack.core.identity.Oid;
import resqpack.core.identity.RemovalReport;
import resqpack.core.metadata.MetadataCodec;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.metadata.MetadataStore;
import resqpack.core.metadata.SchemaLookup;
import resqpack.core.metadata.ValidationError;
import resqpack.exceptions.ConcurrentUpdateException;
import resqpack.exceptions.CorruptionException;
import resqpack.exceptions.NotFoundException;
import resqpack.exceptions.ResqException;
import resqpack.utils.io.FileUtils;

// @formatter:off
/**
 * Package manager: owns one {@link ResqPackage} and its container file.
 *
 * Loading:
 *
 * ┌──────────────┐   ┌─────────────┐   ┌──────────────┐   ┌──────────────┐
 * │ enumerate    │ → │ parse and   │ → │ validate     │ → │ verify array │
 * │ entries,     │   │ register    │   │ references,  │   │ headers and  │
 * │ duplicates   │   │ every part  │   │ schema,      │   │ relationship │
 * │              │   │             │   │ cycles       │   │ parts        │
 * └──────────────┘   └─────────────┘   └──────────────┘   └──────────────┘
 *
 * Each stage records a {@link PartDiagnostic} per failing part and moves on.
 * Unparseable parts and parts with a duplicate OID or name are left out;
 * parts that parsed but failed a check are kept and marked invalid, so they
 * can be inspected, repaired or removed but not saved as they are.
 *
 * Saving validates the whole package, writes a staging file next to the
 * destination and moves it over the destination only once it is complete.
 * Any failure leaves the destination as it was.
 */
// @formatter:on
public final class PackageManager {
    private static final Logger log = LoggerFactory.getLogger(PackageManager.class);

    private static final Map<Path, SaveLock> SAVE_LOCKS = new ConcurrentHashMap<>();

    private final ResqPackage pkg;
    private final MetadataCodec codec = new MetadataCodec();
    private final LoadReport loadReport;
    private OutputStreamFactory streams = OutputStreamFactory.FILES;

    private PackageManager(ResqPackage pkg, LoadReport loadReport) {
        this.pkg = pkg;
        this.loadReport = loadReport;
    }

    public static PackageManager create(PackageOptions options, SchemaLookup schemas) {
        return new PackageManager(new ResqPackage(options, schemas), LoadReport.empty());
    }

    /**
     * Loads a container. Problems with individual parts do not fail the call;
     * they are listed in {@link #getLoadReport()}.
     *
     * @throws NotFoundException   if {@code source} does not exist
     * @throws CorruptionException if the container as a whole is unreadable
     */
    public static PackageManager open(Path source, PackageOptions options, SchemaLookup schemas)
            throws ResqException {
        ResqPackage pkg = new ResqPackage(options, schemas);
        Loader loader = new Loader(pkg, source);
        LoadReport report = loader.load();
        pkg.setSource(source.toAbsolutePath().normalize());
        if (report.isClean()) {
            log.info("Loaded {}: {} part(s)", source, report.getLoadedParts());
        } else {
            log.warn("Loaded {}: {} part(s), {} diagnostic(s)", source, report.getLoadedParts(),
                    report.getDiagnostics().size());
        }
        return new PackageManager(pkg, report);
    }

    /**
     * Like {@link #open} but fails if any part has a diagnostic.
     */
    public static PackageManager openStrict(Path source, PackageOptions options, SchemaLookup schemas)
            throws ResqException {
        PackageManager manager = open(source, options, schemas);
        manager.getLoadReport().throwIfAny();
        return manager;
    }

    public ResqPackage getPackage() {
        return pkg;
    }

    public LoadReport getLoadReport() {
        return loadReport;
    }

    /**
     * Replaces how the staging file is opened for writing.
     */
    public void setOutputStreamFactory(OutputStreamFactory streams) {
        this.streams = streams;
    }

    /**
     * Adds a new object. A draft without OID gets a fresh one; a draft with an
     * OID keeps it, as when copying between packages. Each entry of
     * {@code arrays} is stored under a new handle and set as the array field
     * of the same name.
     *
     * @return the OID of the added object
     */
    public Oid addPart(MetadataDocument draft, Map<String, ArrayData> arrays) throws ResqException {
        return addParts(List.of(new PartDraft(draft, arrays))).get(0);
    }

    /**
     * Adds several objects at once, all or none. Every OID is registered
     * before any document is stored, so the drafts may reference each other,
     * in cycles too.
     *
     * @return the OIDs of the added objects, in draft order
     */
    public List<Oid> addParts(List<PartDraft> drafts) throws ResqException {
        IdentityCatalog catalog = pkg.getCatalog();
        ArrayStore store = pkg.getArrays();
        MetadataStore metadata = pkg.getMetadata();
        List<MetadataDocument> docs = new ArrayList<>(drafts.size());

        try (TransactionScope tx = pkg.beginTransaction("add " + drafts.size() + " part(s)")) {
            for (PartDraft draft : drafts) {
                MetadataDocument doc = draft.getDocument().copy();
                Oid oid;
                if (doc.getOid() == null) {
                    oid = catalog.register(doc.getType(), List.of());
                    doc.setOid(oid);
                } else {
                    oid = doc.getOid();
                    if (catalog.contains(oid)) {
                        throw new IllegalArgumentException("OID " + oid + " is already in the package");
                    }
                    catalog.registerExisting(oid, doc.getType(), null, doc.getCitation(), List.of());
                }
                tx.onRollback(() -> catalog.unregister(oid));
                catalog.setPartName(oid, ContainerLayout.defaultPartName(doc.getType(), oid));

                for (Map.Entry<String, ArrayData> entry : draft.getArrays().entrySet()) {
                    ArrayData data = entry.getValue();
                    ArrayHandle handle = store.allocate(oid, entry.getKey(), data.getShape(),
                            data.getElementType());
                    tx.onRollback(() -> store.release(handle));
                    store.write(handle, data);
                    doc.setArray(entry.getKey(), store.handle(handle.getPath()));
                }
                docs.add(doc);
            }

            for (MetadataDocument doc : docs) {
                metadata.put(doc);
                tx.onRollback(() -> metadata.remove(doc.getOid()));
            }
            tx.commit();
        }

        List<Oid> oids = new ArrayList<>(docs.size());
        for (int i = 0; i < docs.size(); i++) {
            MetadataDocument doc = docs.get(i);
            drafts.get(i).getDocument().setOid(doc.getOid());
            oids.add(doc.getOid());
            log.debug("Added {} {} as {}", doc.getType(), doc.getOid(), catalog.resolve(doc.getOid()).getPartName());
        }
        return oids;
    }

    /**
     * Stores a changed document of an existing object.
     *
     * @param expectedRevision revision the caller read, or
     *                         {@link MetadataStore#ANY_REVISION}
     */
    public void updatePart(MetadataDocument doc, long expectedRevision) throws ResqException {
        pkg.getMetadata().put(doc, expectedRevision);
    }

    /**
     * Writes {@code data} to array field {@code field} of {@code oid}. An
     * existing array of the same shape and element type is overwritten in
     * place; otherwise a new array replaces it in the document.
     */
    public ArrayHandle setArray(Oid oid, String field, ArrayData data) throws ResqException {
        ArrayStore store = pkg.getArrays();
        MetadataStore metadata = pkg.getMetadata();
        try (TransactionScope tx = pkg.beginTransaction("set array " + field + " of " + oid)) {
            MetadataDocument doc = metadata.get(oid);
            ArrayHandle existing = doc.getArray(field);
            if (existing != null && existing.hasShape(data.getShape())
                    && existing.getElementType() == data.getElementType()) {
                store.write(existing, data);
                ArrayHandle current = store.handle(existing.getPath());
                doc.setArray(field, current);
                metadata.put(doc, doc.getRevision());
                tx.commit();
                return current;
            }

            ArrayHandle handle = store.allocate(oid, uniqueArrayName(oid, field), data.getShape(),
                    data.getElementType());
            tx.onRollback(() -> store.release(handle));
            store.write(handle, data);
            ArrayHandle current = store.handle(handle.getPath());
            doc.setArray(field, current);
            metadata.put(doc, doc.getRevision());
            tx.commit();
            if (existing != null) {
                store.release(existing);
            }
            return current;
        }
    }

    private String uniqueArrayName(Oid oid, String field) {
        String name = field;
        int suffix = 1;
        while (pkg.getArrays().contains(ArrayHandle.pathFor(oid, name))) {
            name = field + "_" + suffix++;
        }
        return name;
    }

    /**
     * Removes an object with its document and arrays.
     *
     * @param cascade whether objects referencing {@code oid} may be
     *                invalidated instead of failing the removal
     */
    public RemovalReport removePart(Oid oid, boolean cascade) throws ResqException {
        IdentityCatalog catalog = pkg.getCatalog();
        MetadataStore metadata = pkg.getMetadata();
        RemovalReport report;
        Optional<MetadataDocument> removed;
        try (TransactionScope tx = pkg.beginTransaction("remove " + oid)) {
            CatalogEntry before = catalog.resolve(oid);
            List<CatalogEntry> referencingBefore = new ArrayList<>();
            for (Oid source : catalog.referencing(oid)) {
                catalog.find(source).ifPresent(referencingBefore::add);
            }

            report = catalog.remove(oid, cascade);
            tx.onRollback(() -> {
                catalog.reinstate(before);
                referencingBefore.forEach(catalog::reinstate);
            });

            removed = metadata.remove(oid);
            removed.ifPresent(doc -> tx.onRollback(() -> metadata.restore(doc)));
            tx.commit();
        }
        removed.ifPresent(doc -> doc.getArrays().values().forEach(pkg.getArrays()::release));
        if (report.isPartialFailure()) {
            log.warn("Removed {}; invalidated {}", report.getRemovedPart(), report.getInvalidated().size());
        } else {
            log.debug("Removed {}", report.getRemovedPart());
        }
        return report;
    }

    /**
     * Gives an object a new part name.
     *
     * @throws IllegalArgumentException if {@code newName} is not a valid part
     *                                  name
     * @throws CorruptionException      if another part already has that name
     */
    public void renamePart(Oid oid, String newName) throws ResqException {
        ContainerLayout.requireValidPartName(newName);
        try (TransactionScope tx = pkg.beginTransaction("rename " + oid)) {
            String old = pkg.getCatalog().resolve(oid).getPartName();
            pkg.getCatalog().setPartName(oid, newName);
            tx.commit();
            log.debug("Renamed {} to {}", old, newName);
        }
    }

    /**
     * Saves back to the container the package was loaded from or last saved
     * to.
     */
    public void save() throws ResqException {
        Path source = pkg.getSource();
        if (source == null) {
            throw new IllegalStateException("Package has never been saved; use save(Path)");
        }
        save(source);
    }

    /**
     * Writes a complete container to {@code destination}.
     *
     * @throws ConcurrentUpdateException if another save to the same destination
     *                                   does not finish within the configured
     *                                   timeout
     * @throws ResqException             if the package is inconsistent or
     *                                   writing fails; the destination is then
     *                                   unchanged
     */
    public void save(Path destination) throws ResqException {
        Path target = destination.toAbsolutePath().normalize();
        ReentrantLock saveLock = SaveLock.enter(target);
        try {
            lockForSave(saveLock, target);
            try {
                writeLocked(target);
            } finally {
                saveLock.unlock();
            }
        } finally {
            SaveLock.leave(target);
        }
    }

    private void lockForSave(ReentrantLock saveLock, Path target) throws ConcurrentUpdateException {
        long timeout = pkg.getOptions().getSaveLockTimeoutMillis();
        try {
            if (!saveLock.tryLock(timeout, TimeUnit.MILLISECONDS)) {
                throw new ConcurrentUpdateException(target.toString(),
                        "Another save to " + target + " did not finish within " + timeout + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrentUpdateException(target.toString(), "Interrupted waiting to save " + target);
        }
    }

    private void writeLocked(Path target) throws ResqException {
        pkg.lock().readLock().lock();
        try {
            List<SavedPart> parts = prepareSave();
            writeContainer(target, parts);
            for (SavedPart part : parts) {
                for (ArrayHandle handle : part.doc.getArrays().values()) {
                    pkg.getArrays().rebind(handle.getPath(),
                            new ContainerPayloadSource(target, handle.getPath(), pkg.getOptions().ioRetry()));
                }
            }
            pkg.setSource(target);
            log.info("Saved {} part(s) to {}", parts.size(), target);
        } finally {
            pkg.lock().readLock().unlock();
        }
    }

    /**
     * Whether a save lock entry for {@code target} exists, that is whether
     * some save to it is running or waiting.
     */
    static boolean isSaveInProgress(Path target) {
        return SAVE_LOCKS.containsKey(target.toAbsolutePath().normalize());
    }

    /**
     * Checks that the package can be saved and takes the documents to write,
     * with array handles refreshed from the array store.
     */
    private List<SavedPart> prepareSave() throws ResqException {
        IdentityCatalog catalog = pkg.getCatalog();
        MetadataStore metadata = pkg.getMetadata();
        ArrayStore store = pkg.getArrays();
        List<ValidationError> errors = new ArrayList<>();
        List<SavedPart> parts = new ArrayList<>();

        for (Map.Entry<Oid, Set<Oid>> entry : catalog.danglingReferences().entrySet()) {
            CatalogEntry source = catalog.resolve(entry.getKey());
            for (Oid missing : entry.getValue()) {
                errors.add(new ValidationError(ValidationError.Kind.DANGLING_REFERENCE, source.getOid().toString(),
                        source.getPartName(), null, "References removed or absent OID " + missing,
                        missing.toString()));
            }
        }

        for (CatalogEntry entry : catalog.entries()) {
            Optional<MetadataDocument> found = metadata.find(entry.getOid());
            if (found.isEmpty()) {
                errors.add(new ValidationError(ValidationError.Kind.MISSING_FIELD, entry.getOid().toString(),
                        entry.getPartName(), null, "No metadata document"));
                continue;
            }
            MetadataDocument doc = found.get();
            for (Map.Entry<String, ArrayHandle> field : doc.getArrays().entrySet()) {
                ArrayHandle declared = field.getValue();
                if (!store.contains(declared.getPath()) || !store.hasPayload(declared)) {
                    errors.add(new ValidationError(ValidationError.Kind.MISSING_PAYLOAD, entry.getOid().toString(),
                            entry.getPartName(), field.getKey(), "No payload written for " + declared.getPath()));
                } else {
                    ArrayHandle current = store.handle(declared.getPath());
                    if (current.hasShape(declared.getShape())
                            && current.getElementType() == declared.getElementType()) {
                        doc.setArray(field.getKey(), current);
                    }
                }
            }
            List<ValidationError> docErrors = metadata.validate(doc);
            errors.addAll(docErrors);
            if (docErrors.isEmpty() && !entry.isValid()
                    && !catalog.danglingReferences().containsKey(entry.getOid())) {
                errors.add(new ValidationError(ValidationError.Kind.INVALID_VALUE, entry.getOid().toString(),
                        entry.getPartName(), null, "Object is marked invalid: " + entry.getInvalidReason()));
            }
            parts.add(new SavedPart(entry, doc));
        }

        if (!errors.isEmpty()) {
            log.warn("Refusing to save: {} error(s), first: {}", errors.size(), errors.get(0));
            throw MetadataStore.failureFor(errors);
        }
        return parts;
    }

    private void writeContainer(Path target, List<SavedPart> parts) throws ResqException {
        IdentityCatalog catalog = pkg.getCatalog();
        ArrayStore store = pkg.getArrays();
        Path staging = null;
        boolean replaced = false;
        try {
            staging = FileUtils.createSiblingTempFile(target);
            try (ContainerWriter writer = new ContainerWriter(staging, streams)) {
                ContentTypes types = ContentTypes.standard();
                for (SavedPart part : parts) {
                    types.addOverride(part.entry.getPartName(), MetadataCodec.contentType(part.entry.getType()));
                }
                writer.putEntry(ContainerLayout.CONTENT_TYPES, types.encode());
                writer.putEntry(ContainerLayout.ROOT_RELATIONSHIPS, new Relationships("")
                        .add(Relationship.CORE_PROPERTIES, ContainerLayout.CORE_PROPERTIES)
                        .encode());
                writer.putCoreProperties(target.getFileName().toString(), Citation.DEFAULT_ORIGINATOR,
                        Instant.now());

                for (SavedPart part : parts) {
                    String partName = part.entry.getPartName();
                    writer.putEntry(partName, codec.encode(part.doc, catalog::find));
                    Relationships rels = relationshipsOf(part);
                    if (!rels.isEmpty()) {
                        writer.putEntry(ContainerLayout.relationshipsPartFor(partName), rels.encode());
                    }
                }

                for (SavedPart part : parts) {
                    for (ArrayHandle handle : part.doc.getArrays().values()) {
                        writer.putEntry(handle.getPath(), handle.getCompression(), out -> {
                            try {
                                store.transferTo(handle, out);
                            } catch (NotFoundException e) {
                                throw new IOException("Payload of " + handle.getPath() + " vanished during save", e);
                            }
                        });
                    }
                }
                writer.finish();
            }
            FileUtils.replaceAtomically(staging, target);
            replaced = true;
        } catch (IOException e) {
            throw new ResqException("Failed to save " + target + "; previous container left unchanged: "
                    + e.getMessage(), e);
        } finally {
            if (!replaced) {
                FileUtils.deleteQuietly(staging);
            }
        }
    }

    private Relationships relationshipsOf(SavedPart part) {
        IdentityCatalog catalog = pkg.getCatalog();
        Relationships rels = new Relationships(part.entry.getPartName());
        for (Oid target : part.doc.referencedOids()) {
            if (!target.equals(part.entry.getOid())) {
                catalog.find(target).ifPresent(t -> rels.add(Relationship.DESTINATION_OBJECT, t.getPartName()));
            }
        }
        for (Oid source : catalog.referencing(part.entry.getOid())) {
            if (!source.equals(part.entry.getOid())) {
                catalog.find(source).ifPresent(s -> rels.add(Relationship.SOURCE_OBJECT, s.getPartName()));
            }
        }
        for (ArrayHandle handle : part.doc.getArrays().values()) {
            rels.add(Relationship.EXTERNAL_RESOURCE, handle.getPath());
        }
        return rels;
    }

    /**
     * Save lock of one destination with the number of saves holding or
     * waiting for it. The entry is dropped when the count returns to zero.
     */
    private static final class SaveLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;

        static ReentrantLock enter(Path target) {
            return SAVE_LOCKS.compute(target, (key, current) -> {
                SaveLock entry = current != null ? current : new SaveLock();
                entry.users++;
                return entry;
            }).lock;
        }

        static void leave(Path target) {
            SAVE_LOCKS.computeIfPresent(target, (key, entry) -> --entry.users == 0 ? null : entry);
        }
    }

    private static final class SavedPart {
        final CatalogEntry entry;
        final MetadataDocument doc;

        SavedPart(CatalogEntry entry, MetadataDocument doc) {
            this.entry = entry;
            this.doc = doc;
        }
    }

    /**
     * One load of one container.
     */
    private static final class Loader {
        private final ResqPackage pkg;
        private final Path source;
        private final MetadataCodec codec = new MetadataCodec();
        private final List<PartDiagnostic> diagnostics = new ArrayList<>();
        private final Map<Oid, MetadataDocument> loaded = new LinkedHashMap<>();
        private final Set<Oid> failed = new LinkedHashSet<>();

        Loader(ResqPackage pkg, Path source) {
            this.pkg = pkg;
            this.source = source;
        }

        LoadReport load() throws ResqException {
            try (ContainerReader reader = ContainerReader.open(source, pkg.getOptions().ioRetry())) {
                if (!reader.contains(ContainerLayout.CONTENT_TYPES)) {
                    throw new CorruptionException(ContainerLayout.CONTENT_TYPES,
                            source + " has no " + ContainerLayout.CONTENT_TYPES + "; not a package container");
                }
                ContentTypes types = ContentTypes.decode(
                        new ByteArrayInputStream(reader.read(ContainerLayout.CONTENT_TYPES)));

                for (String duplicate : reader.duplicateNames()) {
                    diagnose(duplicate, null, new CorruptionException(duplicate,
                            "Part name " + duplicate + " occurs more than once in " + source));
                }

                parseParts(reader, types);
                attachArrays(reader);
                for (MetadataDocument doc : loaded.values()) {
                    pkg.getMetadata().putLoaded(doc);
                }
                validateParts();
                verifyArrays();
                checkRelationships(reader);
            } catch (IOException e) {
                log.warn("Failed to close {}: {}", source, e.getMessage());
            }

            for (Oid oid : failed) {
                if (pkg.getCatalog().contains(oid)) {
                    pkg.getCatalog().invalidate(oid, "failed load checks");
                }
            }
            return new LoadReport(source.toString(), loaded.size(), diagnostics);
        }

        private void parseParts(ContainerReader reader, ContentTypes types) throws NotFoundException {
            Set<String> duplicates = reader.duplicateNames();
            for (String name : reader.entryNames()) {
                if (!ContainerLayout.isMetadataPart(name) || duplicates.contains(name)) {
                    continue;
                }
                MetadataDocument doc;
                try (InputStream in = new ByteArrayInputStream(reader.read(name))) {
                    doc = codec.decode(in, name);
                } catch (CorruptionException e) {
                    diagnose(name, null, e);
                    continue;
                } catch (IOException e) {
                    diagnose(name, null, new CorruptionException(name, "Cannot read " + name, e));
                    continue;
                }

                Optional<String> declared = types.typeOf(name).flatMap(ContentTypes::objectType);
                if (declared.isPresent() && !declared.get().equals(doc.getType())) {
                    diagnose(name, null, new CorruptionException(name, "Content type of " + name
                            + " declares " + declared.get() + " but the document is " + doc.getType()));
                    continue;
                }

                try {
                    pkg.getCatalog().registerExisting(doc.getOid(), doc.getType(), name, doc.getCitation(),
                            doc.referencedOids());
                } catch (CorruptionException e) {
                    diagnose(name, null, e);
                    continue;
                }
                loaded.put(doc.getOid(), doc);
                log.debug("Parsed {} ({} {})", name, doc.getType(), doc.getOid());
            }
        }

        private void attachArrays(ContainerReader reader) {
            ArrayStore store = pkg.getArrays();
            for (MetadataDocument doc : loaded.values()) {
                for (ArrayHandle handle : doc.getArrays().values()) {
                    String partName = partOf(doc.getOid());
                    if (!reader.contains(handle.getPath())) {
                        diagnose(partName, doc.getOid(), new CorruptionException(partName,
                                "Array payload " + handle.getPath() + " of " + partName + " is missing"));
                    } else if (store.contains(handle.getPath())) {
                        diagnose(partName, doc.getOid(), new CorruptionException(partName,
                                "Array payload " + handle.getPath() + " is claimed by more than one part"));
                    } else {
                        store.attach(handle, reader.payloadSource(handle.getPath()));
                    }
                }
            }
        }

        private void validateParts() {
            for (MetadataDocument doc : loaded.values()) {
                if (failed.contains(doc.getOid())) {
                    continue;
                }
                List<ValidationError> errors = pkg.getMetadata().validate(doc);
                if (!errors.isEmpty()) {
                    diagnose(partOf(doc.getOid()), doc.getOid(), MetadataStore.failureFor(errors));
                }
            }
        }

        private void verifyArrays() {
            for (MetadataDocument doc : loaded.values()) {
                for (ArrayHandle handle : doc.getArrays().values()) {
                    if (failed.contains(doc.getOid()) || !pkg.getArrays().contains(handle.getPath())) {
                        continue;
                    }
                    try {
                        pkg.getArrays().verifyHeader(handle);
                    } catch (ResqException e) {
                        diagnose(partOf(doc.getOid()), doc.getOid(), e);
                    }
                }
            }
        }

        private void checkRelationships(ContainerReader reader) {
            IdentityCatalog catalog = pkg.getCatalog();
            for (MetadataDocument doc : loaded.values()) {
                if (failed.contains(doc.getOid())) {
                    continue;
                }
                String partName = partOf(doc.getOid());
                String relsPart = ContainerLayout.relationshipsPartFor(partName);

                Set<String> expectedDestinations = new LinkedHashSet<>();
                for (Oid target : doc.referencedOids()) {
                    if (!target.equals(doc.getOid())) {
                        catalog.find(target).ifPresent(t -> expectedDestinations.add(t.getPartName()));
                    }
                }
                Set<String> expectedArrays = new LinkedHashSet<>();
                doc.getArrays().values().forEach(h -> expectedArrays.add(h.getPath()));

                Relationships rels;
                try {
                    rels = reader.contains(relsPart)
                            ? Relationships.decode(new ByteArrayInputStream(reader.read(relsPart)), partName,
                                    relsPart)
                            : new Relationships(partName);
                } catch (ResqException e) {
                    diagnose(partName, doc.getOid(), e);
                    continue;
                }

                Set<String> destinations = rels.targets(Relationship.DESTINATION_OBJECT);
                Set<String> arrays = rels.targets(Relationship.EXTERNAL_RESOURCE);
                if (!sameIgnoringCase(destinations, expectedDestinations) || !arrays.equals(expectedArrays)) {
                    diagnose(partName, doc.getOid(), new CorruptionException(partName, "Relationships of "
                            + partName + " disagree with its document: rels name " + destinations + " and " + arrays
                            + ", document references " + expectedDestinations + " and " + expectedArrays));
                    continue;
                }
                for (String sourcePart : rels.targets(Relationship.SOURCE_OBJECT)) {
                    Optional<Oid> sourceOid = catalog.findByPartName(sourcePart);
                    if (sourceOid.isPresent() && loaded.containsKey(sourceOid.get())
                            && !loaded.get(sourceOid.get()).referencedOids().contains(doc.getOid())) {
                        diagnose(partName, doc.getOid(), new CorruptionException(partName, "Relationships of "
                                + partName + " name " + sourcePart + " as source, but it does not reference "
                                + partName));
                        break;
                    }
                }
            }
        }

        private static boolean sameIgnoringCase(Collection<String> a, Collection<String> b) {
            Map<String, Integer> counts = new HashMap<>();
            a.forEach(s -> counts.merge(s.toLowerCase(Locale.ROOT), 1, Integer::sum));
            b.forEach(s -> counts.merge(s.toLowerCase(Locale.ROOT), -1, Integer::sum));
            return counts.values().stream().allMatch(c -> c == 0);
        }

        private String partOf(Oid oid) {
            return pkg.getCatalog().find(oid).map(CatalogEntry::getPartName).orElse(oid.toString());
        }

        private void diagnose(String partName, Oid oid, ResqException error) {
            log.warn("{}: {}", partName, error.getMessage());
            diagnostics.add(new PartDiagnostic(partName, oid, error));
            if (oid != null) {
                failed.add(oid);
            }
        }
    }
}
