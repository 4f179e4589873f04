package resqpack.core.metadata;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.arrays.ArrayStore;
import resqpack.core.identity.CatalogEntry;
import resqpack.core.identity.Citation;
import resqpack.core.identity.IdentityCatalog;
import resqpack.core.identity.Oid;
import resqpack.exceptions.ConcurrentUpdateException;
import resqpack.exceptions.DanglingReferenceException;
import resqpack.exceptions.NotFoundException;
import resqpack.exceptions.ResqException;
import resqpack.exceptions.ShapeMismatchException;
import resqpack.exceptions.ValidationException;

/**
 * Holds the current metadata document of every object and keeps the
 * catalog's reference sets in step with them.
 *
 * A {@link #put} either replaces the stored document and the catalog's
 * references together or changes nothing. Both happen under the package write
 * lock, which is reentrant, so a put inside a wider transaction scope joins
 * that scope.
 */
public final class MetadataStore {
    private static final Logger log = LoggerFactory.getLogger(MetadataStore.class);

    /**
     * Expected revision that matches whatever is stored.
     */
    public static final long ANY_REVISION = -1;

    private final IdentityCatalog catalog;
    private final ArrayStore arrays;
    private final SchemaLookup schemas;
    private final ReadWriteLock lock;
    private final boolean strictTypes;
    private final Map<Oid, MetadataDocument> documents = new ConcurrentHashMap<>();

    public MetadataStore(IdentityCatalog catalog, ArrayStore arrays, SchemaLookup schemas, ReadWriteLock lock,
            boolean strictTypes) {
        this.catalog = catalog;
        this.arrays = arrays;
        this.schemas = schemas;
        this.lock = lock;
        this.strictTypes = strictTypes;
    }

    public void put(MetadataDocument doc) throws ResqException {
        put(doc, ANY_REVISION);
    }

    /**
     * Validates and stores {@code doc}, replacing the previous document of the
     * same OID.
     *
     * @param expectedRevision revision the caller read, or {@link #ANY_REVISION}
     * @throws ConcurrentUpdateException if the stored revision moved on since
     *                                   the caller read it
     */
    public void put(MetadataDocument doc, long expectedRevision) throws ResqException {
        Oid oid = doc.getOid();
        if (oid == null) {
            throw new IllegalArgumentException("Document has no OID; register it first");
        }
        lock.writeLock().lock();
        try {
            CatalogEntry entry = catalog.resolve(oid);
            if (!entry.getType().equals(doc.getType())) {
                throw new ValidationException(new ValidationError(ValidationError.Kind.INVALID_VALUE,
                        oid.toString(), entry.getPartName(), null,
                        "Type " + doc.getType() + " differs from registered type " + entry.getType()));
            }

            MetadataDocument current = documents.get(oid);
            long currentRevision = current == null ? 0 : current.getRevision();
            if (expectedRevision != ANY_REVISION && expectedRevision != currentRevision) {
                throw new ConcurrentUpdateException(oid.toString(), "Document " + describe(entry)
                        + " changed concurrently: read revision " + expectedRevision + ", now " + currentRevision);
            }

            List<ValidationError> errors = validate(doc);
            if (!errors.isEmpty()) {
                throw failureFor(errors);
            }

            catalog.updateReferences(oid, doc.referencedOids());
            catalog.setCitation(oid, doc.getCitation());

            MetadataDocument stored = doc.copy();
            stored.setRevision(currentRevision + 1);
            documents.put(oid, stored);
            doc.setRevision(currentRevision + 1);
            log.debug("Stored {} revision {}", describe(entry), currentRevision + 1);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores a document read from a container as is. The catalog entry must
     * already exist; nothing is validated here.
     */
    public void putLoaded(MetadataDocument doc) {
        MetadataDocument stored = doc.copy();
        stored.setRevision(1);
        documents.put(doc.getOid(), stored);
    }

    /**
     * Puts back a document captured earlier, including its revision.
     */
    public void restore(MetadataDocument doc) {
        documents.put(doc.getOid(), doc.copy());
    }

    public MetadataDocument get(Oid oid) throws NotFoundException {
        return find(oid).orElseThrow(() -> new NotFoundException(String.valueOf(oid), "No document for OID " + oid));
    }

    public Optional<MetadataDocument> find(Oid oid) {
        lock.readLock().lock();
        try {
            MetadataDocument doc = documents.get(oid);
            return doc == null ? Optional.empty() : Optional.of(doc.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(Oid oid) {
        return documents.containsKey(oid);
    }

    /**
     * Revision of the stored document, zero if none.
     */
    public long revision(Oid oid) {
        MetadataDocument doc = documents.get(oid);
        return doc == null ? 0 : doc.getRevision();
    }

    public Optional<MetadataDocument> remove(Oid oid) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(documents.remove(oid));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        return documents.size();
    }

    /**
     * Checks {@code doc} against its schema, the catalog and the array store
     * without changing anything.
     */
    public List<ValidationError> validate(MetadataDocument doc) {
        lock.readLock().lock();
        try {
            return validateLocked(doc);
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<ValidationError> validateLocked(MetadataDocument doc) {
        List<ValidationError> errors = new ArrayList<>();
        String oid = doc.getOid() != null ? doc.getOid().toString() : null;
        String partName = doc.getOid() == null ? null
                : catalog.find(doc.getOid()).map(CatalogEntry::getPartName).orElse(null);

        Optional<DocumentSchema> schema = schemas.schemaFor(doc.getType());
        if (schema.isPresent()) {
            errors.addAll(schema.get().validate(doc));
        } else if (strictTypes) {
            errors.add(new ValidationError(ValidationError.Kind.UNKNOWN_TYPE, oid, partName, null,
                    "No schema registered for type " + doc.getType()));
        }
        checkRepresentable(doc, oid, partName, errors);

        for (Map.Entry<String, List<Oid>> field : doc.getReferences().entrySet()) {
            Optional<FieldSpec> spec = schema.flatMap(s -> s.field(field.getKey()));
            List<Oid> targets = field.getValue();
            for (int i = 0; i < targets.size(); i++) {
                Oid target = targets.get(i);
                String path = targets.size() > 1 ? field.getKey() + "[" + i + "]" : field.getKey();
                if (target.equals(doc.getOid())) {
                    continue;
                }
                Optional<CatalogEntry> resolved = catalog.find(target);
                if (resolved.isEmpty()) {
                    errors.add(new ValidationError(ValidationError.Kind.DANGLING_REFERENCE, oid, partName, path,
                            "References unknown OID " + target, target.toString()));
                } else if (spec.isPresent() && !spec.get().getTargetTypes().isEmpty()
                        && !spec.get().getTargetTypes().contains(resolved.get().getType())) {
                    errors.add(new ValidationError(ValidationError.Kind.WRONG_REFERENCE_TYPE, oid, partName, path,
                            "Target " + target + " is " + resolved.get().getType() + ", expected one of "
                                    + spec.get().getTargetTypes()));
                }
            }
            if (spec.isPresent() && spec.get().isAcyclic() && doc.getOid() != null
                    && reaches(targets, field.getKey(), doc.getOid())) {
                errors.add(new ValidationError(ValidationError.Kind.REFERENCE_CYCLE, oid, partName, field.getKey(),
                        "Following " + field.getKey() + " leads back to this object"));
            }
        }

        for (Map.Entry<String, ArrayHandle> field : doc.getArrays().entrySet()) {
            ArrayHandle declared = field.getValue();
            if (!arrays.contains(declared.getPath())) {
                errors.add(new ValidationError(ValidationError.Kind.ARRAY_MISMATCH, oid, partName, field.getKey(),
                        "No array store entry at " + declared.getPath()));
                continue;
            }
            try {
                ArrayHandle stored = arrays.handle(declared.getPath());
                if (!stored.hasShape(declared.getShape()) || stored.getElementType() != declared.getElementType()) {
                    errors.add(new ValidationError(ValidationError.Kind.ARRAY_MISMATCH, oid, partName,
                            field.getKey(), "Declared " + declared + " but store holds " + stored));
                }
            } catch (NotFoundException e) {
                errors.add(new ValidationError(ValidationError.Kind.ARRAY_MISMATCH, oid, partName, field.getKey(),
                        e.getMessage()));
            }
        }

        if (partName != null) {
            List<ValidationError> localized = new ArrayList<>(errors.size());
            for (ValidationError error : errors) {
                localized.add(error.getPartName() == null ? error.withPartName(partName) : error);
            }
            return localized;
        }
        return errors;
    }

    /**
     * Field names must be usable as element names and text must be legal XML
     * 1.0 content, or the saved part could not be read back. Array fields must
     * also map to entry paths that differ ignoring case.
     */
    private static void checkRepresentable(MetadataDocument doc, String oid, String partName,
            List<ValidationError> errors) {
        Set<String> names = new LinkedHashSet<>(doc.getFields().keySet());
        names.addAll(doc.getReferences().keySet());
        names.addAll(doc.getArrays().keySet());
        for (String name : names) {
            if (!XmlText.isElementName(name)) {
                errors.add(new ValidationError(ValidationError.Kind.INVALID_VALUE, oid, partName, name,
                        "Field name '" + name + "' is not a valid XML element name"));
            } else if (XmlText.RESERVED_NAMES.contains(name)) {
                errors.add(new ValidationError(ValidationError.Kind.INVALID_VALUE, oid, partName, name,
                        "Field name " + name + " is reserved"));
            }
        }

        Citation citation = doc.getCitation();
        checkText(citation.getTitle(), "Citation.Title", oid, partName, errors);
        checkText(citation.getOriginator(), "Citation.Originator", oid, partName, errors);
        checkText(citation.getFormat(), "Citation.Format", oid, partName, errors);
        checkText(citation.getDescription(), "Citation.Description", oid, partName, errors);
        checkText(citation.getVersionString(), "Citation.VersionString", oid, partName, errors);
        for (Map.Entry<String, String> entry : doc.getExtraMetadata().entrySet()) {
            checkText(entry.getKey(), "ExtraMetadata.Name", oid, partName, errors);
            checkText(entry.getValue(), "ExtraMetadata." + entry.getKey(), oid, partName, errors);
        }
        for (Map.Entry<String, String> field : doc.getFields().entrySet()) {
            checkText(field.getValue(), field.getKey(), oid, partName, errors);
        }

        Map<String, String> arrayPaths = new HashMap<>();
        for (Map.Entry<String, ArrayHandle> field : doc.getArrays().entrySet()) {
            String key = field.getValue().getPath().toLowerCase(Locale.ROOT);
            String other = arrayPaths.putIfAbsent(key, field.getKey());
            if (other != null) {
                errors.add(new ValidationError(ValidationError.Kind.INVALID_VALUE, oid, partName, field.getKey(),
                        "Array path " + field.getValue().getPath() + " clashes with the path of field " + other
                                + " ignoring case"));
            }
        }
    }

    private static void checkText(String text, String path, String oid, String partName,
            List<ValidationError> errors) {
        if (text == null) {
            return;
        }
        int at = XmlText.firstIllegalChar(text);
        if (at >= 0) {
            errors.add(new ValidationError(ValidationError.Kind.INVALID_VALUE, oid, partName, path,
                    String.format("Character U+%04X at index %d cannot be stored in XML", (int) text.charAt(at), at)));
        }
    }

    /**
     * Whether following {@code field} from {@code starts} through stored
     * documents arrives at {@code origin}.
     */
    private boolean reaches(List<Oid> starts, String field, Oid origin) {
        Deque<Oid> pending = new ArrayDeque<>(starts);
        Set<Oid> seen = new HashSet<>();
        while (!pending.isEmpty()) {
            Oid next = pending.pop();
            if (next.equals(origin)) {
                return true;
            }
            if (!seen.add(next)) {
                continue;
            }
            MetadataDocument doc = documents.get(next);
            if (doc != null) {
                pending.addAll(doc.getReferences(field));
            }
        }
        return false;
    }

    /**
     * Maps collected validation errors to the most specific exception: dangling
     * references first, then array mismatches, otherwise a plain validation
     * failure carrying every error.
     */
    public static ResqException failureFor(List<ValidationError> errors) {
        for (ValidationError error : errors) {
            if (error.getKind() == ValidationError.Kind.DANGLING_REFERENCE) {
                String missing = error.getSubject();
                List<String> parts = error.getPartName() != null ? List.of(error.getPartName()) : List.of();
                DanglingReferenceException e = new DanglingReferenceException(missing, parts, error.toString());
                return withOthers(e, errors, error);
            }
        }
        for (ValidationError error : errors) {
            if (error.getKind() == ValidationError.Kind.ARRAY_MISMATCH) {
                ShapeMismatchException e = new ShapeMismatchException(error.getFieldPath(), error.toString());
                return withOthers(e, errors, error);
            }
        }
        return new ValidationException(errors);
    }

    private static ResqException withOthers(ResqException primary, List<ValidationError> errors,
            ValidationError used) {
        List<ValidationError> rest = new ArrayList<>(errors);
        rest.remove(used);
        if (!rest.isEmpty()) {
            primary.addSuppressed(new ValidationException(rest));
        }
        return primary;
    }

    private static String describe(CatalogEntry entry) {
        return entry.getPartName() != null ? entry.getPartName() : entry.getType() + " " + entry.getOid();
    }
}
