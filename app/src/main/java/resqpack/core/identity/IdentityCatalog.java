package resqpack.core.identity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import resqpack.exceptions.CorruptionException;
import resqpack.exceptions.DanglingReferenceException;
import resqpack.exceptions.NotFoundException;

// @formatter:off
/**
 * Identity catalog: the single source of truth for which objects exist.
 *
 * Each live object has one record keyed by its OID holding its type tag, part
 * name, citation and the OIDs it references. The reverse direction is kept in
 * a separate adjacency map so that removal checks never walk every record:
 *
 * ┌─ records ──────────────────────┐   ┌─ referencedBy ─────────────┐
 * │ A → {type, part, refs: []}     │   │ A → {B}                    │
 * │ B → {type, part, refs: [A]}    │   │                            │
 * └────────────────────────────────┘   └────────────────────────────┘
 *
 * Part names are unique ignoring case, as the packaging conventions require.
 *
 * The catalog does no locking of its own. Mutations happen inside a package
 * transaction scope, which holds the package write lock.
 */
// @formatter:on
public final class IdentityCatalog {
    private static final Logger log = LoggerFactory.getLogger(IdentityCatalog.class);

    private static final int MAX_GENERATION_ATTEMPTS = 8;

    private final Map<Oid, Record> records = new LinkedHashMap<>();
    private final Map<Oid, Set<Oid>> referencedBy = new LinkedHashMap<>();
    private final Map<String, Oid> partIndex = new LinkedHashMap<>();
    private final Supplier<Oid> generator;

    public IdentityCatalog() {
        this(Oid::random);
    }

    IdentityCatalog(Supplier<Oid> generator) {
        this.generator = generator;
    }

    /**
     * Registers a new object with a freshly generated OID. Every initial
     * reference must already resolve.
     */
    public Oid register(String type, Collection<Oid> initialReferences) throws DanglingReferenceException {
        requireType(type);
        Set<Oid> refs = new LinkedHashSet<>(initialReferences);
        requireResolvable(null, refs);

        Oid oid = generator.get();
        int attempts = 1;
        while (records.containsKey(oid)) {
            if (attempts++ >= MAX_GENERATION_ATTEMPTS) {
                throw new IllegalStateException("OID generator keeps producing live identifiers");
            }
            log.warn("OID collision on {}, regenerating", oid);
            oid = generator.get();
        }

        insert(new Record(oid, type, null, null, refs));
        log.debug("Registered {} {}", type, oid);
        return oid;
    }

    /**
     * Registers an object whose OID already exists, as when reading a container.
     * References are not checked here since their targets may be registered
     * later; see {@link #danglingReferences()}.
     */
    public void registerExisting(Oid oid, String type, String partName, Citation citation, Collection<Oid> references)
            throws CorruptionException {
        requireType(type);
        if (records.containsKey(oid)) {
            throw new CorruptionException(partName,
                    "Duplicate OID " + oid + " in part " + partName + ", already used by part "
                            + records.get(oid).partName);
        }
        if (partName != null && partIndex.containsKey(key(partName))) {
            throw new CorruptionException(partName, "Duplicate part name: " + partName);
        }
        insert(new Record(oid, type, partName, citation, new LinkedHashSet<>(references)));
    }

    public boolean contains(Oid oid) {
        return records.containsKey(oid);
    }

    public Optional<CatalogEntry> find(Oid oid) {
        Record record = records.get(oid);
        return record == null ? Optional.empty() : Optional.of(snapshot(record));
    }

    public CatalogEntry resolve(Oid oid) throws NotFoundException {
        Record record = records.get(oid);
        if (record == null) {
            throw new NotFoundException(String.valueOf(oid), "No object with OID " + oid);
        }
        return snapshot(record);
    }

    public Optional<Oid> findByPartName(String partName) {
        return Optional.ofNullable(partIndex.get(key(partName)));
    }

    /**
     * OIDs of live objects whose references include {@code oid}.
     */
    public Set<Oid> referencing(Oid oid) {
        Set<Oid> sources = referencedBy.get(oid);
        if (sources == null) {
            return Collections.emptySet();
        }
        Set<Oid> live = new LinkedHashSet<>();
        for (Oid source : sources) {
            if (records.containsKey(source)) {
                live.add(source);
            }
        }
        return Collections.unmodifiableSet(live);
    }

    /**
     * Live OIDs in registration order.
     */
    public List<Oid> oids() {
        return List.copyOf(records.keySet());
    }

    public List<CatalogEntry> entries() {
        List<CatalogEntry> result = new ArrayList<>(records.size());
        for (Record record : records.values()) {
            result.add(snapshot(record));
        }
        return result;
    }

    public int size() {
        return records.size();
    }

    public void setPartName(Oid oid, String partName) throws NotFoundException, CorruptionException {
        Record record = require(oid);
        Oid holder = partIndex.get(key(partName));
        if (holder != null && !holder.equals(oid)) {
            throw new CorruptionException(partName, "Part name " + partName + " is already used by " + holder);
        }
        if (record.partName != null) {
            partIndex.remove(key(record.partName));
        }
        record.partName = partName;
        partIndex.put(key(partName), oid);
    }

    public void setCitation(Oid oid, Citation citation) throws NotFoundException {
        require(oid).citation = citation;
    }

    /**
     * Replaces the reference set of an object. Every target must resolve; on
     * failure nothing changes.
     */
    public void updateReferences(Oid oid, Collection<Oid> references)
            throws NotFoundException, DanglingReferenceException {
        Record record = require(oid);
        Set<Oid> refs = new LinkedHashSet<>(references);
        requireResolvable(record, refs);

        for (Oid old : record.references) {
            Set<Oid> sources = referencedBy.get(old);
            if (sources != null) {
                sources.remove(oid);
            }
        }
        record.references = refs;
        for (Oid target : refs) {
            referencedBy.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(oid);
        }
        // references were repaired so the record is consistent again
        if (record.invalidReason != null && danglingFrom(record).isEmpty()) {
            record.invalidReason = null;
        }
    }

    /**
     * Removes an object.
     *
     * @param cascade when false the removal fails if any live object still
     *                references {@code oid}; when true those objects are marked
     *                invalid and listed in the returned report
     */
    public RemovalReport remove(Oid oid, boolean cascade) throws NotFoundException, DanglingReferenceException {
        Record record = require(oid);
        Set<Oid> sources = referencing(oid);
        Set<Oid> others = new LinkedHashSet<>(sources);
        others.remove(oid);

        if (!others.isEmpty() && !cascade) {
            List<String> parts = partNames(others);
            throw new DanglingReferenceException(oid.toString(), parts,
                    "Cannot remove " + describe(record) + ": still referenced by " + parts);
        }

        List<CatalogEntry> invalidated = new ArrayList<>();
        for (Oid source : others) {
            Record referencing = records.get(source);
            referencing.invalidReason = "references removed object " + oid;
            invalidated.add(snapshot(referencing));
        }
        delete(record);
        if (!invalidated.isEmpty()) {
            log.warn("Removed {} with cascade; {} referencing object(s) invalidated", oid, invalidated.size());
        }
        return new RemovalReport(oid, record.partName, invalidated);
    }

    /**
     * Drops a record without any reference checks. Used to roll back a
     * registration that could not be completed.
     */
    public void unregister(Oid oid) {
        Record record = records.get(oid);
        if (record != null) {
            delete(record);
        }
    }

    /**
     * Puts a previously taken snapshot back in place, replacing any current
     * record for the same OID. Used to roll back removals and updates.
     */
    public void reinstate(CatalogEntry entry) {
        unregister(entry.getOid());
        Record record = new Record(entry.getOid(), entry.getType(), entry.getPartName(), entry.getCitation(),
                new LinkedHashSet<>(entry.getReferences()));
        record.invalidReason = entry.getInvalidReason();
        insert(record);
    }

    public void invalidate(Oid oid, String reason) throws NotFoundException {
        require(oid).invalidReason = reason;
    }

    /**
     * Every reference whose target is not a live object, keyed by the
     * referencing OID.
     */
    public Map<Oid, Set<Oid>> danglingReferences() {
        Map<Oid, Set<Oid>> result = new LinkedHashMap<>();
        for (Record record : records.values()) {
            Set<Oid> missing = danglingFrom(record);
            if (!missing.isEmpty()) {
                result.put(record.oid, missing);
            }
        }
        return result;
    }

    private Set<Oid> danglingFrom(Record record) {
        Set<Oid> missing = new LinkedHashSet<>();
        for (Oid target : record.references) {
            if (!records.containsKey(target)) {
                missing.add(target);
            }
        }
        return missing;
    }

    private void requireResolvable(Record source, Set<Oid> refs) throws DanglingReferenceException {
        for (Oid target : refs) {
            boolean self = source != null && source.oid.equals(target);
            if (!self && !records.containsKey(target)) {
                List<String> parts = source != null && source.partName != null
                        ? List.of(source.partName)
                        : List.of();
                throw new DanglingReferenceException(target.toString(), parts,
                        "Reference to unknown OID " + target
                                + (source != null ? " from " + describe(source) : ""));
            }
        }
    }

    private Record require(Oid oid) throws NotFoundException {
        Record record = records.get(oid);
        if (record == null) {
            throw new NotFoundException(String.valueOf(oid), "No object with OID " + oid);
        }
        return record;
    }

    private void insert(Record record) {
        records.put(record.oid, record);
        if (record.partName != null) {
            partIndex.put(key(record.partName), record.oid);
        }
        for (Oid target : record.references) {
            referencedBy.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(record.oid);
        }
    }

    private void delete(Record record) {
        records.remove(record.oid);
        if (record.partName != null) {
            partIndex.remove(key(record.partName));
        }
        for (Oid target : record.references) {
            Set<Oid> sources = referencedBy.get(target);
            if (sources != null) {
                sources.remove(record.oid);
                if (sources.isEmpty()) {
                    referencedBy.remove(target);
                }
            }
        }
    }

    private CatalogEntry snapshot(Record record) {
        return new CatalogEntry(record.oid, record.type, record.partName, record.citation, record.references,
                referencing(record.oid), record.invalidReason);
    }

    private List<String> partNames(Collection<Oid> oids) {
        List<String> names = new ArrayList<>();
        for (Oid oid : oids) {
            Record record = records.get(oid);
            names.add(record != null && record.partName != null ? record.partName : oid.toString());
        }
        return names;
    }

    private static String describe(Record record) {
        return record.partName != null ? record.partName : record.type + " " + record.oid;
    }

    private static void requireType(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Object type cannot be null or blank");
        }
    }

    private static String key(String partName) {
        return partName.toLowerCase(Locale.ROOT);
    }

    private static final class Record {
        final Oid oid;
        final String type;
        String partName;
        Citation citation;
        Set<Oid> references;
        String invalidReason;

        Record(Oid oid, String type, String partName, Citation citation, Set<Oid> references) {
            this.oid = oid;
            this.type = type;
            this.partName = partName;
            this.citation = citation;
            this.references = references;
        }
    }
}
