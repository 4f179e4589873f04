package resqpack.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import resqpack.core.PackageOptions;
import resqpack.core.arrays.ArrayData;
import resqpack.core.arrays.ArrayHandle;
import resqpack.core.arrays.ArrayStore;
import resqpack.core.identity.CatalogEntry;
import resqpack.core.identity.Citation;
import resqpack.core.identity.IdentityCatalog;
import resqpack.core.identity.Oid;
import resqpack.core.identity.RemovalReport;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.objects.ObjectKind;
import resqpack.core.objects.ObjectKindRegistry;
import resqpack.core.objects.ResqObject;
import resqpack.core.packaging.LoadReport;
import resqpack.core.packaging.PackageManager;
import resqpack.core.packaging.PartDraft;
import resqpack.core.packaging.ResqPackage;
import resqpack.exceptions.NotFoundException;
import resqpack.exceptions.ResqException;

/**
 * Typed object API over one package. Domain code creates, reads and changes
 * objects here and reaches array payloads through {@link #getArray} or
 * {@link #arrays()}; it never touches the catalog or stores directly.
 *
 * <pre>
 * Model model = Model.create();
 * Oid grid = model.add(IjkGridRepresentation.draft("grid", 4, 3, 2, null));
 * Oid prop = model.add(ContinuousProperty.draft("NETGRS", grid, "m3/m3"),
 *         Map.of("Values", ArrayData.ofDoubles(new int[] { 2, 3, 4 }, values)));
 * model.save(path);
 * </pre>
 */
public final class Model {
    private static final Logger log = LoggerFactory.getLogger(Model.class);

    private final PackageManager manager;
    private final ObjectKindRegistry kinds;

    private Model(PackageManager manager, ObjectKindRegistry kinds) {
        this.manager = manager;
        this.kinds = kinds;
    }

    public static Model create() {
        return create(PackageOptions.defaults(), ObjectKindRegistry.loadDefault());
    }

    public static Model create(PackageOptions options, ObjectKindRegistry kinds) {
        return new Model(PackageManager.create(options, kinds), kinds);
    }

    public static Model load(Path path) throws ResqException {
        return load(path, PackageOptions.defaults(), ObjectKindRegistry.loadDefault());
    }

    /**
     * Opens a container. Parts that failed their checks are listed in
     * {@link #getLoadReport()}.
     */
    public static Model load(Path path, PackageOptions options, ObjectKindRegistry kinds) throws ResqException {
        return new Model(PackageManager.open(path, options, kinds), kinds);
    }

    public LoadReport getLoadReport() {
        return manager.getLoadReport();
    }

    public PackageManager getManager() {
        return manager;
    }

    public ObjectKindRegistry getKinds() {
        return kinds;
    }

    private ResqPackage pkg() {
        return manager.getPackage();
    }

    /**
     * Creates an object of {@code type} from plain field values. Values may be
     * strings, numbers, booleans, instants, OIDs (single references) or lists
     * of OIDs.
     */
    public Oid create(String type, String title, Map<String, ?> fields) throws ResqException {
        MetadataDocument doc = new MetadataDocument(type, Citation.of(title));
        for (Map.Entry<String, ?> field : fields.entrySet()) {
            assign(doc, field.getKey(), field.getValue());
        }
        return add(doc);
    }

    public Oid add(MetadataDocument draft) throws ResqException {
        return add(draft, Collections.emptyMap());
    }

    public Oid add(MetadataDocument draft, Map<String, ArrayData> arrays) throws ResqException {
        return manager.addPart(draft, arrays);
    }

    /**
     * Adds {@code draft} unless an equivalent object exists already, in which
     * case that object's OID is returned. Equivalent means same type, title,
     * fields, extra metadata, references and array contents.
     */
    public Oid addOrReuse(MetadataDocument draft, Map<String, ArrayData> arrays) throws ResqException {
        Optional<Oid> existing = findEquivalent(draft, arrays);
        if (existing.isPresent()) {
            log.debug("Reusing {} for {} '{}'", existing.get(), draft.getType(), draft.getTitle());
            return existing.get();
        }
        return add(draft, arrays);
    }

    public ResqObject get(Oid oid) throws NotFoundException {
        return kinds.wrap(manager.getPackage().getMetadata().get(oid));
    }

    /**
     * @throws IllegalArgumentException if the object is not of the kind
     *                                  wrapped by {@code type}
     */
    public <T extends ResqObject> T get(Oid oid, Class<T> type) throws NotFoundException {
        ObjectKind<T> kind = kinds.find(type)
                .orElseThrow(() -> new IllegalArgumentException("No object kind for " + type.getName()));
        MetadataDocument doc = pkg().getMetadata().get(oid);
        if (!doc.getType().equals(kind.getType())) {
            throw new IllegalArgumentException("Object " + oid + " is " + doc.getType() + ", not " + kind.getType());
        }
        return kind.wrap(doc);
    }

    /**
     * Working copy of the object's document.
     */
    public MetadataDocument document(Oid oid) throws NotFoundException {
        return pkg().getMetadata().get(oid);
    }

    public void update(MetadataDocument doc) throws ResqException {
        manager.updatePart(doc, doc.getRevision());
    }

    /**
     * Sets one field; {@code null} removes it.
     *
     * @see #create(String, String, Map)
     */
    public void setField(Oid oid, String name, Object value) throws ResqException {
        MetadataDocument doc = document(oid);
        assign(doc, name, value);
        update(doc);
    }

    public void setTitle(Oid oid, String title) throws ResqException {
        MetadataDocument doc = document(oid);
        doc.setCitation(doc.getCitation().withTitle(title).touched(Instant.now()));
        update(doc);
    }

    public ArrayHandle arrayHandle(Oid oid, String field) throws NotFoundException {
        ArrayHandle handle = document(oid).getArray(field);
        if (handle == null) {
            throw new NotFoundException(oid + "." + field, "Object " + oid + " has no array field " + field);
        }
        return handle;
    }

    /**
     * Reads a whole array field, materializing the payload if needed.
     */
    public ArrayData getArray(Oid oid, String field) throws ResqException {
        return arrays().read(arrayHandle(oid, field));
    }

    public ArrayHandle setArray(Oid oid, String field, ArrayData data) throws ResqException {
        return manager.setArray(oid, field, data);
    }

    /**
     * Array store of the package, for sliced, chunked and asynchronous reads.
     */
    public ArrayStore arrays() {
        return pkg().getArrays();
    }

    public RemovalReport remove(Oid oid, boolean cascade) throws ResqException {
        return manager.removePart(oid, cascade);
    }

    public void rename(Oid oid, String partName) throws ResqException {
        manager.renamePart(oid, partName);
    }

    public void save(Path path) throws ResqException {
        manager.save(path);
    }

    public void save() throws ResqException {
        manager.save();
    }

    public int size() {
        return pkg().read(() -> pkg().getCatalog().size());
    }

    public Optional<String> partName(Oid oid) {
        return pkg().read(() -> pkg().getCatalog().find(oid).map(CatalogEntry::getPartName));
    }

    public Optional<Oid> oidForPart(String partName) {
        return pkg().read(() -> pkg().getCatalog().findByPartName(partName));
    }

    /**
     * Part names, sorted, of objects matching {@code type} and {@code title};
     * a null criterion matches everything. Titles compare ignoring case.
     */
    public List<String> parts(String type, String title, TitleMode mode) {
        return parts(type, title, mode, false);
    }

    public List<String> parts(String type, String title, TitleMode mode, boolean caseSensitive) {
        return entries(type, title, mode, caseSensitive).stream()
                .map(CatalogEntry::getPartName)
                .sorted()
                .collect(Collectors.toList());
    }

    public List<String> parts(String type) {
        return parts(type, null, TitleMode.EQUALS);
    }

    public List<Oid> oids(String type) {
        return oids(type, null, TitleMode.EQUALS);
    }

    public List<Oid> oids(String type, String title, TitleMode mode) {
        return entries(type, title, mode, false).stream()
                .map(CatalogEntry::getOid)
                .collect(Collectors.toList());
    }

    /**
     * The single object of {@code type} titled {@code title}, if any.
     *
     * @throws IllegalStateException if more than one object matches
     */
    public Optional<Oid> oid(String type, String title) {
        List<Oid> matches = oids(type, title, TitleMode.EQUALS);
        if (matches.size() > 1) {
            throw new IllegalStateException(matches.size() + " objects of type " + type + " are titled '" + title
                    + "': " + matches);
        }
        return matches.stream().findFirst();
    }

    public List<String> titles(String type) {
        return entries(type, null, TitleMode.EQUALS, false).stream()
                .map(CatalogEntry::getTitle)
                .collect(Collectors.toList());
    }

    private List<CatalogEntry> entries(String type, String title, TitleMode mode, boolean caseSensitive) {
        List<CatalogEntry> all = pkg().read(() -> pkg().getCatalog().entries());
        List<CatalogEntry> result = new ArrayList<>();
        for (CatalogEntry entry : all) {
            if (type != null && !type.equals(entry.getType())) {
                continue;
            }
            if (title != null && !mode.matches(entry.getTitle(), title, caseSensitive)) {
                continue;
            }
            result.add(entry);
        }
        return result;
    }

    /**
     * Every object of the kind wrapped by {@code type}, in registration order.
     */
    public <T extends ResqObject> Stream<T> objects(Class<T> type) {
        ObjectKind<T> kind = kinds.find(type)
                .orElseThrow(() -> new IllegalArgumentException("No object kind for " + type.getName()));
        List<T> result = new ArrayList<>();
        for (Oid oid : oids(kind.getType())) {
            pkg().getMetadata().find(oid).ifPresent(doc -> result.add(kind.wrap(doc)));
        }
        return result.stream();
    }

    /**
     * Reference graph of the package, or of {@code subset} when not null.
     * Edges leaving the subset are dropped.
     */
    public ObjectGraph asGraph(Collection<Oid> subset) {
        return pkg().read(() -> {
            IdentityCatalog catalog = pkg().getCatalog();
            Set<Oid> included = subset == null ? new LinkedHashSet<>(catalog.oids()) : new LinkedHashSet<>(subset);
            Map<Oid, ObjectGraph.Node> nodes = new LinkedHashMap<>();
            Set<ObjectGraph.Edge> edges = new LinkedHashSet<>();
            for (Oid oid : included) {
                Optional<CatalogEntry> entry = catalog.find(oid);
                if (entry.isEmpty()) {
                    continue;
                }
                nodes.put(oid, new ObjectGraph.Node(oid, entry.get().getType(), entry.get().getTitle()));
                for (Oid target : entry.get().getReferences()) {
                    if (!target.equals(oid) && included.contains(target) && catalog.contains(target)) {
                        edges.add(new ObjectGraph.Edge(oid, target));
                    }
                }
            }
            return new ObjectGraph(nodes, edges);
        });
    }

    /**
     * Copies every object of {@code other} into this model, keeping OIDs.
     * Objects whose OID is already present are skipped. With
     * {@code consolidate}, an object equivalent to one already here is not
     * copied and references to it are redirected to the existing one. The
     * copied objects are added together, so either all of them arrive or none.
     *
     * @return for every object of {@code other}, the OID it has here
     */
    public Map<Oid, Oid> copyAllPartsFrom(Model other, boolean consolidate) throws ResqException {
        Map<Oid, Oid> mapping = new LinkedHashMap<>();
        List<PartDraft> drafts = new ArrayList<>();
        for (Oid source : other.referenceOrder()) {
            if (pkg().getCatalog().contains(source)) {
                mapping.put(source, source);
                continue;
            }
            MetadataDocument doc = other.document(source);
            redirect(doc, mapping);
            Map<String, ArrayData> arrays = new LinkedHashMap<>();
            for (Map.Entry<String, ArrayHandle> field : doc.getArrays().entrySet()) {
                arrays.put(field.getKey(), other.arrays().read(field.getValue()));
            }
            arrays.keySet().forEach(name -> doc.setArray(name, null));

            if (consolidate) {
                Optional<Oid> equivalent = findEquivalent(doc, arrays);
                if (equivalent.isPresent()) {
                    mapping.put(source, equivalent.get());
                    continue;
                }
            }
            mapping.put(source, source);
            drafts.add(new PartDraft(doc, arrays));
        }
        // within a reference cycle an object is visited before some of its targets
        for (PartDraft draft : drafts) {
            redirect(draft.getDocument(), mapping);
        }
        manager.addParts(drafts);
        log.info("Copied {} of {} object(s)", drafts.size(), mapping.size());
        return mapping;
    }

    private static void redirect(MetadataDocument doc, Map<Oid, Oid> mapping) {
        for (Map.Entry<Oid, Oid> remap : mapping.entrySet()) {
            if (!remap.getKey().equals(remap.getValue())) {
                doc.remapReference(remap.getKey(), remap.getValue());
            }
        }
    }

    /**
     * OIDs ordered so that referenced objects come before the objects
     * referencing them, where the references allow it.
     */
    private List<Oid> referenceOrder() {
        return pkg().read(() -> {
            IdentityCatalog catalog = pkg().getCatalog();
            List<Oid> order = new ArrayList<>();
            Set<Oid> visited = new HashSet<>();
            for (Oid oid : catalog.oids()) {
                visit(catalog, oid, visited, order);
            }
            return order;
        });
    }

    private static void visit(IdentityCatalog catalog, Oid oid, Set<Oid> visited, List<Oid> order) {
        if (!visited.add(oid)) {
            return;
        }
        Optional<CatalogEntry> entry = catalog.find(oid);
        if (entry.isEmpty()) {
            return;
        }
        for (Oid target : entry.get().getReferences()) {
            visit(catalog, target, visited, order);
        }
        order.add(oid);
    }

    private Optional<Oid> findEquivalent(MetadataDocument draft, Map<String, ArrayData> arrays)
            throws ResqException {
        for (Oid candidate : oids(draft.getType(), draft.getTitle(), TitleMode.EQUALS)) {
            MetadataDocument existing = document(candidate);
            if (equivalent(draft, arrays, existing)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private boolean equivalent(MetadataDocument draft, Map<String, ArrayData> arrays, MetadataDocument existing)
            throws ResqException {
        if (!draft.sameDescriptionAs(existing)) {
            return false;
        }
        Set<String> draftArrays = new HashSet<>(draft.getArrays().keySet());
        draftArrays.addAll(arrays.keySet());
        if (!draftArrays.equals(existing.getArrays().keySet())) {
            return false;
        }
        for (String name : draftArrays) {
            ArrayHandle theirs = existing.getArray(name);
            ArrayData data = arrays.get(name);
            if (data == null) {
                ArrayHandle ours = draft.getArray(name);
                if (!ours.getPath().equals(theirs.getPath())) {
                    return false;
                }
                continue;
            }
            if (!theirs.hasShape(data.getShape()) || theirs.getElementType() != data.getElementType()) {
                return false;
            }
            if (!arrays().read(theirs).equals(data)) {
                return false;
            }
        }
        return true;
    }

    private static void assign(MetadataDocument doc, String name, Object value) {
        if (value == null) {
            doc.removeField(name);
        } else if (value instanceof Oid) {
            doc.setReference(name, (Oid) value);
        } else if (value instanceof List) {
            List<Oid> targets = new ArrayList<>();
            for (Object item : (List<?>) value) {
                if (!(item instanceof Oid)) {
                    throw new IllegalArgumentException("Field " + name + " list holds " + item + ", expected OIDs");
                }
                targets.add((Oid) item);
            }
            doc.setReferences(name, targets);
        } else if (value instanceof ArrayHandle) {
            doc.setArray(name, (ArrayHandle) value);
        } else if (value instanceof Double || value instanceof Float) {
            doc.setField(name, ((Number) value).doubleValue());
        } else if (value instanceof Number) {
            doc.setField(name, ((Number) value).longValue());
        } else if (value instanceof Boolean) {
            doc.setField(name, (Boolean) value);
        } else if (value instanceof Instant) {
            doc.setField(name, value.toString());
        } else if (value instanceof String) {
            doc.setField(name, (String) value);
        } else {
            throw new IllegalArgumentException("Unsupported value for field " + name + ": "
                    + value.getClass().getName());
        }
    }
}
