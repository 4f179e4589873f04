package resqpack.core.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.identity.Citation;
import resqpack.core.identity.Oid;

/**
 * Structured metadata of one object: citation, extra metadata, scalar fields
 * (kept as their lexical form), reference fields and array-handle fields.
 *
 * A document is a mutable working copy. The metadata store keeps its own
 * copy, so changes only take effect through a put.
 */
public final class MetadataDocument {
    private Oid oid;
    private final String type;
    private Citation citation;
    private long revision;
    private final Map<String, String> extraMetadata = new LinkedHashMap<>();
    private final Map<String, String> fields = new LinkedHashMap<>();
    private final Map<String, List<Oid>> references = new LinkedHashMap<>();
    private final Map<String, ArrayHandle> arrays = new LinkedHashMap<>();

    public MetadataDocument(String type, Citation citation) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Document type cannot be null or blank");
        }
        this.type = type;
        this.citation = Objects.requireNonNull(citation, "citation");
    }

    public MetadataDocument(Oid oid, String type, Citation citation) {
        this(type, citation);
        this.oid = oid;
    }

    public MetadataDocument copy() {
        MetadataDocument copy = new MetadataDocument(oid, type, citation);
        copy.revision = revision;
        copy.extraMetadata.putAll(extraMetadata);
        copy.fields.putAll(fields);
        references.forEach((name, oids) -> copy.references.put(name, new ArrayList<>(oids)));
        copy.arrays.putAll(arrays);
        return copy;
    }

    /**
     * Null for a draft that has not been added to a package yet.
     */
    public Oid getOid() {
        return oid;
    }

    public void setOid(Oid oid) {
        this.oid = oid;
    }

    public String getType() {
        return type;
    }

    public Citation getCitation() {
        return citation;
    }

    public void setCitation(Citation citation) {
        this.citation = Objects.requireNonNull(citation, "citation");
    }

    public String getTitle() {
        return citation.getTitle();
    }

    /**
     * Revision of the stored copy this document was read from; zero for a
     * document never stored.
     */
    public long getRevision() {
        return revision;
    }

    void setRevision(long revision) {
        this.revision = revision;
    }

    public Map<String, String> getExtraMetadata() {
        return Collections.unmodifiableMap(extraMetadata);
    }

    public MetadataDocument putExtraMetadata(String name, String value) {
        extraMetadata.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public MetadataDocument removeExtraMetadata(String name) {
        extraMetadata.remove(name);
        return this;
    }

    public Map<String, String> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public String getField(String name) {
        return fields.get(name);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name) || references.containsKey(name) || arrays.containsKey(name);
    }

    public MetadataDocument setField(String name, String value) {
        Objects.requireNonNull(name, "name");
        if (value == null) {
            fields.remove(name);
        } else {
            fields.put(name, value);
        }
        return this;
    }

    public MetadataDocument setField(String name, double value) {
        return setField(name, Double.toString(value));
    }

    public MetadataDocument setField(String name, long value) {
        return setField(name, Long.toString(value));
    }

    public MetadataDocument setField(String name, boolean value) {
        return setField(name, Boolean.toString(value));
    }

    public MetadataDocument removeField(String name) {
        fields.remove(name);
        references.remove(name);
        arrays.remove(name);
        return this;
    }

    public Map<String, List<Oid>> getReferences() {
        Map<String, List<Oid>> view = new LinkedHashMap<>();
        references.forEach((name, oids) -> view.put(name, Collections.unmodifiableList(oids)));
        return Collections.unmodifiableMap(view);
    }

    public List<Oid> getReferences(String name) {
        List<Oid> oids = references.get(name);
        return oids == null ? Collections.emptyList() : Collections.unmodifiableList(oids);
    }

    /**
     * The single OID of a reference field, or null when absent.
     */
    public Oid getReference(String name) {
        List<Oid> oids = references.get(name);
        return oids == null || oids.isEmpty() ? null : oids.get(0);
    }

    public MetadataDocument setReference(String name, Oid target) {
        Objects.requireNonNull(name, "name");
        if (target == null) {
            references.remove(name);
        } else {
            List<Oid> oids = new ArrayList<>();
            oids.add(target);
            references.put(name, oids);
        }
        return this;
    }

    public MetadataDocument setReferences(String name, List<Oid> targets) {
        Objects.requireNonNull(name, "name");
        if (targets == null || targets.isEmpty()) {
            references.remove(name);
        } else {
            references.put(name, new ArrayList<>(targets));
        }
        return this;
    }

    public MetadataDocument addReference(String name, Oid target) {
        references.computeIfAbsent(name, k -> new ArrayList<>()).add(Objects.requireNonNull(target, "target"));
        return this;
    }

    /**
     * Replaces every occurrence of {@code from} in reference fields with {@code to}.
     */
    public MetadataDocument remapReference(Oid from, Oid to) {
        for (List<Oid> oids : references.values()) {
            oids.replaceAll(oid -> oid.equals(from) ? to : oid);
        }
        return this;
    }

    /**
     * Every OID named by any reference field, without duplicates.
     */
    public Set<Oid> referencedOids() {
        Set<Oid> result = new LinkedHashSet<>();
        references.values().forEach(result::addAll);
        return result;
    }

    public Map<String, ArrayHandle> getArrays() {
        return Collections.unmodifiableMap(arrays);
    }

    public ArrayHandle getArray(String name) {
        return arrays.get(name);
    }

    public MetadataDocument setArray(String name, ArrayHandle handle) {
        Objects.requireNonNull(name, "name");
        if (handle == null) {
            arrays.remove(name);
        } else {
            arrays.put(name, handle);
        }
        return this;
    }

    /**
     * Same type, title, scalar fields, extra metadata and reference fields.
     * Array fields are not compared.
     */
    public boolean sameDescriptionAs(MetadataDocument other) {
        return type.equals(other.type)
                && citation.getTitle().equals(other.citation.getTitle())
                && fields.equals(other.fields)
                && extraMetadata.equals(other.extraMetadata)
                && references.equals(other.references);
    }

    /**
     * Content equality ignoring identity, revision and timestamps: the same
     * description and array fields of the same shapes and element types.
     * Payload bytes are not compared.
     */
    public boolean sameContentAs(MetadataDocument other) {
        if (!sameDescriptionAs(other) || !arrays.keySet().equals(other.arrays.keySet())) {
            return false;
        }
        for (Map.Entry<String, ArrayHandle> entry : arrays.entrySet()) {
            ArrayHandle theirs = other.arrays.get(entry.getKey());
            ArrayHandle ours = entry.getValue();
            if (!ours.hasShape(theirs.getShape()) || ours.getElementType() != theirs.getElementType()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        MetadataDocument other = (MetadataDocument) obj;
        return Objects.equals(oid, other.oid)
                && type.equals(other.type)
                && citation.equals(other.citation)
                && extraMetadata.equals(other.extraMetadata)
                && fields.equals(other.fields)
                && references.equals(other.references)
                && arrays.equals(other.arrays);
    }

    @Override
    public int hashCode() {
        return Objects.hash(oid, type, citation, fields, references);
    }

    @Override
    public String toString() {
        return "MetadataDocument{type=" + type + ", oid=" + oid + ", title=" + citation.getTitle()
                + ", fields=" + fields.size() + ", references=" + references.size()
                + ", arrays=" + arrays.size() + "}";
    }
}
