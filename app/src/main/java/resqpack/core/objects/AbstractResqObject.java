package resqpack.core.objects;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.metadata.ValidationError;

/**
 * Base for object kinds backed by a snapshot of their metadata document.
 * Subclasses add typed accessors over the document's fields.
 */
public abstract class AbstractResqObject implements ResqObject {
    protected final MetadataDocument document;
    private final DocumentSchema schema;

    protected AbstractResqObject(MetadataDocument document, DocumentSchema schema) {
        this.document = document.copy();
        this.schema = Objects.requireNonNull(schema, "schema");
        if (!schema.getType().equals(document.getType())) {
            throw new IllegalArgumentException("Cannot wrap " + document.getType() + " document as "
                    + schema.getType());
        }
    }

    @Override
    public Oid getOid() {
        return document.getOid();
    }

    @Override
    public String getType() {
        return document.getType();
    }

    @Override
    public String getTitle() {
        return document.getTitle();
    }

    @Override
    public List<ValidationError> validate() {
        return schema.validate(document);
    }

    @Override
    public MetadataDocument toDocument() {
        return document.copy();
    }

    @Override
    public Set<Oid> referencedObjects() {
        return document.referencedOids();
    }

    @Override
    public Collection<ArrayHandle> referencedArrays() {
        return document.getArrays().values();
    }

    public long getRevision() {
        return document.getRevision();
    }

    protected String stringField(String name) {
        return document.getField(name);
    }

    protected long longField(String name) {
        String value = document.getField(name);
        if (value == null) {
            throw new IllegalStateException(getType() + " " + getOid() + " has no " + name);
        }
        return Long.parseLong(value.trim());
    }

    protected double doubleField(String name, double fallback) {
        String value = document.getField(name);
        return value == null ? fallback : Double.parseDouble(value.trim());
    }

    protected boolean booleanField(String name) {
        return Boolean.parseBoolean(document.getField(name));
    }

    protected Oid reference(String name) {
        return document.getReference(name);
    }

    protected ArrayHandle array(String name) {
        return document.getArray(name);
    }

    @Override
    public String toString() {
        return getType() + "{oid=" + getOid() + ", title=" + getTitle() + "}";
    }
}
