package resqpack.core.objects;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.metadata.ValidationError;

/**
 * Wrapper for documents of a type no kind is registered for. Only possible
 * when unknown types are tolerated.
 */
public final class GenericResqObject implements ResqObject {
    private final MetadataDocument document;

    public GenericResqObject(MetadataDocument document) {
        this.document = document.copy();
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
        return List.of();
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

    @Override
    public String toString() {
        return "GenericResqObject{type=" + getType() + ", oid=" + getOid() + "}";
    }
}
