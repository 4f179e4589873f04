package resqpack.core.objects;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.metadata.ValidationError;

/**
 * Capability set every object kind provides. The storage layers only ever see
 * the {@link MetadataDocument} an object serializes to.
 */
public interface ResqObject {
    /**
     * Stable identifier, null for an object not yet added to a package.
     */
    Oid getOid();

    /**
     * Type tag, such as {@code IjkGridRepresentation}.
     */
    String getType();

    String getTitle();

    /**
     * Checks that need nothing but this object's own document.
     */
    List<ValidationError> validate();

    /**
     * Metadata document holding this object's state.
     */
    MetadataDocument toDocument();

    /**
     * OIDs named by any reference field.
     */
    Set<Oid> referencedObjects();

    /**
     * Handles of the arrays this object owns; no payload is read.
     */
    Collection<ArrayHandle> referencedArrays();
}
