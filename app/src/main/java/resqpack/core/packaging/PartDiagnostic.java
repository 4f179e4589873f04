package resqpack.core.packaging;

import java.util.Objects;

import resqpack.core.identity.Oid;
import resqpack.exceptions.ResqException;

/**
 * One problem found while loading a container, tied to the part it concerns.
 */
public final class PartDiagnostic {
    private final String partName;
    private final Oid oid;
    private final ResqException error;

    public PartDiagnostic(String partName, Oid oid, ResqException error) {
        this.partName = Objects.requireNonNull(partName, "partName");
        this.oid = oid;
        this.error = Objects.requireNonNull(error, "error");
    }

    public String getPartName() {
        return partName;
    }

    /**
     * OID of the object in the part, or null if it could not be read.
     */
    public Oid getOid() {
        return oid;
    }

    public ResqException getError() {
        return error;
    }

    @Override
    public String toString() {
        return partName + ": " + error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
