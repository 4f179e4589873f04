package resqpack.exceptions;

import java.util.List;

/**
 * A reference names an OID that is absent from the package, or an object
 * cannot be removed because live objects still reference it.
 */
public class DanglingReferenceException extends ResqException {
    private final String missingOid;
    private final List<String> referencingParts;

    public DanglingReferenceException(String missingOid, List<String> referencingParts, String message) {
        super(message);
        this.missingOid = missingOid;
        this.referencingParts = List.copyOf(referencingParts);
    }

    public String getMissingOid() {
        return missingOid;
    }

    /**
     * Part names of the objects holding the offending references.
     */
    public List<String> getReferencingParts() {
        return referencingParts;
    }
}
