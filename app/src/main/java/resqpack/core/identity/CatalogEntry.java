package resqpack.core.identity;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of one catalog record. The referenced-by set is derived by the
 * catalog when the snapshot is taken and is never persisted.
 */
public final class CatalogEntry {
    private final Oid oid;
    private final String type;
    private final String partName;
    private final Citation citation;
    private final Set<Oid> references;
    private final Set<Oid> referencedBy;
    private final String invalidReason;

    CatalogEntry(Oid oid, String type, String partName, Citation citation, Set<Oid> references,
            Set<Oid> referencedBy, String invalidReason) {
        this.oid = Objects.requireNonNull(oid, "oid");
        this.type = Objects.requireNonNull(type, "type");
        this.partName = partName;
        this.citation = citation;
        this.references = Collections.unmodifiableSet(new LinkedHashSet<>(references));
        this.referencedBy = Collections.unmodifiableSet(new LinkedHashSet<>(referencedBy));
        this.invalidReason = invalidReason;
    }

    public Oid getOid() {
        return oid;
    }

    public String getType() {
        return type;
    }

    public String getPartName() {
        return partName;
    }

    public Citation getCitation() {
        return citation;
    }

    public String getTitle() {
        return citation != null ? citation.getTitle() : null;
    }

    public Set<Oid> getReferences() {
        return references;
    }

    public Set<Oid> getReferencedBy() {
        return referencedBy;
    }

    /**
     * False once a cascading removal left this entry holding a dangling reference.
     */
    public boolean isValid() {
        return invalidReason == null;
    }

    public String getInvalidReason() {
        return invalidReason;
    }

    @Override
    public String toString() {
        return "CatalogEntry{oid=" + oid + ", type=" + type + ", part=" + partName
                + ", references=" + references.size() + (isValid() ? "" : ", invalid") + "}";
    }
}
