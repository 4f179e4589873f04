package resqpack.core.identity;

import java.util.List;

/**
 * Outcome of removing an object. With cascading removal the objects that
 * referenced the removed one are listed as invalidated; the caller decides
 * whether to repair or remove them.
 */
public final class RemovalReport {
    private final Oid removed;
    private final String removedPart;
    private final List<CatalogEntry> invalidated;

    public RemovalReport(Oid removed, String removedPart, List<CatalogEntry> invalidated) {
        this.removed = removed;
        this.removedPart = removedPart;
        this.invalidated = List.copyOf(invalidated);
    }

    public Oid getRemoved() {
        return removed;
    }

    public String getRemovedPart() {
        return removedPart;
    }

    public List<CatalogEntry> getInvalidated() {
        return invalidated;
    }

    public boolean isPartialFailure() {
        return !invalidated.isEmpty();
    }

    @Override
    public String toString() {
        return "RemovalReport{removed=" + removed + ", invalidated=" + invalidated.size() + "}";
    }
}
