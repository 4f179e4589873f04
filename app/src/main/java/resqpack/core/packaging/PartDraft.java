package resqpack.core.packaging;

import java.util.Map;
import java.util.Objects;

import resqpack.core.arrays.ArrayData;
import resqpack.core.metadata.MetadataDocument;

/**
 * A document waiting to be added, with the payloads of its array fields.
 */
public final class PartDraft {
    private final MetadataDocument document;
    private final Map<String, ArrayData> arrays;

    public PartDraft(MetadataDocument document, Map<String, ArrayData> arrays) {
        this.document = Objects.requireNonNull(document, "document");
        this.arrays = Map.copyOf(arrays);
    }

    public MetadataDocument getDocument() {
        return document;
    }

    public Map<String, ArrayData> getArrays() {
        return arrays;
    }
}
