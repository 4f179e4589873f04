package resqpack.core.objects.impl;

import java.util.List;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.metadata.FieldSpec;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.metadata.ValidationError;

/**
 * Fields and checks shared by the property kinds.
 */
final class PropertySupport {
    static final String[] INDEXABLE_ELEMENTS = { "cells", "nodes", "faces", "intervals", "columns", "layers" };

    static final String[] SUPPORT_TYPES = { IjkGridRepresentation.TYPE, WellboreTrajectoryRepresentation.TYPE };

    private PropertySupport() {
    }

    static FieldSpec supportingRepresentation() {
        return FieldSpec.reference("SupportingRepresentation", SUPPORT_TYPES).required();
    }

    static FieldSpec propertyKind() {
        return FieldSpec.reference("PropertyKind", PropertyKind.TYPE);
    }

    static FieldSpec indexableElement() {
        return FieldSpec.enumeration("IndexableElement", INDEXABLE_ELEMENTS).required();
    }

    static FieldSpec count() {
        return FieldSpec.integer("Count").min(1);
    }

    /**
     * The first dimension of {@code Values} spans the indexable elements; with
     * {@code Count} above one a trailing dimension of that size holds the
     * values per element.
     */
    static List<ValidationError> checkCount(MetadataDocument doc) {
        ArrayHandle values = doc.getArray("Values");
        String countText = doc.getField("Count");
        if (values == null || countText == null) {
            return List.of();
        }
        long count = Long.parseLong(countText.trim());
        int[] shape = values.getShape();
        if (count > 1 && shape[shape.length - 1] != count) {
            String oid = doc.getOid() != null ? doc.getOid().toString() : null;
            return List.of(new ValidationError(ValidationError.Kind.ARRAY_MISMATCH, oid, null, "Values",
                    "Count is " + count + " but the last dimension of Values is " + shape[shape.length - 1]));
        }
        return List.of();
    }
}
