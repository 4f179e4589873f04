package resqpack.core.objects.impl;

import java.util.ArrayList;
import java.util.List;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.arrays.ElementType;
import resqpack.core.identity.Citation;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.FieldSpec;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.metadata.ValidationError;
import resqpack.core.objects.AbstractResqObject;
import resqpack.core.objects.ObjectKind;

/**
 * Real valued property with a unit of measure, attached to the elements of a
 * supporting representation.
 */
public final class ContinuousProperty extends AbstractResqObject {
    public static final String TYPE = "ContinuousProperty";

    public static final DocumentSchema SCHEMA = DocumentSchema.builder(TYPE)
            .field(PropertySupport.supportingRepresentation())
            .field(PropertySupport.propertyKind())
            .field(PropertySupport.indexableElement())
            .field(PropertySupport.count())
            .field(FieldSpec.string("Uom").required())
            .field(FieldSpec.doubleField("MinimumValue"))
            .field(FieldSpec.doubleField("MaximumValue"))
            .field(FieldSpec.array("Values").required().elementTypes(ElementType.FLOAT64, ElementType.FLOAT32))
            .rule(PropertySupport::checkCount)
            .rule(ContinuousProperty::checkMinMax)
            .build();

    public static final ObjectKind<ContinuousProperty> KIND =
            new ObjectKind<>(ContinuousProperty.class, SCHEMA, ContinuousProperty::new);

    public ContinuousProperty(MetadataDocument document) {
        super(document, SCHEMA);
    }

    /**
     * Document for a new property of one value per cell. The {@code Values}
     * array is supplied when the part is added.
     */
    public static MetadataDocument draft(String title, Oid supportingRepresentation, String uom) {
        return new MetadataDocument(TYPE, Citation.of(title))
                .setReference("SupportingRepresentation", supportingRepresentation)
                .setField("IndexableElement", "cells")
                .setField("Uom", uom);
    }

    public Oid getSupportingRepresentation() {
        return reference("SupportingRepresentation");
    }

    public Oid getPropertyKind() {
        return reference("PropertyKind");
    }

    public String getIndexableElement() {
        return stringField("IndexableElement");
    }

    public String getUom() {
        return stringField("Uom");
    }

    public ArrayHandle getValues() {
        return array("Values");
    }

    private static List<ValidationError> checkMinMax(MetadataDocument doc) {
        String min = doc.getField("MinimumValue");
        String max = doc.getField("MaximumValue");
        List<ValidationError> errors = new ArrayList<>();
        if (min != null && max != null && Double.parseDouble(min.trim()) > Double.parseDouble(max.trim())) {
            errors.add(new ValidationError(ValidationError.Kind.INVALID_VALUE,
                    doc.getOid() != null ? doc.getOid().toString() : null, null, "MinimumValue",
                    "Minimum " + min + " exceeds maximum " + max));
        }
        return errors;
    }
}
