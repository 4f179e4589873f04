package resqpack.core.objects.impl;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.arrays.ElementType;
import resqpack.core.identity.Citation;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.FieldSpec;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.objects.AbstractResqObject;
import resqpack.core.objects.ObjectKind;

/**
 * Integer valued property. With a {@code StringLookup} reference the values
 * are category keys of that table.
 */
public final class DiscreteProperty extends AbstractResqObject {
    public static final String TYPE = "DiscreteProperty";

    public static final DocumentSchema SCHEMA = DocumentSchema.builder(TYPE)
            .field(PropertySupport.supportingRepresentation())
            .field(PropertySupport.propertyKind())
            .field(PropertySupport.indexableElement())
            .field(PropertySupport.count())
            .field(FieldSpec.integer("NullValue"))
            .field(FieldSpec.reference("StringLookup", StringTableLookup.TYPE))
            .field(FieldSpec.array("Values").required().elementTypes(ElementType.INT64, ElementType.INT32,
                    ElementType.INT16, ElementType.INT8, ElementType.UINT8, ElementType.BOOL))
            .rule(PropertySupport::checkCount)
            .build();

    public static final ObjectKind<DiscreteProperty> KIND =
            new ObjectKind<>(DiscreteProperty.class, SCHEMA, DiscreteProperty::new);

    public DiscreteProperty(MetadataDocument document) {
        super(document, SCHEMA);
    }

    public static MetadataDocument draft(String title, Oid supportingRepresentation) {
        return new MetadataDocument(TYPE, Citation.of(title))
                .setReference("SupportingRepresentation", supportingRepresentation)
                .setField("IndexableElement", "cells");
    }

    public Oid getSupportingRepresentation() {
        return reference("SupportingRepresentation");
    }

    public Oid getStringLookup() {
        return reference("StringLookup");
    }

    public boolean isCategorical() {
        return getStringLookup() != null;
    }

    public Long getNullValue() {
        String value = stringField("NullValue");
        return value == null ? null : Long.valueOf(value.trim());
    }

    public ArrayHandle getValues() {
        return array("Values");
    }
}
