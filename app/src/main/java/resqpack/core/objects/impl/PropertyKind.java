package resqpack.core.objects.impl;

import resqpack.core.identity.Citation;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.FieldSpec;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.objects.AbstractResqObject;
import resqpack.core.objects.ObjectKind;

/**
 * Bespoke property kind. Kinds form a hierarchy through {@code Parent}, which
 * must never loop back on itself.
 */
public final class PropertyKind extends AbstractResqObject {
    public static final String TYPE = "PropertyKind";

    public static final DocumentSchema SCHEMA = DocumentSchema.builder(TYPE)
            .field(FieldSpec.string("NamingSystem").required())
            .field(FieldSpec.bool("IsAbstract").required())
            .field(FieldSpec.string("RepresentativeUom").required())
            .field(FieldSpec.reference("Parent", TYPE).acyclic())
            .build();

    public static final ObjectKind<PropertyKind> KIND = new ObjectKind<>(PropertyKind.class, SCHEMA, PropertyKind::new);

    public PropertyKind(MetadataDocument document) {
        super(document, SCHEMA);
    }

    public static MetadataDocument draft(String title, String uom, Oid parent) {
        return new MetadataDocument(TYPE, Citation.of(title))
                .setField("NamingSystem", "urn:resqml:bespoke")
                .setField("IsAbstract", false)
                .setField("RepresentativeUom", uom)
                .setReference("Parent", parent);
    }

    public String getNamingSystem() {
        return stringField("NamingSystem");
    }

    public boolean isAbstract() {
        return booleanField("IsAbstract");
    }

    public String getRepresentativeUom() {
        return stringField("RepresentativeUom");
    }

    public Oid getParent() {
        return reference("Parent");
    }
}
