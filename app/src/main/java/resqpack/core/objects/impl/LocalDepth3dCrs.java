package resqpack.core.objects.impl;

import resqpack.core.identity.Citation;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.FieldSpec;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.objects.AbstractResqObject;
import resqpack.core.objects.ObjectKind;

/**
 * Local coordinate reference system with depth as the vertical axis.
 */
public final class LocalDepth3dCrs extends AbstractResqObject {
    public static final String TYPE = "LocalDepth3dCrs";

    public static final DocumentSchema SCHEMA = DocumentSchema.builder(TYPE)
            .field(FieldSpec.doubleField("XOffset").required())
            .field(FieldSpec.doubleField("YOffset").required())
            .field(FieldSpec.doubleField("ZOffset").required())
            .field(FieldSpec.doubleField("ArealRotation").range(-360, 360))
            .field(FieldSpec.enumeration("ProjectedUom", "m", "ft", "km").required())
            .field(FieldSpec.enumeration("VerticalUom", "m", "ft").required())
            .field(FieldSpec.bool("ZIncreasingDownward").required())
            .field(FieldSpec.integer("ProjectedCrsEpsgCode").min(1))
            .field(FieldSpec.integer("VerticalCrsEpsgCode").min(1))
            .build();

    public static final ObjectKind<LocalDepth3dCrs> KIND =
            new ObjectKind<>(LocalDepth3dCrs.class, SCHEMA, LocalDepth3dCrs::new);

    public LocalDepth3dCrs(MetadataDocument document) {
        super(document, SCHEMA);
    }

    /**
     * Document for a new CRS with metre units, no offset and depth
     * increasing downward.
     */
    public static MetadataDocument draft(String title) {
        return new MetadataDocument(TYPE, Citation.of(title))
                .setField("XOffset", 0.0)
                .setField("YOffset", 0.0)
                .setField("ZOffset", 0.0)
                .setField("ProjectedUom", "m")
                .setField("VerticalUom", "m")
                .setField("ZIncreasingDownward", true);
    }

    public double getXOffset() {
        return doubleField("XOffset", 0);
    }

    public double getYOffset() {
        return doubleField("YOffset", 0);
    }

    public double getZOffset() {
        return doubleField("ZOffset", 0);
    }

    public double getArealRotation() {
        return doubleField("ArealRotation", 0);
    }

    public String getProjectedUom() {
        return stringField("ProjectedUom");
    }

    public String getVerticalUom() {
        return stringField("VerticalUom");
    }

    public boolean isZIncreasingDownward() {
        return booleanField("ZIncreasingDownward");
    }
}
