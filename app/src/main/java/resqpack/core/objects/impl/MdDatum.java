package resqpack.core.objects.impl;

import resqpack.core.identity.Citation;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.FieldSpec;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.objects.AbstractResqObject;
import resqpack.core.objects.ObjectKind;

/**
 * Origin of measured depths along a wellbore.
 */
public final class MdDatum extends AbstractResqObject {
    public static final String TYPE = "MdDatum";

    public static final DocumentSchema SCHEMA = DocumentSchema.builder(TYPE)
            .field(FieldSpec.reference("LocalCrs", LocalDepth3dCrs.TYPE).required())
            .field(FieldSpec.doubleField("X").required())
            .field(FieldSpec.doubleField("Y").required())
            .field(FieldSpec.doubleField("Z").required())
            .field(FieldSpec.enumeration("MdReference", "ground level", "kelly bushing", "mean sea level",
                    "derrick floor", "casing flange", "rotary table", "rotary bushing", "well head",
                    "wellhead flange").required())
            .build();

    public static final ObjectKind<MdDatum> KIND = new ObjectKind<>(MdDatum.class, SCHEMA, MdDatum::new);

    public MdDatum(MetadataDocument document) {
        super(document, SCHEMA);
    }

    public static MetadataDocument draft(String title, Oid crs, double x, double y, double z, String mdReference) {
        return new MetadataDocument(TYPE, Citation.of(title))
                .setReference("LocalCrs", crs)
                .setField("X", x)
                .setField("Y", y)
                .setField("Z", z)
                .setField("MdReference", mdReference);
    }

    public Oid getLocalCrs() {
        return reference("LocalCrs");
    }

    public double[] getLocation() {
        return new double[] { doubleField("X", 0), doubleField("Y", 0), doubleField("Z", 0) };
    }

    public String getMdReference() {
        return stringField("MdReference");
    }
}
