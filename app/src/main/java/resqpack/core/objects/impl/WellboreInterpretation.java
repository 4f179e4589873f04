package resqpack.core.objects.impl;

import resqpack.core.identity.Citation;
import resqpack.core.identity.Oid;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.FieldSpec;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.objects.AbstractResqObject;
import resqpack.core.objects.ObjectKind;

public final class WellboreInterpretation extends AbstractResqObject {
    public static final String TYPE = "WellboreInterpretation";

    public static final DocumentSchema SCHEMA = DocumentSchema.builder(TYPE)
            .field(FieldSpec.reference("InterpretedFeature", WellboreFeature.TYPE).required())
            .field(FieldSpec.bool("IsDrilled").required())
            .field(FieldSpec.enumeration("Domain", "depth", "time", "mixed").required())
            .build();

    public static final ObjectKind<WellboreInterpretation> KIND =
            new ObjectKind<>(WellboreInterpretation.class, SCHEMA, WellboreInterpretation::new);

    public WellboreInterpretation(MetadataDocument document) {
        super(document, SCHEMA);
    }

    public static MetadataDocument draft(Oid feature, String title) {
        return new MetadataDocument(TYPE, Citation.of(title))
                .setReference("InterpretedFeature", feature)
                .setField("IsDrilled", true)
                .setField("Domain", "depth");
    }

    public Oid getInterpretedFeature() {
        return reference("InterpretedFeature");
    }

    public boolean isDrilled() {
        return booleanField("IsDrilled");
    }

    public String getDomain() {
        return stringField("Domain");
    }
}
