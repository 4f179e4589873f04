package resqpack.core.objects.impl;

import resqpack.core.identity.Citation;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.objects.AbstractResqObject;
import resqpack.core.objects.ObjectKind;

/**
 * A wellbore as a named feature; its citation title is the well name.
 */
public final class WellboreFeature extends AbstractResqObject {
    public static final String TYPE = "WellboreFeature";

    public static final DocumentSchema SCHEMA = DocumentSchema.builder(TYPE).build();

    public static final ObjectKind<WellboreFeature> KIND =
            new ObjectKind<>(WellboreFeature.class, SCHEMA, WellboreFeature::new);

    public WellboreFeature(MetadataDocument document) {
        super(document, SCHEMA);
    }

    public static MetadataDocument draft(String wellName) {
        return new MetadataDocument(TYPE, Citation.of(wellName));
    }
}
