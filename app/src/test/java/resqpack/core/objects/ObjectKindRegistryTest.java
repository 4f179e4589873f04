package resqpack.core.objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import resqpack.core.identity.Citation;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.objects.impl.ContinuousProperty;
import resqpack.core.objects.impl.IjkGridRepresentation;
import resqpack.core.objects.impl.LocalDepth3dCrs;

class ObjectKindRegistryTest {

    /** Kind that exists only in this test. */
    static final class Horizon extends AbstractResqObject {
        static final DocumentSchema SCHEMA = DocumentSchema.builder("HorizonInterpretation").build();

        Horizon(MetadataDocument document) {
            super(document, SCHEMA);
        }
    }

    @Test
    void defaultRegistryFindsEveryStandardKind() {
        ObjectKindRegistry registry = ObjectKindRegistry.loadDefault();

        assertThat(registry.kinds()).hasSize(10);
        assertThat(registry.find(IjkGridRepresentation.TYPE)).contains(IjkGridRepresentation.KIND);
        assertThat(registry.find(ContinuousProperty.class)).contains(ContinuousProperty.KIND);
        assertThat(registry.schemaFor(LocalDepth3dCrs.TYPE)).contains(LocalDepth3dCrs.SCHEMA);
        assertThat(registry.schemaFor("Unheard")).isEmpty();
    }

    @Test
    void registeringTheSameTypeTwiceFails() {
        ObjectKindRegistry registry = new ObjectKindRegistry().register(LocalDepth3dCrs.KIND);

        assertThatThrownBy(() -> registry.register(LocalDepth3dCrs.KIND))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(LocalDepth3dCrs.TYPE);
    }

    @Test
    void newKindsPlugInWithoutTouchingTheStandardOnes() {
        ObjectKindRegistry registry = ObjectKindRegistry.loadDefault()
                .register(new ObjectKind<>(Horizon.class, Horizon.SCHEMA, Horizon::new));

        ResqObject wrapped = registry.wrap(new MetadataDocument("HorizonInterpretation", Citation.of("top")));

        assertThat(wrapped).isInstanceOf(Horizon.class);
        assertThat(wrapped.getTitle()).isEqualTo("top");
        assertThat(registry.kinds()).hasSize(11);
    }

    @Test
    void unknownTypesWrapGenerically() {
        ResqObject wrapped = ObjectKindRegistry.loadDefault()
                .wrap(new MetadataDocument("Grid", Citation.of("legacy")));

        assertThat(wrapped).isInstanceOf(GenericResqObject.class);
        assertThat(wrapped.getType()).isEqualTo("Grid");
        assertThat(wrapped.validate()).isEmpty();
    }

    @Test
    void typedWrapperRejectsOtherTypes() {
        MetadataDocument crs = LocalDepth3dCrs.draft("local");

        assertThatThrownBy(() -> IjkGridRepresentation.KIND.wrap(crs))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(LocalDepth3dCrs.KIND.wrap(crs).isZIncreasingDownward()).isTrue();
    }
}
