package resqpack.core.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import resqpack.core.PackageOptions;
import resqpack.core.arrays.ArrayHandle;
import resqpack.core.arrays.ArrayStore;
import resqpack.core.arrays.ElementType;
import resqpack.core.identity.Citation;
import resqpack.core.identity.IdentityCatalog;
import resqpack.core.identity.Oid;
import resqpack.exceptions.ConcurrentUpdateException;
import resqpack.exceptions.DanglingReferenceException;
import resqpack.exceptions.ShapeMismatchException;
import resqpack.exceptions.ValidationException;

class MetadataStoreTest {
    private static final DocumentSchema NODE = DocumentSchema.builder("Node")
            .field(FieldSpec.string("Label"))
            .field(FieldSpec.reference("Parent", "Node").acyclic())
            .field(FieldSpec.reference("Peer"))
            .field(FieldSpec.array("Values"))
            .build();

    private IdentityCatalog catalog;
    private ArrayStore arrays;
    private MetadataStore store;

    @BeforeEach
    void setUp() {
        catalog = new IdentityCatalog();
        arrays = new ArrayStore(PackageOptions.defaults());
        SchemaLookup schemas = type -> Optional.ofNullable(Map.of("Node", NODE).get(type));
        store = new MetadataStore(catalog, arrays, schemas, new ReentrantReadWriteLock(), true);
    }

    private MetadataDocument newNode(String label) throws Exception {
        Oid oid = catalog.register("Node", List.of());
        MetadataDocument doc = new MetadataDocument(oid, "Node", Citation.of(label)).setField("Label", label);
        store.put(doc);
        return doc;
    }

    @Test
    void putIncrementsRevisionAndStoresCopy() throws Exception {
        MetadataDocument doc = newNode("a");

        assertThat(doc.getRevision()).isEqualTo(1);
        doc.setField("Label", "changed locally");
        assertThat(store.get(doc.getOid()).getField("Label")).isEqualTo("a");

        store.put(doc, 1);
        assertThat(store.revision(doc.getOid())).isEqualTo(2);
    }

    @Test
    void staleRevisionIsRejected() throws Exception {
        MetadataDocument first = newNode("a");
        MetadataDocument second = store.get(first.getOid());

        store.put(first.setField("Label", "one"), first.getRevision());

        assertThatThrownBy(() -> store.put(second.setField("Label", "two"), second.getRevision()))
                .isInstanceOf(ConcurrentUpdateException.class);
        assertThat(store.get(first.getOid()).getField("Label")).isEqualTo("one");
    }

    @Test
    void referencesFollowStoredDocument() throws Exception {
        MetadataDocument parent = newNode("parent");
        MetadataDocument child = newNode("child");

        store.put(child.setReference("Parent", parent.getOid()));

        assertThat(catalog.referencing(parent.getOid())).containsExactly(child.getOid());
    }

    @Test
    void danglingReferenceLeavesEverythingUnchanged() throws Exception {
        MetadataDocument doc = newNode("a");
        Oid missing = Oid.random();

        assertThatThrownBy(() -> store.put(doc.setReference("Peer", missing)))
                .isInstanceOf(DanglingReferenceException.class)
                .satisfies(e -> assertThat(((DanglingReferenceException) e).getMissingOid())
                        .isEqualTo(missing.toString()));

        assertThat(store.get(doc.getOid()).getReferences("Peer")).isEmpty();
        assertThat(catalog.resolve(doc.getOid()).getReferences()).isEmpty();
        assertThat(store.revision(doc.getOid())).isEqualTo(1);
    }

    @Test
    void wrongTargetTypeIsReported() throws Exception {
        Oid other = catalog.register("Other", List.of());
        MetadataDocument doc = newNode("a");

        assertThatThrownBy(() -> store.put(doc.setReference("Parent", other)))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrors())
                        .extracting(ValidationError::getKind)
                        .containsExactly(ValidationError.Kind.WRONG_REFERENCE_TYPE));
    }

    @Test
    void cycleOnAcyclicFieldIsReported() throws Exception {
        MetadataDocument a = newNode("a");
        MetadataDocument b = newNode("b");
        store.put(b.setReference("Parent", a.getOid()));

        List<ValidationError> errors = store.validate(a.setReference("Parent", b.getOid()));

        assertThat(errors).extracting(ValidationError::getKind).containsExactly(ValidationError.Kind.REFERENCE_CYCLE);
    }

    @Test
    void unknownTypeFailsWhenStrict() throws Exception {
        Oid oid = catalog.register("Mystery", List.of());

        assertThatThrownBy(() -> store.put(new MetadataDocument(oid, "Mystery", Citation.of("m"))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("UNKNOWN_TYPE");
    }

    @Test
    void arrayMustExistInStoreWithDeclaredShape() throws Exception {
        MetadataDocument doc = newNode("a");
        ArrayHandle handle = arrays.allocate(doc.getOid(), "Values", new int[] { 3 }, ElementType.FLOAT64);
        ArrayHandle lying = new ArrayHandle("Values", new int[] { 4 }, ElementType.FLOAT64, handle.getPath(),
                handle.getCompression(), null);

        assertThatThrownBy(() -> store.put(doc.setArray("Values", lying)))
                .isInstanceOf(ShapeMismatchException.class);

        store.put(doc.setArray("Values", handle));
        assertThat(store.get(doc.getOid()).getArray("Values")).isEqualTo(handle);
    }

    @Test
    void failureForPrefersDanglingReference() {
        ValidationError plain = new ValidationError(ValidationError.Kind.INVALID_VALUE, "x", "p.xml", "A", "bad");
        ValidationError dangling = new ValidationError(ValidationError.Kind.DANGLING_REFERENCE, "x", "p.xml", "B",
                "gone", "target-oid");

        Exception e = MetadataStore.failureFor(List.of(plain, dangling));

        assertThat(e).isInstanceOf(DanglingReferenceException.class);
        assertThat(((DanglingReferenceException) e).getMissingOid()).isEqualTo("target-oid");
        assertThat(((DanglingReferenceException) e).getReferencingParts()).containsExactly("p.xml");
        assertThat(e.getSuppressed()).hasSize(1);
    }

    private List<String> invalidPaths(MetadataDocument doc) {
        List<String> paths = new ArrayList<>();
        for (ValidationError error : store.validate(doc)) {
            if (error.getKind() == ValidationError.Kind.INVALID_VALUE) {
                paths.add(error.getFieldPath());
            }
        }
        return paths;
    }

    @Test
    void fieldNamesMustBeElementNames() throws Exception {
        MetadataDocument doc = newNode("a")
                .setField("my field", "x")
                .setField("1st", "x")
                .setField("Citation", "x");

        assertThat(invalidPaths(doc)).containsExactlyInAnyOrder("my field", "1st", "Citation");
        assertThatThrownBy(() -> store.put(doc)).isInstanceOf(ValidationException.class);
    }

    @Test
    void textMustBeLegalXml() throws Exception {
        MetadataDocument doc = newNode("a").setField("Label", "bell\u0007");
        doc.setCitation(Citation.of("nul\u0000"));
        doc.putExtraMetadata("note", "half \uD800 surrogate");

        assertThat(invalidPaths(doc)).containsExactlyInAnyOrder("Label", "Citation.Title", "ExtraMetadata.note");

        MetadataDocument fine = newNode("b").setField("Label", "tab\tcr\r\nemoji \uD83D\uDE00");
        assertThat(invalidPaths(fine)).isEmpty();
    }

    @Test
    void arrayPathsMustDifferIgnoringCase() throws Exception {
        MetadataDocument doc = newNode("a");
        ArrayHandle upper = arrays.allocate(doc.getOid(), "Values", new int[] { 2 }, ElementType.FLOAT64);
        ArrayHandle lower = arrays.allocate(doc.getOid(), "values", new int[] { 2 }, ElementType.FLOAT64);

        doc.setArray("Values", upper).setArray("values", lower);

        assertThat(invalidPaths(doc)).contains("values");
    }
}
