package resqpack.core.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.arrays.Compression;
import resqpack.core.arrays.ElementType;
import resqpack.core.identity.Citation;
import resqpack.core.identity.Oid;
import resqpack.exceptions.CorruptionException;

class MetadataCodecTest {
    private final MetadataCodec codec = new MetadataCodec();

    private MetadataDocument decode(String xml) throws CorruptionException {
        return codec.decode(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "part.xml");
    }

    @Test
    void encodedDocumentReadsBackWithEveryFieldKind() throws Exception {
        Oid oid = Oid.random();
        Oid support = Oid.random();
        Citation citation = Citation.builder().title("NETGRS").originator("geo")
                .creation(Instant.parse("2021-08-09T10:00:00Z")).description("net to gross").build();
        ArrayHandle values = new ArrayHandle("Values", new int[] { 2, 3, 4 }, ElementType.FLOAT32,
                ArrayHandle.pathFor(oid, "Values"), Compression.DEFLATE, "abc123");
        MetadataDocument doc = new MetadataDocument(oid, "ContinuousProperty", citation)
                .putExtraMetadata("source", "simulator")
                .setField("Uom", "m3/m3")
                .setField("Count", 1)
                .setReference("SupportingRepresentation", support)
                .setArray("Values", values);

        byte[] xml = codec.encode(doc, target -> Optional.empty());
        MetadataDocument decoded = codec.decode(new ByteArrayInputStream(xml), "part.xml");

        assertThat(decoded.getOid()).isEqualTo(oid);
        assertThat(decoded.getType()).isEqualTo("ContinuousProperty");
        assertThat(decoded.getCitation()).isEqualTo(citation);
        assertThat(decoded.getExtraMetadata()).containsEntry("source", "simulator");
        assertThat(decoded.getFields()).containsEntry("Uom", "m3/m3").containsEntry("Count", "1");
        assertThat(decoded.getReference("SupportingRepresentation")).isEqualTo(support);
        assertThat(decoded.getArray("Values")).isEqualTo(values);
    }

    @Test
    void multiValuedReferenceRepeatsElement() throws Exception {
        Oid a = Oid.random();
        Oid b = Oid.random();
        MetadataDocument doc = new MetadataDocument(Oid.random(), "Collection", Citation.of("c"))
                .addReference("Member", a)
                .addReference("Member", b);

        String xml = new String(codec.encode(doc, target -> Optional.empty()), StandardCharsets.UTF_8);

        assertThat(xml.split("<resqml2:Member ", -1)).hasSize(3);
        assertThat(decode(xml).getReferences("Member")).containsExactly(a, b);
    }

    @Test
    void missingUuidIsCorruption() {
        String xml = "<resqml2:Grid xmlns:resqml2=\"" + MetadataCodec.RESQML_NS + "\"/>";

        assertThatThrownBy(() -> decode(xml))
                .isInstanceOf(CorruptionException.class)
                .hasMessageContaining("no uuid");
    }

    @Test
    void missingCitationIsCorruption() {
        String xml = "<resqml2:Grid xmlns:resqml2=\"" + MetadataCodec.RESQML_NS + "\" uuid=\""
                + Oid.random() + "\"><resqml2:Ni>2</resqml2:Ni></resqml2:Grid>";

        assertThatThrownBy(() -> decode(xml))
                .isInstanceOf(CorruptionException.class)
                .hasMessageContaining("Citation");
    }

    @Test
    void malformedXmlNamesThePart() {
        assertThatThrownBy(() -> decode("<not-closed"))
                .isInstanceOf(CorruptionException.class)
                .satisfies(e -> assertThat(((CorruptionException) e).getPartName()).isEqualTo("part.xml"));
    }

    @Test
    void contentTypeCarriesObjectType() {
        assertThat(MetadataCodec.contentType("IjkGridRepresentation"))
                .isEqualTo("application/x-resqml+xml;version=2.0;type=obj_IjkGridRepresentation");
    }

    @Test
    void shapeTextUsesSpaces() {
        assertThat(MetadataCodec.joinShape(new int[] { 4, 3, 2 })).isEqualTo("4 3 2");
        assertThat(MetadataCodec.parseShape(" 4  3 2 ")).containsExactly(4, 3, 2);
    }

    @Test
    void carriageReturnsSurviveRoundTrip() throws Exception {
        Oid oid = Oid.random();
        MetadataDocument doc = new MetadataDocument(oid, "LocalDepth3dCrs", Citation.of("crs\r\nline"))
                .setField("Description", "a\rb & <c>");

        byte[] xml = codec.encode(doc, target -> Optional.empty());
        MetadataDocument decoded = codec.decode(new ByteArrayInputStream(xml), "part.xml");

        assertThat(new String(xml, StandardCharsets.UTF_8)).contains("crs&#13;");
        assertThat(decoded.getTitle()).isEqualTo("crs\r\nline");
        assertThat(decoded.getField("Description")).isEqualTo("a\rb & <c>");
    }
}
