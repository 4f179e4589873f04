package resqpack.core.container;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import resqpack.core.arrays.Compression;
import resqpack.exceptions.CorruptionException;
import resqpack.exceptions.NotFoundException;
import resqpack.utils.io.IoRetry;

class ContainerIoTest {

    @TempDir
    Path tempDir;

    @Test
    void writtenEntriesReadBack() throws Exception {
        Path file = tempDir.resolve("out.epc");
        try (ContainerWriter writer = new ContainerWriter(file, OutputStreamFactory.FILES)) {
            writer.putEntry("obj_A.xml", "<a/>".getBytes(StandardCharsets.UTF_8));
            writer.putEntry("arrays/x/Values.bin", Compression.NONE, out -> out.write(new byte[] { 1, 2, 3 }));
            writer.putCoreProperties("title", "tester", Instant.parse("2024-01-01T00:00:00Z"));
            writer.finish();
        }

        try (ContainerReader reader = ContainerReader.open(file, IoRetry.none())) {
            assertThat(reader.entryNames()).containsExactly("obj_A.xml", "arrays/x/Values.bin",
                    ContainerLayout.CORE_PROPERTIES);
            assertThat(new String(reader.read("obj_A.xml"), StandardCharsets.UTF_8)).isEqualTo("<a/>");
            assertThat(new String(reader.read(ContainerLayout.CORE_PROPERTIES), StandardCharsets.UTF_8))
                    .contains("tester").contains("2024-01-01T00:00:00Z");
            assertThat(reader.duplicateNames()).isEmpty();
            assertThatThrownBy(() -> reader.read("missing.xml")).isInstanceOf(NotFoundException.class);
        }
    }

    @Test
    void writerRejectsSameNameIgnoringCase() throws Exception {
        try (ContainerWriter writer = new ContainerWriter(tempDir.resolve("dup.epc"), OutputStreamFactory.FILES)) {
            writer.putEntry("obj_A.xml", new byte[0]);

            assertThatThrownBy(() -> writer.putEntry("OBJ_a.XML", new byte[0]))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void readerReportsCaseInsensitiveDuplicates() throws Exception {
        Path file = tempDir.resolve("dupes.epc");
        try (OutputStream out = Files.newOutputStream(file); ZipOutputStream zip = new ZipOutputStream(out)) {
            for (String name : new String[] { "obj_A.xml", "OBJ_A.XML", "obj_B.xml" }) {
                zip.putNextEntry(new ZipEntry(name));
                zip.write(name.getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }

        try (ContainerReader reader = ContainerReader.open(file, IoRetry.none())) {
            assertThat(reader.entryNames()).containsExactly("obj_A.xml", "obj_B.xml");
            assertThat(reader.duplicateNames()).containsExactlyInAnyOrder("obj_A.xml", "OBJ_A.XML");
        }
    }

    @Test
    void missingAndNonZipFilesAreDistinguished() throws Exception {
        Path garbage = tempDir.resolve("garbage.epc");
        Files.writeString(garbage, "this is not a zip");

        assertThatThrownBy(() -> ContainerReader.open(tempDir.resolve("absent.epc"), IoRetry.none()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> ContainerReader.open(garbage, IoRetry.none()))
                .isInstanceOf(CorruptionException.class);
    }

    @Test
    void payloadSourceOutlivesReader() throws Exception {
        Path file = tempDir.resolve("payload.epc");
        try (ContainerWriter writer = new ContainerWriter(file, OutputStreamFactory.FILES)) {
            writer.putEntry("arrays/x/Values.bin", Compression.DEFLATE, out -> out.write(new byte[] { 9, 8, 7 }));
            writer.finish();
        }
        ContainerPayloadSource source;
        try (ContainerReader reader = ContainerReader.open(file, IoRetry.none())) {
            source = reader.payloadSource("arrays/x/Values.bin");
        }

        try (InputStream in = source.open()) {
            assertThat(in.readAllBytes()).isEqualTo(new byte[] { 9, 8, 7 });
        }
        assertThat(source.describe()).contains("arrays/x/Values.bin");
    }

    @Test
    void contentTypesResolveOverridesBeforeDefaults() throws Exception {
        ContentTypes types = ContentTypes.standard();
        types.addOverride("obj_A.xml", "application/x-resqml+xml;version=2.0;type=obj_LocalDepth3dCrs");

        ContentTypes decoded = ContentTypes.decode(new ByteArrayInputStream(types.encode()));

        assertThat(decoded.typeOf("obj_A.xml")).hasValue(
                "application/x-resqml+xml;version=2.0;type=obj_LocalDepth3dCrs");
        assertThat(decoded.typeOf("obj_B.XML")).hasValue(ContentTypes.XML_TYPE);
        assertThat(decoded.typeOf("noext")).isEmpty();
        assertThat(ContentTypes.objectType(decoded.typeOf("obj_A.xml").get())).hasValue("LocalDepth3dCrs");
    }

    @Test
    void relationshipsKeepTargetsRootRelative() throws Exception {
        Relationships rels = new Relationships("dir/obj_A.xml")
                .add(Relationship.DESTINATION_OBJECT, "obj_B.xml")
                .add(Relationship.EXTERNAL_RESOURCE, "arrays/a/Values.bin");

        assertThat(rels.all()).extracting(Relationship::getTarget)
                .containsExactly("../obj_B.xml", "../arrays/a/Values.bin");
        assertThat(rels.all()).extracting(Relationship::getId).containsExactly("_1", "_2");

        Relationships decoded = Relationships.decode(new ByteArrayInputStream(rels.encode()), "dir/obj_A.xml",
                "dir/_rels/obj_A.xml.rels");
        assertThat(decoded.targets(Relationship.DESTINATION_OBJECT)).containsExactly("obj_B.xml");
        assertThat(decoded.targets(Relationship.SOURCE_OBJECT)).isEmpty();
    }
}
