package resqpack.core.container;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import resqpack.core.arrays.Compression;

/**
 * Writes the entries of a new container file. Callers write to a staging file
 * and move it into place once {@link #finish()} returned.
 */
public final class ContainerWriter implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ContainerWriter.class);

    private static final String CORE_NS = "http://schemas.openxmlformats.org/package/2006/metadata/core-properties";
    private static final String DC_NS = "http://purl.org/dc/elements/1.1/";
    private static final String DCTERMS_NS = "http://purl.org/dc/terms/";
    private static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";

    /**
     * Writes the body of one entry.
     */
    @FunctionalInterface
    public interface EntryContent {
        void writeTo(OutputStream out) throws IOException;
    }

    private final Path path;
    private final ZipOutputStream zip;
    private final Set<String> written = new HashSet<>();
    private boolean finished;

    public ContainerWriter(Path path, OutputStreamFactory streams) throws IOException {
        this.path = path;
        this.zip = new ZipOutputStream(new BufferedOutputStream(streams.open(path)));
    }

    public void putEntry(String name, byte[] content) throws IOException {
        putEntry(name, Compression.DEFLATE, out -> out.write(content));
    }

    /**
     * Adds one entry. {@link Compression#NONE} entries are deflated at level
     * zero, which stores the bytes without buffering the entry to compute its
     * CRC up front.
     */
    public void putEntry(String name, Compression compression, EntryContent content) throws IOException {
        if (!written.add(name.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Entry written twice: " + name);
        }
        zip.setLevel(compression == Compression.NONE ? Deflater.NO_COMPRESSION : Deflater.DEFAULT_COMPRESSION);
        zip.putNextEntry(new ZipEntry(name));
        content.writeTo(new FilterOutputStream(zip) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() {
                // the entry is closed below, the zip stream stays open
            }
        });
        zip.closeEntry();
        log.debug("Wrote entry {}", name);
    }

    public void putCoreProperties(String title, String creator, Instant created) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            XMLStreamWriter w = XMLOutputFactory.newInstance().createXMLStreamWriter(out, "UTF-8");
            w.writeStartDocument("UTF-8", "1.0");
            w.setPrefix("cp", CORE_NS);
            w.writeStartElement("cp", "coreProperties", CORE_NS);
            w.writeNamespace("cp", CORE_NS);
            w.writeNamespace("dc", DC_NS);
            w.writeNamespace("dcterms", DCTERMS_NS);
            w.writeNamespace("xsi", XSI_NS);
            w.writeStartElement("dc", "title", DC_NS);
            w.writeCharacters(title);
            w.writeEndElement();
            w.writeStartElement("dc", "creator", DC_NS);
            w.writeCharacters(creator);
            w.writeEndElement();
            w.writeStartElement("dcterms", "created", DCTERMS_NS);
            w.writeAttribute("xsi", XSI_NS, "type", "dcterms:W3CDTF");
            w.writeCharacters(created.toString());
            w.writeEndElement();
            w.writeEndElement();
            w.writeEndDocument();
            w.close();
        } catch (XMLStreamException e) {
            throw new IOException("Failed to serialize core properties", e);
        }
        putEntry(ContainerLayout.CORE_PROPERTIES, out.toByteArray());
    }

    /**
     * Completes the zip and forces it to disk.
     */
    public void finish() throws IOException {
        zip.finish();
        zip.flush();
        zip.close();
        finished = true;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            channel.force(true);
        }
        log.debug("Finished {} with {} entries", path, written.size());
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        if (!finished) {
            zip.close();
        }
    }
}
