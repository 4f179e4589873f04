package resqpack.core.metadata;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import javax.xml.stream.XMLStreamWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.arrays.Compression;
import resqpack.core.arrays.ElementType;
import resqpack.core.identity.CatalogEntry;
import resqpack.core.identity.Citation;
import resqpack.core.identity.Oid;
import resqpack.exceptions.CorruptionException;

// @formatter:off
/**
 * XML form of a metadata document, following RESQML 2.0 conventions.
 *
 * <pre>
 * &lt;resqml2:ContinuousProperty schemaVersion="2.0" uuid="…"&gt;
 *   &lt;eml:Citation&gt;
 *     &lt;eml:Title&gt;NETGRS&lt;/eml:Title&gt;
 *     &lt;eml:Originator&gt;…&lt;/eml:Originator&gt;
 *     &lt;eml:Creation&gt;2021-08-09T10:00:00Z&lt;/eml:Creation&gt;
 *     &lt;eml:Format&gt;…&lt;/eml:Format&gt;
 *   &lt;/eml:Citation&gt;
 *   &lt;resqml2:ExtraMetadata&gt;&lt;resqml2:Name/&gt;&lt;resqml2:Value/&gt;&lt;/resqml2:ExtraMetadata&gt;
 *   &lt;resqml2:UOM&gt;m3/m3&lt;/resqml2:UOM&gt;                               ← scalar
 *   &lt;resqml2:SupportingRepresentation xsi:type="eml:DataObjectReference"&gt; ← reference
 *     &lt;eml:ContentType/&gt;&lt;eml:Title/&gt;&lt;eml:UUID/&gt;
 *   &lt;/resqml2:SupportingRepresentation&gt;
 *   &lt;resqml2:Values xsi:type="resqml2:ExternalArray"&gt;                  ← array handle
 *     &lt;resqml2:Shape&gt;2 3 4&lt;/resqml2:Shape&gt;&lt;resqml2:ElementType/&gt;
 *     &lt;eml:PathInExternalFile/&gt;&lt;resqml2:Compression/&gt;&lt;resqml2:Checksum/&gt;
 *   &lt;/resqml2:Values&gt;
 * &lt;/resqml2:ContinuousProperty&gt;
 * </pre>
 *
 * Multi-valued reference fields repeat their element.
 */
// @formatter:on
public final class MetadataCodec {
    private static final Logger log = LoggerFactory.getLogger(MetadataCodec.class);

    public static final String RESQML_NS = "http://www.energistics.org/energyml/data/resqmlv2";
    public static final String EML_NS = "http://www.energistics.org/energyml/data/commonv2";
    public static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String SCHEMA_VERSION = "2.0";

    private static final String REFERENCE_TYPE = "eml:DataObjectReference";
    private static final String ARRAY_TYPE = "resqml2:ExternalArray";

    private final XMLOutputFactory outputFactory;
    private final XMLInputFactory inputFactory;

    public MetadataCodec() {
        this.outputFactory = XMLOutputFactory.newInstance();
        this.inputFactory = XMLInputFactory.newInstance();
        inputFactory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    /**
     * Content type of the metadata part of an object of {@code type}.
     */
    public static String contentType(String type) {
        return "application/x-resqml+xml;version=" + SCHEMA_VERSION + ";type=obj_" + type;
    }

    /**
     * Serializes {@code doc}. {@code targets} supplies type and title of
     * referenced objects for the reference elements.
     */
    public byte[] encode(MetadataDocument doc, Function<Oid, Optional<CatalogEntry>> targets) {
        if (doc.getOid() == null) {
            throw new IllegalArgumentException("Cannot encode a document without OID");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            XMLStreamWriter w = outputFactory.createXMLStreamWriter(out, "UTF-8");
            w.writeStartDocument("UTF-8", "1.0");
            w.writeCharacters("\n");
            w.setPrefix("resqml2", RESQML_NS);
            w.setPrefix("eml", EML_NS);
            w.setPrefix("xsi", XSI_NS);
            w.writeStartElement("resqml2", doc.getType(), RESQML_NS);
            w.writeNamespace("resqml2", RESQML_NS);
            w.writeNamespace("eml", EML_NS);
            w.writeNamespace("xsi", XSI_NS);
            w.writeAttribute("schemaVersion", SCHEMA_VERSION);
            w.writeAttribute("uuid", doc.getOid().toString());

            writeCitation(w, doc.getCitation());

            for (Map.Entry<String, String> entry : doc.getExtraMetadata().entrySet()) {
                w.writeStartElement("resqml2", "ExtraMetadata", RESQML_NS);
                textElement(w, "resqml2", RESQML_NS, "Name", entry.getKey());
                textElement(w, "resqml2", RESQML_NS, "Value", entry.getValue());
                w.writeEndElement();
            }

            for (Map.Entry<String, String> field : doc.getFields().entrySet()) {
                textElement(w, "resqml2", RESQML_NS, field.getKey(), field.getValue());
            }

            for (Map.Entry<String, List<Oid>> field : doc.getReferences().entrySet()) {
                for (Oid target : field.getValue()) {
                    Optional<CatalogEntry> entry = targets.apply(target);
                    w.writeStartElement("resqml2", field.getKey(), RESQML_NS);
                    w.writeAttribute("xsi", XSI_NS, "type", REFERENCE_TYPE);
                    textElement(w, "eml", EML_NS, "ContentType",
                            entry.map(e -> contentType(e.getType())).orElse(""));
                    textElement(w, "eml", EML_NS, "Title", entry.map(CatalogEntry::getTitle).orElse(""));
                    textElement(w, "eml", EML_NS, "UUID", target.toString());
                    w.writeEndElement();
                }
            }

            for (Map.Entry<String, ArrayHandle> field : doc.getArrays().entrySet()) {
                ArrayHandle handle = field.getValue();
                w.writeStartElement("resqml2", field.getKey(), RESQML_NS);
                w.writeAttribute("xsi", XSI_NS, "type", ARRAY_TYPE);
                textElement(w, "resqml2", RESQML_NS, "ArrayName", handle.getName());
                textElement(w, "resqml2", RESQML_NS, "Shape", joinShape(handle.getShape()));
                textElement(w, "resqml2", RESQML_NS, "ElementType", handle.getElementType().getTypeName());
                textElement(w, "eml", EML_NS, "PathInExternalFile", handle.getPath());
                textElement(w, "resqml2", RESQML_NS, "Compression", handle.getCompression().getMarker());
                if (handle.getChecksum() != null) {
                    textElement(w, "resqml2", RESQML_NS, "Checksum", handle.getChecksum());
                }
                w.writeEndElement();
            }

            w.writeEndElement();
            w.writeEndDocument();
            w.flush();
            w.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to serialize " + doc, e);
        }
        return out.toByteArray();
    }

    /**
     * Parses one metadata part.
     *
     * @throws CorruptionException naming {@code partName} if the XML is not a
     *                             well formed metadata document
     */
    public MetadataDocument decode(InputStream in, String partName) throws CorruptionException {
        XMLStreamReader r = null;
        try {
            r = inputFactory.createXMLStreamReader(in);
            r.nextTag();
            String type = r.getLocalName();
            String uuid = r.getAttributeValue(null, "uuid");
            if (uuid == null) {
                throw new CorruptionException(partName, "Root element of " + partName + " has no uuid attribute");
            }
            Oid oid = parseOid(uuid, partName, "uuid");

            Citation citation = null;
            List<String[]> extra = new ArrayList<>();
            MetadataDocument pending = new MetadataDocument(oid, type, Citation.of("pending"));

            while (r.nextTag() == XMLStreamConstants.START_ELEMENT) {
                String name = r.getLocalName();
                if ("Citation".equals(name) && EML_NS.equals(r.getNamespaceURI())) {
                    citation = readCitation(r, partName);
                } else if ("ExtraMetadata".equals(name)) {
                    extra.add(readNameValue(r, partName));
                } else {
                    String xsiType = r.getAttributeValue(XSI_NS, "type");
                    if (xsiType != null && xsiType.endsWith("DataObjectReference")) {
                        pending.addReference(name, readReference(r, partName, name));
                    } else if (xsiType != null && xsiType.endsWith("ExternalArray")) {
                        pending.setArray(name, readArray(r, partName, name));
                    } else {
                        String value = readText(r, partName, name);
                        if (pending.getFields().containsKey(name)) {
                            throw new CorruptionException(partName, "Field " + name + " repeated in " + partName);
                        }
                        pending.setField(name, value);
                    }
                }
            }
            if (citation == null) {
                throw new CorruptionException(partName, "Missing eml:Citation in " + partName);
            }
            pending.setCitation(citation);
            for (String[] pair : extra) {
                pending.putExtraMetadata(pair[0], pair[1]);
            }
            return pending;
        } catch (XMLStreamException e) {
            throw new CorruptionException(partName, "Malformed XML in " + partName + ": " + e.getMessage(), e);
        } finally {
            if (r != null) {
                try {
                    r.close();
                } catch (XMLStreamException e) {
                    log.debug("Failed to close XML reader for {}", partName, e);
                }
            }
        }
    }

    private static void writeCitation(XMLStreamWriter w, Citation citation) throws XMLStreamException {
        w.writeStartElement("eml", "Citation", EML_NS);
        textElement(w, "eml", EML_NS, "Title", citation.getTitle());
        textElement(w, "eml", EML_NS, "Originator", citation.getOriginator());
        textElement(w, "eml", EML_NS, "Creation", citation.getCreation().toString());
        textElement(w, "eml", EML_NS, "Format", citation.getFormat());
        if (citation.getLastUpdate() != null) {
            textElement(w, "eml", EML_NS, "LastUpdate", citation.getLastUpdate().toString());
        }
        if (citation.getDescription() != null) {
            textElement(w, "eml", EML_NS, "Description", citation.getDescription());
        }
        if (citation.getVersionString() != null) {
            textElement(w, "eml", EML_NS, "VersionString", citation.getVersionString());
        }
        w.writeEndElement();
    }

    private static void textElement(XMLStreamWriter w, String prefix, String ns, String name, String text)
            throws XMLStreamException {
        w.writeStartElement(prefix, name, ns);
        writeText(w, text);
        w.writeEndElement();
    }

    /**
     * Writes carriage returns as {@code &#13;}; a literal one would be read
     * back as a line feed.
     */
    private static void writeText(XMLStreamWriter w, String text) throws XMLStreamException {
        int start = 0;
        for (int i = text.indexOf('\r'); i >= 0; i = text.indexOf('\r', start)) {
            if (i > start) {
                w.writeCharacters(text.substring(start, i));
            }
            w.writeEntityRef("#13");
            start = i + 1;
        }
        if (start < text.length()) {
            w.writeCharacters(text.substring(start));
        }
    }

    private Citation readCitation(XMLStreamReader r, String partName) throws XMLStreamException, CorruptionException {
        Citation.Builder builder = Citation.builder();
        while (r.nextTag() == XMLStreamConstants.START_ELEMENT) {
            String name = r.getLocalName();
            String text = readText(r, partName, "Citation." + name);
            switch (name) {
                case "Title":
                    builder.title(text);
                    break;
                case "Originator":
                    builder.originator(text);
                    break;
                case "Creation":
                    builder.creation(parseInstant(text, partName, "Citation.Creation"));
                    break;
                case "LastUpdate":
                    builder.lastUpdate(parseInstant(text, partName, "Citation.LastUpdate"));
                    break;
                case "Format":
                    builder.format(text);
                    break;
                case "Description":
                    builder.description(text);
                    break;
                case "VersionString":
                    builder.versionString(text);
                    break;
                default:
                    // other citation elements of the standard are not modelled
                    break;
            }
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new CorruptionException(partName, "Invalid citation in " + partName + ": " + e.getMessage(), e);
        }
    }

    private String[] readNameValue(XMLStreamReader r, String partName) throws XMLStreamException, CorruptionException {
        String key = null;
        String value = null;
        while (r.nextTag() == XMLStreamConstants.START_ELEMENT) {
            String name = r.getLocalName();
            String text = readText(r, partName, "ExtraMetadata." + name);
            if ("Name".equals(name)) {
                key = text;
            } else if ("Value".equals(name)) {
                value = text;
            }
        }
        if (key == null || value == null) {
            throw new CorruptionException(partName, "Incomplete ExtraMetadata entry in " + partName);
        }
        return new String[] { key, value };
    }

    private Oid readReference(XMLStreamReader r, String partName, String field)
            throws XMLStreamException, CorruptionException {
        String uuid = null;
        while (r.nextTag() == XMLStreamConstants.START_ELEMENT) {
            String name = r.getLocalName();
            String text = readText(r, partName, field + "." + name);
            if ("UUID".equals(name)) {
                uuid = text;
            }
        }
        if (uuid == null) {
            throw new CorruptionException(partName, "Reference " + field + " in " + partName + " has no UUID");
        }
        return parseOid(uuid, partName, field);
    }

    private ArrayHandle readArray(XMLStreamReader r, String partName, String field)
            throws XMLStreamException, CorruptionException {
        String arrayName = field;
        String shape = null;
        String elementType = null;
        String path = null;
        String compression = null;
        String checksum = null;
        while (r.nextTag() == XMLStreamConstants.START_ELEMENT) {
            String name = r.getLocalName();
            String text = readText(r, partName, field + "." + name);
            switch (name) {
                case "ArrayName":
                    arrayName = text;
                    break;
                case "Shape":
                    shape = text;
                    break;
                case "ElementType":
                    elementType = text;
                    break;
                case "PathInExternalFile":
                    path = text;
                    break;
                case "Compression":
                    compression = text;
                    break;
                case "Checksum":
                    checksum = text;
                    break;
                default:
                    throw new CorruptionException(partName, "Unexpected element " + name + " in array " + field
                            + " of " + partName);
            }
        }
        if (shape == null || elementType == null || path == null) {
            throw new CorruptionException(partName, "Array " + field + " in " + partName
                    + " lacks Shape, ElementType or PathInExternalFile");
        }
        try {
            return new ArrayHandle(arrayName, parseShape(shape), ElementType.fromString(elementType), path,
                    compression != null ? Compression.fromString(compression) : Compression.NONE, checksum);
        } catch (IllegalArgumentException e) {
            throw new CorruptionException(partName, "Invalid array " + field + " in " + partName + ": "
                    + e.getMessage(), e);
        }
    }

    private static String readText(XMLStreamReader r, String partName, String field)
            throws XMLStreamException, CorruptionException {
        try {
            return r.getElementText();
        } catch (XMLStreamException e) {
            throw new CorruptionException(partName, "Field " + field + " of " + partName
                    + " has nested content where text was expected", e);
        }
    }

    private static Oid parseOid(String text, String partName, String field) throws CorruptionException {
        try {
            return Oid.parse(text);
        } catch (IllegalArgumentException e) {
            throw new CorruptionException(partName, "Invalid UUID '" + text + "' at " + field + " in " + partName, e);
        }
    }

    private static Instant parseInstant(String text, String partName, String field) throws CorruptionException {
        try {
            return Instant.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new CorruptionException(partName, "Invalid timestamp '" + text + "' at " + field + " in "
                    + partName, e);
        }
    }

    static String joinShape(int[] shape) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < shape.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(shape[i]);
        }
        return sb.toString();
    }

    static int[] parseShape(String text) {
        String[] parts = text.trim().split("\\s+");
        int[] shape = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            shape[i] = Integer.parseInt(parts[i]);
        }
        return shape;
    }
}
