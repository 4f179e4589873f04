package resqpack.core.container;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import javax.xml.stream.XMLStreamWriter;

import resqpack.exceptions.CorruptionException;

/**
 * The {@code [Content_Types].xml} part: content type per file extension plus
 * overrides per part.
 */
public final class ContentTypes {
    public static final String NAMESPACE = "http://schemas.openxmlformats.org/package/2006/content-types";
    public static final String RELATIONSHIPS_TYPE = "application/vnd.openxmlformats-package.relationships+xml";
    public static final String CORE_PROPERTIES_TYPE = "application/vnd.openxmlformats-package.core-properties+xml";
    public static final String XML_TYPE = "application/xml";
    public static final String ARRAY_TYPE = "application/x-resqpack-array";

    private final Map<String, String> defaults = new LinkedHashMap<>();
    private final Map<String, String> overrides = new LinkedHashMap<>();

    /**
     * Content types with the defaults every container carries.
     */
    public static ContentTypes standard() {
        ContentTypes types = new ContentTypes();
        types.addDefault("rels", RELATIONSHIPS_TYPE);
        types.addDefault("xml", XML_TYPE);
        types.addDefault("bin", ARRAY_TYPE);
        types.addOverride(ContainerLayout.CORE_PROPERTIES, CORE_PROPERTIES_TYPE);
        return types;
    }

    public void addDefault(String extension, String contentType) {
        defaults.put(extension.toLowerCase(Locale.ROOT), contentType);
    }

    public void addOverride(String partName, String contentType) {
        overrides.put(partName, contentType);
    }

    public Map<String, String> getOverrides() {
        return Collections.unmodifiableMap(overrides);
    }

    /**
     * Content type of {@code partName}: its override, else the default for
     * its extension.
     */
    public Optional<String> typeOf(String partName) {
        String override = overrides.get(partName);
        if (override != null) {
            return Optional.of(override);
        }
        int dot = partName.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(defaults.get(partName.substring(dot + 1).toLowerCase(Locale.ROOT)));
    }

    /**
     * Object type encoded in a RESQML content type ({@code ...;type=obj_X}),
     * if any.
     */
    public static Optional<String> objectType(String contentType) {
        for (String param : contentType.split(";")) {
            String trimmed = param.trim();
            if (trimmed.startsWith("type=")) {
                String value = trimmed.substring("type=".length());
                return Optional.of(value.startsWith("obj_") ? value.substring(4) : value);
            }
        }
        return Optional.empty();
    }

    public byte[] encode() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            XMLStreamWriter w = XMLOutputFactory.newInstance().createXMLStreamWriter(out, "UTF-8");
            w.writeStartDocument("UTF-8", "1.0");
            w.writeStartElement("Types");
            w.writeDefaultNamespace(NAMESPACE);
            for (Map.Entry<String, String> entry : defaults.entrySet()) {
                w.writeEmptyElement("Default");
                w.writeAttribute("Extension", entry.getKey());
                w.writeAttribute("ContentType", entry.getValue());
            }
            for (Map.Entry<String, String> entry : overrides.entrySet()) {
                w.writeEmptyElement("Override");
                w.writeAttribute("PartName", "/" + entry.getKey());
                w.writeAttribute("ContentType", entry.getValue());
            }
            w.writeEndElement();
            w.writeEndDocument();
            w.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to serialize content types", e);
        }
        return out.toByteArray();
    }

    public static ContentTypes decode(InputStream in) throws CorruptionException {
        ContentTypes types = new ContentTypes();
        try {
            XMLInputFactory factory = XMLInputFactory.newInstance();
            factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
            XMLStreamReader r = factory.createXMLStreamReader(in);
            while (r.hasNext()) {
                if (r.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                String contentType = r.getAttributeValue(null, "ContentType");
                if ("Default".equals(r.getLocalName())) {
                    types.addDefault(require(r, "Extension"), require(contentType, "ContentType"));
                } else if ("Override".equals(r.getLocalName())) {
                    String partName = require(r, "PartName");
                    types.addOverride(partName.startsWith("/") ? partName.substring(1) : partName,
                            require(contentType, "ContentType"));
                }
            }
            r.close();
        } catch (XMLStreamException e) {
            throw new CorruptionException(ContainerLayout.CONTENT_TYPES,
                    "Malformed " + ContainerLayout.CONTENT_TYPES + ": " + e.getMessage(), e);
        }
        return types;
    }

    private static String require(XMLStreamReader r, String attribute) throws CorruptionException {
        return require(r.getAttributeValue(null, attribute), attribute);
    }

    private static String require(String value, String attribute) throws CorruptionException {
        if (value == null) {
            throw new CorruptionException(ContainerLayout.CONTENT_TYPES,
                    "Missing " + attribute + " attribute in " + ContainerLayout.CONTENT_TYPES);
        }
        return value;
    }
}
