package resqpack.core.container;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import javax.xml.stream.XMLStreamWriter;

import resqpack.exceptions.CorruptionException;

/**
 * Content of a {@code .rels} part: the relationships of one source part, or
 * of the package itself.
 */
public final class Relationships {
    public static final String NAMESPACE = "http://schemas.openxmlformats.org/package/2006/relationships";

    private final String sourcePart;
    private final List<Relationship> relationships = new ArrayList<>();

    /**
     * @param sourcePart part the relationships belong to, empty for the
     *                   package relationships
     */
    public Relationships(String sourcePart) {
        this.sourcePart = sourcePart;
    }

    public String getSourcePart() {
        return sourcePart;
    }

    /**
     * Adds a relationship to {@code targetPart}, which is given relative to
     * the container root.
     */
    public Relationships add(String type, String targetPart) {
        String target = sourcePart.isEmpty() ? targetPart : ContainerLayout.relativeTarget(sourcePart, targetPart);
        relationships.add(new Relationship("_" + (relationships.size() + 1), type, target));
        return this;
    }

    public List<Relationship> all() {
        return Collections.unmodifiableList(relationships);
    }

    public boolean isEmpty() {
        return relationships.isEmpty();
    }

    /**
     * Root-relative part names targeted by relationships of {@code type}.
     */
    public Set<String> targets(String type) {
        Set<String> result = new LinkedHashSet<>();
        for (Relationship relationship : relationships) {
            if (relationship.getType().equals(type)) {
                result.add(sourcePart.isEmpty() ? relationship.getTarget()
                        : ContainerLayout.resolveTarget(sourcePart, relationship.getTarget()));
            }
        }
        return result;
    }

    public byte[] encode() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            XMLStreamWriter w = XMLOutputFactory.newInstance().createXMLStreamWriter(out, "UTF-8");
            w.writeStartDocument("UTF-8", "1.0");
            w.writeStartElement("Relationships");
            w.writeDefaultNamespace(NAMESPACE);
            for (Relationship relationship : relationships) {
                w.writeEmptyElement("Relationship");
                w.writeAttribute("Id", relationship.getId());
                w.writeAttribute("Type", relationship.getType());
                w.writeAttribute("Target", relationship.getTarget());
            }
            w.writeEndElement();
            w.writeEndDocument();
            w.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to serialize relationships of " + sourcePart, e);
        }
        return out.toByteArray();
    }

    /**
     * Parses the relationships part {@code relsPart} belonging to
     * {@code sourcePart}.
     */
    public static Relationships decode(InputStream in, String sourcePart, String relsPart)
            throws CorruptionException {
        Relationships result = new Relationships(sourcePart);
        try {
            XMLInputFactory factory = XMLInputFactory.newInstance();
            factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
            XMLStreamReader r = factory.createXMLStreamReader(in);
            while (r.hasNext()) {
                if (r.next() == XMLStreamConstants.START_ELEMENT && "Relationship".equals(r.getLocalName())) {
                    String id = r.getAttributeValue(null, "Id");
                    String type = r.getAttributeValue(null, "Type");
                    String target = r.getAttributeValue(null, "Target");
                    if (id == null || type == null || target == null) {
                        throw new CorruptionException(relsPart, "Relationship without Id, Type or Target in "
                                + relsPart);
                    }
                    result.relationships.add(new Relationship(id, type, target));
                }
            }
            r.close();
        } catch (XMLStreamException e) {
            throw new CorruptionException(relsPart, "Malformed relationships part " + relsPart + ": "
                    + e.getMessage(), e);
        }
        return result;
    }
}
