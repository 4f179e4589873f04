package resqpack.core.container;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

import resqpack.core.arrays.ArrayHandle;
import resqpack.core.identity.Oid;

// @formatter:off
/**
 * Names of the parts inside a container.
 *
 * ┌─ package.epc ───────────────────────────────────────────┐
 * │ [Content_Types].xml                                     │
 * │ _rels/.rels                     ← package relationships  │
 * │ docProps/core.xml               ← core properties        │
 * │ obj_IjkGridRepresentation_<uuid>.xml                     │
 * │ _rels/obj_IjkGridRepresentation_<uuid>.xml.rels          │
 * │ sub/obj_A.xml, sub/_rels/obj_A.xml.rels  ← nested part   │
 * │ arrays/<uuid>/<name>.bin        ← array payloads         │
 * └─────────────────────────────────────────────────────────┘
 */
// @formatter:on
public final class ContainerLayout {
    public static final String CONTENT_TYPES = "[Content_Types].xml";
    public static final String ROOT_RELATIONSHIPS = "_rels/.rels";
    public static final String CORE_PROPERTIES = "docProps/core.xml";
    public static final String RELS_DIR = "_rels/";
    public static final String RELS_SUFFIX = ".rels";
    public static final String METADATA_SUFFIX = ".xml";

    private ContainerLayout() {
    }

    public static String defaultPartName(String type, Oid oid) {
        return "obj_" + type + "_" + oid + METADATA_SUFFIX;
    }

    /**
     * Relationships part of {@code partName}, in a {@code _rels} folder beside
     * it: {@code sub/crs.xml} has {@code sub/_rels/crs.xml.rels}.
     */
    public static String relationshipsPartFor(String partName) {
        int slash = partName.lastIndexOf('/');
        String dir = partName.substring(0, slash + 1);
        String file = partName.substring(slash + 1);
        return dir + RELS_DIR + file + RELS_SUFFIX;
    }

    /**
     * True for entries holding an object's metadata document.
     */
    public static boolean isMetadataPart(String entryName) {
        if (!entryName.toLowerCase(Locale.ROOT).endsWith(METADATA_SUFFIX)) {
            return false;
        }
        return !entryName.equals(CONTENT_TYPES)
                && !entryName.equals(CORE_PROPERTIES)
                && !entryName.startsWith(RELS_DIR)
                && !entryName.contains("/" + RELS_DIR)
                && !entryName.startsWith(ArrayHandle.PATH_PREFIX);
    }

    public static boolean isArrayPart(String entryName) {
        return entryName.startsWith(ArrayHandle.PATH_PREFIX) && entryName.endsWith(ArrayHandle.PATH_SUFFIX);
    }

    /**
     * Checks a part name chosen by a caller.
     *
     * @throws IllegalArgumentException if the name cannot be used for a
     *                                  metadata part
     */
    public static void requireValidPartName(String partName) {
        if (partName == null || partName.isBlank()) {
            throw new IllegalArgumentException("Part name cannot be null or blank");
        }
        if (partName.startsWith("/") || partName.contains("\\") || partName.contains("..")
                || partName.contains("//")) {
            throw new IllegalArgumentException("Invalid part name: " + partName);
        }
        if (!isMetadataPart(partName)) {
            throw new IllegalArgumentException("Part name " + partName
                    + " must end in .xml and lie outside the reserved _rels, docProps and arrays locations");
        }
    }

    /**
     * Relative target of a relationship from {@code sourcePart} to
     * {@code targetPart}. Parts in the root resolve to their own name.
     */
    public static String relativeTarget(String sourcePart, String targetPart) {
        int slash = sourcePart.lastIndexOf('/');
        if (slash < 0) {
            return targetPart;
        }
        String dir = sourcePart.substring(0, slash + 1);
        if (targetPart.startsWith(dir)) {
            return targetPart.substring(dir.length());
        }
        StringBuilder up = new StringBuilder();
        for (int i = 0; i < dir.length(); i++) {
            if (dir.charAt(i) == '/') {
                up.append("../");
            }
        }
        return up + targetPart;
    }

    /**
     * Inverse of {@link #relativeTarget}.
     */
    public static String resolveTarget(String sourcePart, String target) {
        if (target.startsWith("/")) {
            return target.substring(1);
        }
        int slash = sourcePart.lastIndexOf('/');
        String base = slash < 0 ? "" : sourcePart.substring(0, slash + 1);
        String joined = base + target;
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : joined.split("/")) {
            if (segment.equals("..")) {
                if (!segments.isEmpty()) {
                    segments.removeLast();
                }
            } else if (!segment.isEmpty() && !segment.equals(".")) {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }
}
