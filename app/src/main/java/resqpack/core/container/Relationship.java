package resqpack.core.container;

import java.util.Objects;

/**
 * One relationship of a part: a typed link to another part, identified within
 * its relationships part by {@code id}.
 */
public final class Relationship {
    public static final String DESTINATION_OBJECT =
            "http://schemas.energistics.org/package/2012/relationships/destinationObject";
    public static final String SOURCE_OBJECT =
            "http://schemas.energistics.org/package/2012/relationships/sourceObject";
    public static final String EXTERNAL_RESOURCE =
            "http://schemas.energistics.org/package/2012/relationships/externalResource";
    public static final String CORE_PROPERTIES =
            "http://schemas.openxmlformats.org/package/2006/relationships/metadata/core-properties";

    private final String id;
    private final String type;
    private final String target;

    public Relationship(String id, String type, String target) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.target = Objects.requireNonNull(target, "target");
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    /**
     * Target as written, relative to the source part's directory.
     */
    public String getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        Relationship other = (Relationship) obj;
        return id.equals(other.id) && type.equals(other.type) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, target);
    }

    @Override
    public String toString() {
        return id + " " + type.substring(type.lastIndexOf('/') + 1) + " -> " + target;
    }
}
