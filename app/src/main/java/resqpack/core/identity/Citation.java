package resqpack.core.identity;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Citation block carried by every data object: who made it, when, and under
 * what title.
 */
public final class Citation {
    public static final String DEFAULT_FORMAT = "resqpack";
    public static final String DEFAULT_ORIGINATOR = "resqpack";

    private final String title;
    private final String originator;
    private final Instant creation;
    private final Instant lastUpdate;
    private final String format;
    private final String description;
    private final String versionString;

    private Citation(Builder builder) {
        if (builder.title == null || builder.title.isBlank()) {
            throw new IllegalArgumentException("Citation title cannot be null or blank");
        }
        this.title = builder.title;
        this.originator = builder.originator != null ? builder.originator : DEFAULT_ORIGINATOR;
        this.creation = truncate(builder.creation != null ? builder.creation : Instant.now());
        this.lastUpdate = builder.lastUpdate != null ? truncate(builder.lastUpdate) : null;
        this.format = builder.format != null ? builder.format : DEFAULT_FORMAT;
        this.description = builder.description;
        this.versionString = builder.versionString;
    }

    public static Citation of(String title) {
        return builder().title(title).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .title(title)
                .originator(originator)
                .creation(creation)
                .lastUpdate(lastUpdate)
                .format(format)
                .description(description)
                .versionString(versionString);
    }

    public Citation withTitle(String newTitle) {
        return toBuilder().title(newTitle).build();
    }

    /**
     * Copy with the last update time set to {@code when}.
     */
    public Citation touched(Instant when) {
        return toBuilder().lastUpdate(when).build();
    }

    public String getTitle() {
        return title;
    }

    public String getOriginator() {
        return originator;
    }

    public Instant getCreation() {
        return creation;
    }

    /**
     * May be null when the object was never modified after creation.
     */
    public Instant getLastUpdate() {
        return lastUpdate;
    }

    public String getFormat() {
        return format;
    }

    public String getDescription() {
        return description;
    }

    public String getVersionString() {
        return versionString;
    }

    // xsd:dateTime in the container carries whole seconds
    private static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        Citation other = (Citation) obj;
        return title.equals(other.title)
                && originator.equals(other.originator)
                && creation.equals(other.creation)
                && Objects.equals(lastUpdate, other.lastUpdate)
                && format.equals(other.format)
                && Objects.equals(description, other.description)
                && Objects.equals(versionString, other.versionString);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, originator, creation, lastUpdate, format, description, versionString);
    }

    @Override
    public String toString() {
        return "Citation{title=" + title + ", originator=" + originator + ", creation=" + creation + "}";
    }

    public static final class Builder {
        private String title;
        private String originator;
        private Instant creation;
        private Instant lastUpdate;
        private String format;
        private String description;
        private String versionString;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder originator(String originator) {
            this.originator = originator;
            return this;
        }

        public Builder creation(Instant creation) {
            this.creation = creation;
            return this;
        }

        public Builder lastUpdate(Instant lastUpdate) {
            this.lastUpdate = lastUpdate;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder versionString(String versionString) {
            this.versionString = versionString;
            return this;
        }

        public Citation build() {
            return new Citation(this);
        }
    }
}
