package resqpack.core.identity;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Object identifier. A random (version 4) UUID, the identifier scheme RESQML
 * uses for its data objects; immutable and stable across save/load cycles.
 */
public final class Oid implements Comparable<Oid> {
    private final UUID uuid;

    private Oid(UUID uuid) {
        this.uuid = Objects.requireNonNull(uuid, "uuid");
    }

    public static Oid random() {
        return new Oid(UUID.randomUUID());
    }

    public static Oid of(UUID uuid) {
        return new Oid(uuid);
    }

    /**
     * Parses the canonical 36 character form, with or without surrounding braces.
     *
     * @throws IllegalArgumentException if the text is not a UUID
     */
    public static Oid parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("OID cannot be null or blank");
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        if (trimmed.length() != 36) {
            throw new IllegalArgumentException("Invalid OID: " + text);
        }
        return new Oid(UUID.fromString(trimmed.toLowerCase(Locale.ROOT)));
    }

    public UUID getUuid() {
        return uuid;
    }

    @Override
    public int compareTo(Oid other) {
        return uuid.toString().compareTo(other.uuid.toString());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        return uuid.equals(((Oid) obj).uuid);
    }

    @Override
    public int hashCode() {
        return uuid.hashCode();
    }

    @Override
    public String toString() {
        return uuid.toString();
    }
}
