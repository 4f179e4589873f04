package resqpack.core.arrays;

/**
 * Compression marker of an array payload. Maps onto the zip entry method of
 * the payload part.
 */
public enum Compression {
    NONE("none"),
    DEFLATE("deflate");

    private final String marker;

    Compression(String marker) {
        this.marker = marker;
    }

    public String getMarker() {
        return marker;
    }

    public static Compression fromString(String marker) {
        for (Compression compression : values()) {
            if (compression.marker.equalsIgnoreCase(marker)) {
                return compression;
            }
        }
        throw new IllegalArgumentException("Unknown compression: " + marker);
    }
}
