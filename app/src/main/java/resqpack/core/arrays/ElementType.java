package resqpack.core.arrays;

/**
 * Element types an external array may hold. Payload bytes are always little
 * endian; booleans take one byte each.
 */
public enum ElementType {
    FLOAT64("float64", 1, 8, true),
    FLOAT32("float32", 2, 4, true),
    INT64("int64", 3, 8, false),
    INT32("int32", 4, 4, false),
    INT16("int16", 5, 2, false),
    INT8("int8", 6, 1, false),
    UINT8("uint8", 7, 1, false),
    BOOL("bool", 8, 1, false);

    private final String typeName;
    private final int code;
    private final int byteSize;
    private final boolean floatingPoint;

    ElementType(String typeName, int code, int byteSize, boolean floatingPoint) {
        this.typeName = typeName;
        this.code = code;
        this.byteSize = byteSize;
        this.floatingPoint = floatingPoint;
    }

    public String getTypeName() {
        return typeName;
    }

    public int getCode() {
        return code;
    }

    public int getByteSize() {
        return byteSize;
    }

    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    public static ElementType fromString(String type) {
        for (ElementType elementType : values()) {
            if (elementType.typeName.equals(type)) {
                return elementType;
            }
        }
        throw new IllegalArgumentException("Unknown element type: " + type);
    }

    public static ElementType fromCode(int code) {
        for (ElementType elementType : values()) {
            if (elementType.code == code) {
                return elementType;
            }
        }
        throw new IllegalArgumentException("Unknown element type code: " + code);
    }
}
