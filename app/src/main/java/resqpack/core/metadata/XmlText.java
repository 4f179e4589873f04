package resqpack.core.metadata;

import java.util.Set;

/**
 * What the XML metadata form can carry: field names become element names and
 * text goes into element content.
 */
final class XmlText {
    /** Element names the codec uses for its own structure. */
    static final Set<String> RESERVED_NAMES = Set.of("Citation", "ExtraMetadata");

    private XmlText() {
    }

    /**
     * Whether {@code name} is a non-colonized XML name, usable as a local
     * element name.
     */
    static boolean isElementName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        int first = name.codePointAt(0);
        if (!isNameStart(first)) {
            return false;
        }
        for (int i = Character.charCount(first); i < name.length();) {
            int cp = name.codePointAt(i);
            if (!isNameStart(cp) && !isNamePart(cp)) {
                return false;
            }
            i += Character.charCount(cp);
        }
        return true;
    }

    private static boolean isNameStart(int cp) {
        return cp == '_' || Character.isLetter(cp);
    }

    private static boolean isNamePart(int cp) {
        if (cp == '-' || cp == '.' || cp == 0xB7 || Character.isDigit(cp)) {
            return true;
        }
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK || type == Character.COMBINING_SPACING_MARK
                || type == Character.LETTER_NUMBER;
    }

    /**
     * Index of the first character XML 1.0 cannot represent, or -1. Lone
     * surrogates count as such characters.
     */
    static int firstIllegalChar(String text) {
        for (int i = 0; i < text.length();) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < text.length()
                    && Character.isLowSurrogate(text.charAt(i + 1))) {
                i += 2;
                continue;
            }
            boolean legal = c == 0x9 || c == 0xA || c == 0xD
                    || (c >= 0x20 && c <= 0xD7FF)
                    || (c >= 0xE000 && c <= 0xFFFD);
            if (!legal) {
                return i;
            }
            i++;
        }
        return -1;
    }
}
