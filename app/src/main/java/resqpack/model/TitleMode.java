package resqpack.model;

import java.util.Locale;

/**
 * How a citation title is compared with a pattern in part queries.
 */
public enum TitleMode {
    EQUALS(false),
    STARTS(false),
    ENDS(false),
    CONTAINS(false),
    NOT_EQUALS(true),
    NOT_STARTS(true),
    NOT_ENDS(true),
    NOT_CONTAINS(true);

    private final boolean negated;

    TitleMode(boolean negated) {
        this.negated = negated;
    }

    public boolean isNegated() {
        return negated;
    }

    public boolean matches(String title, String pattern, boolean caseSensitive) {
        if (title == null) {
            return negated;
        }
        String t = caseSensitive ? title : title.toLowerCase(Locale.ROOT);
        String p = caseSensitive ? pattern : pattern.toLowerCase(Locale.ROOT);
        boolean hit;
        switch (this) {
            case EQUALS:
            case NOT_EQUALS:
                hit = t.equals(p);
                break;
            case STARTS:
            case NOT_STARTS:
                hit = t.startsWith(p);
                break;
            case ENDS:
            case NOT_ENDS:
                hit = t.endsWith(p);
                break;
            default:
                hit = t.contains(p);
                break;
        }
        return hit != negated;
    }
}
