package resqpack.core.objects.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import resqpack.core.identity.Citation;
import resqpack.core.metadata.DocumentSchema;
import resqpack.core.metadata.FieldSpec;
import resqpack.core.metadata.MetadataDocument;
import resqpack.core.metadata.ValidationError;
import resqpack.core.objects.AbstractResqObject;
import resqpack.core.objects.ObjectKind;

/**
 * Integer to text lookup used by categorical properties. The table is held in
 * the {@code Table} field, one {@code key=value} entry per line.
 */
public final class StringTableLookup extends AbstractResqObject {
    public static final String TYPE = "StringTableLookup";

    public static final DocumentSchema SCHEMA = DocumentSchema.builder(TYPE)
            .field(FieldSpec.string("Table").required())
            .rule(StringTableLookup::checkTable)
            .build();

    public static final ObjectKind<StringTableLookup> KIND =
            new ObjectKind<>(StringTableLookup.class, SCHEMA, StringTableLookup::new);

    public StringTableLookup(MetadataDocument document) {
        super(document, SCHEMA);
    }

    public static MetadataDocument draft(String title, Map<Long, String> table) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Long, String> entry : table.entrySet()) {
            String value = entry.getValue();
            if (value.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("Lookup value for key " + entry.getKey() + " contains a newline");
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(entry.getKey()).append('=').append(value);
        }
        return new MetadataDocument(TYPE, Citation.of(title)).setField("Table", sb.toString());
    }

    public Map<Long, String> getTable() {
        Map<Long, String> table = new LinkedHashMap<>();
        parse(stringField("Table"), table, new ArrayList<>());
        return Collections.unmodifiableMap(table);
    }

    public String lookup(long key) {
        return getTable().get(key);
    }

    private static void parse(String text, Map<Long, String> table, List<String> problems) {
        for (String line : text.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                problems.add("Entry '" + line + "' is not key=value");
                continue;
            }
            try {
                long key = Long.parseLong(line.substring(0, eq).trim());
                if (table.put(key, line.substring(eq + 1)) != null) {
                    problems.add("Key " + key + " occurs more than once");
                }
            } catch (NumberFormatException e) {
                problems.add("Key '" + line.substring(0, eq) + "' is not an integer");
            }
        }
    }

    private static List<ValidationError> checkTable(MetadataDocument doc) {
        List<String> problems = new ArrayList<>();
        parse(doc.getField("Table"), new LinkedHashMap<>(), problems);
        List<ValidationError> errors = new ArrayList<>();
        String oid = doc.getOid() != null ? doc.getOid().toString() : null;
        for (String problem : problems) {
            errors.add(new ValidationError(ValidationError.Kind.INVALID_VALUE, oid, null, "Table", problem));
        }
        return errors;
    }
}
