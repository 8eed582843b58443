package com.eainde.flowconverter.state;

import java.util.regex.Pattern;

/**
 * Guesses a {@link FieldType} from the source text of a Python value expression.
 */
public final class ValueShapes {

    private static final Pattern BOOLEAN_TOKEN = Pattern.compile("\\b(True|False|true|false)\\b");
    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^-?\\d+\\.\\d+$");

    private ValueShapes() {}

    public static FieldType typeOf(String valueText) {
        if (valueText == null) {
            return FieldType.STRING;
        }
        String value = stripTrailer(valueText);

        if (isQuoted(value)) {
            return FieldType.STRING;
        }
        if ((value.startsWith("[") && value.endsWith("]")) || value.startsWith("list(")) {
            return FieldType.LIST;
        }
        if ((value.startsWith("{") && value.endsWith("}")) || value.startsWith("dict(")) {
            return FieldType.MAP;
        }
        if (BOOLEAN_TOKEN.matcher(value).find()) {
            return FieldType.BOOLEAN;
        }
        if (INTEGER.matcher(value).matches()) {
            return FieldType.INTEGER;
        }
        if (DECIMAL.matcher(value).matches()) {
            return FieldType.FLOAT;
        }
        return FieldType.STRING;
    }

    /** Drops a trailing {@code # comment} and {@code ;} outside string literals. */
    static String stripTrailer(String valueText) {
        String value = valueText.strip();
        char quote = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '#') {
                value = value.substring(0, i).strip();
                break;
            }
        }
        while (value.endsWith(";")) {
            value = value.substring(0, value.length() - 1).strip();
        }
        return value;
    }

    private static boolean isQuoted(String value) {
        if (value.length() < 2) {
            return false;
        }
        char first = value.charAt(0);
        return (first == '"' || first == '\'') && value.charAt(value.length() - 1) == first;
    }
}
