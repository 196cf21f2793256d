package com.querysmith.model.filter;

import com.querysmith.model.InvalidPatternException;

import java.util.Locale;

/**
 * A constant value inside an expression.
 *
 * @param lexical the lexical form, unescaped and without quotes or brackets
 * @param type the value kind
 * @param datatype datatype IRI of a typed string, or null
 * @param language language tag of a string, or null
 */
public record LiteralExpression(String lexical, ValueType type, String datatype, String language)
    implements FilterExpression {

    /** Datatype IRI of {@link ValueType#DATE_TIME} literals. */
    public static final String XSD_DATE_TIME = "http://www.w3.org/2001/XMLSchema#dateTime";

    /**
     * Creates a literal.
     *
     * @param lexical the lexical form
     * @param type the value kind
     * @param datatype the datatype IRI, or null
     * @param language the language tag, or null
     */
    public LiteralExpression {
        if (lexical == null) {
            throw new InvalidPatternException("Literal value cannot be null");
        }
        if (type == null) {
            throw new InvalidPatternException("Literal type cannot be null");
        }
        if (datatype != null && language != null) {
            throw new InvalidPatternException("A literal cannot have both a datatype and a language tag");
        }
    }

    @Override
    public String toSparql() {
        return switch (type) {
            case NUMBER -> lexical;
            case BOOLEAN -> lexical.toLowerCase(Locale.ROOT);
            case IRI -> "<" + lexical + ">";
            case DATE_TIME -> quote(lexical) + "^^<" + XSD_DATE_TIME + ">";
            case STRING -> stringForm();
        };
    }

    private String stringForm() {
        if (language != null) {
            return quote(lexical) + "@" + language;
        }
        if (datatype != null) {
            return quote(lexical) + "^^<" + datatype + ">";
        }
        return quote(lexical);
    }

    private static String quote(final String value) {
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }
}
