package info.isaksson.erland.xdlc.parse;

public enum TokenKind {
    OPENING_BRACE("'{'"),
    CLOSING_BRACE("'}'"),
    OPENING_BRACKET("'['"),
    CLOSING_BRACKET("']'"),
    OPENING_PARENTHESIS("'('"),
    CLOSING_PARENTHESIS("')'"),
    SEMICOLON("';'"),
    COLON("':'"),
    PERIOD("'.'"),
    COMMA("','"),
    ASTERISK("'*'"),
    AMPERSAND("'&'"),
    PLUS("'+'"),
    MINUS("'-'"),
    EQUALS("'='"),
    IDENTIFIER("identifier"),
    ENUM("'enum'"),
    STRUCT("'struct'"),
    CLASS("'class'"),
    UNION("'union'"),
    INTERFACE("'interface'"),
    NAMESPACE("'namespace'"),
    CONST("'const'"),
    IMPORT("'import'"),
    STRING_LITERAL("string literal"),
    CHARACTER_LITERAL("character literal"),
    NUMBER("number"),
    UNKNOWN("unknown character");

    private final String description;

    TokenKind(String description) {
        this.description = description;
    }

    /** Human-readable form used in diagnostics. */
    public String description() {
        return description;
    }

    static TokenKind punctuation(char c) {
        return switch (c) {
            case '{' -> OPENING_BRACE;
            case '}' -> CLOSING_BRACE;
            case '[' -> OPENING_BRACKET;
            case ']' -> CLOSING_BRACKET;
            case '(' -> OPENING_PARENTHESIS;
            case ')' -> CLOSING_PARENTHESIS;
            case ';' -> SEMICOLON;
            case ':' -> COLON;
            case '.' -> PERIOD;
            case ',' -> COMMA;
            case '*' -> ASTERISK;
            case '&' -> AMPERSAND;
            case '+' -> PLUS;
            case '-' -> MINUS;
            case '=' -> EQUALS;
            default -> null;
        };
    }

    static TokenKind keywordOrIdentifier(String text) {
        return switch (text) {
            case "enum" -> ENUM;
            case "struct" -> STRUCT;
            case "class" -> CLASS;
            case "union" -> UNION;
            case "interface" -> INTERFACE;
            case "namespace" -> NAMESPACE;
            case "const" -> CONST;
            case "import" -> IMPORT;
            default -> IDENTIFIER;
        };
    }
}
