package info.isaksson.erland.xdlc.parse;

import info.isaksson.erland.xdlc.ast.ArrayType;
import info.isaksson.erland.xdlc.ast.AttributeNode;
import info.isaksson.erland.xdlc.ast.Attributes;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.DeclarationKind;
import info.isaksson.erland.xdlc.ast.EnumMember;
import info.isaksson.erland.xdlc.ast.Expression;
import info.isaksson.erland.xdlc.ast.Field;
import info.isaksson.erland.xdlc.ast.IdentifierExpression;
import info.isaksson.erland.xdlc.ast.ImportDirective;
import info.isaksson.erland.xdlc.ast.IntegerLiteral;
import info.isaksson.erland.xdlc.ast.Member;
import info.isaksson.erland.xdlc.ast.MemberBlock;
import info.isaksson.erland.xdlc.ast.Method;
import info.isaksson.erland.xdlc.ast.NamedType;
import info.isaksson.erland.xdlc.ast.Parameter;
import info.isaksson.erland.xdlc.ast.PointerType;
import info.isaksson.erland.xdlc.ast.ReferenceType;
import info.isaksson.erland.xdlc.ast.SignatureType;
import info.isaksson.erland.xdlc.ast.StringLiteral;
import info.isaksson.erland.xdlc.ast.TypeRef;
import info.isaksson.erland.xdlc.ast.UnaryNegation;
import info.isaksson.erland.xdlc.ast.XdlFile;
import info.isaksson.erland.xdlc.ast.XdlNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Recursive-descent parser for XDL source files.
 *
 * <p>{@link #readNext()} returns top-level items one at a time so a caller can expand an import before the
 * declarations that follow it are read. Every syntax error is fatal.</p>
 */
public final class XdlParser {

    private static final String STATIC = "static";
    private static final String INLINE = "inline";

    private final String sourceName;
    private final Lexer lexer;
    private final Deque<String> namespaces = new ArrayDeque<>();

    public XdlParser(String sourceName, String text) {
        this.sourceName = sourceName;
        this.lexer = new Lexer(sourceName, text);
    }

    /** Parses a whole file; imports are recorded, not followed. */
    public static XdlFile parse(String sourceName, String text) {
        return new XdlParser(sourceName, text).parseAll();
    }

    public XdlFile parseAll() {
        List<ImportDirective> imports = new ArrayList<>();
        List<Declaration> declarations = new ArrayList<>();
        for (XdlNode node = readNext(); node != null; node = readNext()) {
            if (node instanceof ImportDirective i) {
                imports.add(i);
            } else if (node instanceof Declaration d) {
                declarations.add(d);
            }
        }
        return new XdlFile(sourceName, imports, declarations);
    }

    /**
     * Reads the next import or declaration, consuming namespace braces along the way.
     *
     * @return the next node, or {@code null} at end of input
     */
    public XdlNode readNext() {
        while (true) {
            Token first = peek();
            Attributes attributes = readAttributes();
            Token token = peek();

            if (token == null) {
                if (!namespaces.isEmpty()) {
                    throw endOfInput("namespace '" + namespaces.peek() + "' is not closed");
                }
                if (!attributes.isEmpty()) {
                    throw endOfInput("expected a declaration after the attribute list");
                }
                return null;
            }

            if (token.kind() == TokenKind.CLOSING_BRACE && !namespaces.isEmpty()) {
                if (!attributes.isEmpty()) {
                    throw unexpected(first.position(), "attribute list");
                }
                read();
                namespaces.pop();
                continue;
            }

            switch (token.kind()) {
                case ENUM, STRUCT, CLASS, UNION, INTERFACE -> {
                    Declaration declaration = readDeclaration(attributes).withNamespace(currentNamespace());
                    if (declaration.name() == null) {
                        throw new ParseException(sourceName, token.position(), ParseException.Reason.EXPECTED_TOKEN,
                                "top-level " + declaration.kind().keyword() + " must be named");
                    }
                    expect(TokenKind.SEMICOLON);
                    return declaration;
                }
                case NAMESPACE -> {
                    if (!attributes.isEmpty()) throw unexpected(first.position(), "attribute list");
                    readNamespaceStart();
                }
                case IMPORT -> {
                    if (!attributes.isEmpty()) throw unexpected(first.position(), "attribute list");
                    return readImport();
                }
                default -> throw unexpected(token);
            }
        }
    }

    private String currentNamespace() {
        if (namespaces.isEmpty()) return null;
        List<String> parts = new ArrayList<>();
        for (Iterator<String> it = namespaces.descendingIterator(); it.hasNext(); ) {
            parts.add(it.next());
        }
        return String.join(".", parts);
    }

    private ImportDirective readImport() {
        expect(TokenKind.IMPORT);
        Token path = expect(TokenKind.STRING_LITERAL);
        expect(TokenKind.SEMICOLON);
        return new ImportDirective(unquote(path.text()));
    }

    private void readNamespaceStart() {
        expect(TokenKind.NAMESPACE);
        StringBuilder name = new StringBuilder(expect(TokenKind.IDENTIFIER).text());
        while (tryRead(TokenKind.PERIOD) != null) {
            name.append('.').append(expect(TokenKind.IDENTIFIER).text());
        }
        expect(TokenKind.OPENING_BRACE);
        namespaces.push(name.toString());
    }

    // ---------------------------------------------------------------------------------------------
    // Attributes and expressions
    // ---------------------------------------------------------------------------------------------

    private Attributes readAttributes() {
        if (tryRead(TokenKind.OPENING_BRACKET) == null) return Attributes.NONE;

        List<AttributeNode> nodes = new ArrayList<>();
        do {
            for (int i = 0; tryRead(TokenKind.CLOSING_BRACKET) == null; i++) {
                if (i > 0) expect(TokenKind.COMMA);
                String name = expect(TokenKind.IDENTIFIER).text();
                List<Expression> args = new ArrayList<>();
                if (tryRead(TokenKind.OPENING_PARENTHESIS) != null) {
                    for (int j = 0; tryRead(TokenKind.CLOSING_PARENTHESIS) == null; j++) {
                        if (j > 0) expect(TokenKind.COMMA);
                        args.add(readExpression());
                    }
                }
                nodes.add(new AttributeNode(name, args));
            }
        } while (tryRead(TokenKind.OPENING_BRACKET) != null);
        return Attributes.of(nodes);
    }

    private Expression readExpression() {
        Token token = read();
        if (token == null) throw endOfInput("expected an expression");
        return switch (token.kind()) {
            case STRING_LITERAL -> new StringLiteral(unquote(token.text()));
            case MINUS -> new UnaryNegation(readExpression());
            case IDENTIFIER -> new IdentifierExpression(token.text());
            case NUMBER -> new IntegerLiteral(parseInteger(token));
            default -> throw unexpected(token);
        };
    }

    private long parseInteger(Token token) {
        String text = token.text();
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return Long.parseUnsignedLong(text.substring(2), 16);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ParseException(sourceName, token.position(), ParseException.Reason.UNEXPECTED_TOKEN,
                    "'" + text + "' is not an integer constant");
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------------------------------

    private Declaration readDeclaration(Attributes attributes) {
        if (peekIs(TokenKind.ENUM)) return readEnumDeclaration(attributes);

        Token keyword = expect(TokenKind.INTERFACE, TokenKind.STRUCT, TokenKind.CLASS, TokenKind.UNION);
        DeclarationKind kind = switch (keyword.kind()) {
            case INTERFACE -> DeclarationKind.INTERFACE;
            case STRUCT -> DeclarationKind.STRUCT;
            case UNION -> DeclarationKind.UNION;
            default -> DeclarationKind.CLASS;
        };

        Token name = tryRead(TokenKind.IDENTIFIER);
        List<BaseTypeRef> baseTypes = tryRead(TokenKind.COLON) != null ? readBaseTypes() : List.of();

        List<Member> members = List.of();
        boolean hasBody = false;
        if (peekIs(TokenKind.OPENING_BRACE)) {
            members = readMemberBlock();
            hasBody = true;
        }
        return new Declaration(kind, attributes, name == null ? null : name.text(), baseTypes, members, hasBody, false, null);
    }

    private Declaration readEnumDeclaration(Attributes attributes) {
        expect(TokenKind.ENUM);
        Token name = tryRead(TokenKind.IDENTIFIER);
        List<BaseTypeRef> baseTypes = tryRead(TokenKind.COLON) != null ? readBaseTypes() : List.of();

        List<Member> members = new ArrayList<>();
        boolean hasBody = false;
        if (peekIs(TokenKind.OPENING_BRACE)) {
            expect(TokenKind.OPENING_BRACE);
            hasBody = true;
            for (int i = 0; tryRead(TokenKind.CLOSING_BRACE) == null; i++) {
                if (i > 0) expect(TokenKind.COMMA);
                // trailing comma
                if (tryRead(TokenKind.CLOSING_BRACE) != null) break;
                Attributes memberAttributes = readAttributes();
                String memberName = expect(TokenKind.IDENTIFIER).text();
                Expression value = tryRead(TokenKind.EQUALS) != null ? readExpression() : null;
                members.add(new EnumMember(memberAttributes, memberName, value));
            }
        }
        return new Declaration(DeclarationKind.ENUM, attributes, name == null ? null : name.text(), baseTypes, members,
                hasBody, false, null);
    }

    private List<BaseTypeRef> readBaseTypes() {
        List<BaseTypeRef> out = new ArrayList<>();
        do {
            Attributes attributes = readAttributes();
            out.add(new BaseTypeRef(attributes, expect(TokenKind.IDENTIFIER).text()));
        } while (tryRead(TokenKind.COMMA) != null);
        return out;
    }

    private List<Member> readMemberBlock() {
        expect(TokenKind.OPENING_BRACE);
        List<Member> members = new ArrayList<>();
        while (tryRead(TokenKind.CLOSING_BRACE) == null) {
            Attributes attributes = readAttributes();
            if (peekIs(TokenKind.OPENING_BRACE)) {
                members.add(new MemberBlock(attributes, readMemberBlock()));
                continue;
            }
            members.add(readMember(attributes));
            expect(TokenKind.SEMICOLON);
        }
        return members;
    }

    private Member readMember(Attributes attributes) {
        Token start = peek();
        if (start == null) throw endOfInput("expected a member");

        boolean isStatic = false;
        boolean forceInline = false;
        while (true) {
            if (!isStatic && isModifier(STATIC)) {
                read();
                isStatic = true;
            } else if (!forceInline && isModifier(INLINE)) {
                read();
                forceInline = true;
            } else {
                break;
            }
        }

        TypeAndName typed = readType();
        TypeRef type = typed.type;
        String name = typed.name;

        if (type instanceof Declaration) {
            return new Field(attributes, name, type, null, isStatic);
        }

        if (peekIs(TokenKind.OPENING_PARENTHESIS)) {
            requireName(name, start);
            List<Parameter> parameters = readParameterList();
            boolean isConst = tryRead(TokenKind.CONST) != null;
            return new Method(attributes, name, new SignatureType(type, parameters, isConst), isStatic, forceInline);
        }

        if (peekIs(TokenKind.OPENING_BRACKET)) {
            type = readArray(type);
        }

        if (tryRead(TokenKind.COLON) != null) {
            return new Field(attributes, name, type, readExpression(), isStatic);
        }

        requireName(name, start);
        return new Field(attributes, name, type, null, isStatic);
    }

    /**
     * {@code static} and {@code inline} are modifiers only when a type follows that is not itself the member
     * name: in {@code inline Twice(int a);} the word is the return type.
     */
    private boolean isModifier(String word) {
        TextPosition saved = lexer.position();
        try {
            Token first = read();
            if (first == null || first.kind() != TokenKind.IDENTIFIER || !word.equals(first.text())) return false;
            Token second = read();
            if (second == null) return false;
            switch (second.kind()) {
                case IDENTIFIER, CONST, STRUCT, CLASS, UNION, ENUM -> { }
                default -> {
                    return false;
                }
            }
            Token third = read();
            if (third == null) return false;
            return switch (third.kind()) {
                case SEMICOLON, OPENING_PARENTHESIS, OPENING_BRACKET, COLON -> false;
                default -> true;
            };
        } finally {
            lexer.reset(saved);
        }
    }

    private void requireName(String name, Token start) {
        if (name == null || name.isEmpty()) {
            throw new ParseException(sourceName, start.position(), ParseException.Reason.EXPECTED_TOKEN,
                    "expected identifier to name member");
        }
    }

    private record TypeAndName(TypeRef type, String name) {
    }

    private TypeAndName readType() {
        boolean isConst = tryRead(TokenKind.CONST) != null;

        TypeRef type;
        if (peekIs(TokenKind.UNION) || peekIs(TokenKind.STRUCT) || peekIs(TokenKind.CLASS) || peekIs(TokenKind.ENUM)) {
            type = readDeclaration(Attributes.NONE);
        } else {
            type = NamedType.of(expect(TokenKind.IDENTIFIER).text());
        }

        Token secondConst = tryRead(TokenKind.CONST);
        if (secondConst != null) {
            if (isConst) throw unexpected(secondConst);
            isConst = true;
        }
        type = type.withConst(isConst);

        while (true) {
            Token t = tryRead(TokenKind.ASTERISK);
            if (t == null) t = tryRead(TokenKind.AMPERSAND);
            if (t == null) break;
            boolean pointerConst = tryRead(TokenKind.CONST) != null;
            type = t.kind() == TokenKind.ASTERISK
                    ? new PointerType(type, pointerConst)
                    : new ReferenceType(type, pointerConst);
        }

        Token name = tryRead(TokenKind.IDENTIFIER);
        return new TypeAndName(type, name == null ? null : name.text());
    }

    private List<Parameter> readParameterList() {
        expect(TokenKind.OPENING_PARENTHESIS);
        List<Parameter> out = new ArrayList<>();
        for (int i = 0; tryRead(TokenKind.CLOSING_PARENTHESIS) == null; i++) {
            if (i > 0) expect(TokenKind.COMMA);
            Attributes attributes = readAttributes();
            TypeAndName typed = readType();
            TypeRef type = peekIs(TokenKind.OPENING_BRACKET) ? readArray(typed.type) : typed.type;
            out.add(new Parameter(attributes, type, typed.name));
        }
        return out;
    }

    /** {@code x[2][3]} becomes {@code Array(Array(T, 3), 2)}. */
    private TypeRef readArray(TypeRef element) {
        List<Expression> dimensions = new ArrayList<>();
        while (tryRead(TokenKind.OPENING_BRACKET) != null) {
            Expression length = peekIs(TokenKind.CLOSING_BRACKET) ? null : readExpression();
            expect(TokenKind.CLOSING_BRACKET);
            dimensions.add(length);
        }
        TypeRef type = element;
        for (int i = dimensions.size() - 1; i >= 0; i--) {
            type = new ArrayType(type, dimensions.get(i));
        }
        return type;
    }

    // ---------------------------------------------------------------------------------------------
    // Token plumbing
    // ---------------------------------------------------------------------------------------------

    private Token read() {
        return lexer.hasNext() ? lexer.next() : null;
    }

    private Token peek() {
        TextPosition saved = lexer.position();
        Token t = read();
        lexer.reset(saved);
        return t;
    }

    private boolean peekIs(TokenKind kind) {
        Token t = peek();
        return t != null && t.kind() == kind;
    }

    /** Consumes and returns the next token when it has the given kind, otherwise leaves the cursor alone. */
    private Token tryRead(TokenKind kind) {
        TextPosition saved = lexer.position();
        Token t = read();
        if (t != null && t.kind() == kind) return t;
        lexer.reset(saved);
        return null;
    }

    private Token expect(TokenKind kind) {
        Token t = read();
        if (t == null) throw endOfInput("expected " + kind.description() + ", got end of input");
        if (t.kind() != kind) {
            throw new ParseException(sourceName, t.position(), ParseException.Reason.EXPECTED_TOKEN,
                    "expected " + kind.description() + ", got " + t.kind().description() + " '" + t.text() + "'");
        }
        return t;
    }

    private Token expect(TokenKind... kinds) {
        Token t = read();
        StringBuilder wanted = new StringBuilder();
        for (int i = 0; i < kinds.length; i++) {
            if (i > 0) wanted.append(i == kinds.length - 1 ? " or " : ", ");
            wanted.append(kinds[i].description());
        }
        if (t == null) throw endOfInput("expected " + wanted + ", got end of input");
        for (TokenKind k : kinds) {
            if (t.kind() == k) return t;
        }
        throw new ParseException(sourceName, t.position(), ParseException.Reason.EXPECTED_TOKEN,
                "expected " + wanted + ", got " + t.kind().description() + " '" + t.text() + "'");
    }

    private ParseException unexpected(Token token) {
        return new ParseException(sourceName, token.position(), ParseException.Reason.UNEXPECTED_TOKEN,
                token.kind().description() + " '" + token.text() + "' was unexpected at this time");
    }

    private ParseException unexpected(TextPosition position, String what) {
        return new ParseException(sourceName, position, ParseException.Reason.UNEXPECTED_TOKEN,
                what + " was unexpected at this time");
    }

    private ParseException endOfInput(String message) {
        return new ParseException(sourceName, lexer.position(), ParseException.Reason.END_OF_INPUT, message);
    }

    /**
     * Strips the quotes of a literal token. {@code \"}, {@code \'} and {@code \\} are unescaped; other escape
     * sequences are kept as written since the text ends up in generated C++.
     */
    static String unquote(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        if (body.indexOf('\\') < 0) return body;
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char n = body.charAt(i + 1);
                if (n == '"' || n == '\'' || n == '\\') {
                    sb.append(n);
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
