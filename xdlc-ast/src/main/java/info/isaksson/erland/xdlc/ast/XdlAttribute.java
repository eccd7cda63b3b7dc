package info.isaksson.erland.xdlc.ast;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Semantically resolved attribute.
 *
 * <p>Only the payload matching {@link #kind()} is set: {@link #version()} for
 * {@code added}/{@code removed}, {@link #condition()} for {@code conditional} and
 * {@link #uuid()} for {@code uuid}.</p>
 */
public record XdlAttribute(AttributeKind kind, Version version, String condition, UUID uuid) {

    public XdlAttribute {
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * Maps a raw attribute to its typed form.
     *
     * @return the resolved attribute, or {@code null} when the name is not an attribute the compiler knows
     * @throws SemanticException when a known attribute has malformed arguments
     */
    public static XdlAttribute resolve(AttributeNode node) {
        AttributeKind kind = AttributeKind.fromName(node.name());
        if (kind == null) return null;

        return switch (kind) {
            case UUID -> new XdlAttribute(kind, null, null, parseUuid(node));
            case ADDED, REMOVED -> new XdlAttribute(kind, parseVersion(node), null, null);
            case CONDITIONAL -> new XdlAttribute(kind, null, String.valueOf(single(node).fold()), null);
            case NO_UUID, NO_EMIT, NO_IMPL, FORCE_ABI, REGISTER_RETURN, HIDDEN_RETURN -> marker(kind);
        };
    }

    public static XdlAttribute marker(AttributeKind kind) {
        return new XdlAttribute(kind, null, null, null);
    }

    private static Expression single(AttributeNode node) {
        if (node.arguments().size() != 1) {
            throw new SemanticException(node.name(), "expected exactly one argument, got " + node.arguments().size());
        }
        return node.arguments().get(0);
    }

    private static UUID parseUuid(AttributeNode node) {
        Object value = single(node).fold();
        String text = String.valueOf(value).trim();
        if (text.startsWith("{") && text.endsWith("}")) {
            text = text.substring(1, text.length() - 1);
        }
        // UUID.fromString is lenient about group widths, the canonical layout is checked first.
        if (!text.matches("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}")) {
            throw new SemanticException(node.name(), "malformed uuid '" + value + "'");
        }
        return UUID.fromString(text);
    }

    private static Version parseVersion(AttributeNode node) {
        List<Expression> args = node.arguments();
        if (args.size() < 2 || args.size() > 4) {
            throw new SemanticException(node.name(), "expected 2 to 4 version components, got " + args.size());
        }
        int[] c = new int[4];
        for (int i = 0; i < args.size(); i++) {
            Object v = args.get(i).fold();
            if (!(v instanceof Long)) {
                throw new SemanticException(node.name(), "version component " + (i + 1) + " is not an integer: " + v);
            }
            long l = (Long) v;
            if (l < 0 || l > Integer.MAX_VALUE) {
                throw new SemanticException(node.name(), "version component " + (i + 1) + " out of range: " + l);
            }
            c[i] = (int) l;
        }
        return new Version(c[0], c[1], c[2], c[3]);
    }
}
