package info.isaksson.erland.xdlc.ast;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Ordered attribute set of a node. Lookups return the first attribute of the requested kind. */
public final class Attributes {

    public static final Attributes NONE = new Attributes(List.of());

    private final List<AttributeNode> nodes;

    private Attributes(List<AttributeNode> nodes) {
        this.nodes = nodes;
    }

    public static Attributes of(List<AttributeNode> nodes) {
        if (nodes == null || nodes.isEmpty()) return NONE;
        return new Attributes(List.copyOf(nodes));
    }

    public static Attributes of(AttributeNode... nodes) {
        return of(List.of(nodes));
    }

    @JsonValue
    public List<AttributeNode> nodes() {
        return nodes;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<XdlAttribute> find(AttributeKind kind) {
        for (AttributeNode n : nodes) {
            if (kind.matches(n.name())) {
                return Optional.of(XdlAttribute.resolve(n));
            }
        }
        return Optional.empty();
    }

    public boolean has(AttributeKind kind) {
        for (AttributeNode n : nodes) {
            if (kind.matches(n.name())) return true;
        }
        return false;
    }

    public Optional<Version> added() {
        return find(AttributeKind.ADDED).map(XdlAttribute::version);
    }

    public Optional<Version> removed() {
        return find(AttributeKind.REMOVED).map(XdlAttribute::version);
    }

    public Optional<String> condition() {
        return find(AttributeKind.CONDITIONAL).map(XdlAttribute::condition);
    }

    public boolean hasVersionAttribute() {
        return has(AttributeKind.ADDED) || has(AttributeKind.REMOVED);
    }

    /** Concatenation, used when consecutive bracket groups form one set. */
    public Attributes plus(Attributes other) {
        if (other == null || other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<AttributeNode> out = new ArrayList<>(nodes);
        out.addAll(other.nodes);
        return new Attributes(List.copyOf(out));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Attributes)) return false;
        return nodes.equals(((Attributes) o).nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes);
    }

    @Override
    public String toString() {
        return nodes.toString();
    }
}
