package info.isaksson.erland.xdlc.ast;

import java.util.List;
import java.util.Objects;

/** Raw attribute as written: {@code name} or {@code name(arg, ...)}. */
public record AttributeNode(String name, List<Expression> arguments) {

    public AttributeNode {
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public static AttributeNode of(String name, Expression... arguments) {
        return new AttributeNode(name, List.of(arguments));
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) return name;
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}
