package info.isaksson.erland.xdlc.emitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/** A non-fatal diagnostic raised while emitting headers. */
public final class EmitterWarning {

    /** A node whose {@code added} version is not below its {@code removed} version; it is never emitted. */
    public static final String INVERTED_VERSION_WINDOW = "INVERTED_VERSION_WINDOW";

    /** Stable warning code. */
    public final String code;

    public final String message;

    /** Where the warning applies, e.g. {@code declaration} and {@code member}; insertion ordered. */
    public final Map<String, String> context;

    public EmitterWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.context = context == null || context.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /** Single console line: {@code CODE: message (k=v, ...)}. */
    public String format() {
        StringBuilder sb = new StringBuilder(code).append(": ").append(message);
        if (!context.isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ", " (", ")");
            context.forEach((k, v) -> joiner.add(k + "=" + v));
            sb.append(joiner);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
