package info.isaksson.erland.xdlc.ast;

import java.util.List;

/** The closed set of attributes the compiler understands. */
public enum AttributeKind {
    UUID("uuid"),
    NO_UUID("no_uuid"),
    NO_EMIT("no_emit"),
    NO_IMPL("no_impl"),
    FORCE_ABI("force_abi"),
    ADDED("added"),
    REMOVED("removed"),
    CONDITIONAL("conditional"),
    REGISTER_RETURN("reg_return"),
    HIDDEN_RETURN("hidden_return", "rcx_return");

    private final List<String> spellings;

    AttributeKind(String... spellings) {
        this.spellings = List.of(spellings);
    }

    /** Canonical source spelling. */
    public String spelling() {
        return spellings.get(0);
    }

    public boolean matches(String name) {
        return name != null && spellings.contains(name);
    }

    /** @return the kind for a source attribute name, or {@code null} for attributes the compiler ignores */
    public static AttributeKind fromName(String name) {
        for (AttributeKind k : values()) {
            if (k.matches(name)) return k;
        }
        return null;
    }

    public boolean isVersion() {
        return this == ADDED || this == REMOVED;
    }
}
