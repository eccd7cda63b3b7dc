package info.isaksson.erland.xdlc.version;

import info.isaksson.erland.xdlc.ast.Version;

import java.util.ArrayList;
import java.util.List;

/**
 * Half-open version range {@code [lower, upper)} sharing one shape.
 *
 * <p>The primary window has no lower bound: it is the unconstrained template, evaluated at the zero baseline.
 * A {@code null} upper bound means the window is open-ended.</p>
 */
public record VersionWindow(Version lower, Version upper) {

    /** Primary window followed by one window per breakpoint. A zero breakpoint coincides with the primary window. */
    public static List<VersionWindow> partition(List<Version> versions) {
        List<Version> breakpoints = new ArrayList<>(versions.size());
        for (Version v : versions) {
            if (!Version.ZERO.equals(v)) breakpoints.add(v);
        }
        List<VersionWindow> out = new ArrayList<>(breakpoints.size() + 1);
        out.add(new VersionWindow(null, breakpoints.isEmpty() ? null : breakpoints.get(0)));
        for (int i = 0; i < breakpoints.size(); i++) {
            Version next = i + 1 < breakpoints.size() ? breakpoints.get(i + 1) : null;
            out.add(new VersionWindow(breakpoints.get(i), next));
        }
        return out;
    }

    public boolean isPrimary() {
        return lower == null;
    }

    /** Version at which membership is evaluated. */
    public Version at() {
        return lower == null ? Version.ZERO : lower;
    }

    /** {@code requires (...)} constraint of a specialization; empty for the primary window. */
    public String requiresClause() {
        if (lower == null) return "";
        StringBuilder sb = new StringBuilder("requires (ABI >= ").append(lower.toAbiLiteral());
        if (upper != null) sb.append(" && ABI < ").append(upper.toAbiLiteral());
        return sb.append(')').toString();
    }
}
