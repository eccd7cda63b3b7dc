package info.isaksson.erland.xdlc.ast;

import java.util.Comparator;

/**
 * Four-component ABI version, ordered lexicographically.
 */
public record Version(int major, int minor, int build, int revision) implements Comparable<Version> {

    public static final Version ZERO = new Version(0, 0, 0, 0);

    private static final Comparator<Version> ORDER = Comparator
            .comparingInt(Version::major)
            .thenComparingInt(Version::minor)
            .thenComparingInt(Version::build)
            .thenComparingInt(Version::revision);

    public Version {
        if (major < 0 || minor < 0 || build < 0 || revision < 0) {
            throw new IllegalArgumentException("version components must not be negative: "
                    + major + "." + minor + "." + build + "." + revision);
        }
    }

    public static Version of(int major, int minor, int build, int revision) {
        return new Version(major, minor, build, revision);
    }

    /** Parses {@code a.b[.c[.d]]}; missing trailing components are 0. */
    public static Version parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("version text is blank");
        String[] parts = text.trim().split("\\.");
        if (parts.length < 2 || parts.length > 4) {
            throw new IllegalArgumentException("expected 2 to 4 version components: " + text);
        }
        int[] c = new int[4];
        for (int i = 0; i < parts.length; i++) {
            try {
                c[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid version component '" + parts[i] + "' in " + text, e);
            }
        }
        return new Version(c[0], c[1], c[2], c[3]);
    }

    @Override
    public int compareTo(Version other) {
        return ORDER.compare(this, other);
    }

    public boolean isAtLeast(Version other) {
        return compareTo(other) >= 0;
    }

    /** C++ literal used in generated code, e.g. {@code abi_t{10,0,15063,0}}. */
    public String toAbiLiteral() {
        if (ZERO.equals(this)) return "abi_t{}";
        return "abi_t{" + major + "," + minor + "," + build + "," + revision + "}";
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + build + "." + revision;
    }
}
