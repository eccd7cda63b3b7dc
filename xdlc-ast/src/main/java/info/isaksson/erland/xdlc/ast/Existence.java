package info.isaksson.erland.xdlc.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Version existence of attributed nodes.
 *
 * <p>A node is alive at {@code v} iff {@code added <= v} (or no {@code added}) and {@code removed > v}
 * (or no {@code removed}). A node whose {@code added} is not below its {@code removed} is never alive.</p>
 */
public final class Existence {

    private Existence() {}

    public enum SlotKind {
        ENTER_BLOCK,
        MEMBER,
        EXIT_BLOCK
    }

    /** One entry of {@link #aliveMembers}: a live member, or the boundary of a live block. */
    public record Slot(SlotKind kind, Member member) {

        public boolean isBoundary() {
            return kind != SlotKind.MEMBER;
        }
    }

    /** @param version queried version, {@code null} meaning the zero baseline */
    public static boolean exists(Attributes attributes, Version version) {
        Version v = version == null ? Version.ZERO : version;
        Optional<Version> added = attributes.added();
        if (added.isPresent() && added.get().compareTo(v) > 0) return false;
        Optional<Version> removed = attributes.removed();
        return removed.isEmpty() || removed.get().compareTo(v) > 0;
    }

    public static boolean exists(Member member, Version version) {
        return exists(member.attributes(), version);
    }

    public static boolean exists(BaseTypeRef baseType, Version version) {
        return exists(baseType.attributes(), version);
    }

    /** True when both bounds are present and {@code added >= removed}. */
    public static boolean isInverted(Attributes attributes) {
        Optional<Version> added = attributes.added();
        Optional<Version> removed = attributes.removed();
        return added.isPresent() && removed.isPresent() && added.get().compareTo(removed.get()) >= 0;
    }

    /**
     * Live members at {@code version} in source order. Each live block contributes an
     * {@link SlotKind#ENTER_BLOCK} slot, its live children and an {@link SlotKind#EXIT_BLOCK} slot; children of a
     * dead block are skipped regardless of their own attributes.
     */
    public static List<Slot> aliveMembers(List<Member> members, Version version) {
        List<Slot> out = new ArrayList<>();
        collect(members, version, out);
        return out;
    }

    private static void collect(List<Member> members, Version version, List<Slot> out) {
        for (Member m : members) {
            if (!exists(m, version)) continue;
            if (m instanceof MemberBlock b) {
                out.add(new Slot(SlotKind.ENTER_BLOCK, b));
                collect(b.members(), version, out);
                out.add(new Slot(SlotKind.EXIT_BLOCK, b));
            } else {
                out.add(new Slot(SlotKind.MEMBER, m));
            }
        }
    }

    public static List<BaseTypeRef> aliveBaseTypes(List<BaseTypeRef> baseTypes, Version version) {
        List<BaseTypeRef> out = new ArrayList<>();
        for (BaseTypeRef b : baseTypes) {
            if (exists(b, version)) out.add(b);
        }
        return out;
    }
}
