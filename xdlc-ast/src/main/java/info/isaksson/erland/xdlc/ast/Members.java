package info.isaksson.erland.xdlc.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/** Helpers over member lists that ignore versioning. */
public final class Members {

    private Members() {}

    /** All non-block members in source order, descending into blocks. */
    public static List<Member> flatten(List<Member> members) {
        List<Member> out = new ArrayList<>();
        flattenInto(members, out);
        return out;
    }

    private static void flattenInto(List<Member> members, List<Member> out) {
        for (Member m : members) {
            if (m instanceof MemberBlock b) {
                flattenInto(b.members(), out);
            } else {
                out.add(m);
            }
        }
    }

    public static List<Method> methods(List<Member> members) {
        List<Method> out = new ArrayList<>();
        for (Member m : flatten(members)) {
            if (m instanceof Method method) out.add(method);
        }
        return out;
    }

    /** True when a non-block member at any depth satisfies {@code test}. */
    public static boolean anyMatch(List<Member> members, Predicate<Member> test) {
        for (Member m : members) {
            if (m instanceof MemberBlock b) {
                if (anyMatch(b.members(), test)) return true;
            } else if (test.test(m)) {
                return true;
            }
        }
        return false;
    }
}
