package info.isaksson.erland.xdlc.emitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects warnings during one emission.
 *
 * <p>The collected list is reported sorted by (code, message, key-sorted context), so the same input always
 * yields the same warning order.</p>
 */
public final class EmitterWarnings {

    private final List<EmitterWarning> warnings = new ArrayList<>();

    public void warn(String code, String message, Map<String, String> context) {
        warnings.add(new EmitterWarning(code, message, context));
    }

    public void warn(String code, String message, String declaration, String member) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put("declaration", declaration);
        if (member != null) ctx.put("member", member);
        warn(code, message, ctx);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public int size() {
        return warnings.size();
    }

    public List<EmitterWarning> toDeterministicList() {
        List<EmitterWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparing((EmitterWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextKey(w.context)));
        return Collections.unmodifiableList(out);
    }

    private static String contextKey(Map<String, String> ctx) {
        if (ctx.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        new TreeMap<>(ctx).forEach((k, v) -> sb.append(k).append('=').append(v).append(';'));
        return sb.toString();
    }
}
