package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.render.CodeWriter;

import java.util.Objects;

/** Opens and closes {@code namespace a::b} blocks so that consecutive declarations share one block. */
final class NamespaceScope {

    private final CodeWriter writer;
    private String current;

    NamespaceScope(CodeWriter writer) {
        this.writer = writer;
    }

    /** @param namespace dotted namespace path, {@code null} or empty for file scope */
    void enter(String namespace) {
        String next = namespace == null || namespace.isEmpty() ? null : namespace;
        if (Objects.equals(current, next)) return;
        if (current != null) {
            writer.close();
            if (next != null) writer.blank();
        }
        if (next != null) {
            writer.line("namespace " + next.replace(".", "::"));
            writer.open();
        }
        current = next;
    }

    void leave() {
        enter(null);
    }
}
