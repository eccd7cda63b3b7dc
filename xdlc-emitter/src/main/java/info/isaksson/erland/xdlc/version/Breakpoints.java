package info.isaksson.erland.xdlc.version;

import info.isaksson.erland.xdlc.ast.AttributeKind;
import info.isaksson.erland.xdlc.ast.AttributeNode;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.NamedType;
import info.isaksson.erland.xdlc.ast.Version;
import info.isaksson.erland.xdlc.ast.XdlAttribute;
import info.isaksson.erland.xdlc.ast.walk.AstListener;
import info.isaksson.erland.xdlc.ast.walk.AstWalker;
import info.isaksson.erland.xdlc.ast.walk.WalkPolicy;
import info.isaksson.erland.xdlc.io.DeclarationTable;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Version breakpoints: the distinct {@code added}/{@code removed} versions of a declaration, ascending. */
public final class Breakpoints {

    private Breakpoints() {}

    /** Breakpoints of one axis of {@code declaration}, without following referenced declarations. */
    public static List<Version> collect(Declaration declaration, VersionAxis axis) {
        VersionCollector collector = new VersionCollector();
        AstWalker.walk(declaration, axis, collector);
        return List.copyOf(collector.versions);
    }

    /**
     * Breakpoints anywhere in {@code declaration} or in the declarations it references through base types and
     * member types, followed transitively through {@code table}. Each referenced name is visited once.
     */
    public static List<Version> transitive(Declaration declaration, DeclarationTable table) {
        TransitiveCollector collector = new TransitiveCollector(table);
        collector.start(declaration);
        return List.copyOf(collector.versions);
    }

    private static class VersionCollector implements AstListener {
        final TreeSet<Version> versions = new TreeSet<>();

        @Override
        public void onAttribute(AttributeNode attribute) {
            AttributeKind kind = AttributeKind.fromName(attribute.name());
            if (kind != null && kind.isVersion()) {
                versions.add(XdlAttribute.resolve(attribute).version());
            }
        }
    }

    private static final class TransitiveCollector extends VersionCollector {
        private final DeclarationTable table;
        private final Set<String> visited = new HashSet<>();
        private final AstWalker walker = new AstWalker(WalkPolicy.EVERYTHING, this);

        TransitiveCollector(DeclarationTable table) {
            this.table = table;
        }

        void start(Declaration declaration) {
            if (declaration.name() != null) visited.add(declaration.name());
            walker.walk(declaration);
        }

        @Override
        public void onBaseType(BaseTypeRef baseType) {
            follow(baseType.name());
        }

        @Override
        public void onNamedType(NamedType type) {
            follow(type.name());
        }

        private void follow(String name) {
            if (!visited.add(name)) return;
            table.lookup(name).ifPresent(e -> walker.walk(e.declaration()));
        }
    }
}
