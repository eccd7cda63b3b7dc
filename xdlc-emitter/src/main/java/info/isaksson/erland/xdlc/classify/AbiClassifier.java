package info.isaksson.erland.xdlc.classify;

import info.isaksson.erland.xdlc.ast.AttributeKind;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.NamedType;
import info.isaksson.erland.xdlc.ast.walk.AstListener;
import info.isaksson.erland.xdlc.ast.walk.AstWalker;
import info.isaksson.erland.xdlc.ast.walk.WalkPolicy;
import info.isaksson.erland.xdlc.io.DeclarationTable;
import info.isaksson.erland.xdlc.version.Breakpoints;

import java.util.Set;
import java.util.TreeSet;

/**
 * Decides which declarations are versioned.
 *
 * <p>Pass 1 marks declarations that are {@code force_abi} or reach a version attribute through themselves or
 * anything they reference. Pass 2 repeatedly marks declarations that name an already-marked declaration as a base
 * or member type, until nothing changes. Shadowed registrations are classified too.</p>
 */
public final class AbiClassifier {

    private AbiClassifier() {}

    public static AbiClassification classify(DeclarationTable table) {
        Set<Integer> abi = new TreeSet<>();
        for (DeclarationTable.Entry e : table.entries()) {
            Declaration d = e.declaration();
            if (d.attributes().has(AttributeKind.FORCE_ABI) || !Breakpoints.transitive(d, table).isEmpty()) {
                abi.add(e.id());
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (DeclarationTable.Entry e : table.entries()) {
                if (abi.contains(e.id())) continue;
                if (referencesAbi(e.declaration(), table, abi)) {
                    abi.add(e.id());
                    changed = true;
                }
            }
        }
        return new AbiClassification(table, abi);
    }

    private static boolean referencesAbi(Declaration declaration, DeclarationTable table, Set<Integer> abi) {
        ReferenceScan scan = new ReferenceScan(table, abi);
        AstWalker.walk(declaration, WalkPolicy.EVERYTHING, scan);
        return scan.found;
    }

    private static final class ReferenceScan implements AstListener {
        private final DeclarationTable table;
        private final Set<Integer> abi;
        boolean found;

        ReferenceScan(DeclarationTable table, Set<Integer> abi) {
            this.table = table;
            this.abi = abi;
        }

        @Override
        public void onBaseType(BaseTypeRef baseType) {
            check(baseType.name());
        }

        @Override
        public void onNamedType(NamedType type) {
            check(type.name());
        }

        private void check(String name) {
            if (found) return;
            found = table.lookup(name).map(e -> abi.contains(e.id())).orElse(false);
        }
    }
}
