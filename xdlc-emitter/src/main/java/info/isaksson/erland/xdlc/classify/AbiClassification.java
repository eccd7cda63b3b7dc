package info.isaksson.erland.xdlc.classify;

import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.io.DeclarationTable;
import info.isaksson.erland.xdlc.render.NameResolver;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of ABI classification, indexed by declaration id.
 *
 * <p>An ABI declaration is emitted as a template over {@code abi_t ABI}; every reference to it is spelled
 * {@code ns::Name<ABI>}. Names that do not resolve to a registered declaration pass through unchanged.</p>
 */
public final class AbiClassification implements NameResolver {

    private final DeclarationTable table;
    private final Set<Integer> abiIds;

    AbiClassification(DeclarationTable table, Set<Integer> abiIds) {
        this.table = Objects.requireNonNull(table, "table");
        this.abiIds = Collections.unmodifiableSet(new TreeSet<>(abiIds));
    }

    public DeclarationTable table() {
        return table;
    }

    public boolean isAbi(int id) {
        return abiIds.contains(id);
    }

    /** Classification of the declaration that wins resolution of {@code name}; false for unknown names. */
    public boolean isAbi(String name) {
        return table.lookup(name).map(e -> isAbi(e.id())).orElse(false);
    }

    public Set<Integer> abiIds() {
        return abiIds;
    }

    public String qualifiedName(int id) {
        return table.get(id).declaration().qualifiedName();
    }

    /** {@code ns::Name<ABI>} for ABI declarations, {@code ns::Name} otherwise. */
    public String emissionName(int id) {
        return qualifiedName(id) + (isAbi(id) ? "<ABI>" : "");
    }

    /** Emission name of the interface's function table. */
    public String vtblEmissionName(int id) {
        return qualifiedName(id) + "Vtbl" + (isAbi(id) ? "<ABI>" : "");
    }

    public Optional<Declaration> declaration(String name) {
        return table.lookup(name).map(DeclarationTable.Entry::declaration);
    }

    @Override
    public String resolve(String name) {
        return table.lookup(name).map(e -> emissionName(e.id())).orElse(name);
    }

    public String resolveVtbl(String name) {
        return table.lookup(name).map(e -> vtblEmissionName(e.id())).orElse(name + "Vtbl");
    }
}
