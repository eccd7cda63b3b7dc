package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.ast.AttributeKind;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.SemanticException;
import info.isaksson.erland.xdlc.ast.XdlAttribute;
import info.isaksson.erland.xdlc.classify.AbiClassification;
import info.isaksson.erland.xdlc.io.DeclarationTable;
import info.isaksson.erland.xdlc.render.CodeWriter;
import info.isaksson.erland.xdlc.render.UuidLiteral;

import java.util.List;
import java.util.Optional;

/** Interface identity registrations, one {@code DECLARE_*UUIDOF_HELPER} line per identified interface. */
final class UuidTableWriter {

    private UuidTableWriter() {}

    /** @throws SemanticException when an emitted interface has neither or both of {@code uuid} and {@code no_uuid} */
    static void write(CodeWriter w, AbiClassification abi, List<DeclarationTable.Entry> roots) {
        for (DeclarationTable.Entry e : roots) {
            Declaration d = e.declaration();
            if (!d.isInterface() || d.attributes().has(AttributeKind.NO_EMIT)) continue;

            Optional<XdlAttribute> uuid = d.attributes().find(AttributeKind.UUID);
            if (uuid.isEmpty()) {
                if (d.attributes().has(AttributeKind.NO_UUID)) continue;
                throw new SemanticException(d.name(), "interface is missing a [uuid] attribute");
            }
            if (d.attributes().has(AttributeKind.NO_UUID)) {
                throw new SemanticException(d.name(), "interface has both [uuid] and [no_uuid]");
            }

            String macro = abi.isAbi(e.id()) ? "DECLARE_ABI_UUIDOF_HELPER" : "DECLARE_UUIDOF_HELPER";
            w.line(macro + "(" + abi.qualifiedName(e.id()) + ", " + UuidLiteral.arguments(uuid.get().uuid()) + ")");
            w.blank();
        }
    }
}
