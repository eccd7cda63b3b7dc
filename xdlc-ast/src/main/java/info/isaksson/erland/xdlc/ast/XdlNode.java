package info.isaksson.erland.xdlc.ast;

/** Top-level item read from a source file: a {@link Declaration} or an {@link ImportDirective}. */
public interface XdlNode {
}
