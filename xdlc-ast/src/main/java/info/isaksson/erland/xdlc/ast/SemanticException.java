package info.isaksson.erland.xdlc.ast;

/** A well-formed input that cannot be compiled (missing uuid, unresolved base type, bad attribute arguments). */
public final class SemanticException extends XdlException {

    private final String subject;

    public SemanticException(String subject, String message) {
        super(subject == null ? message : subject + ": " + message);
        this.subject = subject;
    }

    /** Name of the offending declaration, member or attribute. */
    public String subject() {
        return subject;
    }
}
