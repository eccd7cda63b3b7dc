package info.isaksson.erland.xdlc.ast;

/**
 * Base class of every fatal compilation failure.
 *
 * <p>Compilation is fail-fast: nothing catches these below the service/CLI layer.</p>
 */
public abstract class XdlException extends RuntimeException {

    protected XdlException(String message) {
        super(message);
    }

    protected XdlException(String message, Throwable cause) {
        super(message, cause);
    }
}
