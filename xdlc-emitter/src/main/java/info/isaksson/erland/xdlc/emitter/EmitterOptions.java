package info.isaksson.erland.xdlc.emitter;

/** Options for emitting headers from a loaded source set. */
public final class EmitterOptions {

    /** Name of the runtime version dispatcher; {@code null} emits no factory. */
    public final String factoryName;

    /** When true, the {@code impls_<stem>.g.h} stub file is rendered as well. */
    public final boolean emitStubs;

    public EmitterOptions(String factoryName, boolean emitStubs) {
        if (factoryName != null && !factoryName.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("factory name is not a C identifier: " + factoryName);
        }
        this.factoryName = factoryName;
        this.emitStubs = emitStubs;
    }

    /** No factory, no stubs. */
    public static EmitterOptions defaults() {
        return new EmitterOptions(null, false);
    }

    /** A factory name also turns on stub emission; {@code null} turns both off. */
    public EmitterOptions withFactoryName(String name) {
        return new EmitterOptions(name, name != null);
    }

    public EmitterOptions withStubs(boolean emit) {
        return new EmitterOptions(factoryName, emit);
    }

    @Override
    public String toString() {
        return "EmitterOptions{factoryName='" + factoryName + "', emitStubs=" + emitStubs + '}';
    }
}
