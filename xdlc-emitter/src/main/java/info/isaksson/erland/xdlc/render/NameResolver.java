package info.isaksson.erland.xdlc.render;

/** Maps a type name as written in source to the spelling used in generated code. */
@FunctionalInterface
public interface NameResolver {

    /** Leaves every name as written. */
    NameResolver VERBATIM = name -> name;

    String resolve(String name);
}
