package info.isaksson.erland.xdlc.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Function signature: method signatures, and function-pointer elements inside pointers/references. */
public record SignatureType(TypeRef returnType, List<Parameter> parameters, boolean constQualified) implements TypeRef {

    public SignatureType {
        Objects.requireNonNull(returnType, "returnType");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    @Override
    public SignatureType withConst(boolean constQualified) {
        return new SignatureType(returnType, parameters, constQualified);
    }

    /** Copy with {@code first} inserted before the existing parameters. */
    public SignatureType withLeadingParameter(Parameter first) {
        List<Parameter> out = new ArrayList<>(parameters.size() + 1);
        out.add(first);
        out.addAll(parameters);
        return new SignatureType(returnType, out, false);
    }
}
