package info.isaksson.erland.xdlc.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Constant expression. Only literals and unary negation exist; there is no arithmetic. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StringLiteral.class, name = "string"),
        @JsonSubTypes.Type(value = IntegerLiteral.class, name = "integer"),
        @JsonSubTypes.Type(value = IdentifierExpression.class, name = "identifier"),
        @JsonSubTypes.Type(value = UnaryNegation.class, name = "negate")
})
public interface Expression {

    /**
     * Folds the expression to a scalar.
     *
     * @return a {@link Long} for integer expressions, a {@link String} otherwise
     */
    Object fold();
}
