
package typesafeschwalbe.mmlc.compiler.rewrite;

import java.util.Objects;

import typesafeschwalbe.mmlc.compiler.Source;
import typesafeschwalbe.mmlc.compiler.frontend.ExprNode;
import typesafeschwalbe.mmlc.compiler.frontend.OperatorSignature;

/**
 * A term whose syntactic role has been decided.
 */
public class TaggedTerm {

    public enum Role {
        OPERAND,    // ExprNode
        PREFIX,     // OperatorSignature
        INFIX,      // OperatorSignature
        POSTFIX,    // OperatorSignature
        APPLICATION // = null
    }

    public final Role role;
    private final Object value;
    public final Source source;

    private TaggedTerm(Role role, Object value, Source source) {
        this.role = role;
        this.value = value;
        this.source = source;
    }

    public static TaggedTerm operand(ExprNode node) {
        return new TaggedTerm(Role.OPERAND, node, node.source);
    }

    public static TaggedTerm operator(
        OperatorSignature signature, Source source
    ) {
        Role role = switch(signature.role()) {
            case PREFIX_UNARY -> Role.PREFIX;
            case INFIX_BINARY -> Role.INFIX;
            case POSTFIX_UNARY -> Role.POSTFIX;
        };
        return new TaggedTerm(role, signature, source);
    }

    /**
     * The implicit operator between a callee and its argument. It has no
     * text of its own, so it is located at the very start of the argument.
     */
    public static TaggedTerm application(Source argumentSource) {
        return new TaggedTerm(
            Role.APPLICATION,
            null,
            new Source(
                argumentSource.file(),
                argumentSource.startOffset(),
                argumentSource.startOffset()
            )
        );
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public long precedence() {
        return switch(this.role) {
            case PREFIX, INFIX, POSTFIX
                -> this.<OperatorSignature>getValue().precedence();
            case APPLICATION -> OperatorSignature.APPLICATION_PRECEDENCE;
            case OPERAND -> throw new IllegalStateException(
                "operands have no precedence!"
            );
        };
    }

    public long operandPrecedence() {
        return switch(this.role) {
            case PREFIX, INFIX, POSTFIX
                -> this.<OperatorSignature>getValue().operandPrecedence();
            case APPLICATION -> OperatorSignature.APPLICATION_PRECEDENCE + 1;
            case OPERAND -> throw new IllegalStateException(
                "operands have no operand precedence!"
            );
        };
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof TaggedTerm)) { return false; }
        TaggedTerm other = (TaggedTerm) otherRaw;
        return this.role == other.role
            && Objects.equals(this.value, other.value)
            && this.source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.role, this.value, this.source);
    }

    @Override
    public String toString() {
        return switch(this.role) {
            case OPERAND -> this.<ExprNode>getValue().toString();
            case PREFIX, INFIX, POSTFIX -> this.role.name().toLowerCase()
                + " " + this.<OperatorSignature>getValue().name();
            case APPLICATION -> "application";
        };
    }

}
