
package typesafeschwalbe.mmlc.compiler.frontend;

import typesafeschwalbe.mmlc.compiler.Source;

public record OperatorSignature(
    String name,
    Role role,
    int precedence,
    Associativity associativity,
    Source source
) {

    public static final int MIN_PRECEDENCE = 0;
    // implicit application binds tighter than any declarable operator
    public static final long APPLICATION_PRECEDENCE = Integer.MAX_VALUE + 1L;

    public enum Role {
        PREFIX_UNARY("prefix"),
        POSTFIX_UNARY("postfix"),
        INFIX_BINARY("infix");

        public final String description;

        private Role(String description) {
            this.description = description;
        }
    }

    public enum Associativity {
        LEFT,
        RIGHT
    }

    public OperatorSignature {
        if(precedence < MIN_PRECEDENCE) {
            throw new IllegalArgumentException(
                "Operator precedence may not be negative, but got "
                    + precedence
            );
        }
    }

    public static OperatorSignature prefix(
        String name, int precedence, Source source
    ) {
        return new OperatorSignature(
            name, Role.PREFIX_UNARY, precedence, Associativity.RIGHT, source
        );
    }

    public static OperatorSignature postfix(
        String name, int precedence, Source source
    ) {
        return new OperatorSignature(
            name, Role.POSTFIX_UNARY, precedence, Associativity.LEFT, source
        );
    }

    public static OperatorSignature infix(
        String name, int precedence, Associativity associativity,
        Source source
    ) {
        return new OperatorSignature(
            name, Role.INFIX_BINARY, precedence, associativity, source
        );
    }

    /**
     * The lowest precedence an operator following this one needs in order to
     * end up inside this operator's (right) operand.
     */
    public long operandPrecedence() {
        switch(this.role) {
            case INFIX_BINARY:
                return this.associativity == Associativity.LEFT
                    ? this.precedence + 1L
                    : this.precedence;
            case PREFIX_UNARY:
                return this.precedence;
            case POSTFIX_UNARY:
                throw new IllegalStateException(
                    "postfix operators have no operand to the right!"
                );
        }
        throw new IllegalStateException("unhandled operator role!");
    }

    @Override
    public String toString() {
        return this.role.description + " '" + this.name + "' (precedence "
            + this.precedence + ", "
            + this.associativity.name().toLowerCase() + ")";
    }

}
