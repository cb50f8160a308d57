
package typesafeschwalbe.mmlc.compiler.frontend;

import java.util.Objects;

import typesafeschwalbe.mmlc.compiler.Source;

/**
 * One syntactically possible interpretation of a name reference, as
 * collected from the declarations visible where the reference occurs.
 */
public class Candidate {

    public static record Binding(
        String name
    ) {}

    public static record Function(
        String name,
        int arity
    ) {}

    public enum Type {
        BINDING,  // Binding
        FUNCTION, // Function
        OPERATOR  // OperatorSignature
    }

    public final Type type;
    private final Object value;
    public final Source source;

    private Candidate(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    public static Candidate binding(String name, Source source) {
        return new Candidate(Type.BINDING, new Binding(name), source);
    }

    public static Candidate function(String name, int arity, Source source) {
        if(arity < 0) {
            throw new IllegalArgumentException(
                "A function may not have a negative arity!"
            );
        }
        return new Candidate(Type.FUNCTION, new Function(name, arity), source);
    }

    public static Candidate operator(OperatorSignature signature) {
        return new Candidate(Type.OPERATOR, signature, signature.source());
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public String name() {
        return switch(this.type) {
            case BINDING -> this.<Binding>getValue().name();
            case FUNCTION -> this.<Function>getValue().name();
            case OPERATOR -> this.<OperatorSignature>getValue().name();
        };
    }

    public boolean isOperand() {
        return this.type != Type.OPERATOR;
    }

    public boolean hasRole(OperatorSignature.Role role) {
        return this.type == Type.OPERATOR
            && this.<OperatorSignature>getValue().role() == role;
    }

    public boolean isNullaryFunction() {
        return this.type == Type.FUNCTION
            && this.<Function>getValue().arity() == 0;
    }

    public String describe() {
        return switch(this.type) {
            case BINDING -> "binding '" + this.name() + "'";
            case FUNCTION -> "function '" + this.name() + "' ("
                + this.<Function>getValue().arity() + " parameters)";
            case OPERATOR -> this.<OperatorSignature>getValue().toString();
        };
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Candidate)) { return false; }
        Candidate other = (Candidate) otherRaw;
        return this.type == other.type
            && this.value.equals(other.value)
            && this.source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.type, this.value, this.source);
    }

    @Override
    public String toString() {
        return this.describe();
    }

}
