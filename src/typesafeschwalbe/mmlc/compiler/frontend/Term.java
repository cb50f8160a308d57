
package typesafeschwalbe.mmlc.compiler.frontend;

import java.util.List;
import java.util.Objects;

import typesafeschwalbe.mmlc.compiler.Source;

/**
 * A single element of a flat, not yet restructured expression as produced by
 * the parser.
 */
public class Term {

    public static record Literal(
        Kind kind,
        String text
    ) {
        public enum Kind {
            INTEGER,
            FLOAT,
            STRING,
            BOOLEAN,
            UNIT
        }

        public static final Literal UNIT = new Literal(Kind.UNIT, "()");
    }

    public static record Reference(
        String name,
        int position
    ) {}

    public static record Group(
        List<Term> terms
    ) {}

    public enum Type {
        LITERAL,   // Literal
        REFERENCE, // Reference
        GROUP,     // Group
        NODE       // ExprNode
    }

    public final Type type;
    private final Object value;
    public final Source source;

    private Term(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    public static Term literal(
        Literal.Kind kind, String text, Source source
    ) {
        return new Term(Type.LITERAL, new Literal(kind, text), source);
    }

    public static Term reference(String name, int position, Source source) {
        return new Term(
            Type.REFERENCE, new Reference(name, position), source
        );
    }

    public static Term group(List<Term> terms, Source source) {
        return new Term(Type.GROUP, new Group(List.copyOf(terms)), source);
    }

    public static Term node(ExprNode node) {
        return new Term(Type.NODE, node, node.source);
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Term)) { return false; }
        Term other = (Term) otherRaw;
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
        return switch(this.type) {
            case LITERAL -> this.<Literal>getValue().text();
            case REFERENCE -> this.<Reference>getValue().name();
            case GROUP -> "(" + this.<Group>getValue().terms().size()
                + " terms)";
            case NODE -> this.<ExprNode>getValue().toString();
        };
    }

}
