
package typesafeschwalbe.mmlc.compiler.frontend;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import typesafeschwalbe.mmlc.compiler.Error;
import typesafeschwalbe.mmlc.compiler.Source;

/**
 * A node of a restructured, unambiguous expression tree. Nodes are immutable
 * and compare structurally. Comparison and hashing never recurse, so trees
 * of any depth can be compared.
 */
public class ExprNode {

    public static record Reference(
        String name,
        Candidate resolvedAs
    ) {}

    public static record Unary(
        OperatorSignature operator,
        Source operatorSource,
        ExprNode operand
    ) {}

    public static record Binary(
        OperatorSignature operator,
        Source operatorSource,
        ExprNode left,
        ExprNode right
    ) {}

    public static record Application(
        ExprNode callee,
        ExprNode argument
    ) {}

    public static record Wrapped(
        ExprNode inner
    ) {}

    public static record Invalid(
        List<Error> errors
    ) {}

    public enum Type {
        LITERAL,     // Term.Literal
        REFERENCE,   // Reference
        UNARY,       // Unary
        BINARY,      // Binary
        APPLICATION, // Application
        GROUP,       // Wrapped (user written parentheses)
        EXPRESSION,  // Wrapped (construction artifact)
        INVALID      // Invalid
    }

    public final Type type;
    private final Object value;
    public final Source source;
    // children are built first, so their hashes are already known
    private final int hash;

    private ExprNode(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
        int hash = Objects.hash(type, this.ownPartsHash(), source);
        for(ExprNode child: this.children()) {
            hash = 31 * hash + child.hash;
        }
        this.hash = hash;
    }

    public static ExprNode literal(Term.Literal literal, Source source) {
        return new ExprNode(Type.LITERAL, literal, source);
    }

    public static ExprNode reference(Candidate resolvedAs, Source source) {
        if(resolvedAs.type == Candidate.Type.OPERATOR) {
            throw new IllegalArgumentException(
                "operators are referenced through unary or binary nodes!"
            );
        }
        return new ExprNode(
            Type.REFERENCE,
            new Reference(resolvedAs.name(), resolvedAs),
            source
        );
    }

    public static ExprNode prefix(
        OperatorSignature operator, Source operatorSource, ExprNode operand
    ) {
        ExprNode.requireRole(operator, OperatorSignature.Role.PREFIX_UNARY);
        return new ExprNode(
            Type.UNARY,
            new Unary(operator, operatorSource, operand),
            new Source(operatorSource, operand.source)
        );
    }

    public static ExprNode postfix(
        OperatorSignature operator, Source operatorSource, ExprNode operand
    ) {
        ExprNode.requireRole(operator, OperatorSignature.Role.POSTFIX_UNARY);
        return new ExprNode(
            Type.UNARY,
            new Unary(operator, operatorSource, operand),
            new Source(operand.source, operatorSource)
        );
    }

    public static ExprNode binary(
        OperatorSignature operator, Source operatorSource,
        ExprNode left, ExprNode right
    ) {
        ExprNode.requireRole(operator, OperatorSignature.Role.INFIX_BINARY);
        return new ExprNode(
            Type.BINARY,
            new Binary(operator, operatorSource, left, right),
            new Source(left.source, right.source)
        );
    }

    public static ExprNode application(ExprNode callee, ExprNode argument) {
        return new ExprNode(
            Type.APPLICATION,
            new Application(callee, argument),
            new Source(callee.source, argument.source)
        );
    }

    public static ExprNode group(ExprNode inner, Source source) {
        return new ExprNode(Type.GROUP, new Wrapped(inner), source);
    }

    public static ExprNode expression(ExprNode inner) {
        return new ExprNode(Type.EXPRESSION, new Wrapped(inner), inner.source);
    }

    public static ExprNode invalid(List<Error> errors, Source source) {
        return new ExprNode(
            Type.INVALID, new Invalid(List.copyOf(errors)), source
        );
    }

    private static void requireRole(
        OperatorSignature operator, OperatorSignature.Role role
    ) {
        if(operator.role() != role) {
            throw new IllegalArgumentException(
                "expected a " + role.description + " operator, but got "
                    + operator
            );
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public boolean isUnaryPrefix() {
        return this.type == Type.UNARY
            && this.<Unary>getValue().operator().role()
                == OperatorSignature.Role.PREFIX_UNARY;
    }

    /**
     * Returns a copy of this node with the given children, in the order the
     * node stores them. Leaves are returned unchanged.
     */
    public ExprNode withChildren(List<ExprNode> children) {
        return switch(this.type) {
            case LITERAL, REFERENCE, INVALID -> this;
            case UNARY -> {
                Unary data = this.getValue();
                yield new ExprNode(
                    Type.UNARY,
                    new Unary(
                        data.operator(), data.operatorSource(), children.get(0)
                    ),
                    this.source
                );
            }
            case BINARY -> {
                Binary data = this.getValue();
                yield new ExprNode(
                    Type.BINARY,
                    new Binary(
                        data.operator(), data.operatorSource(),
                        children.get(0), children.get(1)
                    ),
                    this.source
                );
            }
            case APPLICATION -> new ExprNode(
                Type.APPLICATION,
                new Application(children.get(0), children.get(1)),
                this.source
            );
            case GROUP, EXPRESSION -> new ExprNode(
                this.type, new Wrapped(children.get(0)), this.source
            );
        };
    }

    public List<ExprNode> children() {
        return switch(this.type) {
            case LITERAL, REFERENCE, INVALID -> List.of();
            case UNARY -> List.of(this.<Unary>getValue().operand());
            case BINARY -> List.of(
                this.<Binary>getValue().left(),
                this.<Binary>getValue().right()
            );
            case APPLICATION -> List.of(
                this.<Application>getValue().callee(),
                this.<Application>getValue().argument()
            );
            case GROUP, EXPRESSION -> List.of(
                this.<Wrapped>getValue().inner()
            );
        };
    }

    // hash of everything but the children
    private int ownPartsHash() {
        return switch(this.type) {
            case LITERAL, REFERENCE, INVALID -> this.value.hashCode();
            case UNARY -> Objects.hash(
                this.<Unary>getValue().operator(),
                this.<Unary>getValue().operatorSource()
            );
            case BINARY -> Objects.hash(
                this.<Binary>getValue().operator(),
                this.<Binary>getValue().operatorSource()
            );
            case APPLICATION, GROUP, EXPRESSION -> 0;
        };
    }

    // compares everything but the children
    private boolean ownPartsEqual(ExprNode other) {
        if(this.type != other.type || this.hash != other.hash
            || !this.source.equals(other.source)) {
            return false;
        }
        return switch(this.type) {
            case LITERAL, REFERENCE, INVALID -> this.value.equals(other.value);
            case UNARY -> {
                Unary data = this.getValue();
                Unary otherData = other.getValue();
                yield data.operator().equals(otherData.operator())
                    && data.operatorSource().equals(otherData.operatorSource());
            }
            case BINARY -> {
                Binary data = this.getValue();
                Binary otherData = other.getValue();
                yield data.operator().equals(otherData.operator())
                    && data.operatorSource().equals(otherData.operatorSource());
            }
            case APPLICATION, GROUP, EXPRESSION -> true;
        };
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof ExprNode)) { return false; }
        Deque<ExprNode> left = new ArrayDeque<>();
        Deque<ExprNode> right = new ArrayDeque<>();
        left.push(this);
        right.push((ExprNode) otherRaw);
        while(!left.isEmpty()) {
            ExprNode a = left.pop();
            ExprNode b = right.pop();
            if(a == b) {
                continue;
            }
            if(!a.ownPartsEqual(b)) {
                return false;
            }
            // same type, so both have the same number of children
            List<ExprNode> aChildren = a.children();
            List<ExprNode> bChildren = b.children();
            for(int childI = 0; childI < aChildren.size(); childI += 1) {
                left.push(aChildren.get(childI));
                right.push(bChildren.get(childI));
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return this.hash;
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }

}
