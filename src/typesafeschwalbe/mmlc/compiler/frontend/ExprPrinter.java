
package typesafeschwalbe.mmlc.compiler.frontend;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Renders expression trees in a fully parenthesized form, for example
 * {@code (1 + (2 * 3))}, {@code ((f a) b)} or {@code (- (4 !))}.
 */
public class ExprPrinter {

    // either a node still to be printed or text to append as is
    private static record Piece(ExprNode node, String text) {
        static Piece of(ExprNode node) {
            return new Piece(node, null);
        }

        static Piece of(String text) {
            return new Piece(null, text);
        }
    }

    public static String print(ExprNode root) {
        StringBuilder output = new StringBuilder();
        Deque<Piece> pending = new ArrayDeque<>();
        pending.push(Piece.of(root));
        while(!pending.isEmpty()) {
            Piece piece = pending.pop();
            if(piece.text() != null) {
                output.append(piece.text());
                continue;
            }
            ExprPrinter.expand(piece.node(), pending, output);
        }
        return output.toString();
    }

    // leaves are appended right away, everything else is pushed in reverse
    private static void expand(
        ExprNode node, Deque<Piece> pending, StringBuilder output
    ) {
        switch(node.type) {
            case LITERAL: {
                output.append(ExprPrinter.printLiteral(node.getValue()));
                return;
            }
            case REFERENCE: {
                output.append(node.<ExprNode.Reference>getValue().name());
                return;
            }
            case INVALID: {
                output.append("<invalid>");
                return;
            }
            case UNARY: {
                ExprNode.Unary data = node.getValue();
                String name = data.operator().name();
                pending.push(Piece.of(")"));
                if(node.isUnaryPrefix()) {
                    pending.push(Piece.of(data.operand()));
                    pending.push(Piece.of(name + " "));
                } else {
                    pending.push(Piece.of(" " + name));
                    pending.push(Piece.of(data.operand()));
                }
                pending.push(Piece.of("("));
                return;
            }
            case BINARY: {
                ExprNode.Binary data = node.getValue();
                pending.push(Piece.of(")"));
                pending.push(Piece.of(data.right()));
                pending.push(Piece.of(" " + data.operator().name() + " "));
                pending.push(Piece.of(data.left()));
                pending.push(Piece.of("("));
                return;
            }
            case APPLICATION: {
                ExprNode.Application data = node.getValue();
                pending.push(Piece.of(")"));
                pending.push(Piece.of(data.argument()));
                pending.push(Piece.of(" "));
                pending.push(Piece.of(data.callee()));
                pending.push(Piece.of("("));
                return;
            }
            case GROUP: {
                pending.push(Piece.of(")"));
                pending.push(Piece.of(node.<ExprNode.Wrapped>getValue().inner()));
                pending.push(Piece.of("("));
                return;
            }
            case EXPRESSION: {
                pending.push(Piece.of(node.<ExprNode.Wrapped>getValue().inner()));
                return;
            }
        }
    }

    private static String printLiteral(Term.Literal literal) {
        if(literal.kind() == Term.Literal.Kind.STRING) {
            return "\"" + literal.text() + "\"";
        }
        return literal.text();
    }

    private ExprPrinter() {}

}
