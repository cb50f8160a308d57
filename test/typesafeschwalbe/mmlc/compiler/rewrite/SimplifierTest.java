
package typesafeschwalbe.mmlc.compiler.rewrite;

import static org.junit.jupiter.api.Assertions.*;
import static typesafeschwalbe.mmlc.compiler.rewrite.TermFixtures.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.mmlc.compiler.frontend.ExprNode;
import typesafeschwalbe.mmlc.compiler.frontend.ExprPrinter;
import typesafeschwalbe.mmlc.compiler.frontend.OperatorSignature;
import typesafeschwalbe.mmlc.compiler.frontend.Term;

public class SimplifierTest {

    private static final OperatorSignature TIMES = OperatorSignature.infix(
        "*", 80, OperatorSignature.Associativity.LEFT, at(0, 0)
    );

    private static ExprNode number(String text, int start) {
        return ExprNode.literal(
            new Term.Literal(Term.Literal.Kind.INTEGER, text),
            at(start, start + text.length())
        );
    }

    // (( 2 ) * 3) as built, with every wrapper still in place
    private static ExprNode wrapped() {
        ExprNode two = ExprNode.group(
            ExprNode.expression(number("2", 2)), at(0, 5)
        );
        return ExprNode.expression(ExprNode.binary(
            TIMES, at(6, 7), two, number("3", 8)
        ));
    }

    @Test
    public void testWrappersAreRemoved() {
        ExprNode simplified = new Simplifier().simplify(wrapped());
        assertEquals(ExprNode.Type.BINARY, simplified.type);
        assertEquals("(2 * 3)", ExprPrinter.print(simplified));
        ExprNode left = simplified.<ExprNode.Binary>getValue().left();
        assertEquals(ExprNode.Type.LITERAL, left.type);
    }

    @Test
    public void testGroupsCanBeKept() {
        ExprNode simplified = new Simplifier(true).simplify(wrapped());
        assertEquals("((2) * 3)", ExprPrinter.print(simplified));
        ExprNode group = simplified.<ExprNode.Binary>getValue().left();
        assertEquals(ExprNode.Type.GROUP, group.type);
        assertEquals(
            ExprNode.Type.LITERAL,
            group.<ExprNode.Wrapped>getValue().inner().type
        );
    }

    @Test
    public void testIdempotence() {
        Simplifier simplifier = new Simplifier();
        ExprNode once = simplifier.simplify(wrapped());
        assertEquals(once, simplifier.simplify(once));
        Simplifier keeping = new Simplifier(true);
        ExprNode kept = keeping.simplify(wrapped());
        assertEquals(kept, keeping.simplify(kept));
    }

    @Test
    public void testSourcesArePreserved() {
        ExprNode simplified = new Simplifier().simplify(wrapped());
        assertEquals(at(0, 9), simplified.source);
        assertEquals(
            at(6, 7),
            simplified.<ExprNode.Binary>getValue().operatorSource()
        );
    }

    @Test
    public void testLeavesAreUnchanged() {
        ExprNode leaf = number("7", 0);
        assertSame(leaf, new Simplifier().simplify(leaf));
        ExprNode invalid = ExprNode.invalid(List.of(), at(0, 1));
        assertSame(invalid, new Simplifier().simplify(invalid));
    }

}
