
package typesafeschwalbe.mmlc.compiler.rewrite;

import static org.junit.jupiter.api.Assertions.*;
import static typesafeschwalbe.mmlc.compiler.rewrite.TermFixtures.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import typesafeschwalbe.mmlc.compiler.Error;
import typesafeschwalbe.mmlc.compiler.ErrorException;
import typesafeschwalbe.mmlc.compiler.Result;
import typesafeschwalbe.mmlc.compiler.frontend.ExprNode;
import typesafeschwalbe.mmlc.compiler.frontend.ExprPrinter;
import typesafeschwalbe.mmlc.compiler.frontend.Scope;

public class ExpressionRewriterTest {

    private Scope prelude;
    private ExpressionRewriter rewriter;

    @BeforeEach
    public void setup() {
        this.prelude = prelude();
        this.rewriter = new ExpressionRewriter();
    }

    private Result<ExprNode> rewrite(String text) {
        return this.rewriter.rewrite(terms(text), spanOf(text), this.prelude);
    }

    private String printed(String text) throws ErrorException {
        return ExprPrinter.print(this.rewrite(text).orElseThrow());
    }

    private List<Error.Kind> errorKinds(String text) {
        Result<ExprNode> result = this.rewrite(text);
        assertTrue(result.isError(), "expected '" + text + "' to fail");
        return result.getError().stream()
            .map(Error::kind)
            .collect(Collectors.toList());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "1 + 1 * 2          | (1 + (1 * 2))",
        "1 * 2 + 3          | ((1 * 2) + 3)",
        "1 - 2 - 3          | ((1 - 2) - 3)",
        "8 / 4 / 2          | ((8 / 4) / 2)",
        "2 ^ 3 ^ 2          | (2 ^ (3 ^ 2))",
        "- - 3              | (- (- 3))",
        "- 3 - - 2          | ((- 3) - (- 2))",
        "- 2 ^ 2            | ((- 2) ^ 2)",
        "f a b c            | (((f a) b) c)",
        "double 5 + 1       | ((double 5) + 1)",
        "( 1 + 2 ) * 3      | ((1 + 2) * 3)",
        "f ( 1 + 2 )        | (f (1 + 2))",
        "- f x              | (- (f x))",
        "4 !                | (4 !)",
        "- 4 !              | (- (4 !))",
        "1 + 3 !            | (1 + (3 !))",
        "f 3 !              | ((f 3) !)",
        "x ! + 1            | ((x !) + 1)",
        "( 4 ! ) !          | ((4 !) !)",
        "((1))              | 1",
        "now                | (now ())",
        "now + 1            | ((now ()) + 1)",
        "f now              | (f (now ()))"
    })
    public void testRestructuring(String text, String expected)
        throws ErrorException {
        assertEquals(expected, this.printed(text));
    }

    @Test
    public void testConsecutivePostfixIsRejected() {
        assertEquals(
            List.of(Error.Kind.INVALID_CONSECUTIVE_POSTFIX),
            this.errorKinds("4 ! !")
        );
    }

    @Test
    public void testUndeclaredName() {
        assertEquals(
            List.of(Error.Kind.UNRESOLVABLE_REFERENCE),
            this.errorKinds("1 + y")
        );
    }

    @Test
    public void testMissingOperands() {
        assertEquals(List.of(Error.Kind.MISSING_OPERAND), this.errorKinds("1 +"));
        assertEquals(List.of(Error.Kind.MISSING_OPERAND), this.errorKinds("* 2"));
        assertEquals(List.of(Error.Kind.MISSING_OPERAND), this.errorKinds(""));
        assertEquals(List.of(Error.Kind.MISSING_OPERAND), this.errorKinds("-"));
    }

    @Test
    public void testErrorsInsideGroupsAreKept() {
        String text = "1 + ( 2 * y ) + z";
        ExpressionRewriter.Rewritten rewritten = this.rewriter.rewriteMarked(
            terms(text), spanOf(text), this.prelude
        );
        assertFalse(rewritten.isValid());
        assertEquals(2, rewritten.errors().size());
        assertEquals("((1 + <invalid>) + <invalid>)",
            ExprPrinter.print(rewritten.tree()));
    }

    @Test
    public void testMarkedTreeKeepsInvalidNodesInPlace() {
        String text = "* 2";
        ExpressionRewriter.Rewritten rewritten = this.rewriter.rewriteMarked(
            terms(text), spanOf(text), this.prelude
        );
        assertEquals("(<invalid> * 2)", ExprPrinter.print(rewritten.tree()));
        ExprNode left = rewritten.tree().<ExprNode.Binary>getValue().left();
        assertEquals(ExprNode.Type.INVALID, left.type);
        assertEquals(
            rewritten.errors(),
            left.<ExprNode.Invalid>getValue().errors()
        );
    }

    @Test
    public void testKeepGroups() throws ErrorException {
        ExpressionRewriter keeping = new ExpressionRewriter(
            new ExpressionRewriter.Options(true, true)
        );
        String text = "( 1 + 2 ) * 3";
        ExprNode tree = keeping.rewrite(terms(text), spanOf(text), this.prelude)
            .orElseThrow();
        assertEquals("(((1 + 2)) * 3)", ExprPrinter.print(tree));
        assertEquals(
            ExprNode.Type.GROUP,
            tree.<ExprNode.Binary>getValue().left().type
        );
    }

    @Test
    public void testNullaryFunctionsCanStayUnapplied() throws ErrorException {
        ExpressionRewriter plain = new ExpressionRewriter(
            new ExpressionRewriter.Options(false, false)
        );
        String text = "now + 1";
        ExprNode tree = plain.rewrite(terms(text), spanOf(text), this.prelude)
            .orElseThrow();
        assertEquals("(now + 1)", ExprPrinter.print(tree));
    }

    @Test
    public void testNoWrappersRemain() throws ErrorException {
        ExprNode tree = this.rewrite("f ( a + ( b * c ) ) ! - 1").orElseThrow();
        assertFalse(containsWrapper(tree));
    }

    @Test
    public void testDeterminism() throws ErrorException {
        String text = "f a + - b * c ! ^ 2 ^ x";
        ExprNode first = this.rewrite(text).orElseThrow();
        ExprNode second = this.rewrite(text).orElseThrow();
        assertEquals(first, second);
        assertEquals(ExprPrinter.print(first), ExprPrinter.print(second));
    }

    @Test
    public void testSourcesSpanTheirChildren() throws ErrorException {
        String text = "double 5 + 1";
        ExprNode tree = this.rewrite(text).orElseThrow();
        assertEquals(spanOf(text), tree.source);
        ExprNode.Binary sum = tree.getValue();
        assertEquals(at(0, 8), sum.left().source);
        assertEquals(at(9, 10), sum.operatorSource());
    }

    @Test
    public void testDeepInputDoesNotOverflow() {
        StringBuilder text = new StringBuilder();
        int depth = 20_000;
        for(int i = 0; i < depth; i += 1) {
            text.append("2 ^ ");
        }
        text.append("2");
        Result<ExprNode> result = this.rewrite(text.toString());
        assertTrue(result.isValue());
        ExprNode node = result.getValue();
        int seen = 0;
        while(node.type == ExprNode.Type.BINARY) {
            node = node.<ExprNode.Binary>getValue().right();
            seen += 1;
        }
        assertEquals(depth, seen);
        assertEquals(ExprNode.Type.LITERAL, node.type);
    }

    @Test
    public void testDeepPrefixChainDoesNotOverflow() {
        StringBuilder text = new StringBuilder();
        int depth = 20_000;
        for(int i = 0; i < depth; i += 1) {
            text.append("- ");
        }
        text.append("3");
        ExprNode node = this.rewrite(text.toString()).getValue();
        int seen = 0;
        while(node.type == ExprNode.Type.UNARY) {
            node = node.<ExprNode.Unary>getValue().operand();
            seen += 1;
        }
        assertEquals(depth, seen);
    }

    @Test
    public void testDeeplyNestedGroups() throws ErrorException {
        int depth = 50_000;
        String text = "(".repeat(depth) + "1 + 2" + ")".repeat(depth);
        ExprNode tree = this.rewrite(text).orElseThrow();
        assertEquals("(1 + 2)", ExprPrinter.print(tree));
        ExpressionRewriter keeping = new ExpressionRewriter(
            new ExpressionRewriter.Options(true, true)
        );
        ExprNode kept = keeping.rewrite(terms(text), spanOf(text), this.prelude)
            .orElseThrow();
        String printed = ExprPrinter.print(kept);
        assertEquals(
            "(".repeat(depth) + "(1 + 2)" + ")".repeat(depth), printed
        );
    }

    @Test
    public void testErrorInsideDeeplyNestedGroups() {
        int depth = 50_000;
        String text = "(".repeat(depth) + "1 + y" + ")".repeat(depth);
        assertEquals(
            List.of(Error.Kind.UNRESOLVABLE_REFERENCE), this.errorKinds(text)
        );
    }

    @Test
    public void testDeepTreesCompareAndPrint() {
        StringBuilder text = new StringBuilder();
        int depth = 20_000;
        for(int i = 0; i < depth; i += 1) {
            text.append("2 ^ ");
        }
        ExprNode first = this.rewrite(text + "2").getValue();
        ExprNode second = this.rewrite(text + "2").getValue();
        ExprNode different = this.rewrite(text + "3").getValue();
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, different);
        String printed = ExprPrinter.print(first);
        assertTrue(printed.startsWith("(2 ^ (2 ^ "));
        assertTrue(printed.endsWith("(2 ^ 2)" + ")".repeat(depth - 1)));
    }

    private static boolean containsWrapper(ExprNode node) {
        if(node.type == ExprNode.Type.GROUP
            || node.type == ExprNode.Type.EXPRESSION) {
            return true;
        }
        for(ExprNode child: node.children()) {
            if(containsWrapper(child)) {
                return true;
            }
        }
        return false;
    }

}
