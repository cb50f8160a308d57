
package typesafeschwalbe.mmlc.compiler;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class ErrorTest {

    private static final Map<String, String> FILES = Map.of(
        "main.mml", "val a =\n  1 + nope\n"
    );

    private static Error sample() {
        return new Error(
            Error.Kind.UNRESOLVABLE_REFERENCE,
            "Unresolvable reference",
            Error.Marking.error(
                new Source("main.mml", 14, 18), "'nope' is not declared"
            )
        );
    }

    @Test
    public void testRender() {
        assertEquals(
            "error[unresolvable-reference]: Unresolvable reference\n"
                + "  ^ main.mml:2:7 'nope' is not declared\n",
            sample().render(FILES)
        );
    }

    @Test
    public void testEquality() {
        assertEquals(sample(), sample());
        assertEquals(sample().hashCode(), sample().hashCode());
    }

    @Test
    public void testSourceJoining() {
        Source joined = new Source(
            new Source("main.mml", 2, 4), new Source("main.mml", 8, 9)
        );
        assertEquals(new Source("main.mml", 2, 9), joined);
        assertThrows(
            IllegalArgumentException.class,
            () -> new Source(
                new Source("main.mml", 2, 4), new Source("other.mml", 8, 9)
            )
        );
        assertThrows(
            IllegalArgumentException.class,
            () -> new Source("main.mml", 5, 4)
        );
    }

    @Test
    public void testResultValue() throws ErrorException {
        Result<Integer> result = Result.ofValue(3);
        assertTrue(result.isValue());
        assertFalse(result.isError());
        assertEquals(4, result.map(v -> v + 1).getValue());
        assertEquals(3, result.orElseThrow());
        assertThrows(IllegalStateException.class, result::getError);
    }

    @Test
    public void testResultError() {
        Result<Integer> result = Result.ofError(sample());
        assertTrue(result.isError());
        assertEquals(List.of(sample()), result.getError());
        assertTrue(result.map(v -> v + 1).isError());
        assertThrows(IllegalStateException.class, result::getValue);
        ErrorException thrown = assertThrows(
            ErrorException.class, result::orElseThrow
        );
        assertEquals(sample(), thrown.error);
        assertThrows(
            IllegalArgumentException.class, () -> Result.ofError(List.of())
        );
    }

}
