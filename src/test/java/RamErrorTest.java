import com.ramlang.script.error.RamBlockException;
import com.ramlang.script.error.RamException;
import com.ramlang.script.error.RamGeneralException;
import com.ramlang.script.error.RamNameException;
import com.ramlang.script.error.RamOperatorException;
import com.ramlang.script.error.RamSyntaxException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RamErrorTest {

    @Test
    void rendersLineAndDetail() {
        RamException e = new RamSyntaxException("display (1", 4, "Missing ')'.");
        assertEquals("Line 4: 'display (1'\n     Missing ')'.", e.getMessage());
    }

    @Test
    void rendersLineOnlyWithoutDetail() {
        RamException e = new RamBlockException("}", 9, null);
        assertEquals("Line 9: '}'", e.getMessage());
    }

    @Test
    void unlocatedErrorRendersItsDetail() {
        RamOperatorException e = new RamOperatorException("%");
        assertFalse(e.isLocated());
        assertEquals("Operator '%' invalid.", e.getMessage());
    }

    @Test
    void locatingKeepsKindAndDetail() {
        RamException located = new RamOperatorException("%").locatedAt("display 1 % 2", 3);

        RamOperatorException op = assertInstanceOf(RamOperatorException.class, located);
        assertEquals("%", op.getOperator());
        assertEquals(3, op.getLineNumber());
        assertEquals("Line 3: 'display 1 % 2'\n     Operator '%' invalid.", op.getMessage());
    }

    @Test
    void innermostLocationWins() {
        RamException inner = new RamSyntaxException("display (", 7, "Missing ')'.");
        RamException outer = inner.locatedAt("loop with i from 0 to 1 {", 6);

        assertSame(inner, outer);
        assertEquals(7, outer.getLineNumber());
    }

    @Test
    void causeSurvivesRelocation() {
        IllegalStateException cause = new IllegalStateException("boom");
        RamException e = new RamGeneralException(null, 0, "boom", cause).locatedAt("x", 1);
        assertSame(cause, e.getCause());
    }

    @Test
    void nameErrorNamesTheVariable() {
        RamNameException e = new RamNameException("total");
        assertEquals("total", e.getName());
        assertEquals("Variable 'total' not defined.", e.getMessage());
    }
}
