import com.ramlang.script.RamModule;
import com.ramlang.script.RamScript;
import com.ramlang.script.error.RamBlockException;
import com.ramlang.script.error.RamKeywordException;
import com.ramlang.script.error.RamSyntaxException;
import com.ramlang.script.parser.Expr;
import com.ramlang.script.parser.Operator;
import com.ramlang.script.parser.Statement;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RamBlockParserTest {

    private static Statement.Stmt single(String... lines) {
        RamModule module = new RamScript().parse(String.join("\n", lines));
        assertEquals(1, module.size());
        return module.statements().get(0);
    }

    // ---------------- loop ----------------

    @Test
    void loopHeaderAndBody() {
        Statement.Loop loop = assertInstanceOf(Statement.Loop.class, single(
                "loop with x from 0 to 4 {",
                "    display x",
                "}"));

        assertEquals("x", loop.variable);
        assertEquals(0.0, ((Expr.Literal) loop.start).value);
        assertEquals(4.0, ((Expr.Literal) loop.stop).value);
        assertEquals(1, loop.body.size());
        Statement.Display d = assertInstanceOf(Statement.Display.class, loop.body.get(0));
        assertEquals("x", ((Expr.Variable) d.value).name);
    }

    @Test
    void loopBoundsAreExpressions() {
        Statement.Loop loop = assertInstanceOf(Statement.Loop.class, single(
                "loop with j from (15) to (var1 + 1) {",
                "display j",
                "}"));

        assertEquals(15.0, ((Expr.Literal) loop.start).value);
        Expr.Binary stop = assertInstanceOf(Expr.Binary.class, loop.stop);
        assertEquals(Operator.PLUS, stop.operator);
    }

    @Test
    void nestedLoopsGiveNestedStatements() {
        Statement.Loop outer = assertInstanceOf(Statement.Loop.class, single(
                "loop with j from 1 to 3 {",
                "    loop with k from 1 to 2 {",
                "        display j + k",
                "    }",
                "}"));

        Statement.Loop inner = assertInstanceOf(Statement.Loop.class, outer.body.get(0));
        assertEquals("k", inner.variable);
        assertInstanceOf(Statement.Display.class, inner.body.get(0));
    }

    @Test
    void loopHeaderWordsAreChecked() {
        RamKeywordException noWith = assertThrows(RamKeywordException.class,
                () -> single("loop for x from 0 to 4 {", "display x", "}"));
        assertEquals("for", noWith.getKeyword());
        assertEquals(1, noWith.getLineNumber());

        RamKeywordException noFrom = assertThrows(RamKeywordException.class,
                () -> single("loop with x in 0 to 4 {", "display x", "}"));
        assertEquals("in", noFrom.getKeyword());

        assertThrows(RamSyntaxException.class, () -> single("loop with x from 0 {", "display x", "}"));
    }

    // ---------------- function ----------------

    @Test
    void functionTakesSendBackAsItsReturnValue() {
        Statement.FunctionStmt fn = assertInstanceOf(Statement.FunctionStmt.class, single(
                "new function add takes (a, b) {",
                "    send back a + b",
                "}"));

        assertEquals("add", fn.name);
        assertEquals(List.of("a", "b"), fn.params);
        assertTrue(fn.body.isEmpty());
        Expr.Binary ret = assertInstanceOf(Expr.Binary.class, fn.returnValue);
        assertEquals(Operator.PLUS, ret.operator);
        assertEquals("a", ((Expr.Variable) ret.left).name);
        assertEquals("b", ((Expr.Variable) ret.right).name);
    }

    @Test
    void functionWithoutSendBackReturnsEmpty() {
        Statement.FunctionStmt fn = assertInstanceOf(Statement.FunctionStmt.class, single(
                "new function greet takes (name) {",
                "    display \"Hello \" + name",
                "}"));

        assertEquals(1, fn.body.size());
        assertSame(Expr.Empty.INSTANCE, fn.returnValue);
    }

    @Test
    void functionWithNoParameters() {
        Statement.FunctionStmt fn = assertInstanceOf(Statement.FunctionStmt.class, single(
                "new function answer takes () {",
                "    set integer x to 42",
                "    send back x",
                "}"));

        assertTrue(fn.params.isEmpty());
        assertEquals(1, fn.body.size());
        assertEquals("x", ((Expr.Variable) fn.returnValue).name);
    }

    @Test
    void functionHeaderWordsAreChecked() {
        RamKeywordException e = assertThrows(RamKeywordException.class,
                () -> single("new func add takes (a) {", "send back a", "}"));
        assertEquals("func", e.getKeyword());

        RamKeywordException takes = assertThrows(RamKeywordException.class,
                () -> single("new function add with (a) {", "send back a", "}"));
        assertEquals("with", takes.getKeyword());

        assertThrows(RamSyntaxException.class,
                () -> single("new function add takes (a) extra {", "send back a", "}"));
        assertThrows(RamSyntaxException.class,
                () -> single("new function add takes {", "send back a", "}"));
    }

    @Test
    void unknownBlockKeyword() {
        RamKeywordException e = assertThrows(RamKeywordException.class,
                () -> single("while x {", "display x", "}"));
        assertEquals("while", e.getKeyword());
    }

    // ---------------- if ----------------

    @Test
    void ifWithTwoOperandsComparesThem() {
        Statement.If stmt = assertInstanceOf(Statement.If.class, single(
                "if (var1) is (0) {",
                "    display \"zero\"",
                "}"));

        assertEquals(1, stmt.branches.size());
        Expr.Binary cond = assertInstanceOf(Expr.Binary.class, stmt.branches.get(0).condition);
        assertEquals(Operator.IS, cond.operator);
        assertEquals("var1", ((Expr.Variable) cond.left).name);
        assertEquals(0.0, ((Expr.Literal) cond.right).value);
        assertTrue(stmt.elseBody.isEmpty());
    }

    @Test
    void isSplitsTheWholeSides() {
        Statement.If stmt = assertInstanceOf(Statement.If.class, single(
                "if y + 2 is x * 3 {",
                "    display y",
                "}"));

        Expr.Binary cond = (Expr.Binary) stmt.branches.get(0).condition;
        assertEquals(Operator.IS, cond.operator);
        assertEquals(Operator.PLUS, ((Expr.Binary) cond.left).operator);
        assertEquals(Operator.STAR, ((Expr.Binary) cond.right).operator);
    }

    @Test
    void ifWithOneOperandUsesItDirectly() {
        Statement.If stmt = assertInstanceOf(Statement.If.class, single(
                "if ready {",
                "    display 1",
                "}"));

        assertEquals("ready", ((Expr.Variable) stmt.branches.get(0).condition).name);
    }

    @Test
    void plainElseIsAFlatElseBody() {
        Statement.If stmt = assertInstanceOf(Statement.If.class, single(
                "if flag {",
                "    display 1",
                "} else {",
                "    display 2",
                "    display 3",
                "}"));

        assertEquals(1, stmt.branches.get(0).body.size());
        assertEquals(2, stmt.elseBody.size());
        assertInstanceOf(Statement.Display.class, stmt.elseBody.get(0));
    }

    @Test
    void elseIfChainIsRightNested() {
        Statement.If first = assertInstanceOf(Statement.If.class, single(
                "if (var1) is (0) {",
                "    set integer x to 4 * 3",
                "    display \"The End\"",
                "} else if (var1) is (15) {",
                "    if (y + 2) is (3) {",
                "        reset integer y to 2",
                "    }",
                "    display \"Hello World!\"",
                "} else {",
                "    display \"other\"",
                "}"));

        assertEquals(2, first.branches.get(0).body.size());
        assertEquals(1, first.elseBody.size());

        Statement.If second = assertInstanceOf(Statement.If.class, first.elseBody.get(0));
        Expr.Binary cond = (Expr.Binary) second.branches.get(0).condition;
        assertEquals(15.0, ((Expr.Literal) cond.right).value);
        assertEquals(2, second.branches.get(0).body.size());
        assertInstanceOf(Statement.If.class, second.branches.get(0).body.get(0));

        assertEquals(1, second.elseBody.size());
        Statement.Display last = assertInstanceOf(Statement.Display.class, second.elseBody.get(0));
        assertEquals("other", ((Expr.Literal) last.value).value);
    }

    @Test
    void chainOfFourBranchesHasThreeIfNodes() {
        Statement.If stmt = assertInstanceOf(Statement.If.class, single(
                "if x is 1 {",
                "display 1",
                "} else if x is 2 {",
                "display 2",
                "} else if x is 3 {",
                "display 3",
                "} else {",
                "display 4",
                "}"));

        int ifNodes = 1;
        Statement.If current = stmt;
        while (current.elseBody.size() == 1 && current.elseBody.get(0) instanceof Statement.If) {
            current = (Statement.If) current.elseBody.get(0);
            ifNodes++;
        }
        assertEquals(3, ifNodes);
        assertInstanceOf(Statement.Display.class, current.elseBody.get(0));
    }

    @Test
    void dividerMustSayElse() {
        RamKeywordException e = assertThrows(RamKeywordException.class, () -> single(
                "if x {",
                "display 1",
                "} otherwise {",
                "display 2",
                "}"));
        assertEquals("otherwise", e.getKeyword());
        assertEquals(3, e.getLineNumber());
    }

    @Test
    void nothingFollowsAFinalElse() {
        assertThrows(RamBlockException.class, () -> single(
                "if x {",
                "display 1",
                "} else {",
                "display 2",
                "} else {",
                "display 3",
                "}"));
    }

    @Test
    void elseInsideALoopIsRejected() {
        RamBlockException e = assertThrows(RamBlockException.class, () -> single(
                "loop with i from 0 to 2 {",
                "display i",
                "} else {",
                "display 0",
                "}"));
        assertEquals(3, e.getLineNumber());
    }

    @Test
    void errorInsideANestedBlockKeepsTheInnermostLine() {
        RamKeywordException e = assertThrows(RamKeywordException.class, () -> single(
                "loop with i from 0 to 2 {",
                "    if i is 1 {",
                "        shout i",
                "    }",
                "}"));
        assertEquals(3, e.getLineNumber());
        assertEquals("shout i", e.getLine());
    }
}
