import org.junit.jupiter.api.Test;

import com.cah.script.parser.AstPrinter;
import com.cah.script.parser.Lexer;
import com.cah.script.parser.Parser;
import com.cah.script.parser.Statement.Stmt;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CahParserTest {

    private final List<String> diagnostics = new ArrayList<>();

    private List<Stmt> parse(String source) {
        return new Parser(new Lexer(source, (line, msg) -> diagnostics.add(msg)).tokenize(),
                (line, msg) -> diagnostics.add(msg)).parse();
    }

    private String ast(String source) {
        return AstPrinter.print(parse(source));
    }

    @Test
    void arithmetic_precedence() {
        assertEquals("(print (+ 1 (* 2 3)))", ast("$< 1 + 2 * 3"));
        assertEquals("(* (group (+ 1 2)) 3)", ast("(1 + 2) * 3"));
        assertEquals("(- (/ 8 4) 1)", ast("8 / 4 - 1"));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void binaryLevels_areLeftAssociative() {
        assertEquals("(- (- 1 2) 3)", ast("1 - 2 - 3"));
        assertEquals("(/ (/ 8 4) 2)", ast("8 / 4 / 2"));
        assertEquals("(is (is a b) c)", ast("a is b is c"));
    }

    @Test
    void assignment_isRightAssociative() {
        assertEquals("(= a (= b 3))", ast("a = b = 3"));
    }

    @Test
    void andOr_shareOneLevel() {
        assertEquals("(and (or a b) c)", ast("a or b and c"));
        assertEquals("(or (and a b) c)", ast("a and b or c"));
    }

    @Test
    void equality_bindsLooserThanComparison() {
        assertEquals("(is (< 1 2) true)", ast("1 < 2 is true"));
        assertEquals("(not x none)", ast("x not none"));
    }

    @Test
    void unary_bindsTighterThanEquality_andLooserThanPostfix() {
        assertEquals("(is (not a) b)", ast("not a is b"));
        assertEquals("(- (postfix ++ x))", ast("-x++"));
    }

    @Test
    void declarations() {
        assertEquals("(var x)", ast("offering x"));
        assertEquals("(var x \"s\")", ast("offering x = \"s\""));
        assertEquals("(var y (+ 1 2))", ast("offering y = 1 +\n 2"));
    }

    @Test
    void compoundAssignment_desugars() {
        assertEquals("(= x (+ x 2))", ast("x += 2"));
        assertEquals("(= x (- x 1))", ast("x -= 1"));
    }

    @Test
    void blocks() {
        assertEquals("(block (var x 2) (print x))", ast("{\noffering x = 2\n$< x\n}"));
        assertEquals("(block (block (print 1)))", ast("{\n{\n$< 1\n}\n}"));
    }

    @Test
    void ifElse_sameLineAndNextLine() {
        String expected = "(if x (block (print 1)) (block (print 2)))";
        assertEquals(expected, ast("if x {\n$< 1\n} else {\n$< 2\n}"));
        assertEquals(expected, ast("if x {\n$< 1\n}\nelse {\n$< 2\n}"));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void ifWithoutElse_followedByStatement() {
        List<Stmt> program = parse("if x {\n$< 1\n}\n$< 2");
        assertEquals(2, program.size());
        assertEquals("(if x (block (print 1)))", AstPrinter.print(program.get(0)));
    }

    @Test
    void elseIf_nestsInsideElseBlock() {
        assertEquals(
                "(if a (block (print 1)) (block (if b (block (print 2)) (block (print 3)))))",
                ast("if a {\n$< 1\n} else if b {\n$< 2\n} else {\n$< 3\n}"));
    }

    @Test
    void whileLoop() {
        assertEquals("(while (< i 3) (block (group (postfix ++ i))))", ast("while i < 3 {\n(i++)\n}"));
    }

    @Test
    void ifRequiresBraces() {
        List<Stmt> program = parse("if x $< 1\n$< 2");
        assertEquals(1, diagnostics.size());
        assertEquals("Expected '{' after if condition.", diagnostics.get(0));
        assertEquals(2, program.size());
        assertEquals("(print 2)", AstPrinter.print(program.get(1)));
    }

    @Test
    void invalidAssignmentTarget_isReportedNotThrown() {
        List<Stmt> program = parse("1 = 2\n$< 3");
        assertEquals(List.of("Invalid assignment target."), diagnostics);
        assertEquals("1\n(print 3)", AstPrinter.print(program));
    }

    @Test
    void failedStatement_becomesNoOp_andParsingContinues() {
        List<Stmt> program = parse("1 + * 2\n$< 1");
        assertEquals(1, diagnostics.size());
        assertEquals("Expected an expression.", diagnostics.get(0));
        assertEquals("none\n(print 1)", AstPrinter.print(program));
    }

    @Test
    void missingVariableName_recoversAtNextLine() {
        List<Stmt> program = parse("offering = 5\n$< 1");
        assertEquals(List.of("Expected variable name."), diagnostics);
        assertEquals("none\n(print 1)", AstPrinter.print(program));
    }

    @Test
    void errorInsideBlock_onlyDropsThatStatement() {
        assertEquals("(block none (print 2))", ast("{\n$< )\n$< 2\n}"));
        assertEquals(1, diagnostics.size());
    }

    @Test
    void reservedKeywords_areRejected() {
        List<Stmt> program = parse("ritual greet\n$< 1");
        assertEquals(1, diagnostics.size());
        assertTrue(diagnostics.get(0).contains("'ritual' is reserved"));
        assertEquals(2, program.size());
    }

    @Test
    void parse_isTotal_onGarbage() {
        String[] inputs = { ")))}}}", "{{{", "= = =", "$<", "offering", "if {", "while", "else {\n}", "\"x\" \"y\"" };
        for (String src : inputs) {
            diagnostics.clear();
            List<Stmt> program = assertDoesNotThrow(() -> parse(src), src);
            assertNotNull(program);
            assertFalse(diagnostics.isEmpty(), src);
        }
    }

    @Test
    void recoveryInsideBlock_stopsAtItsClosingBrace() {
        assertEquals("(block none)\n(print 2)", ast("{ $< 1 }\n$< 2"));
        assertEquals(1, diagnostics.size());
    }

    @Test
    void recoveryAtTopLevel_skipsWholeBracedRegion() {
        assertEquals("none\n(print 2)", ast("if x y {\n$< 1\n}\n$< 2"));
        assertEquals(List.of("Expected '{' after if condition."), diagnostics);
    }

    @Test
    void nestingCap_isAParseError() {
        List<Stmt> program = parse("$< " + "(".repeat(Parser.MAX_NESTING + 1) + "1" + ")".repeat(Parser.MAX_NESTING + 1)
                + "\n$< 2");
        assertEquals(2, program.size());
        assertEquals(List.of("Expression nested too deeply."), diagnostics);
    }

    @Test
    void emptyProgram() {
        assertTrue(parse("").isEmpty());
        assertTrue(parse("\n\n? just a comment\n").isEmpty());
        assertTrue(diagnostics.isEmpty());
    }
}
