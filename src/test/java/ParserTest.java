import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.grim.script.GrimScript;
import com.grim.script.parser.BinaryOperator;
import com.grim.script.parser.Expr;
import com.grim.script.parser.Lexer;
import com.grim.script.parser.ParseException;
import com.grim.script.parser.Statement;
import com.grim.script.parser.Statement.Stmt;
import com.grim.script.parser.Token;
import com.grim.script.parser.TokenType;
import com.grim.script.parser.UnaryOperator;
import com.grim.script.parser.Value;

public class ParserTest {

    @Test
    void lexer_recognisesKeywordsOperatorsAndComments() {
        List<Token> tokens = new Lexer("let x = 1 <= 2.5 && !y; // trailing\nfn").tokenize();

        TokenType[] expected = {
                TokenType.LET, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INTEGER,
                TokenType.LESS_EQUAL, TokenType.FLOAT, TokenType.AND_AND, TokenType.BANG,
                TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.FN, TokenType.EOF
        };
        assertEquals(expected.length, tokens.size());
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], tokens.get(i).type(), "token " + i);
        }
        assertEquals(2, tokens.get(10).line);
    }

    @Test
    void lexer_errorsCarryLine() {
        ParseException ex = assertThrows(ParseException.class, () -> new Lexer("let a = 1;\nlet b = #;").tokenize());
        assertEquals(2, ex.getLine());
        assertThrows(ParseException.class, () -> new Lexer("\"open").tokenize());
        assertThrows(ParseException.class, () -> new Lexer("a & b").tokenize());
        assertThrows(ParseException.class, () -> new Lexer("99999999999999999999").tokenize());
    }

    @Test
    void parse_statementForms() {
        List<Stmt> program = GrimScript.parse(
                "let x = 1;\n" +
                "x = 2;\n" +
                "if (x > 1) { print(x); }\n" +
                "if (x > 1) { print(x); } else { print(0); }\n" +
                "while (false) { }\n" +
                "fn f(a, b) { return a; }\n" +
                "input(x);\n"
        );

        assertEquals(7, program.size());
        assertInstanceOf(Statement.VarStmt.class, program.get(0));
        assertInstanceOf(Statement.AssignStmt.class, program.get(1));
        assertInstanceOf(Statement.If.class, program.get(2));
        assertInstanceOf(Statement.IfElse.class, program.get(3));
        assertInstanceOf(Statement.While.class, program.get(4));
        Statement.FunctionStmt fn = assertInstanceOf(Statement.FunctionStmt.class, program.get(5));
        assertEquals(List.of("a", "b"), fn.params);
        assertInstanceOf(Statement.ReturnStmt.class, fn.body.get(0));
        assertInstanceOf(Statement.InputStmt.class, program.get(6));
    }

    @Test
    void parse_precedence() {
        Statement.VarStmt let = (Statement.VarStmt) GrimScript.parse("let r = a || b && c == 1 + 2 * -d;").get(0);

        Expr.Binary or = assertInstanceOf(Expr.Binary.class, let.initializer);
        assertEquals(BinaryOperator.OR, or.operator);
        Expr.Binary and = assertInstanceOf(Expr.Binary.class, or.right);
        assertEquals(BinaryOperator.AND, and.operator);
        Expr.Binary eq = assertInstanceOf(Expr.Binary.class, and.right);
        assertEquals(BinaryOperator.EQ, eq.operator);
        Expr.Binary add = assertInstanceOf(Expr.Binary.class, eq.right);
        assertEquals(BinaryOperator.ADD, add.operator);
        Expr.Binary mul = assertInstanceOf(Expr.Binary.class, add.right);
        assertEquals(BinaryOperator.MUL, mul.operator);
        Expr.Unary neg = assertInstanceOf(Expr.Unary.class, mul.right);
        assertEquals(UnaryOperator.NEGATE, neg.operator);
    }

    @Test
    void parse_leftAssociativeSubtraction() {
        Statement.VarStmt let = (Statement.VarStmt) GrimScript.parse("let r = 10 - 3 - 2;").get(0);
        Expr.Binary outer = assertInstanceOf(Expr.Binary.class, let.initializer);
        assertInstanceOf(Expr.Binary.class, outer.left);
        Expr.Literal two = assertInstanceOf(Expr.Literal.class, outer.right);
        assertEquals(Value.integer(2), two.value);
    }

    @Test
    void parse_callWithArguments() {
        Statement.PrintStmt print = (Statement.PrintStmt) GrimScript.parse("print(max(1, \"s\", true));").get(0);
        Expr.Call call = assertInstanceOf(Expr.Call.class, print.content);
        assertEquals("max", call.name);
        assertEquals(3, call.arguments.size());
    }

    @Test
    void parse_errors() {
        assertThrows(ParseException.class, () -> GrimScript.parse("let x = ;"));
        assertThrows(ParseException.class, () -> GrimScript.parse("let x = 1"));
        assertThrows(ParseException.class, () -> GrimScript.parse("if x { }"));
        assertThrows(ParseException.class, () -> GrimScript.parse("while (true) { "));
        assertThrows(ParseException.class, () -> GrimScript.parse("x + 1;"));
        assertThrows(ParseException.class, () -> GrimScript.parse("input(1);"));
        ParseException ex = assertThrows(ParseException.class, () -> GrimScript.parse("let a = 1;\nlet = 2;"));
        assertEquals(2, ex.getLine());
    }
}
