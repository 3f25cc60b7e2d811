package com.grim.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.grim.script.parser.Expr.Binary;
import com.grim.script.parser.Expr.Call;
import com.grim.script.parser.Expr.ExprInterface;
import com.grim.script.parser.Expr.Literal;
import com.grim.script.parser.Expr.Unary;
import com.grim.script.parser.Expr.Variable;
import com.grim.script.parser.Statement.AssignStmt;
import com.grim.script.parser.Statement.FunctionStmt;
import com.grim.script.parser.Statement.If;
import com.grim.script.parser.Statement.IfElse;
import com.grim.script.parser.Statement.InputStmt;
import com.grim.script.parser.Statement.PrintStmt;
import com.grim.script.parser.Statement.ReturnStmt;
import com.grim.script.parser.Statement.Stmt;
import com.grim.script.parser.Statement.VarStmt;
import com.grim.script.parser.Statement.While;

public class Parser {
    private static final int MAX_PARAMETERS = 255;

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(declaration());
        }
        return statements;
    }

    private Stmt declaration() {
        if (match(TokenType.FN)) return functionDeclaration();
        if (match(TokenType.LET)) return varDeclaration();
        return statement();
    }

    private Stmt functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<String> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_PARAMETERS) {
                    throw error(peek(), "Too many parameters (max " + MAX_PARAMETERS + ").");
                }
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name.").lexeme);
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");

        List<Stmt> body = block();
        return new FunctionStmt(name.lexeme, params, body);
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        ExprInterface initializer = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new VarStmt(name.lexeme, initializer);
    }

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.PRINT)) return printStatement();
        if (match(TokenType.INPUT)) return inputStatement();
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL)) return assignment();
        throw error(peek(), "Expect statement.");
    }

    private Stmt assignment() {
        Token name = advance();
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        ExprInterface value = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after assignment.");
        return new AssignStmt(name.lexeme, value);
    }

    private Stmt ifStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        consume(TokenType.LEFT_BRACE, "Expect '{' before if body.");
        List<Stmt> thenBranch = block();
        if (match(TokenType.ELSE)) {
            consume(TokenType.LEFT_BRACE, "Expect '{' after 'else'.");
            List<Stmt> elseBranch = block();
            return new IfElse(condition, thenBranch, elseBranch);
        }
        return new If(condition, thenBranch);
    }

    private Stmt whileStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
        ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after condition.");
        consume(TokenType.LEFT_BRACE, "Expect '{' before loop body.");
        return new While(condition, block());
    }

    private Stmt returnStatement() {
        ExprInterface value = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return new ReturnStmt(value);
    }

    private Stmt printStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'print'.");
        ExprInterface content = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after print argument.");
        consume(TokenType.SEMICOLON, "Expect ';' after print.");
        return new PrintStmt(content);
    }

    private Stmt inputStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'input'.");
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name in input.");
        consume(TokenType.RIGHT_PAREN, "Expect ')' after input variable.");
        consume(TokenType.SEMICOLON, "Expect ';' after input.");
        return new InputStmt(name.lexeme);
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(declaration());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private ExprInterface expression() { return or(); }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            ExprInterface right = and();
            expr = new Binary(expr, BinaryOperator.OR, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = equality();
        while (match(TokenType.AND_AND)) {
            ExprInterface right = equality();
            expr = new Binary(expr, BinaryOperator.AND, right);
        }
        return expr;
    }

    private ExprInterface equality() {
        ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            BinaryOperator op = binaryOperator(previous());
            ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface comparison() {
        ExprInterface expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            BinaryOperator op = binaryOperator(previous());
            ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface term() {
        ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryOperator op = binaryOperator(previous());
            ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface factor() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            BinaryOperator op = binaryOperator(previous());
            ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.BANG)) return new Unary(UnaryOperator.NOT, unary());
        if (match(TokenType.MINUS)) return new Unary(UnaryOperator.NEGATE, unary());
        return call();
    }

    private ExprInterface call() {
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_PAREN)) {
            Token name = advance();
            advance();
            List<ExprInterface> arguments = new ArrayList<>();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
            return new Call(name.lexeme, arguments);
        }
        return primary();
    }

    private ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Value.bool(false));
        if (match(TokenType.TRUE)) return new Literal(Value.bool(true));
        if (match(TokenType.INTEGER)) return new Literal(Value.integer((Long) previous().literal));
        if (match(TokenType.FLOAT)) return new Literal(Value.floating((Double) previous().literal));
        if (match(TokenType.STRING)) return new Literal(Value.string((String) previous().literal));
        if (match(TokenType.IDENTIFIER)) return new Variable(previous().lexeme);
        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }
        throw error(peek(), "Expect expression.");
    }

    private BinaryOperator binaryOperator(Token token) {
        switch (token.type) {
            case PLUS:          return BinaryOperator.ADD;
            case MINUS:         return BinaryOperator.SUB;
            case STAR:          return BinaryOperator.MUL;
            case SLASH:         return BinaryOperator.DIV;
            case PERCENT:       return BinaryOperator.MOD;
            case LESS:          return BinaryOperator.LESS;
            case GREATER:       return BinaryOperator.GREATER;
            case LESS_EQUAL:    return BinaryOperator.LESS_EQ;
            case GREATER_EQUAL: return BinaryOperator.GREATER_EQ;
            case EQUAL_EQUAL:   return BinaryOperator.EQ;
            case BANG_EQUAL:    return BinaryOperator.NEQ;
            default: throw error(token, "Not a binary operator.");
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseException error(Token token, String message) {
        String where = (token.type == TokenType.EOF) ? " at end" : " at '" + token.lexeme + "'";
        return new ParseException(token.line, message + where);
    }
}
