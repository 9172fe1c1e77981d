package com.truthy.processor.parser;

import com.truthy.processor.ast.Expression;
import com.truthy.processor.ast.GroupExpr;
import com.truthy.processor.ast.Identifier;
import com.truthy.processor.ast.LogicalExpr;
import com.truthy.processor.ast.NotExpr;
import com.truthy.processor.ast.Position;
import com.truthy.processor.lexer.Lexer;
import com.truthy.processor.lexer.Token;
import com.truthy.processor.lexer.TokenType;

import static com.truthy.processor.lexer.TokenType.*;

/**
 * 真值表达式语法分析器（递归下降）
 *
 * <pre>
 * Expr   := Term (BinOp Expr)? | '!' Expr | '(' Expr ')' (BinOp Expr)?
 * Term   := IDENTIFIER
 * BinOp  := '&&' | '||'
 * </pre>
 *
 * <p>不做优先级推断：分组只由括号决定；运算符链先识别第一项和运算符，
 * 再递归解析剩余部分，因此 {@code a && b && c} 解析为 {@code a && (b && c)}。
 * 解析过程不对任何标识符求值。</p>
 */
public class Parser {

    private static final String MALFORMED = "Malformed boolean expression";

    final Lexer lexer;
    Token current;
    Token previous;

    public Parser(Lexer lexer) {
        this.lexer = lexer;
        advance();  // 读取第一个 token
    }

    /**
     * 解析完整表达式
     *
     * @throws ParseException 不符合语法，指出第一个无法匹配的 token
     */
    public Expression parse() {
        Expression expr = parseExpression();
        if (!isAtEnd()) {
            if (check(RPAREN)) {
                throw error(MALFORMED + ": unbalanced parentheses", "'&&', '||' or end of expression");
            }
            throw error(MALFORMED + ": unexpected token after complete expression",
                    "'&&', '||' or end of expression");
        }
        return expr;
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        current = lexer.nextToken();
        return previous;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message, String expected) {
        if (check(type)) {
            return advance();
        }
        throw error(message, expected);
    }

    /**
     * 刚消费的 token 的位置
     */
    Position previousPosition() {
        return new Position(previous.getLine(), previous.getColumn());
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    /**
     * 以当前 token 构造解析异常；ERROR token 使用词法错误描述
     */
    ParseException error(String message, String expected) {
        if (check(ERROR)) {
            return new ParseException(MALFORMED + ": " + current.getError(), current, expected);
        }
        return new ParseException(message, current, expected);
    }

    // ============ 表达式 ============

    Expression parseExpression() {
        // '!' Expr：取反作用于整个剩余部分
        if (match(NOT)) {
            Position pos = previousPosition();
            return new NotExpr(pos, parseExpression());
        }

        // '(' Expr ')'，其后可接运算符与剩余部分
        if (match(LPAREN)) {
            Position pos = previousPosition();
            Expression inner = parseExpression();
            expect(RPAREN, MALFORMED + ": unbalanced parentheses", "')'");
            return parseRest(new GroupExpr(pos, inner));
        }

        // Term，其后可接运算符与剩余部分
        if (match(IDENTIFIER)) {
            Position pos = previousPosition();
            return parseRest(new Identifier(pos, previous.getLexeme()));
        }

        throw error(MALFORMED + ": expected an operand", "identifier, '!' or '('");
    }

    private Expression parseRest(Expression left) {
        if (current.getType().isBinaryOperator()) {
            Token op = advance();
            Position pos = previousPosition();
            Expression right = parseExpression();
            LogicalExpr.LogicalOp logicalOp = op.is(AND) ? LogicalExpr.LogicalOp.AND : LogicalExpr.LogicalOp.OR;
            return new LogicalExpr(pos, left, logicalOp, right);
        }
        return left;
    }
}
