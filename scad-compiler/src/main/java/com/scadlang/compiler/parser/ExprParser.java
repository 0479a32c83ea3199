package com.scadlang.compiler.parser;

import com.scadlang.compiler.cst.CstNode;
import com.scadlang.compiler.lexer.Token;
import com.scadlang.compiler.lexer.TokenType;

import static com.scadlang.compiler.lexer.TokenType.*;

/**
 * 表达式解析
 *
 * <p>优先级从低到高：条件 {@code ?:}、{@code ||}、{@code &&}、相等、比较、加减、乘除模、
 * 一元、乘方 {@code ^}（右结合）、后缀（调用、下标、成员）。</p>
 */
class ExprParser {
    private final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    boolean canStartExpression() {
        return parser.checkAny(NUMBER, STRING, IDENTIFIER, SPECIAL_VARIABLE, KW_TRUE, KW_FALSE, KW_UNDEF,
                LPAREN, LBRACKET, MINUS, PLUS, NOT, KW_LET, KW_FUNCTION);
    }

    CstNode parseExpression() {
        return parseConditional();
    }

    private CstNode parseConditional() {
        CstNode condition = parseBinary(0);
        if (!parser.check(QUESTION)) {
            return condition;
        }
        NodeBuilder expr = new NodeBuilder();
        expr.add("condition", condition);
        expr.add(parser.token(parser.advance()));
        expr.add("consequence", parseExpression());
        expr.add(parser.expectOrMissing(COLON, ":"));
        expr.add("alternative", parseExpression());
        return parser.build(expr, "conditional_expression");
    }

    // 二元运算符按优先级分层
    private static final TokenType[][] BINARY_LEVELS = {
            {OR},
            {AND},
            {EQ, NE},
            {LT, LE, GT, GE},
            {PLUS, MINUS},
            {STAR, SLASH, PERCENT},
    };

    private CstNode parseBinary(int level) {
        if (level >= BINARY_LEVELS.length) {
            return parseUnary();
        }
        CstNode left = parseBinary(level + 1);
        while (parser.checkAny(BINARY_LEVELS[level])) {
            NodeBuilder expr = new NodeBuilder();
            expr.add("left", left);
            expr.add("operator", parser.token(parser.advance()));
            expr.add("right", parseBinary(level + 1));
            left = parser.build(expr, "binary_expression");
        }
        return left;
    }

    private CstNode parseUnary() {
        if (parser.checkAny(NOT, MINUS, PLUS)) {
            NodeBuilder expr = new NodeBuilder();
            expr.add("operator", parser.token(parser.advance()));
            expr.add("operand", parseUnary());
            return parser.build(expr, "unary_expression");
        }
        return parsePower();
    }

    private CstNode parsePower() {
        CstNode base = parsePostfix();
        if (!parser.check(CARET)) {
            return base;
        }
        NodeBuilder expr = new NodeBuilder();
        expr.add("left", base);
        expr.add("operator", parser.token(parser.advance()));
        expr.add("right", parseUnary());
        return parser.build(expr, "binary_expression");
    }

    private CstNode parsePostfix() {
        CstNode expr = parsePrimary();
        while (true) {
            if (parser.check(LPAREN)) {
                NodeBuilder call = new NodeBuilder();
                call.add("function", expr);
                call.add("arguments", parseArguments());
                expr = parser.build(call, "call_expression");
            } else if (parser.check(LBRACKET)) {
                NodeBuilder index = new NodeBuilder();
                index.add("value", expr);
                index.add(parser.token(parser.advance()));
                index.add("index", parseExpression());
                index.add(parser.expectOrMissing(RBRACKET, "]"));
                expr = parser.build(index, "index_expression");
            } else if (parser.check(DOT)) {
                NodeBuilder member = new NodeBuilder();
                member.add("value", expr);
                member.add(parser.token(parser.advance()));
                member.add("property", parser.named(parser.expect(IDENTIFIER, "Expected member name"), "identifier"));
                expr = parser.build(member, "member_expression");
            } else {
                return expr;
            }
        }
    }

    private CstNode parsePrimary() {
        Token token = parser.peek();
        switch (token.getType()) {
            case NUMBER:
                return parser.named(parser.advance(), "number");
            case STRING:
                return parser.named(parser.advance(), "string");
            case KW_TRUE:
            case KW_FALSE:
                return parser.named(parser.advance(), "boolean");
            case KW_UNDEF:
                return parser.named(parser.advance(), "undef");
            case IDENTIFIER:
                return parser.named(parser.advance(), "identifier");
            case SPECIAL_VARIABLE:
                return parser.named(parser.advance(), "special_variable");
            case LPAREN: {
                NodeBuilder expr = new NodeBuilder();
                expr.add(parser.token(parser.advance()));
                expr.add(parseExpression());
                expr.add(parser.expectOrMissing(RPAREN, ")"));
                return parser.build(expr, "parenthesized_expression");
            }
            case LBRACKET:
                return parseBracket();
            case KW_LET:
                return parseLet(false);
            case KW_FUNCTION: {
                NodeBuilder literal = new NodeBuilder();
                literal.add(parser.token(parser.advance()));
                literal.add("parameters", parseParameterList());
                literal.add("body", parseExpression());
                return parser.build(literal, "function_literal");
            }
            default:
                throw new ParseException("Expected expression", token);
        }
    }

    // ============ 方括号：向量、范围、列表推导 ============

    private CstNode parseBracket() {
        NodeBuilder bracket = new NodeBuilder();
        bracket.add(parser.token(parser.advance()));
        if (parser.check(RBRACKET)) {
            bracket.add(parser.token(parser.advance()));
            return parser.build(bracket, "vector_expression");
        }

        boolean comprehension = isClauseStart();
        CstNode first = parseElement();
        if (!comprehension && parser.check(COLON)) {
            return parseRange(bracket, first);
        }
        bracket.add(first);
        while (parser.check(COMMA)) {
            bracket.add(parser.token(parser.advance()));
            if (parser.check(RBRACKET)) {
                break; // 允许尾随逗号
            }
            comprehension |= isClauseStart();
            bracket.add(parseElement());
        }
        bracket.add(parser.expectOrMissing(RBRACKET, "]"));
        return parser.build(bracket, comprehension ? "list_comprehension" : "vector_expression");
    }

    private CstNode parseRange(NodeBuilder range, CstNode start) {
        range.add("start", start);
        range.add(parser.token(parser.advance()));
        CstNode second = parseExpression();
        if (parser.check(COLON)) {
            range.add("step", second);
            range.add(parser.token(parser.advance()));
            range.add("end", parseExpression());
        } else {
            range.add("end", second);
        }
        range.add(parser.expectOrMissing(RBRACKET, "]"));
        return parser.build(range, "range_expression");
    }

    private boolean isClauseStart() {
        return parser.checkAny(KW_FOR, KW_IF, KW_EACH);
    }

    /** 向量元素：普通表达式或推导子句 */
    private CstNode parseElement() {
        if (parser.check(KW_FOR)) {
            NodeBuilder clause = new NodeBuilder();
            clause.add(parser.token(parser.advance()));
            clause.add(parser.token(parser.expect(LPAREN, "Expected '(' after 'for'")));
            parseForAssignments(clause);
            clause.add(parser.expectOrMissing(RPAREN, ")"));
            clause.add("body", parseElement());
            return parser.build(clause, "for_clause");
        }
        if (parser.check(KW_IF)) {
            NodeBuilder clause = new NodeBuilder();
            clause.add(parser.token(parser.advance()));
            clause.add(parser.token(parser.expect(LPAREN, "Expected '(' after 'if'")));
            clause.add("condition", parseExpression());
            clause.add(parser.expectOrMissing(RPAREN, ")"));
            clause.add("consequence", parseElement());
            if (parser.check(KW_ELSE)) {
                clause.add(parser.token(parser.advance()));
                clause.add("alternative", parseElement());
            }
            return parser.build(clause, "if_clause");
        }
        if (parser.check(KW_EACH)) {
            NodeBuilder clause = new NodeBuilder();
            clause.add(parser.token(parser.advance()));
            clause.add("value", parseElement());
            return parser.build(clause, "each_clause");
        }
        if (parser.check(KW_LET)) {
            return parseLet(true);
        }
        return parseExpression();
    }

    private CstNode parseLet(boolean inComprehension) {
        NodeBuilder let = new NodeBuilder();
        let.add(parser.token(parser.advance()));
        let.add("arguments", parseArguments());
        let.add("body", inComprehension ? parseElement() : parseExpression());
        return parser.build(let, "let_expression");
    }

    // ============ 参数、形参与循环变量 ============

    /**
     * arguments := '(' (argument (',' argument)* ','?)? ')'
     */
    CstNode parseArguments() {
        NodeBuilder arguments = new NodeBuilder();
        arguments.add(parser.token(parser.expect(LPAREN, "Expected '('")));
        while (canStartExpression()) {
            arguments.add(parseArgument());
            if (!parser.check(COMMA)) {
                break;
            }
            arguments.add(parser.token(parser.advance()));
        }
        arguments.add(parser.expectOrMissing(RPAREN, ")"));
        return parser.build(arguments, "arguments");
    }

    private CstNode parseArgument() {
        NodeBuilder argument = new NodeBuilder();
        if (parser.checkAny(IDENTIFIER, SPECIAL_VARIABLE) && parser.checkNext(ASSIGN)) {
            Token name = parser.advance();
            argument.add("name", parser.named(name, name.is(IDENTIFIER) ? "identifier" : "special_variable"));
            argument.add(parser.token(parser.advance()));
            if (canStartExpression()) {
                argument.add("value", parseExpression());
            } else {
                parser.error("Expected argument value", parser.peek());
            }
        } else {
            argument.add("value", parseExpression());
        }
        return parser.build(argument, "argument");
    }

    /**
     * parameter_list := '(' (parameter (',' parameter)* ','?)? ')'
     */
    CstNode parseParameterList() {
        NodeBuilder parameters = new NodeBuilder();
        parameters.add(parser.token(parser.expect(LPAREN, "Expected '('")));
        while (parser.checkAny(IDENTIFIER, SPECIAL_VARIABLE)) {
            NodeBuilder parameter = new NodeBuilder();
            Token name = parser.advance();
            parameter.add("name", parser.named(name, name.is(IDENTIFIER) ? "identifier" : "special_variable"));
            if (parser.check(ASSIGN)) {
                parameter.add(parser.token(parser.advance()));
                parameter.add("default", parseExpression());
            }
            parameters.add(parser.build(parameter, "parameter"));
            if (!parser.check(COMMA)) {
                break;
            }
            parameters.add(parser.token(parser.advance()));
        }
        parameters.add(parser.expectOrMissing(RPAREN, ")"));
        return parser.build(parameters, "parameter_list");
    }

    /**
     * 把一个或多个 for_assignment 追加到 owner
     */
    void parseForAssignments(NodeBuilder owner) {
        do {
            NodeBuilder assignment = new NodeBuilder();
            Token name = parser.expect(IDENTIFIER, "Expected loop variable");
            assignment.add("name", parser.named(name, "identifier"));
            assignment.add(parser.token(parser.expect(ASSIGN, "Expected '=' in for")));
            assignment.add("value", parseExpression());
            owner.add(parser.build(assignment, "for_assignment"));
            if (!parser.check(COMMA)) {
                return;
            }
            owner.add(parser.token(parser.advance()));
        } while (true);
    }
}
