package com.scadlang.compiler.parser;

import com.scadlang.compiler.cst.CstNode;
import com.scadlang.compiler.lexer.Token;

import static com.scadlang.compiler.lexer.TokenType.*;

/**
 * 语句解析
 */
class StmtParser {
    private final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    CstNode parseStatement() {
        Token token = parser.peek();
        switch (token.getType()) {
            case LBRACE:
                return parseBlock();
            case KW_MODULE:
                return parseModuleDefinition();
            case KW_FUNCTION:
                return parseFunctionDefinition();
            case KW_INCLUDE:
                return parseImport("include_statement");
            case KW_USE:
                return parseImport("use_statement");
            case KW_IF:
                return parseIf();
            case KW_FOR:
                return parseFor();
            case ASSIGN:
                // 缺少左值的赋值，保留结构交给适配层兜底
                parser.error("Missing assignment target", token);
                return parseAssignment(null);
            case SPECIAL_VARIABLE:
                return parseAssignment(parser.named(parser.advance(), "special_variable"));
            case IDENTIFIER:
                if (parser.checkNext(ASSIGN)) {
                    return parseAssignment(parser.named(parser.advance(), "identifier"));
                }
                return parseInstantiation();
            case KW_LET:
            case KW_EACH:
            case HASH:
            case NOT:
            case PERCENT:
            case STAR:
                return parseInstantiation();
            default:
                throw new ParseException("Expected statement", token);
        }
    }

    boolean canStartStatement() {
        return parser.checkAny(LBRACE, KW_MODULE, KW_FUNCTION, KW_INCLUDE, KW_USE, KW_IF, KW_FOR,
                ASSIGN, SPECIAL_VARIABLE, IDENTIFIER, KW_LET, KW_EACH, HASH, NOT, PERCENT, STAR);
    }

    // ============ 块与赋值 ============

    CstNode parseBlock() {
        NodeBuilder block = new NodeBuilder();
        block.add(parser.token(parser.expect(LBRACE, "Expected '{'")));
        parser.parseStatementList(block, true);
        block.add(parser.expectOrMissing(RBRACE, "}"));
        return parser.build(block, "block");
    }

    private CstNode parseAssignment(CstNode name) {
        NodeBuilder assignment = new NodeBuilder();
        assignment.add("name", name);
        assignment.add(parser.token(parser.expect(ASSIGN, "Expected '='")));
        assignment.add("value", optionalValue());
        assignment.add(parser.expectOrMissing(SEMICOLON, ";"));
        return parser.build(assignment, "assignment");
    }

    /** '=' 之后缺少表达式时记录错误并省略 value 字段 */
    private CstNode optionalValue() {
        if (parser.exprParser.canStartExpression()) {
            return parser.exprParser.parseExpression();
        }
        parser.error("Expected expression", parser.peek());
        return null;
    }

    // ============ 模块实例化 ============

    private CstNode parseInstantiation() {
        NodeBuilder instantiation = new NodeBuilder();
        while (parser.checkAny(HASH, NOT, PERCENT, STAR)) {
            instantiation.add(parser.token(parser.advance()));
        }
        if (parser.checkAny(IDENTIFIER, KW_LET, KW_EACH)) {
            instantiation.add("name", parser.named(parser.advance(), "identifier"));
        } else {
            throw new ParseException("Expected module name", parser.peek(), IDENTIFIER.name());
        }
        instantiation.add("arguments", parser.exprParser.parseArguments());
        parseChild(instantiation, "body");
        return parser.build(instantiation, "module_instantiation");
    }

    /**
     * 解析子语句：单独的 ';'、块或另一条语句
     */
    private void parseChild(NodeBuilder owner, String field) {
        if (parser.check(SEMICOLON)) {
            owner.add(parser.token(parser.advance()));
        } else if (parser.check(LBRACE)) {
            owner.add(field, parseBlock());
        } else if (canStartStatement()) {
            owner.add(field, parseStatement());
        } else {
            owner.add(parser.expectOrMissing(SEMICOLON, ";"));
        }
    }

    // ============ 控制流 ============

    private CstNode parseIf() {
        NodeBuilder statement = new NodeBuilder();
        statement.add(parser.token(parser.advance()));
        statement.add(parser.token(parser.expect(LPAREN, "Expected '(' after 'if'")));
        statement.add("condition", parser.exprParser.parseExpression());
        statement.add(parser.expectOrMissing(RPAREN, ")"));
        parseChild(statement, "consequence");
        if (parser.check(KW_ELSE)) {
            statement.add(parser.token(parser.advance()));
            parseChild(statement, "alternative");
        }
        return parser.build(statement, "if_statement");
    }

    private CstNode parseFor() {
        NodeBuilder statement = new NodeBuilder();
        statement.add(parser.token(parser.advance()));
        statement.add(parser.token(parser.expect(LPAREN, "Expected '(' after 'for'")));
        parser.exprParser.parseForAssignments(statement);
        statement.add(parser.expectOrMissing(RPAREN, ")"));
        parseChild(statement, "body");
        return parser.build(statement, "for_statement");
    }

    // ============ 声明 ============

    private CstNode parseModuleDefinition() {
        NodeBuilder definition = new NodeBuilder();
        definition.add(parser.token(parser.advance()));
        definition.add("name", parser.named(parser.expect(IDENTIFIER, "Expected module name"), "identifier"));
        definition.add("parameters", parser.exprParser.parseParameterList());
        parseChild(definition, "body");
        return parser.build(definition, "module_definition");
    }

    private CstNode parseFunctionDefinition() {
        NodeBuilder definition = new NodeBuilder();
        definition.add(parser.token(parser.advance()));
        definition.add("name", parser.named(parser.expect(IDENTIFIER, "Expected function name"), "identifier"));
        definition.add("parameters", parser.exprParser.parseParameterList());
        definition.add(parser.token(parser.expect(ASSIGN, "Expected '=' in function definition")));
        definition.add("body", optionalValue());
        definition.add(parser.expectOrMissing(SEMICOLON, ";"));
        return parser.build(definition, "function_definition");
    }

    private CstNode parseImport(String type) {
        NodeBuilder statement = new NodeBuilder();
        statement.add(parser.token(parser.advance()));
        if (parser.check(INCLUDE_PATH)) {
            statement.add("path", parser.named(parser.advance(), "include_path"));
        } else if (parser.check(STRING)) {
            statement.add("path", parser.named(parser.advance(), "string"));
        } else {
            throw new ParseException("Expected file path", parser.peek(), "<path>");
        }
        if (parser.check(SEMICOLON)) {
            statement.add(parser.token(parser.advance()));
        }
        return parser.build(statement, type);
    }
}
