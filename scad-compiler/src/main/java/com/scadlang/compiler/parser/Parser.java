package com.scadlang.compiler.parser;

import com.scadlang.compiler.cst.CstNode;
import com.scadlang.compiler.cst.CstTree;
import com.scadlang.compiler.cst.Point;
import com.scadlang.compiler.cst.SyntaxError;
import com.scadlang.compiler.cst.SyntaxNode;
import com.scadlang.compiler.lexer.Lexer;
import com.scadlang.compiler.lexer.Token;
import com.scadlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.scadlang.compiler.lexer.TokenType.*;

/**
 * OpenSCAD 容错解析器，输出具体语法树
 *
 * <p>缺失的必需 token（如 {@code ;}、{@code )}）以零宽 missing 节点补齐；
 * 无法继续的语句由 {@link ParseException} 中断，跳过的 token 被包进 ERROR 节点后继续解析。</p>
 */
public class Parser {
    private final String source;
    private final List<Token> tokens;
    private final List<SyntaxError> errors = new ArrayList<SyntaxError>();
    private int index;
    private Token current;
    private Token previous;

    final ExprParser exprParser;
    final StmtParser stmtParser;

    public Parser(Lexer lexer, String source) {
        this.source = source != null ? source : "";
        this.tokens = lexer.scanTokens();
        this.errors.addAll(lexer.getErrors());
        this.index = 0;
        this.current = tokens.get(0);
        this.exprParser = new ExprParser(this);
        this.stmtParser = new StmtParser(this);
    }

    public Parser(String source) {
        this(new Lexer(source), source);
    }

    /**
     * 解析整个源文件
     */
    public CstTree parse() {
        NodeBuilder program = new NodeBuilder();
        parseStatementList(program, false);
        Point end = new Point(current.getLine(), current.getColumn());
        CstNode root = CstNode.branch("program", source, program.getChildren(), program.getFieldNames(),
                0, source.length(), Point.ORIGIN, end);
        return new CstTree(root, source, errors);
    }

    /**
     * 解析语句序列，直到 EOF（或块内遇到 '}'）
     */
    void parseStatementList(NodeBuilder target, boolean insideBlock) {
        while (!isAtEnd()) {
            if (insideBlock && check(RBRACE)) {
                return;
            }
            if (check(SEMICOLON)) {
                target.add(token(advance()));
                continue;
            }
            int startIndex = index;
            try {
                target.add(stmtParser.parseStatement());
            } catch (ParseException e) {
                Token token = e.getToken();
                if (token == null || !token.is(ERROR)) {
                    errors.add(new SyntaxError(e.getMessage(), pointOf(token)));
                }
                target.add(recover(startIndex, insideBlock));
            }
        }
    }

    /**
     * 从 startIndex 起同步到语句边界，把经过的 token 包进 ERROR 节点
     */
    private CstNode recover(int startIndex, boolean insideBlock) {
        if (index == startIndex) {
            advance(); // 跳过触发错误的 token
        }
        while (!isAtEnd()) {
            if (previous != null && previous.isOneOf(SEMICOLON, RBRACE)) {
                break;
            }
            if (insideBlock && check(RBRACE)) {
                break;
            }
            // 明确的语句起点
            if (checkAny(IDENTIFIER, SPECIAL_VARIABLE, LBRACE, KW_MODULE, KW_FUNCTION,
                    KW_INCLUDE, KW_USE, KW_IF, KW_FOR)) {
                break;
            }
            advance();
        }
        NodeBuilder error = new NodeBuilder();
        for (int i = startIndex; i < index; i++) {
            error.add(token(tokens.get(i)));
        }
        return error.build(SyntaxNode.ERROR_TYPE, source);
    }

    // ============ Token 导航 ============

    Token peek() {
        return current;
    }

    Token peekNext() {
        return index + 1 < tokens.size() ? tokens.get(index + 1) : current;
    }

    Token previous() {
        return previous;
    }

    boolean isAtEnd() {
        return current.is(EOF);
    }

    boolean check(TokenType type) {
        return current.is(type);
    }

    boolean checkAny(TokenType... types) {
        return current.isOneOf(types);
    }

    boolean checkNext(TokenType type) {
        return peekNext().is(type);
    }

    Token advance() {
        Token token = current;
        if (!isAtEnd()) {
            previous = current;
            index++;
            current = tokens.get(index);
        }
        return token;
    }

    /** 期待某个 token，缺失时抛出 {@link ParseException} */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 期待某个标点，缺失时记录错误并返回零宽 missing 节点
     */
    CstNode expectOrMissing(TokenType type, String text) {
        if (check(type)) {
            return token(advance());
        }
        int offset = previous != null ? previous.getEndOffset() : 0;
        Point at = previous != null ? new Point(previous.getEndLine(), previous.getEndColumn()) : Point.ORIGIN;
        errors.add(new SyntaxError("Missing '" + text + "'", at));
        return CstNode.missing(text, false, source, offset, at);
    }

    void error(String message, Token at) {
        errors.add(new SyntaxError(message, pointOf(at)));
    }

    // ============ 节点构造 ============

    /** 匿名 token 节点，类型即 token 文本 */
    CstNode token(Token token) {
        return leaf(token, token.is(ERROR) ? SyntaxNode.ERROR_TYPE : token.getLexeme(), token.is(ERROR));
    }

    /** 命名叶子节点 */
    CstNode named(Token token, String type) {
        return leaf(token, type, true);
    }

    CstNode build(NodeBuilder builder, String type) {
        return builder.build(type, source);
    }

    private CstNode leaf(Token token, String type, boolean named) {
        return CstNode.leaf(type, named, source, token.getOffset(), token.getEndOffset(),
                new Point(token.getLine(), token.getColumn()),
                new Point(token.getEndLine(), token.getEndColumn()));
    }

    private Point pointOf(Token token) {
        return token != null ? new Point(token.getLine(), token.getColumn()) : Point.ORIGIN;
    }
}
