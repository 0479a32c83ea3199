package com.scadlang.compiler.lexer;

import com.scadlang.compiler.cst.Point;
import com.scadlang.compiler.cst.SyntaxError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * OpenSCAD 词法分析器
 *
 * <p>行、列从 0 开始。注释与空白被丢弃；无法识别的字符生成 {@link TokenType#ERROR}
 * Token 并记录一条 {@link SyntaxError}，分析不会中断。</p>
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<SyntaxError> errors = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 0;
    private int column = 0;
    private int startLine = 0;
    private int startColumn = 0;

    // include / use 之后的 <...> 按路径处理，而不是比较运算符
    private boolean expectPath = false;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("module", TokenType.KW_MODULE);
        map.put("function", TokenType.KW_FUNCTION);
        map.put("include", TokenType.KW_INCLUDE);
        map.put("use", TokenType.KW_USE);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("for", TokenType.KW_FOR);
        map.put("let", TokenType.KW_LET);
        map.put("each", TokenType.KW_EACH);

        // 常量
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("undef", TokenType.KW_UNDEF);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合（供 LSP 等外部工具使用） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            markStart();
            scanToken();
        }

        markStart();
        tokens.add(new Token(TokenType.EOF, "", null, line, column, current, line, column));
        return tokens;
    }

    public List<SyntaxError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    private void scanToken() {
        char c = advance();

        if (expectPath) {
            expectPath = false;
            if (c == '<') {
                includePath();
                return;
            }
        }

        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '#': addToken(TokenType.HASH); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '^': addToken(TokenType.CARET); break;
            case '?': addToken(TokenType.QUESTION); break;
            case ':': addToken(TokenType.COLON); break;

            // 可能是多字符的 Token
            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            case '.':
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '"':
                string();
                break;

            case '$':
                if (isAlpha(peek())) {
                    while (isAlphaNumeric(peek())) advance();
                    addToken(TokenType.SPECIAL_VARIABLE);
                } else {
                    error("Expected a name after '$'");
                }
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t' || c == '\n') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (peek() != '\n' && !isAtEnd()) advance();
            } else if (c == '/' && peekNext() == '*') {
                markStart();
                advance();
                advance();
                blockComment();
            } else {
                break;
            }
        }
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        errors.add(new SyntaxError("Unterminated block comment",
                new Point(startLine, startColumn), new Point(line, column)));
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start, line, column));
    }

    private void error(String message) {
        errors.add(new SyntaxError(message, new Point(startLine, startColumn), new Point(line, column)));
        addToken(TokenType.ERROR, message);
    }

    // === 复杂 Token 扫描 ===

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) {
            addToken(TokenType.IDENTIFIER);
            return;
        }
        if (type == TokenType.KW_INCLUDE || type == TokenType.KW_USE) {
            expectPath = true;
        }
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();

        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        } else if (peek() == '.' && source.charAt(start) != '.') {
            // 形如 "1." 的写法
            advance();
        }

        if (peek() == 'e' || peek() == 'E') {
            char sign = peekNext();
            int save = current;
            int saveLine = line;
            int saveColumn = column;
            advance();
            if (sign == '+' || sign == '-') advance();
            if (isDigit(peek())) {
                while (isDigit(peek())) advance();
            } else {
                // 不是指数，回退
                current = save;
                line = saveLine;
                column = saveColumn;
            }
        }

        String text = source.substring(start, current);
        addToken(TokenType.NUMBER, Double.parseDouble(text));
    }

    private void string() {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING, value.toString());
    }

    private String escapeChar() {
        char c = advance();
        switch (c) {
            case 'n': return "\n";
            case 't': return "\t";
            case 'r': return "\r";
            case '"': return "\"";
            case '\\': return "\\";
            case 'x': return hexEscape(2);
            case 'u': return hexEscape(4);
            default: return "\\" + c;
        }
    }

    private String hexEscape(int digits) {
        int begin = current;
        for (int i = 0; i < digits && isHexDigit(peek()); i++) {
            advance();
        }
        if (current - begin != digits) {
            return source.substring(begin - 2, current);
        }
        return String.valueOf((char) Integer.parseInt(source.substring(begin, current), 16));
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private void includePath() {
        while (!isAtEnd() && peek() != '>' && peek() != '\n') {
            advance();
        }
        if (peek() != '>') {
            error("Unterminated include path");
            return;
        }
        advance(); // 闭合的 >
        addToken(TokenType.INCLUDE_PATH, source.substring(start + 1, current - 1));
    }
}
