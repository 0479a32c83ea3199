package com.scadlang.compiler.lexer;

/**
 * Token 类型
 */
public enum TokenType {
    // 字面量与名称
    NUMBER,
    STRING,
    IDENTIFIER,
    SPECIAL_VARIABLE,
    INCLUDE_PATH,

    // 关键词
    KW_MODULE,
    KW_FUNCTION,
    KW_IF,
    KW_ELSE,
    KW_FOR,
    KW_LET,
    KW_EACH,
    KW_INCLUDE,
    KW_USE,
    KW_TRUE,
    KW_FALSE,
    KW_UNDEF,

    // 运算符
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    CARET,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    AND,
    OR,
    NOT,
    QUESTION,
    COLON,
    ASSIGN,

    // 分隔符
    SEMICOLON,
    COMMA,
    DOT,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    HASH,

    // 特殊
    ERROR,
    EOF;

    public boolean isKeyword() {
        return name().startsWith("KW_");
    }
}
