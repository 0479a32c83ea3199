package com.scadlang.compiler.cst;

/**
 * 解析期间收集到的语法错误
 */
public final class SyntaxError {
    private final String message;
    private final Point start;
    private final Point end;

    public SyntaxError(String message, Point start, Point end) {
        this.message = message;
        this.start = start;
        this.end = end;
    }

    public SyntaxError(String message, Point at) {
        this(message, at, at);
    }

    public String getMessage() {
        return message;
    }

    public Point getStart() {
        return start;
    }

    public Point getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return message + " at " + start;
    }
}
