package com.scadlang.compiler.ast;

/**
 * AST 节点的源码范围（行、列从 0 开始，与解析器坐标一致）
 */
public final class Position {
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    public Position(int startLine, int startColumn, int endLine, int endColumn) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    /** 是否包含给定坐标（含起点，不含终点） */
    public boolean contains(int line, int column) {
        if (line < startLine || line > endLine) return false;
        if (line == startLine && column < startColumn) return false;
        if (line == endLine && column >= endColumn) return false;
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return startLine == other.startLine && startColumn == other.startColumn
                && endLine == other.endLine && endColumn == other.endColumn;
    }

    @Override
    public int hashCode() {
        int result = startLine;
        result = 31 * result + startColumn;
        result = 31 * result + endLine;
        result = 31 * result + endColumn;
        return result;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
