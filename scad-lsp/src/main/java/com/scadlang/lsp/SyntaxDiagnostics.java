package com.scadlang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.scadlang.compiler.cst.Point;
import com.scadlang.compiler.cst.SyntaxError;
import com.scadlang.compiler.cst.SyntaxTree;

import static com.scadlang.lsp.LspConstants.SEVERITY_ERROR;

/**
 * 把语法树上收集到的语法错误转换为 LSP Diagnostic
 */
public final class SyntaxDiagnostics {
    public static final String SOURCE = "scad";

    private SyntaxDiagnostics() {}

    public static JsonArray of(DocumentState state) {
        if (state == null || state.getSyntaxTree() == null) {
            return new JsonArray();
        }
        return of(state.getSyntaxTree());
    }

    public static JsonArray of(SyntaxTree tree) {
        JsonArray diagnostics = new JsonArray();
        for (SyntaxError error : tree.getErrors()) {
            Point start = error.getStart();
            Point end = error.getEnd();
            // 零宽错误（缺失的记号）至少标出一个字符
            int endColumn = end.getColumn();
            if (end.equals(start)) {
                endColumn = start.getColumn() + 1;
            }

            JsonObject diag = new JsonObject();
            diag.add("range", createRange(start.getRow(), start.getColumn(), end.getRow(), endColumn));
            diag.addProperty("severity", SEVERITY_ERROR);
            diag.addProperty("source", SOURCE);
            diag.addProperty("message", error.getMessage());
            diagnostics.add(diag);
        }
        return diagnostics;
    }

    static JsonObject createRange(int startLine, int startChar, int endLine, int endChar) {
        JsonObject range = new JsonObject();
        range.add("start", createPosition(startLine, startChar));
        range.add("end", createPosition(endLine, endChar));
        return range;
    }

    static JsonObject createPosition(int line, int character) {
        JsonObject position = new JsonObject();
        position.addProperty("line", line);
        position.addProperty("character", character);
        return position;
    }
}
