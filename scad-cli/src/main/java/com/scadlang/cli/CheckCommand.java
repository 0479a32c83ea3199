package com.scadlang.cli;

import com.scadlang.compiler.cst.SyntaxError;
import com.scadlang.lsp.DocumentState;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.List;

/**
 * picocli check 子命令：报告语法错误，有错误时退出码为 1
 *
 * <p>输出格式 {@code 文件:行:列: 消息}，行列从 1 开始。</p>
 */
@Command(name = "check", description = "检查语法错误")
public class CheckCommand extends SourceCommand {

    @Override
    protected int execute(DocumentState state, PrintWriter out) {
        List<SyntaxError> errors = state.getSyntaxTree().getErrors();
        for (SyntaxError error : errors) {
            out.println(file + ":" + (error.getStart().getRow() + 1) + ":"
                    + (error.getStart().getColumn() + 1) + ": " + error.getMessage());
        }
        if (errors.isEmpty()) {
            out.println("无语法错误: " + file);
            return EXIT_OK;
        }
        out.println(errors.size() + " 个语法错误");
        return EXIT_SYNTAX_ERRORS;
    }
}
