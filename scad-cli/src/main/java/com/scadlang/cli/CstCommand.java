package com.scadlang.cli;

import com.scadlang.lsp.DocumentState;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

/**
 * picocli cst 子命令：输出具体语法树（S 表达式）
 */
@Command(name = "cst", description = "输出具体语法树（S 表达式）")
public class CstCommand extends SourceCommand {

    @Override
    protected int execute(DocumentState state, PrintWriter out) {
        out.println(state.getSyntaxTree().getRootNode());
        return EXIT_OK;
    }
}
