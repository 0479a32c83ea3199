package com.scadlang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.scadlang.lsp.AstJsonSerializer;
import com.scadlang.lsp.DocumentState;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;

/**
 * picocli ast 子命令：输出 AST 的 JSON 投影
 */
@Command(name = "ast", description = "输出 AST（JSON）")
public class AstCommand extends SourceCommand {

    @Option(names = "--pretty", description = "格式化输出 JSON")
    boolean pretty;

    @Override
    protected int execute(DocumentState state, PrintWriter out) {
        GsonBuilder builder = new GsonBuilder().serializeNulls();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        Gson gson = builder.create();
        out.println(gson.toJson(new AstJsonSerializer().toJson(state.getAst())));
        return EXIT_OK;
    }
}
