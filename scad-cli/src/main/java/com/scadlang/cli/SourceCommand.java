package com.scadlang.cli;

import com.scadlang.compiler.adapter.AdapterConfig;
import com.scadlang.lsp.DocumentDriver;
import com.scadlang.lsp.DocumentState;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * 读取单个源码文件并执行一次 解析 → 适配 的子命令基类
 */
abstract class SourceCommand implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_SYNTAX_ERRORS = 1;
    static final int EXIT_IO_ERROR = 2;

    @Parameters(index = "0", description = "源码文件路径")
    Path file;

    @Option(names = "--halve-diameter", description = "非字面量直径包装为 d / 2（默认原样作为半径）")
    boolean halveDiameter;

    @Option(names = "--strict-callees", description = "未识别的调用名输出为 Unknown")
    boolean strictCallees;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        if (!Files.isRegularFile(file)) {
            err.println("错误: 文件不存在 - " + file);
            return EXIT_IO_ERROR;
        }

        String source;
        try {
            source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + file + " (" + e.getMessage() + ")");
            return EXIT_IO_ERROR;
        }

        DocumentState state = new DocumentDriver(adapterConfig()).update(DocumentState.EMPTY, source, 1);
        return execute(state, spec.commandLine().getOut());
    }

    AdapterConfig adapterConfig() {
        AdapterConfig config = new AdapterConfig();
        if (halveDiameter) {
            config.setDiameterMode(AdapterConfig.DiameterMode.HALVE_EXPRESSION);
        }
        config.setStrictCallees(strictCallees);
        return config;
    }

    protected abstract int execute(DocumentState state, PrintWriter out);
}
