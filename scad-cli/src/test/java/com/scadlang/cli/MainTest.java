package com.scadlang.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("scad 命令行测试")
class MainTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path write(String name, String source) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, source.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    @DisplayName("ast 输出 Program JSON")
    void testAst() throws IOException {
        Path file = write("part.scad", "sphere(d=20);\ncube(1);\n");

        int code = execute("ast", file.toString());

        assertThat(code).isZero();
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(json.get("type").getAsString()).isEqualTo("Program");
        assertThat(json.getAsJsonArray("children").size()).isEqualTo(2);
        JsonObject sphere = json.getAsJsonArray("children").get(0).getAsJsonObject();
        assertThat(sphere.getAsJsonObject("radius").get("value").getAsDouble()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("--halve-diameter 把非字面量直径包装为除法")
    void testHalveDiameterOption() throws IOException {
        Path file = write("part.scad", "sphere(d=size);");

        int code = execute("ast", "--halve-diameter", file.toString());

        assertThat(code).isZero();
        JsonObject sphere = JsonParser.parseString(out.toString()).getAsJsonObject()
                .getAsJsonArray("children").get(0).getAsJsonObject();
        JsonObject radius = sphere.getAsJsonObject("radius");
        assertThat(radius.get("type").getAsString()).isEqualTo("BinaryExpression");
        assertThat(radius.get("operator").getAsString()).isEqualTo("/");
    }

    @Test
    @DisplayName("--strict-callees 把未知调用输出为 Unknown")
    void testStrictCalleesOption() throws IOException {
        Path file = write("part.scad", "my_part(1);");

        execute("ast", "--strict-callees", file.toString());

        JsonObject child = JsonParser.parseString(out.toString()).getAsJsonObject()
                .getAsJsonArray("children").get(0).getAsJsonObject();
        assertThat(child.get("type").getAsString()).isEqualTo("Unknown");
    }

    @Test
    @DisplayName("cst 输出 S 表达式")
    void testCst() throws IOException {
        Path file = write("lib.scad", "include <a.scad>");

        int code = execute("cst", file.toString());

        assertThat(code).isZero();
        assertThat(out.toString().trim()).isEqualTo("(program (include_statement path: (include_path)))");
    }

    @Test
    @DisplayName("check 报告语法错误位置")
    void testCheckWithErrors() throws IOException {
        Path file = write("broken.scad", "cube(1");

        int code = execute("check", file.toString());

        assertThat(code).isEqualTo(SourceCommand.EXIT_SYNTAX_ERRORS);
        assertThat(out.toString()).contains(file + ":1:7: Missing ')'");
        assertThat(out.toString()).contains("2 个语法错误");
    }

    @Test
    @DisplayName("check 无错误时退出码为 0")
    void testCheckClean() throws IOException {
        Path file = write("ok.scad", "cube(1);");

        assertThat(execute("check", file.toString())).isZero();
        assertThat(out.toString()).contains("无语法错误");
    }

    @Test
    @DisplayName("文件不存在时退出码为 2")
    void testMissingFile() {
        int code = execute("ast", dir.resolve("missing.scad").toString());

        assertThat(code).isEqualTo(SourceCommand.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("文件不存在");
    }

    @Test
    @DisplayName("无子命令时输出用法")
    void testUsage() {
        assertThat(execute()).isZero();
        assertThat(out.toString()).contains("Usage: scad").contains("ast").contains("check");
    }
}
