package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.ast.Program;
import com.scadlang.compiler.ast.UnknownNode;
import com.scadlang.compiler.ast.expr.BinaryExpression;
import com.scadlang.compiler.ast.expr.ConditionalExpression;
import com.scadlang.compiler.ast.geom.Cube3D;
import com.scadlang.compiler.ast.stmt.FunctionDeclaration;
import com.scadlang.compiler.ast.stmt.IncludeStatement;
import com.scadlang.compiler.ast.stmt.ModuleDeclaration;
import com.scadlang.compiler.ast.stmt.UseStatement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.scadlang.compiler.adapter.node.AdaptSupport.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 声明与文件引入的适配测试
 */
class DeclarationAdaptersTest {

    @Test
    @DisplayName("模块定义：形参与默认值")
    void testModule() {
        ModuleDeclaration module = first("module box(w, h = 2) { cube([w, w, h]); }", ModuleDeclaration.class);
        assertEquals("box", module.getName());
        assertEquals(2, module.getParameters().size());
        assertEquals("w", module.getParameters().get(0).getName());
        assertFalse(module.getParameters().get(0).hasDefaultValue());
        assertEquals(2, number(module.getParameters().get(1).getDefaultValue()));
        assertThat(module.getBody()).hasSize(1);
        assertThat(module.getBody().get(0)).isInstanceOf(Cube3D.class);
    }

    @Test
    @DisplayName("模块体可以是单条语句")
    void testModuleSingleStatement() {
        ModuleDeclaration module = first("module ball() sphere(1);", ModuleDeclaration.class);
        assertTrue(module.getParameters().isEmpty());
        assertThat(module.getBody()).hasSize(1);
    }

    @Test
    @DisplayName("函数定义")
    void testFunction() {
        FunctionDeclaration function = first("function twice(x) = x * 2;", FunctionDeclaration.class);
        assertEquals("twice", function.getName());
        assertEquals("x", function.getParameters().get(0).getName());
        BinaryExpression body = assertInstanceOf(BinaryExpression.class, function.getBody());
        assertEquals("*", body.getOperator());
    }

    @Test
    @DisplayName("递归函数体中的条件表达式")
    void testFunctionConditional() {
        FunctionDeclaration function = first("function f(n) = n <= 0 ? 0 : n + f(n - 1);", FunctionDeclaration.class);
        assertThat(function.getBody()).isInstanceOf(ConditionalExpression.class);
    }

    @Test
    @DisplayName("函数体缺失时为 Unknown")
    void testFunctionMissingBody() {
        FunctionDeclaration function = first("function f() = ;", FunctionDeclaration.class);
        assertThat(function.getBody()).isInstanceOf(UnknownNode.class);
    }

    @Test
    @DisplayName("include 与 use 去掉路径包围符")
    void testImports() {
        Program program = program("include <lib/shapes.scad>\nuse \"util.scad\";");
        assertEquals("lib/shapes.scad", assertInstanceOf(IncludeStatement.class, program.getChildren().get(0)).getPath());
        assertEquals("util.scad", assertInstanceOf(UseStatement.class, program.getChildren().get(1)).getPath());
    }
}
