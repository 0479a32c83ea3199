package com.scadlang.lsp;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.UnknownNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AstJsonSerializer 测试")
class AstJsonSerializerTest {

    private final AstJsonSerializer serializer = new AstJsonSerializer();

    private JsonObject program(String source) {
        DocumentState state = new DocumentDriver().update(DocumentState.EMPTY, source, 1);
        return serializer.toJson(state.getAst()).getAsJsonObject();
    }

    private JsonObject firstChild(String source) {
        return program(source).getAsJsonArray("children").get(0).getAsJsonObject();
    }

    private static void collectTypes(JsonElement element, Set<String> types) {
        if (element.isJsonArray()) {
            for (JsonElement item : element.getAsJsonArray()) {
                collectTypes(item, types);
            }
        } else if (element.isJsonObject()) {
            JsonObject obj = element.getAsJsonObject();
            if (obj.has("type") && obj.get("type").isJsonPrimitive()) {
                types.add(obj.get("type").getAsString());
            }
            for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
                collectTypes(entry.getValue(), types);
            }
        }
    }

    @Nested
    @DisplayName("公共字段")
    class CommonFields {

        @Test
        @DisplayName("Unknown 只输出类型与位置")
        void testUnknown() {
            JsonObject json = serializer.toJson(new UnknownNode(new Position(0, 0, 0, 5))).getAsJsonObject();

            assertThat(json.get("type").getAsString()).isEqualTo("Unknown");
            JsonObject range = json.getAsJsonObject("position");
            assertThat(range.getAsJsonObject("start").get("line").getAsInt()).isZero();
            assertThat(range.getAsJsonObject("start").get("character").getAsInt()).isZero();
            assertThat(range.getAsJsonObject("end").get("line").getAsInt()).isZero();
            assertThat(range.getAsJsonObject("end").get("character").getAsInt()).isEqualTo(5);
            assertThat(json.keySet()).containsExactlyInAnyOrder("type", "position");
        }

        @Test
        @DisplayName("null 输出为 JSON null")
        void testNull() {
            assertThat(serializer.toJson(null).isJsonNull()).isTrue();
        }

        @Test
        @DisplayName("Program 的 children 与顶层语句一一对应")
        void testProgramChildren() {
            JsonObject json = program("cube(1); sphere(2);");

            assertThat(json.get("type").getAsString()).isEqualTo("Program");
            assertThat(json.getAsJsonArray("children").size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("节点字段")
    class NodeFields {

        @Test
        @DisplayName("立方体尺寸按分量输出")
        void testCubeSize() {
            JsonObject cube = firstChild("cube(size=10);");

            assertThat(cube.get("type").getAsString()).isEqualTo("Cube3D");
            JsonObject size = cube.getAsJsonObject("size");
            assertThat(size.getAsJsonObject("x").get("value").getAsDouble()).isEqualTo(10.0);
            assertThat(size.getAsJsonObject("y").get("value").getAsDouble()).isEqualTo(10.0);
            assertThat(size.getAsJsonObject("z").get("value").getAsDouble()).isEqualTo(10.0);
        }

        @Test
        @DisplayName("直径换算后的半径")
        void testSphereRadius() {
            JsonObject sphere = firstChild("sphere(d=20, $fn=12);");

            assertThat(sphere.getAsJsonObject("radius").get("value").getAsDouble()).isEqualTo(10.0);
            JsonObject facets = sphere.getAsJsonObject("facets");
            assertThat(facets.getAsJsonObject("$fn").get("value").getAsDouble()).isEqualTo(12.0);
            assertThat(facets.has("$fa")).isFalse();
        }

        @Test
        @DisplayName("未设置的可选字段不输出")
        void testAbsentFields() {
            JsonObject cylinder = firstChild("cylinder(h=2, r=1);");
            assertThat(cylinder.has("radius2")).isFalse();
            assertThat(cylinder.has("facets")).isFalse();

            JsonObject ifStatement = firstChild("if (a) cube(1);");
            assertThat(ifStatement.has("elseBranch")).isFalse();
            assertThat(ifStatement.getAsJsonArray("thenBranch").size()).isEqualTo(1);
        }

        @Test
        @DisplayName("字面量类型与值")
        void testLiterals() {
            JsonArray children = program("a = \"s\"; b = true; c = undef;").getAsJsonArray("children");

            JsonObject s = children.get(0).getAsJsonObject().getAsJsonObject("right");
            assertThat(s.get("valueType").getAsString()).isEqualTo("string");
            assertThat(s.get("value").getAsString()).isEqualTo("s");

            JsonObject b = children.get(1).getAsJsonObject().getAsJsonObject("right");
            assertThat(b.get("valueType").getAsString()).isEqualTo("boolean");
            assertThat(b.get("value").getAsBoolean()).isTrue();

            JsonObject u = children.get(2).getAsJsonObject().getAsJsonObject("right");
            assertThat(u.get("valueType").getAsString()).isEqualTo("undef");
            assertThat(u.get("value").isJsonNull()).isTrue();
        }

        @Test
        @DisplayName("溢出的数字以字符串输出，结果仍是合法 JSON")
        void testNonFiniteNumber() {
            JsonObject json = program("x = 1e400;");

            JsonObject value = json.getAsJsonArray("children").get(0).getAsJsonObject().getAsJsonObject("right");
            assertThat(value.get("valueType").getAsString()).isEqualTo("number");
            assertThat(value.get("value").getAsJsonPrimitive().isString()).isTrue();
            assertThat(value.get("value").getAsString()).isEqualTo("Infinity");

            String text = new Gson().toJson(json);
            assertThat(text).doesNotContain(":Infinity");
            assertThat(JsonParser.parseString(text).isJsonObject()).isTrue();
        }

        @Test
        @DisplayName("调用的具名参数与子节点")
        void testCallExpression() {
            JsonObject call = firstChild("part(1, w = 2) cube(1);");

            assertThat(call.get("type").getAsString()).isEqualTo("CallExpression");
            assertThat(call.get("callee").getAsString()).isEqualTo("part");
            JsonArray args = call.getAsJsonArray("args");
            assertThat(args.size()).isEqualTo(2);
            assertThat(args.get(0).getAsJsonObject().has("name")).isFalse();
            assertThat(args.get(1).getAsJsonObject().get("name").getAsString()).isEqualTo("w");
            assertThat(call.getAsJsonArray("children").size()).isEqualTo(1);
        }

        @Test
        @DisplayName("模块声明的参数与默认值")
        void testModuleDeclaration() {
            JsonObject module = firstChild("module part(w = 10, h) { cube(w); }");

            assertThat(module.get("name").getAsString()).isEqualTo("part");
            JsonArray params = module.getAsJsonArray("parameters");
            assertThat(params.get(0).getAsJsonObject().get("name").getAsString()).isEqualTo("w");
            assertThat(params.get(0).getAsJsonObject().has("defaultValue")).isTrue();
            assertThat(params.get(1).getAsJsonObject().has("defaultValue")).isFalse();
            assertThat(module.getAsJsonArray("body").size()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("每种节点都能序列化")
    void testAllKinds() {
        String source = String.join("\n",
                "include <lib.scad>",
                "use <util.scad>",
                "$fn = 32;",
                "module part(w = 10, h) {",
                "  translate([1, 2, 3]) rotate([0, 0, 45]) scale(2) mirror([0, 1, 0]) cube(w, center = true);",
                "  color(\"red\", 0.5) sphere(r = 5);",
                "}",
                "function area(r) = r > 0 ? 3.14 * r * r : -1;",
                "difference() { cylinder(h = 10, r1 = 2, r2 = 1); union() { circle(1); square([1, 2]); } }",
                "intersection() { hull() { polygon([[0, 0], [1, 0], [0, 1]]); } minkowski() { polyhedron([[0, 0, 0]], [[0]]); } }",
                "linear_extrude(height = 5) square(1);",
                "rotate_extrude(angle = 90) circle(1);",
                "for (i = [0 : 2 : 10]) if (i > 2) { part(i); } else { echo(i); }",
                "{ z = 1; }");

        Set<String> types = new LinkedHashSet<>();
        collectTypes(program(source), types);

        for (NodeKind kind : NodeKind.values()) {
            if (kind != NodeKind.UNKNOWN) {
                assertThat(types).as("kind %s", kind).contains(kind.getCanonicalName());
            }
        }
        assertThat(types).doesNotContain("Unknown");
    }
}
