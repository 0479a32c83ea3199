package com.scadlang.compiler.ast;

import com.scadlang.compiler.adapter.CursorTraversal;
import com.scadlang.compiler.ast.geom.Cube3D;
import com.scadlang.compiler.ast.geom.Sphere3D;
import com.scadlang.compiler.ast.transform.TranslateTransform;
import com.scadlang.compiler.parser.ScadSyntaxParser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 节点种类与访问者分派
 */
class AstNodeTest {

    @Test
    @DisplayName("规范名互相可查")
    void testCanonicalNames() {
        for (NodeKind kind : NodeKind.values()) {
            assertSame(kind, NodeKind.fromCanonicalName(kind.getCanonicalName()));
        }
        assertEquals("Cube3D", NodeKind.CUBE.toString());
        assertEquals(NodeKind.UNKNOWN, NodeKind.fromCanonicalName("Torus3D"));
        assertEquals(NodeKind.Family.TRANSFORM, NodeKind.LINEAR_EXTRUDE.getFamily());
        assertEquals(NodeKind.Family.OPERATION, NodeKind.HULL.getFamily());
    }

    @Test
    @DisplayName("访问者按具体类型分派")
    void testVisitorDispatch() {
        Program program = (Program) new CursorTraversal()
                .adapt(new ScadSyntaxParser().parse("translate([1,0,0]) { cube(1); sphere(2); }"));

        List<String> visited = new ArrayList<>();
        AstVisitor<Void, List<String>> collector = new AstVisitor<Void, List<String>>() {
            @Override
            public Void visitTranslate(TranslateTransform node, List<String> ctx) {
                ctx.add("translate");
                for (AstNode child : node.getChildren()) {
                    child.accept(this, ctx);
                }
                return null;
            }

            @Override
            public Void visitCube(Cube3D node, List<String> ctx) {
                ctx.add("cube");
                return null;
            }

            @Override
            public Void visitSphere(Sphere3D node, List<String> ctx) {
                ctx.add("sphere");
                return null;
            }
        };
        for (AstNode child : program.getChildren()) {
            child.accept(collector, visited);
        }
        assertEquals(List.of("translate", "cube", "sphere"), visited);
    }

    @Test
    @DisplayName("withChildren 返回新的程序节点")
    void testWithChildren() {
        Program program = new Program(new Position(0, 0, 0, 0), new ArrayList<AstNode>());
        Program replaced = program.withChildren(List.of(new UnknownNode(new Position(0, 0, 0, 1))));
        assertTrue(program.getChildren().isEmpty());
        assertEquals(1, replaced.getChildren().size());
        assertEquals(program.getPosition(), replaced.getPosition());
    }
}
