package com.scadlang.compiler.adapter.node;

import com.scadlang.compiler.adapter.AdapterConfig;
import com.scadlang.compiler.ast.UnknownNode;
import com.scadlang.compiler.ast.expr.Argument;
import com.scadlang.compiler.ast.expr.BinaryExpression;
import com.scadlang.compiler.ast.expr.CallExpression;
import com.scadlang.compiler.ast.expr.ConditionalExpression;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.LiteralExpression;
import com.scadlang.compiler.ast.expr.RangeExpression;
import com.scadlang.compiler.ast.expr.UnaryExpression;
import com.scadlang.compiler.ast.expr.VectorExpression;
import com.scadlang.compiler.ast.geom.Cube3D;
import com.scadlang.compiler.ast.stmt.AssignmentStatement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.scadlang.compiler.adapter.node.AdaptSupport.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 表达式适配测试
 */
class ExpressionAdaptersTest {

    /** 赋值右侧的表达式 */
    private Expression value(String expression) {
        return first("x = " + expression + ";", AssignmentStatement.class).getRight();
    }

    @Nested
    @DisplayName("字面量与标识符")
    class LiteralTests {

        @Test
        @DisplayName("数字、字符串、布尔、undef")
        void testLiterals() {
            assertEquals(1.5, number(value("1.5")));
            LiteralExpression string = assertInstanceOf(LiteralExpression.class, value("\"a\\\"b\""));
            assertEquals("a\"b", string.getValue());
            assertTrue(bool(value("true")));
            assertFalse(bool(value("false")));
            assertEquals(LiteralExpression.ValueType.UNDEF,
                    assertInstanceOf(LiteralExpression.class, value("undef")).getValueType());
        }

        @Test
        @DisplayName("标识符与特殊变量")
        void testIdentifiers() {
            assertEquals("width", identifier(value("width")));
            assertEquals("$t", identifier(value("$t")));
        }
    }

    @Nested
    @DisplayName("运算")
    class OperatorTests {

        @Test
        @DisplayName("二元运算保持优先级")
        void testBinary() {
            BinaryExpression sum = assertInstanceOf(BinaryExpression.class, value("1 + 2 * 3"));
            assertEquals("+", sum.getOperator());
            assertEquals(1, number(sum.getLeft()));
            BinaryExpression product = assertInstanceOf(BinaryExpression.class, sum.getRight());
            assertEquals("*", product.getOperator());
        }

        @Test
        @DisplayName("比较与逻辑运算符")
        void testLogical() {
            BinaryExpression or = assertInstanceOf(BinaryExpression.class, value("a < 1 || b >= 2"));
            assertEquals("||", or.getOperator());
            assertEquals("<", assertInstanceOf(BinaryExpression.class, or.getLeft()).getOperator());
            assertEquals(">=", assertInstanceOf(BinaryExpression.class, or.getRight()).getOperator());
        }

        @Test
        @DisplayName("一元运算")
        void testUnary() {
            UnaryExpression negate = assertInstanceOf(UnaryExpression.class, value("-a"));
            assertEquals("-", negate.getOperator());
            assertEquals("a", identifier(negate.getOperand()));
            assertEquals("!", assertInstanceOf(UnaryExpression.class, value("!ok")).getOperator());
        }

        @Test
        @DisplayName("条件表达式")
        void testConditional() {
            ConditionalExpression conditional = assertInstanceOf(ConditionalExpression.class, value("big ? 10 : 1"));
            assertEquals("big", identifier(conditional.getCondition()));
            assertEquals(10, number(conditional.getThenExpr()));
            assertEquals(1, number(conditional.getElseExpr()));
        }
    }

    @Nested
    @DisplayName("向量与范围")
    class CollectionTests {

        @Test
        @DisplayName("嵌套向量")
        void testVector() {
            VectorExpression vector = assertInstanceOf(VectorExpression.class, value("[[0, 0], [1, 2]]"));
            assertEquals(2, vector.size());
            VectorExpression second = assertInstanceOf(VectorExpression.class, vector.getElements().get(1));
            assertEquals(2, number(second.getElements().get(1)));
        }

        @Test
        @DisplayName("范围有无步长")
        void testRange() {
            RangeExpression plain = assertInstanceOf(RangeExpression.class, value("[0:5]"));
            assertFalse(plain.hasStep());
            assertNull(plain.getStep());
            assertEquals(5, number(plain.getEnd()));

            RangeExpression stepped = assertInstanceOf(RangeExpression.class, value("[0:0.5:5]"));
            assertEquals(0.5, number(stepped.getStep()));
        }

        @Test
        @DisplayName("列表推导不在支持范围内")
        void testComprehension() {
            assertThat(value("[for (i = [0:3]) i]")).isInstanceOf(UnknownNode.class);
        }
    }

    @Nested
    @DisplayName("调用")
    class CallTests {

        @Test
        @DisplayName("函数调用的位置与命名实参")
        void testFunctionCall() {
            CallExpression call = assertInstanceOf(CallExpression.class, value("lookup(2, table = t)"));
            assertEquals("lookup", call.getCalleeName());
            assertEquals(2, call.getArgs().size());
            Argument first = call.getArgs().get(0);
            assertFalse(first.isNamed());
            assertEquals(2, number(first.getValue()));
            Argument second = call.getArgs().get(1);
            assertEquals("table", second.getName());
            assertEquals("t", identifier(second.getValue()));
            assertTrue(call.getChildren().isEmpty());
        }

        @Test
        @DisplayName("用户模块实例化带子节点")
        void testUserModule() {
            CallExpression call = first("rounded_box(5, r = 1) cube(1);", CallExpression.class);
            assertEquals("rounded_box", call.getCalleeName());
            assertEquals(2, call.getArgs().size());
            assertThat(call.getChildren()).hasSize(1);
            assertThat(call.getChildren().get(0)).isInstanceOf(Cube3D.class);
        }

        @Test
        @DisplayName("严格模式下用户模块为 Unknown")
        void testStrictCallees() {
            AdapterConfig config = new AdapterConfig();
            config.setStrictCallees(true);
            assertThat(first("rounded_box(5);", UnknownNode.class, config)).isNotNull();
        }

        @Test
        @DisplayName("缺少值的命名实参为 Unknown")
        void testMissingArgumentValue() {
            CallExpression call = first("part(size = );", CallExpression.class);
            assertEquals("size", call.getArgs().get(0).getName());
            assertThat(call.getArgs().get(0).getValue()).isInstanceOf(UnknownNode.class);
        }
    }
}
