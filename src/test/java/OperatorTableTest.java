import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.grim.script.parser.BinaryOperator;
import com.grim.script.parser.ErrorKind;
import com.grim.script.parser.GrimRuntimeException;
import com.grim.script.parser.OperatorTable;
import com.grim.script.parser.UnaryOperator;
import com.grim.script.parser.Value;
import com.grim.script.parser.Value.Type;

public class OperatorTableTest {

    private static Value apply(BinaryOperator op, Value l, Value r) {
        return OperatorTable.apply(op, l, r);
    }

    private static ErrorKind failure(BinaryOperator op, Value l, Value r) {
        return assertThrows(GrimRuntimeException.class, () -> OperatorTable.apply(op, l, r)).getKind();
    }

    @Test
    void mixedArithmetic_promotesToFloat() {
        long[] ints = {-3, 0, 2, 17};
        double[] floats = {-1.5, 0.0, 0.25, 8.0};
        BinaryOperator[] ops = {BinaryOperator.ADD, BinaryOperator.SUB, BinaryOperator.MUL};
        for (BinaryOperator op : ops) {
            for (long a : ints) {
                for (double b : floats) {
                    Value mixed = apply(op, Value.integer(a), Value.floating(b));
                    Value promoted = apply(op, Value.floating(a), Value.floating(b));
                    assertEquals(promoted, mixed, op + " " + a + " " + b);
                    assertEquals(Type.FLOAT, mixed.getType());
                }
            }
        }
    }

    @Test
    void integerArithmetic_staysInteger() {
        assertEquals(Value.integer(5), apply(BinaryOperator.ADD, Value.integer(2), Value.integer(3)));
        assertEquals(Value.integer(-1), apply(BinaryOperator.SUB, Value.integer(2), Value.integer(3)));
        assertEquals(Value.integer(6), apply(BinaryOperator.MUL, Value.integer(2), Value.integer(3)));
    }

    @Test
    void integerDivision_exactOrFloat() {
        assertEquals(Value.floating(3.5), apply(BinaryOperator.DIV, Value.integer(7), Value.integer(2)));
        assertEquals(Value.integer(3), apply(BinaryOperator.DIV, Value.integer(6), Value.integer(2)));
        assertEquals(Value.integer(-3), apply(BinaryOperator.DIV, Value.integer(-6), Value.integer(2)));
    }

    @Test
    void modulo_integersOnly() {
        assertEquals(Value.integer(1), apply(BinaryOperator.MOD, Value.integer(7), Value.integer(2)));
        assertEquals(ErrorKind.INCOMPATIBLE_OPERANDS, failure(BinaryOperator.MOD, Value.floating(7.5), Value.integer(2)));
        assertEquals(ErrorKind.INCOMPATIBLE_OPERANDS, failure(BinaryOperator.MOD, Value.integer(7), Value.floating(2)));
    }

    @Test
    void integerDivisionByZero_isError() {
        assertEquals(ErrorKind.DIVISION_BY_ZERO, failure(BinaryOperator.DIV, Value.integer(1), Value.integer(0)));
        assertEquals(ErrorKind.DIVISION_BY_ZERO, failure(BinaryOperator.MOD, Value.integer(1), Value.integer(0)));
    }

    @Test
    void floatDivisionByZero_followsIeee() {
        Value r = apply(BinaryOperator.DIV, Value.floating(1.0), Value.integer(0));
        assertEquals(Double.POSITIVE_INFINITY, r.asFloat());
        assertTrue(Double.isNaN(apply(BinaryOperator.DIV, Value.floating(0.0), Value.floating(0.0)).asFloat()));
    }

    @Test
    void integerOverflow_isError() {
        assertEquals(ErrorKind.INTEGER_OVERFLOW,
                failure(BinaryOperator.ADD, Value.integer(Long.MAX_VALUE), Value.integer(1)));
        assertEquals(ErrorKind.INTEGER_OVERFLOW,
                failure(BinaryOperator.SUB, Value.integer(Long.MIN_VALUE), Value.integer(1)));
        assertEquals(ErrorKind.INTEGER_OVERFLOW,
                failure(BinaryOperator.MUL, Value.integer(Long.MAX_VALUE), Value.integer(2)));
        assertEquals(ErrorKind.INTEGER_OVERFLOW,
                failure(BinaryOperator.DIV, Value.integer(Long.MIN_VALUE), Value.integer(-1)));
    }

    @Test
    void crossVariantEquality_isIncompatible() {
        assertEquals(ErrorKind.INCOMPATIBLE_OPERANDS, failure(BinaryOperator.EQ, Value.bool(true), Value.integer(1)));
        assertEquals(ErrorKind.INCOMPATIBLE_OPERANDS, failure(BinaryOperator.NEQ, Value.integer(1), Value.floating(1.0)));
        assertEquals(ErrorKind.INCOMPATIBLE_OPERANDS, failure(BinaryOperator.EQ, Value.string("1"), Value.integer(1)));
    }

    @Test
    void sameVariantEquality() {
        assertTrue(apply(BinaryOperator.EQ, Value.string("a"), Value.string("a")).asBool());
        assertTrue(apply(BinaryOperator.NEQ, Value.bool(true), Value.bool(false)).asBool());
        assertFalse(apply(BinaryOperator.EQ, Value.floating(Double.NaN), Value.floating(Double.NaN)).asBool());
    }

    @Test
    void relational_acceptsMixedNumbers() {
        assertTrue(apply(BinaryOperator.LESS, Value.integer(1), Value.floating(1.5)).asBool());
        assertTrue(apply(BinaryOperator.GREATER_EQ, Value.floating(2.0), Value.integer(2)).asBool());
        assertFalse(apply(BinaryOperator.GREATER, Value.integer(Long.MAX_VALUE), Value.integer(Long.MAX_VALUE)).asBool());
        assertEquals(ErrorKind.INCOMPATIBLE_OPERANDS, failure(BinaryOperator.LESS, Value.string("a"), Value.string("b")));
    }

    @Test
    void logical_booleansOnly() {
        assertTrue(apply(BinaryOperator.OR, Value.bool(false), Value.bool(true)).asBool());
        assertFalse(apply(BinaryOperator.AND, Value.bool(true), Value.bool(false)).asBool());
        assertEquals(ErrorKind.INCOMPATIBLE_OPERANDS, failure(BinaryOperator.AND, Value.integer(1), Value.bool(true)));
    }

    @Test
    void incompatibleError_carriesOperands() {
        GrimRuntimeException ex = assertThrows(GrimRuntimeException.class,
                () -> OperatorTable.apply(BinaryOperator.ADD, Value.string("a"), Value.integer(1)));
        assertEquals(2, ex.getOperands().size());
        assertEquals(Value.string("a"), ex.getOperands().get(0));
        assertEquals(Value.integer(1), ex.getOperands().get(1));
    }

    @Test
    void supports_reflectsRuleMatrix() {
        assertTrue(OperatorTable.supports(BinaryOperator.ADD, Type.INTEGER, Type.FLOAT));
        assertTrue(OperatorTable.supports(BinaryOperator.MOD, Type.INTEGER, Type.INTEGER));
        assertFalse(OperatorTable.supports(BinaryOperator.MOD, Type.FLOAT, Type.INTEGER));
        assertFalse(OperatorTable.supports(BinaryOperator.ADD, Type.STRING, Type.STRING));
        assertTrue(OperatorTable.supports(BinaryOperator.EQ, Type.STRING, Type.STRING));
        assertFalse(OperatorTable.supports(BinaryOperator.EQ, Type.BOOLEAN, Type.INTEGER));
    }

    @Test
    void unaryOperators() {
        assertEquals(Value.integer(-4), UnaryOperator.NEGATE.apply(Value.integer(4)));
        assertEquals(Value.floating(-0.5), UnaryOperator.NEGATE.apply(Value.floating(0.5)));
        assertEquals(Value.bool(false), UnaryOperator.NOT.apply(Value.bool(true)));

        assertEquals(ErrorKind.UNSUPPORTED_UNARY_OPERAND,
                assertThrows(GrimRuntimeException.class, () -> UnaryOperator.NOT.apply(Value.integer(1))).getKind());
        assertEquals(ErrorKind.UNSUPPORTED_UNARY_OPERAND,
                assertThrows(GrimRuntimeException.class, () -> UnaryOperator.NEGATE.apply(Value.string("x"))).getKind());
        assertEquals(ErrorKind.INTEGER_OVERFLOW,
                assertThrows(GrimRuntimeException.class, () -> UnaryOperator.NEGATE.apply(Value.integer(Long.MIN_VALUE))).getKind());
    }
}
