package io.github.eutro.cfgopt.test;

import io.github.eutro.cfgopt.cfg.*;
import io.github.eutro.cfgopt.cse.AnalysisContext;
import io.github.eutro.cfgopt.cse.Availability;
import io.github.eutro.cfgopt.cse.AvailableExpressionSet;
import io.github.eutro.cfgopt.cse.ExpressionType;
import io.github.eutro.cfgopt.ops.Operator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static io.github.eutro.cfgopt.cfg.Expression.*;
import static io.github.eutro.cfgopt.test.Graphs.U;
import static org.junit.jupiter.api.Assertions.*;

public class AvailableExpressionSetTest {
    private AnalysisContext ctx;
    private AvailableExpressionSet set;
    private Variable a, b, c, d;
    private int x, y;

    @BeforeEach
    void setUp() {
        ControlFlowGraph cfg = new ControlFlowGraph("sets", Collections.singletonList(U));
        BasicBlock block = cfg.newBlock();
        ctx = new AnalysisContext();
        ctx.setCurrentBlock(block);
        set = new AvailableExpressionSet();
        a = var(U, cfg.newVar("a", U));
        b = var(U, cfg.newVar("b", U));
        c = var(U, cfg.newVar("c", U));
        d = var(U, cfg.newVar("d", U));
        x = cfg.newVar("x", U);
        y = cfg.newVar("y", U);
    }

    private static Expression add(Expression l, Expression r) {
        return binary(Operator.ADD, U, l, r);
    }

    private static Expression mul(Expression l, Expression r) {
        return binary(Operator.MUL, U, l, r);
    }

    @Test
    void commutativeOperationsShareANode() {
        Integer ab = set.gen(add(a, b), ctx);
        assertNotNull(ab);
        assertEquals(ab, set.gen(add(b, a), ctx));
        assertEquals(3, set.size());
        assertEquals(ab, set.find(add(b, a)));
        set.verifyConsistency();
    }

    @Test
    void nonCommutativeOperationsDoNot() {
        Integer ab = set.gen(binary(Operator.SUB, U, a, b), ctx);
        Integer ba = set.gen(binary(Operator.SUB, U, b, a), ctx);
        assertNotEquals(ab, ba);
        assertEquals(4, set.size());
    }

    @Test
    void keysIncludeTypesAndCheckedness() {
        assertNotEquals(set.gen(num(Type.uint(8), 1), ctx), set.gen(num(U, 1), ctx));
        assertNotEquals(set.gen(add(a, b), ctx), set.gen(checked(Operator.ADD, U, a, b), ctx));
        Integer wide = set.gen(unary(Operator.ZERO_EXT, U, var(Type.uint(8), 9)), ctx);
        Integer narrow = set.gen(unary(Operator.TRUNC, Type.uint(16), a), ctx);
        assertNotNull(wide);
        assertNotEquals(narrow, set.gen(unary(Operator.TRUNC, Type.uint(32), a), ctx));
        assertEquals(narrow, set.find(unary(Operator.TRUNC, Type.uint(16), a)));
    }

    @Test
    void impureExpressionsAreNotTracked() {
        Expression load = new StorageLoad(U, add(a, b));
        assertNull(set.gen(load, ctx));
        assertNull(set.find(load));
        // the pure operand is still available
        assertNotNull(set.find(add(a, b)));
        assertNull(set.gen(add(load, c), ctx));
        assertNotNull(set.find(c));
        assertNull(set.keyOf(new ReturnData()));
    }

    @Test
    void killRemovesDependents() {
        Expression product = mul(add(a, b), c);
        set.gen(product, ctx);
        set.gen(add(c, d), ctx);
        set.kill(a.slot);
        assertNull(set.find(a));
        assertNull(set.find(add(a, b)));
        assertNull(set.find(product));
        assertNotNull(set.find(b));
        assertNotNull(set.find(add(c, d)));
        set.verifyConsistency();

        int cId = set.find(c);
        set.killNode(cId);
        assertNull(set.find(add(c, d)));
        assertNotNull(set.find(d));
        set.verifyConsistency();
        assertThrows(IllegalArgumentException.class, () -> set.killNode(cId));
    }

    @Test
    void assignmentTracksAvailability() {
        Expression sum = add(a, b);
        set.processInstruction(new Instr.Set(x, sum), ctx);
        assertEquals(Availability.inVariable(x), set.getNode(set.find(sum)).getAvailability());
        set.processInstruction(new Instr.Set(x, c), ctx);
        assertEquals(Availability.NOT_AVAILABLE, set.getNode(set.find(sum)).getAvailability());

        // x = x + 1 reads the old x, then kills it
        set.processInstruction(new Instr.Set(x, add(var(U, x), num(U, 1))), ctx);
        assertNull(set.find(var(U, x)));
        assertNull(set.find(add(var(U, x), num(U, 1))));
    }

    @Test
    void copiesAreIndependent() {
        set.gen(add(a, b), ctx);
        AvailableExpressionSet copy = set.copy();
        copy.kill(a.slot);
        assertNull(copy.find(add(a, b)));
        assertEquals(set.find(add(a, b)), set.find(add(b, a)));
        assertNotNull(set.find(add(a, b)));
        set.verifyConsistency();
        copy.verifyConsistency();
    }

    @Test
    void intersectionKeepsCommonValues() {
        set.gen(add(a, b), ctx);
        AvailableExpressionSet other = set.copy();
        other.gen(c, ctx);
        set.gen(d, ctx);
        set.intersect(other, null);
        assertNotNull(set.find(add(a, b)));
        assertNull(set.find(c));
        assertNull(set.find(d));
        assertEquals(3, set.size());
        set.verifyConsistency();
    }

    @Test
    void intersectionDropsReassignedVariables() {
        set.gen(add(a, b), ctx);
        AvailableExpressionSet other = set.copy();
        other.kill(a.slot);
        other.gen(add(a, b), ctx);
        set.intersect(other, null);
        assertNull(set.find(a));
        assertNull(set.find(add(a, b)));
        assertNotNull(set.find(b));
        set.verifyConsistency();
    }

    @Test
    void independentComputationsNeedAPlacement() {
        set.gen(a, ctx);
        set.gen(b, ctx);
        AvailableExpressionSet left = set.copy();
        AvailableExpressionSet right = set.copy();
        left.gen(mul(add(a, b), c), ctx);
        right.gen(mul(add(a, b), c), ctx);
        assertNotEquals(left.find(add(a, b)), right.find(add(a, b)));
        left.intersect(right, null);
        assertNull(left.find(add(a, b)));
        assertNull(left.find(mul(add(a, b), c)));
        assertNotNull(left.find(a));
        left.verifyConsistency();
    }

    @Test
    void mergedAvailabilityIsInvalidated() {
        set.processInstruction(new Instr.Set(x, add(a, b)), ctx);
        AvailableExpressionSet other = set.copy();
        other.processInstruction(new Instr.Set(y, add(a, b)), ctx);
        AvailableExpressionSet same = set.copy();
        set.intersect(other, null);
        assertEquals(Availability.INVALIDATED, set.getNode(set.find(add(a, b))).getAvailability());
        same.intersect(same.copy(), null);
        assertEquals(Availability.inVariable(x), same.getNode(same.find(add(a, b))).getAvailability());
    }

    @Test
    void unionAddsEverything() {
        set.gen(add(a, b), ctx);
        AvailableExpressionSet other = new AvailableExpressionSet();
        other.gen(mul(c, a), ctx);
        other.gen(add(b, a), ctx);
        set.union(other, ctx);
        assertEquals(5, set.size());
        assertNotNull(set.find(mul(a, c)));
        assertEquals(set.find(add(a, b)), set.find(add(b, a)));
        set.verifyConsistency();

        int before = ctx.peekNextId();
        set.gen(d, ctx);
        assertEquals(before, (int) set.find(d));
    }

    @Test
    void variableLeavesOfANode() {
        Integer id = set.gen(mul(add(a, b), add(a, num(U, 2))), ctx);
        Map<Integer, Integer> leaves = set.variableLeaves(id);
        assertEquals(2, leaves.size());
        assertEquals(set.find(a), leaves.get(a.slot));
        assertEquals(set.find(b), leaves.get(b.slot));
        assertEquals(set.find(b), set.idOfVariable(b.slot));
    }

    @Test
    void variableLeavesOfASharedOperand() {
        Expression expr = add(a, b);
        for (int i = 0; i < 12; i++) {
            expr = mul(expr, expr);
            set.gen(expr, ctx);
        }
        // 15 nodes: two variables, a + b, and one product per level
        assertEquals(15, set.size());
        Map<Integer, Integer> leaves = set.variableLeaves(set.find(expr));
        assertEquals(2, leaves.size());
        assertEquals(set.find(a), leaves.get(a.slot));
        assertEquals(set.find(b), leaves.get(b.slot));
    }

    @Test
    void keysNameOperandNodes() {
        set.gen(add(a, b), ctx);
        ExpressionType key = set.keyOf(add(a, b));
        assertTrue(key instanceof ExpressionType.Binary);
        ExpressionType.Binary bin = (ExpressionType.Binary) key;
        assertEquals((int) set.find(a), bin.left);
        assertEquals((int) set.find(b), bin.right);
        assertEquals(set.find(add(a, b)), set.lookup(bin.swapped()));
        assertNull(set.keyOf(add(a, c)));
    }
}
