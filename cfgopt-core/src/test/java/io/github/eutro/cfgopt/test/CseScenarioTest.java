package io.github.eutro.cfgopt.test;

import io.github.eutro.cfgopt.cfg.*;
import io.github.eutro.cfgopt.cse.CseConfig;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ops.Operator;
import io.github.eutro.cfgopt.passes.Passes;
import io.github.eutro.cfgopt.passes.opts.EliminateCommonSubexpressions;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static io.github.eutro.cfgopt.cfg.Expression.*;
import static io.github.eutro.cfgopt.test.Graphs.*;
import static org.junit.jupiter.api.Assertions.*;

public class CseScenarioTest {
    private static final EliminateCommonSubexpressions CSE =
            new EliminateCommonSubexpressions(CseConfig.DEFAULT.withCheckInvariants(true));

    private static Expression exprOf(Instr instr) {
        return ((Instr.Set) instr).getExpr();
    }

    private static void assertSameBehaviour(Supplier<ControlFlowGraph> build, long[]... inputs) {
        ControlFlowGraph original = build.get();
        ControlFlowGraph optimised = build.get();
        CSE.runInPlace(optimised);
        for (long[] input : inputs) {
            assertEquals(Interpreter.run(original, input), Interpreter.run(optimised, input), optimised::toString);
        }
    }

    @Test
    void straightLineSharesOneTemporary() {
        ControlFlowGraph cfg = straightLine();
        Variable a = v(cfg, "a");
        Variable b = v(cfg, "b");
        Passes.CSE.run(cfg);

        int temp = varNamed(cfg, "1.cse_temp");
        assertEquals(U, cfg.getVar(temp).type);
        List<Instr> instrs = cfg.getEntry().getInstrs();
        assertEquals(6, instrs.size(), cfg::toString);
        assertEquals(temp, ((Instr.Set) instrs.get(2)).res);
        assertEquals(binary(Operator.ADD, U, a, b), exprOf(instrs.get(2)));
        assertEquals(var(U, temp), exprOf(instrs.get(3)));
        assertEquals(var(U, temp), exprOf(instrs.get(4)));
        assertEquals(binary(Operator.MUL, U, v(cfg, "t1"), v(cfg, "t2")), exprOf(instrs.get(5)));

        assertSameBehaviour(Graphs::straightLine, new long[]{1, 2}, new long[]{-1, 5});
    }

    @Test
    void reassignmentKillsTheValue() {
        ControlFlowGraph cfg = killedByReassignment();
        String before = cfg.toString();
        CSE.runInPlace(cfg);
        assertEquals(before, cfg.toString());
    }

    @Test
    void commutedOperandsAreShared() {
        ControlFlowGraph cfg = new ControlFlowGraph("commuted", Arrays.asList(U, U));
        CfgBuilder ib = new CfgBuilder(cfg);
        Variable a = ib.assign("a", arg(U, 0));
        Variable b = ib.assign("b", arg(U, 1));
        Variable t1 = ib.assign("t1", binary(Operator.ADD, U, a, b));
        Variable t2 = ib.assign("t2", binary(Operator.ADD, U, b, a));
        Variable t3 = ib.assign("t3", binary(Operator.SUB, U, a, b));
        Variable t4 = ib.assign("t4", binary(Operator.SUB, U, b, a));
        ib.insertCtrl(new Control.Return(Arrays.asList(t1, t2, t3, t4)));
        CSE.runInPlace(cfg);

        int temp = varNamed(cfg, "1.cse_temp");
        assertEquals(7, cfg.getVars().size(), cfg::toString);
        List<Instr> instrs = cfg.getEntry().getInstrs();
        assertEquals(7, instrs.size(), cfg::toString);
        assertEquals(var(U, temp), exprOf(instrs.get(3)));
        assertEquals(var(U, temp), exprOf(instrs.get(4)));
        assertEquals(binary(Operator.SUB, U, a, b), exprOf(instrs.get(5)));
        assertEquals(binary(Operator.SUB, U, b, a), exprOf(instrs.get(6)));
    }

    @Test
    void checkedAndUncheckedAreDistinct() {
        ControlFlowGraph cfg = new ControlFlowGraph("checked", Arrays.asList(U, U));
        CfgBuilder ib = new CfgBuilder(cfg);
        Variable a = ib.assign("a", arg(U, 0));
        Variable b = ib.assign("b", arg(U, 1));
        Variable t1 = ib.assign("t1", binary(Operator.ADD, U, a, b));
        Variable t2 = ib.assign("t2", checked(Operator.ADD, U, a, b));
        ib.insertCtrl(new Control.Return(Arrays.asList(t1, t2)));
        String before = cfg.toString();
        CSE.runInPlace(cfg);
        assertEquals(before, cfg.toString());
    }

    @Test
    void nestedSubexpressionsShareTemporaries() {
        ControlFlowGraph cfg = new ControlFlowGraph("nested", Arrays.asList(U, U, U));
        CfgBuilder ib = new CfgBuilder(cfg);
        Variable a = ib.assign("a", arg(U, 0));
        Variable b = ib.assign("b", arg(U, 1));
        Variable c = ib.assign("c", arg(U, 2));
        Expression sum = binary(Operator.ADD, U, a, b);
        Variable t = ib.assign("t", binary(Operator.MUL, U, sum, c));
        Variable u = ib.assign("u", binary(Operator.MUL, U, sum, c));
        Variable w = ib.assign("w", sum);
        ib.insertCtrl(new Control.Return(Arrays.asList(t, u, w)));
        CSE.runInPlace(cfg);

        Variable sumTemp = v(cfg, "1.cse_temp");
        Variable productTemp = v(cfg, "2.cse_temp");
        List<Instr> instrs = cfg.getEntry().getInstrs();
        assertEquals(8, instrs.size(), cfg::toString);
        assertEquals(sum, exprOf(instrs.get(3)));
        assertEquals(sumTemp.slot, ((Instr.Set) instrs.get(3)).res);
        assertEquals(binary(Operator.MUL, U, sumTemp, c), exprOf(instrs.get(4)));
        assertEquals(productTemp.slot, ((Instr.Set) instrs.get(4)).res);
        assertEquals(productTemp, exprOf(instrs.get(5)));
        assertEquals(productTemp, exprOf(instrs.get(6)));
        assertEquals(sumTemp, exprOf(instrs.get(7)));
    }

    @Test
    void branchesShareAHoistedComputation() {
        ControlFlowGraph cfg = diamond(false);
        Variable a = v(cfg, "a");
        Variable b = v(cfg, "b");
        CSE.runInPlace(cfg);

        Variable temp = v(cfg, "1.cse_temp");
        List<Instr> entry = cfg.getEntry().getInstrs();
        assertEquals(4, entry.size(), cfg::toString);
        assertEquals(temp.slot, ((Instr.Set) entry.get(3)).res);
        assertEquals(binary(Operator.ADD, U, a, b), exprOf(entry.get(3)));
        assertEquals(temp, exprOf(blockNamed(cfg, "left").getInstrs().get(0)));
        assertEquals(temp, exprOf(blockNamed(cfg, "right").getInstrs().get(0)));

        assertSameBehaviour(() -> diamond(false), new long[]{1, 2}, new long[]{7, 3});
    }

    @Test
    void joinReusesTheHoistedComputation() {
        ControlFlowGraph cfg = diamond(true);
        CSE.runInPlace(cfg);

        Variable temp = v(cfg, "1.cse_temp");
        assertEquals(1, cfg.getVars().size() - 6, cfg::toString);
        assertEquals(temp.slot, ((Instr.Set) cfg.getEntry().getInstrs().get(3)).res);
        for (String name : new String[]{"left", "right", "join"}) {
            List<Instr> instrs = blockNamed(cfg, name).getInstrs();
            assertEquals(1, instrs.size(), cfg::toString);
            assertEquals(temp, exprOf(instrs.get(0)), name);
        }

        assertSameBehaviour(() -> diamond(true), new long[]{1, 2}, new long[]{7, 3});
    }

    @Test
    void trappingOperationsAreNotHoisted() {
        for (ControlFlowGraph cfg : Arrays.asList(
                diamond(Operator.UDIV, false, false),
                diamond(Operator.ADD, true, false),
                diamond(Operator.UDIV, false, true))) {
            String before = cfg.toString();
            CSE.runInPlace(cfg);
            assertEquals(before, cfg.toString());
        }
        assertSameBehaviour(() -> diamond(Operator.UDIV, false, true), new long[]{1, 0}, new long[]{0, 3});
    }

    @Test
    void hoistingCanBeDisabled() {
        ControlFlowGraph cfg = diamond(true);
        String before = cfg.toString();
        new EliminateCommonSubexpressions(CseConfig.DEFAULT.withHoistAcrossBranches(false)).runInPlace(cfg);
        assertEquals(before, cfg.toString());
    }

    @Test
    void loopInvariantValuesAreReused() {
        ControlFlowGraph cfg = loop();
        Variable a = v(cfg, "a");
        Variable b = v(cfg, "b");
        Variable c = v(cfg, "c");
        CSE.runInPlace(cfg);

        Variable temp = v(cfg, "1.cse_temp");
        assertEquals(1, cfg.getVars().size() - 9, cfg::toString);

        List<Instr> entry = cfg.getEntry().getInstrs();
        assertEquals(7, entry.size(), cfg::toString);
        assertEquals(binary(Operator.ADD, U, a, b), exprOf(entry.get(4)));
        assertEquals(temp.slot, ((Instr.Set) entry.get(5)).res);
        assertEquals(binary(Operator.ADD, U, b, c), exprOf(entry.get(5)));
        assertEquals(temp, exprOf(entry.get(6)));

        List<Instr> body = blockNamed(cfg, "body").getInstrs();
        assertEquals(6, body.size(), cfg::toString);
        // a is reassigned in the loop
        assertEquals(binary(Operator.ADD, U, a, b), exprOf(body.get(0)));
        assertEquals(temp, exprOf(body.get(1)));

        assertSameBehaviour(Graphs::loop, new long[]{1, 2, 3}, new long[]{-1, -1, 4});
    }

    @Test
    void hoistedDefinitionReadsAnEarlierTemporary() {
        ControlFlowGraph cfg = sharedInnerOperand(true);
        Variable a = v(cfg, "a");
        Variable b = v(cfg, "b");
        Variable c = v(cfg, "c");
        CSE.runInPlace(cfg);

        Variable sumTemp = v(cfg, "1.cse_temp");
        Variable diffTemp = v(cfg, "2.cse_temp");
        List<Instr> entry = cfg.getEntry().getInstrs();
        assertEquals(7, entry.size(), cfg::toString);
        assertEquals(sumTemp.slot, ((Instr.Set) entry.get(3)).res);
        assertEquals(binary(Operator.ADD, U, a, b), exprOf(entry.get(3)));
        assertEquals(sumTemp, exprOf(entry.get(4)));
        assertEquals(diffTemp.slot, ((Instr.Set) entry.get(6)).res);
        assertEquals(binary(Operator.SUB, U, c, sumTemp), exprOf(entry.get(6)));
        assertEquals(diffTemp, exprOf(blockNamed(cfg, "q").getInstrs().get(0)));
        assertEquals(diffTemp, exprOf(blockNamed(cfg, "r").getInstrs().get(0)));

        String once = cfg.toString();
        CSE.runInPlace(cfg);
        assertEquals(once, cfg.toString());

        assertSameBehaviour(() -> sharedInnerOperand(true), new long[]{1, 2, 3}, new long[]{9, 4, 2});
    }

    @Test
    void operandsComputedInEachBranchAreHoistedTogether() {
        ControlFlowGraph cfg = sharedInnerOperand(false);
        Variable a = v(cfg, "a");
        Variable b = v(cfg, "b");
        Variable c = v(cfg, "c");
        CSE.runInPlace(cfg);

        Variable sumTemp = v(cfg, "1.cse_temp");
        Variable diffTemp = v(cfg, "2.cse_temp");
        List<Instr> entry = cfg.getEntry().getInstrs();
        assertEquals(6, entry.size(), cfg::toString);
        assertEquals(sumTemp.slot, ((Instr.Set) entry.get(4)).res);
        assertEquals(binary(Operator.ADD, U, a, b), exprOf(entry.get(4)));
        assertEquals(diffTemp.slot, ((Instr.Set) entry.get(5)).res);
        assertEquals(binary(Operator.SUB, U, c, sumTemp), exprOf(entry.get(5)));
        for (String name : new String[]{"q", "r"}) {
            List<Instr> instrs = blockNamed(cfg, name).getInstrs();
            assertEquals(1, instrs.size(), cfg::toString);
            assertEquals(diffTemp, exprOf(instrs.get(0)), name);
        }

        String once = cfg.toString();
        CSE.runInPlace(cfg);
        assertEquals(once, cfg.toString());

        assertSameBehaviour(() -> sharedInnerOperand(false), new long[]{1, 2, 3}, new long[]{9, 4, 2});
    }

    @Test
    void laterRunsNumberTemporariesAfterEarlierOnes() {
        ControlFlowGraph cfg = straightLine();
        Variable a = v(cfg, "a");
        Variable b = v(cfg, "b");
        CSE.runInPlace(cfg);

        CfgBuilder ib = new CfgBuilder(cfg, cfg.getEntry());
        ib.assign("u", binary(Operator.MUL, U, a, b));
        ib.assign("w", binary(Operator.MUL, U, a, b));
        cfg.getExtOrThrow(CommonExts.METADATA_STATE).varsChanged();
        CSE.runInPlace(cfg);

        int firstTemps = 0;
        for (ControlFlowGraph.VarDecl decl : cfg.getVars().values()) {
            if (decl.name.equals("1.cse_temp")) firstTemps++;
        }
        assertEquals(1, firstTemps, cfg::toString);
        int second = varNamed(cfg, "2.cse_temp");
        Instr definition = null;
        for (Instr instr : cfg.getEntry().getInstrs()) {
            if (instr instanceof Instr.Set && ((Instr.Set) instr).res == second) definition = instr;
        }
        assertNotNull(definition, cfg::toString);
        assertEquals(binary(Operator.MUL, U, a, b), exprOf(definition));
    }

    @TestFactory
    Stream<DynamicTest> runningTwiceChangesNothing() {
        return Stream.<Supplier<ControlFlowGraph>>of(
                Graphs::straightLine,
                Graphs::killedByReassignment,
                () -> diamond(false),
                () -> diamond(true),
                () -> diamond(Operator.UDIV, false, true),
                Graphs::loop,
                () -> sharedInnerOperand(true),
                () -> sharedInnerOperand(false)
        ).map(build -> {
            ControlFlowGraph cfg = build.get();
            return DynamicTest.dynamicTest(cfg.name, () -> {
                CSE.runInPlace(cfg);
                String once = cfg.toString();
                CSE.runInPlace(cfg);
                assertEquals(once, cfg.toString());
            });
        });
    }

    @Test
    void contractPassRunsOnEveryFunction() {
        Contract contract = new Contract("test");
        contract.functions.add(straightLine());
        contract.functions.add(diamond(true));
        Passes.CONTRACT_CSE.run(contract);
        for (ControlFlowGraph cfg : contract.functions) {
            varNamed(cfg, "1.cse_temp");
        }
    }
}
