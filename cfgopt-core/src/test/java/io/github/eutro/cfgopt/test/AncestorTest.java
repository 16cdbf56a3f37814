package io.github.eutro.cfgopt.test;

import io.github.eutro.cfgopt.cfg.*;
import io.github.eutro.cfgopt.cse.AnticipatedExpressions;
import io.github.eutro.cfgopt.cse.CseConfig;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ext.MetadataState;
import io.github.eutro.cfgopt.ops.Operator;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.cfgopt.cfg.Expression.*;
import static io.github.eutro.cfgopt.test.Graphs.*;
import static org.junit.jupiter.api.Assertions.*;

public class AncestorTest {
    static AnticipatedExpressions anticipate(ControlFlowGraph cfg) {
        cfg.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(cfg,
                MetadataState.PREDS,
                MetadataState.DOMS,
                MetadataState.VISITING_ORDER,
                MetadataState.LOOP_REACHING_VARIABLES);
        return AnticipatedExpressions.compute(cfg, CseConfig.DEFAULT.withCheckInvariants(true));
    }

    private static Expression sum(ControlFlowGraph cfg) {
        return binary(Operator.ADD, U, v(cfg, "a"), v(cfg, "b"));
    }

    @Test
    void siblingsMeetAtTheBranch() {
        ControlFlowGraph cfg = diamond(true);
        AnticipatedExpressions ae = anticipate(cfg);
        BasicBlock left = blockNamed(cfg, "left");
        BasicBlock right = blockNamed(cfg, "right");
        BasicBlock join = blockNamed(cfg, "join");
        assertSame(cfg.getEntry(), ae.findAncestor(left, right, sum(cfg)));
        assertSame(cfg.getEntry(), ae.findAncestor(right, left, sum(cfg)));
        // join is reached through both branches, so neither branch sees all of the flow
        assertSame(cfg.getEntry(), ae.findAncestor(join, left, sum(cfg)));
    }

    @Test
    void sameBlockIsItsOwnAncestor() {
        ControlFlowGraph cfg = diamond(true);
        AnticipatedExpressions ae = anticipate(cfg);
        BasicBlock left = blockNamed(cfg, "left");
        assertSame(left, ae.findAncestor(left, left, binary(Operator.MUL, U, v(cfg, "a"), v(cfg, "b"))));
    }

    @Test
    void ancestorMustAnticipateTheValue() {
        ControlFlowGraph cfg = diamond(true);
        AnticipatedExpressions ae = anticipate(cfg);
        Expression product = binary(Operator.MUL, U, v(cfg, "a"), v(cfg, "b"));
        assertFalse(ae.isAnticipatedAt(cfg.getEntry(), product));
        assertNull(ae.findAncestor(blockNamed(cfg, "left"), blockNamed(cfg, "right"), product));
        assertTrue(ae.isAnticipatedAt(cfg.getEntry(), sum(cfg)));
        assertTrue(ae.isAnticipatedAt(cfg.getEntry(), binary(Operator.ADD, U, v(cfg, "b"), v(cfg, "a"))));
    }

    /**
     * <pre>
     * entry: a = arg0; b = arg1; goto mid
     * mid:   c = a < b; if c then left else right
     * left:  x = a + b
     * right: y = a + b
     * </pre>
     */
    @Test
    void deepestAncestorWins() {
        ControlFlowGraph cfg = new ControlFlowGraph("chain", Arrays.asList(U, U));
        CfgBuilder ib = new CfgBuilder(cfg);
        Variable a = ib.assign("a", arg(U, 0));
        Variable b = ib.assign("b", arg(U, 1));
        BasicBlock mid = cfg.newBlock("mid");
        BasicBlock left = cfg.newBlock("left");
        BasicBlock right = cfg.newBlock("right");
        ib.insertCtrl(Control.br(mid));
        ib.setBlock(mid);
        Variable c = ib.assign("c", binary(Operator.LT_U, Type.BOOL, a, b));
        ib.insertCtrl(new Control.BranchCond(c, left, right));
        ib.setBlock(left);
        Variable x = ib.assign("x", binary(Operator.ADD, U, a, b));
        ib.insertCtrl(new Control.Return(Collections.singletonList(x)));
        ib.setBlock(right);
        Variable y = ib.assign("y", binary(Operator.ADD, U, a, b));
        ib.insertCtrl(new Control.Return(Collections.singletonList(y)));

        AnticipatedExpressions ae = anticipate(cfg);
        assertTrue(ae.isAnticipatedAt(cfg.getEntry(), sum(cfg)));
        assertSame(mid, ae.findAncestor(left, right, sum(cfg)));
    }

    @Test
    void reassignmentBlocksAnticipation() {
        ControlFlowGraph cfg = diamond(true);
        BasicBlock left = blockNamed(cfg, "left");
        left.getInstrs().add(0, new Instr.Set(varNamed(cfg, "a"), num(U, 7)));
        AnticipatedExpressions ae = anticipate(cfg);
        // still anticipated through the right branch
        assertTrue(ae.isAnticipatedAt(cfg.getEntry(), sum(cfg)));
        assertNotNull(ae.getExitSet(left));
    }

    @Test
    void loopsKillWhatTheyReassign() {
        ControlFlowGraph cfg = loop();
        AnticipatedExpressions ae = anticipate(cfg);
        BasicBlock entry = cfg.getEntry();
        assertFalse(ae.isAnticipatedAt(entry, sum(cfg)));
        assertTrue(ae.isAnticipatedAt(entry, binary(Operator.ADD, U, v(cfg, "b"), v(cfg, "c"))));
        BasicBlock header = blockNamed(cfg, "header");
        assertFalse(ae.isAnticipatedAt(header, sum(cfg)));
        assertTrue(ae.isAnticipatedAt(header, binary(Operator.ADD, U, v(cfg, "c"), v(cfg, "b"))));
    }
}
