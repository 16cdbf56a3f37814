package io.github.eutro.cfgopt.passes.meta;

import io.github.eutro.cfgopt.cfg.*;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.passes.InPlaceIRPass;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks that a graph is well formed, throwing if it is not.
 * <p>
 * Every block must belong to the graph at its own index and end in a control instruction,
 * every jump must target a block of the same graph, and every variable read or written must
 * be declared.
 */
public class VerifyIntegrity implements InPlaceIRPass<ControlFlowGraph> {
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        if (cfg.blocks.isEmpty()) {
            throw new IllegalStateException(String.format("graph %s has no blocks", cfg.name));
        }
        Set<BasicBlock> blockSet = new HashSet<>(cfg.blocks);
        for (int i = 0; i < cfg.blocks.size(); i++) {
            BasicBlock block = cfg.blocks.get(i);
            if (block.getIndex() != i) {
                throw new IllegalStateException(String.format("block %s found at index %d",
                        block.toTargetString(), i));
            }
            if (block.getNullable(CommonExts.OWNING_GRAPH) != cfg) {
                throw new IllegalStateException(String.format("block %s is owned by another graph",
                        block.toTargetString()));
            }
            Control ctrl = block.getControl();
            if (ctrl == null) {
                throw new IllegalStateException(String.format("block %s has no control",
                        block.toTargetString()));
            }
            for (Instr instr : block.getInstrs()) {
                verifyInstr(cfg, block, instr);
            }
            verifyInstr(cfg, block, ctrl);
            for (BasicBlock target : ctrl.targets) {
                if (!blockSet.contains(target)) {
                    throw new IllegalStateException(String.format("target %s is not in graph %s" +
                                    "\n  in block: %s",
                            target.toTargetString(), cfg.name, block.toTargetString()));
                }
            }
        }
    }

    private static void verifyInstr(ControlFlowGraph cfg, BasicBlock block, Instr instr) {
        if (instr.getNullable(CommonExts.OWNING_BLOCK) != block) {
            throw new IllegalStateException(String.format("instruction %s is owned by another block" +
                    "\n  in block: %s", instr, block.toTargetString()));
        }
        for (int slot : instr.results()) {
            if (cfg.getVar(slot) == null) {
                throw new IllegalStateException(String.format("write to undeclared variable %%%d in %s" +
                        "\n  in block: %s", slot, instr, block.toTargetString()));
            }
        }
        for (Expression operand : instr.operands()) {
            verifyExpr(cfg, block, instr, operand);
        }
    }

    private static void verifyExpr(ControlFlowGraph cfg, BasicBlock block, Instr instr, Expression expr) {
        if (expr instanceof Expression.Variable) {
            int slot = ((Expression.Variable) expr).slot;
            ControlFlowGraph.VarDecl decl = cfg.getVar(slot);
            if (decl == null) {
                throw new IllegalStateException(String.format("read of undeclared variable %%%d in %s" +
                        "\n  in block: %s", slot, instr, block.toTargetString()));
            }
            if (!decl.type.equals(expr.getType())) {
                throw new IllegalStateException(String.format("variable %%%d declared %s but read as %s in %s" +
                        "\n  in block: %s", slot, decl.type, expr.getType(), instr, block.toTargetString()));
            }
        } else if (expr instanceof Expression.FunctionArg) {
            int index = ((Expression.FunctionArg) expr).index;
            if (index < 0 || index >= cfg.params.size()) {
                throw new IllegalStateException(String.format("argument %d out of range in %s" +
                        "\n  in block: %s", index, instr, block.toTargetString()));
            }
        }
        for (Expression child : expr.children()) {
            verifyExpr(cfg, block, instr, child);
        }
    }
}
