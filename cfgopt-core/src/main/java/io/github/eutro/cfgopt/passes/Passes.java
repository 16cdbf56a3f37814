package io.github.eutro.cfgopt.passes;

import io.github.eutro.cfgopt.cfg.Contract;
import io.github.eutro.cfgopt.cfg.ControlFlowGraph;
import io.github.eutro.cfgopt.passes.meta.VerifyIntegrity;
import io.github.eutro.cfgopt.passes.misc.ForPass;
import io.github.eutro.cfgopt.passes.opts.EliminateCommonSubexpressions;

public class Passes {
    public static final IRPass<ControlFlowGraph, ControlFlowGraph> CSE =
            VerifyIntegrity.INSTANCE
                    .then(EliminateCommonSubexpressions.INSTANCE)
                    .then(VerifyIntegrity.INSTANCE);

    public static final IRPass<Contract, Contract> CONTRACT_CSE = ForPass.liftFunctions(CSE);
}
