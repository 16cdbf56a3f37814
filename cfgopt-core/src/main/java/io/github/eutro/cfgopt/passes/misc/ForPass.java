package io.github.eutro.cfgopt.passes.misc;

import io.github.eutro.cfgopt.cfg.Contract;
import io.github.eutro.cfgopt.cfg.ControlFlowGraph;
import io.github.eutro.cfgopt.passes.IRPass;
import io.github.eutro.cfgopt.passes.InPlaceIRPass;

import java.util.ListIterator;

/**
 * Lifts passes over single functions into passes over whole contracts.
 */
public class ForPass {
    /**
     * Lift a function pass to run on every function of a contract, in order.
     *
     * @param pass The function pass.
     * @return The contract pass.
     */
    public static InPlaceIRPass<Contract> liftFunctions(IRPass<ControlFlowGraph, ControlFlowGraph> pass) {
        return new Functions(pass);
    }

    private static class Functions implements InPlaceIRPass<Contract> {
        private final IRPass<ControlFlowGraph, ControlFlowGraph> pass;

        private Functions(IRPass<ControlFlowGraph, ControlFlowGraph> pass) {
            this.pass = pass;
        }

        @Override
        public void runInPlace(Contract contract) {
            ListIterator<ControlFlowGraph> it = contract.functions.listIterator();
            while (it.hasNext()) {
                ControlFlowGraph cfg = it.next();
                try {
                    ControlFlowGraph result = pass.run(cfg);
                    if (result != cfg) it.set(result);
                } catch (RuntimeException | Error e) {
                    e.addSuppressed(new RuntimeException("in function " + cfg.name));
                    throw e;
                }
            }
        }

        @Override
        public String toString() {
            return "for functions: " + pass;
        }
    }
}
