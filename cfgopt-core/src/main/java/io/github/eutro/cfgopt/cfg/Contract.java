package io.github.eutro.cfgopt.cfg;

import java.util.ArrayList;
import java.util.List;

/**
 * A compiled contract: the control flow graphs of all its functions.
 */
public final class Contract {
    public final String name;
    /**
     * The functions of the contract.
     */
    public final List<ControlFlowGraph> functions = new ArrayList<>();

    public Contract(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("contract ").append(name).append(" {\n");
        for (ControlFlowGraph function : functions) {
            sb.append(function).append('\n');
        }
        return sb.append('}').toString();
    }
}
