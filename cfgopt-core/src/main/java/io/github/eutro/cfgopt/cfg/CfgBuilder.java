package io.github.eutro.cfgopt.cfg;

/**
 * An instruction builder, which appends instructions to one block of a graph at a time.
 */
public class CfgBuilder {
    /**
     * The graph being built.
     */
    public final ControlFlowGraph cfg;
    private BasicBlock bb;

    /**
     * Construct a builder inserting into a block.
     *
     * @param cfg The graph.
     * @param bb  One of the graph's blocks.
     */
    public CfgBuilder(ControlFlowGraph cfg, BasicBlock bb) {
        this.cfg = cfg;
        this.bb = bb;
    }

    /**
     * Construct a builder inserting into a new entry block of an empty graph.
     *
     * @param cfg The graph.
     */
    public CfgBuilder(ControlFlowGraph cfg) {
        this(cfg, cfg.blocks.isEmpty() ? cfg.newBlock("entry") : cfg.getEntry());
    }

    public BasicBlock getBlock() {
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Append an instruction to the current block.
     *
     * @param instr The instruction.
     */
    public void insert(Instr instr) {
        bb.addInstr(instr);
    }

    /**
     * Assign an expression to an existing variable.
     *
     * @param slot The variable's slot.
     * @param expr The expression.
     * @return A read of the variable.
     */
    public Expression.Variable assign(int slot, Expression expr) {
        insert(new Instr.Set(slot, expr));
        return Expression.var(expr.getType(), slot);
    }

    /**
     * Assign an expression to a new variable.
     *
     * @param name The name of the variable.
     * @param expr The expression.
     * @return A read of the variable.
     */
    public Expression.Variable assign(String name, Expression expr) {
        return assign(cfg.newVar(name, expr.getType()), expr);
    }

    /**
     * Terminate the current block.
     *
     * @param ctrl The control instruction.
     */
    public void insertCtrl(Control ctrl) {
        bb.setControl(ctrl);
    }
}
