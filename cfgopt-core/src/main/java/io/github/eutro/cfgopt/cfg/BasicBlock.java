package io.github.eutro.cfgopt.cfg;

import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ext.Ext;
import io.github.eutro.cfgopt.ext.ExtHolder;
import io.github.eutro.cfgopt.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block: a list of non-terminating {@link Instr instructions},
 * followed by exactly one {@link Control} instruction.
 */
public final class BasicBlock extends ExtHolder {
    private final int index;
    private final String name;
    private final List<Instr> instrs = new TrackedList<Instr>(new ArrayList<>()) {
        @Override
        protected void onAdded(Instr elt) {
            if (elt instanceof Control) {
                throw new IllegalArgumentException("control instruction in instruction list: " + elt);
            }
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Instr elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };
    private Control control;

    BasicBlock(int index, String name) {
        this.index = index;
        this.name = name;
    }

    /**
     * Get the index of this block in its graph's {@link ControlFlowGraph#blocks block list}.
     *
     * @return The index.
     */
    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    /**
     * Format this block as a jump target, for debugging.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return "@" + index + "." + name;
    }

    /**
     * Get the non-terminating instructions of this block. Adding to or removing from
     * the list updates {@link CommonExts#OWNING_BLOCK}.
     *
     * @return The instruction list.
     */
    public List<Instr> getInstrs() {
        return instrs;
    }

    public void addInstr(Instr instr) {
        instrs.add(instr);
    }

    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        if (this.control != null) {
            this.control.removeExt(CommonExts.OWNING_BLOCK);
        }
        control.attachExt(CommonExts.OWNING_BLOCK, this);
        this.control = control;
    }

    /**
     * Get the blocks control may pass to from this one.
     *
     * @return The successors, in target order.
     */
    public List<BasicBlock> successors() {
        return control == null ? Collections.emptyList() : control.targets;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append(":\n");
        for (Instr instr : instrs) {
            sb.append("  ").append(instr).append('\n');
        }
        sb.append("  ").append(control);
        return sb.toString();
    }

    // exts
    private ControlFlowGraph owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_GRAPH) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_GRAPH) {
            owner = (ControlFlowGraph) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_GRAPH) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
