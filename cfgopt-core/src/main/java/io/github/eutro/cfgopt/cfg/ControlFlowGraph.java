package io.github.eutro.cfgopt.cfg;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ext.Ext;
import io.github.eutro.cfgopt.ext.ExtHolder;
import io.github.eutro.cfgopt.ext.MetadataState;
import io.github.eutro.cfgopt.ext.TrackedList;
import org.intellij.lang.annotations.PrintFormat;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The control flow graph of one function: its {@link BasicBlock blocks} and its variable table.
 */
public final class ControlFlowGraph extends ExtHolder {
    /**
     * The name of the function.
     */
    public final String name;
    /**
     * The parameter types, indexed by {@link Expression.FunctionArg#index}.
     */
    public final List<Type> params;
    /**
     * The blocks of this graph. The first one is the entry, and the index of each block is its position.
     */
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_GRAPH, ControlFlowGraph.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_GRAPH);
        }
    };
    private final SortedMap<Integer, VarDecl> vars = new TreeMap<>();
    private int nextSlot = 0;

    /**
     * A declared variable.
     */
    public static final class VarDecl {
        public final String name;
        public final Type type;

        VarDecl(String name, Type type) {
            this.name = name;
            this.type = type;
        }

        @Override
        public String toString() {
            return type + " " + name;
        }
    }

    public ControlFlowGraph(String name, List<Type> params) {
        this.name = name;
        this.params = ImmutableList.copyOf(params);
    }

    public ControlFlowGraph(String name) {
        this(name, Collections.emptyList());
    }

    /**
     * Declare a new variable in a fresh slot.
     *
     * @param name The name of the variable.
     * @param type The type of the variable.
     * @return The slot of the variable.
     */
    public int newVar(String name, Type type) {
        int slot = nextSlot++;
        vars.put(slot, new VarDecl(name, type));
        return slot;
    }

    /**
     * Declare a new variable with a formatted name.
     *
     * @param type The type of the variable.
     * @param fmt  The format string of the name.
     * @param args The format arguments.
     * @return The slot of the variable.
     */
    public int newVarFmt(Type type, @PrintFormat String fmt, Object... args) {
        return newVar(String.format(fmt, args), type);
    }

    /**
     * Declare a variable in a slot chosen by the producer of this graph.
     *
     * @param slot The slot.
     * @param name The name of the variable.
     * @param type The type of the variable.
     */
    public void declareVar(int slot, String name, Type type) {
        Preconditions.checkArgument(!vars.containsKey(slot), "slot %s already declared", slot);
        vars.put(slot, new VarDecl(name, type));
        nextSlot = Math.max(nextSlot, slot + 1);
    }

    public @Nullable VarDecl getVar(int slot) {
        return vars.get(slot);
    }

    /**
     * Get the variable table, ordered by slot.
     *
     * @return An unmodifiable view of the table.
     */
    public SortedMap<Integer, VarDecl> getVars() {
        return Collections.unmodifiableSortedMap(vars);
    }

    /**
     * Create a new block at the end of this graph.
     *
     * @param name The name of the block, for debugging.
     * @return The new block.
     */
    public BasicBlock newBlock(String name) {
        BasicBlock bb = new BasicBlock(blocks.size(), name);
        blocks.add(bb);
        return bb;
    }

    public BasicBlock newBlock() {
        return newBlock("bb" + blocks.size());
    }

    public BasicBlock getEntry() {
        return blocks.get(0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append(params).append(" {\n");
        for (Map.Entry<Integer, VarDecl> entry : vars.entrySet()) {
            sb.append("  var %").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
