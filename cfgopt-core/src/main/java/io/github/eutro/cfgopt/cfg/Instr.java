package io.github.eutro.cfgopt.cfg;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ext.Ext;
import io.github.eutro.cfgopt.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An instruction in a {@link BasicBlock}.
 * <p>
 * Each instruction splits its fields into <i>operands</i>, the expressions it evaluates, which
 * passes may rewrite through {@link #operands()}, and structural fields (result slots, callee
 * names, jump targets) that are fixed when the instruction is built.
 */
public abstract class Instr extends ExtHolder {
    private final Expression[] operands;

    Instr(Expression... operands) {
        for (Expression operand : operands) {
            Preconditions.checkNotNull(operand);
        }
        this.operands = operands;
    }

    Instr(List<Expression> operands) {
        this(operands.toArray(new Expression[0]));
    }

    /**
     * Get the operand expressions, in evaluation order.
     * <p>
     * The list has a fixed size, but elements may be replaced.
     *
     * @return The operands.
     */
    public final List<Expression> operands() {
        return Arrays.asList(operands);
    }

    Expression operand(int i) {
        return operands[i];
    }

    /**
     * Get the variable slots this instruction writes.
     *
     * @return The written slots.
     */
    public List<Integer> results() {
        return Collections.emptyList();
    }

    abstract String describe();

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        List<Integer> results = results();
        if (!results.isEmpty()) {
            for (int i = 0; i < results.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append('%').append(results.get(i));
            }
            sb.append(" = ");
        }
        sb.append(describe());
        for (Expression operand : operands) {
            sb.append(' ').append(operand);
        }
        return sb.toString();
    }

    /**
     * {@code res = expr}
     */
    public static final class Set extends Instr {
        public final int res;

        public Set(int res, Expression expr) {
            super(expr);
            this.res = res;
        }

        public Expression getExpr() {
            return operand(0);
        }

        @Override
        public List<Integer> results() {
            return Collections.singletonList(res);
        }

        @Override
        public String toString() {
            return "%" + res + " = " + getExpr();
        }

        @Override
        String describe() {
            return "set";
        }
    }

    /**
     * Write a value to memory through a pointer.
     */
    public static final class Store extends Instr {
        public Store(Expression dest, Expression value) {
            super(dest, value);
        }

        public Expression getDest() {
            return operand(0);
        }

        public Expression getValue() {
            return operand(1);
        }

        @Override
        String describe() {
            return "store";
        }
    }

    /**
     * Write a value to contract storage.
     */
    public static final class SetStorage extends Instr {
        public SetStorage(Expression slot, Expression value) {
            super(slot, value);
        }

        public Expression getSlot() {
            return operand(0);
        }

        public Expression getValue() {
            return operand(1);
        }

        @Override
        String describe() {
            return "sstore";
        }
    }

    /**
     * Read a value from contract storage into a variable.
     */
    public static final class LoadStorage extends Instr {
        public final int res;

        public LoadStorage(int res, Expression slot) {
            super(slot);
            this.res = res;
        }

        public Expression getSlot() {
            return operand(0);
        }

        @Override
        public List<Integer> results() {
            return Collections.singletonList(res);
        }

        @Override
        String describe() {
            return "sload";
        }
    }

    /**
     * Call a function of the same contract.
     */
    public static final class Call extends Instr {
        public final ImmutableList<Integer> res;
        public final String callee;

        public Call(List<Integer> res, String callee, List<Expression> args) {
            super(args);
            this.res = ImmutableList.copyOf(res);
            this.callee = callee;
        }

        @Override
        public List<Integer> results() {
            return res;
        }

        @Override
        String describe() {
            return "call " + callee;
        }
    }

    /**
     * Call another contract. The optional success flag is written with whether the call succeeded.
     */
    public static final class ExternalCall extends Instr {
        @Nullable
        public final Integer success;

        public ExternalCall(@Nullable Integer success, Expression address, Expression value, Expression payload) {
            super(address, value, payload);
            this.success = success;
        }

        public Expression getAddress() {
            return operand(0);
        }

        public Expression getValue() {
            return operand(1);
        }

        public Expression getPayload() {
            return operand(2);
        }

        @Override
        public List<Integer> results() {
            return success == null ? Collections.emptyList() : Collections.singletonList(success);
        }

        @Override
        String describe() {
            return "extcall";
        }
    }

    /**
     * Deploy a new contract, writing its address and, optionally, whether deployment succeeded.
     */
    public static final class Constructor extends Instr {
        public final int address;
        @Nullable
        public final Integer success;
        public final String contract;

        public Constructor(int address, @Nullable Integer success, String contract, List<Expression> args) {
            super(args);
            this.address = address;
            this.success = success;
            this.contract = contract;
        }

        @Override
        public List<Integer> results() {
            List<Integer> results = new ArrayList<>(2);
            results.add(address);
            if (success != null) results.add(success);
            return results;
        }

        @Override
        String describe() {
            return "create " + contract;
        }
    }

    /**
     * Emit an event. The operands are the topics, followed by the data.
     */
    public static final class EmitEvent extends Instr {
        public final String event;
        public final int topicCount;

        public EmitEvent(String event, List<Expression> topics, Expression data) {
            super(ImmutableList.<Expression>builder().addAll(topics).add(data).build());
            this.event = event;
            this.topicCount = topics.size();
        }

        @Override
        String describe() {
            return "emit " + event;
        }
    }

    public static final class Print extends Instr {
        public Print(Expression expr) {
            super(expr);
        }

        @Override
        String describe() {
            return "print";
        }
    }

    /**
     * Abort execution, reverting all effects.
     */
    public static final class AssertFailure extends Instr {
        public AssertFailure(@Nullable Expression reason) {
            super(reason == null ? new Expression[0] : new Expression[]{reason});
        }

        @Override
        String describe() {
            return "assert-failure";
        }
    }

    public static final class Nop extends Instr {
        public Nop() {
            super();
        }

        @Override
        String describe() {
            return "nop";
        }
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
