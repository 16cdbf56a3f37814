package io.github.eutro.cfgopt.cfg;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The terminating instruction of a {@link BasicBlock}, which decides where control goes next.
 */
public abstract class Control extends Instr {
    /**
     * The jump targets of this instruction. The meaning of the order depends on the instruction.
     */
    public final List<BasicBlock> targets;

    Control(List<BasicBlock> targets, Expression... operands) {
        super(operands);
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    Control(List<BasicBlock> targets, List<Expression> operands) {
        super(operands);
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(super.toString());
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }

    public static Branch br(BasicBlock target) {
        return new Branch(target);
    }

    public static final class Branch extends Control {
        public Branch(BasicBlock target) {
            super(Collections.singletonList(target));
        }

        @Override
        String describe() {
            return "br";
        }
    }

    /**
     * Jump to the first target if the condition holds, otherwise to the second.
     */
    public static final class BranchCond extends Control {
        public BranchCond(Expression cond, BasicBlock ifTrue, BasicBlock ifFalse) {
            super(ImmutableList.of(ifTrue, ifFalse), cond);
        }

        public Expression getCond() {
            return operand(0);
        }

        @Override
        String describe() {
            return "br_if";
        }
    }

    /**
     * Jump to the target of the first case equal to the condition, or to the default,
     * which is the last target.
     */
    public static final class Switch extends Control {
        public final ImmutableList<BigInteger> cases;

        public Switch(Expression cond, List<BigInteger> cases, List<BasicBlock> caseTargets, BasicBlock dflt) {
            super(ImmutableList.<BasicBlock>builder().addAll(caseTargets).add(dflt).build(), cond);
            Preconditions.checkArgument(cases.size() == caseTargets.size(), "case count mismatch");
            this.cases = ImmutableList.copyOf(cases);
        }

        public Expression getCond() {
            return operand(0);
        }

        @Override
        String describe() {
            return "switch " + cases;
        }
    }

    public static final class Return extends Control {
        public Return(List<Expression> values) {
            super(Collections.emptyList(), values);
        }

        @Override
        String describe() {
            return "return";
        }
    }

    public static final class Unreachable extends Control {
        public Unreachable() {
            super(Collections.emptyList());
        }

        @Override
        String describe() {
            return "unreachable";
        }
    }
}
