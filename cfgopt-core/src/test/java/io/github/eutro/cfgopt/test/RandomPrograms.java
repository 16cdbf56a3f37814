package io.github.eutro.cfgopt.test;

import io.github.eutro.cfgopt.cfg.*;
import io.github.eutro.cfgopt.ops.Operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Generates structured random programs over a handful of variables: assignments, prints,
 * storage accesses, if/else diamonds and bounded loops. The same seed always produces
 * the same program.
 */
public class RandomPrograms {
    static final Type T = Type.uint(64);
    private static final Operator[] OPS = {
            Operator.ADD, Operator.SUB, Operator.MUL, Operator.BIT_XOR, Operator.UDIV,
    };

    private final Random rng;
    private final ControlFlowGraph cfg;
    private final CfgBuilder ib;
    private final int[] pool = new int[4];
    private final List<Expression> favourites = new ArrayList<>();
    private int loops = 0;

    private RandomPrograms(long seed) {
        rng = new Random(seed);
        cfg = new ControlFlowGraph("random" + seed, Arrays.asList(T, T, T));
        ib = new CfgBuilder(cfg);
    }

    public static ControlFlowGraph generate(long seed) {
        return new RandomPrograms(seed).generate();
    }

    private ControlFlowGraph generate() {
        for (int i = 0; i < pool.length; i++) {
            pool[i] = cfg.newVarFmt(T, "v%d", i);
        }
        for (int i = 0; i < 3; i++) {
            ib.assign(pool[i], Expression.arg(T, i));
        }
        ib.assign(pool[3], Expression.num(T, rng.nextInt(10)));
        for (int i = 0; i < 4; i++) {
            favourites.add(freshExpr(2));
        }

        stmts(0);

        List<Expression> ret = new ArrayList<>();
        for (int slot : pool) {
            ret.add(Expression.var(T, slot));
        }
        ib.insertCtrl(new Control.Return(ret));
        return cfg;
    }

    private void stmts(int depth) {
        int count = 2 + rng.nextInt(depth == 0 ? 6 : 3);
        for (int i = 0; i < count; i++) {
            stmt(depth);
        }
    }

    private void stmt(int depth) {
        switch (rng.nextInt(depth < 2 ? 7 : 4)) {
            case 0:
            case 1:
                ib.assign(pool[rng.nextInt(pool.length)], expr(2));
                break;
            case 2:
                ib.insert(new Instr.Print(expr(2)));
                break;
            case 3:
                if (rng.nextBoolean()) {
                    ib.insert(new Instr.SetStorage(Expression.num(T, rng.nextInt(3)), expr(1)));
                } else {
                    ib.insert(new Instr.LoadStorage(pool[rng.nextInt(pool.length)], Expression.num(T, rng.nextInt(3))));
                }
                break;
            case 4:
            case 5: {
                Expression cond = Expression.binary(Operator.LT_U, Type.BOOL, expr(1), expr(1));
                BasicBlock then = cfg.newBlock("then");
                BasicBlock join = cfg.newBlock("join");
                if (rng.nextBoolean()) {
                    BasicBlock els = cfg.newBlock("else");
                    ib.insertCtrl(new Control.BranchCond(cond, then, els));
                    ib.setBlock(els);
                    stmts(depth + 1);
                    ib.insertCtrl(Control.br(join));
                } else {
                    ib.insertCtrl(new Control.BranchCond(cond, then, join));
                }
                ib.setBlock(then);
                stmts(depth + 1);
                ib.insertCtrl(Control.br(join));
                ib.setBlock(join);
                break;
            }
            default: {
                int ctr = cfg.newVarFmt(T, "ctr%d", loops++);
                ib.assign(ctr, Expression.num(T, 0));
                BasicBlock header = cfg.newBlock("header");
                BasicBlock body = cfg.newBlock("body");
                BasicBlock exit = cfg.newBlock("exit");
                ib.insertCtrl(Control.br(header));
                ib.setBlock(header);
                ib.insertCtrl(new Control.BranchCond(
                        Expression.binary(Operator.LT_U, Type.BOOL, Expression.var(T, ctr), Expression.num(T, 1 + rng.nextInt(3))),
                        body, exit));
                ib.setBlock(body);
                stmts(depth + 1);
                ib.assign(ctr, Expression.binary(Operator.ADD, T, Expression.var(T, ctr), Expression.num(T, 1)));
                ib.insertCtrl(Control.br(header));
                ib.setBlock(exit);
                break;
            }
        }
    }

    private Expression expr(int depth) {
        if (rng.nextBoolean()) {
            return favourites.get(rng.nextInt(favourites.size()));
        }
        return freshExpr(depth);
    }

    private Expression freshExpr(int depth) {
        if (depth == 0 || rng.nextInt(3) == 0) {
            return rng.nextInt(5) < 4
                    ? Expression.var(T, pool[rng.nextInt(pool.length)])
                    : Expression.num(T, rng.nextInt(4));
        }
        Operator op = OPS[rng.nextInt(OPS.length)];
        Expression left = freshExpr(depth - 1);
        Expression right = freshExpr(depth - 1);
        if (op == Operator.ADD && rng.nextInt(4) == 0) {
            return Expression.checked(op, T, left, right);
        }
        return Expression.binary(op, T, left, right);
    }
}
