package io.github.eutro.cfgopt.passes.opts;

import com.google.common.base.Verify;
import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.ControlFlowGraph;
import io.github.eutro.cfgopt.cfg.Instr;
import io.github.eutro.cfgopt.cse.*;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ext.CommonExts.OrderData;
import io.github.eutro.cfgopt.ext.MetadataState;
import io.github.eutro.cfgopt.passes.InPlaceIRPass;
import org.apache.log4j.Logger;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Common subexpression elimination.
 * <p>
 * The graph is walked twice, in the acyclic visiting order, tracking the available expressions
 * at each point. The first walk records every pure operation computed more than once where a
 * single computation can serve all the occurrences, possibly hoisted into a block dominating
 * them. The second walk replays the first with identical node ids, and rewrites those
 * occurrences to read a fresh temporary, inserting the temporary's definition before its first
 * use or, if hoisted, at the end of the hoist block. Temporaries are numbered after those left
 * by earlier runs.
 */
public class EliminateCommonSubexpressions implements InPlaceIRPass<ControlFlowGraph> {
    private static final Logger LOGGER = Logger.getLogger(EliminateCommonSubexpressions.class);

    /**
     * Whether to dump the available expressions at the end of every block, at info level.
     * Set with the {@code CFGOPT_TRACE_SETS} environment variable.
     */
    public static boolean TRACE_SETS = System.getenv("CFGOPT_TRACE_SETS") != null;

    public static final EliminateCommonSubexpressions INSTANCE = new EliminateCommonSubexpressions(CseConfig.DEFAULT);

    private final CseConfig config;

    public EliminateCommonSubexpressions(CseConfig config) {
        this.config = config;
    }

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(cfg,
                MetadataState.PREDS,
                MetadataState.DOMS,
                MetadataState.VISITING_ORDER,
                MetadataState.LOOP_REACHING_VARIABLES);

        AnticipatedExpressions anticipated = AnticipatedExpressions.compute(cfg, config);
        Map<BasicBlock, AvailableExpressionSet> exitSets = new HashMap<>();
        CommonSubexpressionTracker tracker = new CommonSubexpressionTracker(config, anticipated, exitSets);
        walk(cfg, new AnalysisContext(tracker), anticipated, exitSets, false);

        List<CommonSubexpression> declared = tracker.getDeclared();
        if (declared.isEmpty()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(cfg.name + ": " + tracker.getEntries().size() + " entries, nothing shared");
            }
            return;
        }

        int counter = firstFreeTemporary(cfg);
        int hoisted = 0;
        for (CommonSubexpression entry : declared) {
            entry.setTemp(cfg.newVar(String.format(config.temporaryNameFormat(), counter++),
                    entry.getDefinition().getType()));
            if (entry.isHoisted()) hoisted++;
        }

        AnalysisContext rewriteCtx = new AnalysisContext(tracker);
        Map<BasicBlock, AvailableExpressionSet> rewrittenExitSets = new HashMap<>();
        walk(cfg, rewriteCtx, anticipated, rewrittenExitSets, true);

        for (CommonSubexpression entry : declared) {
            if (entry.isHoisted()) {
                BasicBlock hoistBlock = entry.getHoistBlock();
                AvailableExpressionSet exitSet = Verify.verifyNotNull(rewrittenExitSets.get(hoistBlock),
                        "hoist block %s not visited", hoistBlock.toTargetString());
                hoistBlock.addInstr(new Instr.Set(entry.getTemp(),
                        tracker.hoistedDefinition(entry, exitSet, rewriteCtx)));
                entry.materialize();
            }
            Verify.verify(entry.getState() == CommonSubexpression.State.MATERIALIZED,
                    "declared but never defined: %s", entry);
        }
        ms.varsChanged();

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(cfg.name + ": " + tracker.getEntries().size() + " entries, "
                    + declared.size() + " temporaries, " + hoisted + " hoisted");
        }
    }

    private int firstFreeTemporary(ControlFlowGraph cfg) {
        Set<String> taken = new HashSet<>();
        for (ControlFlowGraph.VarDecl decl : cfg.getVars().values()) {
            taken.add(decl.name);
        }
        int first = 1;
        for (int n = 1; n <= taken.size(); n++) {
            if (taken.contains(String.format(config.temporaryNameFormat(), n))) first = n + 1;
        }
        return first;
    }

    private void walk(ControlFlowGraph cfg,
                      AnalysisContext ctx,
                      AnticipatedExpressions anticipated,
                      Map<BasicBlock, AvailableExpressionSet> exitSets,
                      boolean rewrite) {
        CommonExts.VisitingOrder vo = cfg.getExtOrThrow(CommonExts.VISITING_ORDER);
        Map<BasicBlock, AvailableExpressionSet> entrySets = new HashMap<>();
        for (BasicBlock block : vo.order) {
            ctx.setCurrentBlock(block);
            OrderData od = block.getExtOrThrow(CommonExts.ORDER_DATA);
            AvailableExpressionSet set = entrySets.remove(block);
            if (set == null) set = new AvailableExpressionSet();
            if (od.cyclic) {
                for (int slot : block.getExtOrThrow(CommonExts.LOOP_REACHING_VARIABLES)) {
                    set.kill(slot);
                }
            }

            List<Instr> instrs = block.getInstrs();
            for (int i = 0; i < instrs.size(); i++) {
                Instr instr = instrs.get(i);
                if (rewrite) {
                    set.rewriteInstruction(instr, ctx);
                    List<Instr> defs = ctx.drainPending();
                    instrs.addAll(i, defs);
                    i += defs.size();
                } else {
                    set.processInstruction(instr, ctx);
                }
            }
            if (rewrite) {
                set.rewriteInstruction(block.getControl(), ctx);
                instrs.addAll(ctx.drainPending());
            } else {
                set.processInstruction(block.getControl(), ctx);
            }
            if (config.checkInvariants()) set.verifyConsistency();
            if (TRACE_SETS) {
                LOGGER.info("available at end of " + block.toTargetString() + ": " + set);
            } else if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("available at end of " + block.toTargetString() + ": " + set);
            }
            exitSets.put(block, set);

            for (BasicBlock succ : od.dagSuccs) {
                AvailableExpressionSet succSet = entrySets.get(succ);
                if (succSet == null) {
                    entrySets.put(succ, set.copy());
                } else {
                    succSet.intersect(set, anticipated);
                    if (config.checkInvariants()) succSet.verifyConsistency();
                }
            }
        }
    }

    @Override
    public String toString() {
        return "cse " + config;
    }
}
