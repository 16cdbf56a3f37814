package io.github.eutro.cfgopt.passes.meta;

import io.github.eutro.cfgopt.cfg.BasicBlock;
import io.github.eutro.cfgopt.cfg.ControlFlowGraph;
import io.github.eutro.cfgopt.ext.CommonExts;
import io.github.eutro.cfgopt.ext.MetadataState;
import io.github.eutro.cfgopt.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 */
public class ComputePreds implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);

        for (BasicBlock block : cfg.blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : cfg.blocks) {
            for (BasicBlock target : block.successors()) {
                List<BasicBlock> preds = target.getExtOrThrow(CommonExts.PREDS);
                if (!preds.contains(block)) preds.add(block);
            }
        }

        ms.validate(MetadataState.PREDS);
    }
}
