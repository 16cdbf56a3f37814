/**
 * Typed side data for IR objects.
 * <p>
 * An {@link io.github.eutro.cfgopt.ext.Ext} is a key, and an
 * {@link io.github.eutro.cfgopt.ext.ExtContainer} maps keys to values:
 *
 * <pre>{@code
 * block.attachExt(CommonExts.PREDS, preds);
 * List<BasicBlock> preds = block.getExtOrThrow(CommonExts.PREDS);
 * }</pre>
 * <p>
 * Analyses use this to hang their results off the blocks and graphs they describe,
 * instead of threading maps keyed by block through every pass. Which analysis results
 * are currently valid for a graph is tracked by its
 * {@link io.github.eutro.cfgopt.ext.MetadataState}.
 * <p>
 * Containers may keep hot exts in dedicated fields.
 */
package io.github.eutro.cfgopt.ext;
