/**
 * The analyses behind {@link io.github.eutro.cfgopt.passes.opts.EliminateCommonSubexpressions}.
 * <p>
 * {@link io.github.eutro.cfgopt.cse.AvailableExpressionSet} holds the pure values available at a
 * program point as an identity graph, {@link io.github.eutro.cfgopt.cse.AnticipatedExpressions}
 * the values needed later on, and {@link io.github.eutro.cfgopt.cse.CommonSubexpressionTracker}
 * decides which values are shared through temporaries.
 */
package io.github.eutro.cfgopt.cse;
