/**
 * The intermediate representation the optimisation passes work on.
 * <p>
 * A {@link io.github.eutro.cfgopt.cfg.ControlFlowGraph} holds the blocks of one function.
 * Each {@link io.github.eutro.cfgopt.cfg.BasicBlock} holds a list of
 * {@link io.github.eutro.cfgopt.cfg.Instr instructions} and ends in a
 * {@link io.github.eutro.cfgopt.cfg.Control}. Instructions evaluate
 * {@link io.github.eutro.cfgopt.cfg.Expression expressions}, which read variables by slot.
 * Variables are not in SSA form and may be assigned any number of times.
 */
package io.github.eutro.cfgopt.cfg;
