/**
 * Optimisation passes.
 */
package io.github.eutro.cfgopt.passes.opts;
