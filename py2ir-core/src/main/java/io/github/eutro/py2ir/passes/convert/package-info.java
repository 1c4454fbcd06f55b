/**
 * Passes that convert code objects into the IR.
 * <p>
 * {@link io.github.eutro.py2ir.passes.convert.PyToIr} is the entry point. Each procedure is
 * partitioned into blocks by {@link io.github.eutro.py2ir.passes.convert.CfgBuilder}, then
 * its operand stack is simulated symbolically, so that every stack entry becomes either an SSA
 * value or, where control flow merges, a block parameter.
 */
package io.github.eutro.py2ir.passes.convert;
