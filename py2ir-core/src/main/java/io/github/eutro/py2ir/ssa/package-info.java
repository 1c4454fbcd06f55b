/**
 * This package defines the intermediate representation (IR) produced by py2ir.
 * <p>
 * A {@link io.github.eutro.py2ir.ssa.Module} holds one {@link io.github.eutro.py2ir.ssa.Function procedure}
 * per code object of a Python module: the module body, and every function, lambda, comprehension
 * and class body hoisted out of it. Each procedure is a graph of
 * {@link io.github.eutro.py2ir.ssa.BasicBlock basic blocks}, whose effects are
 * {@link io.github.eutro.py2ir.ops.PyOps operations} over {@link io.github.eutro.py2ir.ssa.Value values}.
 * <p>
 * The IR is in static single assignment form (SSA): each {@link io.github.eutro.py2ir.ssa.Var}
 * is assigned exactly once, either by one {@link io.github.eutro.py2ir.ssa.Effect} in a block
 * dominating all of its uses, or as a parameter of a block. Values flowing between blocks are passed
 * as arguments of {@link io.github.eutro.py2ir.ssa.Jump jumps}, there are no phi instructions.
 * <p>
 * Python variables are not SSA values: they are accessed through explicit loads and stores
 * of {@link io.github.eutro.py2ir.scope.ScopedName scoped names}.
 */
package io.github.eutro.py2ir.ssa;
