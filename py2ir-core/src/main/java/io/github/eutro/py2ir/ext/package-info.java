/**
 * Exts: typed, named metadata slots which can be attached to IR nodes.
 * <p>
 * An {@link io.github.eutro.py2ir.ext.Ext} is created once, usually as a constant in
 * {@link io.github.eutro.py2ir.ext.CommonExts}, and then values can be
 * {@link io.github.eutro.py2ir.ext.ExtContainer#attachExt(io.github.eutro.py2ir.ext.Ext, java.lang.Object) attached}
 * to any {@link io.github.eutro.py2ir.ext.ExtContainer}. Analysis passes such as
 * {@link io.github.eutro.py2ir.passes.meta.ComputeDoms} communicate their results this way.
 */
package io.github.eutro.py2ir.ext;
