/**
 * The ext API associates arbitrary typed data with instances of
 * {@link io.github.eutro.ssabuilder.ext.ExtContainer}.
 *
 * <pre>{@code
 * public static final Ext<Integer> SOURCE_LINE = Ext.create(Integer.class, "sourceLine");
 *
 * Operation op = ib.op("add", lhs, rhs);
 * op.attachExt(SOURCE_LINE, 12);
 * op.getExtOrThrow(SOURCE_LINE); // => 12
 * }</pre>
 * <p>
 * Front ends use this to carry types, source positions or scratch data on values and
 * blocks without the SSA construction core knowing about them.
 * <p>
 * Some containers keep frequently used exts in fields; see
 * {@link io.github.eutro.ssabuilder.ext.CommonExts}.
 */
package io.github.eutro.ssabuilder.ext;
