/**
 * The intermediate representation, and its construction in static single assignment form (SSA).
 * <p>
 * {@link io.github.eutro.ssabuilder.ssa.Value Values} are what operands refer to:
 * {@link io.github.eutro.ssabuilder.ssa.Operation operations},
 * {@link io.github.eutro.ssabuilder.ssa.Phi phis}, and
 * {@link io.github.eutro.ssabuilder.ssa.Undef undefined values}.
 * {@link io.github.eutro.ssabuilder.ssa.Variable Variables} are source-level names, and never operands;
 * each {@link io.github.eutro.ssabuilder.ssa.Block block} maps them to values.
 * <p>
 * Construction is driven by an {@link io.github.eutro.ssabuilder.ssa.SSABuilder}, while
 * the front end is still discovering the control flow graph:
 *
 * <pre>{@code
 * SSABuilder ssa = new SSABuilder();
 * IRBuilder ib = new IRBuilder(ssa);
 * ib.seal();
 * ib.assign("i", ib.op("const0"));
 *
 * Block header = ib.newBlock();
 * ib.jump(header);
 * ib.setBlock(header);              // header stays unsealed: the back edge is not known yet
 * Value i = ib.use("i");            // a pending phi
 * ib.assign("i", ib.op("inc", i));
 * ib.jump(header);
 * ib.seal();                        // completes the phi: phi(const0, inc)
 *
 * Function func = ssa.finish();
 * }</pre>
 * <p>
 * Phis that turn out to merge only one value are replaced by that value as soon as
 * they are complete, and every operation or block that referred to them is rewritten.
 * Values are compared by identity.
 */
package io.github.eutro.ssabuilder.ssa;
