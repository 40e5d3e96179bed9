/**
 * Box framing shared by every codec: header primitive, encode/decode contracts, fixed-point values.
 * <p><strong>Role:</strong> Boundary towards an enclosing container walker, which dispatches on
 * {@link ca.gc.cra.hvcbox.domain.box.BoxHeader#type()} and decides what to do with failures.</p>
 * <p><strong>Invariants:</strong> Sizes are recomputed from field values on every call; decoders always finish at
 * declared start plus declared size.</p>
 */
package ca.gc.cra.hvcbox.domain.box;
