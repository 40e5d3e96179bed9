/**
 * HEVC sample description boxes: {@code hvc1} sample entry, {@code hvcC} configuration record, and NAL unit arrays.
 * <p><strong>Role:</strong> Domain codecs; byte-exact encode and lenient decode of the records a media container
 * stores for an H.265 track.</p>
 * <p><strong>Concurrency:</strong> All values are immutable; encode/decode calls own their stream exclusively.</p>
 * <p><strong>Errors:</strong> Malformed bytes raise {@link ca.gc.cra.hvcbox.domain.box.MalformedBoxException};
 * stream failures propagate as {@link java.io.IOException}; invalid construction arguments raise
 * {@link IllegalArgumentException}.</p>
 */
package ca.gc.cra.hvcbox.domain.hevc;
