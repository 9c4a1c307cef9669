/**
 * Public API for reading and writing property lists.
 *
 * <p><b>Layers</b>
 *
 * <ul>
 *   <li><b>Values</b>: {@link io.jplist.api.PlistValue} is a closed tree of arrays, dictionaries
 *       and scalars. Switch on {@link io.jplist.api.PlistValue#kind()}.
 *   <li><b>Events</b>: every format reads into an {@link io.jplist.api.EventProducer} and writes
 *       from an {@link io.jplist.api.EventConsumer}. {@link io.jplist.api.Events#pipe} connects
 *       the two, so converting between formats never builds a tree.
 *   <li><b>Formats</b>: binary ({@code bplist00}), XML and read-only ASCII, held by a {@link
 *       io.jplist.api.FormatRegistry}.
 * </ul>
 *
 * <p><b>Errors</b>
 *
 * <p>All failures are checked {@link io.jplist.api.PlistException}s carrying an {@link
 * io.jplist.api.ErrorKind}. The first error ends the operation; no partial value is returned.
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * PlistContext ctx = PlistContext.create();
 * PlistValue value = ctx.decode(Path.of("Info.plist"));
 * byte[] binary = ctx.encodeBinary(value);
 *
 * // stream XML straight to binary
 * Events.pipe(
 *     ctx.newReader(xmlStream, "xml"),
 *     ctx.newWriter("binary", out));
 * }</pre>
 */
package io.jplist.api;
