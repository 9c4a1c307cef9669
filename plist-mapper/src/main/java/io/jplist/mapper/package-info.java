/**
 * Structured-data bridge: maps records, classes, collections and scalars to and from the
 * property-list event stream without building a value tree.
 *
 * <p>Records become dictionaries keyed by component name, classes by field name; {@link
 * io.jplist.mapper.PlistKey} renames an entry and {@link io.jplist.mapper.PlistIgnore} leaves it
 * out. Dates, data and uids keep their kind through {@code Instant}, {@code byte[]} and the
 * {@link io.jplist.api.PlistDate}, {@link io.jplist.api.PlistData} and {@link
 * io.jplist.api.PlistUid} types.
 *
 * <p>Failures carry the path of the offending field, e.g. {@code items[2].count}. See {@link
 * io.jplist.mapper.PlistMappingException#getPath()}.
 */
package io.jplist.mapper;
