package io.jplist.internal_api.binary;

import io.jplist.api.EventConsumer;
import io.jplist.api.EventStructureValidator;
import io.jplist.api.PlistBoolean;
import io.jplist.api.PlistData;
import io.jplist.api.PlistDate;
import io.jplist.api.PlistEncodeException;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistException;
import io.jplist.api.PlistInteger;
import io.jplist.api.PlistReal;
import io.jplist.api.PlistScalar;
import io.jplist.api.PlistString;
import io.jplist.api.PlistUid;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event consumer producing {@code bplist00} output.
 *
 * <p>Events are collected into an object table first: every object gets its index the first time
 * it is seen, collections when they open, so the root is always object 0. Equal scalars share one
 * entry. On {@link #finish()} the table is serialized in index order, followed by the offset table
 * and the trailer. Nothing is written to the target before {@code finish()}.
 */
public final class BinaryPlistWriter implements EventConsumer {
  private static final Logger log = LoggerFactory.getLogger(BinaryPlistWriter.class);

  private final OutputStream target;
  private final boolean allowExtendedIntegers;
  private final EventStructureValidator validator = new EventStructureValidator();
  private final CharsetEncoder utf16 =
      StandardCharsets.UTF_16BE
          .newEncoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT);

  // either PlistScalar or Collection, indexed by object number
  private final List<Object> objects = new ArrayList<>();
  private final Object2IntOpenHashMap<PlistScalar> interned = new Object2IntOpenHashMap<>();
  private final Deque<Collection> open = new ArrayDeque<>();

  /** Byte count of everything written so far; offsets may pass 2 GiB. */
  private static final class CountingOutputStream extends FilterOutputStream {
    long count;

    CountingOutputStream(OutputStream out) {
      super(out);
    }

    @Override
    public void write(int b) throws IOException {
      out.write(b);
      count++;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
      count += len;
    }
  }

  private static final class Collection {
    final boolean dictionary;
    final IntArrayList keys;
    final IntArrayList values = new IntArrayList();

    Collection(boolean dictionary) {
      this.dictionary = dictionary;
      this.keys = dictionary ? new IntArrayList() : null;
    }

    void addChild(int ref) {
      // dictionary keys and values alternate, starting with a key
      if (dictionary && keys.size() == values.size()) {
        keys.add(ref);
      } else {
        values.add(ref);
      }
    }
  }

  /**
   * @param target receives the encoded bytes on {@link #finish()}; it is flushed but not closed
   * @param allowExtendedIntegers accept integers outside [{@link Long#MIN_VALUE}, 2^64 - 1]
   */
  public BinaryPlistWriter(OutputStream target, boolean allowExtendedIntegers) {
    this.target = target;
    this.allowExtendedIntegers = allowExtendedIntegers;
    interned.defaultReturnValue(-1);
  }

  public BinaryPlistWriter(OutputStream target) {
    this(target, false);
  }

  @Override
  public void onStartArray(long sizeHint) throws PlistException {
    startCollection(new PlistEvent.StartArray(sizeHint), false);
  }

  @Override
  public void onStartDictionary(long sizeHint) throws PlistException {
    startCollection(new PlistEvent.StartDictionary(sizeHint), true);
  }

  private void startCollection(PlistEvent event, boolean dictionary) throws PlistException {
    validator.onEvent(event);
    Collection collection = new Collection(dictionary);
    int index = objects.size();
    objects.add(collection);
    addToParent(index);
    open.push(collection);
  }

  @Override
  public void onEndCollection() throws PlistException {
    validator.onEvent(PlistEvent.EndCollection.INSTANCE);
    open.pop();
  }

  @Override
  public void onString(PlistString value) throws PlistException {
    if (!utf16.canEncode(value.value())) {
      throw PlistEncodeException.unsupported("binary", "String with an unpaired surrogate");
    }
    scalar(value);
  }

  @Override
  public void onBoolean(PlistBoolean value) throws PlistException {
    scalar(value);
  }

  @Override
  public void onReal(PlistReal value) throws PlistException {
    scalar(value);
  }

  @Override
  public void onInteger(PlistInteger value) throws PlistException {
    if (value.isExtended() && !allowExtendedIntegers) {
      throw PlistEncodeException.integerOverflow(value.value().toString());
    }
    scalar(value);
  }

  @Override
  public void onData(PlistData value) throws PlistException {
    scalar(value);
  }

  @Override
  public void onDate(PlistDate value) throws PlistException {
    scalar(value);
  }

  @Override
  public void onUid(PlistUid value) throws PlistException {
    scalar(value);
  }

  private void scalar(PlistScalar value) throws PlistException {
    validator.onEvent(value);
    int index = interned.getInt(value);
    if (index < 0) {
      index = objects.size();
      objects.add(value);
      interned.put(value, index);
    }
    addToParent(index);
  }

  private void addToParent(int index) {
    Collection parent = open.peek();
    if (parent != null) {
      parent.addChild(index);
    }
  }

  @Override
  public void finish() throws PlistException {
    validator.onFinish();
    try {
      write();
    } catch (IOException e) {
      throw PlistEncodeException.writeFailed("binary", e);
    }
  }

  private void write() throws IOException {
    int refSize = BinaryMarkers.widthFor(objects.size() - 1);
    CountingOutputStream counter = new CountingOutputStream(new BufferedOutputStream(target));
    DataOutputStream out = new DataOutputStream(counter);
    out.write(BinaryMarkers.MAGIC);

    long[] offsets = new long[objects.size()];
    for (int i = 0; i < objects.size(); i++) {
      offsets[i] = counter.count;
      Object object = objects.get(i);
      if (object instanceof Collection c) {
        writeCollection(out, c, refSize);
      } else {
        writeScalar(out, (PlistScalar) object);
      }
    }

    long offsetTableStart = counter.count;
    int offsetSize = BinaryMarkers.widthFor(offsetTableStart);
    for (long offset : offsets) {
      writeSized(out, offset, offsetSize);
    }
    new Trailer(offsetSize, refSize, objects.size(), 0, offsetTableStart).write(out);
    out.flush();
    log.debug(
        "Wrote binary plist: {} objects ({} interned scalars), ref size {}, offset size {}",
        objects.size(),
        interned.size(),
        refSize,
        offsetSize);
  }

  private static void writeCollection(DataOutputStream out, Collection c, int refSize)
      throws IOException {
    int type = c.dictionary ? BinaryMarkers.TYPE_DICT : BinaryMarkers.TYPE_ARRAY;
    writeHeader(out, type, c.values.size());
    if (c.dictionary) {
      for (int i = 0; i < c.keys.size(); i++) {
        writeSized(out, c.keys.getInt(i), refSize);
      }
    }
    for (int i = 0; i < c.values.size(); i++) {
      writeSized(out, c.values.getInt(i), refSize);
    }
  }

  private static void writeScalar(DataOutputStream out, PlistScalar scalar) throws IOException {
    switch (scalar.kind()) {
      case BOOLEAN -> out.writeByte(
          ((PlistBoolean) scalar).value() ? BinaryMarkers.SIMPLE_TRUE : BinaryMarkers.SIMPLE_FALSE);
      case INTEGER -> writeInteger(out, ((PlistInteger) scalar).value());
      case REAL -> {
        out.writeByte((BinaryMarkers.TYPE_REAL << 4) | 3);
        out.writeDouble(((PlistReal) scalar).value());
      }
      case DATE -> {
        out.writeByte((BinaryMarkers.TYPE_DATE << 4) | 3);
        out.writeDouble(((PlistDate) scalar).secondsSinceEpoch2001());
      }
      case DATA -> {
        byte[] bytes = ((PlistData) scalar).bytes();
        writeHeader(out, BinaryMarkers.TYPE_DATA, bytes.length);
        out.write(bytes);
      }
      case STRING -> writeString(out, ((PlistString) scalar).value());
      case UID -> {
        long value = ((PlistUid) scalar).value();
        int width = BinaryMarkers.widthFor(value);
        out.writeByte((BinaryMarkers.TYPE_UID << 4) | (width - 1));
        writeSized(out, value, width);
      }
      default -> throw new IllegalStateException("Not a scalar: " + scalar.kind());
    }
  }

  private static void writeString(DataOutputStream out, String value) throws IOException {
    boolean ascii = true;
    for (int i = 0; i < value.length() && ascii; i++) {
      ascii = value.charAt(i) < 0x80;
    }
    if (ascii) {
      writeHeader(out, BinaryMarkers.TYPE_ASCII_STRING, value.length());
      out.write(value.getBytes(StandardCharsets.US_ASCII));
    } else {
      // length counts UTF-16 code units
      writeHeader(out, BinaryMarkers.TYPE_UTF16_STRING, value.length());
      out.write(value.getBytes(StandardCharsets.UTF_16BE));
    }
  }

  private static void writeInteger(DataOutputStream out, BigInteger value) throws IOException {
    if (value.signum() >= 0 && value.bitLength() <= 32) {
      long v = value.longValue();
      int width = BinaryMarkers.widthFor(v);
      out.writeByte((BinaryMarkers.TYPE_INT << 4) | Integer.numberOfTrailingZeros(width));
      writeSized(out, v, width);
    } else if (value.bitLength() <= 63) {
      out.writeByte((BinaryMarkers.TYPE_INT << 4) | 3);
      out.writeLong(value.longValue());
    } else {
      // 16-byte two's complement; unsigned 64-bit values keep the upper half zero
      out.writeByte((BinaryMarkers.TYPE_INT << 4) | 4);
      byte[] raw = value.toByteArray();
      byte pad = (byte) (value.signum() < 0 ? 0xFF : 0x00);
      for (int i = raw.length; i < 16; i++) {
        out.writeByte(pad);
      }
      out.write(raw, Math.max(0, raw.length - 16), Math.min(16, raw.length));
    }
  }

  /** Writes a marker with the count in its low nibble, or followed by an integer object. */
  private static void writeHeader(DataOutputStream out, int type, int count) throws IOException {
    if (count < BinaryMarkers.EXTENDED_LENGTH) {
      out.writeByte((type << 4) | count);
    } else {
      out.writeByte((type << 4) | BinaryMarkers.EXTENDED_LENGTH);
      int width = BinaryMarkers.widthFor(count);
      out.writeByte((BinaryMarkers.TYPE_INT << 4) | Integer.numberOfTrailingZeros(width));
      writeSized(out, count, width);
    }
  }

  private static void writeSized(DataOutputStream out, long value, int width) throws IOException {
    for (int i = width - 1; i >= 0; i--) {
      out.writeByte((int) (value >>> (8 * i)));
    }
  }
}
