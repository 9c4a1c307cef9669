package io.jplist.internal_api.binary;

import io.jplist.api.AbstractEventProducer;
import io.jplist.api.ErrorKind;
import io.jplist.api.PlistBoolean;
import io.jplist.api.PlistData;
import io.jplist.api.PlistDate;
import io.jplist.api.PlistDecodeException;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistInteger;
import io.jplist.api.PlistReal;
import io.jplist.api.PlistString;
import io.jplist.api.PlistUid;
import io.jplist.utils.CustomByteBuffer;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pull-based reader for {@code bplist00} data.
 *
 * <p>The header, trailer and offset table are validated on the first call to {@link #next()}.
 * Objects are then resolved lazily while walking the graph with an explicit stack, so deeply nested
 * input cannot exhaust the call stack. An object reached again through one of its own ancestors is
 * reported as {@code INVALID_OBJECT_REFERENCE}. Objects shared between siblings are fine and are
 * emitted once per reference.
 */
public final class BinaryPlistReader extends AbstractEventProducer {
  private static final Logger log = LoggerFactory.getLogger(BinaryPlistReader.class);

  private final CustomByteBuffer buffer;
  private final boolean allowExtendedIntegers;

  private Trailer trailer;
  private BinaryStream stream;
  private long[] offsets;
  private final Deque<Frame> stack = new ArrayDeque<>();
  private final IntOpenHashSet activeCollections = new IntOpenHashSet();
  private boolean rootEmitted;

  /** An open array or dictionary whose children are still being emitted. */
  private static final class Frame {
    final int index;
    final boolean dictionary;
    final long count;
    final long refsStart;
    long next;

    Frame(int index, boolean dictionary, long count, long refsStart) {
      this.index = index;
      this.dictionary = dictionary;
      this.count = count;
      this.refsStart = refsStart;
    }

    long childTotal() {
      return dictionary ? count * 2 : count;
    }
  }

  /**
   * @param buffer the complete input
   * @param allowExtendedIntegers accept integers outside [{@link Long#MIN_VALUE}, 2^64 - 1]
   */
  public BinaryPlistReader(CustomByteBuffer buffer, boolean allowExtendedIntegers) {
    this.buffer = buffer;
    this.allowExtendedIntegers = allowExtendedIntegers;
  }

  public BinaryPlistReader(byte[] bytes) {
    this(CustomByteBuffer.wrap(bytes), false);
  }

  /**
   * @return the trailer once the first event has been read, otherwise {@code null}
   */
  public Trailer trailer() {
    return trailer;
  }

  @Override
  protected PlistEvent produce() throws PlistDecodeException {
    if (trailer == null) {
      initialize();
    }
    if (!rootEmitted) {
      rootEmitted = true;
      return readObject(trailer.topObject(), false, -1);
    }
    Frame frame = stack.peek();
    if (frame == null) {
      return null;
    }
    if (frame.next == frame.childTotal()) {
      stack.pop();
      activeCollections.remove(frame.index);
      return PlistEvent.EndCollection.INSTANCE;
    }
    long refPos;
    boolean key = false;
    if (frame.dictionary) {
      long entry = frame.next / 2;
      key = frame.next % 2 == 0;
      refPos = frame.refsStart + (key ? entry : frame.count + entry) * trailer.refSize();
    } else {
      refPos = frame.refsStart + frame.next * trailer.refSize();
    }
    frame.next++;
    long ref = stream.readTableEntry(refPos, trailer.refSize());
    return readObject(ref, key, refPos);
  }

  private void initialize() throws PlistDecodeException {
    trailer = Trailer.read(buffer);
    log.debug("Binary plist trailer: {}", trailer);
    stream = new BinaryStream(buffer, trailer.offsetTableStart());

    int num = (int) trailer.numObjects();
    offsets = new long[num];
    int highest = -1;
    long tablePos = trailer.offsetTableStart();
    for (int i = 0; i < num; i++) {
      long offset = stream.readTableEntry(tablePos, trailer.offsetSize());
      if (offset < BinaryMarkers.HEADER_SIZE || offset >= trailer.offsetTableStart()) {
        throw PlistDecodeException.offsetOutOfBounds(i, offset);
      }
      offsets[i] = offset;
      if (highest < 0 || offset > offsets[highest]) {
        highest = i;
      }
      tablePos += trailer.offsetSize();
    }

    long end = objectEnd(offsets[highest]);
    if (end < trailer.offsetTableStart()) {
      throw PlistDecodeException.trailingData(
          (trailer.offsetTableStart() - end) + " byte(s) after the last object", end);
    }
  }

  /** Returns the position just past the object at {@code offset}. */
  private long objectEnd(long offset) throws PlistDecodeException {
    stream.position(offset);
    int marker = stream.readU8("object marker");
    int type = marker >>> 4;
    int info = marker & 0xF;
    long payload;
    switch (type) {
      case BinaryMarkers.TYPE_SIMPLE -> payload = 0;
      case BinaryMarkers.TYPE_INT, BinaryMarkers.TYPE_REAL -> payload = 1L << info;
      case BinaryMarkers.TYPE_DATE -> payload = 8;
      case BinaryMarkers.TYPE_UID -> payload = info + 1;
      case BinaryMarkers.TYPE_DATA, BinaryMarkers.TYPE_ASCII_STRING -> payload = readLength(info);
      case BinaryMarkers.TYPE_UTF16_STRING -> payload = scaled(readLength(info), 2);
      case BinaryMarkers.TYPE_ARRAY -> payload = scaled(readLength(info), trailer.refSize());
      case BinaryMarkers.TYPE_DICT -> payload = scaled(readLength(info), 2L * trailer.refSize());
      default -> throw unknownMarker(marker, offset);
    }
    stream.require(payload, "object at offset " + offset);
    return stream.position() + payload;
  }

  private long scaled(long count, long unit) throws PlistDecodeException {
    if (count > stream.remaining() / unit) {
      throw PlistDecodeException.truncated("object payload", stream.position());
    }
    return count * unit;
  }

  private PlistEvent readObject(long index, boolean key, long refPos)
      throws PlistDecodeException {
    if (index < 0 || index >= trailer.numObjects()) {
      throw PlistDecodeException.invalidReference(index, trailer.numObjects(), refPos);
    }
    int idx = (int) index;
    long offset = offsets[idx];
    stream.position(offset);
    int marker = stream.readU8("object marker");
    int type = marker >>> 4;
    int info = marker & 0xF;
    if (key && type != BinaryMarkers.TYPE_ASCII_STRING && type != BinaryMarkers.TYPE_UTF16_STRING) {
      throw PlistDecodeException.invalidData(
          String.format("Dictionary key (object %d) is not a string", idx), offset);
    }
    switch (type) {
      case BinaryMarkers.TYPE_SIMPLE:
        if (marker == BinaryMarkers.SIMPLE_TRUE) {
          return PlistBoolean.TRUE;
        } else if (marker == BinaryMarkers.SIMPLE_FALSE) {
          return PlistBoolean.FALSE;
        } else if (marker == BinaryMarkers.SIMPLE_NULL || marker == BinaryMarkers.SIMPLE_FILL) {
          throw PlistDecodeException.invalidData("Null and fill objects are not supported", offset);
        }
        throw unknownMarker(marker, offset);
      case BinaryMarkers.TYPE_INT:
        return readInteger(info, offset);
      case BinaryMarkers.TYPE_REAL:
        if (info == 2) {
          return PlistReal.of(stream.readFloat("real"));
        } else if (info == 3) {
          return PlistReal.of(stream.readDouble("real"));
        }
        throw PlistDecodeException.invalidData("Real of " + (1L << info) + " bytes", offset);
      case BinaryMarkers.TYPE_DATE:
        if (info != 3) {
          throw unknownMarker(marker, offset);
        }
        double seconds = stream.readDouble("date");
        if (!PlistDate.isValidSeconds(seconds)) {
          throw PlistDecodeException.invalidData("Date is out of range: " + seconds, offset);
        }
        return PlistDate.ofSeconds(seconds);
      case BinaryMarkers.TYPE_DATA:
        return PlistData.of(stream.readBytes(readLength(info), "data"));
      case BinaryMarkers.TYPE_ASCII_STRING:
        return readAscii(readLength(info), offset);
      case BinaryMarkers.TYPE_UTF16_STRING:
        return readUtf16(readLength(info), offset);
      case BinaryMarkers.TYPE_UID:
        if (info > 7) {
          throw PlistDecodeException.invalidData("Uid of " + (info + 1) + " bytes", offset);
        }
        return PlistUid.of(stream.readUnsigned(info + 1, "uid"));
      case BinaryMarkers.TYPE_ARRAY:
      case BinaryMarkers.TYPE_DICT:
        boolean dictionary = type == BinaryMarkers.TYPE_DICT;
        long count = readLength(info);
        scaled(count, dictionary ? 2L * trailer.refSize() : trailer.refSize());
        if (!activeCollections.add(idx)) {
          throw PlistDecodeException.cyclicReference(idx, refPos);
        }
        stack.push(new Frame(idx, dictionary, count, stream.position()));
        return dictionary
            ? new PlistEvent.StartDictionary(count)
            : new PlistEvent.StartArray(count);
      default:
        throw unknownMarker(marker, offset);
    }
  }

  /** Reads a collection, string or data length from the marker nibble or the following integer. */
  private long readLength(int info) throws PlistDecodeException {
    if (info != BinaryMarkers.EXTENDED_LENGTH) {
      return info;
    }
    long pos = stream.position();
    int intMarker = stream.readU8("length");
    if (intMarker >>> 4 != BinaryMarkers.TYPE_INT) {
      throw PlistDecodeException.invalidData(
          String.format("Length marker 0x%02x is not an integer", intMarker), pos);
    }
    int power = intMarker & 0xF;
    if (power > 3) {
      throw PlistDecodeException.unsupportedWidth("length", 1L << power, pos);
    }
    long length = stream.readUnsigned(1 << power, "length");
    if (length < 0) {
      throw PlistDecodeException.truncated("object payload", pos);
    }
    return length;
  }

  private PlistInteger readInteger(int power, long offset) throws PlistDecodeException {
    if (power >= 15) {
      throw PlistDecodeException.integerOverflow("Integer of 2^" + power + " bytes", offset);
    }
    int width = 1 << power;
    if (width < 8) {
      return PlistInteger.of(stream.readUnsigned(width, "integer"));
    }
    if (width == 8) {
      return PlistInteger.of(stream.readUnsigned(8, "integer"));
    }
    BigInteger value = new BigInteger(stream.readBytes(width, "integer"));
    if (value.bitLength() > 127) {
      throw PlistDecodeException.integerOverflow(
          "Integer " + value + " exceeds the 128-bit signed range", offset);
    }
    PlistInteger integer = PlistInteger.of(value);
    if (integer.isExtended() && !allowExtendedIntegers) {
      throw PlistDecodeException.integerOverflow(
          "Integer " + value + " is outside the 64-bit range; unstable features are disabled",
          offset);
    }
    return integer;
  }

  private PlistString readAscii(long length, long offset) throws PlistDecodeException {
    byte[] bytes = stream.readBytes(length, "ASCII string");
    for (byte b : bytes) {
      if (b < 0) {
        throw PlistDecodeException.invalidData("Non-ASCII byte in ASCII string", offset);
      }
    }
    return PlistString.of(new String(bytes, StandardCharsets.US_ASCII));
  }

  private PlistString readUtf16(long units, long offset) throws PlistDecodeException {
    long byteCount = scaled(units, 2);
    byte[] bytes = stream.readBytes(byteCount, "UTF-16 string");
    try {
      return PlistString.of(
          StandardCharsets.UTF_16BE
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString());
    } catch (CharacterCodingException e) {
      throw new PlistDecodeException(
          ErrorKind.INVALID_DATA, "Invalid UTF-16 string", offset, e);
    }
  }

  private static PlistDecodeException unknownMarker(int marker, long offset) {
    return PlistDecodeException.invalidData(
        String.format("Unknown object marker 0x%02x", marker), offset);
  }
}
