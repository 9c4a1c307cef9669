package io.jplist.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.jplist.api.Events;
import io.jplist.api.Plist;
import io.jplist.api.PlistArray;
import io.jplist.api.PlistContext;
import io.jplist.api.PlistData;
import io.jplist.api.PlistDate;
import io.jplist.api.PlistDictionary;
import io.jplist.api.PlistEvent;
import io.jplist.api.PlistInteger;
import io.jplist.api.PlistString;
import io.jplist.api.PlistUid;
import io.jplist.api.PlistValue;
import java.io.ByteArrayOutputStream;
import java.lang.reflect.Type;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

public class PlistMapperTest {
  private static final PlistEvent END = PlistEvent.EndCollection.INSTANCE;

  record Item(String name, int count) {}

  record Note(String title, String body, Optional<String> tag) {}

  enum Status {
    ACTIVE,
    RETIRED {
      @Override
      public String toString() {
        return "gone";
      }
    }
  }

  record Order(
      String id,
      List<Item> items,
      Map<String, Long> totals,
      Optional<String> note,
      Status status,
      Set<String> tags,
      double ratio) {}

  record Numbers(
      byte b, short s, long l, BigInteger big, float f, char c, Boolean flag, int[] codes) {}

  record Archive(
      Instant created,
      byte[] payload,
      PlistDate modified,
      PlistData raw,
      PlistUid owner,
      PlistValue extra) {}

  record Renamed(@PlistKey("CFBundleName") String name, @PlistIgnore String secret, int version) {}

  record Node(String name, List<Node> children) {}

  record Measure(double value) {}

  record Sorted(SortedMap<String, String> entries) {}

  static class Base {
    String id;
  }

  static class Settings extends Base {
    static String shared = "shared";

    String mode = "fast";
    List<String> hosts;
    transient String cache = "cached";

    @PlistKey("max-retries")
    int retries;

    @PlistIgnore String local;
  }

  static List<Item> itemList;

  private final PlistMapper mapper = new PlistMapper();

  private List<PlistEvent> eventsOf(Object value) throws Exception {
    EventRecorder recorder = new EventRecorder();
    mapper.toEvents(value, recorder);
    assertTrue(recorder.finished);
    return recorder.events;
  }

  @Test
  void writesRecordComponentsInDeclarationOrder() throws Exception {
    assertEquals(
        List.of(
            new PlistEvent.StartDictionary(2),
            PlistString.of("name"),
            PlistString.of("apple"),
            PlistString.of("count"),
            PlistInteger.of(3),
            END),
        eventsOf(new Item("apple", 3)));
  }

  @Test
  void omitsNullFieldsAndEmptyOptionals() throws Exception {
    Note note = new Note("t", null, Optional.empty());

    assertEquals(
        List.of(
            new PlistEvent.StartDictionary(1), PlistString.of("title"), PlistString.of("t"), END),
        eventsOf(note));
    assertEquals(
        note, mapper.fromValue(PlistDictionary.of("title", PlistString.of("t")), Note.class));
  }

  @Test
  void roundTripsThroughBinary() throws Exception {
    Order order =
        new Order(
            "o-1",
            List.of(new Item("apple", 3), new Item("pear", 0)),
            Map.of("net", 120L),
            Optional.of("leave at door"),
            Status.ACTIVE,
            Set.of("fresh"),
            0.25);

    Order decoded = mapper.readValue(mapper.writeBinary(order), Order.class);

    assertEquals(order, decoded);
  }

  @Test
  void roundTripsThroughXml() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    mapper.writeXml(new Item("a & b", -7), out);

    String xml = out.toString(StandardCharsets.UTF_8);
    assertThat(xml).contains("<key>name</key>").contains("<string>a &amp; b</string>");
    assertEquals(new Item("a & b", -7), mapper.readValue(out.toByteArray(), Item.class));
  }

  @Test
  void mapsScalarsToTheirNearestKind() throws Exception {
    Numbers numbers =
        new Numbers(
            (byte) -1,
            (short) 300,
            Long.MIN_VALUE,
            BigInteger.ONE.shiftLeft(63),
            1.5f,
            'x',
            Boolean.TRUE,
            new int[] {1, 2, 3});

    PlistDictionary dict = (PlistDictionary) mapper.toValue(numbers);
    assertEquals(PlistInteger.of(-1), dict.get("b"));
    assertEquals(PlistInteger.ofUnsigned(Long.MIN_VALUE), dict.get("big"));
    assertEquals(PlistValue.Kind.REAL, dict.get("f").kind());
    assertEquals(PlistString.of("x"), dict.get("c"));
    assertEquals(
        PlistArray.of(PlistInteger.of(1), PlistInteger.of(2), PlistInteger.of(3)),
        dict.get("codes"));

    Numbers decoded = mapper.readValue(mapper.writeBinary(numbers), Numbers.class);
    assertEquals(numbers.b(), decoded.b());
    assertEquals(numbers.s(), decoded.s());
    assertEquals(numbers.l(), decoded.l());
    assertEquals(numbers.big(), decoded.big());
    assertEquals(numbers.f(), decoded.f());
    assertEquals(numbers.c(), decoded.c());
    assertEquals(numbers.flag(), decoded.flag());
    assertArrayEquals(numbers.codes(), decoded.codes());
  }

  @Test
  void keepsDateDataAndUidKinds() throws Exception {
    Instant created = Instant.parse("2011-03-24T18:30:00Z");
    Archive archive =
        new Archive(
            created,
            new byte[] {0, 1, 2},
            PlistDate.of(created.plusSeconds(60)),
            PlistData.of(new byte[] {9}),
            PlistUid.of(17),
            PlistArray.of(PlistString.of("any"), PlistUid.of(1)));

    PlistDictionary dict = (PlistDictionary) mapper.toValue(archive);
    assertEquals(PlistValue.Kind.DATE, dict.get("created").kind());
    assertEquals(PlistValue.Kind.DATA, dict.get("payload").kind());
    assertEquals(PlistValue.Kind.DATE, dict.get("modified").kind());
    assertEquals(PlistValue.Kind.DATA, dict.get("raw").kind());
    assertEquals(PlistValue.Kind.UID, dict.get("owner").kind());

    Archive decoded = mapper.readValue(mapper.writeBinary(archive), Archive.class);
    assertEquals(created, decoded.created());
    assertArrayEquals(archive.payload(), decoded.payload());
    assertEquals(archive.modified(), decoded.modified());
    assertEquals(archive.raw(), decoded.raw());
    assertEquals(archive.owner(), decoded.owner());
    assertEquals(archive.extra(), decoded.extra());
  }

  @Test
  void honoursRenamedAndIgnoredComponents() throws Exception {
    assertEquals(
        List.of(
            new PlistEvent.StartDictionary(2),
            PlistString.of("CFBundleName"),
            PlistString.of("Sample"),
            PlistString.of("version"),
            PlistInteger.of(4),
            END),
        eventsOf(new Renamed("Sample", "hidden", 4)));

    PlistDictionary input =
        PlistDictionary.builder()
            .put("CFBundleName", "Sample")
            .put("secret", "ignored")
            .put("version", 4)
            .build();
    assertEquals(new Renamed("Sample", null, 4), mapper.fromValue(input, Renamed.class));
  }

  @Test
  void skipsUnknownKeysWithTheirSubtrees() throws Exception {
    List<PlistEvent> events =
        List.of(
            PlistEvent.StartDictionary.UNKNOWN,
            PlistString.of("name"),
            PlistString.of("apple"),
            PlistString.of("extra"),
            PlistEvent.StartDictionary.UNKNOWN,
            PlistString.of("nested"),
            new PlistEvent.StartArray(2),
            PlistInteger.of(1),
            PlistEvent.StartDictionary.UNKNOWN,
            END,
            END,
            END,
            PlistString.of("count"),
            PlistInteger.of(2),
            END);

    assertEquals(new Item("apple", 2), mapper.fromEvents(Events.fromList(events), Item.class));
  }

  @Test
  void readsAndWritesPlainClasses() throws Exception {
    Settings settings = new Settings();
    settings.id = "s-1";
    settings.hosts = List.of("a", "b");
    settings.retries = 5;
    settings.local = "not written";

    PlistDictionary dict = (PlistDictionary) mapper.toValue(settings);
    // superclass fields first, then declaration order
    assertEquals(List.of("id", "mode", "hosts", "max-retries"), List.copyOf(dict.keys()));

    PlistDictionary input =
        PlistDictionary.builder()
            .put("id", "s-2")
            .put("hosts", PlistArray.of(PlistString.of("c")))
            .put("max-retries", 1)
            .build();
    Settings decoded = mapper.fromValue(input, Settings.class);
    assertEquals("s-2", decoded.id);
    assertEquals("fast", decoded.mode);
    assertEquals(List.of("c"), decoded.hosts);
    assertEquals(1, decoded.retries);
    assertEquals("cached", decoded.cache);
    assertNull(decoded.local);
  }

  @Test
  void mapsRecursiveTypes() throws Exception {
    Node tree =
        new Node(
            "root",
            List.of(
                new Node("a", List.of()),
                new Node("b", List.of(new Node("c", List.of())))));

    assertEquals(tree, mapper.readValue(mapper.writeBinary(tree), Node.class));
  }

  @Test
  void readsGenericRootTypes() throws Exception {
    Type type = PlistMapperTest.class.getDeclaredField("itemList").getGenericType();
    PlistValue value =
        PlistArray.of(
            PlistDictionary.builder().put("name", "a").put("count", 1).build(),
            PlistDictionary.builder().put("name", "b").put("count", 2).build());

    Object items = mapper.fromEvents(Plist.toEvents(value), type);

    assertEquals(List.of(new Item("a", 1), new Item("b", 2)), items);
    assertThat(items).isInstanceOf(ArrayList.class);
  }

  @Test
  void writesUntypedContainersByRuntimeClass() throws Exception {
    Map<String, Object> map = new TreeMap<>();
    map.put("item", new Item("x", 1));
    map.put("list", List.of("a", 2L));
    map.put("missing", null);

    PlistValue expected =
        PlistDictionary.builder()
            .put("item", PlistDictionary.builder().put("name", "x").put("count", 1).build())
            .put("list", PlistArray.of(PlistString.of("a"), PlistInteger.of(2)))
            .build();
    assertEquals(expected, mapper.toValue(map));
  }

  @Test
  void enumsAreWrittenByConstantName() throws Exception {
    assertEquals(PlistString.of("RETIRED"), mapper.toValue(Status.RETIRED));
    assertEquals(Status.RETIRED, mapper.fromValue(PlistString.of("RETIRED"), Status.class));
  }

  @Test
  void integersWidenToReals() throws Exception {
    PlistDictionary input = PlistDictionary.of("value", PlistInteger.of(2));

    assertEquals(new Measure(2.0), mapper.fromValue(input, Measure.class));
  }

  @Test
  void sortedMapsKeepKeyOrder() throws Exception {
    PlistDictionary input = PlistDictionary.builder().put("b", "2").put("a", "1").build();

    Sorted sorted = mapper.fromValue(PlistDictionary.of("entries", input), Sorted.class);

    assertThat(sorted.entries()).isInstanceOf(TreeMap.class);
    assertEquals(List.of("a", "b"), List.copyOf(sorted.entries().keySet()));
  }

  @Test
  void unstableFeaturesAllowWideIntegers() throws Exception {
    PlistMapper wide = new PlistMapper(PlistContext.builder().unstableFeatures(true).build());
    BigInteger big = BigInteger.ONE.shiftLeft(100).negate();

    assertEquals(big, wide.readValue(wide.writeBinary(big), BigInteger.class));
  }
}
