package io.binpack.serializer;

import io.binpack.codegen.container.CodeContainerManager;
import io.binpack.codegen.container.EmitterFlavor;
import io.binpack.codegen.container.PlatformCapabilities;
import io.binpack.serializer.SampleTypes.*;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

import java.util.*;

import static org.junit.Assert.*;

@RunWith(Parameterized.class)
public class SerializerRoundTripTest {

	@Parameter()
	public String testName;

	@Parameter(1)
	public SerializerGenerator.Mode mode;

	@Parameter(2)
	public EmitterFlavor flavor;

	@Parameters(name = "{0}")
	public static Collection<Object[]> getParameters() {
		return List.of(
				new Object[]{"bytecode, field based", SerializerGenerator.Mode.BYTECODE, EmitterFlavor.FIELD_BASED},
				new Object[]{"bytecode, context based", SerializerGenerator.Mode.BYTECODE, EmitterFlavor.CONTEXT_BASED},
				new Object[]{"expression graph, field based", SerializerGenerator.Mode.EXPRESSION_GRAPH, EmitterFlavor.FIELD_BASED},
				new Object[]{"expression graph, context based", SerializerGenerator.Mode.EXPRESSION_GRAPH, EmitterFlavor.CONTEXT_BASED}
		);
	}

	private SerializerGenerator createGenerator() {
		return SerializerGenerator.builder()
				.withCodeContainerManager(CodeContainerManager.create(PlatformCapabilities.unrestricted()))
				.withMode(mode)
				.withFlavor(flavor)
				.build();
	}

	private SerializationContext createContext(SerializationMethod method) {
		return SerializationContext.builder()
				.withGenerator(createGenerator())
				.withSerializationMethod(method)
				.build();
	}

	private <T> T roundTrip(SerializationContext context, Class<T> type, T value) {
		PackSerializer<T> serializer = context.getSerializer(type);
		return serializer.unpack(serializer.pack(value));
	}

	@Test
	public void personRoundTrip() {
		SerializationContext context = createContext(SerializationMethod.ARRAY);
		Person person = new Person("John", 42);

		Person unpacked = roundTrip(context, Person.class, person);

		assertNotSame(person, unpacked);
		assertEquals(person, unpacked);
		assertNull(roundTrip(context, Person.class, null));
		assertEquals(new Person(null, 0), roundTrip(context, Person.class, new Person(null, 0)));
	}

	@Test
	public void personIsPackedAsArrayOfMembers() {
		SerializationContext context = createContext(SerializationMethod.ARRAY);

		Packer expected = new Packer();
		expected.writeArrayHeader(2);
		expected.writeString("John");
		expected.writeInt(42);

		assertArrayEquals(expected.toByteArray(), context.getSerializer(Person.class).pack(new Person("John", 42)));
	}

	@Test
	public void personIsPackedAsMapOfMembers() {
		SerializationContext context = createContext(SerializationMethod.MAP);

		Packer expected = new Packer();
		expected.writeMapHeader(2);
		expected.writeString("name");
		expected.writeString("John");
		expected.writeString("age");
		expected.writeInt(42);

		assertArrayEquals(expected.toByteArray(), context.getSerializer(Person.class).pack(new Person("John", 42)));
	}

	@Test
	public void arrayAndMapFormsAreInterchangeable() {
		SerializationContext arrayContext = createContext(SerializationMethod.ARRAY);
		SerializationContext mapContext = createContext(SerializationMethod.MAP);
		Order order = new Order("o-1", List.of("a", "b"), Map.of("apple", 3), Set.of(Color.RED),
				new Person("Ann", 30), Color.BLUE, 15L);

		byte[] asArray = arrayContext.getSerializer(Order.class).pack(order);
		byte[] asMap = mapContext.getSerializer(Order.class).pack(order);

		assertFalse(Arrays.equals(asArray, asMap));
		assertEquals(order, arrayContext.getSerializer(Order.class).unpack(asMap));
		assertEquals(order, mapContext.getSerializer(Order.class).unpack(asArray));
	}

	@Test
	public void packingIsDeterministic() {
		Order order = new Order("o-2", List.of("x"), new LinkedHashMap<>(Map.of("pear", 1)), Set.of(Color.GREEN),
				new Person("Bob", 25), Color.RED, null);

		byte[] first = createContext(SerializationMethod.MAP).getSerializer(Order.class).pack(order);
		byte[] second = createContext(SerializationMethod.MAP).getSerializer(Order.class).pack(order);

		assertArrayEquals(first, second);
	}

	@Test
	public void recordWithCollectionsAndNulls() {
		SerializationContext context = createContext(SerializationMethod.ARRAY);
		Map<String, Integer> quantities = new LinkedHashMap<>();
		quantities.put("apple", 3);
		quantities.put("plum", null);
		Order order = new Order("o-3", new ArrayList<>(Arrays.asList("first", null, "third")), quantities,
				EnumSet.of(Color.RED, Color.BLUE), null, null, null);

		assertEquals(order, roundTrip(context, Order.class, order));

		Order empty = new Order(null, null, null, null, null, null, null);
		assertEquals(empty, roundTrip(context, Order.class, empty));
	}

	@Test
	public void primitivesAndWrappers() {
		SerializationContext context = createContext(SerializationMethod.MAP);
		AllPrimitives value = new AllPrimitives();
		value.flag = true;
		value.b = -7;
		value.s = 1234;
		value.c = 'Z';
		value.i = Integer.MIN_VALUE;
		value.l = Long.MAX_VALUE;
		value.f = 1.5f;
		value.d = -0.25;
		value.boxed = 17;
		value.text = "ünïcödé";

		AllPrimitives unpacked = roundTrip(context, AllPrimitives.class, value);

		assertTrue(unpacked.flag);
		assertEquals(-7, unpacked.b);
		assertEquals(1234, unpacked.s);
		assertEquals('Z', unpacked.c);
		assertEquals(Integer.MIN_VALUE, unpacked.i);
		assertEquals(Long.MAX_VALUE, unpacked.l);
		assertEquals(1.5f, unpacked.f, 0.0f);
		assertEquals(-0.25, unpacked.d, 0.0);
		assertEquals(Integer.valueOf(17), unpacked.boxed);
		assertEquals("ünïcödé", unpacked.text);
	}

	@Test
	public void arraysOfPrimitivesAndObjects() {
		SerializationContext context = createContext(SerializationMethod.ARRAY);
		ArrayHolder value = new ArrayHolder();
		value.numbers = new int[]{3, 1, 2};
		value.words = new String[]{"a", null};
		value.points = new Point[]{new Point(1, 2), null};
		value.path = List.of(new Point(0, 0), new Point(5, 5));

		ArrayHolder unpacked = roundTrip(context, ArrayHolder.class, value);

		assertArrayEquals(value.numbers, unpacked.numbers);
		assertArrayEquals(value.words, unpacked.words);
		assertArrayEquals(value.points, unpacked.points);
		assertEquals(value.path, unpacked.path);

		ArrayHolder empty = roundTrip(context, ArrayHolder.class, new ArrayHolder());
		assertNull(empty.numbers);
		assertNull(empty.path);
	}

	@Test
	public void propertiesAreSerializedThroughGettersAndSetters() {
		SerializationContext context = createContext(SerializationMethod.MAP);
		Account account = new Account();
		account.setId(77);
		account.setOwner("Carol");
		account.setActive(true);

		Account unpacked = roundTrip(context, Account.class, account);

		assertEquals(77, unpacked.getId());
		assertEquals("Carol", unpacked.getOwner());
		assertTrue(unpacked.isActive());

		GeneratedObjectSerializer<Account> serializer = (GeneratedObjectSerializer<Account>) context.getSerializer(Account.class);
		assertEquals(List.of("active", "id", "owner"), serializer.getMemberNames());
	}

	@Test
	public void enumByName() {
		SerializationContext context = createContext(SerializationMethod.ARRAY);
		PackSerializer<Color> serializer = context.getSerializer(Color.class);

		Packer expected = new Packer();
		expected.writeString("GREEN");

		assertArrayEquals(expected.toByteArray(), serializer.pack(Color.GREEN));
		for (Color color : Color.values()) {
			assertEquals(color, serializer.unpack(serializer.pack(color)));
		}
		assertNull(serializer.unpack(serializer.pack(null)));
	}

	@Test
	public void enumByUnderlyingValue() {
		SerializationContext context = SerializationContext.builder()
				.withGenerator(createGenerator())
				.withEnumSerializationMethod(Color.class, EnumSerializationMethod.BY_UNDERLYING_VALUE)
				.build();
		PackSerializer<Color> serializer = context.getSerializer(Color.class);

		Packer expected = new Packer();
		expected.writeInt(2);

		assertArrayEquals(expected.toByteArray(), serializer.pack(Color.BLUE));
		for (Color color : Color.values()) {
			assertEquals(color, serializer.unpack(serializer.pack(color)));
		}

		Packer byName = new Packer();
		byName.writeString("RED");
		assertEquals(Color.RED, serializer.unpack(byName.toByteArray()));
	}

	@Test
	public void selfPackingMembers() {
		SerializationContext context = createContext(SerializationMethod.MAP);
		Release release = new Release();
		release.name = "stable";
		release.version = new Version();
		release.version.major = 2;
		release.version.minor = 7;

		Release unpacked = roundTrip(context, Release.class, release);

		assertEquals("stable", unpacked.name);
		assertEquals(2, unpacked.version.major);
		assertEquals(7, unpacked.version.minor);

		Packer expected = new Packer();
		expected.writeString("2.7");
		assertArrayEquals(expected.toByteArray(), context.getSerializer(Version.class).pack(release.version));
	}

	@Test
	public void unknownMembersAreSkipped() {
		SerializationContext context = createContext(SerializationMethod.ARRAY);

		Packer map = new Packer();
		map.writeMapHeader(3);
		map.writeString("nickname");
		map.writeArrayHeader(2);
		map.writeString("J");
		map.writeMapHeader(0);
		map.writeString("age");
		map.writeInt(31);
		map.writeString("name");
		map.writeString("Jane");
		assertEquals(new Person("Jane", 31), context.getSerializer(Person.class).unpack(map.toByteArray()));

		Packer array = new Packer();
		array.writeArrayHeader(4);
		array.writeString("Jane");
		array.writeInt(31);
		array.writeDouble(1.0);
		array.writeNil();
		assertEquals(new Person("Jane", 31), context.getSerializer(Person.class).unpack(array.toByteArray()));
	}

	@Test
	public void corruptedDataIsRejected() {
		SerializationContext context = createContext(SerializationMethod.ARRAY);
		PackSerializer<Person> serializer = context.getSerializer(Person.class);
		byte[] bytes = serializer.pack(new Person("John", 42));

		byte[] trailing = Arrays.copyOf(bytes, bytes.length + 1);
		trailing[bytes.length] = (byte) 0xC0;
		assertThrows(CorruptedDataException.class, () -> serializer.unpack(trailing));

		byte[] truncated = Arrays.copyOf(bytes, bytes.length - 1);
		assertThrows(CorruptedDataException.class, () -> serializer.unpack(truncated));

		Packer wrongType = new Packer();
		wrongType.writeArrayHeader(2);
		wrongType.writeInt(1);
		wrongType.writeInt(2);
		assertThrows(CorruptedDataException.class, () -> serializer.unpack(wrongType.toByteArray()));

		Packer unknownConstant = new Packer();
		unknownConstant.writeString("PURPLE");
		assertThrows(CorruptedDataException.class, () -> context.getSerializer(Color.class).unpack(unknownConstant.toByteArray()));

		Packer unknownOrdinal = new Packer();
		unknownOrdinal.writeInt(7);
		assertThrows(CorruptedDataException.class, () -> context.getSerializer(Color.class).unpack(unknownOrdinal.toByteArray()));
	}

	@Test
	public void serializersAreCachedPerContext() {
		SerializationContext context = createContext(SerializationMethod.ARRAY);

		assertSame(context.getSerializer(Person.class), context.getSerializer(Person.class));
		assertSame(context, context.getSerializer(Person.class).getSerializationContext());
		assertEquals(Person.class, context.getSerializer(Person.class).getTargetType());
	}
}
