package io.binpack.serializer.reflection;

import io.binpack.serializer.SampleTypes.*;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static java.util.stream.Collectors.toList;
import static org.junit.Assert.*;

public class SerializationTargetTest {

	public static class WithoutDefaultConstructor {
		public int value;

		public WithoutDefaultConstructor(int value) {
			this.value = value;
		}
	}

	public abstract static class Abstract {
		public int value;
	}

	public class Inner {
		public int value;
	}

	public static class WithIgnoredFields {
		public static int counter;
		public final int constant = 1;
		public transient int cache;
		public int value;
	}

	public static class ReadOnlyProperty {
		public int getValue() {
			return 0;
		}
	}

	static class NotPublic {
		public int value;
	}

	@Test
	public void recordComponentsAreMembers() {
		SerializationTarget target = SerializationTarget.prepare(Order.class);

		assertEquals(SerializationTarget.Kind.RECORD, target.getKind());
		assertTrue(target.isRecord());
		assertEquals(List.of("id", "tags", "quantities", "colors", "customer", "color", "discount"), names(target));
		assertEquals(7, target.getConstructor().getParameterCount());
		assertNull(target.getMembers().get(0).getField());
		assertNotNull(target.getMembers().get(0).getGetter());
	}

	@Test
	public void publicFieldsAreMembers() {
		SerializationTarget target = SerializationTarget.prepare(WithIgnoredFields.class);

		assertEquals(SerializationTarget.Kind.FIELDS, target.getKind());
		assertEquals(List.of("value"), names(target));
		assertFalse(target.isTuple());
	}

	@Test
	public void getterAndSetterPairsAreMembers() {
		SerializationTarget target = SerializationTarget.prepare(Account.class);

		assertEquals(SerializationTarget.Kind.PROPERTIES, target.getKind());
		assertEquals(List.of("active", "id", "owner"), names(target));
		SerializingMember id = target.getMembers().get(1);
		assertEquals(long.class, id.getType());
		assertEquals(1, id.getIndex());
		assertNotNull(id.getSetter());

		assertTrue(SerializationTarget.prepare(ReadOnlyProperty.class).getMembers().isEmpty());
	}

	@Test
	public void selfPackingTypesAreRecognized() {
		SerializationTarget target = SerializationTarget.prepare(Version.class);

		assertTrue(target.isPackable());
		assertTrue(target.isUnpackable());
		assertFalse(SerializationTarget.prepare(Person.class).isPackable());
	}

	@Test
	public void tuplesHaveNoMemberNames() {
		SerializationTarget target = SerializationTarget.forTuple(Point.class);

		assertTrue(target.isTuple());
		assertEquals(2, target.getMembers().size());
		for (SerializingMember member : target.getMembers()) {
			assertNull(member.getName());
		}
		assertEquals(int.class, target.getMembers().get(1).getType());
	}

	@Test
	public void unsupportedTypesAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> SerializationTarget.prepare(WithoutDefaultConstructor.class));
		assertThrows(IllegalArgumentException.class, () -> SerializationTarget.prepare(Abstract.class));
		assertThrows(IllegalArgumentException.class, () -> SerializationTarget.prepare(Inner.class));
		assertThrows(IllegalArgumentException.class, () -> SerializationTarget.prepare(NotPublic.class));
		assertThrows(IllegalArgumentException.class, () -> SerializationTarget.prepare(Map.class));
		assertThrows(IllegalArgumentException.class, () -> SerializationTarget.prepare(new Object() {}.getClass()));
	}

	private static List<String> names(SerializationTarget target) {
		return target.getMembers().stream().map(SerializingMember::getName).collect(toList());
	}
}
