package io.binpack.serializer.reflection;

import io.binpack.serializer.SampleTypes.ArrayHolder;
import io.binpack.serializer.SampleTypes.Color;
import io.binpack.serializer.SampleTypes.Order;
import io.binpack.serializer.SampleTypes.Point;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class CollectionTraitsTest {

	@Test
	public void arrays() throws NoSuchFieldException {
		CollectionTraits traits = CollectionTraits.of(Point[].class);

		assertEquals(CollectionKind.ARRAY, traits.getKind());
		assertTrue(traits.isCollection());
		assertEquals(Point.class, traits.getElementType());
		assertEquals(int.class, CollectionTraits.of(ArrayHolder.class.getField("numbers").getType()).getElementType());
		assertThrows(IllegalStateException.class, traits::getSizeMethod);
	}

	@Test
	public void iterablesTakeElementTypeFromTypeArguments() {
		SerializingMember tags = SerializationTarget.prepare(Order.class).getMembers().get(1);
		SerializingMember colors = SerializationTarget.prepare(Order.class).getMembers().get(3);

		assertEquals(CollectionKind.ITERABLE, tags.getCollectionTraits().getKind());
		assertEquals(String.class, tags.getCollectionTraits().getElementType());
		assertEquals(Color.class, colors.getCollectionTraits().getElementType());
		assertEquals(Set.class, colors.getCollectionTraits().getCollectionType());
		assertEquals("size", tags.getCollectionTraits().getSizeMethod().getName());
		assertNull(tags.getCollectionTraits().getEntrySetMethod());

		assertEquals(Object.class, CollectionTraits.of(List.class).getElementType());
	}

	@Test
	public void mapsIterateOverEntries() {
		SerializingMember quantities = SerializationTarget.prepare(Order.class).getMembers().get(2);
		CollectionTraits traits = quantities.getCollectionTraits();

		assertEquals(CollectionKind.MAP, traits.getKind());
		assertEquals(String.class, traits.getKeyType());
		assertEquals(Integer.class, traits.getValueType());
		assertEquals(Map.Entry.class, traits.getElementType());
		assertNotNull(traits.getEntrySetMethod());
	}

	@Test
	public void otherTypesAreNotCollections() {
		assertEquals(CollectionKind.NOT_A_COLLECTION, CollectionTraits.of(String.class).getKind());
		assertFalse(CollectionTraits.of(Point.class).isCollection());
	}
}
