package io.binpack.serializer.reflection;

import io.binpack.serializer.Delegate2;
import io.binpack.serializer.PackOperation;
import io.binpack.serializer.Packer;
import io.binpack.serializer.SerializationContext;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.Assert.*;

public class MethodDefinitionTest {

	@Test
	public void resolvesByExactParameterTypes() {
		MethodDefinition writeInt = MethodDefinition.resolve(Packer.class, "writeInt", int.class);

		assertEquals("writeInt", writeInt.getName());
		assertEquals(Packer.class, writeInt.getDeclaringType());
		assertEquals(void.class, writeInt.getReturnType());
		assertEquals(List.of(int.class), writeInt.getParameterTypes());
		assertFalse(writeInt.isStatic());
		assertFalse(writeInt.isHelper());

		assertThrows(UnresolvedMemberException.class, () -> MethodDefinition.resolve(Packer.class, "writeInt", long.class));
	}

	@Test
	public void resolvesByName() {
		assertEquals(List.of(), MethodDefinition.resolve(Packer.class, "writeNil").getParameterTypes());
		assertTrue(MethodDefinition.resolve(List.class, "copyOf").isStatic());

		assertThrows(UnresolvedMemberException.class, () -> MethodDefinition.resolve(Packer.class, "writeChar"));
		assertThrows(AmbiguousMemberException.class, () -> MethodDefinition.resolve(List.class, "of"));
	}

	@Test
	public void resolvesIndexedSetters() {
		MethodDefinition put = MethodDefinition.resolveIndexed(Map.class, "put", String.class, Integer.class);

		assertEquals(List.of(Object.class, Object.class), put.getParameterTypes());
		assertThrows(UnresolvedMemberException.class, () -> MethodDefinition.resolveIndexed(Map.class, "put", int.class, Object.class));
		assertThrows(UnresolvedMemberException.class, () -> MethodDefinition.resolveIndexed(Map.class, "get", Object.class, Object.class));
	}

	@Test
	public void helpersDropTheSerializerParameter() {
		MethodDefinition helper = MethodDefinition.helper("packMember0", PackOperation.class);

		assertTrue(helper.isHelper());
		assertEquals("packMember0", helper.getName());
		assertEquals(PackOperation.class, helper.getDelegateType());
		assertEquals(void.class, helper.getReturnType());
		assertEquals(List.of(SerializationContext.class, Packer.class, Object.class), helper.getParameterTypes());

		assertEquals(2, MethodDefinition.helper("pack", Delegate2.class).getParameterTypes().size());
	}

	@Test
	public void findsSingleAbstractMethod() {
		assertEquals("apply", MethodDefinition.findAbstractMethod(Function.class).getName());
		assertThrows(IllegalArgumentException.class, () -> MethodDefinition.findAbstractMethod(List.class));
		assertThrows(IllegalArgumentException.class, () -> MethodDefinition.findAbstractMethod(Object.class));
	}
}
