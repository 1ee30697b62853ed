package io.binpack.codegen.container;

import org.junit.Test;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

import static io.binpack.codegen.expression.Expressions.value;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.junit.Assert.*;

@SuppressWarnings({"rawtypes", "unchecked"})
public class SerializerEmitterTest {
	private final CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());

	public static final class Person {
	}

	@Test
	public void fieldBasedConstantsAreStaticFields() {
		SerializerEmitter emitter = manager.createEmitter(CodeContainerMode.FAST, Person.class, EmitterFlavor.FIELD_BASED);
		Object constant = List.of("a", "b");

		Supplier supplier = emitter.defineOperation("constant", Supplier.class, emitter.constant(constant, List.class));

		assertSame(constant, supplier.get());
		assertEquals(EmitterFlavor.FIELD_BASED, emitter.getFlavor());
		assertEquals(emitter.getTypeName() + "$constant", supplier.getClass().getName());
	}

	@Test
	public void contextBasedConstantsAreLoadedFromPool() {
		ContextBasedSerializerEmitter emitter = (ContextBasedSerializerEmitter) manager.createEmitter(
				CodeContainerMode.FAST, Person.class, EmitterFlavor.CONTEXT_BASED);
		Object first = List.of(1);
		Object second = List.of(2);

		Function firstFn = emitter.defineOperation("first", Function.class, emitter.constant(first, List.class));
		Function secondFn = emitter.defineOperation("second", Function.class, emitter.constant(second, Object.class));
		Function againFn = emitter.defineOperation("again", Function.class, emitter.constant(first, Object.class));

		ConstantTable pool = emitter.getConstantPool();
		assertEquals(2, pool.size());
		assertEquals(List.of(first, second), pool.toList());

		assertSame(first, firstFn.apply(pool));
		assertSame(second, secondFn.apply(pool));
		assertSame(first, againFn.apply(pool));
	}

	@Test
	public void contextBasedLiteralsStayInline() {
		ContextBasedSerializerEmitter emitter = (ContextBasedSerializerEmitter) manager.createEmitter(
				CodeContainerMode.FAST, Person.class, EmitterFlavor.CONTEXT_BASED);

		Function fn = emitter.defineOperation("literal", Function.class, emitter.constant("text", String.class));

		assertEquals("text", fn.apply(null));
		assertEquals(0, emitter.getConstantPool().size());
	}

	@Test
	public void operationNamesAreUniquePerEmitter() {
		SerializerEmitter emitter = manager.createEmitter(CodeContainerMode.FAST, Person.class, EmitterFlavor.FIELD_BASED);
		emitter.defineOperation("get", Supplier.class, value(1));

		assertThrows(IllegalArgumentException.class, () -> emitter.defineOperation("get", Supplier.class, value(2)));
		assertEquals(List.of("get"), emitter.getDefinedOperations());
	}

	@Test
	public void rejectsNonFunctionalInterfaces() {
		SerializerEmitter emitter = manager.createEmitter(CodeContainerMode.FAST, Person.class, EmitterFlavor.FIELD_BASED);

		assertThrows(IllegalArgumentException.class, () -> emitter.defineOperation("list", List.class, value(1)));
		assertThrows(IllegalArgumentException.class, () -> emitter.defineOperation("object", Object.class, value(1)));
		assertTrue(emitter.getDefinedOperations().isEmpty());
	}

	@Test
	public void typeNamesAreDistinctPerEmitter() {
		SerializerEmitter first = manager.createEmitter(CodeContainerMode.FAST, Person.class, EmitterFlavor.FIELD_BASED);
		SerializerEmitter second = manager.createEmitter(CodeContainerMode.FAST, Person.class, EmitterFlavor.CONTEXT_BASED);

		assertNotEquals(first.getTypeName(), second.getTypeName());
		assertThat(first.getTypeName(), endsWith(".PersonSerializer" + first.getSequence()));
	}
}
