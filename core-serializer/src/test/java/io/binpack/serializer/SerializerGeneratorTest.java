package io.binpack.serializer;

import io.binpack.codegen.container.CodeContainerManager;
import io.binpack.codegen.container.CodeContainerMode;
import io.binpack.codegen.container.EmitterFlavor;
import io.binpack.codegen.container.PlatformCapabilities;
import io.binpack.codegen.container.PlatformUnsupportedException;
import io.binpack.serializer.SampleTypes.Color;
import io.binpack.serializer.SampleTypes.Person;
import io.binpack.serializer.builder.bytecode.BytecodeSerializerBuilder;
import io.binpack.serializer.builder.graph.ExpressionGraphSerializerBuilder;
import org.jetbrains.annotations.Nullable;
import org.junit.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.*;

public class SerializerGeneratorTest {

	@Test
	public void autoModeUsesBytecodeWhereDynamicCodeIsSupported() {
		SerializerGenerator generator = SerializerGenerator.builder()
				.withCodeContainerManager(CodeContainerManager.create(PlatformCapabilities.unrestricted()))
				.withMode(SerializerGenerator.Mode.AUTO)
				.build();

		assertThat(generator.getSerializerBuilder(), instanceOf(BytecodeSerializerBuilder.class));
	}

	@Test
	public void autoModeFallsBackToExpressionGraphs() {
		SerializerGenerator generator = SerializerGenerator.builder()
				.withCodeContainerManager(CodeContainerManager.create(PlatformCapabilities.withoutDynamicCode()))
				.withMode(SerializerGenerator.Mode.AUTO)
				.withContainerMode(CodeContainerMode.DEBUGGABLE)
				.build();

		assertThat(generator.getSerializerBuilder(), instanceOf(ExpressionGraphSerializerBuilder.class));
		assertTrue(((ExpressionGraphSerializerBuilder) generator.getSerializerBuilder()).isDumpMode());

		SerializationContext context = SerializationContext.builder().withGenerator(generator).build();
		Person person = new Person("Kim", 38);
		PackSerializer<Person> serializer = context.getSerializer(Person.class);
		assertEquals(person, serializer.unpack(serializer.pack(person)));
	}

	@Test
	public void bytecodeModeFailsWithoutDynamicCode() {
		SerializerGenerator generator = SerializerGenerator.builder()
				.withCodeContainerManager(CodeContainerManager.create(PlatformCapabilities.withoutDynamicCode()))
				.withMode(SerializerGenerator.Mode.BYTECODE)
				.build();

		assertThrows(PlatformUnsupportedException.class, () -> generator.getFactory(Person.class));
	}

	@Test
	public void factoriesAreCachedPerTypeAndSchema() {
		SerializerGenerator generator = SerializerGenerator.builder()
				.withCodeContainerManager(CodeContainerManager.create(PlatformCapabilities.unrestricted()))
				.withFlavor(EmitterFlavor.CONTEXT_BASED)
				.build();
		PolymorphismSchema schema = PolymorphismSchema.of(Map.of("person", Person.class));

		SerializerFactory<Person> factory = generator.getFactory(Person.class);

		assertSame(factory, generator.getFactory(Person.class));
		assertSame(factory, generator.getFactory(Person.class, PolymorphismSchema.DEFAULT));
		assertNotSame(factory, generator.getFactory(Person.class, schema));
		assertSame(generator.getFactory(Color.class), generator.getFactory(Color.class));
		assertEquals(EmitterFlavor.CONTEXT_BASED, generator.getFlavor());

		SerializationContext context = SerializationContext.create();
		assertNotSame(factory.create(context), factory.create(context));
		assertEquals(schema, ((GeneratedSerializer<Person>) generator.getFactory(Person.class, schema).create(context)).getPolymorphismSchema());
	}

	@Test
	public void unsupportedTypesAreRejected() {
		SerializerGenerator generator = SerializerGenerator.builder()
				.withMode(SerializerGenerator.Mode.EXPRESSION_GRAPH)
				.build();

		assertThrows(IllegalArgumentException.class, () -> generator.getFactory(int.class));
		assertThrows(IllegalArgumentException.class, () -> generator.getFactory(String[].class));
		assertThrows(IllegalArgumentException.class, () -> generator.getFactory(Runnable.class));
	}

	@Test
	@SuppressWarnings({"rawtypes", "unchecked"})
	public void customSerializersTakePrecedence() {
		PackSerializer<Person> custom = new PackSerializer<>(null, Person.class) {
			@Override
			public void packTo(Packer packer, @Nullable Person value) {
				packer.writeString(value == null ? null : value.name);
			}

			@Override
			public @Nullable Person unpackFrom(Unpacker unpacker) {
				String name = unpacker.readString();
				return name == null ? null : new Person(name, 0);
			}
		};
		SerializationContext context = SerializationContext.builder()
				.withSerializer(Person.class, custom)
				.build();

		assertSame(custom, context.getSerializer(Person.class));
		assertEquals(new Person("Lee", 0), context.getSerializer(Person.class).unpack(custom.pack(new Person("Lee", 70))));
		assertThrows(IllegalArgumentException.class,
				() -> SerializationContext.builder().withSerializer(Color.class, (PackSerializer) custom));
	}

	@Test
	public void builtinSerializersAreUsedForValues() {
		SerializationContext context = SerializationContext.create();

		assertEquals("text", context.getSerializer(String.class).unpack(context.getSerializer(String.class).pack("text")));
		assertEquals(Long.valueOf(-5), context.getSerializer(Long.class).unpack(context.getSerializer(Long.class).pack(-5L)));
		assertEquals(Integer.valueOf(9), context.getSerializer(int.class).unpack(context.getSerializer(int.class).pack(9)));
		assertNull(context.getSerializer(Double.class).unpack(context.getSerializer(Double.class).pack(null)));
	}
}
