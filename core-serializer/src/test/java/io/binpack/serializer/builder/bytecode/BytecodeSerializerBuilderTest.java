package io.binpack.serializer.builder.bytecode;

import io.binpack.codegen.container.*;
import io.binpack.serializer.PolymorphismSchema;
import io.binpack.serializer.SampleTypes.Person;
import io.binpack.serializer.SerializationContext;
import io.binpack.serializer.SerializerFactory;
import io.binpack.serializer.builder.AbstractSerializerBuilderTest;
import io.binpack.serializer.builder.SerializerBuildPlan;
import io.binpack.serializer.builder.SerializerBuilder;
import io.binpack.serializer.reflection.SerializationTarget;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class BytecodeSerializerBuilderTest extends AbstractSerializerBuilderTest<BytecodeGenerationContext, BytecodeConstruct> {
	@Rule
	public final TemporaryFolder temporaryFolder = new TemporaryFolder();

	private final CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());

	@Override
	protected SerializerBuilder<BytecodeGenerationContext, BytecodeConstruct> createBuilder() {
		return BytecodeSerializerBuilder.create(manager, CodeContainerMode.FAST);
	}

	@Test
	public void contextUsesSubstitutedFlavor() {
		CodeContainerManager restricted = CodeContainerManager.create(PlatformCapabilities.restrictedTo(EmitterFlavor.CONTEXT_BASED));
		BytecodeSerializerBuilder builder = BytecodeSerializerBuilder.create(restricted, CodeContainerMode.FAST);

		BytecodeGenerationContext ctx = builder.createContext(Person.class, EmitterFlavor.FIELD_BASED);

		assertEquals(EmitterFlavor.CONTEXT_BASED, ctx.getFlavor());
		assertNotNull(ctx.getConstantTable());
	}

	@Test
	public void contextBasedSerializerPacksLikeFieldBasedOne() {
		Person person = new Person("Dora", 51);
		SerializationContext context = SerializationContext.create();

		byte[] fieldBased = build(EmitterFlavor.FIELD_BASED).create(context).pack(person);
		byte[] contextBased = build(EmitterFlavor.CONTEXT_BASED).create(context).pack(person);

		assertArrayEquals(fieldBased, contextBased);
	}

	@Test
	public void platformWithoutDynamicCodeIsRejected() {
		CodeContainerManager withoutDynamicCode = CodeContainerManager.create(PlatformCapabilities.withoutDynamicCode());
		BytecodeSerializerBuilder builder = BytecodeSerializerBuilder.create(withoutDynamicCode, CodeContainerMode.FAST);

		assertThrows(PlatformUnsupportedException.class, () -> builder.createContext(Person.class, EmitterFlavor.FIELD_BASED));
	}

	@Test
	public void debuggableSerializersCanBePersisted() throws IOException {
		BytecodeSerializerBuilder builder = BytecodeSerializerBuilder.create(manager, CodeContainerMode.DEBUGGABLE);
		SerializerBuildPlan<BytecodeGenerationContext, BytecodeConstruct> plan =
				SerializerBuildPlan.create(builder, Person.class, EmitterFlavor.FIELD_BASED);
		SerializerFactory<Person> factory = plan.buildObjectSerializer(SerializationTarget.prepare(Person.class), PolymorphismSchema.DEFAULT);

		Person person = new Person("Eve", 29);
		assertEquals(person, factory.create(SerializationContext.create()).unpack(factory.create(SerializationContext.create()).pack(person)));

		CodeContainer container = plan.getContext().getEmitter().getContainer();
		assertEquals(DebugMetadata.RETAIN_SEQUENCE_POINTS, container.getDebugMetadata());
		assertTrue(container.getDefinedClassesCount() > 0);

		Path jar = container.persist(temporaryFolder.newFolder().toPath());
		assertTrue(Files.size(jar) > 0);
	}

	private SerializerFactory<Person> build(EmitterFlavor flavor) {
		SerializerBuildPlan<BytecodeGenerationContext, BytecodeConstruct> plan =
				SerializerBuildPlan.create(createBuilder(), Person.class, flavor);
		return plan.buildObjectSerializer(SerializationTarget.prepare(Person.class), PolymorphismSchema.DEFAULT);
	}
}
