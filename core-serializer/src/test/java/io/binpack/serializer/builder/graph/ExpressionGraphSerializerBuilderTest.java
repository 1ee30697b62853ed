package io.binpack.serializer.builder.graph;

import io.binpack.codegen.container.CodeContainerManager;
import io.binpack.codegen.container.CodeContainerMode;
import io.binpack.codegen.container.EmitterFlavor;
import io.binpack.codegen.container.PlatformCapabilities;
import io.binpack.serializer.*;
import io.binpack.serializer.SampleTypes.Color;
import io.binpack.serializer.SampleTypes.Order;
import io.binpack.serializer.SampleTypes.Person;
import io.binpack.serializer.builder.AbstractSerializerBuilderTest;
import io.binpack.serializer.builder.SerializerBuilder;
import io.binpack.serializer.graph.Node;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class ExpressionGraphSerializerBuilderTest extends AbstractSerializerBuilderTest<GraphGenerationContext, Node> {

	@Override
	protected SerializerBuilder<GraphGenerationContext, Node> createBuilder() {
		return ExpressionGraphSerializerBuilder.create();
	}

	@Test
	public void requestedFlavorIsUsedAsIs() {
		ExpressionGraphSerializerBuilder builder = ExpressionGraphSerializerBuilder.create();

		assertEquals(EmitterFlavor.CONTEXT_BASED, builder.createContext(Person.class, EmitterFlavor.CONTEXT_BASED).getFlavor());
		assertEquals(EmitterFlavor.FIELD_BASED, builder.createContext(Person.class, EmitterFlavor.FIELD_BASED).getFlavor());
		assertFalse(builder.isDumpMode());
		assertTrue(ExpressionGraphSerializerBuilder.create(true).isDumpMode());
	}

	@Test
	public void worksWithoutDynamicCode() {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.withoutDynamicCode());
		SerializerGenerator generator = SerializerGenerator.builder()
				.withCodeContainerManager(manager)
				.withMode(SerializerGenerator.Mode.EXPRESSION_GRAPH)
				.build();
		SerializationContext context = SerializationContext.builder().withGenerator(generator).build();

		Order order = new Order("o-9", List.of("t"), Map.of("k", 1), Set.of(Color.GREEN), new Person("Fay", 33), Color.RED, 3L);
		PackSerializer<Order> serializer = context.getSerializer(Order.class);

		assertEquals(order, serializer.unpack(serializer.pack(order)));
	}

	@Test
	public void dumpModeLooksReflectionHandlesUpByName() {
		SerializerGenerator generator = SerializerGenerator.builder()
				.withMode(SerializerGenerator.Mode.EXPRESSION_GRAPH)
				.withContainerMode(CodeContainerMode.DEBUGGABLE)
				.build();
		SerializationContext context = SerializationContext.builder().withGenerator(generator).build();
		Order order = new Order("o-10", List.of(), Map.of(), Set.of(), new Person("Gil", 60), Color.BLUE, null);

		assertTrue(((ExpressionGraphSerializerBuilder) generator.getSerializerBuilder()).isDumpMode());
		PackSerializer<Order> serializer = context.getSerializer(Order.class);
		assertEquals(order, serializer.unpack(serializer.pack(order)));
	}
}
