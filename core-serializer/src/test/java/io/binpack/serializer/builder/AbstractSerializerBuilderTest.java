package io.binpack.serializer.builder;

import io.binpack.codegen.container.EmitterFlavor;
import io.binpack.serializer.Delegate1;
import io.binpack.serializer.GeneratedObjectSerializer;
import io.binpack.serializer.GeneratedSerializer;
import io.binpack.serializer.Packer;
import io.binpack.serializer.PolymorphismSchema;
import io.binpack.serializer.SampleTypes.Color;
import io.binpack.serializer.SampleTypes.Person;
import io.binpack.serializer.SampleTypes.Point;
import io.binpack.serializer.SerializationContext;
import io.binpack.serializer.SerializationMethod;
import io.binpack.serializer.SerializerFactory;
import io.binpack.serializer.reflection.AmbiguousMemberException;
import io.binpack.serializer.reflection.CollectionTraits;
import io.binpack.serializer.reflection.MethodDefinition;
import io.binpack.serializer.reflection.SerializationTarget;
import io.binpack.serializer.reflection.UnresolvedMemberException;
import org.junit.Test;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static io.binpack.serializer.builder.GenerationContext.State.*;
import static org.junit.Assert.*;

/**
 * Checks that every backend honours the contract of {@link SerializerBuilder}
 */
public abstract class AbstractSerializerBuilderTest<C extends GenerationContext<N>, N extends Construct> {

	public static final class Registry {
		public void put(String key, Object value) {
		}

		public void put(CharSequence key, Object value) {
		}
	}

	protected abstract SerializerBuilder<C, N> createBuilder();

	@Test
	public void contextIsCompiledAfterObjectSerializerIsCreated() {
		SerializerBuilder<C, N> builder = createBuilder();
		SerializerBuildPlan<C, N> plan = SerializerBuildPlan.create(builder, Person.class, EmitterFlavor.FIELD_BASED);
		C ctx = plan.getContext();
		assertEquals(OPEN, ctx.getState());

		SerializerFactory<Person> factory = plan.buildObjectSerializer(SerializationTarget.prepare(Person.class), PolymorphismSchema.DEFAULT);

		assertNotNull(factory);
		assertEquals(COMPILED, ctx.getState());
		assertThrows(IllegalStateException.class, () -> builder.emitIntConstant(ctx, 1));
		assertThrows(IllegalStateException.class, () -> builder.emitStringConstant(ctx, "name"));
		assertThrows(IllegalStateException.class,
				() -> builder.createSerializerConstructor(ctx, SerializationTarget.prepare(Person.class), PolymorphismSchema.DEFAULT));
		assertThrows(IllegalStateException.class, () -> builder.createEnumSerializerConstructor(ctx));
	}

	@Test
	@SuppressWarnings("unchecked")
	public void contextIsCompiledAfterEnumSerializerIsCreated() {
		SerializerBuilder<C, N> builder = createBuilder();
		SerializerBuildPlan<C, N> plan = SerializerBuildPlan.create(builder, Color.class, EmitterFlavor.FIELD_BASED);

		SerializerFactory<Color> factory = plan.buildEnumSerializer();

		assertEquals(COMPILED, plan.getContext().getState());
		GeneratedSerializer<Color> serializer = (GeneratedSerializer<Color>) factory.create(SerializationContext.create());
		assertEquals(Color.class, serializer.getTargetType());
		assertSame(PolymorphismSchema.DEFAULT, serializer.getPolymorphismSchema());
	}

	@Test
	public void finishedContextRejectsEmission() {
		SerializerBuilder<C, N> builder = createBuilder();
		C ctx = builder.createContext(Person.class, EmitterFlavor.FIELD_BASED);
		ctx.finish();

		assertEquals(FINISHED, ctx.getState());
		assertThrows(IllegalStateException.class, () -> builder.emitBooleanConstant(ctx, true));
		assertThrows(IllegalStateException.class, () -> builder.declareLocal(ctx, int.class, "local"));
		assertThrows(IllegalStateException.class, () -> builder.emitSequentialStatements(ctx, void.class, List.of()));
		assertThrows(IllegalStateException.class,
				() -> builder.defineHelper(ctx, "helper", Delegate1.class, parameters -> parameters.get(1)));
		assertThrows(IllegalStateException.class, ctx::finish);
	}

	@Test
	public void missingOperationListsFailCompilation() {
		SerializerBuilder<C, N> builder = createBuilder();
		C ctx = builder.createContext(Person.class, EmitterFlavor.FIELD_BASED);

		assertThrows(SerializerCompilationException.class,
				() -> builder.createSerializerConstructor(ctx, SerializationTarget.prepare(Person.class), PolymorphismSchema.DEFAULT));
		assertEquals(FINISHED, ctx.getState());
		assertThrows(IllegalStateException.class,
				() -> builder.createSerializerConstructor(ctx, SerializationTarget.prepare(Person.class), PolymorphismSchema.DEFAULT));
	}

	@Test
	public void missingEnumHelpersFailCompilation() {
		SerializerBuilder<C, N> builder = createBuilder();
		C ctx = builder.createContext(Color.class, EmitterFlavor.FIELD_BASED);

		assertThrows(SerializerCompilationException.class, () -> builder.createEnumSerializerConstructor(ctx));
		assertEquals(FINISHED, ctx.getState());
	}

	@Test
	public void sequentialStatementsAreTypeChecked() {
		SerializerBuilder<C, N> builder = createBuilder();
		C ctx = builder.createContext(Person.class, EmitterFlavor.FIELD_BASED);

		assertThrows(SerializerCompilationException.class,
				() -> builder.emitSequentialStatements(ctx, int.class, List.of(builder.emitStringConstant(ctx, "text"))));
		assertThrows(SerializerCompilationException.class,
				() -> builder.emitSequentialStatements(ctx, String.class, List.of()));
		assertThrows(SerializerCompilationException.class,
				() -> builder.emitSequentialStatements(ctx, String.class, Arrays.asList(null, null)));

		N empty = builder.emitSequentialStatements(ctx, void.class, List.of());
		assertEquals(void.class, empty.getType());
		N block = builder.emitSequentialStatements(ctx, CharSequence.class,
				Arrays.asList(builder.emitIntConstant(ctx, 1), null, builder.emitStringConstant(ctx, "last")));
		assertEquals(CharSequence.class, block.getType());
	}

	@Test
	public void indexedPropertiesAreResolvedByKeyAndValueTypes() {
		SerializerBuilder<C, N> builder = createBuilder();
		C ctx = builder.createContext(Person.class, EmitterFlavor.FIELD_BASED);
		N map = builder.declareLocal(ctx, Map.class, "map");
		N registry = builder.declareLocal(ctx, Registry.class, "registry");
		N key = builder.emitStringConstant(ctx, "key");
		N value = builder.emitStringConstant(ctx, "value");

		N put = builder.emitSetIndexedProperty(ctx, map, Map.class, "put", String.class, Object.class, key, value);
		assertNotNull(put);
		assertThrows(UnresolvedMemberException.class,
				() -> builder.emitSetIndexedProperty(ctx, map, Map.class, "putAll", String.class, Object.class, key, value));
		assertThrows(UnresolvedMemberException.class,
				() -> builder.emitSetIndexedProperty(ctx, map, Map.class, "put", int.class, Object.class,
						builder.emitIntConstant(ctx, 1), value));
		assertThrows(AmbiguousMemberException.class,
				() -> builder.emitSetIndexedProperty(ctx, registry, Registry.class, "put", String.class, Object.class, key, value));
	}

	@Test
	public void helpersAreCompiledToDelegates() {
		SerializerBuilder<C, N> builder = createBuilder();
		C ctx = builder.createContext(Person.class, EmitterFlavor.FIELD_BASED);

		builder.defineHelper(ctx, "countNonNull", Delegate1.class, parameters -> {
			N values = builder.referArgument(ctx, List.class, "values", 1);
			N total = builder.declareLocal(ctx, int.class, ctx.newLocalName("total"));
			N nullValue = builder.emitNullConstant(ctx, Object.class);
			return builder.emitSequentialStatements(ctx, Integer.class, List.of(
					builder.emitStoreVariable(ctx, total, builder.emitIntConstant(ctx, 0)),
					builder.emitForEachLoop(ctx, CollectionTraits.of(List.class), values, element ->
							builder.emitConditionalExpression(ctx,
									builder.emitNotEqualsExpression(ctx, element, nullValue),
									builder.emitIncrement(ctx, total),
									null)),
					builder.emitBoxExpression(ctx, total)));
		});
		builder.defineHelper(ctx, "pointX", Delegate1.class, parameters -> {
			N point = builder.referArgument(ctx, Point.class, "point", 1);
			return builder.emitBoxExpression(ctx, builder.emitGetProperty(ctx, point, getMethod(Point.class, "x")));
		});

		assertTrue(ctx.hasHelper("countNonNull"));
		assertEquals(Delegate1.class, ctx.getHelper("countNonNull").getDelegateType());
		Delegate1 countNonNull = (Delegate1) ctx.getHelperInstance("countNonNull");
		assertEquals(0, countNonNull.invoke(null, List.of()));
		assertEquals(2, countNonNull.invoke(null, Arrays.asList("a", null, "b", null)));

		Delegate1 pointX = (Delegate1) ctx.getHelperInstance("pointX");
		assertEquals(3, pointX.invoke(null, new Point(3, 4)));

		assertThrows(IllegalArgumentException.class,
				() -> builder.defineHelper(ctx, "pointX", Delegate1.class, parameters -> builder.emitIntConstant(ctx, 0)));
	}

	@Test
	public void localsKeepTheirValuesAcrossLoopIterations() {
		SerializerBuilder<C, N> builder = createBuilder();
		C ctx = builder.createContext(Person.class, EmitterFlavor.FIELD_BASED);
		MethodDefinition concat = MethodDefinition.resolve(String.class, "concat");

		builder.defineHelper(ctx, "joinAll", Delegate1.class, parameters -> {
			N values = builder.referArgument(ctx, List.class, "values", 1);
			N joined = builder.declareLocal(ctx, String.class, ctx.newLocalName("joined"));
			return builder.emitSequentialStatements(ctx, String.class, List.of(
					builder.emitStoreVariable(ctx, joined, builder.emitStringConstant(ctx, "")),
					builder.emitForEachLoop(ctx, CollectionTraits.of(List.class), values, element ->
							builder.emitSequentialStatements(ctx, void.class, List.of(
									builder.emitStoreVariable(ctx, joined, builder.emitInvokeMethodExpression(ctx, joined, concat,
											List.of(builder.emitCast(ctx, element, String.class))))))),
					joined));
		});

		Delegate1 joinAll = (Delegate1) ctx.getHelperInstance("joinAll");
		assertEquals("abc", joinAll.invoke(null, List.of("a", "b", "c")));
		assertEquals("", joinAll.invoke(null, List.of()));
	}

	@Test
	public void forEachLoopAdvancesWhenElementIsUnused() {
		SerializerBuilder<C, N> builder = createBuilder();
		C ctx = builder.createContext(Person.class, EmitterFlavor.FIELD_BASED);

		builder.defineHelper(ctx, "countAll", Delegate1.class, parameters -> {
			N values = builder.referArgument(ctx, List.class, "values", 1);
			N total = builder.declareLocal(ctx, int.class, ctx.newLocalName("total"));
			return builder.emitSequentialStatements(ctx, Integer.class, List.of(
					builder.emitStoreVariable(ctx, total, builder.emitIntConstant(ctx, 0)),
					builder.emitForEachLoop(ctx, CollectionTraits.of(List.class), values, element ->
							builder.emitIncrement(ctx, total)),
					builder.emitBoxExpression(ctx, total)));
		});

		Delegate1 countAll = (Delegate1) ctx.getHelperInstance("countAll");
		assertEquals(4, countAll.invoke(null, Arrays.asList("a", null, "b", "c")));
		assertEquals(0, countAll.invoke(null, List.of()));
	}

	@Test
	@SuppressWarnings("unchecked")
	public void tupleTargetsArePackedByPosition() {
		SerializerBuilder<C, N> builder = createBuilder();
		SerializerBuildPlan<C, N> plan = SerializerBuildPlan.create(builder, Point.class, EmitterFlavor.FIELD_BASED);

		SerializerFactory<Point> factory = plan.buildObjectSerializer(SerializationTarget.forTuple(Point.class), PolymorphismSchema.DEFAULT);

		SerializationContext mapContext = SerializationContext.builder()
				.withSerializationMethod(SerializationMethod.MAP)
				.build();
		GeneratedObjectSerializer<Point> serializer =
				(GeneratedObjectSerializer<Point>) factory.create(mapContext);
		assertTrue(serializer.getPackOperationTable().isEmpty());
		assertEquals(List.of("#0", "#1"), serializer.getMemberNames());

		Packer expected = new Packer();
		expected.writeArrayHeader(2);
		expected.writeInt(5);
		expected.writeInt(6);
		assertArrayEquals(expected.toByteArray(), serializer.pack(new Point(5, 6)));
		assertEquals(new Point(5, 6), serializer.unpack(expected.toByteArray()));
	}

	private static Method getMethod(Class<?> type, String name) {
		try {
			return type.getMethod(name);
		} catch (NoSuchMethodException e) {
			throw new AssertionError(e);
		}
	}
}
