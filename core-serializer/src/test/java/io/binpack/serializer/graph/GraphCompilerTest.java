package io.binpack.serializer.graph;

import io.binpack.serializer.Delegate1;
import io.binpack.serializer.SampleTypes.Person;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

import static io.binpack.serializer.graph.CompareNode.Operation.*;
import static io.binpack.serializer.graph.Nodes.*;
import static org.junit.Assert.*;

public class GraphCompilerTest {

	@Test
	public void loopsOverArrays() {
		ParameterNode size = parameter(int.class, "size");
		VariableNode array = variable(int[].class, "array");
		VariableNode index = variable(int.class, "index");
		BreakLabel label = label("fill");

		LambdaNode lambda = lambda("fill", List.of(size), block(List.of(array, index), List.of(
				assign(array, newArray(int.class, size)),
				loop(condition(compare(LT, index, arrayLength(array)),
						block(List.of(), List.of(arrayAssign(array, index, index), increment(index)), void.class),
						breakLoop(label), void.class), label),
				array), int[].class), int[].class);

		CompiledLambda compiled = GraphCompiler.compile(lambda);

		assertEquals("fill", compiled.getName());
		assertEquals(1, compiled.getParameterCount());
		assertArrayEquals(new int[]{0, 1, 2, 3}, (int[]) compiled.invoke(4));
		assertArrayEquals(new int[0], (int[]) compiled.invoke(0));
	}

	@Test
	public void callsMethodsAndConstructors() throws ReflectiveOperationException {
		ParameterNode name = parameter(String.class, "name");
		ParameterNode age = parameter(int.class, "age");

		LambdaNode lambda = lambda("person", List.of(name, age),
				newInstance(Person.class.getConstructor(String.class, int.class), List.of(
						call(name, String.class.getMethod("concat", String.class), List.of(constant("!", String.class))),
						age)),
				Object.class);

		@SuppressWarnings("unchecked")
		BiFunction<Object, Object, Object> function = GraphCompiler.compile(lambda).asInterface(BiFunction.class);

		assertEquals(new Person("Hal!", 44), function.apply("Hal", 44));
	}

	@Test
	public void varargsMethodsReceiveTheirArrayAsIs() throws NoSuchMethodException {
		ParameterNode elements = parameter(Object[].class, "elements");
		LambdaNode lambda = lambda("listOf", List.of(elements),
				call(null, List.class.getMethod("of", Object[].class), List.of(elements)),
				Object.class);

		CompiledLambda compiled = GraphCompiler.compile(lambda);

		assertEquals(List.of("a", "b"), compiled.invoke((Object) new Object[]{"a", "b"}));
		assertEquals(List.of(), compiled.invoke((Object) new Object[0]));
	}

	@Test
	public void readsAndWritesFields() throws NoSuchFieldException {
		ParameterNode person = parameter(Person.class, "person");
		LambdaNode lambda = lambda("rename", List.of(person), block(List.of(), List.of(
				assignField(person, Person.class.getField("name"), constant("renamed", String.class)),
				condition(compare(EQ, field(person, Person.class.getField("age")), constant(0, int.class)),
						constant("newborn", String.class),
						field(person, Person.class.getField("name")),
						String.class)), String.class), String.class);

		@SuppressWarnings("unchecked")
		UnaryOperator<Object> rename = GraphCompiler.compile(lambda).asInterface(UnaryOperator.class);

		Person adult = new Person("Ida", 20);
		assertEquals("renamed", rename.apply(adult));
		assertEquals("renamed", adult.name);
		assertEquals("newborn", rename.apply(new Person("Jon", 0)));
	}

	@Test
	public void finallyBlocksRunWhenTryBlocksThrow() throws NoSuchMethodException {
		ParameterNode values = parameter(List.class, "values");
		ParameterNode log = parameter(List.class, "log");
		LambdaNode lambda = lambda("first", List.of(values, log), tryFinally(
				call(values, List.class.getMethod("get", int.class), List.of(constant(0, int.class))),
				call(log, List.class.getMethod("add", Object.class), List.of(constant("finally", String.class)))),
				Object.class);
		CompiledLambda compiled = GraphCompiler.compile(lambda);

		List<Object> log1 = new ArrayList<>();
		assertEquals("value", compiled.invoke(List.of("value"), log1));
		assertEquals(List.of("finally"), log1);

		List<Object> log2 = new ArrayList<>();
		assertThrows(IndexOutOfBoundsException.class, () -> compiled.invoke(List.of(), log2));
		assertEquals(List.of("finally"), log2);
	}

	@Test
	public void lambdasAdaptToDelegates() {
		ParameterNode self = parameter(Object.class, "self");
		ParameterNode value = parameter(Object.class, "value");
		LambdaNode lambda = lambda("isNull", List.of(self, value),
				compare(EQ, value, constant(null, Object.class)), Object.class);

		Delegate1 delegate = (Delegate1) GraphCompiler.compile(lambda).asDelegate(1);

		assertEquals(true, delegate.invoke(null, null));
		assertEquals(false, delegate.invoke(null, "value"));
		assertThrows(IllegalArgumentException.class, () -> GraphCompiler.compile(lambda).asDelegate(2));
	}

	@Test
	public void malformedGraphsAreRejected() {
		ParameterNode foreign = parameter(int.class, "foreign");
		ParameterNode own = parameter(int.class, "own");

		assertThrows(IllegalArgumentException.class, () -> GraphCompiler.compile(lambda("foreign", List.of(own), foreign, int.class)));
		assertThrows(IllegalArgumentException.class, () -> lambda("mismatch", List.of(own), constant("text", String.class), int.class));
		assertThrows(IllegalArgumentException.class, () -> block(List.of(), List.of(), void.class));
		assertThrows(IllegalArgumentException.class, () -> compare(LT, own, constant(1L, long.class)));
		assertThrows(IllegalArgumentException.class, () -> constant(null, int.class));
		assertThrows(IllegalArgumentException.class, () -> GraphCompiler.compile(lambda("wrongArity", List.of(own), own, int.class)).invoke());
	}
}
