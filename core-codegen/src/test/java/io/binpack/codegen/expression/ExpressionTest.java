package io.binpack.codegen.expression;

import io.binpack.codegen.ClassBuilder;
import io.binpack.codegen.DefiningClassLoader;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

import static io.binpack.codegen.expression.Expressions.*;
import static org.junit.Assert.*;

public class ExpressionTest {
	public static final DefiningClassLoader CLASS_LOADER = DefiningClassLoader.create();

	public static class TestPojo {
		public int property1;
		public String property2;

		public TestPojo(int property1, String property2) {
			this.property1 = property1;
			this.property2 = property2;
		}

		public int getProperty1() {
			return property1;
		}
	}

	public interface StringOps {
		int length(String s);

		String concat(String a, String b);
	}

	public interface Comparisons {
		boolean same(int a, int b);

		boolean sameStrings(String a, String b);

		String sign(int a);

		boolean isMissing(Object o);
	}

	public interface Counting {
		int count(List<String> values);

		String[] copy(String[] source);
	}

	public interface PojoOps {
		int read(TestPojo pojo);

		TestPojo update(TestPojo pojo, String value);

		TestPojo create(int value);
	}

	public interface Guarded {
		Object first(List<Object> values, List<String> log);

		void fail(String message);
	}

	@Test
	public void testCalls() {
		StringOps ops = ClassBuilder.<StringOps>create(StringOps.class)
				.withMethod("length", call(arg(0), "length"))
				.withMethod("concat", call(arg(0), "concat", arg(1)))
				.defineClassAndCreateInstance(CLASS_LOADER);

		assertEquals(5, ops.length("hello"));
		assertEquals("foobar", ops.concat("foo", "bar"));
	}

	@Test
	public void testComparisons() {
		Comparisons comparisons = ClassBuilder.<Comparisons>create(Comparisons.class)
				.withMethod("same", isEq(arg(0), arg(1)))
				.withMethod("sameStrings", isEq(arg(0), arg(1)))
				.withMethod("sign", ifElse(isLt(arg(0), value(0)),
						value("negative"),
						ifElse(isGt(arg(0), value(0)),
								value("positive"),
								value("zero"))))
				.withMethod("isMissing", isNull(arg(0)))
				.defineClassAndCreateInstance(CLASS_LOADER);

		assertTrue(comparisons.same(1, 1));
		assertFalse(comparisons.same(1, 2));
		assertTrue(comparisons.sameStrings("a", new String("a")));
		assertFalse(comparisons.sameStrings("a", "b"));
		assertEquals("negative", comparisons.sign(-10));
		assertEquals("zero", comparisons.sign(0));
		assertEquals("positive", comparisons.sign(3));
		assertTrue(comparisons.isMissing(null));
		assertFalse(comparisons.isMissing(""));
	}

	@Test
	public void testLoopsAndDeclaredLocals() {
		DeclaredLocal counter = declaredLocal(int.class, "counter");
		DeclaredLocal iterator = declaredLocal(Iterator.class, "iterator");
		Counting counting = ClassBuilder.<Counting>create(Counting.class)
				.withMethod("count", block(List.of(counter, iterator), List.of(
						set(iterator, call(arg(0), "iterator")),
						loop(call(iterator, "hasNext"), sequence(call(iterator, "next"), increment(counter))),
						counter)))
				.withMethod("copy", let(arrayNew(String[].class, length(arg(0))), copy ->
						sequence(
								iterate(length(arg(0)), i -> arraySet(copy, i, arrayGet(arg(0), i))),
								copy)))
				.defineClassAndCreateInstance(CLASS_LOADER);

		assertEquals(0, counting.count(List.of()));
		assertEquals(3, counting.count(List.of("a", "b", "c")));

		String[] source = {"x", "y"};
		String[] copy = counting.copy(source);
		assertNotSame(source, copy);
		assertArrayEquals(source, copy);
		assertEquals(0, counting.copy(new String[0]).length);
	}

	@Test
	public void testFieldsAndConstructors() throws NoSuchFieldException {
		PojoOps ops = ClassBuilder.<PojoOps>create(PojoOps.class)
				.withMethod("read", call(arg(0), "getProperty1"))
				.withMethod("update", sequence(
						set(field(arg(0), TestPojo.class.getField("property2")), arg(1)),
						arg(0)))
				.withMethod("create", constructor(TestPojo.class, arg(0), value("created")))
				.defineClassAndCreateInstance(CLASS_LOADER);

		TestPojo pojo = new TestPojo(42, "initial");
		assertEquals(42, ops.read(pojo));
		assertSame(pojo, ops.update(pojo, "updated"));
		assertEquals("updated", pojo.property2);

		TestPojo created = ops.create(7);
		assertEquals(7, created.property1);
		assertEquals("created", created.property2);
	}

	@Test
	public void testTryFinallyAndThrow() {
		Guarded guarded = ClassBuilder.<Guarded>create(Guarded.class)
				.withMethod("first", tryFinally(
						call(arg(0), "get", value(0)),
						call(arg(1), "add", value("finally"))))
				.withMethod("fail", throwException(constructor(IllegalArgumentException.class, arg(0))))
				.defineClassAndCreateInstance(CLASS_LOADER);

		List<String> log = new ArrayList<>();
		assertEquals("value", guarded.first(List.of("value"), log));
		assertEquals(List.of("finally"), log);

		log.clear();
		assertThrows(IndexOutOfBoundsException.class, () -> guarded.first(List.of(), log));
		assertEquals(List.of("finally"), log);

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> guarded.fail("message"));
		assertEquals("message", e.getMessage());
	}

	@Test
	@SuppressWarnings("unchecked")
	public void testStaticConstants() {
		int constantsBefore = ClassBuilder.getStaticConstantsSize();
		TestPojo constant = new TestPojo(1, "constant");

		Supplier<Object> supplier = ClassBuilder.<Supplier<Object>>create(Supplier.class)
				.withMethod("get", value(constant))
				.defineClassAndCreateInstance(CLASS_LOADER);

		assertSame(constant, supplier.get());
		assertEquals(constantsBefore, ClassBuilder.getStaticConstantsSize());
	}

	@Test
	public void testUnknownMethod() {
		ClassBuilder<StringOps> builder = ClassBuilder.<StringOps>create(StringOps.class)
				.withMethod("length", call(arg(0), "size"))
				.withMethod("concat", arg(0));

		assertThrows(IllegalArgumentException.class, () -> builder.defineClass(CLASS_LOADER));
	}
}
