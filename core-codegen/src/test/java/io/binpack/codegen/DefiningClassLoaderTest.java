package io.binpack.codegen;

import org.junit.ClassRule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Supplier;

import static io.binpack.codegen.expression.Expressions.value;
import static org.junit.Assert.*;

@SuppressWarnings("rawtypes")
public class DefiningClassLoaderTest {
	@ClassRule
	public static final TemporaryFolder temporaryFolder = new TemporaryFolder();

	@Test
	public void definesClassWithGivenName() throws ReflectiveOperationException {
		DefiningClassLoader classLoader = DefiningClassLoader.create();
		String className = "io.binpack.codegen.TestSupplier";

		Class<Supplier> supplierClass = ClassBuilder.<Supplier>create(Supplier.class)
				.withClassName(className)
				.withMethod("get", value("test string"))
				.defineClass(classLoader);

		assertEquals(className, supplierClass.getName());
		assertSame(classLoader, supplierClass.getClassLoader());
		assertEquals("test string", supplierClass.getConstructor().newInstance().get());
		assertEquals(1, classLoader.getDefinedClassesCount());
		assertTrue(classLoader.getDefinedClassNames().contains(className));
		assertFalse(classLoader.isBytecodeRetained());
		assertThrows(IllegalStateException.class, classLoader::getRetainedBytecode);
	}

	@Test
	public void sameNameCannotBeDefinedTwice() {
		DefiningClassLoader classLoader = DefiningClassLoader.create();
		String className = "io.binpack.codegen.DuplicateSupplier";

		ClassBuilder.<Supplier>create(Supplier.class)
				.withClassName(className)
				.withMethod("get", value(1))
				.defineClass(classLoader);

		assertThrows(LinkageError.class, () -> ClassBuilder.<Supplier>create(Supplier.class)
				.withClassName(className)
				.withMethod("get", value(2))
				.defineClass(classLoader));
	}

	@Test
	public void retainsBytecodeInDefinitionOrder() {
		DefiningClassLoader classLoader = DefiningClassLoader.builder()
				.withRetainedBytecode()
				.build();

		for (String name : new String[]{"First", "Second", "Third"}) {
			ClassBuilder.<Supplier>create(Supplier.class)
					.withClassName("io.binpack.codegen.retained." + name)
					.withMethod("get", value(name))
					.defineClass(classLoader);
		}

		Map<String, byte[]> bytecode = classLoader.getRetainedBytecode();
		assertArrayEquals(
				new String[]{"io.binpack.codegen.retained.First", "io.binpack.codegen.retained.Second", "io.binpack.codegen.retained.Third"},
				bytecode.keySet().toArray(new String[0]));
		for (byte[] bytes : bytecode.values()) {
			assertTrue(bytes.length > 0);
		}
	}

	@Test
	public void writesBytecodeToDebugOutputDir() throws IOException {
		Path dir = temporaryFolder.newFolder().toPath();
		DefiningClassLoader classLoader = DefiningClassLoader.builder()
				.withDebugOutputDir(dir)
				.build();

		ClassBuilder.<Supplier>create(Supplier.class)
				.withClassName("io.binpack.codegen.DebugSupplier")
				.withMethod("get", value("debug"))
				.defineClass(classLoader);

		assertTrue(Files.exists(dir.resolve("io.binpack.codegen.DebugSupplier.class")));
	}

	@Test
	public void builderCannotBeReused() {
		DefiningClassLoader.Builder builder = DefiningClassLoader.builder();
		builder.build();

		assertThrows(IllegalStateException.class, builder::withRetainedBytecode);
		assertThrows(IllegalStateException.class, builder::build);
	}
}
