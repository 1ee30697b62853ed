package io.binpack.codegen.container;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.function.Supplier;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static io.binpack.codegen.expression.Expressions.value;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class CodeContainerManagerTest {
	@Rule
	public final TemporaryFolder temporaryFolder = new TemporaryFolder();

	public static final class Target {
	}

	@Test
	public void containerIsCreatedOncePerMode() {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());

		CodeContainer fast = manager.getContainer(CodeContainerMode.FAST);
		assertSame(fast, manager.getContainer(CodeContainerMode.FAST));
		assertEquals(CodeContainerMode.FAST, fast.getMode());
		assertEquals(DebugMetadata.SUPPRESS_SEQUENCE_POINTS, fast.getDebugMetadata());

		CodeContainer debuggable = manager.getContainer(CodeContainerMode.DEBUGGABLE);
		assertNotSame(fast, debuggable);
		assertEquals(DebugMetadata.RETAIN_SEQUENCE_POINTS, debuggable.getDebugMetadata());
		assertNotEquals(fast.getName(), debuggable.getName());
		assertThat(fast.getName(), startsWith(CodeContainerManager.NAMESPACE + ".GeneratedSerializers"));
	}

	@Test
	public void typeSequencesHaveNoGapsUnderConcurrency() throws Exception {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());
		CodeContainer container = manager.getContainer(CodeContainerMode.FAST);
		int threads = 8;
		int perThread = 50;

		ExecutorService executor = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<List<Integer>>> futures = new ArrayList<>();
		try {
			for (int i = 0; i < threads; i++) {
				futures.add(executor.submit(() -> {
					start.await();
					List<Integer> sequences = new ArrayList<>();
					for (int j = 0; j < perThread; j++) {
						sequences.add(manager.createEmitter(container, Target.class, EmitterFlavor.FIELD_BASED).getSequence());
					}
					return sequences;
				}));
			}
			start.countDown();

			List<Integer> all = new ArrayList<>();
			for (Future<List<Integer>> future : futures) {
				all.addAll(future.get(30, TimeUnit.SECONDS));
			}
			Set<Integer> expected = IntStream.range(0, threads * perThread).boxed().collect(Collectors.toSet());
			assertEquals(threads * perThread, all.size());
			assertEquals(expected, new HashSet<>(all));
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	public void refreshReplacesContainersWithNewNames() {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());

		CodeContainer before = manager.getContainer(CodeContainerMode.FAST);
		SerializerEmitter emitterBefore = manager.createEmitter(CodeContainerMode.FAST, Target.class, EmitterFlavor.FIELD_BASED);
		Supplier<?> supplierBefore = emitterBefore.defineOperation("get", Supplier.class, value("before"));

		manager.refresh();

		CodeContainer after = manager.getContainer(CodeContainerMode.FAST);
		assertNotSame(before, after);
		assertThat(after.getSequence(), greaterThan(before.getSequence()));

		SerializerEmitter emitterAfter = manager.createEmitter(CodeContainerMode.FAST, Target.class, EmitterFlavor.FIELD_BASED);
		assertSame(after, emitterAfter.getContainer());
		assertNotEquals(emitterBefore.getTypeName(), emitterAfter.getTypeName());

		Supplier<?> supplierAfter = emitterAfter.defineOperation("get", Supplier.class, value("after"));
		assertEquals("before", supplierBefore.get());
		assertEquals("after", supplierAfter.get());
	}

	@Test
	public void containerSequencesNeverRepeatAcrossManagers() {
		Set<Integer> sequences = new HashSet<>();
		for (int i = 0; i < 10; i++) {
			CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());
			assertTrue(sequences.add(manager.getContainer(CodeContainerMode.FAST).getSequence()));
			manager.refresh();
			for (CodeContainerMode mode : CodeContainerMode.values()) {
				assertTrue(sequences.add(manager.getContainer(mode).getSequence()));
			}
		}
	}

	@Test
	public void unsupportedFlavorIsSubstituted() {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.restrictedTo(EmitterFlavor.CONTEXT_BASED));

		SerializerEmitter emitter = manager.createEmitter(CodeContainerMode.FAST, Target.class, EmitterFlavor.FIELD_BASED);

		assertEquals(EmitterFlavor.CONTEXT_BASED, emitter.getFlavor());
		assertThat(emitter, instanceOf(ContextBasedSerializerEmitter.class));
		assertFalse(manager.getCapabilities().isFlavorSupported(EmitterFlavor.FIELD_BASED));
	}

	@Test
	public void platformWithoutDynamicCodeRejectsContainers() {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.withoutDynamicCode());

		assertFalse(manager.getCapabilities().isDynamicCodeSupported());
		assertThrows(PlatformUnsupportedException.class, () -> manager.getContainer(CodeContainerMode.FAST));
		assertThrows(PlatformUnsupportedException.class,
				() -> manager.createEmitter(CodeContainerMode.FAST, Target.class, EmitterFlavor.FIELD_BASED));

		manager.refresh();
		assertThrows(PlatformUnsupportedException.class, () -> manager.getContainer(CodeContainerMode.COLLECTABLE));
	}

	@Test
	public void persistWritesJarOfDebuggableContainer() throws IOException {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());
		SerializerEmitter emitter = manager.createEmitter(CodeContainerMode.DEBUGGABLE, Target.class, EmitterFlavor.FIELD_BASED);
		emitter.defineOperation("first", Supplier.class, value("first"));
		emitter.defineOperation("second", Supplier.class, value("second"));

		CodeContainer container = emitter.getContainer();
		assertEquals(2, container.getDefinedClassesCount());

		Path dir = temporaryFolder.newFolder().toPath();
		Path jar = container.persist(dir);

		assertEquals(dir.resolve(container.getName() + ".jar"), jar);
		try (JarFile jarFile = new JarFile(jar.toFile())) {
			Set<String> entries = jarFile.stream()
					.map(JarEntry::getName)
					.filter(name -> name.endsWith(".class"))
					.collect(Collectors.toSet());
			String prefix = emitter.getTypeName().replace('.', '/');
			assertEquals(Set.of(prefix + "$first.class", prefix + "$second.class"), entries);
			assertNotNull(jarFile.getManifest());
		}
	}

	@Test
	public void persistRejectsNonDebuggableContainer() throws IOException {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());
		Path dir = temporaryFolder.newFolder().toPath();

		assertThrows(IllegalStateException.class, () -> manager.getContainer(CodeContainerMode.FAST).persist(dir));
		assertThrows(IllegalStateException.class, () -> manager.getContainer(CodeContainerMode.COLLECTABLE).persist(dir));
	}

	@Test
	public void persistPropagatesIoErrors() {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());
		CodeContainer container = manager.getContainer(CodeContainerMode.DEBUGGABLE);
		Path missing = temporaryFolder.getRoot().toPath().resolve("missing");

		assertThrows(IOException.class, () -> container.persist(missing));
	}

	@Test
	public void persistFailsOnLockedFile() throws IOException {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());
		CodeContainer container = manager.getContainer(CodeContainerMode.DEBUGGABLE);
		Path dir = temporaryFolder.newFolder().toPath();
		Path file = dir.resolve(container.getName() + ".jar");

		try (FileChannel channel = FileChannel.open(file, CREATE, WRITE);
			 FileLock ignored = channel.lock()) {
			assertThrows(FileSystemException.class, () -> container.persist(dir));
		}
		assertTrue(Files.exists(file));
	}

	@Test
	public void collectableContainerUsesSeparateClassLoaders() {
		CodeContainerManager manager = CodeContainerManager.create(PlatformCapabilities.unrestricted());
		SerializerEmitter first = manager.createEmitter(CodeContainerMode.COLLECTABLE, Target.class, EmitterFlavor.FIELD_BASED);
		SerializerEmitter second = manager.createEmitter(CodeContainerMode.COLLECTABLE, Target.class, EmitterFlavor.FIELD_BASED);

		Supplier<?> firstSupplier = first.defineOperation("get", Supplier.class, value(1));
		Supplier<?> secondSupplier = second.defineOperation("get", Supplier.class, value(2));

		assertNotSame(firstSupplier.getClass().getClassLoader(), secondSupplier.getClass().getClassLoader());
		assertEquals(0, first.getContainer().getDefinedClassesCount());
	}
}
