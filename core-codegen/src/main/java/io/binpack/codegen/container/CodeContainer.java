/*
 * Copyright (C) 2020 ActiveJ LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.binpack.codegen.container;

import io.binpack.codegen.DefiningClassLoader;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileSystemException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

import static io.binpack.codegen.util.Utils.getPathSetting;
import static io.binpack.common.Checks.checkState;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;
import static java.util.jar.Attributes.Name.MANIFEST_VERSION;

/**
 * An append-only namespace of generated classes.
 * <p>
 * The mode of a container never changes. Generated classes are named after the container,
 * so that classes of different containers never collide.
 */
public final class CodeContainer {
	private static final Logger logger = LoggerFactory.getLogger(CodeContainer.class);

	public static final @Nullable Path DEFAULT_DEBUG_OUTPUT_DIR = getPathSetting(CodeContainer.class, "debugOutputDir", null);

	private final String name;
	private final int sequence;
	private final CodeContainerMode mode;
	private final DebugMetadata debugMetadata;
	private final ClassLoader parentClassLoader;
	private final @Nullable DefiningClassLoader sharedClassLoader;

	private final AtomicInteger typeSequence = new AtomicInteger();

	CodeContainer(String name, int sequence, CodeContainerMode mode, ClassLoader parentClassLoader) {
		this.name = name;
		this.sequence = sequence;
		this.mode = mode;
		this.debugMetadata = DebugMetadata.forMode(mode);
		this.parentClassLoader = parentClassLoader;
		this.sharedClassLoader = switch (mode) {
			case FAST -> DefiningClassLoader.create(parentClassLoader);
			case DEBUGGABLE -> DefiningClassLoader.builder(parentClassLoader)
					.withRetainedBytecode()
					.withDebugOutputDir(DEFAULT_DEBUG_OUTPUT_DIR)
					.build();
			case COLLECTABLE -> null;
		};
	}

	public String getName() {
		return name;
	}

	public int getSequence() {
		return sequence;
	}

	public CodeContainerMode getMode() {
		return mode;
	}

	public DebugMetadata getDebugMetadata() {
		return debugMetadata;
	}

	int nextTypeSequence() {
		return typeSequence.getAndIncrement();
	}

	/**
	 * Returns a class loader for the classes of a single target type.
	 * Collectable containers create a separate class loader for each type.
	 */
	DefiningClassLoader getTypeClassLoader() {
		return sharedClassLoader != null ? sharedClassLoader : DefiningClassLoader.create(parentClassLoader);
	}

	/**
	 * Returns the number of classes defined in this container so far,
	 * always {@code 0} for collectable containers, which do not track their classes
	 */
	public int getDefinedClassesCount() {
		return sharedClassLoader != null ? sharedClassLoader.getDefinedClassesCount() : 0;
	}

	/**
	 * Writes all classes generated so far into {@code <directory>/<name>.jar}
	 *
	 * @param directory an existing directory
	 * @return path of the written file
	 * @throws IllegalStateException if this container is not debuggable
	 * @throws FileSystemException   if the target file is locked by another writer
	 * @throws IOException           if the file could not be written
	 */
	public Path persist(Path directory) throws IOException {
		checkState(mode == CodeContainerMode.DEBUGGABLE, "Only debuggable containers can be persisted, %s is %s", name, mode);
		assert sharedClassLoader != null;

		Map<String, byte[]> classes = sharedClassLoader.getRetainedBytecode();
		Path file = directory.resolve(name + ".jar");

		try (FileChannel channel = FileChannel.open(file, CREATE, WRITE)) {
			FileLock lock;
			try {
				lock = channel.tryLock();
			} catch (OverlappingFileLockException e) {
				lock = null;
			}
			if (lock == null) {
				throw new FileSystemException(file.toString(), null, "File is locked by another writer");
			}
			try {
				channel.truncate(0);
				Manifest manifest = new Manifest();
				manifest.getMainAttributes().put(MANIFEST_VERSION, "1.0");
				OutputStream out = Channels.newOutputStream(channel);
				JarOutputStream jar = new JarOutputStream(out, manifest);
				for (Map.Entry<String, byte[]> entry : classes.entrySet()) {
					jar.putNextEntry(new JarEntry(entry.getKey().replace('.', '/') + ".class"));
					jar.write(entry.getValue());
					jar.closeEntry();
				}
				jar.finish();
				out.flush();
			} finally {
				lock.release();
			}
		}
		logger.debug("Persisted {} classes of {} to {}", classes.size(), name, file);
		return file;
	}

	@Override
	public String toString() {
		return "CodeContainer{" +
				"name='" + name + '\'' +
				", mode=" + mode +
				'}';
	}
}
