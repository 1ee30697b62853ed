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

package io.binpack.codegen;

import io.binpack.common.builder.AbstractBuilder;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static io.binpack.codegen.util.Utils.getPathSetting;

/**
 * A {@link ClassLoader} for defining dynamically generated classes.
 * <p>
 * To simply define a new class from a bytecode use {@link #defineClass(String, byte[])} method.
 * A class loader built {@link Builder#withRetainedBytecode() with retained bytecode} keeps the bytecode
 * of every defined class, so that it can be persisted later.
 */
@SuppressWarnings("WeakerAccess")
public final class DefiningClassLoader extends ClassLoader {
	public static final Path DEFAULT_DEBUG_OUTPUT_DIR = getPathSetting(DefiningClassLoader.class, "debugOutputDir", null);

	private final Map<String, Class<?>> definedClasses = new ConcurrentHashMap<>();
	private @Nullable Map<String, byte[]> retainedBytecode;

	private @Nullable Path debugOutputDir = DEFAULT_DEBUG_OUTPUT_DIR;

	private DefiningClassLoader(ClassLoader parent) {
		super(parent);
	}

	/**
	 * Creates a new instance of {@code DefiningClassLoader}
	 * with a context class loader of the current thread as a parent class loader
	 */
	public static DefiningClassLoader create() {
		return builder().build();
	}

	/**
	 * Creates a new instance of {@code DefiningClassLoader}
	 * with given class loader as a parent class loader
	 *
	 * @param parent parent class loader
	 */
	public static DefiningClassLoader create(ClassLoader parent) {
		return builder(parent).build();
	}

	public static Builder builder() {
		return builder(Thread.currentThread().getContextClassLoader());
	}

	public static Builder builder(ClassLoader parent) {
		return new DefiningClassLoader(parent).new Builder();
	}

	public final class Builder extends AbstractBuilder<Builder, DefiningClassLoader> {
		private Builder() {}

		/**
		 * Keeps the bytecode of every defined class in memory
		 */
		public Builder withRetainedBytecode() {
			checkNotBuilt(this);
			DefiningClassLoader.this.retainedBytecode = new LinkedHashMap<>();
			return this;
		}

		/**
		 * Writes all classes to the specified directory once a class is defined.
		 * <p>
		 * If a directory does not exist when class is defined, a runtime error will be thrown.
		 *
		 * @param debugOutputDir directory where bytecode would be written to for debug purposes
		 */
		public Builder withDebugOutputDir(@Nullable Path debugOutputDir) {
			checkNotBuilt(this);
			DefiningClassLoader.this.debugOutputDir = debugOutputDir;
			return this;
		}

		@Override
		protected DefiningClassLoader doBuild() {
			return DefiningClassLoader.this;
		}
	}

	/**
	 * Defines a class using a given class name and bytecode
	 *
	 * @param className name of a defined class
	 * @param bytecode  bytecode of a defined class
	 * @return newly defined class
	 */
	public Class<?> defineClass(String className, byte[] bytecode) {
		Class<?> aClass = super.defineClass(className, bytecode, 0, bytecode.length);
		definedClasses.put(className, aClass);
		if (retainedBytecode != null) {
			synchronized (this) {
				retainedBytecode.put(className, bytecode);
			}
		}
		if (debugOutputDir != null) {
			try {
				Files.write(debugOutputDir.resolve(className + ".class"), bytecode);
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}
		return aClass;
	}

	public boolean isBytecodeRetained() {
		return retainedBytecode != null;
	}

	/**
	 * Returns a snapshot of the retained bytecode, keyed by class name in the order of definition
	 *
	 * @throws IllegalStateException if this class loader does not retain bytecode
	 */
	public synchronized Map<String, byte[]> getRetainedBytecode() {
		if (retainedBytecode == null) {
			throw new IllegalStateException("Bytecode is not retained by this class loader");
		}
		return new LinkedHashMap<>(retainedBytecode);
	}

	public Set<String> getDefinedClassNames() {
		return Set.copyOf(definedClasses.keySet());
	}

	public int getDefinedClassesCount() {
		return definedClasses.size();
	}

	static <T> T createInstance(Class<T> aClass, Object[] arguments) {
		try {
			return aClass
					.getConstructor(Arrays.stream(arguments).map(Object::getClass).toArray(Class<?>[]::new))
					.newInstance(arguments);
		} catch (InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
			throw new IllegalStateException("Could not create an instance of " + aClass.getName(), e);
		}
	}

	@Override
	public String toString() {
		return "DefiningClassLoader{classes=" + definedClasses.size() + '}';
	}
}
