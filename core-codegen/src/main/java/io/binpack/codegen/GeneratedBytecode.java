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

import java.util.function.Consumer;

/**
 * Class bytes produced by a {@link ClassBuilder}, not yet defined into a class loader
 */
public final class GeneratedBytecode {
	private final String className;
	private final byte[] bytecode;
	private final Consumer<Class<?>> initializer;
	private final Runnable onFailure;

	GeneratedBytecode(String className, byte[] bytecode, Consumer<Class<?>> initializer, Runnable onFailure) {
		this.className = className;
		this.bytecode = bytecode;
		this.initializer = initializer;
		this.onFailure = onFailure;
	}

	public String getClassName() {
		return className;
	}

	public int size() {
		return bytecode.length;
	}

	/**
	 * Defines the class and runs its static initializer
	 */
	public Class<?> defineClass(DefiningClassLoader classLoader) {
		Class<?> definedClass;
		try {
			definedClass = classLoader.defineClass(className, bytecode);
		} catch (RuntimeException | LinkageError e) {
			onFailure.run();
			throw e;
		}
		initializer.accept(definedClass);
		return definedClass;
	}
}
