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

package io.binpack.codegen.util;

import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Type;

/**
 * Computes stack map frames of a generated class, resolving the classes it refers to
 * through the loader that is going to define it
 */
public final class DefiningClassWriter extends ClassWriter {
	private static final String OBJECT = Type.getInternalName(Object.class);

	private final ClassLoader classLoader;

	public DefiningClassWriter(ClassLoader classLoader) {
		super(ClassWriter.COMPUTE_FRAMES);
		this.classLoader = classLoader;
	}

	@Override
	protected String getCommonSuperClass(String type1, String type2) {
		Class<?> first = resolve(type1);
		Class<?> second = resolve(type2);
		if (first.isAssignableFrom(second)) return type1;
		if (second.isAssignableFrom(first)) return type2;
		// frames only need a common class, interfaces are verified at the call
		if (first.isInterface() || second.isInterface()) return OBJECT;
		Class<?> common = first.getSuperclass();
		while (!common.isAssignableFrom(second)) {
			common = common.getSuperclass();
		}
		return Type.getInternalName(common);
	}

	private Class<?> resolve(String internalName) {
		try {
			return Class.forName(internalName.replace('/', '.'), false, classLoader);
		} catch (ClassNotFoundException e) {
			throw new IllegalStateException("Generated code refers to " + internalName + ", which its class loader cannot find", e);
		}
	}
}
