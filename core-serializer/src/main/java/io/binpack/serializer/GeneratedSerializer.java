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

package io.binpack.serializer;

import io.binpack.codegen.container.ConstantPool;

import java.util.List;
import java.util.Map;

/**
 * Base class of serializers assembled from generated operations.
 * <p>
 * Generated code receives the serializer as its first argument and reads captured constants
 * and named helpers from it.
 */
public abstract class GeneratedSerializer<T> extends PackSerializer<T> implements ConstantPool, DelegateTable {
	private final PolymorphismSchema polymorphismSchema;
	private final List<Object> constants;
	private final Map<String, Object> delegates;

	protected GeneratedSerializer(SerializationContext context, Class<T> targetType, PolymorphismSchema polymorphismSchema,
			List<Object> constants, Map<String, Object> delegates) {
		super(context, targetType);
		this.polymorphismSchema = polymorphismSchema;
		this.constants = constants;
		this.delegates = delegates;
	}

	public final PolymorphismSchema getPolymorphismSchema() {
		return polymorphismSchema;
	}

	@Override
	public final Object getConstant(int index) {
		return constants.get(index);
	}

	@Override
	public final Object getDelegate(String name) {
		Object delegate = delegates.get(name);
		if (delegate == null) {
			throw new IllegalArgumentException("No delegate '" + name + "' in serializer of " + targetType.getName());
		}
		return delegate;
	}

	public final Map<String, Object> getDelegates() {
		return delegates;
	}
}
