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

import io.binpack.common.builder.AbstractBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static io.binpack.common.Checks.checkArgument;

/**
 * Process-wide serialization settings together with a cache of serializers built for them.
 * <p>
 * Serializers of members are looked up here at run time, so every serializer created
 * for a context packs its members with the settings of that context.
 */
public final class SerializationContext {
	private static final Logger logger = LoggerFactory.getLogger(SerializationContext.class);

	private SerializationMethod serializationMethod = SerializationMethod.ARRAY;
	private EnumSerializationMethod enumSerializationMethod = EnumSerializationMethod.BY_NAME;
	private final Map<Class<?>, EnumSerializationMethod> enumSerializationMethods = new HashMap<>();
	private SerializerGenerator generator;

	private final Map<Class<?>, PackSerializer<?>> serializers = new ConcurrentHashMap<>();

	private SerializationContext() {
	}

	public static SerializationContext create() {
		return builder().build();
	}

	public static Builder builder() {
		return new SerializationContext().new Builder();
	}

	public final class Builder extends AbstractBuilder<Builder, SerializationContext> {
		private Builder() {}

		public Builder withSerializationMethod(SerializationMethod serializationMethod) {
			checkNotBuilt(this);
			SerializationContext.this.serializationMethod = serializationMethod;
			return this;
		}

		/**
		 * Sets how enums are serialized unless a type has its own setting
		 */
		public Builder withEnumSerializationMethod(EnumSerializationMethod method) {
			checkNotBuilt(this);
			SerializationContext.this.enumSerializationMethod = method;
			return this;
		}

		public Builder withEnumSerializationMethod(Class<? extends Enum<?>> enumType, EnumSerializationMethod method) {
			checkNotBuilt(this);
			SerializationContext.this.enumSerializationMethods.put(enumType, method);
			return this;
		}

		public Builder withGenerator(SerializerGenerator generator) {
			checkNotBuilt(this);
			SerializationContext.this.generator = generator;
			return this;
		}

		/**
		 * Uses a given serializer for a type instead of a generated one
		 */
		public <T> Builder withSerializer(Class<T> type, PackSerializer<T> serializer) {
			checkNotBuilt(this);
			checkArgument(serializer.getTargetType() == type, "Serializer of %s cannot be used for %s", serializer.getTargetType(), type);
			SerializationContext.this.serializers.put(type, serializer);
			return this;
		}

		@Override
		protected SerializationContext doBuild() {
			if (generator == null) {
				generator = SerializerGenerator.getDefault();
			}
			return SerializationContext.this;
		}
	}

	public SerializationMethod getSerializationMethod() {
		return serializationMethod;
	}

	public EnumSerializationMethod getEnumSerializationMethod(Class<?> enumType) {
		return enumSerializationMethods.getOrDefault(enumType, enumSerializationMethod);
	}

	public SerializerGenerator getGenerator() {
		return generator;
	}

	/**
	 * Returns a serializer of the given type, building it on first request
	 */
	@SuppressWarnings("unchecked")
	public <T> PackSerializer<T> getSerializer(Class<T> type) {
		PackSerializer<?> serializer = serializers.get(type);
		if (serializer != null) {
			return (PackSerializer<T>) serializer;
		}
		serializer = BuiltinSerializers.create(this, type);
		if (serializer == null) {
			serializer = generator.getFactory(type, PolymorphismSchema.DEFAULT).create(this);
			logger.debug("Created serializer {} for {}", serializer, type.getName());
		}
		PackSerializer<?> existing = serializers.putIfAbsent(type, serializer);
		return (PackSerializer<T>) (existing != null ? existing : serializer);
	}

	@Override
	public String toString() {
		return "SerializationContext{" +
				"serializationMethod=" + serializationMethod +
				", enumSerializationMethod=" + enumSerializationMethod +
				", serializers=" + serializers.size() +
				'}';
	}
}
