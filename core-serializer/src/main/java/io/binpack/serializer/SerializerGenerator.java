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

import io.binpack.codegen.container.CodeContainerManager;
import io.binpack.codegen.container.CodeContainerMode;
import io.binpack.codegen.container.EmitterFlavor;
import io.binpack.common.builder.AbstractBuilder;
import io.binpack.serializer.builder.Construct;
import io.binpack.serializer.builder.GenerationContext;
import io.binpack.serializer.builder.SerializerBuildPlan;
import io.binpack.serializer.builder.SerializerBuilder;
import io.binpack.serializer.builder.bytecode.BytecodeSerializerBuilder;
import io.binpack.serializer.builder.graph.ExpressionGraphSerializerBuilder;
import io.binpack.serializer.reflection.SerializationTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import static io.binpack.codegen.util.Utils.getEnumSetting;
import static io.binpack.common.Checks.checkArgument;

/**
 * Builds and caches serializer factories, one per type and polymorphism schema.
 * <p>
 * Serializers are compiled to bytecode where the platform allows dynamic code,
 * and to expression graphs otherwise.
 */
public final class SerializerGenerator {
	private static final Logger logger = LoggerFactory.getLogger(SerializerGenerator.class);

	public enum Mode {
		/**
		 * Bytecode if the platform supports dynamic code, expression graphs otherwise
		 */
		AUTO,
		BYTECODE,
		EXPRESSION_GRAPH
	}

	public static final Mode DEFAULT_MODE = getEnumSetting(SerializerGenerator.class, "mode", Mode.AUTO);
	public static final EmitterFlavor DEFAULT_FLAVOR = getEnumSetting(SerializerGenerator.class, "flavor", EmitterFlavor.FIELD_BASED);
	public static final CodeContainerMode DEFAULT_CONTAINER_MODE = getEnumSetting(SerializerGenerator.class, "containerMode", CodeContainerMode.FAST);

	private static volatile SerializerGenerator defaultInstance;

	private CodeContainerManager manager = CodeContainerManager.getInstance();
	private Mode mode = DEFAULT_MODE;
	private EmitterFlavor flavor = DEFAULT_FLAVOR;
	private CodeContainerMode containerMode = DEFAULT_CONTAINER_MODE;

	private SerializerBuilder<?, ?> serializerBuilder;

	private final Map<FactoryKey, SerializerFactory<?>> factories = new ConcurrentHashMap<>();

	private SerializerGenerator() {
	}

	public static SerializerGenerator create() {
		return builder().build();
	}

	/**
	 * Returns a shared generator with default settings
	 */
	public static SerializerGenerator getDefault() {
		SerializerGenerator generator = defaultInstance;
		if (generator == null) {
			synchronized (SerializerGenerator.class) {
				generator = defaultInstance;
				if (generator == null) {
					generator = create();
					defaultInstance = generator;
				}
			}
		}
		return generator;
	}

	public static Builder builder() {
		return new SerializerGenerator().new Builder();
	}

	public final class Builder extends AbstractBuilder<Builder, SerializerGenerator> {
		private Builder() {}

		public Builder withCodeContainerManager(CodeContainerManager manager) {
			checkNotBuilt(this);
			SerializerGenerator.this.manager = manager;
			return this;
		}

		public Builder withMode(Mode mode) {
			checkNotBuilt(this);
			SerializerGenerator.this.mode = mode;
			return this;
		}

		/**
		 * Sets a requested flavor, a platform may substitute another one for bytecode serializers
		 */
		public Builder withFlavor(EmitterFlavor flavor) {
			checkNotBuilt(this);
			SerializerGenerator.this.flavor = flavor;
			return this;
		}

		public Builder withContainerMode(CodeContainerMode containerMode) {
			checkNotBuilt(this);
			SerializerGenerator.this.containerMode = containerMode;
			return this;
		}

		@Override
		protected SerializerGenerator doBuild() {
			serializerBuilder = createSerializerBuilder();
			logger.debug("Created {} with {}", SerializerGenerator.this, serializerBuilder);
			return SerializerGenerator.this;
		}
	}

	private SerializerBuilder<?, ?> createSerializerBuilder() {
		switch (mode) {
			case BYTECODE -> {
				return BytecodeSerializerBuilder.create(manager, containerMode);
			}
			case EXPRESSION_GRAPH -> {
				return ExpressionGraphSerializerBuilder.create(containerMode == CodeContainerMode.DEBUGGABLE);
			}
			default -> {
				if (manager.getCapabilities().isDynamicCodeSupported()) {
					return BytecodeSerializerBuilder.create(manager, containerMode);
				}
				logger.warn("Dynamic code is not supported by the platform, serializers are built as expression graphs");
				return ExpressionGraphSerializerBuilder.create(containerMode == CodeContainerMode.DEBUGGABLE);
			}
		}
	}

	public SerializerBuilder<?, ?> getSerializerBuilder() {
		return serializerBuilder;
	}

	public EmitterFlavor getFlavor() {
		return flavor;
	}

	/**
	 * Returns a factory of serializers of a type, building it on first request
	 *
	 * @throws IllegalArgumentException if a type cannot be serialized
	 * @throws io.binpack.serializer.builder.SerializerCompilationException if generated code is inconsistent
	 */
	@SuppressWarnings("unchecked")
	public <T> SerializerFactory<T> getFactory(Class<T> type, PolymorphismSchema schema) {
		checkArgument(!type.isPrimitive() && !type.isArray(), "Cannot generate a serializer of %s", type.getName());
		return (SerializerFactory<T>) factories.computeIfAbsent(new FactoryKey(type, schema), key -> {
			SerializerFactory<?> factory = buildFactory(serializerBuilder, type, schema);
			logger.debug("Cached serializer factory of {}", type.getName());
			return factory;
		});
	}

	public <T> SerializerFactory<T> getFactory(Class<T> type) {
		return getFactory(type, PolymorphismSchema.DEFAULT);
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private <C extends GenerationContext<N>, N extends Construct> SerializerFactory<?> buildFactory(
			SerializerBuilder<C, N> builder, Class<?> type, PolymorphismSchema schema) {
		SerializerBuildPlan<C, N> plan = SerializerBuildPlan.create(builder, type, flavor);
		if (type.isEnum()) {
			return plan.buildEnumSerializer();
		}
		return plan.buildObjectSerializer(SerializationTarget.prepare(type), schema);
	}

	@Override
	public String toString() {
		return "SerializerGenerator{mode=" + mode + ", flavor=" + flavor + ", containerMode=" + containerMode + '}';
	}

	private static final class FactoryKey {
		private final Class<?> type;
		private final PolymorphismSchema schema;

		FactoryKey(Class<?> type, PolymorphismSchema schema) {
			this.type = type;
			this.schema = schema;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			FactoryKey that = (FactoryKey) o;
			return type == that.type && schema.equals(that.schema);
		}

		@Override
		public int hashCode() {
			return Objects.hash(type, schema);
		}
	}
}
