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

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Serializers of primitive wrappers and strings, which are never generated
 */
final class BuiltinSerializers {
	private static final Map<Class<?>, Function<SerializationContext, PackSerializer<?>>> FACTORIES = new HashMap<>();

	static {
		register(Boolean.class, boolean.class, Packer::writeBoolean, Unpacker::readBoolean);
		register(Byte.class, byte.class, (p, v) -> p.writeInt(v), u -> (byte) u.readInt());
		register(Short.class, short.class, (p, v) -> p.writeInt(v), u -> (short) u.readInt());
		register(Character.class, char.class, (p, v) -> p.writeInt(v), u -> (char) u.readInt());
		register(Integer.class, int.class, Packer::writeInt, Unpacker::readInt);
		register(Long.class, long.class, Packer::writeLong, Unpacker::readLong);
		register(Float.class, float.class, Packer::writeFloat, Unpacker::readFloat);
		register(Double.class, double.class, Packer::writeDouble, Unpacker::readDouble);
		register(String.class, null, Packer::writeString, Unpacker::readString);
	}

	private BuiltinSerializers() {
	}

	private static <T> void register(Class<T> type, @Nullable Class<?> primitiveType,
			BiConsumer<Packer, T> writer, Function<Unpacker, T> reader) {
		Function<SerializationContext, PackSerializer<?>> factory = context -> new ValueSerializer<>(context, type, writer, reader);
		FACTORIES.put(type, factory);
		if (primitiveType != null) {
			FACTORIES.put(primitiveType, factory);
		}
	}

	static @Nullable PackSerializer<?> create(SerializationContext context, Class<?> type) {
		Function<SerializationContext, PackSerializer<?>> factory = FACTORIES.get(type);
		return factory != null ? factory.apply(context) : null;
	}

	static boolean isBuiltin(Class<?> type) {
		return FACTORIES.containsKey(type);
	}

	private static final class ValueSerializer<T> extends PackSerializer<T> {
		private final BiConsumer<Packer, T> writer;
		private final Function<Unpacker, T> reader;

		ValueSerializer(SerializationContext context, Class<T> type, BiConsumer<Packer, T> writer, Function<Unpacker, T> reader) {
			super(context, type);
			this.writer = writer;
			this.reader = reader;
		}

		@Override
		public void packTo(Packer packer, @Nullable T value) {
			if (value == null) {
				packer.writeNil();
				return;
			}
			writer.accept(packer, value);
		}

		@Override
		public @Nullable T unpackFrom(Unpacker unpacker) {
			if (unpacker.tryReadNil()) return null;
			return reader.apply(unpacker);
		}
	}
}
