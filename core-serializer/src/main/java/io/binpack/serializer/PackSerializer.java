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

/**
 * Packs and unpacks values of a single type
 *
 * @param <T> type of serialized values
 */
public abstract class PackSerializer<T> {
	protected final SerializationContext context;
	protected final Class<T> targetType;

	protected PackSerializer(SerializationContext context, Class<T> targetType) {
		this.context = context;
		this.targetType = targetType;
	}

	public final SerializationContext getSerializationContext() {
		return context;
	}

	public final Class<T> getTargetType() {
		return targetType;
	}

	/**
	 * Writes a value, {@code null} is written as nil
	 */
	public abstract void packTo(Packer packer, @Nullable T value);

	/**
	 * Reads a value, nil is read as {@code null}
	 */
	public abstract @Nullable T unpackFrom(Unpacker unpacker);

	public final byte[] pack(@Nullable T value) {
		Packer packer = new Packer();
		packTo(packer, value);
		return packer.toByteArray();
	}

	/**
	 * Reads a value that must occupy the whole array
	 */
	public final @Nullable T unpack(byte[] bytes) {
		Unpacker unpacker = new Unpacker(bytes);
		T value = unpackFrom(unpacker);
		if (unpacker.hasRemaining()) {
			throw new CorruptedDataException("Unexpected data after a value of " + targetType.getName() +
					" at position " + unpacker.pos());
		}
		return value;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + '{' + targetType.getName() + '}';
	}
}
