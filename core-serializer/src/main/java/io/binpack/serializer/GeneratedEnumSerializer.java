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

import java.util.List;
import java.util.Map;

/**
 * A serializer of an enum, which is packed either by name or by its underlying value.
 * <p>
 * The method is taken from the {@link SerializationContext} on every call. Both forms are accepted when unpacking.
 */
public final class GeneratedEnumSerializer<E extends Enum<E>> extends GeneratedSerializer<E> {
	public static final String PACK_UNDERLYING_VALUE_TO = "packUnderlyingValueTo";
	public static final String UNPACK_FROM_UNDERLYING_VALUE = "unpackFromUnderlyingValue";

	private final Delegate2 packUnderlyingValueTo;
	private final Delegate1 unpackFromUnderlyingValue;

	public GeneratedEnumSerializer(SerializationContext context, Class<E> targetType, PolymorphismSchema polymorphismSchema,
			Delegate2 packUnderlyingValueTo, Delegate1 unpackFromUnderlyingValue,
			List<Object> constants, Map<String, Object> delegates) {
		super(context, targetType, polymorphismSchema, constants, delegates);
		this.packUnderlyingValueTo = packUnderlyingValueTo;
		this.unpackFromUnderlyingValue = unpackFromUnderlyingValue;
	}

	@Override
	public void packTo(Packer packer, @Nullable E value) {
		if (value == null) {
			packer.writeNil();
			return;
		}
		if (context.getEnumSerializationMethod(targetType) == EnumSerializationMethod.BY_NAME) {
			packer.writeString(value.name());
		} else {
			packUnderlyingValueTo.invoke(this, packer, value);
		}
	}

	@Override
	public @Nullable E unpackFrom(Unpacker unpacker) {
		if (unpacker.tryReadNil()) return null;
		if (unpacker.peekType() == ValueType.STRING) {
			String name = unpacker.readString();
			try {
				return Enum.valueOf(targetType, name);
			} catch (IllegalArgumentException e) {
				throw new CorruptedDataException("Unknown constant '" + name + "' of " + targetType.getName());
			}
		}
		try {
			return targetType.cast(unpackFromUnderlyingValue.invoke(this, unpacker));
		} catch (ArrayIndexOutOfBoundsException e) {
			throw new CorruptedDataException("Unknown ordinal of " + targetType.getName(), e);
		}
	}
}
