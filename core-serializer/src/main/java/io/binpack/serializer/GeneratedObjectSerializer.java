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

import io.binpack.common.Checks;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

import static io.binpack.common.Checks.checkArgument;

/**
 * A serializer of an object with named members, assembled from generated per-member operations.
 * <p>
 * An object is packed either as an array of member values or as a map from member names to values,
 * as {@link SerializationContext#getSerializationMethod()} says. Both forms are accepted when unpacking.
 * Tuple-like objects, whose members have no names, are always packed as arrays.
 */
public final class GeneratedObjectSerializer<T> extends GeneratedSerializer<T> {
	private static final boolean CHECKS = Checks.isEnabled(GeneratedObjectSerializer.class);

	public static final String CREATE_UNPACKING_CONTEXT = "createUnpackingContext";
	public static final String CREATE_OBJECT_FROM_CONTEXT = "createObjectFromContext";

	private final List<PackOperation<T>> packOperations;
	private final Map<String, PackOperation<T>> packOperationTable;
	private final List<UnpackOperation<T>> unpackOperations;
	private final Map<String, UnpackOperation<T>> unpackOperationTable;
	private final List<String> memberNames;

	private final Delegate0 createUnpackingContext;
	private final Delegate1 createObjectFromContext;

	public GeneratedObjectSerializer(SerializationContext context, Class<T> targetType, PolymorphismSchema polymorphismSchema,
			List<PackOperation<T>> packOperations, Map<String, PackOperation<T>> packOperationTable,
			List<UnpackOperation<T>> unpackOperations, Map<String, UnpackOperation<T>> unpackOperationTable,
			List<String> memberNames, List<Object> constants, Map<String, Object> delegates) {
		super(context, targetType, polymorphismSchema, constants, delegates);
		this.packOperations = packOperations;
		this.packOperationTable = packOperationTable;
		this.unpackOperations = unpackOperations;
		this.unpackOperationTable = unpackOperationTable;
		this.memberNames = memberNames;
		this.createUnpackingContext = (Delegate0) getDelegate(CREATE_UNPACKING_CONTEXT);
		this.createObjectFromContext = (Delegate1) getDelegate(CREATE_OBJECT_FROM_CONTEXT);
		if (!Packable.class.isAssignableFrom(targetType)) {
			checkArgument(packOperations.size() == memberNames.size(), "Expected %s pack operations, got %s",
					memberNames.size(), packOperations.size());
		}
	}

	public List<String> getMemberNames() {
		return memberNames;
	}

	public List<PackOperation<T>> getPackOperations() {
		return packOperations;
	}

	public Map<String, PackOperation<T>> getPackOperationTable() {
		return packOperationTable;
	}

	public List<UnpackOperation<T>> getUnpackOperations() {
		return unpackOperations;
	}

	public Map<String, UnpackOperation<T>> getUnpackOperationTable() {
		return unpackOperationTable;
	}

	@Override
	public void packTo(Packer packer, @Nullable T value) {
		if (value == null) {
			packer.writeNil();
			return;
		}
		if (value instanceof Packable) {
			((Packable) value).packTo(packer, context);
			return;
		}
		if (context.getSerializationMethod() == SerializationMethod.MAP && !packOperationTable.isEmpty()) {
			packer.writeMapHeader(memberNames.size());
			for (String memberName : memberNames) {
				packer.writeString(memberName);
				packOperationTable.get(memberName).pack(this, context, packer, value);
			}
		} else {
			packer.writeArrayHeader(packOperations.size());
			for (PackOperation<T> operation : packOperations) {
				operation.pack(this, context, packer, value);
			}
		}
	}

	@SuppressWarnings("unchecked")
	@Override
	public @Nullable T unpackFrom(Unpacker unpacker) {
		if (unpacker.tryReadNil()) return null;
		Object unpackingContext = createUnpackingContext.invoke(this);
		if (unpackingContext instanceof Unpackable) {
			((Unpackable) unpackingContext).unpackFrom(unpacker, context);
		} else if (unpacker.peekType() == ValueType.MAP) {
			int itemsCount = unpacker.readMapHeader();
			for (int i = 0; i < itemsCount; i++) {
				String memberName = unpacker.readString();
				UnpackOperation<T> operation = memberName != null ? unpackOperationTable.get(memberName) : null;
				if (operation == null) {
					unpacker.skip();
					continue;
				}
				operation.unpack(this, context, unpacker, unpackingContext, i, itemsCount);
			}
		} else {
			int itemsCount = unpacker.readArrayHeader();
			for (int i = 0; i < itemsCount; i++) {
				if (i >= unpackOperations.size()) {
					unpacker.skip();
					continue;
				}
				unpackOperations.get(i).unpack(this, context, unpacker, unpackingContext, i, itemsCount);
			}
		}
		Object result = createObjectFromContext.invoke(this, unpackingContext);
		if (CHECKS) {
			checkArgument(targetType.isInstance(result), "Unpacked %s is not an instance of %s", result, targetType);
		}
		return (T) result;
	}
}
