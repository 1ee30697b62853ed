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

package io.binpack.codegen.container;

import io.binpack.codegen.expression.Expression;

import static io.binpack.codegen.expression.Expressions.value;

/**
 * Keeps every non-literal constant in a static final field of the generated class
 */
public final class FieldBasedSerializerEmitter extends SerializerEmitter {
	FieldBasedSerializerEmitter(CodeContainer container, Class<?> targetType, int sequence) {
		super(container, targetType, sequence);
	}

	@Override
	public EmitterFlavor getFlavor() {
		return EmitterFlavor.FIELD_BASED;
	}

	@Override
	public Expression constant(Object value, Class<?> type) {
		return value(value, type);
	}
}
