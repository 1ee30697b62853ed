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

package io.binpack.serializer.builder.bytecode;

import io.binpack.codegen.container.ConstantTable;
import io.binpack.codegen.container.ContextBasedSerializerEmitter;
import io.binpack.codegen.container.SerializerEmitter;
import io.binpack.serializer.builder.GenerationContext;
import org.jetbrains.annotations.Nullable;

/**
 * A generation context backed by an emitter of a code container.
 * The flavor of the context is the flavor of its emitter.
 */
public final class BytecodeGenerationContext extends GenerationContext<BytecodeConstruct> {
	private final SerializerEmitter emitter;

	BytecodeGenerationContext(SerializerEmitter emitter) {
		super(emitter.getTargetType(), emitter.getFlavor());
		this.emitter = emitter;
	}

	public SerializerEmitter getEmitter() {
		return emitter;
	}

	/**
	 * Returns constants of a context-based emitter, or {@code null} if constants are kept in generated classes
	 */
	public @Nullable ConstantTable getConstantTable() {
		return emitter instanceof ContextBasedSerializerEmitter ?
				((ContextBasedSerializerEmitter) emitter).getConstantPool() :
				null;
	}
}
