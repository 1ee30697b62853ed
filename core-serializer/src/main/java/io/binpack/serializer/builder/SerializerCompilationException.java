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

package io.binpack.serializer.builder;

/**
 * Thrown when generated code is inconsistent and cannot be compiled.
 * This indicates an error in the code that drives a builder and is not meant to be recovered from.
 */
public final class SerializerCompilationException extends RuntimeException {
	public SerializerCompilationException(String message) {
		super(message);
	}

	public SerializerCompilationException(String message, Throwable cause) {
		super(message, cause);
	}
}
