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

/**
 * Kinds of code containers, exactly one container of each kind exists at a time
 */
public enum CodeContainerMode {
	/**
	 * Transient, optimized for throughput, never persisted
	 */
	FAST,
	/**
	 * Retains generated bytecode and line numbers, may be persisted for inspection
	 */
	DEBUGGABLE,
	/**
	 * Transient, generated classes of a type are unloaded once its serializers become unreachable
	 */
	COLLECTABLE
}
