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

public enum DebugMetadata {
	RETAIN_SEQUENCE_POINTS,
	SUPPRESS_SEQUENCE_POINTS;

	static DebugMetadata forMode(CodeContainerMode mode) {
		return mode == CodeContainerMode.DEBUGGABLE ? RETAIN_SEQUENCE_POINTS : SUPPRESS_SEQUENCE_POINTS;
	}
}
