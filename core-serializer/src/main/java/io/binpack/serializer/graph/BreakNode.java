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

package io.binpack.serializer.graph;

/**
 * Leaves the loop with a given label. Statements of enclosing blocks that follow it are skipped.
 */
public final class BreakNode extends Node {
	private final BreakLabel label;

	BreakNode(BreakLabel label) {
		super(void.class);
		this.label = label;
	}

	public BreakLabel getLabel() {
		return label;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		return frame -> {
			frame.breaking = label;
			return null;
		};
	}

	@Override
	public String toString() {
		return "break " + label;
	}
}
