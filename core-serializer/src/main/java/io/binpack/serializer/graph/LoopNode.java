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
 * Evaluates a body until a {@link BreakNode} with the label of the loop is reached
 */
public final class LoopNode extends Node {
	private final Node body;
	private final BreakLabel label;

	LoopNode(Node body, BreakLabel label) {
		super(void.class);
		this.body = body;
		this.label = label;
	}

	public BreakLabel getLabel() {
		return label;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator body = this.body.compile(scope);
		return frame -> {
			while (true) {
				body.evaluate(frame);
				if (frame.breaking == label) {
					frame.breaking = null;
					return null;
				}
				if (frame.isBreaking()) {
					return null;
				}
			}
		};
	}

	@Override
	public String toString() {
		return label + ": loop " + body;
	}
}
