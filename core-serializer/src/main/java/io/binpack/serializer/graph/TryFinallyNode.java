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

import org.jetbrains.annotations.Nullable;

/**
 * Evaluates a finally block after a try block, whether it completes normally, breaks or throws
 */
public final class TryFinallyNode extends Node {
	private final Node tryBlock;
	private final Node finallyBlock;

	TryFinallyNode(Node tryBlock, Node finallyBlock) {
		super(tryBlock.getType());
		this.tryBlock = tryBlock;
		this.finallyBlock = finallyBlock;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator tryBlock = this.tryBlock.compile(scope);
		Evaluator finallyBlock = this.finallyBlock.compile(scope);
		return frame -> {
			try {
				return tryBlock.evaluate(frame);
			} finally {
				@Nullable BreakLabel breaking = frame.breaking;
				frame.breaking = null;
				finallyBlock.evaluate(frame);
				if (frame.breaking == null) {
					frame.breaking = breaking;
				}
			}
		};
	}

	@Override
	public String toString() {
		return "try " + tryBlock + " finally " + finallyBlock;
	}
}
