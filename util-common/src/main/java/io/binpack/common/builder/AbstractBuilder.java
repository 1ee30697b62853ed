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

package io.binpack.common.builder;

import static io.binpack.common.Checks.checkNotNull;
import static io.binpack.common.Checks.checkState;

/**
 * Base class for single-use builders: every {@code with*} method must call
 * {@link #checkNotBuilt(AbstractBuilder)} and {@link #build()} may be called only once.
 *
 * @param <B> a concrete builder type
 * @param <T> a type of built instance
 */
public abstract class AbstractBuilder<B extends AbstractBuilder<B, T>, T> implements Builder<T> {
	private boolean built;

	public final boolean isBuilt() {
		return built;
	}

	protected static void checkNotBuilt(AbstractBuilder<?, ?> self) {
		checkState(!self.built, "Builder has already been used");
	}

	@Override
	public final T build() {
		checkNotBuilt(this);
		built = true;
		T instance = doBuild();
		checkNotNull(instance);
		return instance;
	}

	protected abstract T doBuild();
}
