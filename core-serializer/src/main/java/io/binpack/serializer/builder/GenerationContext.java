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

import io.binpack.codegen.container.EmitterFlavor;
import io.binpack.serializer.reflection.MethodDefinition;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Supplier;

import static io.binpack.common.Checks.checkArgument;
import static io.binpack.common.Checks.checkState;

/**
 * State of a serializer being generated for a single target type.
 * <p>
 * A context collects helpers and delegates defined by a {@link SerializerBuilder}, and the operation lists
 * that become the serializer. It moves from {@link State#OPEN} to {@link State#FINISHED} when the serializer
 * starts to be assembled and to {@link State#COMPILED} once it is assembled. Nothing can be emitted
 * into a context that is not open.
 * <p>
 * A context is used by a single thread.
 *
 * @param <N> type of constructs of a backend
 */
public abstract class GenerationContext<N extends Construct> {
	public enum State {
		OPEN, FINISHED, COMPILED
	}

	protected final Class<?> targetType;
	protected final EmitterFlavor flavor;

	private State state = State.OPEN;

	private final Map<String, MethodDefinition> helpers = new LinkedHashMap<>();
	private final Map<String, Object> helperInstances = new HashMap<>();
	private final Map<String, Object> delegates = new LinkedHashMap<>();

	private @Nullable N packOperations;
	private @Nullable N packOperationTable;
	private @Nullable N unpackOperations;
	private @Nullable N unpackOperationTable;
	private @Nullable N memberNames;

	private Map<String, N> locals = new LinkedHashMap<>();
	private List<N> parameters = List.of();
	private int localCounter;

	protected GenerationContext(Class<?> targetType, EmitterFlavor flavor) {
		this.targetType = targetType;
		this.flavor = flavor;
	}

	public final Class<?> getTargetType() {
		return targetType;
	}

	/**
	 * Returns a flavor that is actually used, which may differ from a requested one
	 */
	public final EmitterFlavor getFlavor() {
		return flavor;
	}

	public final State getState() {
		return state;
	}

	/**
	 * @throws IllegalStateException if the context is not open
	 */
	public final void checkOpen() {
		checkState(state == State.OPEN, "Context of %s is %s, nothing can be emitted", targetType.getName(), state);
	}

	public final void finish() {
		checkState(state == State.OPEN, "Context of %s is already %s", targetType.getName(), state);
		state = State.FINISHED;
	}

	public final void markCompiled() {
		checkState(state == State.FINISHED, "Context of %s is %s, expected FINISHED", targetType.getName(), state);
		state = State.COMPILED;
	}

	// region helpers and delegates
	public final void registerHelper(MethodDefinition definition, Object instance) {
		checkOpen();
		checkArgument(definition.isHelper(), "Not a helper: %s", definition);
		checkArgument(!helpers.containsKey(definition.getName()), "Helper %s is already defined", definition.getName());
		helpers.put(definition.getName(), definition);
		helperInstances.put(definition.getName(), instance);
	}

	public final boolean hasHelper(String name) {
		return helpers.containsKey(name);
	}

	public final MethodDefinition getHelper(String name) {
		MethodDefinition definition = helpers.get(name);
		checkArgument(definition != null, "Helper %s is not defined", name);
		return definition;
	}

	/**
	 * Returns a compiled instance of a helper, which implements its delegate type
	 */
	public final Object getHelperInstance(String name) {
		Object instance = helperInstances.get(name);
		checkArgument(instance != null, "Helper %s is not defined", name);
		return instance;
	}

	public final Collection<MethodDefinition> getHelpers() {
		return Collections.unmodifiableCollection(helpers.values());
	}

	/**
	 * Makes a delegate available to the serializer under a given name
	 */
	public final void exposeDelegate(String name, Object delegate) {
		Object existing = delegates.putIfAbsent(name, delegate);
		checkArgument(existing == null || existing == delegate, "Another delegate is already exposed as %s", name);
	}

	public final @Nullable Object getExposedDelegate(String name) {
		return delegates.get(name);
	}

	public final Map<String, Object> getDelegates() {
		return Collections.unmodifiableMap(delegates);
	}
	// endregion

	// region operation lists
	public final void setPackOperations(N packOperations) {
		checkOpen();
		this.packOperations = packOperations;
	}

	public final void setPackOperationTable(N packOperationTable) {
		checkOpen();
		this.packOperationTable = packOperationTable;
	}

	public final void setUnpackOperations(N unpackOperations) {
		checkOpen();
		this.unpackOperations = unpackOperations;
	}

	public final void setUnpackOperationTable(N unpackOperationTable) {
		checkOpen();
		this.unpackOperationTable = unpackOperationTable;
	}

	public final void setMemberNames(N memberNames) {
		checkOpen();
		this.memberNames = memberNames;
	}

	public final @Nullable N getPackOperations() {
		return packOperations;
	}

	public final @Nullable N getPackOperationTable() {
		return packOperationTable;
	}

	public final @Nullable N getUnpackOperations() {
		return unpackOperations;
	}

	public final @Nullable N getUnpackOperationTable() {
		return unpackOperationTable;
	}

	public final @Nullable N getMemberNames() {
		return memberNames;
	}
	// endregion

	// region scopes
	/**
	 * Emits the body of a helper: locals declared by the emitter are not visible outside of it,
	 * and {@link #getParameter(int)} returns the helper's parameters
	 */
	public final <R> R withinScope(List<N> parameters, Supplier<R> emitter) {
		Map<String, N> outerLocals = this.locals;
		List<N> outerParameters = this.parameters;
		this.locals = new LinkedHashMap<>();
		this.parameters = List.copyOf(parameters);
		try {
			return emitter.get();
		} finally {
			this.locals = outerLocals;
			this.parameters = outerParameters;
		}
	}

	public final N getParameter(int index) {
		checkArgument(index >= 0 && index < parameters.size(), "No parameter #%s in the current scope of %s",
				index, targetType.getName());
		return parameters.get(index);
	}

	public final @Nullable N getLocal(String name) {
		return locals.get(name);
	}

	public final void putLocal(String name, N local) {
		locals.put(name, local);
	}

	/**
	 * Returns locals declared in the current scope
	 */
	public final Collection<N> getLocals() {
		return List.copyOf(locals.values());
	}

	/**
	 * Returns a name of a local variable that does not clash with other names of this context
	 */
	public final String newLocalName(String prefix) {
		return prefix + '$' + localCounter++;
	}
	// endregion

	@Override
	public String toString() {
		return getClass().getSimpleName() + '{' + targetType.getSimpleName() + ' ' + flavor + ' ' + state + '}';
	}
}
