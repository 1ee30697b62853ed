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

import io.binpack.codegen.ClassBuilder;
import io.binpack.codegen.DefiningClassLoader;
import io.binpack.codegen.expression.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.binpack.codegen.util.Primitives.isWrapperType;
import static io.binpack.common.Checks.checkArgument;

/**
 * A per-type handle into a {@link CodeContainer}.
 * <p>
 * An emitter defines one class per generated operation. Every class implements a functional
 * interface and is named {@code <container>.<Type>Serializer<sequence>$<operation>}.
 * Subclasses decide how constants captured by generated code reach it at run time.
 * <p>
 * Not thread-safe, an emitter is owned by the thread that builds a serializer for its target type.
 */
public abstract class SerializerEmitter {
	private static final Logger logger = LoggerFactory.getLogger(SerializerEmitter.class);

	protected final CodeContainer container;
	protected final Class<?> targetType;
	protected final int sequence;

	private final DefiningClassLoader classLoader;
	private final List<String> definedOperations = new ArrayList<>();

	SerializerEmitter(CodeContainer container, Class<?> targetType, int sequence) {
		this.container = container;
		this.targetType = targetType;
		this.sequence = sequence;
		this.classLoader = container.getTypeClassLoader();
	}

	public abstract EmitterFlavor getFlavor();

	/**
	 * Returns an expression that loads the given value in generated code
	 *
	 * @param value a value captured by generated code
	 * @param type  a type the expression should have
	 */
	public abstract Expression constant(Object value, Class<?> type);

	public CodeContainer getContainer() {
		return container;
	}

	public Class<?> getTargetType() {
		return targetType;
	}

	public int getSequence() {
		return sequence;
	}

	/**
	 * Returns a name that is unique across all emitters of all containers
	 */
	public String getTypeName() {
		return container.getName() + '.' + targetType.getSimpleName() + "Serializer" + sequence;
	}

	public List<String> getDefinedOperations() {
		return List.copyOf(definedOperations);
	}

	/**
	 * Defines a class that implements a functional interface with the given body and returns its instance
	 *
	 * @param name                name of the operation, unique within this emitter
	 * @param functionalInterface an interface with exactly one abstract method
	 * @param body                body of the abstract method
	 * @param <F>                 type of the interface
	 */
	public <F> F defineOperation(String name, Class<F> functionalInterface, Expression body) {
		checkArgument(!definedOperations.contains(name), "Operation %s is already defined by %s", name, getTypeName());
		Method method = findAbstractMethod(functionalInterface);
		ClassBuilder<F> classBuilder = ClassBuilder.<F>create(functionalInterface)
				.withClassName(getTypeName() + '$' + name)
				.withMethod(method.getName(), body);
		if (container.getDebugMetadata() == DebugMetadata.RETAIN_SEQUENCE_POINTS) {
			classBuilder.withDebugInfo(targetType.getSimpleName() + "Serializer" + sequence + ".generated");
		}
		F instance = classBuilder.defineClassAndCreateInstance(classLoader);
		definedOperations.add(name);
		logger.trace("Defined operation {} of {}", name, getTypeName());
		return instance;
	}

	static boolean isLiteral(Object value) {
		return value instanceof String || value instanceof Class || value instanceof Enum ||
				isWrapperType(value.getClass());
	}

	private static Method findAbstractMethod(Class<?> functionalInterface) {
		checkArgument(functionalInterface.isInterface(), "Not an interface: %s", functionalInterface);
		Method[] methods = Arrays.stream(functionalInterface.getMethods())
				.filter(m -> Modifier.isAbstract(m.getModifiers()))
				.toArray(Method[]::new);
		checkArgument(methods.length == 1, "Not a functional interface: %s", functionalInterface);
		return methods[0];
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + '{' + getTypeName() + '}';
	}
}
