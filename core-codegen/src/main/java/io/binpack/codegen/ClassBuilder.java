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

package io.binpack.codegen;

import io.binpack.codegen.expression.Expression;
import io.binpack.codegen.expression.Expression_Constant;
import io.binpack.codegen.util.DefiningClassWriter;
import org.jetbrains.annotations.ApiStatus.Internal;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;
import org.objectweb.asm.commons.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static io.binpack.codegen.DefiningClassLoader.createInstance;
import static io.binpack.codegen.expression.Expressions.*;
import static org.objectweb.asm.Opcodes.*;
import static org.objectweb.asm.Type.VOID_TYPE;
import static org.objectweb.asm.Type.getInternalName;
import static org.objectweb.asm.Type.getType;

/**
 * Describes a final class to be generated at runtime. The class implements an interface (or extends a class)
 * with the given method bodies, and holds every non-literal constant of those bodies in a static final field.
 *
 * @param <T> type of class to be generated
 */
public final class ClassBuilder<T> {
	private static final Logger logger = LoggerFactory.getLogger(ClassBuilder.class);

	public static final String CLASS_BUILDER_MARKER = "$GENERATED";
	public static final String DEFAULT_PACKAGE_PREFIX = "io.binpack.codegen.";

	private static final AtomicInteger COUNTER = new AtomicInteger();

	// constants waiting to be read by the static initializers of classes not yet defined
	private static final Map<Integer, Object> PENDING_CONSTANTS = new ConcurrentHashMap<>();

	final Class<?> superclass;
	final List<Class<?>> interfaces;

	private @Nullable String className;
	private @Nullable String sourceFile;
	private int lineNumber;

	final Map<String, Class<?>> fields = new LinkedHashMap<>();
	private final Map<String, Expression> fieldInitializers = new LinkedHashMap<>();
	private final Map<Method, Expression> methods = new LinkedHashMap<>();

	private ClassBuilder(Class<?> superclass, List<Class<?>> interfaces) {
		this.superclass = superclass;
		this.interfaces = interfaces;
		fields.put(CLASS_BUILDER_MARKER, Void.class);
	}

	/**
	 * @param implementation an interface to implement or a class to extend
	 * @param interfaces     additional interfaces
	 */
	public static <T> ClassBuilder<T> create(Class<? super T> implementation, Class<?>... interfaces) {
		for (Class<?> type : interfaces) {
			if (!type.isInterface()) throw new IllegalArgumentException("Not an interface: " + type.getName());
		}
		if (!implementation.isInterface()) {
			return new ClassBuilder<>(implementation, List.of(interfaces));
		}
		List<Class<?>> allInterfaces = new ArrayList<>();
		allInterfaces.add(implementation);
		allInterfaces.addAll(List.of(interfaces));
		return new ClassBuilder<>(Object.class, allInterfaces);
	}

	/**
	 * Sets a fully qualified name of the generated class. Without it, a unique name under
	 * {@value #DEFAULT_PACKAGE_PREFIX} is chosen.
	 */
	public ClassBuilder<T> withClassName(String name) {
		this.className = name;
		return this;
	}

	/**
	 * Makes the generated class carry a source file attribute and a line number
	 * for every statement of a sequence, so that stack traces point at generated statements
	 */
	public ClassBuilder<T> withDebugInfo(String sourceFile) {
		this.sourceFile = sourceFile;
		return this;
	}

	/**
	 * Implements a method of a supertype. The method is looked up by name and must not be overloaded.
	 */
	public ClassBuilder<T> withMethod(String methodName, Expression body) {
		methods.put(findSupertypeMethod(methodName), body);
		return this;
	}

	private Method findSupertypeMethod(String methodName) {
		List<Class<?>> supertypes = new ArrayList<>();
		supertypes.add(Object.class);
		supertypes.add(superclass);
		supertypes.addAll(interfaces);

		Method found = null;
		for (Class<?> supertype : supertypes) {
			for (java.lang.reflect.Method candidate : supertype.getMethods()) {
				if (!candidate.getName().equals(methodName) || candidate.isDefault()) continue;
				Method method = Method.getMethod(candidate);
				if (found != null && !found.equals(method)) {
					throw new IllegalArgumentException("Method " + method + " collides with " + found);
				}
				found = method;
			}
		}
		if (found == null) {
			throw new IllegalArgumentException("No method '" + methodName + "' in supertypes of generated class");
		}
		return found;
	}

	/**
	 * Declares a static final field initialized in the static initializer. A field that is already declared is kept.
	 * Non-literal constants are handed over to the initializer through {@link #getStaticConstant(int)}.
	 */
	public ClassBuilder<T> withStaticFinalField(String field, Class<?> type, Expression value) {
		if (fields.putIfAbsent(field, type) != null) return this;
		if (isPendingConstant(value)) {
			Expression_Constant constant = (Expression_Constant) value;
			PENDING_CONSTANTS.put(constant.getId(), constant.getValue());
		}
		fieldInitializers.put(field, value);
		return this;
	}

	/**
	 * Used by static initializers of generated classes
	 */
	@Internal
	public static Object getStaticConstant(int id) {
		return PENDING_CONSTANTS.get(id);
	}

	@VisibleForTesting
	public static int getStaticConstantsSize() {
		return PENDING_CONSTANTS.size();
	}

	boolean isDebugInfo() {
		return sourceFile != null;
	}

	int nextLineNumber() {
		return ++lineNumber;
	}

	public Class<T> defineClass(DefiningClassLoader classLoader) {
		//noinspection unchecked
		return (Class<T>) toBytecode(classLoader).defineClass(classLoader);
	}

	public T defineClassAndCreateInstance(DefiningClassLoader classLoader, Object... arguments) {
		return createInstance(defineClass(classLoader), arguments);
	}

	/**
	 * Emits the class without defining it
	 */
	public GeneratedBytecode toBytecode(ClassLoader classLoader) {
		String name = className != null ? className : DEFAULT_PACKAGE_PREFIX + simpleName() + '_' + COUNTER.incrementAndGet();
		byte[] bytecode;
		try {
			bytecode = emitClass(name, classLoader);
		} catch (RuntimeException e) {
			releaseConstants();
			throw e;
		}
		logger.trace("Generated {} ({} bytes)", name, bytecode.length);
		return new GeneratedBytecode(name, bytecode, this::initialize, this::releaseConstants);
	}

	private String simpleName() {
		return superclass == Object.class && !interfaces.isEmpty() ?
				interfaces.get(0).getSimpleName() :
				superclass.getSimpleName();
	}

	// reading the marker field runs the static initializer, which consumes the pending constants
	private void initialize(Class<?> definedClass) {
		try {
			definedClass.getField(CLASS_BUILDER_MARKER).get(null);
		} catch (IllegalAccessException | NoSuchFieldException e) {
			throw new AssertionError(e);
		} finally {
			releaseConstants();
		}
	}

	private void releaseConstants() {
		for (Expression expression : fieldInitializers.values()) {
			if (expression instanceof Expression_Constant) {
				PENDING_CONSTANTS.remove(((Expression_Constant) expression).getId());
			}
		}
	}

	private static boolean isPendingConstant(Expression expression) {
		return expression instanceof Expression_Constant && !((Expression_Constant) expression).isJvmPrimitive();
	}

	// region emission
	private byte[] emitClass(String name, ClassLoader classLoader) {
		DefiningClassWriter cw = new DefiningClassWriter(classLoader);
		Type selfType = Type.getObjectType(name.replace('.', '/'));

		String[] interfaceNames = new String[interfaces.size()];
		for (int i = 0; i < interfaceNames.length; i++) {
			interfaceNames[i] = getInternalName(interfaces.get(i));
		}
		cw.visit(V1_8, ACC_PUBLIC | ACC_FINAL | ACC_SUPER, selfType.getInternalName(), null,
				getInternalName(superclass), interfaceNames);
		if (sourceFile != null) {
			cw.visitSource(sourceFile, null);
		}

		emitDefaultConstructor(cw);
		methods.forEach((method, body) -> emitMethod(cw, classLoader, selfType, method, body));
		// method bodies register their constants as fields, so fields and their initializer come last
		emitStaticInitializer(cw, classLoader, selfType);
		fields.forEach((field, type) ->
				cw.visitField(ACC_PUBLIC | ACC_STATIC | (field.equals(CLASS_BUILDER_MARKER) ? 0 : ACC_FINAL),
						field, getType(type).getDescriptor(), null, null));

		cw.visitEnd();
		return cw.toByteArray();
	}

	private void emitDefaultConstructor(DefiningClassWriter cw) {
		Method constructor = new Method("<init>", VOID_TYPE, new Type[0]);
		GeneratorAdapter g = new GeneratorAdapter(ACC_PUBLIC, constructor, null, null, cw);
		g.loadThis();
		g.invokeConstructor(getType(superclass), constructor);
		g.returnValue();
		g.endMethod();
	}

	private void emitMethod(DefiningClassWriter cw, ClassLoader classLoader, Type selfType, Method method, Expression body) {
		GeneratorAdapter g = new GeneratorAdapter(ACC_PUBLIC | ACC_FINAL, method, null, null, cw);
		Context ctx = new Context(classLoader, this, g, selfType, method);
		Type bodyType = body.load(ctx);
		// a body that always throws leaves nothing to return
		if (bodyType != null) {
			ctx.cast(bodyType, method.getReturnType());
			g.returnValue();
		}
		g.endMethod();
	}

	private void emitStaticInitializer(DefiningClassWriter cw, ClassLoader classLoader, Type selfType) {
		Method clinit = new Method("<clinit>", VOID_TYPE, new Type[0]);
		GeneratorAdapter g = new GeneratorAdapter(ACC_STATIC, clinit, null, null, cw);
		Context ctx = new Context(classLoader, this, g, selfType, clinit);
		fieldInitializers.forEach((field, expression) -> {
			Expression initializer = isPendingConstant(expression) ?
					cast(staticCall(ClassBuilder.class, "getStaticConstant", value(((Expression_Constant) expression).getId())), fields.get(field)) :
					expression;
			set(staticField(field), initializer).load(ctx);
		});
		g.returnValue();
		g.endMethod();
	}
	// endregion
}
