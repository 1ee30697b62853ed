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

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static io.binpack.codegen.util.Utils.getStringSetting;

/**
 * Owns one {@link CodeContainer} per {@link CodeContainerMode} and hands out {@link SerializerEmitter}s backed by them.
 * <p>
 * Containers are created lazily on first use and replaced wholesale by {@link #refresh()}.
 * Container names are derived from a process-wide sequence that never repeats.
 * Emitters and serializers produced from a replaced container remain usable.
 */
public final class CodeContainerManager {
	private static final Logger logger = LoggerFactory.getLogger(CodeContainerManager.class);

	public static final String NAMESPACE = getStringSetting(CodeContainerManager.class, "namespace", "io.binpack.serializer");

	private static final AtomicInteger ASSEMBLY_SEQUENCE = new AtomicInteger();

	private static volatile @Nullable CodeContainerManager instance;

	private final PlatformCapabilities capabilities;
	private final ClassLoader parentClassLoader;

	private final ReadWriteLock lock = new ReentrantReadWriteLock();
	private final Map<CodeContainerMode, CodeContainer> containers = new EnumMap<>(CodeContainerMode.class);

	private CodeContainerManager(PlatformCapabilities capabilities, ClassLoader parentClassLoader) {
		this.capabilities = capabilities;
		this.parentClassLoader = parentClassLoader;
	}

	/**
	 * Returns the process-wide manager with {@link PlatformCapabilities#detect() detected} capabilities
	 */
	public static CodeContainerManager getInstance() {
		CodeContainerManager manager = instance;
		if (manager == null) {
			synchronized (CodeContainerManager.class) {
				manager = instance;
				if (manager == null) {
					manager = create(PlatformCapabilities.detect());
					instance = manager;
				}
			}
		}
		return manager;
	}

	/**
	 * Creates a manager that is independent of the process-wide one
	 */
	public static CodeContainerManager create(PlatformCapabilities capabilities) {
		return new CodeContainerManager(capabilities, CodeContainerManager.class.getClassLoader());
	}

	public static CodeContainerManager create(PlatformCapabilities capabilities, ClassLoader parentClassLoader) {
		return new CodeContainerManager(capabilities, parentClassLoader);
	}

	public PlatformCapabilities getCapabilities() {
		return capabilities;
	}

	/**
	 * Returns the current container of the given mode, creating it on first use
	 *
	 * @throws PlatformUnsupportedException if the platform does not allow dynamic code
	 */
	public CodeContainer getContainer(CodeContainerMode mode) {
		checkDynamicCode();
		Lock readLock = lock.readLock();
		readLock.lock();
		try {
			CodeContainer container = containers.get(mode);
			if (container != null) return container;
		} finally {
			readLock.unlock();
		}

		Lock writeLock = lock.writeLock();
		writeLock.lock();
		try {
			CodeContainer container = containers.get(mode);
			if (container == null) {
				container = newContainer(mode);
				containers.put(mode, container);
			}
			return container;
		} finally {
			writeLock.unlock();
		}
	}

	/**
	 * Replaces containers of every mode with new ones.
	 * Subsequently created emitters use the new containers.
	 */
	public void refresh() {
		Lock writeLock = lock.writeLock();
		writeLock.lock();
		try {
			containers.clear();
			if (!capabilities.isDynamicCodeSupported()) {
				logger.info("Containers are not refreshed, dynamic code is not supported");
				return;
			}
			for (CodeContainerMode mode : CodeContainerMode.values()) {
				containers.put(mode, newContainer(mode));
			}
			logger.info("Refreshed code containers: {}", containers.values());
		} finally {
			writeLock.unlock();
		}
	}

	/**
	 * Creates an emitter for a target type.
	 * <p>
	 * If the requested flavor is not supported by the platform, the supported one is used instead;
	 * {@link SerializerEmitter#getFlavor()} reports the flavor actually used.
	 *
	 * @param container  a container of this manager
	 * @param targetType a type serializers are generated for
	 * @param flavor     requested flavor
	 * @throws PlatformUnsupportedException if the platform does not allow dynamic code
	 */
	public SerializerEmitter createEmitter(CodeContainer container, Class<?> targetType, EmitterFlavor flavor) {
		checkDynamicCode();
		Lock readLock = lock.readLock();
		readLock.lock();
		try {
			EmitterFlavor actualFlavor = capabilities.resolveFlavor(flavor);
			if (actualFlavor != flavor) {
				logger.info("Flavor {} is not supported, {} is used for {}", flavor, actualFlavor, targetType.getName());
			}
			int sequence = container.nextTypeSequence();
			SerializerEmitter emitter = switch (actualFlavor) {
				case FIELD_BASED -> new FieldBasedSerializerEmitter(container, targetType, sequence);
				case CONTEXT_BASED -> new ContextBasedSerializerEmitter(container, targetType, sequence);
			};
			logger.debug("Created emitter {}", emitter);
			return emitter;
		} finally {
			readLock.unlock();
		}
	}

	public SerializerEmitter createEmitter(CodeContainerMode mode, Class<?> targetType, EmitterFlavor flavor) {
		return createEmitter(getContainer(mode), targetType, flavor);
	}

	private void checkDynamicCode() {
		if (!capabilities.isDynamicCodeSupported()) {
			throw new PlatformUnsupportedException("Dynamic code containers are not supported on this platform: " + capabilities);
		}
	}

	private CodeContainer newContainer(CodeContainerMode mode) {
		int sequence = ASSEMBLY_SEQUENCE.getAndIncrement();
		String name = NAMESPACE + ".GeneratedSerializers" + sequence;
		CodeContainer container = new CodeContainer(name, sequence, mode, parentClassLoader);
		logger.debug("Created container {} with {}", container, container.getDebugMetadata());
		return container;
	}
}
