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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import static io.binpack.codegen.util.Utils.getStringSetting;
import static io.binpack.common.Checks.checkArgument;
import static java.util.Collections.unmodifiableSet;

/**
 * Describes what the host platform allows for runtime code generation.
 * <p>
 * Callers query these flags to select a strategy up front instead of probing by failure.
 * When a flavor is not supported, the supported one is substituted, see {@link #resolveFlavor(EmitterFlavor)}.
 */
public final class PlatformCapabilities {
	private static final Logger logger = LoggerFactory.getLogger(PlatformCapabilities.class);

	private static final String NATIVE_IMAGE_PROPERTY = "org.graalvm.nativeimage.imagecode";

	private final boolean dynamicCodeSupported;
	private final Set<EmitterFlavor> supportedFlavors;

	private PlatformCapabilities(boolean dynamicCodeSupported, Set<EmitterFlavor> supportedFlavors) {
		this.dynamicCodeSupported = dynamicCodeSupported;
		this.supportedFlavors = unmodifiableSet(supportedFlavors);
	}

	/**
	 * Capabilities of a platform that allows every strategy
	 */
	public static PlatformCapabilities unrestricted() {
		return new PlatformCapabilities(true, EnumSet.allOf(EmitterFlavor.class));
	}

	/**
	 * Capabilities of a platform that does not allow defining classes at runtime
	 */
	public static PlatformCapabilities withoutDynamicCode() {
		return new PlatformCapabilities(false, EnumSet.noneOf(EmitterFlavor.class));
	}

	/**
	 * Capabilities of a platform that allows defining classes at runtime, but only with the given flavors
	 */
	public static PlatformCapabilities restrictedTo(EmitterFlavor flavor, EmitterFlavor... otherFlavors) {
		return new PlatformCapabilities(true, EnumSet.of(flavor, otherFlavors));
	}

	/**
	 * Detects capabilities of the current process.
	 * <p>
	 * Dynamic code is not supported inside a native image. System properties
	 * {@code PlatformCapabilities.dynamicCode} ({@code on} or {@code off}) and
	 * {@code PlatformCapabilities.flavors} (comma-separated flavor names) restrict it further.
	 */
	public static PlatformCapabilities detect() {
		if (System.getProperty(NATIVE_IMAGE_PROPERTY) != null) {
			logger.warn("Running inside a native image, classes cannot be defined at runtime");
			return withoutDynamicCode();
		}
		String dynamicCode = getStringSetting(PlatformCapabilities.class, "dynamicCode", "on");
		checkArgument(dynamicCode.equals("on") || dynamicCode.equals("off"),
				"Only 'on' and 'off' values are allowed for dynamic code setting, was '%s'", dynamicCode);
		if (dynamicCode.equals("off")) {
			return withoutDynamicCode();
		}
		String flavors = getStringSetting(PlatformCapabilities.class, "flavors", null);
		if (flavors == null) {
			return unrestricted();
		}
		EnumSet<EmitterFlavor> supported = EnumSet.noneOf(EmitterFlavor.class);
		Arrays.stream(flavors.split(","))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.map(EmitterFlavor::valueOf)
				.forEach(supported::add);
		checkArgument(!supported.isEmpty(), "At least one emitter flavor must be supported");
		return new PlatformCapabilities(true, supported);
	}

	public boolean isDynamicCodeSupported() {
		return dynamicCodeSupported;
	}

	public Set<EmitterFlavor> getSupportedFlavors() {
		return supportedFlavors;
	}

	public boolean isFlavorSupported(EmitterFlavor flavor) {
		return supportedFlavors.contains(flavor);
	}

	/**
	 * Returns the requested flavor if it is supported, otherwise the flavor that replaces it
	 *
	 * @throws PlatformUnsupportedException if dynamic code is not supported at all
	 */
	public EmitterFlavor resolveFlavor(EmitterFlavor requested) {
		if (!dynamicCodeSupported) {
			throw new PlatformUnsupportedException("Dynamic code is not supported on this platform");
		}
		if (supportedFlavors.contains(requested)) {
			return requested;
		}
		return supportedFlavors.iterator().next();
	}

	@Override
	public String toString() {
		return "PlatformCapabilities{" +
				"dynamicCode=" + dynamicCodeSupported +
				", flavors=" + supportedFlavors +
				'}';
	}
}
