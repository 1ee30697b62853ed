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

package io.binpack.common;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

/**
 * Preconditions shared by all modules.
 * <p>
 * Besides the preconditions, a class may own expensive sanity checks that stay off unless requested:
 * <pre>
 * {@code private static final boolean CHECKS = Checks.isEnabled(MyClass.class);}
 * </pre>
 * {@code -Dchk=on} turns them on everywhere, {@code -Dchk:io.binpack.serializer=on} turns them on
 * for a package and {@code -Dchk:MyClass=off} turns them off for a single class.
 */
public final class Checks {
	private static final String PROPERTY = "chk";
	private static final boolean DEFAULT = parse(PROPERTY, System.getProperty(PROPERTY), false);

	private Checks() {
	}

	/**
	 * Looks up the switch of a class: its full name, then its simple name,
	 * then every enclosing package from the innermost one
	 */
	public static boolean isEnabled(Class<?> cls) {
		checkState(!cls.isAnonymousClass(), "Checks of anonymous classes cannot be switched");

		String name = cls.getName();
		String key = PROPERTY + ':' + name;
		String value = System.getProperty(key);
		if (value == null) {
			key = PROPERTY + ':' + cls.getSimpleName();
			value = System.getProperty(key);
		}
		for (int dot = name.lastIndexOf('.'); value == null && dot != -1; dot = name.lastIndexOf('.', dot - 1)) {
			key = PROPERTY + ':' + name.substring(0, dot);
			value = System.getProperty(key);
		}
		return parse(key, value, DEFAULT);
	}

	private static boolean parse(String key, @Nullable String value, boolean fallback) {
		if (value == null) return fallback;
		switch (value) {
			case "on":
				return true;
			case "off":
				return false;
			default:
				throw new IllegalArgumentException("Property '" + key + "' is either 'on' or 'off', was '" + value + '\'');
		}
	}

	@Contract("null -> fail")
	public static <T> T checkNotNull(@Nullable T reference) {
		if (reference == null) throw new NullPointerException();
		return reference;
	}

	@Contract("null, _, _ -> fail")
	public static <T> T checkNotNull(@Nullable T reference, String template, Object... args) {
		if (reference == null) throw new NullPointerException(format(template, args));
		return reference;
	}

	/**
	 * @throws IllegalArgumentException with the formatted message if the argument is not valid
	 */
	@Contract("false, _, _ -> fail")
	public static void checkArgument(boolean valid, String template, Object... args) {
		if (!valid) throw new IllegalArgumentException(format(template, args));
	}

	@Contract("false, _ -> fail")
	public static void checkArgument(boolean valid, Supplier<String> message) {
		if (!valid) throw new IllegalArgumentException(message.get());
	}

	/**
	 * @throws IllegalStateException with the formatted message if the state is not valid
	 */
	@Contract("false, _, _ -> fail")
	public static void checkState(boolean valid, String template, Object... args) {
		if (!valid) throw new IllegalStateException(format(template, args));
	}

	@Contract("false, _ -> fail")
	public static void checkState(boolean valid, Supplier<String> message) {
		if (!valid) throw new IllegalStateException(message.get());
	}

	private static String format(String template, Object[] args) {
		return args.length == 0 ? template : String.format(template, args);
	}
}
