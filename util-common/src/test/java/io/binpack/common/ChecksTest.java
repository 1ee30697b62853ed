package io.binpack.common;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static io.binpack.common.Checks.*;
import static org.junit.Assert.*;

public final class ChecksTest {
	@Before
	public void setUp() {
		System.getProperties().stringPropertyNames().stream()
				.filter(s -> s.startsWith("chk:"))
				.forEach(System::clearProperty);
	}

	@Test
	public void testDisablingClass() {
		System.setProperty("chk:" + ChecksTest.class.getName(), "on");
		assertTrue(Checks.isEnabled(ChecksTest.class));

		System.setProperty("chk:" + ChecksTest.class.getName(), "off");
		assertFalse(Checks.isEnabled(ChecksTest.class));
	}

	@Test
	public void testDisablingClassBySimpleName() {
		System.setProperty("chk:" + ChecksTest.class.getSimpleName(), "off");
		assertFalse(Checks.isEnabled(ChecksTest.class));

		System.setProperty("chk:" + ChecksTest.class.getSimpleName(), "on");
		assertTrue(Checks.isEnabled(ChecksTest.class));
	}

	@Test
	public void testDisablingPackageButEnablingClass() {
		System.setProperty("chk:java.util", "off");
		assertFalse(Checks.isEnabled(List.class));
		assertFalse(Checks.isEnabled(ArrayList.class));

		System.setProperty("chk:java.util.ArrayList", "on");
		assertFalse(Checks.isEnabled(List.class));
		assertTrue(Checks.isEnabled(ArrayList.class));
	}

	@Test
	public void testEnablingSubpackage() {
		System.setProperty("chk:java.util", "off");
		System.setProperty("chk:java.util.function", "on");

		assertFalse(Checks.isEnabled(List.class));
		assertTrue(Checks.isEnabled(Function.class));
	}

	@Test
	public void testInvalidPropertyValue() {
		System.setProperty("chk:" + ChecksTest.class.getName(), "yes");
		assertThrows(IllegalArgumentException.class, () -> Checks.isEnabled(ChecksTest.class));
	}

	@Test(expected = IllegalStateException.class)
	public void testAnonymousClass() {
		Checks.isEnabled(new Object() {}.getClass());
	}

	@Test
	public void testPreconditions() {
		assertEquals("value", checkNotNull("value"));
		NullPointerException npe = assertThrows(NullPointerException.class, () -> checkNotNull(null, "%s is missing", "name"));
		assertEquals("name is missing", npe.getMessage());

		checkArgument(true, "unused");
		IllegalArgumentException iae = assertThrows(IllegalArgumentException.class,
				() -> checkArgument(false, "Bad %s: %d", "size", 3));
		assertEquals("Bad size: 3", iae.getMessage());

		checkState(true, "unused");
		IllegalStateException ise = assertThrows(IllegalStateException.class, () -> checkState(false, () -> "lazy"));
		assertEquals("lazy", ise.getMessage());
	}

	@Test
	public void testMessageWithoutArgumentsIsNotFormatted() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> checkArgument(false, "100% full"));
		assertEquals("100% full", e.getMessage());
	}

	@Test
	public void testInvalidPackagePropertyIsNamed() {
		System.setProperty("chk:java.util", "maybe");
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Checks.isEnabled(List.class));
		assertTrue(e.getMessage().contains("chk:java.util"));
	}
}
