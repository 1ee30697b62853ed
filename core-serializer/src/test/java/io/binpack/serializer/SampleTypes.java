package io.binpack.serializer;

import java.util.*;

public final class SampleTypes {
	private SampleTypes() {
	}

	public enum Color {
		RED, GREEN, BLUE
	}

	public static final class Person {
		public String name;
		public int age;

		public Person() {
		}

		public Person(String name, int age) {
			this.name = name;
			this.age = age;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Person person = (Person) o;
			return age == person.age && Objects.equals(name, person.name);
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, age);
		}

		@Override
		public String toString() {
			return "Person{name='" + name + "', age=" + age + '}';
		}
	}

	public record Point(int x, int y) {
	}

	public record Order(String id, List<String> tags, Map<String, Integer> quantities, Set<Color> colors,
			Person customer, Color color, Long discount) {
	}

	public static final class AllPrimitives {
		public boolean flag;
		public byte b;
		public short s;
		public char c;
		public int i;
		public long l;
		public float f;
		public double d;
		public Integer boxed;
		public String text;
	}

	public static final class ArrayHolder {
		public int[] numbers;
		public String[] words;
		public Point[] points;
		public List<Point> path;
	}

	public static final class Account {
		private long id;
		private String owner;
		private boolean active;

		public long getId() {
			return id;
		}

		public void setId(long id) {
			this.id = id;
		}

		public String getOwner() {
			return owner;
		}

		public void setOwner(String owner) {
			this.owner = owner;
		}

		public boolean isActive() {
			return active;
		}

		public void setActive(boolean active) {
			this.active = active;
		}

		public String getDisplayName() {
			return owner + '#' + id;
		}
	}

	public static final class Version implements Packable, Unpackable {
		public int major;
		public int minor;

		@Override
		public void packTo(Packer packer, SerializationContext context) {
			packer.writeString(major + "." + minor);
		}

		@Override
		public void unpackFrom(Unpacker unpacker, SerializationContext context) {
			String[] parts = Objects.requireNonNull(unpacker.readString()).split("\\.");
			major = Integer.parseInt(parts[0]);
			minor = Integer.parseInt(parts[1]);
		}
	}

	public static final class Release {
		public String name;
		public Version version;
	}
}
