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

package io.binpack.serializer;

import org.jetbrains.annotations.Nullable;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads tagged values written by a {@link Packer}.
 * <p>
 * Truncated data or a value of an unexpected type results in a {@link CorruptedDataException}.
 */
public final class Unpacker {
	private final byte[] array;
	private int pos;

	public Unpacker(byte[] array) {
		this.array = array;
	}

	public int pos() {
		return pos;
	}

	public boolean hasRemaining() {
		return pos < array.length;
	}

	public ValueType peekType() {
		ensure(1);
		return ValueType.ofTag(array[pos]);
	}

	/**
	 * Consumes a nil value if it is the next one
	 *
	 * @return whether a nil value was consumed
	 */
	public boolean tryReadNil() {
		if (peekType() != ValueType.NIL) return false;
		pos++;
		return true;
	}

	public boolean readBoolean() {
		ValueType type = readTag();
		if (type == ValueType.TRUE) return true;
		if (type == ValueType.FALSE) return false;
		throw unexpected("boolean", type);
	}

	public int readInt() {
		ValueType type = readTag();
		if (type != ValueType.INT) throw unexpected("int", type);
		int v = readVarInt();
		return (v >>> 1) ^ -(v & 1);
	}

	/**
	 * Reads a long value, ints are widened
	 */
	public long readLong() {
		ValueType type = readTag();
		if (type == ValueType.INT) {
			int v = readVarInt();
			return (v >>> 1) ^ -(v & 1);
		}
		if (type != ValueType.LONG) throw unexpected("long", type);
		long v = readVarLong();
		return (v >>> 1) ^ -(v & 1);
	}

	public float readFloat() {
		ValueType type = readTag();
		if (type != ValueType.FLOAT) throw unexpected("float", type);
		return Float.intBitsToFloat(readRawInt());
	}

	/**
	 * Reads a double value, floats are widened
	 */
	public double readDouble() {
		ValueType type = readTag();
		if (type == ValueType.FLOAT) return Float.intBitsToFloat(readRawInt());
		if (type != ValueType.DOUBLE) throw unexpected("double", type);
		long high = readRawInt() & 0xFFFFFFFFL;
		long low = readRawInt() & 0xFFFFFFFFL;
		return Double.longBitsToDouble(high << 32 | low);
	}

	/**
	 * Reads a string, or {@code null} if the next value is nil
	 */
	public @Nullable String readString() {
		ValueType type = readTag();
		if (type == ValueType.NIL) return null;
		if (type != ValueType.STRING) throw unexpected("string", type);
		int length = readVarInt();
		ensure(length);
		String s = new String(array, pos, length, UTF_8);
		pos += length;
		return s;
	}

	public int readArrayHeader() {
		ValueType type = readTag();
		if (type != ValueType.ARRAY) throw unexpected("array", type);
		return readVarInt();
	}

	public int readMapHeader() {
		ValueType type = readTag();
		if (type != ValueType.MAP) throw unexpected("map", type);
		return readVarInt();
	}

	/**
	 * Skips the next value, including all nested values of an array or a map
	 */
	public void skip() {
		ValueType type = readTag();
		switch (type) {
			case NIL, TRUE, FALSE -> {
			}
			case INT -> readVarInt();
			case LONG -> readVarLong();
			case FLOAT -> move(4);
			case DOUBLE -> move(8);
			case STRING -> move(readVarInt());
			case ARRAY -> {
				int size = readVarInt();
				for (int i = 0; i < size; i++) skip();
			}
			case MAP -> {
				int size = readVarInt();
				for (int i = 0; i < size * 2; i++) skip();
			}
		}
	}

	private ValueType readTag() {
		ensure(1);
		return ValueType.ofTag(array[pos++]);
	}

	private int readRawInt() {
		ensure(4);
		int v = (array[pos] & 0xFF) << 24 |
				(array[pos + 1] & 0xFF) << 16 |
				(array[pos + 2] & 0xFF) << 8 |
				(array[pos + 3] & 0xFF);
		pos += 4;
		return v;
	}

	private int readVarInt() {
		int result = 0;
		for (int offset = 0; offset < 35; offset += 7) {
			ensure(1);
			byte b = array[pos++];
			result |= (b & 0x7F) << offset;
			if (b >= 0) return result;
		}
		throw new CorruptedDataException("Read varint was too long");
	}

	private long readVarLong() {
		long result = 0;
		for (int offset = 0; offset < 70; offset += 7) {
			ensure(1);
			byte b = array[pos++];
			result |= (long) (b & 0x7F) << offset;
			if (b >= 0) return result;
		}
		throw new CorruptedDataException("Read varlong was too long");
	}

	private void move(int length) {
		ensure(length);
		pos += length;
	}

	private void ensure(int size) {
		if (size < 0 || pos + size > array.length) {
			throw new CorruptedDataException("Unexpected end of data at position " + pos);
		}
	}

	private static CorruptedDataException unexpected(String expected, ValueType actual) {
		return new CorruptedDataException("Expected " + expected + ", but was " + actual);
	}
}
