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

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes tagged values into a growable byte array.
 * <p>
 * Integers are written as zig-zag encoded variable length numbers,
 * floating point numbers in IEEE 754 big-endian form, strings as UTF-8 bytes prefixed with their length.
 */
public final class Packer {
	private byte[] array;
	private int pos;

	public Packer() {
		this(64);
	}

	public Packer(int initialCapacity) {
		this.array = new byte[initialCapacity];
	}

	public int size() {
		return pos;
	}

	public byte[] toByteArray() {
		return Arrays.copyOf(array, pos);
	}

	public void writeNil() {
		writeTag(ValueType.NIL);
	}

	public void writeBoolean(boolean v) {
		writeTag(v ? ValueType.TRUE : ValueType.FALSE);
	}

	public void writeInt(int v) {
		writeTag(ValueType.INT);
		writeVarInt((v << 1) ^ (v >> 31));
	}

	public void writeLong(long v) {
		writeTag(ValueType.LONG);
		writeVarLong((v << 1) ^ (v >> 63));
	}

	public void writeFloat(float v) {
		writeTag(ValueType.FLOAT);
		writeRawInt(Float.floatToIntBits(v));
	}

	public void writeDouble(double v) {
		writeTag(ValueType.DOUBLE);
		long bits = Double.doubleToLongBits(v);
		writeRawInt((int) (bits >>> 32));
		writeRawInt((int) bits);
	}

	/**
	 * Writes a string, or nil if the string is {@code null}
	 */
	public void writeString(@Nullable String s) {
		if (s == null) {
			writeNil();
			return;
		}
		byte[] bytes = s.getBytes(UTF_8);
		writeTag(ValueType.STRING);
		writeVarInt(bytes.length);
		ensure(bytes.length);
		System.arraycopy(bytes, 0, array, pos, bytes.length);
		pos += bytes.length;
	}

	/**
	 * Starts an array, followed by {@code size} values
	 */
	public void writeArrayHeader(int size) {
		writeTag(ValueType.ARRAY);
		writeVarInt(size);
	}

	/**
	 * Starts a map, followed by {@code size} pairs of key and value
	 */
	public void writeMapHeader(int size) {
		writeTag(ValueType.MAP);
		writeVarInt(size);
	}

	private void writeTag(ValueType type) {
		ensure(1);
		array[pos++] = (byte) type.tag;
	}

	private void writeRawInt(int v) {
		ensure(4);
		array[pos] = (byte) (v >>> 24);
		array[pos + 1] = (byte) (v >>> 16);
		array[pos + 2] = (byte) (v >>> 8);
		array[pos + 3] = (byte) v;
		pos += 4;
	}

	private void writeVarInt(int v) {
		ensure(5);
		while ((v & ~0x7F) != 0) {
			array[pos++] = (byte) ((v & 0x7F) | 0x80);
			v >>>= 7;
		}
		array[pos++] = (byte) v;
	}

	private void writeVarLong(long v) {
		ensure(10);
		while ((v & ~0x7FL) != 0) {
			array[pos++] = (byte) ((v & 0x7F) | 0x80);
			v >>>= 7;
		}
		array[pos++] = (byte) v;
	}

	private void ensure(int size) {
		if (pos + size > array.length) {
			array = Arrays.copyOf(array, Math.max(array.length * 2, pos + size));
		}
	}
}
