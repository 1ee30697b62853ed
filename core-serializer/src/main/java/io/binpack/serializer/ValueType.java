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

/**
 * Types of values in packed data
 */
public enum ValueType {
	NIL(0xC0),
	FALSE(0xC2),
	TRUE(0xC3),
	INT(0xD0),
	LONG(0xD1),
	FLOAT(0xCA),
	DOUBLE(0xCB),
	STRING(0xD9),
	ARRAY(0xDC),
	MAP(0xDE);

	private static final ValueType[] BY_TAG = new ValueType[256];

	static {
		for (ValueType type : values()) {
			BY_TAG[type.tag] = type;
		}
	}

	final int tag;

	ValueType(int tag) {
		this.tag = tag;
	}

	static ValueType ofTag(int tag) {
		ValueType type = BY_TAG[tag & 0xFF];
		if (type == null) {
			throw new CorruptedDataException("Unknown value tag: 0x" + Integer.toHexString(tag & 0xFF));
		}
		return type;
	}
}
