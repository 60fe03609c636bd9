/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.avroudf.io;

import org.apache.avroudf.common.util.ValidationUtils;
import org.apache.avroudf.exception.TruncatedFrameException;

import java.util.Arrays;

/**
 * A forward-only read cursor over a window {@code [offset, limit)} of a byte array.
 * <p>
 * Every read checks the remaining length first and throws {@link TruncatedFrameException}
 * without moving the cursor, so a failed read never leaves the position half advanced.
 * Slices share the backing array with their parent.
 */
public class ByteCursor {

  private final byte[] buffer;
  private final int offset;
  private final int limit;
  private int position;

  private ByteCursor(byte[] buffer, int offset, int limit) {
    this.buffer = buffer;
    this.offset = offset;
    this.limit = limit;
    this.position = offset;
  }

  public static ByteCursor wrap(byte[] buffer) {
    return new ByteCursor(buffer, 0, buffer.length);
  }

  public static ByteCursor wrap(byte[] buffer, int offset, int length) {
    ValidationUtils.checkArgument(offset >= 0 && length >= 0 && offset + length <= buffer.length,
        "Window [" + offset + ", " + (offset + length) + ") exceeds buffer of " + buffer.length + " bytes");
    return new ByteCursor(buffer, offset, offset + length);
  }

  /**
   * Position relative to the start of this cursor's window.
   */
  public int position() {
    return position - offset;
  }

  public int remaining() {
    return limit - position;
  }

  public boolean hasRemaining() {
    return position < limit;
  }

  public byte[] array() {
    return buffer;
  }

  /**
   * Absolute index into {@link #array()} of the next byte to be read.
   */
  public int arrayPosition() {
    return position;
  }

  public int readUnsignedByte() {
    ensureRemaining(1);
    return buffer[position++] & 0xFF;
  }

  /**
   * Reads a 4-byte big-endian unsigned integer.
   */
  public long readUnsignedInt() {
    ensureRemaining(4);
    long value = ((long) (buffer[position] & 0xFF) << 24)
        | ((buffer[position + 1] & 0xFF) << 16)
        | ((buffer[position + 2] & 0xFF) << 8)
        | (buffer[position + 3] & 0xFF);
    position += 4;
    return value;
  }

  public byte[] readBytes(long length) {
    ensureRemaining(length);
    byte[] bytes = Arrays.copyOfRange(buffer, position, position + (int) length);
    position += (int) length;
    return bytes;
  }

  public void skip(long length) {
    ensureRemaining(length);
    position += (int) length;
  }

  /**
   * Returns a cursor over the next {@code length} bytes and advances past them.
   */
  public ByteCursor slice(long length) {
    ensureRemaining(length);
    ByteCursor slice = new ByteCursor(buffer, position, position + (int) length);
    position += (int) length;
    return slice;
  }

  /**
   * Returns an independent cursor over the same window, starting at the current position.
   */
  public ByteCursor duplicate() {
    ByteCursor copy = new ByteCursor(buffer, offset, limit);
    copy.position = position;
    return copy;
  }

  /**
   * Moves this cursor to the position of another cursor over the same window.
   */
  public void syncTo(ByteCursor other) {
    ValidationUtils.checkArgument(other.buffer == buffer && other.offset == offset && other.limit == limit,
        "Cursors do not share the same window");
    this.position = other.position;
  }

  public byte[] remainingBytes() {
    return Arrays.copyOfRange(buffer, position, limit);
  }

  private void ensureRemaining(long length) {
    if (length < 0 || length > remaining()) {
      throw new TruncatedFrameException((int) Math.min(length, Integer.MAX_VALUE), position(), remaining());
    }
  }

  @Override
  public String toString() {
    return "ByteCursor{position=" + position() + ", remaining=" + remaining() + "}";
  }
}
