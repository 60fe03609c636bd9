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

package org.apache.avroudf.avro;

import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.Decoder;
import org.apache.avro.util.Utf8;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * A {@link Decoder} over an in-memory {@link BinaryDecoder} that rejects a declared string, bytes or
 * block length larger than the input left, before any buffer of that length is allocated.
 * <p>
 * Every array item or map entry takes at least one byte, so a block item count is bounded by the
 * bytes left as well. Arrays of zero-width items (nulls, empty records) longer than the remaining
 * input are therefore rejected.
 */
class LengthCheckingDecoder extends Decoder {

  private final BinaryDecoder in;

  LengthCheckingDecoder(BinaryDecoder in) {
    this.in = in;
  }

  private long remaining() throws IOException {
    return in.inputStream().available();
  }

  private int checkLength(long length) throws IOException {
    long remaining = remaining();
    if (length < 0 || length > remaining) {
      throw new EOFException("Declared length " + length + " exceeds the " + remaining + " bytes left");
    }
    return (int) length;
  }

  private long checkItemCount(long count) throws IOException {
    long remaining = remaining();
    if (count < 0 || count > remaining) {
      throw new EOFException("Declared block of " + count + " items exceeds the " + remaining + " bytes left");
    }
    return count;
  }

  @Override
  public void readNull() throws IOException {
    in.readNull();
  }

  @Override
  public boolean readBoolean() throws IOException {
    return in.readBoolean();
  }

  @Override
  public int readInt() throws IOException {
    return in.readInt();
  }

  @Override
  public long readLong() throws IOException {
    return in.readLong();
  }

  @Override
  public float readFloat() throws IOException {
    return in.readFloat();
  }

  @Override
  public double readDouble() throws IOException {
    return in.readDouble();
  }

  @Override
  public Utf8 readString(Utf8 old) throws IOException {
    int length = checkLength(in.readLong());
    Utf8 result = old != null ? old : new Utf8();
    result.setByteLength(length);
    if (length > 0) {
      in.readFixed(result.getBytes(), 0, length);
    }
    return result;
  }

  @Override
  public String readString() throws IOException {
    return readString(null).toString();
  }

  @Override
  public void skipString() throws IOException {
    in.skipFixed(checkLength(in.readLong()));
  }

  @Override
  public ByteBuffer readBytes(ByteBuffer old) throws IOException {
    byte[] bytes = new byte[checkLength(in.readLong())];
    in.readFixed(bytes, 0, bytes.length);
    return ByteBuffer.wrap(bytes);
  }

  @Override
  public void skipBytes() throws IOException {
    in.skipFixed(checkLength(in.readLong()));
  }

  @Override
  public void readFixed(byte[] bytes, int start, int length) throws IOException {
    checkLength(length);
    in.readFixed(bytes, start, length);
  }

  @Override
  public void skipFixed(int length) throws IOException {
    in.skipFixed(checkLength(length));
  }

  @Override
  public int readEnum() throws IOException {
    return in.readEnum();
  }

  @Override
  public long readArrayStart() throws IOException {
    return checkItemCount(in.readArrayStart());
  }

  @Override
  public long arrayNext() throws IOException {
    return checkItemCount(in.arrayNext());
  }

  @Override
  public long skipArray() throws IOException {
    return checkItemCount(in.skipArray());
  }

  @Override
  public long readMapStart() throws IOException {
    return checkItemCount(in.readMapStart());
  }

  @Override
  public long mapNext() throws IOException {
    return checkItemCount(in.mapNext());
  }

  @Override
  public long skipMap() throws IOException {
    return checkItemCount(in.skipMap());
  }

  @Override
  public int readIndex() throws IOException {
    return in.readIndex();
  }
}
