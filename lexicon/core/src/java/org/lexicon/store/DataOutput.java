/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.lexicon.store;


import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Abstract base class for performing write operations of Lexicon's low-level
 * data types.
 *
 * <p>{@code DataOutput} may only be used from one thread, because it is not
 * thread safe (it keeps internal state like file position).
 */
public abstract class DataOutput {


  /** Writes a single byte.
   * <p>
   * The most primitive data type is an eight-bit byte. Files are
   * accessed as sequences of bytes. All other data types are defined
   * as sequences of bytes, so file formats are byte-order independent.
   *
   * @see DataInput#readByte()
   */
  public abstract void writeByte(byte b) throws IOException;

  /** Writes an array of bytes.
   * @param b the bytes to write
   * @param length the number of bytes to write
   * @see DataInput#readBytes(byte[],int,int)
   */
  public void writeBytes(byte[] b, int length) throws IOException {
    writeBytes(b, 0, length);
  }

  /** Writes an array of bytes.
   * @param b the bytes to write
   * @param offset the offset in the byte array
   * @param length the number of bytes to write
   * @see DataInput#readBytes(byte[],int,int)
   */
  public abstract void writeBytes(byte[] b, int offset, int length) throws IOException;

  /** Writes an int as four bytes, high byte first.
   * @see DataInput#readInt()
   */
  public void writeInt(int i) throws IOException {
    writeByte((byte) (i >> 24));
    writeByte((byte) (i >> 16));
    writeByte((byte) (i >>  8));
    writeByte((byte) i);
  }

  /** Writes a short as two bytes.
   * @see DataInput#readShort()
   */
  public void writeShort(short i) throws IOException {
    writeByte((byte) (i >>  8));
    writeByte((byte) i);
  }

  /** Writes an int in a variable-length format.  Writes between one and
   * five bytes.  Smaller values take fewer bytes.  Negative numbers are
   * supported, but should be avoided.
   * <p>The low-order seven bits of each byte carry data; the high-order bit
   * says whether more bytes follow.
   *
   * @see DataInput#readVInt()
   */
  public final void writeVInt(int i) throws IOException {
    while ((i & ~0x7F) != 0) {
      writeByte((byte) ((i & 0x7F) | 0x80));
      i >>>= 7;
    }
    writeByte((byte) i);
  }

  /** Writes a long as eight bytes.
   * @see DataInput#readLong()
   */
  public void writeLong(long i) throws IOException {
    writeInt((int) (i >> 32));
    writeInt((int) i);
  }

  /** Writes a non-negative long in a variable-length format.  Writes between
   * one and nine bytes.  Smaller values take fewer bytes.
   *
   * @throws IllegalArgumentException if the value is negative
   * @see DataInput#readVLong()
   */
  public final void writeVLong(long i) throws IOException {
    if (i < 0) {
      throw new IllegalArgumentException("cannot write negative vLong (got: " + i + ")");
    }
    while ((i & ~0x7FL) != 0L) {
      writeByte((byte) ((i & 0x7FL) | 0x80L));
      i >>>= 7;
    }
    writeByte((byte) i);
  }

  /** Writes a string as its UTF-8 byte length (vInt) followed by the bytes.
   * @see DataInput#readString()
   */
  public void writeString(String s) throws IOException {
    final byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
    writeVInt(utf8.length);
    writeBytes(utf8, 0, utf8.length);
  }}
