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
package org.lexicon.util.fst;


import java.io.IOException;

import org.lexicon.util.ArrayUtil;
import org.lexicon.util.BytesRef;

/** Enumerates the keys of a {@link FST.INPUT_TYPE#BYTE1} FST as
 *  {@link BytesRef}s, together with their outputs.
 *  The returned {@link InputOutput} is reused by every call. */
public final class BytesRefFSTEnum<T> extends FSTEnum<T> {
  // 下标 0 不使用, label 从 bytes[1] 开始
  private final BytesRef current = new BytesRef(10);
  private final InputOutput<T> result = new InputOutput<>();
  private BytesRef target;

  /** Holds a single input (BytesRef) + output pair. */
  public static class InputOutput<T> {
    public BytesRef input;
    public T output;
  }

  public BytesRefFSTEnum(FST<T> fst) {
    super(fst);
    current.offset = 1;
    result.input = current;
  }

  public InputOutput<T> current() {
    return result;
  }

  /** Advances to the next key, or returns null after the last one. */
  public InputOutput<T> next() throws IOException {
    doNext();
    return result();
  }

  /** Seeks to smallest term that's &gt;= target. */
  public InputOutput<T> seekCeil(BytesRef target) throws IOException {
    target(target);
    doSeekCeil();
    return result();
  }

  /** Seeks to biggest term that's &lt;= target. */
  public InputOutput<T> seekFloor(BytesRef target) throws IOException {
    target(target);
    doSeekFloor();
    return result();
  }

  /** Returns the entry for exactly {@code target}, or null when it is not a key. */
  public InputOutput<T> seekExact(BytesRef target) throws IOException {
    target(target);
    if (doSeekExact() == false) {
      return null;
    }
    assert upto == 1 + target.length;
    return result();
  }

  private void target(BytesRef target) {
    this.target = target;
    targetLength = target.length;
  }

  @Override
  protected int getTargetLabel() {
    final int depth = upto - 1;
    return depth == target.length ? FST.END_LABEL : target.bytes[target.offset + depth] & 0xFF;
  }

  @Override
  protected int getCurrentLabel() {
    return current.bytes[upto] & 0xFF;
  }

  @Override
  protected void setCurrentLabel(int label) {
    current.bytes[upto] = (byte) label;
  }

  @Override
  protected void grow() {
    current.bytes = ArrayUtil.grow(current.bytes, upto + 1);
  }

  private InputOutput<T> result() {
    if (upto == 0) {
      return null;
    }
    current.length = upto - 1;
    result.output = output[upto];
    return result;
  }
}
