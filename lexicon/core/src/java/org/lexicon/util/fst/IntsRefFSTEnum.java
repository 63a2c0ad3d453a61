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
import org.lexicon.util.IntsRef;

/** Enumerates the keys of an FST of any {@link FST.INPUT_TYPE} as
 *  {@link IntsRef}s, together with their outputs. */
public final class IntsRefFSTEnum<T> extends FSTEnum<T> {
  private final IntsRef current = new IntsRef(10);
  private final InputOutput<T> result = new InputOutput<>();
  private IntsRef target;

  /** Holds a single input (IntsRef) + output pair. */
  public static class InputOutput<T> {
    public IntsRef input;
    public T output;
  }

  public IntsRefFSTEnum(FST<T> fst) {
    super(fst);
    current.offset = 1;
    result.input = current;
  }

  public InputOutput<T> current() {
    return result;
  }

  public InputOutput<T> next() throws IOException {
    doNext();
    return result();
  }

  /** Seeks to smallest term that's &gt;= target. */
  public InputOutput<T> seekCeil(IntsRef target) throws IOException {
    target(target);
    doSeekCeil();
    return result();
  }

  /** Seeks to biggest term that's &lt;= target. */
  public InputOutput<T> seekFloor(IntsRef target) throws IOException {
    target(target);
    doSeekFloor();
    return result();
  }

  public InputOutput<T> seekExact(IntsRef target) throws IOException {
    target(target);
    return doSeekExact() ? result() : null;
  }

  private void target(IntsRef target) {
    this.target = target;
    targetLength = target.length;
  }

  @Override
  protected int getTargetLabel() {
    final int depth = upto - 1;
    return depth == target.length ? FST.END_LABEL : target.ints[target.offset + depth];
  }

  @Override
  protected int getCurrentLabel() {
    return current.ints[upto];
  }

  @Override
  protected void setCurrentLabel(int label) {
    current.ints[upto] = label;
  }

  @Override
  protected void grow() {
    current.ints = ArrayUtil.grow(current.ints, upto + 1);
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
