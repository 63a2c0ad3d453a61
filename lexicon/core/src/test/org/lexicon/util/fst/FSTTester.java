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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.lexicon.store.InputStreamDataInput;
import org.lexicon.store.OutputStreamDataOutput;
import org.lexicon.util.BytesRef;
import org.lexicon.util.IntsRef;
import org.lexicon.util.IntsRefBuilder;

/** Builds small automata for tests, in every node encoding. */
final class FSTTester {

  private FSTTester() {
  }

  /** How nodes get laid out by the compiler. */
  enum Encoding {
    /** default thresholds: fixed arrays only for wide nodes near the root */
    DEFAULT,
    /** never fixed arrays */
    SEQUENTIAL,
    /** every node with arcs is a fixed array */
    FIXED_ARRAYS;

    <T> FSTCompiler.Builder<T> apply(FSTCompiler.Builder<T> builder) {
      switch (this) {
        case SEQUENTIAL:
          return builder.allowFixedLengthArcs(false);
        case FIXED_ARRAYS:
          return builder.allowFixedLengthArcs(true)
              .fixedLengthArcsShallowNumArcs(1)
              .fixedLengthArcsDeepNumArcs(1);
        default:
          return builder;
      }
    }
  }

  static IntsRef ints(String key) {
    return Util.toIntsRef(new BytesRef(key), new IntsRefBuilder());
  }

  static <T> FSTCompiler<T> compiler(Outputs<T> outputs, Encoding encoding, boolean shareSuffix) {
    return encoding.apply(new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, outputs))
        .shouldShareSuffix(shareSuffix)
        .build();
  }

  /** Adds the entries in key order and compiles. */
  static <T> FST<T> compile(FSTCompiler<T> compiler, SortedMap<String, T> entries) throws IOException {
    final IntsRefBuilder scratch = new IntsRefBuilder();
    for (Map.Entry<String, T> entry : entries.entrySet()) {
      compiler.add(Util.toIntsRef(new BytesRef(entry.getKey()), scratch), entry.getValue());
    }
    return compiler.compile();
  }

  static <T> FST<T> build(Outputs<T> outputs, Encoding encoding, boolean shareSuffix, SortedMap<String, T> entries) throws IOException {
    return compile(compiler(outputs, encoding, shareSuffix), entries);
  }

  static FST<Long> build(Encoding encoding, SortedMap<String, Long> entries) throws IOException {
    return build(PositiveIntOutputs.getSingleton(), encoding, true, entries);
  }

  /** keys map to 0, 1, 2, ... in sorted order */
  static SortedMap<String, Long> ordinals(Iterable<String> sortedKeys) {
    final SortedMap<String, Long> entries = new TreeMap<>();
    long ord = 0;
    for (String key : sortedKeys) {
      entries.put(key, ord++);
    }
    return entries;
  }

  static SortedMap<String, Long> longs(Object... keysAndValues) {
    final SortedMap<String, Long> entries = new TreeMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      entries.put((String) keysAndValues[i], ((Number) keysAndValues[i + 1]).longValue());
    }
    return entries;
  }

  /** Distinct ASCII keys over a small alphabet, so prefixes and suffixes get shared. */
  static TreeSet<String> randomKeys(Random random, int count, int maxLength) {
    final TreeSet<String> keys = new TreeSet<>();
    while (keys.size() < count) {
      final int length = 1 + random.nextInt(maxLength);
      final StringBuilder sb = new StringBuilder();
      for (int i = 0; i < length; i++) {
        sb.append((char) ('a' + random.nextInt(12)));
      }
      keys.add(sb.toString());
    }
    return keys;
  }

  static List<String> keysOf(FST<?> fst) throws IOException {
    final List<String> keys = new ArrayList<>();
    final BytesRefFSTEnum<?> fstEnum = new BytesRefFSTEnum<>(fst);
    BytesRefFSTEnum.InputOutput<?> io;
    while ((io = fstEnum.next()) != null) {
      keys.add(io.input.utf8ToString());
    }
    return keys;
  }

  static byte[] save(FST<?> fst) throws IOException {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    fst.save(new OutputStreamDataOutput(bytes));
    return bytes.toByteArray();
  }

  static <T> FST<T> load(byte[] bytes, Outputs<T> outputs) throws IOException {
    return new FST<>(new InputStreamDataInput(new ByteArrayInputStream(bytes), "test bytes"), outputs);
  }

  static <T> FST<T> load(byte[] bytes, Outputs<T> outputs, FSTStore store) throws IOException {
    return new FST<>(new InputStreamDataInput(new ByteArrayInputStream(bytes), "test bytes"), outputs, store);
  }
}
