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

import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.junit.Test;
import org.lexicon.util.BytesRef;
import org.lexicon.util.IntsRef;
import org.lexicon.util.IntsRefBuilder;
import org.lexicon.util.fst.FSTTester.Encoding;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.lexicon.util.fst.FSTTester.longs;

public class TestFSTEnum {

  private static String randomTarget(Random random) {
    int length = random.nextInt(7);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < length; i++) {
      // one past each end of the key alphabet
      sb.append((char) ('`' + random.nextInt(14)));
    }
    return sb.toString();
  }

  @Test
  public void testNextVisitsAllInOrder() throws Exception {
    SortedMap<String, Long> entries = longs("", 1, "a", 3, "ab", 4, "abc", 9, "b", 12, "ba", 12);
    for (Encoding encoding : Encoding.values()) {
      FST<Long> fst = FSTTester.build(encoding, entries);
      BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<>(fst);
      for (String key : entries.keySet()) {
        BytesRefFSTEnum.InputOutput<Long> io = fstEnum.next();
        assertThat(io, notNullValue());
        assertThat(io.input.utf8ToString(), is(key));
        assertThat(io.output, is(entries.get(key)));
        assertThat(fstEnum.current().input.utf8ToString(), is(key));
      }
      assertThat(fstEnum.next(), nullValue());
    }
  }

  @Test
  public void testRandomSeeks() throws Exception {
    Random random = new Random(0xfeed);
    TreeSet<String> keys = FSTTester.randomKeys(random, 400, 6);
    TreeMap<String, Long> entries = new TreeMap<>(FSTTester.ordinals(keys));
    String[] keyArray = keys.toArray(new String[0]);

    for (Encoding encoding : Encoding.values()) {
      FST<Long> fst = FSTTester.build(encoding, entries);
      for (int iter = 0; iter < 500; iter++) {
        String target = random.nextInt(4) == 0 ? keyArray[random.nextInt(keyArray.length)] : randomTarget(random);
        String where = encoding + " target=" + target;

        BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<>(fst);
        BytesRefFSTEnum.InputOutput<Long> io;
        switch (random.nextInt(3)) {
          case 0: {
            String expected = entries.ceilingKey(target);
            io = fstEnum.seekCeil(new BytesRef(target));
            if (expected == null) {
              assertThat(where, io, nullValue());
            } else {
              assertThat(where, io.input.utf8ToString(), is(expected));
              assertThat(where, io.output, is(entries.get(expected)));
              String higher = entries.higherKey(expected);
              io = fstEnum.next();
              if (higher == null) {
                assertThat(where, io, nullValue());
              } else {
                assertThat(where, io.input.utf8ToString(), is(higher));
              }
            }
            break;
          }
          case 1: {
            String expected = entries.floorKey(target);
            io = fstEnum.seekFloor(new BytesRef(target));
            if (expected == null) {
              assertThat(where, io, nullValue());
            } else {
              assertThat(where, io.input.utf8ToString(), is(expected));
              assertThat(where, io.output, is(entries.get(expected)));
            }
            break;
          }
          default: {
            io = fstEnum.seekExact(new BytesRef(target));
            if (entries.containsKey(target)) {
              assertThat(where, io.input.utf8ToString(), is(target));
              assertThat(where, io.output, is(entries.get(target)));
            } else {
              assertThat(where, io, nullValue());
            }
          }
        }
      }
    }
  }

  @Test
  public void testSeekOnSameEnum() throws Exception {
    FST<Long> fst = FSTTester.build(Encoding.DEFAULT, longs("aardvark", 1, "beaver", 2, "cat", 3, "catfish", 4, "dog", 5));
    BytesRefFSTEnum<Long> fstEnum = new BytesRefFSTEnum<>(fst);
    assertThat(fstEnum.seekCeil(new BytesRef("cas")).input.utf8ToString(), is("cat"));
    assertThat(fstEnum.seekCeil(new BytesRef("catf")).input.utf8ToString(), is("catfish"));
    assertThat(fstEnum.seekFloor(new BytesRef("cb")).input.utf8ToString(), is("catfish"));
    assertThat(fstEnum.seekFloor(new BytesRef("b")).input.utf8ToString(), is("aardvark"));
    assertThat(fstEnum.seekExact(new BytesRef("dog")).output, is(5L));
    assertThat(fstEnum.seekExact(new BytesRef("do")), nullValue());
    assertThat(fstEnum.seekCeil(new BytesRef("e")), nullValue());
  }

  @Test
  public void testIntsRefEnumOverCodePoints() throws Exception {
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE4, PositiveIntOutputs.getSingleton());
    String[] keys = {"alpha", "b\u00e9ta", "\u03b3amma"};
    IntsRefBuilder scratch = new IntsRefBuilder();
    for (int i = 0; i < keys.length; i++) {
      compiler.add(Util.toUTF32(keys[i], scratch), (long) i + 1);
    }
    FST<Long> fst = compiler.compile();

    IntsRefFSTEnum<Long> fstEnum = new IntsRefFSTEnum<>(fst);
    for (int i = 0; i < keys.length; i++) {
      IntsRefFSTEnum.InputOutput<Long> io = fstEnum.next();
      assertThat(io.input, is(IntsRef.deepCopyOf(Util.toUTF32(keys[i], scratch))));
      assertThat(io.output, is((long) i + 1));
    }
    assertThat(fstEnum.next(), nullValue());

    IntsRefFSTEnum.InputOutput<Long> io = fstEnum.seekCeil(Util.toUTF32("c", scratch));
    assertThat(io.output, is(3L));
    io = fstEnum.seekFloor(Util.toUTF32("c", scratch));
    assertThat(io.output, is(2L));
    assertThat(fstEnum.seekExact(Util.toUTF32("alpha", scratch)).output, is(1L));
  }
}
