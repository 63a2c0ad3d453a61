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

import org.junit.Test;
import org.lexicon.store.ByteArrayDataOutput;
import org.lexicon.util.BytesRef;
import org.lexicon.util.CharsRef;
import org.lexicon.util.IntsRef;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

public class TestOutputs {

  /** add(NO_OUTPUT, x) == x == add(x, NO_OUTPUT), and common/subtract/add rebuild the original. */
  private static <T> void assertLaws(Outputs<T> outputs, T a, T b) {
    final T none = outputs.getNoOutput();
    assertThat(outputs.add(none, a), is(a));
    assertThat(outputs.add(a, none), is(a));
    assertThat(outputs.subtract(a, none), is(a));
    assertThat(outputs.subtract(a, a), sameInstance(none));

    final T common = outputs.common(a, b);
    assertThat(outputs.common(b, a), is(common));
    assertThat(outputs.add(common, outputs.subtract(a, common)), is(a));
    assertThat(outputs.add(common, outputs.subtract(b, common)), is(b));
  }

  @Test
  public void testPositiveIntOutputs() {
    PositiveIntOutputs outputs = PositiveIntOutputs.getSingleton();
    assertLaws(outputs, 17L, 5L);
    assertThat(outputs.common(17L, 5L), is(5L));
    assertThat(outputs.subtract(17L, 5L), is(12L));
    assertThat(outputs.add(12L, 5L), is(17L));
    assertThat(outputs.common(17L, outputs.getNoOutput()), sameInstance(outputs.getNoOutput()));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> outputs.subtract(5L, 17L));
    assertThat(e.getMessage(), is("cannot subtract 17 from smaller output 5"));
  }

  @Test
  public void testByteSequenceOutputs() {
    ByteSequenceOutputs outputs = ByteSequenceOutputs.getSingleton();
    BytesRef foobar = new BytesRef("foobar");
    BytesRef food = new BytesRef("food");
    assertLaws(outputs, foobar, food);
    assertThat(outputs.common(foobar, food), is(new BytesRef("foo")));
    assertThat(outputs.subtract(foobar, new BytesRef("foo")), is(new BytesRef("bar")));
    assertThat(outputs.common(foobar, new BytesRef("xyz")), sameInstance(outputs.getNoOutput()));
    assertThrows(IllegalArgumentException.class, () -> outputs.subtract(food, foobar));
  }

  @Test
  public void testCharSequenceOutputs() {
    CharSequenceOutputs outputs = CharSequenceOutputs.getSingleton();
    CharsRef left = new CharsRef("lexical");
    CharsRef right = new CharsRef("lexicon");
    assertLaws(outputs, left, right);
    assertThat(outputs.common(left, right).toString(), is("lexic"));
    assertThat(outputs.add(new CharsRef("lex"), new CharsRef("icon")).toString(), is("lexicon"));
    assertThrows(IllegalArgumentException.class, () -> outputs.subtract(new CharsRef("ab"), left));
  }

  @Test
  public void testIntSequenceOutputs() {
    IntSequenceOutputs outputs = IntSequenceOutputs.getSingleton();
    IntsRef a = new IntsRef(new int[] {1, 2, 3, 4}, 0, 4);
    IntsRef b = new IntsRef(new int[] {9, 1, 2, 7}, 1, 3);
    assertLaws(outputs, a, b);
    assertThat(outputs.common(a, b), is(new IntsRef(new int[] {1, 2}, 0, 2)));
  }

  @Test
  public void testSequenceSubtractRejectsNonPrefix() {
    CharSequenceOutputs chars = CharSequenceOutputs.getSingleton();
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> chars.subtract(new CharsRef("foobar"), new CharsRef("bar")));
    assertThat(e.getMessage(), containsString("not a prefix"));
    assertThat(chars.subtract(new CharsRef("foobar"), new CharsRef("foo")).toString(), is("bar"));

    ByteSequenceOutputs bytes = ByteSequenceOutputs.getSingleton();
    assertThrows(IllegalArgumentException.class, () -> bytes.subtract(new BytesRef("foobar"), new BytesRef("fob")));

    IntSequenceOutputs ints = IntSequenceOutputs.getSingleton();
    // same contents at a different offset still count as a prefix
    IntsRef output = new IntsRef(new int[] {1, 2, 3, 4}, 0, 4);
    assertThat(ints.subtract(output, new IntsRef(new int[] {0, 1, 2}, 1, 2)), is(new IntsRef(new int[] {3, 4}, 0, 2)));
    assertThrows(IllegalArgumentException.class, () -> ints.subtract(output, new IntsRef(new int[] {2, 1}, 0, 2)));
  }

  @Test
  public void testNoOutputs() {
    NoOutputs outputs = NoOutputs.getSingleton();
    Object none = outputs.getNoOutput();
    assertThat(outputs.add(none, none), sameInstance(none));
    assertThat(outputs.common(none, none), sameInstance(none));
    assertThat(outputs.subtract(none, none), sameInstance(none));
  }

  @Test
  public void testPairOutputs() {
    PairOutputs<Long, BytesRef> outputs = new PairOutputs<>(PositiveIntOutputs.getSingleton(), ByteSequenceOutputs.getSingleton());
    PairOutputs.Pair<Long, BytesRef> a = outputs.newPair(10L, new BytesRef("north"));
    PairOutputs.Pair<Long, BytesRef> b = outputs.newPair(4L, new BytesRef("nord"));
    assertLaws(outputs, a, b);
    PairOutputs.Pair<Long, BytesRef> common = outputs.common(a, b);
    assertThat(common.output1, is(4L));
    assertThat(common.output2, is(new BytesRef("nor")));
    assertThat(outputs.newPair(0L, new BytesRef()), sameInstance(outputs.getNoOutput()));
  }

  @Test
  public void testSkipOutputLeavesReaderAfterOutput() throws Exception {
    CharSequenceOutputs outputs = CharSequenceOutputs.getSingleton();
    byte[] bytes = new byte[64];
    ByteArrayDataOutput out = new ByteArrayDataOutput(bytes);
    outputs.write(new CharsRef("skip me"), out);
    outputs.writeFinalOutput(new CharsRef("keep"), out);
    out.writeByte((byte) 42);

    ForwardBytesReader in = new ForwardBytesReader(bytes);
    outputs.skipOutput(in);
    assertThat(outputs.readFinalOutput(in).toString(), is("keep"));
    assertThat(in.readByte(), is((byte) 42));

    in.setPosition(0);
    outputs.skipOutput(in);
    outputs.skipFinalOutput(in);
    assertThat(in.readByte(), is((byte) 42));
  }
}
