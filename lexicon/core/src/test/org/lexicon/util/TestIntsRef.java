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
package org.lexicon.util;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThrows;

public class TestIntsRef {

  @Test
  public void testEmpty() {
    IntsRef i = new IntsRef();
    assertThat(i.length, is(0));
    assertThat(i.isValid(), is(true));
  }

  @Test
  public void testSlices() {
    int[] ints = {9, 1, 2, 3, 9};
    IntsRef slice = new IntsRef(ints, 1, 3);
    IntsRef same = new IntsRef(new int[] {1, 2, 3}, 0, 3);
    assertThat(slice, is(same));
    assertThat(slice.hashCode(), is(same.hashCode()));
    assertThat(slice, not(new IntsRef(ints, 0, 3)));
    assertThat(slice.toString(), is("[1 2 3]"));

    IntsRef copy = IntsRef.deepCopyOf(slice);
    ints[1] = 100;
    assertThat(copy, is(same));
  }

  @Test
  public void testSignedOrder() {
    IntsRef negative = new IntsRef(new int[] {-1}, 0, 1);
    IntsRef positive = new IntsRef(new int[] {1}, 0, 1);
    assertThat(negative.compareTo(positive), lessThan(0));
    IntsRef prefix = new IntsRef(new int[] {1, 2}, 0, 1);
    assertThat(prefix.compareTo(new IntsRef(new int[] {1, 2}, 0, 2)), lessThan(0));
  }

  @Test
  public void testInvalidSlice() {
    IntsRef broken = new IntsRef(new int[] {1, 2}, 0, 2);
    broken.offset = 1;
    assertThrows(IllegalStateException.class, broken::isValid);
  }

  @Test
  public void testBuilder() {
    IntsRefBuilder builder = new IntsRefBuilder();
    for (int i = 0; i < 20; i++) {
      builder.append(i * i);
    }
    assertThat(builder.length(), is(20));
    assertThat(builder.intAt(19), is(361));

    IntsRef frozen = builder.toIntsRef();
    builder.setIntAt(0, -5);
    assertThat(frozen.ints[0], is(0));
    assertThat(builder.get().ints[0], is(-5));

    builder.copyInts(new IntsRef(new int[] {7, 8, 9}, 1, 2));
    assertThat(builder.get(), is(new IntsRef(new int[] {8, 9}, 0, 2)));

    builder.grow(100);
    assertThat(builder.ints().length >= 100, is(true));
    builder.setLength(1);
    assertThat(builder.get(), is(new IntsRef(new int[] {8}, 0, 1)));
    builder.clear();
    assertThat(builder.length(), is(0));
  }
}
