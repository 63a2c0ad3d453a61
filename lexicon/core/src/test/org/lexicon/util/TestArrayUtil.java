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
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

public class TestArrayUtil {

  @Test
  public void testOversizeGrowsMonotonically() {
    int previous = 0;
    for (int size = 1; size < 100_000; size += 1 + size / 3) {
      int oversize = ArrayUtil.oversize(size, Integer.BYTES);
      assertThat(oversize, greaterThanOrEqualTo(size));
      assertThat(oversize, greaterThanOrEqualTo(previous));
      previous = oversize;
    }
    assertThat(ArrayUtil.oversize(0, 1), is(0));
    assertThat(ArrayUtil.oversize(1, 1), greaterThan(1));
  }

  @Test
  public void testOversizeRejectsBadSizes() {
    assertThrows(IllegalArgumentException.class, () -> ArrayUtil.oversize(-1, 1));
    assertThrows(IllegalArgumentException.class, () -> ArrayUtil.oversize(Integer.MAX_VALUE, 1));
  }

  @Test
  public void testGrowKeepsContent() {
    byte[] bytes = {1, 2, 3};
    byte[] grown = ArrayUtil.grow(bytes, 10);
    assertThat(grown.length, greaterThanOrEqualTo(10));
    assertThat(grown[2], is((byte) 3));
    assertThat(ArrayUtil.grow(grown, 5), sameInstance(grown));

    int[] ints = ArrayUtil.grow(new int[] {4, 5}, 3);
    assertThat(ints[1], is(5));
    long[] longs = ArrayUtil.grow(new long[] {6L}, 2);
    assertThat(longs[0], is(6L));
    String[] strings = ArrayUtil.grow(new String[] {"a"}, 4);
    assertThat(strings.length, greaterThanOrEqualTo(4));
    assertThat(strings[0], is("a"));
  }

  @Test
  public void testCopyOfSubArray() {
    int[] copy = ArrayUtil.copyOfSubArray(new int[] {1, 2, 3, 4}, 1, 3);
    assertThat(copy.length, is(2));
    assertThat(copy[0], is(2));
    assertThat(copy[1], is(3));
  }
}
