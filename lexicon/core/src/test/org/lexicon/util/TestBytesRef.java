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
import static org.hamcrest.Matchers.greaterThan;

public class TestBytesRef {

  @Test
  public void testEmpty() {
    BytesRef b = new BytesRef();
    assertThat(b.length, is(0));
    assertThat(b.offset, is(0));
    assertThat(b.isValid(), is(true));
  }

  @Test
  public void testSliceEquality() {
    byte[] bytes = {'x', 'l', 'e', 'x', 'y'};
    BytesRef slice = new BytesRef(bytes, 1, 3);
    assertThat(slice, is(new BytesRef("lex")));
    assertThat(slice.hashCode(), is(new BytesRef("lex").hashCode()));
    assertThat(slice.utf8ToString(), is("lex"));
    assertThat(slice, not(new BytesRef("le")));

    BytesRef copy = BytesRef.deepCopyOf(slice);
    bytes[1] = 'L';
    assertThat(copy.utf8ToString(), is("lex"));
    assertThat(copy.offset, is(0));
  }

  @Test
  public void testUnsignedOrder() {
    BytesRef low = new BytesRef(new byte[] {0x7F});
    BytesRef high = new BytesRef(new byte[] {(byte) 0x80});
    assertThat(low.compareTo(high), lessThan(0));
    assertThat(new BytesRef("ab").compareTo(new BytesRef("a")), greaterThan(0));
  }

  @Test
  public void testToString() {
    assertThat(new BytesRef(new byte[] {0x6c, (byte) 0xff}).toString(), is("[6c ff]"));
  }

  @Test
  public void testBuilder() {
    BytesRefBuilder builder = new BytesRefBuilder();
    builder.copyChars("lexi");
    builder.append((byte) 'c');
    builder.append(new BytesRef("xon"));
    assertThat(builder.length(), is(8));
    assertThat(builder.get().utf8ToString(), is("lexicxon"));

    builder.setLength(5);
    builder.append(new byte[] {'o', 'n'}, 0, 2);
    assertThat(builder.byteAt(5), is((byte) 'o'));
    BytesRef frozen = builder.toBytesRef();
    builder.setByteAt(0, (byte) 'L');
    assertThat(frozen.utf8ToString(), is("lexicon"));
    assertThat(builder.get().utf8ToString(), is("Lexicon"));

    builder.copyBytes(new BytesRef("fst"));
    assertThat(builder.get(), is(new BytesRef("fst")));
    builder.clear();
    assertThat(builder.length(), is(0));
  }
}
