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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

public class TestDataInputOutput {

  private static InputStreamDataInput input(byte[] bytes) {
    return new InputStreamDataInput(new ByteArrayInputStream(bytes));
  }

  @Test
  public void testPrimitives() throws Exception {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    OutputStreamDataOutput out = new OutputStreamDataOutput(bytes);
    out.writeByte((byte) -7);
    out.writeShort((short) 0x1234);
    out.writeInt(-123456789);
    out.writeLong(Long.MIN_VALUE + 5);
    out.writeVInt(0);
    out.writeVInt(127);
    out.writeVInt(128);
    out.writeVInt(Integer.MAX_VALUE);
    out.writeVInt(-1);
    out.writeVLong(0L);
    out.writeVLong(Long.MAX_VALUE);
    out.writeString("gr\u00fc\u00dfe, lexicon");
    out.close();

    InputStreamDataInput in = input(bytes.toByteArray());
    assertThat(in.readByte(), is((byte) -7));
    assertThat(in.readShort(), is((short) 0x1234));
    assertThat(in.readInt(), is(-123456789));
    assertThat(in.readLong(), is(Long.MIN_VALUE + 5));
    assertThat(in.readVInt(), is(0));
    assertThat(in.readVInt(), is(127));
    assertThat(in.readVInt(), is(128));
    assertThat(in.readVInt(), is(Integer.MAX_VALUE));
    assertThat(in.readVInt(), is(-1));
    assertThat(in.readVLong(), is(0L));
    assertThat(in.readVLong(), is(Long.MAX_VALUE));
    assertThat(in.readString(), is("gr\u00fc\u00dfe, lexicon"));
    assertThrows(EOFException.class, in::readByte);
  }

  @Test
  public void testVIntLengths() throws Exception {
    byte[] buffer = new byte[16];
    ByteArrayDataOutput out = new ByteArrayDataOutput(buffer);
    out.writeVInt(127);
    assertThat(out.getPosition(), is(1));
    out.writeVInt(128);
    assertThat(out.getPosition(), is(3));
    out.writeVLong(1L << 56);
    assertThat(out.getPosition(), is(3 + 9));
  }

  @Test
  public void testNegativeVLongRejected() {
    OutputStreamDataOutput out = new OutputStreamDataOutput(new ByteArrayOutputStream());
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> out.writeVLong(-1L));
    assertThat(e.getMessage(), containsString("negative"));
  }

  @Test
  public void testMalformedVInt() {
    byte[] tooLong = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0x7F};
    IOException e = assertThrows(IOException.class, () -> input(tooLong).readVInt());
    assertThat(e.getMessage(), containsString("Invalid vInt"));

    byte[] negativeVLong = new byte[10];
    java.util.Arrays.fill(negativeVLong, (byte) 0xFF);
    assertThrows(IOException.class, () -> input(negativeVLong).readVLong());
  }

  @Test
  public void testSkipAndCopy() throws Exception {
    byte[] source = new byte[3000];
    for (int i = 0; i < source.length; i++) {
      source[i] = (byte) i;
    }
    InputStreamDataInput in = input(source);
    in.skipBytes(1500);
    assertThat(in.readByte(), is((byte) 1500));
    assertThrows(IllegalArgumentException.class, () -> in.skipBytes(-1));

    ByteArrayOutputStream copy = new ByteArrayOutputStream();
    new OutputStreamDataOutput(copy).copyBytes(in, 1499);
    byte[] copied = copy.toByteArray();
    assertThat(copied.length, is(1499));
    assertThat(copied[0], is((byte) 1501));
    assertThat(copied[1498], is((byte) 2999));
  }

  @Test
  public void testResourceDescription() {
    assertThat(new InputStreamDataInput(new ByteArrayInputStream(new byte[0]), "terms.fst").toString(), is("terms.fst"));
    CorruptDataException e = new CorruptDataException("bad magic", "terms.fst");
    assertThat(e.getMessage(), is("bad magic (resource=terms.fst)"));
    assertThat(e.getOriginalMessage(), is("bad magic"));
  }
}
