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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lexicon.codecs.CodecUtil;
import org.lexicon.store.CorruptDataException;
import org.lexicon.util.BytesRef;
import org.lexicon.util.CharsRef;
import org.lexicon.util.InfoStream;
import org.lexicon.util.IntsRef;
import org.lexicon.util.IntsRefBuilder;
import org.lexicon.util.fst.FSTTester.Encoding;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertThrows;
import static org.lexicon.util.fst.FSTTester.ints;
import static org.lexicon.util.fst.FSTTester.longs;

public class TestFSTs {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testCatCatsDog() throws Exception {
    for (Encoding encoding : Encoding.values()) {
      FST<Long> fst = FSTTester.build(encoding, longs("cat", 1, "cats", 2, "dog", 3));
      assertThat(Util.get(fst, new BytesRef("cat")), is(1L));
      assertThat(Util.get(fst, new BytesRef("cats")), is(2L));
      assertThat(Util.get(fst, new BytesRef("dog")), is(3L));
      assertThat(Util.get(fst, new BytesRef("ca")), nullValue());
      assertThat(Util.get(fst, new BytesRef("do")), nullValue());
      assertThat(Util.get(fst, new BytesRef("catss")), nullValue());
      assertThat(Util.get(fst, new BytesRef("")), nullValue());
      assertThat(Util.get(fst, ints("cats")), is(2L));
    }
  }

  @Test
  public void testRandomRoundTrip() throws Exception {
    Random random = new Random(0x5eed);
    TreeSet<String> all = FSTTester.randomKeys(random, 600, 8);
    SortedMap<String, Long> entries = new TreeMap<>();
    List<String> absent = new ArrayList<>();
    for (String key : all) {
      if (random.nextInt(3) == 0) {
        absent.add(key);
      } else {
        entries.put(key, (long) random.nextInt(1000));
      }
    }

    for (Encoding encoding : Encoding.values()) {
      for (boolean shareSuffix : new boolean[] {true, false}) {
        FST<Long> fst = FSTTester.build(PositiveIntOutputs.getSingleton(), encoding, shareSuffix, entries);
        for (String key : entries.keySet()) {
          assertThat(encoding + " " + key, Util.get(fst, new BytesRef(key)), is(entries.get(key)));
        }
        for (String key : absent) {
          assertThat(encoding + " " + key, Util.get(fst, ints(key)), nullValue());
        }
        assertThat(FSTTester.keysOf(fst), is(new ArrayList<>(entries.keySet())));
      }
    }
  }

  @Test
  public void testSuffixSharingShrinksTheGraph() throws Exception {
    SortedMap<String, Object> entries = new TreeMap<>();
    for (String prefix : new String[] {"bake", "fake", "make", "rake", "take", "wake"}) {
      entries.put(prefix + "d", NoOutputs.getSingleton().getNoOutput());
      entries.put(prefix + "s", NoOutputs.getSingleton().getNoOutput());
    }
    FST<Object> shared = FSTTester.build(NoOutputs.getSingleton(), Encoding.SEQUENTIAL, true, entries);
    FST<Object> unshared = FSTTester.build(NoOutputs.getSingleton(), Encoding.SEQUENTIAL, false, entries);
    assertThat(unshared.numBytes(), greaterThan(shared.numBytes()));
    assertThat(FSTTester.keysOf(shared), is(FSTTester.keysOf(unshared)));
  }

  @Test
  public void testByteSequenceOutputs() throws Exception {
    SortedMap<String, BytesRef> entries = new TreeMap<>();
    entries.put("apple", new BytesRef("fruit/red"));
    entries.put("apricot", new BytesRef("fruit/orange"));
    entries.put("asparagus", new BytesRef("vegetable"));
    for (Encoding encoding : Encoding.values()) {
      FST<BytesRef> fst = FSTTester.build(ByteSequenceOutputs.getSingleton(), encoding, true, entries);
      assertThat(Util.get(fst, new BytesRef("apricot")).utf8ToString(), is("fruit/orange"));
      assertThat(Util.get(fst, new BytesRef("apple")).utf8ToString(), is("fruit/red"));
      assertThat(Util.get(fst, new BytesRef("asparagus")).utf8ToString(), is("vegetable"));
      assertThat(Util.get(fst, new BytesRef("ap")), nullValue());
    }
  }

  @Test
  public void testCharSequenceOutputsSurviveSaveAndLoad() throws Exception {
    SortedMap<String, CharsRef> entries = new TreeMap<>();
    entries.put("ein", new CharsRef("one"));
    entries.put("eins", new CharsRef("one!"));
    entries.put("zwei", new CharsRef("two"));
    FST<CharsRef> fst = FSTTester.build(CharSequenceOutputs.getSingleton(), Encoding.DEFAULT, true, entries);
    FST<CharsRef> loaded = FSTTester.load(FSTTester.save(fst), CharSequenceOutputs.getSingleton());
    assertThat(Util.get(loaded, new BytesRef("ein")).toString(), is("one"));
    assertThat(Util.get(loaded, new BytesRef("eins")).toString(), is("one!"));
    assertThat(Util.get(loaded, new BytesRef("zwei")).toString(), is("two"));
  }

  @Test
  public void testPairOutputs() throws Exception {
    PairOutputs<Long, BytesRef> outputs = new PairOutputs<>(PositiveIntOutputs.getSingleton(), ByteSequenceOutputs.getSingleton());
    SortedMap<String, PairOutputs.Pair<Long, BytesRef>> entries = new TreeMap<>();
    entries.put("lucky", outputs.newPair(7L, new BytesRef("seven")));
    entries.put("lunar", outputs.newPair(3L, new BytesRef("three")));
    FST<PairOutputs.Pair<Long, BytesRef>> fst = FSTTester.build(outputs, Encoding.DEFAULT, true, entries);
    PairOutputs.Pair<Long, BytesRef> lucky = Util.get(fst, new BytesRef("lucky"));
    assertThat(lucky.output1, is(7L));
    assertThat(lucky.output2.utf8ToString(), is("seven"));
    PairOutputs.Pair<Long, BytesRef> lunar = Util.get(fst, new BytesRef("lunar"));
    assertThat(lunar.output1, is(3L));
    assertThat(lunar.output2.utf8ToString(), is("three"));
  }

  @Test
  public void testUtf32Input() throws Exception {
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE4, PositiveIntOutputs.getSingleton());
    IntsRefBuilder scratch = new IntsRefBuilder();
    // sorted by code point
    String[] keys = {"abc", "ab\uD83D\uDE00", "\u4E2D\u6587"};
    for (int i = 0; i < keys.length; i++) {
      compiler.add(Util.toUTF32(keys[i], scratch), (long) i + 1);
    }
    FST<Long> fst = compiler.compile();
    for (int i = 0; i < keys.length; i++) {
      assertThat(Util.get(fst, Util.toUTF32(keys[i], scratch)), is((long) i + 1));
    }
    assertThat(fst.getInputType(), is(FST.INPUT_TYPE.BYTE4));
  }

  @Test
  public void testEmptyInput() throws Exception {
    FST<Long> fst = FSTTester.build(Encoding.DEFAULT, longs("", 5, "a", 7));
    assertThat(Util.get(fst, new BytesRef("")), is(5L));
    assertThat(Util.get(fst, new BytesRef("a")), is(7L));
    assertThat(fst.getEmptyOutput(), is(5L));

    FST<Long> loaded = FSTTester.load(FSTTester.save(fst), PositiveIntOutputs.getSingleton());
    assertThat(Util.get(loaded, new BytesRef("")), is(5L));
    assertThat(Util.get(loaded, new BytesRef("a")), is(7L));
  }

  @Test
  public void testOnlyEmptyInput() throws Exception {
    FST<Long> fst = FSTTester.build(Encoding.DEFAULT, longs("", 42));
    assertThat(Util.get(fst, new BytesRef("")), is(42L));
    assertThat(Util.get(fst, new BytesRef("x")), nullValue());
  }

  @Test
  public void testReadFirstTargetArcInPlace() throws Exception {
    for (Encoding encoding : Encoding.values()) {
      FST<Long> fst = FSTTester.build(encoding, longs("cat", 1, "cats", 2, "dog", 3));
      FST.BytesReader in = fst.getBytesReader();
      FST.Arc<Long> arc = fst.getFirstArc(new FST.Arc<>());
      for (char c : "cat".toCharArray()) {
        assertThat(fst.findTargetArc(c, arc, arc, in).label(), is((int) c));
      }
      assertThat(arc.isFinal(), is(true));

      // the arc is both the source and the destination
      fst.readFirstTargetArc(arc, arc, in);
      assertThat(arc.label(), is(FST.END_LABEL));
      assertThat(arc.isLast(), is(false));
      fst.readNextArc(arc, in);
      assertThat(encoding.toString(), arc.label(), is((int) 's'));
      assertThat(arc.isLast(), is(true));
    }
  }

  @Test
  public void testNothingAccepted() throws Exception {
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
    assertThat(compiler.compile(), nullValue());
  }

  @Test
  public void testOutOfOrderInputRejected() throws Exception {
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
    compiler.add(ints("dog"), 1L);
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> compiler.add(ints("cat"), 2L));
    assertThat(e.getMessage(), containsString("out of order"));
  }

  @Test
  public void testDuplicateInputRejected() throws Exception {
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
    compiler.add(ints("dog"), 1L);
    assertThrows(IllegalArgumentException.class, () -> compiler.add(ints("dog"), 1L));
  }

  @Test
  public void testDuplicateEmptyInputRejected() throws Exception {
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
    compiler.add(new IntsRef(), 1L);
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> compiler.add(new IntsRef(), 2L));
    assertThat(e.getMessage(), containsString("empty input"));
  }

  @Test
  public void testEmptyInputAfterOthersRejected() throws Exception {
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
    compiler.add(ints("a"), 1L);
    assertThrows(IllegalArgumentException.class, () -> compiler.add(new IntsRef(), 2L));
  }

  @Test
  public void testLabelMustFitInputType() {
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
    IntsRef input = new IntsRef(new int[] {'a', 256}, 0, 2);
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> compiler.add(input, 1L));
    assertThat(e.getMessage(), containsString("256"));
  }

  @Test
  public void testCompileTwice() throws Exception {
    FSTCompiler<Long> compiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
    compiler.add(ints("a"), 1L);
    compiler.compile();
    assertThrows(IllegalStateException.class, compiler::compile);
    assertThrows(IllegalStateException.class, () -> compiler.add(ints("b"), 2L));
  }

  @Test
  public void testBuilderValidation() {
    PositiveIntOutputs outputs = PositiveIntOutputs.getSingleton();
    assertThrows(IllegalArgumentException.class,
        () -> new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, outputs).bytesPageBits(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, outputs).bytesPageBits(31).build());
    assertThrows(IllegalArgumentException.class,
        () -> new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, outputs).shareMaxTailLength(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, outputs).fixedLengthArcsDeepNumArcs(-3).build());
    assertThrows(IllegalArgumentException.class,
        () -> new FSTCompiler.Builder<>(null, outputs).build());
    assertThrows(IllegalArgumentException.class,
        () -> new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, outputs).infoStream(null));
  }

  @Test
  public void testStatistics() throws Exception {
    FSTCompiler<Long> compiler = FSTTester.compiler(PositiveIntOutputs.getSingleton(), Encoding.FIXED_ARRAYS, true);
    FST<Long> fst = FSTTester.compile(compiler, longs("cat", 1, "cats", 2, "dog", 3));
    assertThat(compiler.getTermCount(), is(3L));
    assertThat(compiler.getArcCount(), greaterThan(0L));
    assertThat(compiler.getNodeCount(), greaterThan(1L));
    assertThat(compiler.getBinarySearchNodeCount(), is(compiler.getNodeCount() - 1));
    assertThat(compiler.fstRamBytesUsed(), is(fst.ramBytesUsed()));

    FSTCompiler<Long> sequential = FSTTester.compiler(PositiveIntOutputs.getSingleton(), Encoding.SEQUENTIAL, true);
    FSTTester.compile(sequential, longs("cat", 1, "cats", 2, "dog", 3));
    assertThat(sequential.getBinarySearchNodeCount(), is(0L));
  }

  @Test
  public void testSaveAndLoad() throws Exception {
    SortedMap<String, Long> entries = FSTTester.ordinals(FSTTester.randomKeys(new Random(17), 300, 6));
    for (Encoding encoding : Encoding.values()) {
      FST<Long> fst = FSTTester.build(encoding, entries);
      byte[] bytes = FSTTester.save(fst);
      FST<Long> loaded = FSTTester.load(bytes, PositiveIntOutputs.getSingleton());
      assertThat(loaded.getInputType(), is(FST.INPUT_TYPE.BYTE1));
      assertThat(loaded.numBytes(), is(fst.numBytes()));
      for (String key : entries.keySet()) {
        assertThat(Util.get(loaded, new BytesRef(key)), is(entries.get(key)));
      }
      // saving a loaded automaton gives the same bytes back
      assertThat(FSTTester.save(loaded), is(bytes));
    }
  }

  @Test
  public void testLoadIntoSmallPages() throws Exception {
    SortedMap<String, Long> entries = FSTTester.ordinals(FSTTester.randomKeys(new Random(3), 200, 6));
    FST<Long> fst = FSTTester.build(Encoding.DEFAULT, entries);
    byte[] bytes = FSTTester.save(fst);
    FST<Long> paged = FSTTester.load(bytes, PositiveIntOutputs.getSingleton(), new OnHeapFSTStore(4));
    for (String key : entries.keySet()) {
      assertThat(Util.get(paged, new BytesRef(key)), is(entries.get(key)));
    }
    assertThat(FSTTester.keysOf(paged), is(new ArrayList<>(entries.keySet())));
    assertThat(FSTTester.save(paged), is(bytes));
  }

  @Test
  public void testSaveAndReadPath() throws Exception {
    FST<Long> fst = FSTTester.build(Encoding.DEFAULT, longs("cat", 1, "cats", 2, "dog", 3));
    Path path = tmp.newFolder().toPath().resolve("words.fst");
    fst.save(path);
    FST<Long> loaded = FST.read(path, PositiveIntOutputs.getSingleton());
    assertThat(Util.get(loaded, new BytesRef("cats")), is(2L));
    assertThat(Util.get(loaded, new BytesRef("dog")), is(3L));
  }

  @Test
  public void testCorruptPathNamesTheFile() throws Exception {
    FST<Long> fst = FSTTester.build(Encoding.DEFAULT, longs("cat", 1));
    byte[] bytes = FSTTester.save(fst);
    bytes[0] ^= 0x55;
    Path path = tmp.newFolder().toPath().resolve("broken.fst");
    Files.write(path, bytes);
    CorruptDataException e = assertThrows(CorruptDataException.class, () -> FST.read(path, PositiveIntOutputs.getSingleton()));
    assertThat(e.getResourceDescription(), is(path.toString()));
  }

  @Test
  public void testBadCodecName() throws Exception {
    byte[] bytes = FSTTester.save(FSTTester.build(Encoding.DEFAULT, longs("cat", 1)));
    // codec name follows the 4 byte magic and its 1 byte length
    bytes[5] = 'X';
    CorruptDataException e = assertThrows(CorruptDataException.class,
        () -> FSTTester.load(bytes, PositiveIntOutputs.getSingleton()));
    assertThat(e.getMessage(), containsString("codec mismatch"));
  }

  @Test
  public void testBadInputType() throws Exception {
    byte[] bytes = FSTTester.save(FSTTester.build(Encoding.DEFAULT, longs("cat", 1)));
    int pos = CodecUtil.headerLength("FST");
    assertThat(bytes[pos], is((byte) 0)); // no empty output
    bytes[pos + 1] = 7;
    CorruptDataException e = assertThrows(CorruptDataException.class,
        () -> FSTTester.load(bytes, PositiveIntOutputs.getSingleton()));
    assertThat(e.getMessage(), containsString("invalid input type 7"));
  }

  @Test
  public void testSaveUnfinished() {
    FST<Long> fst = new FST<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton(), 15);
    assertThat(fst.isFinished(), is(false));
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> FSTTester.save(fst));
    assertThat(e.getMessage(), containsString("finish"));
  }

  @Test
  public void testInfoStream() throws Exception {
    List<String> messages = new ArrayList<>();
    InfoStream infoStream = new InfoStream() {
      @Override
      public void message(String component, String message) {
        messages.add(component + ": " + message);
      }

      @Override
      public boolean isEnabled(String component) {
        return FSTCompiler.INFO_STREAM_COMPONENT.equals(component);
      }

      @Override
      public void close() {
      }
    };

    FSTCompiler<Long> compiler = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton())
        .infoStream(infoStream)
        .build();
    FSTTester.compile(compiler, FSTTester.ordinals(FSTTester.randomKeys(new Random(11), 400, 7)));

    assertThat(messages.get(messages.size() - 1), startsWith("FST: compile: terms=400 "));
    boolean rehashed = false;
    for (String message : messages) {
      rehashed |= message.startsWith("FST: node hash rehash: 16 -> 32 slots");
    }
    assertThat(rehashed, is(true));

    messages.clear();
    FSTCompiler<Long> empty = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton())
        .infoStream(infoStream)
        .build();
    assertThat(empty.compile(), nullValue());
    assertThat(messages, hasItem("FST: compile: no input accepted"));
  }

  @Test
  public void testToString() throws Exception {
    FST<Long> fst = FSTTester.build(Encoding.DEFAULT, longs("a", 1));
    assertThat(fst.toString(), is("FST(input=BYTE1,output=PositiveIntOutputs)"));
  }
}
