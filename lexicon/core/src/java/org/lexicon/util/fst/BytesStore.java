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
import java.util.ArrayList;
import java.util.List;

import org.lexicon.store.DataInput;
import org.lexicon.store.DataOutput;
import org.lexicon.util.Accountable;
import org.lexicon.util.RamUsageEstimator;

/**
 * Paged byte storage used while compiling an FST and, for large automata,
 * while reading one back.
 * 每个block 都是一个 byte[]，大小为 1 &lt;&lt; blockBits
 */
class BytesStore extends DataOutput implements Accountable {

  private static final long BASE_RAM_BYTES_USED =
        RamUsageEstimator.shallowSizeOfInstance(BytesStore.class)
      + RamUsageEstimator.shallowSizeOfInstance(ArrayList.class);

  private final List<byte[]> blocks = new ArrayList<>();

  private final int blockSize;
  private final int blockBits;
  private final int blockMask;

  /** 当前正在写入的 block */
  private byte[] current;
  /** 下一个写入位置 (block 内偏移) */
  private int nextWrite;

  public BytesStore(int blockBits) {
    this.blockBits = blockBits;
    this.blockSize = 1 << blockBits;
    this.blockMask = blockSize - 1;
    this.nextWrite = blockSize;
  }

  /** Reads {@code numBytes} from {@code in} into pages of at most {@code maxBlockSize} bytes. */
  public BytesStore(DataInput in, long numBytes, int maxBlockSize) throws IOException {
    int bits = 1;
    while ((1L << bits) < numBytes && (1 << bits) < maxBlockSize) {
      bits++;
    }
    this.blockBits = bits;
    this.blockSize = 1 << bits;
    this.blockMask = blockSize - 1;
    for (long left = numBytes; left > 0; left -= blockSize) {
      byte[] block = new byte[(int) Math.min(blockSize, left)];
      in.readBytes(block, 0, block.length);
      blocks.add(block);
    }
    // read-only from here on, but getPosition() must report numBytes
    nextWrite = blocks.isEmpty() ? blockSize : blocks.get(blocks.size() - 1).length;
  }

  private int blockIndex(long pos) {
    return (int) (pos >> blockBits);
  }

  private int blockOffset(long pos) {
    return (int) (pos & blockMask);
  }

  private void appendBlock() {
    current = new byte[blockSize];
    blocks.add(current);
    nextWrite = 0;
  }

  /** Block holding the byte just before {@code end}. */
  private byte[] blockEndingAt(long end) {
    return blocks.get(blockIndex(end - 1));
  }

  /** Number of bytes of {@link #blockEndingAt} that lie before {@code end}. */
  private int headLength(long end) {
    return blockOffset(end - 1) + 1;
  }

  @Override
  public void writeByte(byte b) {
    if (nextWrite == blockSize) {
      appendBlock();
    }
    current[nextWrite++] = b;
  }

  @Override
  public void writeBytes(byte[] b, int offset, int len) {
    while (len > 0) {
      if (nextWrite == blockSize) {
        appendBlock();
      }
      int chunk = Math.min(len, blockSize - nextWrite);
      System.arraycopy(b, offset, current, nextWrite, chunk);
      nextWrite += chunk;
      offset += chunk;
      len -= chunk;
    }
  }

  /** Overwrites already written bytes at {@code dest}; the current position does not move. */
  void writeBytes(long dest, byte[] b, int offset, int len) {
    assert dest + len <= getPosition(): "dest=" + dest + " pos=" + getPosition() + " len=" + len;
    while (len > 0) {
      int upto = blockOffset(dest);
      int chunk = Math.min(len, blockSize - upto);
      System.arraycopy(b, offset, blocks.get(blockIndex(dest)), upto, chunk);
      dest += chunk;
      offset += chunk;
      len -= chunk;
    }
  }

  /** Moves {@code len} already written bytes from {@code src} up to {@code dest}.
   *  The two ranges may overlap, so the copy runs from the end. */
  public void copyBytes(long src, long dest, int len) {
    assert src < dest;
    assert dest + len <= getPosition();
    long srcEnd = src + len;
    long destEnd = dest + len;
    while (len > 0) {
      int srcHead = headLength(srcEnd);
      int destHead = headLength(destEnd);
      int chunk = Math.min(len, Math.min(srcHead, destHead));
      System.arraycopy(blockEndingAt(srcEnd), srcHead - chunk, blockEndingAt(destEnd), destHead - chunk, chunk);
      srcEnd -= chunk;
      destEnd -= chunk;
      len -= chunk;
    }
  }

  /** Reverses the bytes between {@code srcPos} and {@code destPos}, both inclusive. */
  public void reverse(long srcPos, long destPos) {
    assert srcPos < destPos;
    assert destPos < getPosition();
    for (long lo = srcPos, hi = destPos; lo < hi; lo++, hi--) {
      byte[] loBlock = blocks.get(blockIndex(lo));
      byte[] hiBlock = blocks.get(blockIndex(hi));
      int loUpto = blockOffset(lo);
      int hiUpto = blockOffset(hi);
      byte b = loBlock[loUpto];
      loBlock[loUpto] = hiBlock[hiUpto];
      hiBlock[hiUpto] = b;
    }
  }

  /** Appends {@code len} zero bytes, used to reserve room for a node that is expanded in place. */
  public void skipBytes(int len) {
    while (len > 0) {
      if (nextWrite == blockSize) {
        appendBlock();
      }
      int chunk = Math.min(len, blockSize - nextWrite);
      nextWrite += chunk;
      len -= chunk;
    }
  }

  public long getPosition() {
    return ((long) blocks.size() - 1) * blockSize + nextWrite;
  }

  /** 裁剪最后一个 block，之后不再写入 */
  public void finish() {
    if (current != null) {
      byte[] last = new byte[nextWrite];
      System.arraycopy(current, 0, last, 0, nextWrite);
      blocks.set(blocks.size() - 1, last);
      current = null;
    }
  }

  /** Writes all of our bytes to the target {@link DataOutput}. */
  public void writeTo(DataOutput out) throws IOException {
    for (byte[] block : blocks) {
      out.writeBytes(block, 0, block.length);
    }
  }

  private void checkPosition(long pos, long limit) {
    if (pos < 0 || pos > limit) {
      throw new IndexOutOfBoundsException("position " + pos + " is out of bounds [0, " + limit + "]");
    }
  }

  /** Returns a reader that walks the bytes in write order. */
  public FST.BytesReader getForwardReader() {
    if (blocks.size() == 1) {
      return new ForwardBytesReader(blocks.get(0));
    }
    return new PagedForwardReader();
  }

  public FST.BytesReader getReverseReader() {
    return getReverseReader(true);
  }

  /**
   * @param allowSingle  单个 block 时是否直接使用 {@link ReverseBytesReader}
   */
  FST.BytesReader getReverseReader(boolean allowSingle) {
    if (allowSingle && blocks.size() == 1) {
      return new ReverseBytesReader(blocks.get(0));
    }
    return new PagedReverseReader();
  }

  private final class PagedForwardReader extends FST.BytesReader {
    private byte[] block;
    private int index = -1;
    private int upto = blockSize;

    private void nextBlock() {
      block = blocks.get(++index);
      upto = 0;
    }

    @Override
    public byte readByte() {
      if (upto == blockSize) {
        nextBlock();
      }
      return block[upto++];
    }

    @Override
    public void readBytes(byte[] b, int offset, int len) {
      while (len > 0) {
        if (upto == blockSize) {
          nextBlock();
        }
        int chunk = Math.min(len, blockSize - upto);
        System.arraycopy(block, upto, b, offset, chunk);
        upto += chunk;
        offset += chunk;
        len -= chunk;
      }
    }

    @Override
    public void skipBytes(long count) {
      setPosition(getPosition() + count);
    }

    @Override
    public long getPosition() {
      return (long) index * blockSize + upto;
    }

    @Override
    public void setPosition(long pos) {
      // the end of the store is a legal resting place for a forward reader
      checkPosition(pos, BytesStore.this.getPosition());
      index = blockIndex(pos);
      if (index == blocks.size()) {
        index--;
      }
      block = index < 0 ? null : blocks.get(index);
      upto = (int) (pos - (long) index * blockSize);
      assert getPosition() == pos;
    }

    @Override
    public boolean reversed() {
      return false;
    }
  }

  private final class PagedReverseReader extends FST.BytesReader {
    private byte[] block = blocks.isEmpty() ? null : blocks.get(0);
    private int index;
    private int upto;

    @Override
    public byte readByte() {
      if (upto == -1) {
        block = blocks.get(--index);
        upto = blockSize - 1;
      }
      return block[upto--];
    }

    @Override
    public void readBytes(byte[] b, int offset, int len) {
      for (int i = 0; i < len; i++) {
        b[offset + i] = readByte();
      }
    }

    @Override
    public void skipBytes(long count) {
      setPosition(getPosition() - count);
    }

    @Override
    public long getPosition() {
      return (long) index * blockSize + upto;
    }

    @Override
    public void setPosition(long pos) {
      checkPosition(pos, BytesStore.this.getPosition() - 1);
      index = blockIndex(pos);
      block = blocks.get(index);
      upto = blockOffset(pos);
      assert getPosition() == pos: "pos=" + pos + " getPos()=" + getPosition();
    }

    @Override
    public boolean reversed() {
      return true;
    }
  }

  @Override
  public long ramBytesUsed() {
    long size = BASE_RAM_BYTES_USED;
    for (byte[] block : blocks) {
      size += RamUsageEstimator.sizeOf(block);
    }
    return size;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(numBlocks=" + blocks.size() + ")";
  }
}
