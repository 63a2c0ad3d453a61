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

/**
 * Walks the keys of an FST in order and seeks among them.
 * Subclasses own the key buffer; this class keeps one arc and one
 * cumulative output per depth.
 */
abstract class FSTEnum<T> {
  protected final FST<T> fst;

  /** arcs[i] is the arc taken at depth i; arcs[0] is the virtual arc into the root. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  protected FST.Arc<T>[] arcs = new FST.Arc[10];

  /** output[i] sums the outputs of arcs[1..i]. */
  @SuppressWarnings("unchecked")
  protected T[] output = (T[]) new Object[10];

  protected final T NO_OUTPUT;
  protected final FST.BytesReader fstReader;

  /** Current key length plus one, or 0 before the first move. */
  protected int upto;
  int targetLength;

  FSTEnum(FST<T> fst) {
    this.fst = fst;
    fstReader = fst.getBytesReader();
    NO_OUTPUT = fst.outputs.getNoOutput();
    fst.getFirstArc(getArc(0));
    output[0] = NO_OUTPUT;
  }

  /** Label of the seek target at depth {@code upto}, or {@link FST#END_LABEL} past its end. */
  protected abstract int getTargetLabel();

  protected abstract int getCurrentLabel();

  protected abstract void setCurrentLabel(int label);

  /** Makes room in the key buffer for depth {@code upto}. */
  protected abstract void grow();

  private static boolean isArrayNode(FST.Arc<?> arc) {
    return arc.bytesPerArc() != 0 && arc.label() != FST.END_LABEL;
  }

  /** Keeps the part of the current key that the target shares, so a seek
   *  resumes from the first differing depth. */
  private void rewindPrefix() throws IOException {
    if (upto == 0) {
      upto = 1;
      fst.readFirstTargetArc(getArc(0), getArc(1), fstReader);
      return;
    }

    final int limit = upto;
    for (upto = 1; upto < limit && upto <= targetLength + 1; upto++) {
      final int cmp = getCurrentLabel() - getTargetLabel();
      if (cmp > 0) {
        // the current key is already past the target here
        fst.readFirstTargetArc(getArc(upto - 1), getArc(upto), fstReader);
      }
      if (cmp != 0) {
        return;
      }
    }
  }

  protected void doNext() throws IOException {
    if (upto == 0) {
      upto = 1;
      fst.readFirstTargetArc(getArc(0), getArc(1), fstReader);
    } else {
      while (arcs[upto].isLast()) {
        if (--upto == 0) {
          return;
        }
      }
      fst.readNextArc(arcs[upto], fstReader);
    }
    pushFirst();
  }

  /** Takes {@code arc}, which matched the target label, and returns the first
   *  arc one level down, or null once the final pseudo arc was matched. */
  private FST.Arc<T> descend(FST.Arc<T> arc, int label) throws IOException {
    output[upto] = fst.outputs.add(output[upto - 1], arc.output());
    if (label == FST.END_LABEL) {
      return null;
    }
    setCurrentLabel(label);
    incr();
    return fst.readFirstTargetArc(arc, getArc(upto), fstReader);
  }

  /** Seeks to smallest term that's &gt;= target. */
  protected void doSeekCeil() throws IOException {
    rewindPrefix();
    FST.Arc<T> arc = getArc(upto);
    while (arc != null) {
      final int label = getTargetLabel();
      arc = isArrayNode(arc) ? seekCeilInArray(arc, label) : seekCeilInList(arc, label);
    }
  }

  private FST.Arc<T> seekCeilInArray(FST.Arc<T> arc, int label) throws IOException {
    final int idx = Util.binarySearch(fst, arc, label);
    if (idx >= 0) {
      fst.readArcByIndex(arc, fstReader, idx);
      assert arc.label() == label : "arc.label=" + arc.label() + " vs label=" + label;
      return descend(arc, label);
    }
    final int ceil = -1 - idx;
    if (ceil < arc.numArcs()) {
      fst.readArcByIndex(arc, fstReader, ceil);
      assert arc.label() > label;
      pushFirst();
      return null;
    }
    // every arc of this node sorts before the target
    fst.readArcByIndex(arc, fstReader, ceil - 1);
    assert arc.isLast();
    upto--;
    return nextFork();
  }

  private FST.Arc<T> seekCeilInList(FST.Arc<T> arc, int label) throws IOException {
    if (arc.label() == label) {
      return descend(arc, label);
    }
    if (arc.label() > label) {
      pushFirst();
      return null;
    }
    if (arc.isLast()) {
      upto--;
      return nextFork();
    }
    return fst.readNextArc(arc, fstReader);
  }

  // 回退到最近一个还有后续 arc 的节点, 然后取下一个 arc
  private FST.Arc<T> nextFork() throws IOException {
    for (; upto > 0; upto--) {
      final FST.Arc<T> arc = getArc(upto);
      if (!arc.isLast()) {
        fst.readNextArc(arc, fstReader);
        pushFirst();
        return null;
      }
    }
    return null;
  }

  /** Seeks to largest term that's &lt;= target. */
  void doSeekFloor() throws IOException {
    rewindPrefix();
    FST.Arc<T> arc = getArc(upto);
    while (arc != null) {
      final int label = getTargetLabel();
      arc = isArrayNode(arc) ? seekFloorInArray(arc, label) : seekFloorInList(arc, label);
    }
  }

  private FST.Arc<T> seekFloorInArray(FST.Arc<T> arc, int label) throws IOException {
    final int idx = Util.binarySearch(fst, arc, label);
    if (idx >= 0) {
      fst.readArcByIndex(arc, fstReader, idx);
      assert arc.label() == label : "arc.label=" + arc.label() + " vs label=" + label;
      return descend(arc, label);
    }
    if (idx == -1) {
      return backtrackToFloor(arc, label);
    }
    // the arc just below the insertion point is the floor
    fst.readArcByIndex(arc, fstReader, -2 - idx);
    assert arc.label() < label : "arc.label=" + arc.label() + " vs label=" + label;
    pushLast();
    return null;
  }

  private FST.Arc<T> seekFloorInList(FST.Arc<T> arc, int label) throws IOException {
    if (arc.label() == label) {
      return descend(arc, label);
    }
    if (arc.label() > label) {
      return backtrackToFloor(arc, label);
    }
    if (!arc.isLast() && fst.readNextArcLabel(arc, fstReader) <= label) {
      return fst.readNextArc(arc, fstReader);
    }
    pushLast();
    return null;
  }

  /**
   * Called when the target sorts before the remaining arcs at this depth.
   * Climbs until a node has an arc below the target label, then takes the
   * last key under the greatest such arc. Always returns null.
   */
  private FST.Arc<T> backtrackToFloor(FST.Arc<T> arc, int label) throws IOException {
    while (true) {
      fst.readFirstTargetArc(getArc(upto - 1), arc, fstReader);
      if (arc.label() < label) {
        if (!arc.isLast()) {
          if (isArrayNode(arc)) {
            floorInArray(arc, label);
          } else {
            floorInList(arc, label);
          }
        }
        assert arc.label() < label;
        pushLast();
        return null;
      }
      if (--upto == 0) {
        return null;
      }
      label = getTargetLabel();
      arc = getArc(upto);
    }
  }

  /** Moves {@code arc}, the first arc of a fixed-array node, to the greatest arc below {@code label}. */
  private void floorInArray(FST.Arc<T> arc, int label) throws IOException {
    assert arc.nodeFlags() == FST.ARCS_FOR_BINARY_SEARCH;
    assert arc.arcIdx() == 0;
    if (arc.numArcs() > 1) {
      final int idx = Util.binarySearch(fst, arc, label);
      assert idx != -1;
      if (idx > 1) {
        fst.readArcByIndex(arc, fstReader, idx - 1);
      } else if (idx < -2) {
        fst.readArcByIndex(arc, fstReader, -2 - idx);
      }
    }
  }

  private void floorInList(FST.Arc<T> arc, int label) throws IOException {
    while (!arc.isLast() && fst.readNextArcLabel(arc, fstReader) < label) {
      fst.readNextArc(arc, fstReader);
    }
  }

  /** Seeks to exactly target term. */
  boolean doSeekExact() throws IOException {
    rewindPrefix();
    FST.Arc<T> arc = getArc(upto - 1);
    int label = getTargetLabel();
    while (true) {
      final FST.Arc<T> next = fst.findTargetArc(label, arc, getArc(upto), fstReader);
      if (next == null) {
        // leave a valid arc at this depth so the next seek can rewind from here
        fst.readFirstTargetArc(arc, getArc(upto), fstReader);
        return false;
      }
      output[upto] = fst.outputs.add(output[upto - 1], next.output());
      if (label == FST.END_LABEL) {
        return true;
      }
      setCurrentLabel(label);
      incr();
      label = getTargetLabel();
      arc = next;
    }
  }

  private void incr() {
    upto++;
    grow();
    arcs = ArrayUtil.grow(arcs, upto + 1);
    output = ArrayUtil.grow(output, upto + 1);
  }

  /** Follows first arcs from arcs[upto] down to a final pseudo arc. */
  private void pushFirst() throws IOException {
    FST.Arc<T> arc = arcs[upto];
    assert arc != null;
    output[upto] = fst.outputs.add(output[upto - 1], arc.output());
    while (arc.label() != FST.END_LABEL) {
      setCurrentLabel(arc.label());
      incr();
      arc = fst.readFirstTargetArc(arc, getArc(upto), fstReader);
      output[upto] = fst.outputs.add(output[upto - 1], arc.output());
    }
  }

  /** Follows last arcs from arcs[upto] down to a final pseudo arc. */
  private void pushLast() throws IOException {
    FST.Arc<T> arc = arcs[upto];
    assert arc != null;
    while (true) {
      setCurrentLabel(arc.label());
      output[upto] = fst.outputs.add(output[upto - 1], arc.output());
      if (arc.label() == FST.END_LABEL) {
        return;
      }
      incr();
      arc = fst.readLastTargetArc(arc, getArc(upto), fstReader);
    }
  }

  private FST.Arc<T> getArc(int idx) {
    if (arcs[idx] == null) {
      arcs[idx] = new FST.Arc<>();
    }
    return arcs[idx];
  }
}
