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

import org.lexicon.util.InfoStream;

/**
 * Finds already frozen nodes that equal a node about to be frozen, so that
 * equal suffixes are written once.  Keys are node addresses in the
 * {@link FST} bytes; a node is hashed and compared by reading it back.
 */
final class NodeHash<T> {

    private static final int PRIME = 31;
    private static final int MAX_SLOTS = 1 << 30;

    /** 节点地址 0 表示空槽 (地址 0 是 pad 字节, 不会是合法节点) */
    private long[] slots = new long[16];
    private long count;
    private final FST<T> fst;
    private final InfoStream infoStream;

    private final FST.Arc<T> scratchArc = new FST.Arc<>();
    private final FST.BytesReader in;

    NodeHash(FST<T> fst, FST.BytesReader in, InfoStream infoStream) {
        this.fst = fst;
        this.in = in;
        this.infoStream = infoStream;
    }

    /** Number of distinct frozen nodes seen so far. */
    long size() {
        return count;
    }

    /**
     * Returns the address of a frozen node equal to {@code nodeIn}, freezing
     * {@code nodeIn} into the FST first when no such node exists yet.
     */
    long add(FSTCompiler<T> fstCompiler, FSTCompiler.UnCompiledNode<T> nodeIn) throws IOException {
        final long h = hash(nodeIn);
        final int mask = slots.length - 1;
        int pos = (int) (h & mask);
        for (int step = 1; slots[pos] != 0; step++) {
            if (sameNode(nodeIn, slots[pos])) {
                return slots[pos];
            }
            pos = (pos + step) & mask;
        }

        final long address = fst.addNode(fstCompiler, nodeIn);
        assert hash(address) == h : "frozenHash=" + hash(address) + " vs h=" + h;
        slots[pos] = address;
        count++;
        if (3 * count > 2L * slots.length) {
            grow();
        }
        return address;
    }

    private static long mix(long h, int label, long target, Object output, Object nextFinalOutput, boolean isFinal) {
        h = PRIME * h + label;
        h = PRIME * h + (int) (target ^ (target >> 32));
        h = PRIME * h + output.hashCode();
        h = PRIME * h + nextFinalOutput.hashCode();
        return isFinal ? h + 17 : h;
    }

    // 未冻结节点和已冻结节点的 hash 必须一致
    private long hash(FSTCompiler.UnCompiledNode<T> node) {
        long h = 0;
        for (int i = 0; i < node.numArcs; i++) {
            final FSTCompiler.Arc<T> arc = node.arcs[i];
            h = mix(h, arc.label, arc.targetAddress(), arc.output, arc.nextFinalOutput, arc.isFinal);
        }
        return h & Long.MAX_VALUE;
    }

    private long hash(long address) throws IOException {
        long h = 0;
        fst.readFirstRealTargetArc(address, scratchArc, in);
        while (true) {
            h = mix(h, scratchArc.label(), scratchArc.target(), scratchArc.output(), scratchArc.nextFinalOutput(), scratchArc.isFinal());
            if (scratchArc.isLast()) {
                return h & Long.MAX_VALUE;
            }
            fst.readNextRealArc(scratchArc, in);
        }
    }

    private boolean sameNode(FSTCompiler.UnCompiledNode<T> node, long address) throws IOException {
        fst.readFirstRealTargetArc(address, scratchArc, in);
        if (scratchArc.bytesPerArc() != 0 && scratchArc.numArcs() != node.numArcs) {
            return false;
        }
        for (int i = 0; i < node.numArcs; i++) {
            final FSTCompiler.Arc<T> arc = node.arcs[i];
            final boolean same = arc.label == scratchArc.label()
                    && arc.targetAddress() == scratchArc.target()
                    && arc.isFinal == scratchArc.isFinal()
                    && arc.output.equals(scratchArc.output())
                    && arc.nextFinalOutput.equals(scratchArc.nextFinalOutput());
            if (!same) {
                return false;
            }
            if (scratchArc.isLast()) {
                return i == node.numArcs - 1;
            }
            fst.readNextRealArc(scratchArc, in);
        }
        // the frozen node has more arcs
        return false;
    }

    private void grow() throws IOException {
        final long[] old = slots;
        if (old.length >= MAX_SLOTS) {
            throw new IllegalStateException("node hash cannot grow beyond " + old.length + " slots");
        }
        slots = new long[old.length << 1];
        final int mask = slots.length - 1;
        for (long address : old) {
            if (address == 0) {
                continue;
            }
            int pos = (int) (hash(address) & mask);
            for (int step = 1; slots[pos] != 0; step++) {
                pos = (pos + step) & mask;
            }
            slots[pos] = address;
        }
        if (infoStream.isEnabled(FSTCompiler.INFO_STREAM_COMPONENT)) {
            infoStream.message(FSTCompiler.INFO_STREAM_COMPONENT,
                    "node hash rehash: " + old.length + " -> " + slots.length + " slots, " + count + " nodes");
        }
    }
}
