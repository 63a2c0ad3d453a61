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

import org.lexicon.store.ByteArrayDataOutput;
import org.lexicon.util.ArrayUtil;
import org.lexicon.util.InfoStream;
import org.lexicon.util.IntsRef;
import org.lexicon.util.IntsRefBuilder;
import org.lexicon.util.fst.FST.INPUT_TYPE;

/**
 * Compiles sorted input/output pairs into a minimal, acyclic {@link FST}.
 *
 * <p>Only the path of the most recently added input is kept in memory, as
 * the "frontier" of uncompiled nodes.  When the next input arrives, every
 * frontier node past the shared prefix can no longer change, so it is frozen:
 * written to the FST bytes, or replaced by an equal node that was frozen
 * before.  Outputs are pushed towards the root as far as they are shared
 * (see {@link Outputs#common}).
 *
 * <p>NOTE: the algorithm is described at
 * http://citeseerx.ist.psu.edu/viewdoc/summary?doi=10.1.1.24.3698</p>
 *
 * <p>Use {@link NoOutputs} to build an automaton without outputs.
 */
public class FSTCompiler<T> {

    /** Component name used for {@link InfoStream} messages. */
    public static final String INFO_STREAM_COMPONENT = "FST";

    final FST<T> fst;
    final BytesStore bytes;
    private final T NO_OUTPUT;
    private final NodeHash<T> dedupHash;
    private final InfoStream infoStream;

    private final boolean doShareNonSingletonNodes;
    private final int shareMaxTailLength;
    final boolean allowFixedLengthArcs;
    final int fixedLengthArcsShallowDepth;
    final int fixedLengthArcsShallowNumArcs;
    final int fixedLengthArcsDeepNumArcs;

    private final IntsRefBuilder lastInput = new IntsRefBuilder();

    // frontier[i] 是上一个输入第 i 个 label 之前的节点
    private UnCompiledNode<T>[] frontier;

    /** Address of the node frozen last; an arc pointing at it can omit its target. */
    long lastFrozenNode;

    // scratch used by FST.addNode
    int[] numBytesPerArc = new int[4];
    final FixedLengthArcsBuffer fixedLengthArcsBuffer = new FixedLengthArcsBuffer();

    private long termCount;
    long arcCount;
    long nodeCount;
    long binarySearchNodeCount;

    private boolean compiled;

    /**
     * Creates a compiler with default settings. See {@link Builder} for the
     * tuning knobs.
     */
    public FSTCompiler(FST.INPUT_TYPE inputType, Outputs<T> outputs) {
        this(new Builder<>(inputType, outputs));
    }

    private FSTCompiler(Builder<T> builder) {
        fst = new FST<>(builder.inputType, builder.outputs, builder.bytesPageBits);
        bytes = fst.bytes;
        NO_OUTPUT = builder.outputs.getNoOutput();
        infoStream = builder.infoStream;
        doShareNonSingletonNodes = builder.shouldShareNonSingletonNodes;
        shareMaxTailLength = builder.shareMaxTailLength;
        allowFixedLengthArcs = builder.allowFixedLengthArcs;
        fixedLengthArcsShallowDepth = builder.fixedLengthArcsShallowDepth;
        fixedLengthArcsShallowNumArcs = builder.fixedLengthArcsShallowNumArcs;
        fixedLengthArcsDeepNumArcs = builder.fixedLengthArcsDeepNumArcs;
        // 构建过程中 bytes 还在增长, 所以不能用单 block 的 reader
        dedupHash = builder.shouldShareSuffix ? new NodeHash<>(fst, bytes.getReverseReader(false), infoStream) : null;
        frontier = newFrontier(null, 10);
    }

    /**
     * Fluent configuration for an {@link FSTCompiler}; every setting has a
     * default, and {@link #build()} validates them.
     */
    public static class Builder<T> {

        private final INPUT_TYPE inputType;
        private final Outputs<T> outputs;
        private boolean shouldShareSuffix = true;
        private boolean shouldShareNonSingletonNodes = true;
        private int shareMaxTailLength = Integer.MAX_VALUE;
        private boolean allowFixedLengthArcs = true;
        private int fixedLengthArcsShallowDepth = 3;
        private int fixedLengthArcsShallowNumArcs = 5;
        private int fixedLengthArcsDeepNumArcs = 10;
        private int bytesPageBits = 15;
        private InfoStream infoStream = InfoStream.getDefault();

        /**
         * @param inputType width of the labels; use {@link INPUT_TYPE#BYTE4} for code points
         * @param outputs   the output algebra, {@link NoOutputs#getSingleton()} for an automaton without outputs
         */
        public Builder(FST.INPUT_TYPE inputType, Outputs<T> outputs) {
            this.inputType = inputType;
            this.outputs = outputs;
        }

        /** Whether equal suffixes are written once. Default {@code true}; {@code false} builds faster but larger. */
        public Builder<T> shouldShareSuffix(boolean shouldShareSuffix) {
            this.shouldShareSuffix = shouldShareSuffix;
            return this;
        }

        /** Whether nodes with more than one arc may be shared too. Default {@code true}. */
        public Builder<T> shouldShareNonSingletonNodes(boolean shouldShareNonSingletonNodes) {
            this.shouldShareNonSingletonNodes = shouldShareNonSingletonNodes;
            return this;
        }

        /** Longest suffix, in labels, that is still looked up for sharing. Default {@link Integer#MAX_VALUE}. */
        public Builder<T> shareMaxTailLength(int shareMaxTailLength) {
            this.shareMaxTailLength = shareMaxTailLength;
            return this;
        }

        /** Whether nodes may store their arcs as a binary searchable array. Default {@code true}. */
        public Builder<T> allowFixedLengthArcs(boolean allowFixedLengthArcs) {
            this.allowFixedLengthArcs = allowFixedLengthArcs;
            return this;
        }

        /**
         * Nodes at depth up to this value (0 = root only) get fixed length
         * arcs once they have {@link #fixedLengthArcsShallowNumArcs(int)} arcs. Default 3.
         */
        public Builder<T> fixedLengthArcsShallowDepth(int fixedLengthArcsShallowDepth) {
            this.fixedLengthArcsShallowDepth = fixedLengthArcsShallowDepth;
            return this;
        }

        /** Default 5. */
        public Builder<T> fixedLengthArcsShallowNumArcs(int fixedLengthArcsShallowNumArcs) {
            this.fixedLengthArcsShallowNumArcs = fixedLengthArcsShallowNumArcs;
            return this;
        }

        /** Arc count from which a node at any depth gets fixed length arcs. Default 10. */
        public Builder<T> fixedLengthArcsDeepNumArcs(int fixedLengthArcsDeepNumArcs) {
            this.fixedLengthArcsDeepNumArcs = fixedLengthArcsDeepNumArcs;
            return this;
        }

        /** Page size of the byte storage, as a power of two. Default 15 (32 KB pages). */
        public Builder<T> bytesPageBits(int bytesPageBits) {
            this.bytesPageBits = bytesPageBits;
            return this;
        }

        /** Where the compiler reports progress; defaults to {@link InfoStream#getDefault()}. */
        public Builder<T> infoStream(InfoStream infoStream) {
            if (infoStream == null) {
                throw new IllegalArgumentException("infoStream must not be null");
            }
            this.infoStream = infoStream;
            return this;
        }

        /**
         * Creates a new {@link FSTCompiler}.
         *
         * @throws IllegalArgumentException if one of the settings is out of range
         */
        public FSTCompiler<T> build() {
            if (inputType == null || outputs == null) {
                throw new IllegalArgumentException("inputType and outputs must not be null");
            }
            if (shareMaxTailLength < 0) {
                throw new IllegalArgumentException("shareMaxTailLength must be >= 0; got " + shareMaxTailLength);
            }
            if (fixedLengthArcsShallowDepth < 0 || fixedLengthArcsShallowNumArcs < 0 || fixedLengthArcsDeepNumArcs < 0) {
                throw new IllegalArgumentException("fixed length arcs thresholds must be >= 0; got shallowDepth="
                        + fixedLengthArcsShallowDepth + " shallowNumArcs=" + fixedLengthArcsShallowNumArcs
                        + " deepNumArcs=" + fixedLengthArcsDeepNumArcs);
            }
            if (bytesPageBits < 1 || bytesPageBits > 30) {
                throw new IllegalArgumentException("bytesPageBits should be 1 .. 30; got " + bytesPageBits);
            }
            return new FSTCompiler<>(this);
        }
    }

    /** Number of inputs added so far, the empty input included. */
    public long getTermCount() {
        return termCount;
    }

    /** Number of written nodes plus the implicit final end node. */
    public long getNodeCount() {
        return nodeCount + 1;
    }

    public long getArcCount() {
        return arcCount;
    }

    /** Number of nodes written with fixed length arcs. */
    public long getBinarySearchNodeCount() {
        return binarySearchNodeCount;
    }

    /** Number of nodes that went through suffix sharing, 0 when sharing is off. */
    public long getMappedStateCount() {
        return dedupHash == null ? 0 : nodeCount;
    }

    public long fstRamBytesUsed() {
        return fst.ramBytesUsed();
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private UnCompiledNode<T>[] newFrontier(UnCompiledNode<T>[] old, int minSize) {
        final UnCompiledNode<T>[] next = old == null ? (UnCompiledNode<T>[]) new UnCompiledNode[minSize] : ArrayUtil.grow(old, minSize);
        for (int depth = old == null ? 0 : old.length; depth < next.length; depth++) {
            next[depth] = new UnCompiledNode<>(this, depth);
        }
        return next;
    }

    private boolean shouldShare(UnCompiledNode<T> nodeIn, int tailLength) {
        return dedupHash != null
                && (doShareNonSingletonNodes || nodeIn.numArcs <= 1)
                && tailLength <= shareMaxTailLength;
    }

    private CompiledNode compileNode(UnCompiledNode<T> nodeIn, int tailLength) throws IOException {
        final long sizeBefore = bytes.getPosition();
        final long address;
        if (nodeIn.numArcs > 0 && shouldShare(nodeIn, tailLength)) {
            address = dedupHash.add(this, nodeIn);
        } else {
            address = fst.addNode(this, nodeIn);
        }
        // a node found in the hash was written earlier and is not the one just before us
        if (bytes.getPosition() != sizeBefore || (nodeIn.numArcs == 0 && shouldShare(nodeIn, tailLength))) {
            lastFrozenNode = address;
        }
        nodeIn.clear();
        return new CompiledNode(address);
    }

    // 把 frontier 上比 prefixLenPlus1 更深的节点依次冻结写入 fst
    private void freezeTail(int prefixLenPlus1) throws IOException {
        final int last = lastInput.length();
        for (int depth = last; depth >= Math.max(1, prefixLenPlus1); depth--) {
            final UnCompiledNode<T> node = frontier[depth];
            // a dead end is always final, so every path ends in an accepted input
            final boolean isFinal = node.isFinal || node.numArcs == 0;
            final T finalOutput = node.output;
            final CompiledNode target = compileNode(node, 1 + last - depth);
            frontier[depth - 1].replaceLast(lastInput.intAt(depth - 1), target, finalOutput, isFinal);
        }
    }

    /**
     * Adds the next input and its output.  Inputs must arrive in strictly
     * increasing {@link IntsRef#compareTo} order.  The input may be reused by
     * the caller afterwards; the output is kept, so mutable outputs such as
     * {@link ByteSequenceOutputs} values must not be.
     *
     * @throws IllegalArgumentException if the input is not strictly greater than the previous
     *         one, or one of its labels does not fit the input type
     * @throws IllegalStateException if {@link #compile()} was already called
     */
    public void add(IntsRef input, T output) throws IOException {
        if (compiled) {
            throw new IllegalStateException("FST was already compiled");
        }
        if (lastInput.length() != 0 && input.compareTo(lastInput.get()) <= 0) {
            throw new IllegalArgumentException("inputs are added out of order lastInput=" + lastInput.get() + " vs input=" + input);
        }
        checkLabels(input);
        // NO_OUTPUT is compared by identity everywhere
        if (output.equals(NO_OUTPUT)) {
            output = NO_OUTPUT;
        }
        assert validOutput(output);

        if (input.length == 0) {
            // finalness lives on the incoming arc, and the root has none
            fst.setEmptyOutput(output);
            termCount++;
            frontier[0].isFinal = true;
            return;
        }

        final int prefixLenPlus1 = countSharedPrefix(input) + 1;
        if (frontier.length <= input.length) {
            frontier = newFrontier(frontier, input.length + 1);
        }

        freezeTail(prefixLenPlus1);
        for (int depth = prefixLenPlus1; depth <= input.length; depth++) {
            frontier[depth - 1].addArc(labelAt(input, depth - 1), frontier[depth]);
        }
        final UnCompiledNode<T> lastNode = frontier[input.length];
        lastNode.isFinal = true;
        lastNode.output = NO_OUTPUT;

        final T leftover = pushOutputs(input, prefixLenPlus1, output);
        frontier[prefixLenPlus1 - 1].setLastOutput(labelAt(input, prefixLenPlus1 - 1), leftover);
        lastInput.copyInts(input);
        termCount++;
    }

    private static int labelAt(IntsRef input, int idx) {
        return input.ints[input.offset + idx];
    }

    /** Length of the prefix shared with the previous input. */
    private int countSharedPrefix(IntsRef input) {
        final int stop = Math.min(lastInput.length(), input.length);
        int shared = 0;
        while (shared < stop && lastInput.intAt(shared) == labelAt(input, shared)) {
            shared++;
        }
        return shared;
    }

    /**
     * Along the shared prefix, keeps on each arc only the part of its output
     * that the new input shares, and moves the rest one node down.
     * Returns what is left of {@code output} for the input's first new arc.
     */
    private T pushOutputs(IntsRef input, int prefixLenPlus1, T output) {
        final Outputs<T> outputs = fst.outputs;
        for (int depth = 1; depth < prefixLenPlus1; depth++) {
            final UnCompiledNode<T> parent = frontier[depth - 1];
            final int label = labelAt(input, depth - 1);
            final T arcOutput = parent.getLastOutput(label);
            assert validOutput(arcOutput);
            if (arcOutput == NO_OUTPUT) {
                continue;
            }
            final T common = outputs.common(output, arcOutput);
            assert validOutput(common);
            final T suffix = outputs.subtract(arcOutput, common);
            assert validOutput(suffix);
            parent.setLastOutput(label, common);
            frontier[depth].prependOutput(suffix);
            output = outputs.subtract(output, common);
            assert validOutput(output);
        }
        return output;
    }

    private void checkLabels(IntsRef input) {
        final int maxLabel;
        switch (fst.inputType) {
            case BYTE1:
                maxLabel = 0xFF;
                break;
            case BYTE2:
                maxLabel = 0xFFFF;
                break;
            default:
                maxLabel = Integer.MAX_VALUE;
        }
        for (int i = 0; i < input.length; i++) {
            final int label = labelAt(input, i);
            if (label < 0 || label > maxLabel) {
                throw new IllegalArgumentException("label " + label + " at position " + i + " does not fit input type " + fst.inputType);
            }
        }
    }

    private boolean validOutput(T output) {
        return output == NO_OUTPUT || !output.equals(NO_OUTPUT);
    }

    /**
     * Freezes the remaining nodes and returns the finished FST, or null when
     * no input was added.
     *
     * @throws IllegalStateException if called more than once
     */
    public FST<T> compile() throws IOException {
        if (compiled) {
            throw new IllegalStateException("FST was already compiled");
        }
        compiled = true;

        freezeTail(0);
        final UnCompiledNode<T> root = frontier[0];
        if (root.numArcs == 0 && fst.emptyOutput == null) {
            if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
                infoStream.message(INFO_STREAM_COMPONENT, "compile: no input accepted");
            }
            return null;
        }

        fst.finish(compileNode(root, lastInput.length()).node);

        if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
            infoStream.message(INFO_STREAM_COMPONENT, "compile: terms=" + getTermCount() + " nodes=" + getNodeCount()
                    + " arcs=" + arcCount + " binarySearchNodes=" + binarySearchNodeCount
                    + " mappedStates=" + getMappedStateCount()
                    + " distinctNodes=" + (dedupHash == null ? nodeCount : dedupHash.size())
                    + " bytes=" + fst.numBytes());
        }
        return fst;
    }

    /** A pending arc of the frontier. */
    static class Arc<T> {
        int label;
        Node target;
        boolean isFinal;
        T output;
        T nextFinalOutput;

        /** Address of the frozen target; only valid once the target was compiled. */
        long targetAddress() {
            return ((CompiledNode) target).node;
        }
    }

    interface Node {
        boolean isCompiled();
    }

    static final class CompiledNode implements Node {
        final long node;

        CompiledNode(long node) {
            this.node = node;
        }

        @Override
        public boolean isCompiled() {
            return true;
        }
    }

    /** A frontier node: its arcs may still change. Instances are reused once frozen. */
    static final class UnCompiledNode<T> implements Node {
        final FSTCompiler<T> owner;
        /** Distance from the root; drives the fixed length arcs decision. */
        final int depth;
        int numArcs;
        Arc<T>[] arcs;
        T output;
        boolean isFinal;

        @SuppressWarnings({"rawtypes", "unchecked"})
        UnCompiledNode(FSTCompiler<T> owner, int depth) {
            this.owner = owner;
            this.depth = depth;
            arcs = (Arc<T>[]) new Arc[1];
            arcs[0] = new Arc<>();
            output = owner.NO_OUTPUT;
        }

        @Override
        public boolean isCompiled() {
            return false;
        }

        void clear() {
            numArcs = 0;
            isFinal = false;
            output = owner.NO_OUTPUT;
        }

        private Arc<T> lastArc(int labelToMatch) {
            assert numArcs > 0;
            final Arc<T> arc = arcs[numArcs - 1];
            assert arc.label == labelToMatch : "arc.label=" + arc.label + " vs " + labelToMatch;
            return arc;
        }

        T getLastOutput(int labelToMatch) {
            return lastArc(labelToMatch).output;
        }

        void addArc(int label, Node target) {
            assert label >= 0;
            assert numArcs == 0 || label > arcs[numArcs - 1].label : "last label=" + arcs[numArcs - 1].label + " new label=" + label;
            if (numArcs == arcs.length) {
                final int oldLength = arcs.length;
                arcs = ArrayUtil.grow(arcs, numArcs + 1);
                for (int i = oldLength; i < arcs.length; i++) {
                    arcs[i] = new Arc<>();
                }
            }
            final Arc<T> arc = arcs[numArcs++];
            arc.label = label;
            arc.target = target;
            arc.isFinal = false;
            arc.output = owner.NO_OUTPUT;
            arc.nextFinalOutput = owner.NO_OUTPUT;
        }

        void replaceLast(int labelToMatch, Node target, T nextFinalOutput, boolean isFinal) {
            final Arc<T> arc = lastArc(labelToMatch);
            arc.target = target;
            arc.nextFinalOutput = nextFinalOutput;
            arc.isFinal = isFinal;
        }

        void setLastOutput(int labelToMatch, T newOutput) {
            assert owner.validOutput(newOutput);
            lastArc(labelToMatch).output = newOutput;
        }

        /** Adds {@code prefix} in front of every arc output and of the final output. */
        void prependOutput(T prefix) {
            assert owner.validOutput(prefix);
            final Outputs<T> outputs = owner.fst.outputs;
            for (int i = 0; i < numArcs; i++) {
                arcs[i].output = outputs.add(prefix, arcs[i].output);
                assert owner.validOutput(arcs[i].output);
            }
            if (isFinal) {
                output = outputs.add(prefix, output);
                assert owner.validOutput(output);
            }
        }
    }

    /**
     * Scratch for the header of a fixed length arcs node: marker byte,
     * arc count and slot width, at most 11 bytes.
     */
    static class FixedLengthArcsBuffer {

        private final byte[] header = new byte[11];
        private final ByteArrayDataOutput out = new ByteArrayDataOutput(header);

        FixedLengthArcsBuffer resetPosition() {
            out.reset(header);
            return this;
        }

        FixedLengthArcsBuffer writeByte(byte b) {
            out.writeByte(b);
            return this;
        }

        FixedLengthArcsBuffer writeVInt(int i) {
            try {
                out.writeVInt(i);
            } catch (IOException e) {
                // a byte[] sink does not do I/O
                throw new IllegalStateException(e);
            }
            return this;
        }

        int getPosition() {
            return out.getPosition();
        }

        byte[] getBytes() {
            return header;
        }
    }
}
