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


import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.lexicon.codecs.CodecUtil;
import org.lexicon.store.CorruptDataException;
import org.lexicon.store.DataInput;
import org.lexicon.store.DataOutput;
import org.lexicon.store.InputStreamDataInput;
import org.lexicon.store.OutputStreamDataOutput;
import org.lexicon.util.Accountable;
import org.lexicon.util.ArrayUtil;
import org.lexicon.util.Constants;
import org.lexicon.util.RamUsageEstimator;

/** An immutable finite state transducer held in a compact byte[] format.
 *
 *  <p>Nodes are written back to front while building: the
 *  bytes of every frozen node are reversed, so that reading
 *  a node always walks a {@link BytesReader} backwards.  A
 *  node either lists its arcs one after another (each arc
 *  variable length, terminated by the last-arc flag), or,
 *  when it has many arcs, stores them in a fixed length
 *  array that can be binary searched by label.
 *
 *  <p>Every arc starts with a flags byte, followed by its label,
 *  its output, the final output of its target and the target
 *  address, each present only when the flags say so.
 *
 *  <p> See the {@link org.lexicon.util.fst package
 *      documentation} for some simple examples.
 */
public final class FST<T> implements Accountable {

    /** Specifies allowed range of each int input label for
     *  this FST. The ordinal is the persisted code. */
    public enum INPUT_TYPE {BYTE1, BYTE2, BYTE4}

    private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(FST.class);

    private static final int BIT_FINAL_ARC = 1;
    static final int BIT_LAST_ARC = 1 << 1;
    static final int BIT_TARGET_NEXT = 1 << 2;
    private static final int BIT_STOP_NODE = 1 << 3;

    /** This flag is set if the arc has an output. */
    public static final int BIT_ARC_HAS_OUTPUT = 1 << 4;

    private static final int BIT_ARC_HAS_FINAL_OUTPUT = 1 << 5;

    /**
     * First byte of a node whose arcs are stored as a fixed length
     * array. No real arc carries this flag on its own.
     */
    public static final byte ARCS_FOR_BINARY_SEARCH = BIT_ARC_HAS_FINAL_OUTPUT;

    private static final String FILE_FORMAT_NAME = "FST";
    private static final int VERSION_START = 6;
    private static final int VERSION_CURRENT = 7;

    // 虚拟的终止节点, 不会被序列化
    private static final long FINAL_END_NODE = -1;
    private static final long NON_FINAL_END_NODE = 0;

    /** If arc has this label then that arc is final/accepted */
    public static final int END_LABEL = -1;

    private static final int DEFAULT_MAX_BLOCK_BITS = Constants.JRE_IS_64BIT ? 30 : 28;

    final INPUT_TYPE inputType;

    /** Output of the empty input, or null when the empty input is not accepted. */
    T emptyOutput;

    /** A {@link BytesStore}, used during building.  Null once the
     *  FST was loaded from a {@link DataInput}. */
    final BytesStore bytes;

    /** 读取已持久化的 fst 时使用 */
    private final FSTStore fstStore;

    private long startNode = -1;

    public final Outputs<T> outputs;

    /** Represents a single arc. Instances are mutable and refilled in place by the read methods. */
    public static final class Arc<T> {

        private int label;

        private T output;

        private long target;

        private byte flags;

        private T nextFinalOutput;

        private long nextArc;

        private byte nodeFlags;

        // only meaningful when bytesPerArc != 0
        private int bytesPerArc;

        private long posArcsStart;

        private int arcIdx;

        private int numArcs;

        /** Returns this */
        public Arc<T> copyFrom(Arc<T> other) {
            label = other.label;
            output = other.output;
            target = other.target;
            flags = other.flags;
            nextFinalOutput = other.nextFinalOutput;
            nextArc = other.nextArc;
            nodeFlags = other.nodeFlags;
            bytesPerArc = other.bytesPerArc;
            posArcsStart = other.posArcsStart;
            arcIdx = other.arcIdx;
            numArcs = other.numArcs;
            return this;
        }

        boolean flag(int flag) {
            return FST.flag(flags, flag);
        }

        public boolean isLast() {
            return flag(BIT_LAST_ARC);
        }

        public boolean isFinal() {
            return flag(BIT_FINAL_ARC);
        }

        @Override
        public String toString() {
            StringBuilder b = new StringBuilder();
            b.append(" target=").append(target);
            b.append(" label=0x").append(Integer.toHexString(label));
            b.append(flag(BIT_FINAL_ARC) ? " final" : "");
            b.append(flag(BIT_LAST_ARC) ? " last" : "");
            b.append(flag(BIT_TARGET_NEXT) ? " targetNext" : "");
            b.append(flag(BIT_STOP_NODE) ? " stop" : "");
            if (flag(BIT_ARC_HAS_OUTPUT)) {
                b.append(" output=").append(output);
            }
            if (flag(BIT_ARC_HAS_FINAL_OUTPUT)) {
                b.append(" nextFinalOutput=").append(nextFinalOutput);
            }
            if (bytesPerArc != 0) {
                b.append(" arcArray(idx=").append(arcIdx).append(" of ").append(numArcs).append(")");
            }
            return b.toString();
        }

        public int label() {
            return label;
        }

        public T output() {
            return output;
        }

        /** Address of the target node; 0 or -1 for the virtual end nodes. */
        public long target() {
            return target;
        }

        public byte flags() {
            return flags;
        }

        public T nextFinalOutput() {
            return nextFinalOutput;
        }

        /**
         * Address of the next arc of a variable length list, or the address
         * of the real arcs' node when this is the final pseudo arc.
         */
        long nextArc() {
            return nextArc;
        }

        /** Where we are in the array; only valid if bytesPerArc != 0. */
        public int arcIdx() {
            return arcIdx;
        }

        /**
         * Node header flags. Only meaningful to check if the value is
         * {@link #ARCS_FOR_BINARY_SEARCH}.
         */
        public byte nodeFlags() {
            return nodeFlags;
        }

        /** Where the first arc in the array starts; only valid if bytesPerArc != 0 */
        public long posArcsStart() {
            return posArcsStart;
        }

        /** Width of every arc slot when the node stores its arcs as a fixed
         *  length array, 0 for a variable length list. */
        public int bytesPerArc() {
            return bytesPerArc;
        }

        /** How many arcs; only valid if bytesPerArc != 0 (fixed length arcs). */
        public int numArcs() {
            return numArcs;
        }
    }

    private static boolean flag(int flags, int bit) {
        return (flags & bit) != 0;
    }

    // make a new empty FST, for building; Builder invokes this
    FST(INPUT_TYPE inputType, Outputs<T> outputs, int bytesPageBits) {
        this.inputType = inputType;
        this.outputs = outputs;
        fstStore = null;
        bytes = new BytesStore(bytesPageBits);
        // address 0 is the non-final stop node, so no real node may start there
        bytes.writeByte((byte) 0);
        emptyOutput = null;
    }

    /** Load a previously saved FST. */
    public FST(DataInput in, Outputs<T> outputs) throws IOException {
        this(in, outputs, new OnHeapFSTStore(DEFAULT_MAX_BLOCK_BITS));
    }

    /** Load a previously saved FST into the given store. */
    public FST(DataInput in, Outputs<T> outputs, FSTStore fstStore) throws IOException {
        bytes = null;
        this.fstStore = fstStore;
        this.outputs = outputs;

        CodecUtil.checkHeader(in, FILE_FORMAT_NAME, VERSION_START, VERSION_CURRENT);
        emptyOutput = in.readByte() == 1 ? readEmptyOutput(in) : null;
        inputType = readInputType(in);
        startNode = in.readVLong();
        final long numBytes = in.readVLong();
        if (numBytes < 0) {
            throw new CorruptDataException("invalid number of FST bytes " + numBytes, in.toString());
        }
        fstStore.init(in, numBytes);
    }

    private T readEmptyOutput(DataInput in) throws IOException {
        final int numBytes = in.readVInt();
        if (numBytes < 0) {
            throw new CorruptDataException("invalid empty output length " + numBytes, in.toString());
        }
        final BytesStore encoded = new BytesStore(in, numBytes, 1 << DEFAULT_MAX_BLOCK_BITS);
        return outputs.readFinalOutput(encoded.getForwardReader());
    }

    private static INPUT_TYPE readInputType(DataInput in) throws IOException {
        final byte code = in.readByte();
        final INPUT_TYPE[] types = INPUT_TYPE.values();
        if (code < 0 || code >= types.length) {
            throw new CorruptDataException("invalid input type " + code, in.toString());
        }
        return types[code];
    }

    public INPUT_TYPE getInputType() {
        return inputType;
    }

    /** Number of bytes of the packed graph, pad byte included. */
    long numBytes() {
        return bytes != null ? bytes.getPosition() : fstStore.size();
    }

    @Override
    public long ramBytesUsed() {
        return BASE_RAM_BYTES_USED + (fstStore != null ? fstStore.ramBytesUsed() : bytes.ramBytesUsed());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(input=" + inputType + ",output=" + outputs + ")";
    }

    void finish(long newStartNode) throws IOException {
        assert newStartNode <= bytes.getPosition();
        if (isFinished()) {
            throw new IllegalStateException("already finished");
        }
        if (newStartNode == FINAL_END_NODE && emptyOutput != null) {
            newStartNode = 0;
        }
        startNode = newStartNode;
        bytes.finish();
    }

    boolean isFinished() {
        return startNode != -1;
    }

    public T getEmptyOutput() {
        return emptyOutput;
    }

    void setEmptyOutput(T v) {
        if (emptyOutput != null) {
            throw new IllegalArgumentException("the empty input was already added with output=" + outputs.outputToString(emptyOutput));
        }
        emptyOutput = v;
    }

    /** Writes this FST: header, empty output, input type, root address and graph bytes. */
    public void save(DataOutput out) throws IOException {
        if (!isFinished()) {
            throw new IllegalStateException("call finish first");
        }
        CodecUtil.writeHeader(out, FILE_FORMAT_NAME, VERSION_CURRENT);
        if (emptyOutput == null) {
            out.writeByte((byte) 0);
        } else {
            out.writeByte((byte) 1);
            writeEmptyOutput(out);
        }
        out.writeByte((byte) inputType.ordinal());
        out.writeVLong(startNode);
        if (bytes != null) {
            out.writeVLong(bytes.getPosition());
            bytes.writeTo(out);
        } else {
            fstStore.writeTo(out);
        }
    }

    private void writeEmptyOutput(DataOutput out) throws IOException {
        // 空输出不属于图数据 所以这里正向写入 读取时也用正向 reader
        final BytesStore encoded = new BytesStore(10);
        outputs.writeFinalOutput(emptyOutput, encoded);
        encoded.finish();
        out.writeVInt((int) encoded.getPosition());
        encoded.writeTo(out);
    }

    /**
     * Writes an automaton to a file.
     */
    public void save(final Path path) throws IOException {
        try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(path))) {
            save(new OutputStreamDataOutput(os));
        }
    }

    /**
     * Reads an automaton from a file.
     */
    public static <T> FST<T> read(Path path, Outputs<T> outputs) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return new FST<>(new InputStreamDataInput(new BufferedInputStream(is), path.toString()), outputs);
        }
    }

    private void writeLabel(DataOutput out, int v) throws IOException {
        assert v >= 0 : "v=" + v;
        switch (inputType) {
            case BYTE1:
                assert v <= 0xFF : "v=" + v;
                out.writeByte((byte) v);
                break;
            case BYTE2:
                assert v <= 0xFFFF : "v=" + v;
                out.writeShort((short) v);
                break;
            default:
                out.writeVInt(v);
        }
    }

    /** Reads one BYTE1/2/4 label from the provided {@link DataInput}. */
    public int readLabel(DataInput in) throws IOException {
        switch (inputType) {
            case BYTE1:
                return in.readByte() & 0xFF;
            case BYTE2:
                return in.readShort() & 0xFFFF;
            default:
                return in.readVInt();
        }
    }

    /** returns true if the node at this address has any
     *  outgoing arcs */
    public static <T> boolean targetHasArcs(Arc<T> arc) {
        return arc.target() > 0;
    }

    /** Appends a frozen node to the compiler's bytes and returns its address. */
    long addNode(FSTCompiler<T> fstCompiler, FSTCompiler.UnCompiledNode<T> nodeIn) throws IOException {
        if (nodeIn.numArcs == 0) {
            return nodeIn.isFinal ? FINAL_END_NODE : NON_FINAL_END_NODE;
        }

        final BytesStore out = fstCompiler.bytes;
        final long startAddress = out.getPosition();
        final boolean fixedLength = shouldExpandNodeWithFixedLengthArcs(fstCompiler, nodeIn);
        if (fixedLength && fstCompiler.numBytesPerArc.length < nodeIn.numArcs) {
            fstCompiler.numBytesPerArc = new int[ArrayUtil.oversize(nodeIn.numArcs, Integer.BYTES)];
        }
        fstCompiler.arcCount += nodeIn.numArcs;

        // arcs first get their natural length; a fixed-array node pads them afterwards
        int maxBytesPerArc = 0;
        for (int idx = 0; idx < nodeIn.numArcs; idx++) {
            final long arcStart = out.getPosition();
            writeArc(fstCompiler, nodeIn.arcs[idx], idx == nodeIn.numArcs - 1, fixedLength);
            if (fixedLength) {
                final int arcLen = (int) (out.getPosition() - arcStart);
                fstCompiler.numBytesPerArc[idx] = arcLen;
                maxBytesPerArc = Math.max(maxBytesPerArc, arcLen);
            }
        }

        if (fixedLength) {
            assert maxBytesPerArc > 0;
            writeNodeForBinarySearch(fstCompiler, nodeIn, startAddress, maxBytesPerArc);
            fstCompiler.binarySearchNodeCount++;
        }

        final long nodeAddress = out.getPosition() - 1;
        out.reverse(startAddress, nodeAddress);
        fstCompiler.nodeCount++;
        return nodeAddress;
    }

    private void writeArc(FSTCompiler<T> fstCompiler, FSTCompiler.Arc<T> arc, boolean last, boolean fixedLength) throws IOException {
        final T NO_OUTPUT = outputs.getNoOutput();
        final long target = arc.targetAddress();
        final boolean targetHasArcs = target > 0;

        int flags = 0;
        if (last) {
            flags |= BIT_LAST_ARC;
        }
        // 下游节点刚好是上一个写入的节点 可以省略 target 地址
        if (fstCompiler.lastFrozenNode == target && !fixedLength) {
            flags |= BIT_TARGET_NEXT;
        }
        if (arc.isFinal) {
            flags |= BIT_FINAL_ARC;
            if (arc.nextFinalOutput != NO_OUTPUT) {
                flags |= BIT_ARC_HAS_FINAL_OUTPUT;
            }
        } else {
            assert arc.nextFinalOutput == NO_OUTPUT;
        }
        if (!targetHasArcs) {
            flags |= BIT_STOP_NODE;
        }
        if (arc.output != NO_OUTPUT) {
            flags |= BIT_ARC_HAS_OUTPUT;
        }

        final BytesStore out = fstCompiler.bytes;
        out.writeByte((byte) flags);
        writeLabel(out, arc.label);
        if (flag(flags, BIT_ARC_HAS_OUTPUT)) {
            outputs.write(arc.output, out);
        }
        if (flag(flags, BIT_ARC_HAS_FINAL_OUTPUT)) {
            outputs.writeFinalOutput(arc.nextFinalOutput, out);
        }
        if (targetHasArcs && !flag(flags, BIT_TARGET_NEXT)) {
            out.writeVLong(target);
        }
    }

    /**
     * Fixed length arcs cost space (every arc takes the width of the widest
     * one) but allow binary search by label, so only nodes near the root
     * with a few arcs, or any node with many arcs, get them.
     */
    private boolean shouldExpandNodeWithFixedLengthArcs(FSTCompiler<T> fstCompiler, FSTCompiler.UnCompiledNode<T> node) {
        if (!fstCompiler.allowFixedLengthArcs) {
            return false;
        }
        if (node.numArcs >= fstCompiler.fixedLengthArcsDeepNumArcs) {
            return true;
        }
        return node.depth <= fstCompiler.fixedLengthArcsShallowDepth
                && node.numArcs >= fstCompiler.fixedLengthArcsShallowNumArcs;
    }

    private void writeNodeForBinarySearch(FSTCompiler<T> fstCompiler, FSTCompiler.UnCompiledNode<T> nodeIn, long startAddress, int maxBytesPerArc) {
        // the header reads like a pseudo arc: marker flags, arc count, slot width
        final FSTCompiler.FixedLengthArcsBuffer header = fstCompiler.fixedLengthArcsBuffer
                .resetPosition()
                .writeByte(ARCS_FOR_BINARY_SEARCH)
                .writeVInt(nodeIn.numArcs)
                .writeVInt(maxBytesPerArc);
        final int headerLen = header.getPosition();
        final BytesStore out = fstCompiler.bytes;

        // slide the arcs into their slots, last one first, so no arc is overwritten before it moved
        long srcPos = out.getPosition();
        long destPos = startAddress + headerLen + nodeIn.numArcs * (long) maxBytesPerArc;
        assert destPos > srcPos;
        out.skipBytes((int) (destPos - srcPos));
        for (int idx = nodeIn.numArcs - 1; idx >= 0; idx--) {
            final int arcLen = fstCompiler.numBytesPerArc[idx];
            destPos -= maxBytesPerArc;
            srcPos -= arcLen;
            if (srcPos != destPos) {
                assert destPos > srcPos : "destPos=" + destPos + " srcPos=" + srcPos + " idx=" + idx + " maxBytesPerArc=" + maxBytesPerArc + " arcLen=" + arcLen;
                out.copyBytes(srcPos, destPos, arcLen);
            }
        }

        out.writeBytes(startAddress, header.getBytes(), 0, headerLen);
    }

    /** Fills the virtual arc that leads into the root node. */
    public Arc<T> getFirstArc(Arc<T> arc) {
        final T NO_OUTPUT = outputs.getNoOutput();
        arc.output = NO_OUTPUT;
        if (emptyOutput == null) {
            arc.flags = BIT_LAST_ARC;
            arc.nextFinalOutput = NO_OUTPUT;
        } else {
            int flags = BIT_FINAL_ARC | BIT_LAST_ARC;
            if (emptyOutput != NO_OUTPUT) {
                flags |= BIT_ARC_HAS_FINAL_OUTPUT;
            }
            arc.flags = (byte) flags;
            arc.nextFinalOutput = emptyOutput;
        }
        // startNode is 0 when only the empty input is accepted
        arc.target = startNode;
        return arc;
    }

    /** Follows the <code>follow</code> arc and reads the last
     *  arc of its target; this changes the provided
     *  <code>arc</code> (2nd arg) in-place and returns it.
     *
     * @return Returns the second argument
     * (<code>arc</code>). */
    Arc<T> readLastTargetArc(Arc<T> follow, Arc<T> arc, BytesReader in) throws IOException {
        if (!targetHasArcs(follow)) {
            assert follow.isFinal();
            arc.label = END_LABEL;
            arc.target = FINAL_END_NODE;
            arc.output = follow.nextFinalOutput();
            arc.flags = BIT_LAST_ARC;
            arc.nodeFlags = arc.flags;
            return arc;
        }

        in.setPosition(follow.target());
        arc.nodeFlags = in.readByte();
        if (arc.nodeFlags == ARCS_FOR_BINARY_SEARCH) {
            readArrayHeader(arc, in);
            // one before the last slot, readNextRealArc steps onto it
            arc.arcIdx = arc.numArcs - 2;
        } else {
            arc.bytesPerArc = 0;
            arc.flags = arc.nodeFlags;
            while (!arc.isLast()) {
                skipArcBody(arc.flags, in);
                arc.flags = in.readByte();
            }
            // back onto the flags byte of the last arc
            in.skipBytes(-1);
            arc.nextArc = in.getPosition();
        }
        readNextRealArc(arc, in);
        assert arc.isLast();
        return arc;
    }

    private long readUnpackedNodeTarget(BytesReader in) throws IOException {
        return in.readVLong();
    }

    private static void readArrayHeader(Arc<?> arc, BytesReader in) throws IOException {
        arc.numArcs = in.readVInt();
        arc.bytesPerArc = in.readVInt();
        arc.posArcsStart = in.getPosition();
    }

    /** Address of slot {@code idx} of a fixed length arc array. */
    private static long arcSlot(Arc<?> arc, int idx) {
        return arc.posArcsStart - idx * (long) arc.bytesPerArc;
    }

    /** Skips everything of an arc after its flags byte. */
    private void skipArcBody(int flags, BytesReader in) throws IOException {
        readLabel(in);
        if (flag(flags, BIT_ARC_HAS_OUTPUT)) {
            outputs.skipOutput(in);
        }
        if (flag(flags, BIT_ARC_HAS_FINAL_OUTPUT)) {
            outputs.skipFinalOutput(in);
        }
        if (!flag(flags, BIT_STOP_NODE) && !flag(flags, BIT_TARGET_NEXT)) {
            readUnpackedNodeTarget(in);
        }
    }

    /**
     * Follow the <code>follow</code> arc and read the first arc of its target;
     * this changes the provided <code>arc</code> (2nd arg) in-place and returns
     * it.
     *
     * @return Returns the second argument (<code>arc</code>).
     */
    public Arc<T> readFirstTargetArc(Arc<T> follow, Arc<T> arc, BytesReader in) throws IOException {
        if (!follow.isFinal()) {
            return readFirstRealTargetArc(follow.target(), arc, in);
        }
        // follow and arc may be the same instance
        final long node = follow.target();
        final T finalOutput = follow.nextFinalOutput();
        // a final node first yields a pseudo arc carrying its final output
        arc.label = END_LABEL;
        arc.output = finalOutput;
        arc.target = FINAL_END_NODE;
        if (node <= 0) {
            arc.flags = BIT_FINAL_ARC | BIT_LAST_ARC;
        } else {
            arc.flags = BIT_FINAL_ARC;
            // a node address here: the real arcs start there
            arc.nextArc = node;
        }
        arc.nodeFlags = arc.flags;
        return arc;
    }

    public Arc<T> readFirstRealTargetArc(long nodeAddress, Arc<T> arc, final BytesReader in) throws IOException {
        in.setPosition(nodeAddress);
        arc.nodeFlags = in.readByte();
        if (arc.nodeFlags == ARCS_FOR_BINARY_SEARCH) {
            readArrayHeader(arc, in);
            arc.arcIdx = -1;
        } else {
            // the first byte was the first arc's flags; readNextRealArc reads it again
            arc.nextArc = nodeAddress;
            arc.bytesPerArc = 0;
        }
        return readNextRealArc(arc, in);
    }

    /**
     * Returns whether <code>arc</code>'s target points to a node in expanded format (fixed length arcs).
     */
    boolean isExpandedTarget(Arc<T> follow, BytesReader in) throws IOException {
        if (!targetHasArcs(follow)) {
            return false;
        }
        in.setPosition(follow.target());
        return in.readByte() == ARCS_FOR_BINARY_SEARCH;
    }

    /** In-place read; returns the arc. */
    public Arc<T> readNextArc(Arc<T> arc, BytesReader in) throws IOException {
        if (arc.label() != END_LABEL) {
            return readNextRealArc(arc, in);
        }
        if (arc.nextArc() <= 0) {
            throw new IllegalArgumentException("cannot readNextArc when arc.isLast()=true");
        }
        return readFirstRealTargetArc(arc.nextArc(), arc, in);
    }

    /** Peeks at next arc's label; does not alter arc.  Do
     *  not call this if arc.isLast()! */
    int readNextArcLabel(Arc<T> arc, BytesReader in) throws IOException {
        assert !arc.isLast();

        if (arc.label() == END_LABEL) {
            // 伪造的 final arc 下一个 arc 是目标节点的第一个 arc
            in.setPosition(arc.nextArc());
            if (in.readByte() == ARCS_FOR_BINARY_SEARCH) {
                in.readVInt(); // numArcs
                in.readVInt(); // bytesPerArc
                in.readByte(); // flags of slot 0
            }
        } else if (arc.bytesPerArc() != 0) {
            // label of the next slot, past its flags byte
            in.setPosition(arcSlot(arc, arc.arcIdx() + 1) - 1);
        } else {
            in.setPosition(arc.nextArc() - 1);
        }
        return readLabel(in);
    }

    /**
     * Reads the arc at position {@code idx} of a node with fixed length arcs.
     */
    public Arc<T> readArcByIndex(Arc<T> arc, final BytesReader in, int idx) throws IOException {
        assert arc.bytesPerArc() > 0;
        assert arc.nodeFlags() == ARCS_FOR_BINARY_SEARCH;
        assert idx >= 0 && idx < arc.numArcs();
        in.setPosition(arcSlot(arc, idx));
        arc.arcIdx = idx;
        arc.flags = in.readByte();
        return readArc(arc, in);
    }

    /** Never returns null, but you should never call this if
     *  arc.isLast() is true. */
    public Arc<T> readNextRealArc(Arc<T> arc, final BytesReader in) throws IOException {
        if (arc.nodeFlags() == ARCS_FOR_BINARY_SEARCH) {
            assert arc.bytesPerArc() > 0;
            arc.arcIdx++;
            assert arc.arcIdx() >= 0 && arc.arcIdx() < arc.numArcs();
            in.setPosition(arcSlot(arc, arc.arcIdx()));
        } else {
            assert arc.bytesPerArc() == 0;
            in.setPosition(arc.nextArc());
        }
        arc.flags = in.readByte();
        return readArc(arc, in);
    }

    /**
     * Reads an arc.
     * <br>Precondition: The arc flags byte has already been read and set;
     * the given BytesReader is positioned just after the arc flags byte.
     */
    private Arc<T> readArc(Arc<T> arc, BytesReader in) throws IOException {
        final T NO_OUTPUT = outputs.getNoOutput();
        arc.label = readLabel(in);
        arc.output = arc.flag(BIT_ARC_HAS_OUTPUT) ? outputs.read(in) : NO_OUTPUT;
        arc.nextFinalOutput = arc.flag(BIT_ARC_HAS_FINAL_OUTPUT) ? outputs.readFinalOutput(in) : NO_OUTPUT;

        if (arc.flag(BIT_STOP_NODE)) {
            arc.target = arc.isFinal() ? FINAL_END_NODE : NON_FINAL_END_NODE;
            arc.nextArc = in.getPosition();
        } else if (arc.flag(BIT_TARGET_NEXT)) {
            arc.nextArc = in.getPosition();
            // the target was frozen just before this node, so it starts right after our last arc
            if (!arc.isLast()) {
                if (arc.bytesPerArc() == 0) {
                    seekToNextNode(in);
                } else {
                    in.setPosition(arcSlot(arc, arc.numArcs()));
                }
            }
            arc.target = in.getPosition();
        } else {
            arc.target = readUnpackedNodeTarget(in);
            arc.nextArc = in.getPosition();
        }
        return arc;
    }

    /** Fills {@code arc} with the final pseudo arc of {@code follow}'s target,
     *  or returns null when that target is not final. */
    static <T> Arc<T> readEndArc(Arc<T> follow, Arc<T> arc) {
        if (!follow.isFinal()) {
            return null;
        }
        final long node = follow.target();
        final T finalOutput = follow.nextFinalOutput();
        if (node <= 0) {
            arc.flags = FST.BIT_LAST_ARC;
        } else {
            arc.flags = 0;
            // a node address here: the real arcs start there
            arc.nextArc = node;
        }
        arc.output = finalOutput;
        arc.label = FST.END_LABEL;
        arc.nodeFlags = arc.flags;
        return arc;
    }

    /** Finds an arc leaving the incoming arc, replacing the arc in place.
     *  This returns null if the arc was not found, else the incoming arc. */
    public Arc<T> findTargetArc(int labelToMatch, Arc<T> follow, Arc<T> arc, BytesReader in) throws IOException {
        if (labelToMatch == END_LABEL) {
            return readEndArc(follow, arc);
        }
        if (!targetHasArcs(follow)) {
            return null;
        }

        final long node = follow.target();
        in.setPosition(node);
        arc.nodeFlags = in.readByte();
        if (arc.nodeFlags == ARCS_FOR_BINARY_SEARCH) {
            readArrayHeader(arc, in);
            int low = 0;
            int high = arc.numArcs() - 1;
            while (low <= high) {
                final int mid = (low + high) >>> 1;
                // label sits right after the slot's flags byte
                in.setPosition(arcSlot(arc, mid) - 1);
                final int midLabel = readLabel(in);
                if (midLabel < labelToMatch) {
                    low = mid + 1;
                } else if (midLabel > labelToMatch) {
                    high = mid - 1;
                } else {
                    arc.arcIdx = mid - 1;
                    return readNextRealArc(arc, in);
                }
            }
            return null;
        }

        // arcs are sorted, stop at the first label that is not smaller
        readFirstRealTargetArc(node, arc, in);
        while (arc.label() < labelToMatch && !arc.isLast()) {
            readNextRealArc(arc, in);
        }
        return arc.label() == labelToMatch ? arc : null;
    }

    private void seekToNextNode(BytesReader in) throws IOException {
        int flags;
        do {
            flags = in.readByte();
            skipArcBody(flags, in);
        } while (!flag(flags, BIT_LAST_ARC));
    }

    /** Returns a {@link BytesReader} for this FST, positioned at
     *  position 0. */
    public BytesReader getBytesReader() {
        return fstStore != null ? fstStore.getReverseBytesReader() : bytes.getReverseReader();
    }

    /** Reads bytes stored in an FST. */
    public static abstract class BytesReader extends DataInput {
        /** Get current read position. */
        public abstract long getPosition();

        /** Set current read position.
         *
         * @throws IndexOutOfBoundsException if {@code pos} lies outside the backing storage */
        public abstract void setPosition(long pos);

        /** Returns true if this reader uses reversed bytes
         *  under-the-hood. */
        public abstract boolean reversed();
    }
}
