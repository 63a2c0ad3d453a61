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

import org.lexicon.store.DataInput;
import org.lexicon.store.DataOutput;
import org.lexicon.util.RamUsageEstimator;

/** Holds the bytes of a loaded FST on the heap.
 *
 * <p>Graphs up to one page are kept in a single {@code byte[]};
 * anything larger is paged through a {@link BytesStore}. */
public final class OnHeapFSTStore implements FSTStore {

    private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(OnHeapFSTStore.class);

    private final int pageBits;

    // 两者只会有一个非空
    private BytesStore pages;
    private byte[] singlePage;

    public OnHeapFSTStore(int pageBits) {
        if (pageBits < 1 || pageBits > 30) {
            throw new IllegalArgumentException("pageBits must be 1 .. 30; got " + pageBits);
        }
        this.pageBits = pageBits;
    }

    @Override
    public void init(DataInput in, long numBytes) throws IOException {
        if (pages != null || singlePage != null) {
            throw new IllegalStateException("store is already initialized");
        }
        final long pageSize = 1L << pageBits;
        if (numBytes > pageSize) {
            pages = new BytesStore(in, numBytes, (int) pageSize);
        } else {
            singlePage = new byte[(int) numBytes];
            in.readBytes(singlePage, 0, singlePage.length);
        }
    }

    @Override
    public long size() {
        return singlePage != null ? singlePage.length : pages.getPosition();
    }

    @Override
    public long ramBytesUsed() {
        long size = BASE_RAM_BYTES_USED;
        if (singlePage != null) {
            size += RamUsageEstimator.sizeOf(singlePage);
        } else if (pages != null) {
            size += pages.ramBytesUsed();
        }
        return size;
    }

    @Override
    public FST.BytesReader getReverseBytesReader() {
        return singlePage != null ? new ReverseBytesReader(singlePage) : pages.getReverseReader();
    }

    @Override
    public void writeTo(DataOutput out) throws IOException {
        out.writeVLong(size());
        if (singlePage != null) {
            out.writeBytes(singlePage, 0, singlePage.length);
        } else {
            pages.writeTo(out);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(pageBits=" + pageBits + ", bytes=" + size() + ")";
    }
}
