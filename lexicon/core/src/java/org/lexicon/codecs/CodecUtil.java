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
package org.lexicon.codecs;


import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.lexicon.store.CorruptDataException;
import org.lexicon.store.DataInput;
import org.lexicon.store.DataOutput;

/**
 * Utility class for reading and writing versioned headers.
 * <p>
 * Writing codec headers is useful to ensure that a file is in
 * the format you think it is.
 */
public final class CodecUtil {
  private CodecUtil() {} // no instance

  /**
   * Constant to identify the start of a codec header.
   */
  public final static int CODEC_MAGIC = 0x3fd76c17;

  /**
   * Writes a codec header, which records both a string to
   * identify the file and a version number. This header can
   * be parsed and validated with
   * {@link #checkHeader(DataInput, String, int, int) checkHeader()}.
   * <p>
   * CodecHeader --&gt; Magic,CodecName,Version
   * <ul>
   *    <li>Magic --&gt; int. This identifies the start of the header. It is always {@value #CODEC_MAGIC}.
   *    <li>CodecName --&gt; String. This is a string to identify this file.
   *    <li>Version --&gt; int. Records the version of the file.
   * </ul>
   *
   * @param out Output stream
   * @param codec String to identify this file. It should be simple ASCII,
   *              less than 128 characters in length.
   * @param version Version number
   * @throws IOException If there is an I/O error writing to the underlying medium.
   * @throws IllegalArgumentException If the codec name is not simple ASCII, or is more than 127 characters in length
   */
  public static void writeHeader(DataOutput out, String codec, int version) throws IOException {
    byte[] bytes = codec.getBytes(StandardCharsets.UTF_8);
    if (bytes.length != codec.length() || bytes.length >= 128) {
      throw new IllegalArgumentException("codec must be simple ASCII, less than 128 characters in length [got " + codec + "]");
    }
    out.writeInt(CODEC_MAGIC);
    out.writeString(codec);
    out.writeInt(version);
  }

  /**
   * Computes the length of a codec header.
   *
   * @param codec Codec name.
   * @return length of the entire codec header.
   * @see #writeHeader(DataOutput, String, int)
   */
  public static int headerLength(String codec) {
    return 9+codec.length();
  }

  /**
   * Reads and validates a header previously written with
   * {@link #writeHeader(DataOutput, String, int)}.
   *
   * @param in Input stream, positioned at the point where the
   *        header was previously written.
   * @param codec The expected codec name.
   * @param minVersion The minimum supported expected version number.
   * @param maxVersion The maximum supported expected version number.
   * @return The actual version found, when a valid header is found
   *         that matches <code>codec</code>, with an actual version
   *         where {@code minVersion <= actual <= maxVersion}.
   * @throws CorruptDataException If the first four bytes are not
   *         {@link #CODEC_MAGIC}, the codec name does not match, or the
   *         actual version is outside the supported range.
   * @throws IOException If there is an I/O error reading from the underlying medium.
   */
  public static int checkHeader(DataInput in, String codec, int minVersion, int maxVersion) throws IOException {
    // Safety to guard against reading a bogus string:
    final int actualHeader = in.readInt();
    if (actualHeader != CODEC_MAGIC) {
      throw new CorruptDataException("codec header mismatch: actual header=" + actualHeader + " vs expected header=" + CODEC_MAGIC, in.toString());
    }
    return checkHeaderNoMagic(in, codec, minVersion, maxVersion);
  }

  /** Like {@link
   *  #checkHeader(DataInput,String,int,int)} except this
   *  version assumes the first int has already been read
   *  and validated from the input. */
  public static int checkHeaderNoMagic(DataInput in, String codec, int minVersion, int maxVersion) throws IOException {
    final String actualCodec = in.readString();
    if (!actualCodec.equals(codec)) {
      throw new CorruptDataException("codec mismatch: actual codec=" + actualCodec + " vs expected codec=" + codec, in.toString());
    }

    final int actualVersion = in.readInt();
    if (actualVersion < minVersion || actualVersion > maxVersion) {
      throw new CorruptDataException("format version " + actualVersion + " is not supported (needs to be between "
          + minVersion + " and " + maxVersion + ")", in.toString());
    }

    return actualVersion;
  }
}
