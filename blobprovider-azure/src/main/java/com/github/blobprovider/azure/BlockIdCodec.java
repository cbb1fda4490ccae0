/**
 * Copyright 2026 LinkedIn Corp. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 */
package com.github.blobprovider.azure;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.codec.binary.Base64;


/**
 * Maps the 1-based index of a chunk to the id of the block that holds it. Azure requires block ids to be Base64 text
 * of equal length within a blob, so the index is zero padded to a fixed width before encoding. The encoding is
 * injective and preserves index order.
 */
final class BlockIdCodec {

  static final int BLOCK_ID_DIGITS = 6;
  static final int MAX_BLOCK_INDEX = 999_999;
  private static final String BLOCK_ID_FORMAT = "%0" + BLOCK_ID_DIGITS + "d";

  private BlockIdCodec() {
  }

  /**
   * @param index the 1-based chunk index, at most {@link #MAX_BLOCK_INDEX}.
   * @return the Base64 block id.
   * @throws IllegalArgumentException if the index is out of range.
   */
  static String encode(int index) {
    if (index < 1 || index > MAX_BLOCK_INDEX) {
      throw new IllegalArgumentException("Block index " + index + " is not in the range 1-" + MAX_BLOCK_INDEX);
    }
    String padded = String.format(Locale.ROOT, BLOCK_ID_FORMAT, index);
    return Base64.encodeBase64String(padded.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * @param blockCount the number of blocks of a blob.
   * @return the ids of blocks {@code 1..blockCount}, in order.
   */
  static List<String> encodeRange(int blockCount) {
    List<String> blockIds = new ArrayList<>(blockCount);
    for (int index = 1; index <= blockCount; index++) {
      blockIds.add(encode(index));
    }
    return blockIds;
  }
}
