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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.blobprovider.BlobProviderErrorCode;
import com.github.blobprovider.BlobProviderException;
import java.util.Objects;
import java.util.UUID;


/**
 * The provider data the host persists next to its own binary record: the name of the Azure blob and the chunk size
 * agreed for writing it. Serialized as JSON; unknown fields are ignored and missing ones default, so text written by
 * older or newer versions stays readable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AzureBlobProviderData {
  public static final String FIELD_BLOB_ID = "BlobId";
  public static final String FIELD_CHUNK_SIZE = "ChunkSize";

  private static final ObjectMapper objectMapper = new ObjectMapper();

  @JsonProperty(FIELD_BLOB_ID)
  private final String blobId;
  @JsonProperty(FIELD_CHUNK_SIZE)
  private final int chunkSize;

  /**
   * @param blobId the blob name inside the tenant's container.
   * @param chunkSize the chunk size of the transfer, 0 if unknown.
   */
  @JsonCreator
  public AzureBlobProviderData(@JsonProperty(FIELD_BLOB_ID) String blobId,
      @JsonProperty(FIELD_CHUNK_SIZE) int chunkSize) {
    this.blobId = blobId;
    this.chunkSize = chunkSize;
  }

  /**
   * Create the provider data of a transfer.
   * @param existingBlobId the blob id to reuse, or {@code null} to mint a new one.
   * @param chunkSize the chunk size every write of the transfer must use.
   * @return the provider data.
   */
  static AzureBlobProviderData allocate(String existingBlobId, int chunkSize) {
    return new AzureBlobProviderData(existingBlobId != null ? existingBlobId : newBlobId(), chunkSize);
  }

  /**
   * @return a new globally unique blob id.
   */
  static String newBlobId() {
    return UUID.randomUUID().toString();
  }

  public String getBlobId() {
    return blobId;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  /**
   * @return the JSON form of this record.
   */
  public String toJson() {
    try {
      return objectMapper.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      // Two plain fields always serialize.
      throw new IllegalStateException("Could not serialize " + this, e);
    }
  }

  /**
   * Parse the JSON form of a record.
   * @param json the text produced by {@link #toJson()}.
   * @return the record.
   * @throws BlobProviderException with {@link BlobProviderErrorCode#InvalidProviderData} if the text is not a JSON
   * object or has no blob id.
   */
  public static AzureBlobProviderData fromJson(String json) throws BlobProviderException {
    if (json == null || json.trim().isEmpty()) {
      throw new BlobProviderException("Provider data is empty.", BlobProviderErrorCode.InvalidProviderData);
    }
    AzureBlobProviderData data;
    try {
      data = objectMapper.readValue(json, AzureBlobProviderData.class);
    } catch (JsonProcessingException e) {
      throw new BlobProviderException("Could not parse provider data: " + json, e,
          BlobProviderErrorCode.InvalidProviderData);
    }
    if (data == null || data.blobId == null || data.blobId.isEmpty()) {
      throw new BlobProviderException("Provider data has no " + FIELD_BLOB_ID + ": " + json,
          BlobProviderErrorCode.InvalidProviderData);
    }
    return data;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AzureBlobProviderData that = (AzureBlobProviderData) o;
    return chunkSize == that.chunkSize && Objects.equals(blobId, that.blobId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(blobId, chunkSize);
  }

  @Override
  public String toString() {
    return "AzureBlobProviderData[blobId=" + blobId + ", chunkSize=" + chunkSize + "]";
  }
}
