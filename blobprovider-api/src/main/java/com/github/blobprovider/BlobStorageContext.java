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
package com.github.blobprovider;

/**
 * The host repository's view of one binary value being stored or read. The host owns this record; a
 * {@link BlobProvider} reads the total length and the provider data, and replaces the provider data when it allocates
 * a blob. The file, version and property type ids are only used to tag the stored blob.
 */
public class BlobStorageContext {

  private final int fileId;
  private final int versionId;
  private final int propertyTypeId;
  private final long length;
  private volatile Object blobProviderData;

  /**
   * @param fileId id of the host's file record that owns the binary.
   * @param versionId id of the content version the binary belongs to.
   * @param propertyTypeId id of the binary property (slot) on that version.
   * @param length total length of the binary in bytes.
   */
  public BlobStorageContext(int fileId, int versionId, int propertyTypeId, long length) {
    if (length < 0) {
      throw new IllegalArgumentException("Length cannot be negative: " + length);
    }
    this.fileId = fileId;
    this.versionId = versionId;
    this.propertyTypeId = propertyTypeId;
    this.length = length;
  }

  public int getFileId() {
    return fileId;
  }

  public int getVersionId() {
    return versionId;
  }

  public int getPropertyTypeId() {
    return propertyTypeId;
  }

  public long getLength() {
    return length;
  }

  /**
   * @return the provider specific data, or {@code null} before allocation.
   */
  public Object getBlobProviderData() {
    return blobProviderData;
  }

  public BlobStorageContext setBlobProviderData(Object blobProviderData) {
    this.blobProviderData = blobProviderData;
    return this;
  }

  @Override
  public String toString() {
    return "BlobStorageContext[fileId=" + fileId + ", versionId=" + versionId + ", propertyTypeId=" + propertyTypeId
        + ", length=" + length + ", providerData=" + blobProviderData + "]";
  }
}
