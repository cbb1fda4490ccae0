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
package com.github.blobprovider.config;

/**
 * Provider-independent configs shared by every {@link com.github.blobprovider.BlobProvider} implementation.
 */
public class BlobProviderConfig {

  public static final String BLOB_PROVIDER_FACTORY = "blob.provider.factory";
  public static final String BLOB_PROVIDER_CHUNK_SIZE = "blob.provider.chunk.size";
  public static final String BLOB_PROVIDER_TENANT_ID = "blob.provider.tenant.id";

  public static final String DEFAULT_BLOB_PROVIDER_FACTORY = "com.github.blobprovider.azure.AzureBlobProviderFactory";
  public static final int DEFAULT_CHUNK_SIZE = 256 * 1024;
  // Largest block accepted by the Put Block operation on older service versions.
  public static final int MAX_CHUNK_SIZE = 100 * 1024 * 1024;

  /**
   * The {@link com.github.blobprovider.BlobProviderFactory} used to build providers.
   */
  @Config(BLOB_PROVIDER_FACTORY)
  @Default(DEFAULT_BLOB_PROVIDER_FACTORY)
  public final String blobProviderFactory;

  /**
   * The size in bytes of one block. The host must split content into chunks of exactly this size (the last chunk may
   * be shorter), otherwise writes fail with a configuration mismatch.
   */
  @Config(BLOB_PROVIDER_CHUNK_SIZE)
  @Default("262144")
  public final int blobProviderChunkSize;

  /**
   * The tenant served by the default provider. Empty for single-tenant deployments.
   */
  @Config(BLOB_PROVIDER_TENANT_ID)
  @Default("")
  public final String blobProviderTenantId;

  public BlobProviderConfig(VerifiableProperties verifiableProperties) {
    blobProviderFactory = verifiableProperties.getString(BLOB_PROVIDER_FACTORY, DEFAULT_BLOB_PROVIDER_FACTORY);
    blobProviderChunkSize =
        verifiableProperties.getIntInRange(BLOB_PROVIDER_CHUNK_SIZE, DEFAULT_CHUNK_SIZE, 1, MAX_CHUNK_SIZE);
    blobProviderTenantId = verifiableProperties.getString(BLOB_PROVIDER_TENANT_ID, "");
  }
}
