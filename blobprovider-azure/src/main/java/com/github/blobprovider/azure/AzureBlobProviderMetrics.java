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

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;


/**
 * Metrics of {@link AzureBlobProvider}: request counts and latencies, and failures by error class.
 */
public class AzureBlobProviderMetrics {

  // Metric name constants
  public static final String BLOCK_STAGE_COUNT = "BlockStageCount";
  public static final String BLOCK_STAGE_TIME = "BlockStageTime";
  public static final String BLOB_COMMIT_COUNT = "BlobCommitCount";
  public static final String BLOB_COMMIT_TIME = "BlobCommitTime";
  public static final String BLOB_DELETE_COUNT = "BlobDeleteCount";
  public static final String BLOB_DELETE_TIME = "BlobDeleteTime";
  public static final String READ_STREAM_OPEN_COUNT = "ReadStreamOpenCount";
  public static final String WRITE_STREAM_OPEN_COUNT = "WriteStreamOpenCount";
  public static final String CONTAINER_CREATE_COUNT = "ContainerCreateCount";
  public static final String CONFIG_ERROR_COUNT = "ConfigErrorCount";
  public static final String BLOB_NOT_FOUND_COUNT = "BlobNotFoundCount";
  public static final String STORAGE_ERROR_COUNT = "StorageErrorCount";

  // Metrics
  public final Counter blockStageCount;
  public final Timer blockStageTime;
  public final Counter blobCommitCount;
  public final Timer blobCommitTime;
  public final Counter blobDeleteCount;
  public final Timer blobDeleteTime;
  public final Counter readStreamOpenCount;
  public final Counter writeStreamOpenCount;
  public final Counter containerCreateCount;
  public final Counter configErrorCount;
  public final Counter blobNotFoundCount;
  public final Counter storageErrorCount;

  public AzureBlobProviderMetrics(MetricRegistry registry) {
    blockStageCount = registry.counter(MetricRegistry.name(AzureBlobProvider.class, BLOCK_STAGE_COUNT));
    blockStageTime = registry.timer(MetricRegistry.name(AzureBlobProvider.class, BLOCK_STAGE_TIME));
    blobCommitCount = registry.counter(MetricRegistry.name(AzureBlobProvider.class, BLOB_COMMIT_COUNT));
    blobCommitTime = registry.timer(MetricRegistry.name(AzureBlobProvider.class, BLOB_COMMIT_TIME));
    blobDeleteCount = registry.counter(MetricRegistry.name(AzureBlobProvider.class, BLOB_DELETE_COUNT));
    blobDeleteTime = registry.timer(MetricRegistry.name(AzureBlobProvider.class, BLOB_DELETE_TIME));
    readStreamOpenCount = registry.counter(MetricRegistry.name(AzureBlobProvider.class, READ_STREAM_OPEN_COUNT));
    writeStreamOpenCount = registry.counter(MetricRegistry.name(AzureBlobProvider.class, WRITE_STREAM_OPEN_COUNT));
    containerCreateCount = registry.counter(MetricRegistry.name(AzureBlobProvider.class, CONTAINER_CREATE_COUNT));
    configErrorCount = registry.counter(MetricRegistry.name(AzureBlobProvider.class, CONFIG_ERROR_COUNT));
    blobNotFoundCount = registry.counter(MetricRegistry.name(AzureBlobProvider.class, BLOB_NOT_FOUND_COUNT));
    storageErrorCount = registry.counter(MetricRegistry.name(AzureBlobProvider.class, STORAGE_ERROR_COUNT));
  }
}
