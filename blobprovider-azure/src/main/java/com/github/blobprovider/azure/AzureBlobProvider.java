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

import com.azure.core.util.Context;
import com.azure.storage.blob.BlobContainerAsyncClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceAsyncClient;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.models.BlobErrorCode;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.BlobStorageException;
import com.azure.storage.blob.models.ParallelTransferOptions;
import com.azure.storage.blob.options.BlockBlobCommitBlockListOptions;
import com.azure.storage.blob.specialized.BlobInputStream;
import com.azure.storage.blob.specialized.BlobOutputStream;
import com.azure.storage.blob.specialized.BlockBlobAsyncClient;
import com.azure.storage.blob.specialized.BlockBlobClient;
import com.codahale.metrics.Timer;
import com.github.blobprovider.BlobProvider;
import com.github.blobprovider.BlobProviderErrorCode;
import com.github.blobprovider.BlobProviderException;
import com.github.blobprovider.BlobStorageContext;
import com.github.blobprovider.config.BlobProviderConfig;
import com.google.common.collect.ForwardingIterator;
import com.google.common.collect.Iterables;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;


/**
 * A {@link BlobProvider} that keeps each binary in an Azure block blob. Chunk {@code n} of a binary is staged as
 * block {@code n} and the block list is committed when the chunk ending the binary arrives, so a blob is either
 * absent or complete. The blobs of a tenant live in the container {@code <prefix><tenantId>}.
 */
public class AzureBlobProvider implements BlobProvider {

  static final String FILE_ID_KEY = "fileId";
  static final String VERSION_ID_KEY = "versionId";
  static final String PROPERTY_TYPE_ID_KEY = "propertyTypeId";

  private static final Logger logger = LoggerFactory.getLogger(AzureBlobProvider.class);
  private final String tenantId;
  private final String containerName;
  private final int chunkSize;
  private final boolean transactionalMd5Enabled;
  private final BlobContainerClient containerClient;
  private final BlobContainerAsyncClient containerAsyncClient;
  private final AzureBlobProviderMetrics metrics;

  /**
   * Construct a provider for one tenant and make sure its container exists.
   * @param tenantId the tenant served by this provider, empty for single-tenant deployments.
   * @param blobProviderConfig the {@link BlobProviderConfig} to use.
   * @param azureConfig the {@link AzureBlobProviderConfig} to use.
   * @param serviceClient the sync client of the storage account.
   * @param serviceAsyncClient the async client of the same storage account.
   * @param metrics the {@link AzureBlobProviderMetrics} to use.
   * @throws BlobProviderException with {@link BlobProviderErrorCode#InvalidContainerName} if the tenant's container
   * name is invalid, in which case no request is sent, or with another code if the container cannot be created.
   */
  public AzureBlobProvider(String tenantId, BlobProviderConfig blobProviderConfig, AzureBlobProviderConfig azureConfig,
      BlobServiceClient serviceClient, BlobServiceAsyncClient serviceAsyncClient, AzureBlobProviderMetrics metrics)
      throws BlobProviderException {
    this.tenantId = tenantId == null ? "" : tenantId;
    this.metrics = metrics;
    try {
      containerName = new AzureContainerNamespace(azureConfig.azureContainerPrefix).getContainerName(this.tenantId);
    } catch (BlobProviderException e) {
      metrics.configErrorCount.inc();
      throw e;
    }
    this.chunkSize = blobProviderConfig.blobProviderChunkSize;
    this.transactionalMd5Enabled = azureConfig.azureTransactionalMd5Enabled;
    this.containerClient = serviceClient.getBlobContainerClient(containerName);
    this.containerAsyncClient = serviceAsyncClient.getBlobContainerAsyncClient(containerName);
    ensureContainerExists();
  }

  @Override
  public void allocate(BlobStorageContext context) throws BlobProviderException {
    AzureBlobProviderData data = assignProviderData(context);
    if (context.getLength() == 0) {
      BlockBlobClient blockBlobClient = getBlockBlobClient(data.getBlobId());
      try {
        commit(blockBlobClient, data.getBlobId(), 0, context);
      } catch (RuntimeException e) {
        throw toBlobProviderException("Commit", data.getBlobId(), e);
      }
    }
  }

  @Override
  public CompletableFuture<Void> allocateAsync(BlobStorageContext context) {
    AzureBlobProviderData data;
    try {
      data = assignProviderData(context);
    } catch (BlobProviderException e) {
      return CompletableFuture.failedFuture(e);
    }
    if (context.getLength() > 0) {
      return CompletableFuture.completedFuture(null);
    }
    String blobId = data.getBlobId();
    return commitAsync(getBlockBlobAsyncClient(blobId), blobId, 0, context).onErrorMap(
        e -> toBlobProviderException("Commit", blobId, e)).toFuture();
  }

  @Override
  public void write(BlobStorageContext context, long offset, byte[] buffer) throws BlobProviderException {
    ChunkWrite chunk = prepareWrite(context, offset, buffer);
    BlockBlobClient blockBlobClient = getBlockBlobClient(chunk.blobId);
    String operation = "Stage";
    try {
      Timer.Context timer = metrics.blockStageTime.time();
      try {
        blockBlobClient.stageBlockWithResponse(chunk.blockId, new ByteArrayInputStream(buffer), buffer.length,
            getContentMd5(buffer), null, null, Context.NONE);
        metrics.blockStageCount.inc();
      } finally {
        timer.stop();
      }
      if (chunk.isLast()) {
        operation = "Commit";
        commit(blockBlobClient, chunk.blobId, chunk.blockCount, context);
      }
    } catch (RuntimeException e) {
      throw toBlobProviderException(operation, chunk.blobId, e);
    }
  }

  @Override
  public CompletableFuture<Void> writeAsync(BlobStorageContext context, long offset, byte[] buffer) {
    ChunkWrite chunk;
    try {
      chunk = prepareWrite(context, offset, buffer);
    } catch (BlobProviderException e) {
      return CompletableFuture.failedFuture(e);
    }
    BlockBlobAsyncClient blockBlobAsyncClient = getBlockBlobAsyncClient(chunk.blobId);
    Mono<Void> stage = Mono.defer(() -> {
      Timer.Context timer = metrics.blockStageTime.time();
      return blockBlobAsyncClient.stageBlockWithResponse(chunk.blockId, Flux.just(ByteBuffer.wrap(buffer)),
          buffer.length, getContentMd5(buffer), null)
          .doOnSuccess(response -> metrics.blockStageCount.inc())
          .doFinally(signal -> timer.stop())
          .then();
    }).onErrorMap(e -> toBlobProviderException("Stage", chunk.blobId, e));
    if (chunk.isLast()) {
      stage = stage.then(commitAsync(blockBlobAsyncClient, chunk.blobId, chunk.blockCount, context).onErrorMap(
          e -> toBlobProviderException("Commit", chunk.blobId, e)));
    }
    return stage.toFuture();
  }

  @Override
  public void delete(BlobStorageContext context) throws BlobProviderException {
    String blobId = getProviderData(context).getBlobId();
    Timer.Context timer = metrics.blobDeleteTime.time();
    try {
      getBlockBlobClient(blobId).delete();
      metrics.blobDeleteCount.inc();
      logger.debug("Deleted blob {} in container {}", blobId, containerName);
    } catch (RuntimeException e) {
      throw toBlobProviderException("Delete", blobId, e);
    } finally {
      timer.stop();
    }
  }

  @Override
  public CompletableFuture<Void> deleteAsync(BlobStorageContext context) {
    String blobId;
    try {
      blobId = getProviderData(context).getBlobId();
    } catch (BlobProviderException e) {
      return CompletableFuture.failedFuture(e);
    }
    return Mono.defer(() -> {
      Timer.Context timer = metrics.blobDeleteTime.time();
      return getBlockBlobAsyncClient(blobId).delete()
          .doOnSuccess(v -> metrics.blobDeleteCount.inc())
          .doFinally(signal -> timer.stop());
    }).onErrorMap(e -> toBlobProviderException("Delete", blobId, e)).toFuture();
  }

  @Override
  public BlobInputStream getStreamForRead(BlobStorageContext context) throws BlobProviderException {
    String blobId = getProviderData(context).getBlobId();
    try {
      BlobInputStream inputStream = getBlockBlobClient(blobId).openInputStream();
      metrics.readStreamOpenCount.inc();
      return inputStream;
    } catch (RuntimeException e) {
      throw toBlobProviderException("Read", blobId, e);
    }
  }

  @Override
  public BlobOutputStream getStreamForWrite(BlobStorageContext context) throws BlobProviderException {
    String blobId = getProviderData(context).getBlobId();
    ParallelTransferOptions transferOptions = new ParallelTransferOptions().setBlockSizeLong((long) chunkSize);
    try {
      BlobOutputStream outputStream =
          getBlockBlobClient(blobId).getBlobOutputStream(transferOptions, null, getMetadata(context), null, null);
      metrics.writeStreamOpenCount.inc();
      return outputStream;
    } catch (RuntimeException e) {
      throw toBlobProviderException("Write", blobId, e);
    }
  }

  @Override
  public Closeable cloneStream(BlobStorageContext context, Closeable stream) throws BlobProviderException {
    if (stream instanceof OutputStream) {
      return getStreamForWrite(context);
    }
    return getStreamForRead(context);
  }

  @Override
  public boolean exists(String blobId) throws BlobProviderException {
    try {
      return Boolean.TRUE.equals(getBlockBlobClient(blobId).exists());
    } catch (RuntimeException e) {
      throw toBlobProviderException("Exists", blobId, e);
    }
  }

  /**
   * {@inheritDoc}
   * <p>
   * Failures of the listing are logged and counted, then rethrown unchanged by the iterator.
   */
  @Override
  public Iterable<String> getBlobIds() {
    Iterable<String> blobIds = Iterables.transform(containerClient.listBlobs(), BlobItem::getName);
    return () -> new ForwardingIterator<String>() {
      private final Iterator<String> delegate = openListing(blobIds);

      @Override
      protected Iterator<String> delegate() {
        return delegate;
      }

      @Override
      public boolean hasNext() {
        try {
          return super.hasNext();
        } catch (RuntimeException e) {
          throw listingFailure(e);
        }
      }

      @Override
      public String next() {
        try {
          return super.next();
        } catch (RuntimeException e) {
          throw listingFailure(e);
        }
      }
    };
  }

  @Override
  public AzureBlobProviderData parseData(String providerData) throws BlobProviderException {
    return AzureBlobProviderData.fromJson(providerData);
  }

  @Override
  public String serializeData(Object providerData) throws BlobProviderException {
    if (!(providerData instanceof AzureBlobProviderData)) {
      throw new BlobProviderException("Cannot serialize provider data of another provider: " + providerData,
          BlobProviderErrorCode.InvalidProviderData);
    }
    return ((AzureBlobProviderData) providerData).toJson();
  }

  /**
   * @return the tenant served by this provider.
   */
  public String getTenantId() {
    return tenantId;
  }

  /**
   * @return the name of the container holding the blobs of this provider's tenant.
   */
  public String getContainerName() {
    return containerName;
  }

  int getChunkSize() {
    return chunkSize;
  }

  private Iterator<String> openListing(Iterable<String> blobIds) {
    try {
      return blobIds.iterator();
    } catch (RuntimeException e) {
      throw listingFailure(e);
    }
  }

  private RuntimeException listingFailure(RuntimeException e) {
    // Iterator cannot throw the checked exception, so the cause is rethrown as is.
    toBlobProviderException("List", null, e);
    return e;
  }

  private void ensureContainerExists() throws BlobProviderException {
    try {
      if (!containerClient.exists()) {
        containerClient.create();
        metrics.containerCreateCount.inc();
        logger.info("Created container {}", containerName);
      }
    } catch (BlobStorageException e) {
      if (!BlobErrorCode.CONTAINER_ALREADY_EXISTS.equals(e.getErrorCode())) {
        throw toBlobProviderException("Create container", null, e);
      }
      logger.debug("Container {} was created concurrently", containerName);
    } catch (RuntimeException e) {
      throw toBlobProviderException("Create container", null, e);
    }
  }

  /**
   * Replace the provider data of the context, keeping the blob id it may already carry.
   */
  private AzureBlobProviderData assignProviderData(BlobStorageContext context) throws BlobProviderException {
    Object existing = context.getBlobProviderData();
    if (existing != null && !(existing instanceof AzureBlobProviderData)) {
      throw new BlobProviderException("Cannot allocate over provider data of another provider: " + existing,
          BlobProviderErrorCode.InvalidProviderData);
    }
    String existingBlobId = existing == null ? null : ((AzureBlobProviderData) existing).getBlobId();
    AzureBlobProviderData data = AzureBlobProviderData.allocate(existingBlobId, chunkSize);
    context.setBlobProviderData(data);
    logger.debug("Allocated blob {} in container {} for {}", data.getBlobId(), containerName, context);
    return data;
  }

  private AzureBlobProviderData getProviderData(BlobStorageContext context) throws BlobProviderException {
    Object data = context.getBlobProviderData();
    if (!(data instanceof AzureBlobProviderData)) {
      throw new BlobProviderException("Context has no Azure provider data: " + context,
          BlobProviderErrorCode.InvalidProviderData);
    }
    return (AzureBlobProviderData) data;
  }

  /**
   * Check a chunk against the chunk size recorded at allocation and work out which block it fills.
   */
  private ChunkWrite prepareWrite(BlobStorageContext context, long offset, byte[] buffer)
      throws BlobProviderException {
    AzureBlobProviderData data = getProviderData(context);
    String blobId = data.getBlobId();
    int dataChunkSize = data.getChunkSize();
    if (dataChunkSize <= 0) {
      throw new BlobProviderException("Provider data of blob " + blobId + " has no chunk size.",
          BlobProviderErrorCode.InvalidProviderData);
    }
    if (buffer.length > dataChunkSize || offset < 0 || offset % dataChunkSize != 0) {
      throw configurationMismatch(blobId, offset, buffer.length, dataChunkSize, "");
    }
    long length = context.getLength();
    long blockCount = length / dataChunkSize + (length % dataChunkSize == 0 ? 0 : 1);
    long index = offset / dataChunkSize + 1;
    if (index > blockCount) {
      throw configurationMismatch(blobId, offset, buffer.length, dataChunkSize,
          " Block " + index + " is past the end of a " + length + " byte binary.");
    }
    if (blockCount > BlockIdCodec.MAX_BLOCK_INDEX) {
      throw configurationMismatch(blobId, offset, buffer.length, dataChunkSize,
          " A " + length + " byte binary needs more than " + BlockIdCodec.MAX_BLOCK_INDEX + " blocks.");
    }
    logger.debug("Writing block {} of {} for blob {} at offset {}", index, blockCount, blobId, offset);
    return new ChunkWrite(blobId, (int) index, (int) blockCount);
  }

  private BlobProviderException configurationMismatch(String blobId, long offset, int bufferLength,
      int dataChunkSize, String detail) {
    metrics.configErrorCount.inc();
    return new BlobProviderException(
        "Chunk of blob " + blobId + " at offset " + offset + " with length " + bufferLength
            + " does not match chunk size " + dataChunkSize + "." + detail,
        BlobProviderErrorCode.ConfigurationMismatch);
  }

  /**
   * Commit the first {@code blockCount} blocks and tag the blob in the same request, so a failed commit leaves
   * nothing readable.
   */
  private void commit(BlockBlobClient blockBlobClient, String blobId, int blockCount, BlobStorageContext context) {
    Timer.Context timer = metrics.blobCommitTime.time();
    try {
      blockBlobClient.commitBlockListWithResponse(getCommitOptions(blockCount, context), null, Context.NONE);
      metrics.blobCommitCount.inc();
      logger.debug("Committed {} blocks of blob {} in container {}", blockCount, blobId, containerName);
    } finally {
      timer.stop();
    }
  }

  private Mono<Void> commitAsync(BlockBlobAsyncClient blockBlobAsyncClient, String blobId, int blockCount,
      BlobStorageContext context) {
    return Mono.defer(() -> {
      Timer.Context timer = metrics.blobCommitTime.time();
      return blockBlobAsyncClient.commitBlockListWithResponse(getCommitOptions(blockCount, context))
          .doOnSuccess(response -> {
            metrics.blobCommitCount.inc();
            logger.debug("Committed {} blocks of blob {} in container {}", blockCount, blobId, containerName);
          })
          .doFinally(signal -> timer.stop())
          .then();
    });
  }

  private static BlockBlobCommitBlockListOptions getCommitOptions(int blockCount, BlobStorageContext context) {
    return new BlockBlobCommitBlockListOptions(BlockIdCodec.encodeRange(blockCount)).setMetadata(
        getMetadata(context));
  }

  private byte[] getContentMd5(byte[] buffer) {
    return transactionalMd5Enabled ? DigestUtils.md5(buffer) : null;
  }

  private static Map<String, String> getMetadata(BlobStorageContext context) {
    Map<String, String> metadata = new HashMap<>();
    metadata.put(FILE_ID_KEY, String.valueOf(context.getFileId()));
    metadata.put(VERSION_ID_KEY, String.valueOf(context.getVersionId()));
    metadata.put(PROPERTY_TYPE_ID_KEY, String.valueOf(context.getPropertyTypeId()));
    return metadata;
  }

  private BlockBlobClient getBlockBlobClient(String blobId) {
    return containerClient.getBlobClient(blobId).getBlockBlobClient();
  }

  private BlockBlobAsyncClient getBlockBlobAsyncClient(String blobId) {
    return containerAsyncClient.getBlobAsyncClient(blobId).getBlockBlobAsyncClient();
  }

  /**
   * Translate a failure of the store into a {@link BlobProviderException}. Exceptions that are already translated
   * pass through unchanged.
   * @param blobId the blob the request was about, or {@code null} for container requests.
   */
  private BlobProviderException toBlobProviderException(String operation, String blobId, Throwable e) {
    if (e instanceof BlobProviderException) {
      return (BlobProviderException) e;
    }
    String target = (blobId == null ? "" : "blob " + blobId + " in ") + "container " + containerName;
    if (e instanceof BlobStorageException && isNotFoundError(((BlobStorageException) e).getErrorCode())) {
      metrics.blobNotFoundCount.inc();
      logger.warn("{} failed, {} not found: {}", operation, target, e.getMessage());
      return new BlobProviderException(operation + " failed, " + target + " not found", e,
          BlobProviderErrorCode.BlobNotFound);
    }
    metrics.storageErrorCount.inc();
    logger.error("{} failed for {}", operation, target, e);
    return new BlobProviderException(operation + " failed for " + target, e, BlobProviderErrorCode.StorageError);
  }

  private static boolean isNotFoundError(BlobErrorCode errorCode) {
    return BlobErrorCode.BLOB_NOT_FOUND.equals(errorCode) || BlobErrorCode.CONTAINER_NOT_FOUND.equals(errorCode);
  }

  /**
   * The block a chunk fills. Indices are 1-based.
   */
  private static final class ChunkWrite {
    private final String blobId;
    private final int index;
    private final int blockCount;
    private final String blockId;

    private ChunkWrite(String blobId, int index, int blockCount) {
      this.blobId = blobId;
      this.index = index;
      this.blockCount = blockCount;
      this.blockId = BlockIdCodec.encode(index);
    }

    boolean isLast() {
      return index == blockCount;
    }
  }
}
