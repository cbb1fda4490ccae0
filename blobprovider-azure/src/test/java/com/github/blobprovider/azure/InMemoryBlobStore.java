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

import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpHeaders;
import com.azure.core.http.HttpResponse;
import com.azure.core.http.rest.PagedFlux;
import com.azure.core.http.rest.PagedIterable;
import com.azure.core.http.rest.PagedResponse;
import com.azure.core.http.rest.PagedResponseBase;
import com.azure.core.util.FluxUtil;
import com.azure.storage.blob.BlobAsyncClient;
import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerAsyncClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceAsyncClient;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.models.BlobErrorCode;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.BlobProperties;
import com.azure.storage.blob.models.BlobStorageException;
import com.azure.storage.blob.options.BlockBlobCommitBlockListOptions;
import com.azure.storage.blob.specialized.BlobInputStream;
import com.azure.storage.blob.specialized.BlobOutputStream;
import com.azure.storage.blob.specialized.BlockBlobAsyncClient;
import com.azure.storage.blob.specialized.BlockBlobClient;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.codec.digest.DigestUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;


/**
 * A storage account kept in memory behind mocked Azure clients. Models containers, staged blocks, committed blobs
 * and their metadata closely enough to run the block upload protocol end to end. Failures are raised as real
 * {@link BlobStorageException}s carrying the service error code.
 */
class InMemoryBlobStore {

  private final Map<String, Map<String, StoredBlob>> containers = new ConcurrentHashMap<>();
  private final Map<String, BlobContainerClient> containerClients = new ConcurrentHashMap<>();
  private final Map<String, BlobContainerAsyncClient> containerAsyncClients = new ConcurrentHashMap<>();
  private final BlobServiceClient serviceClient = mock(BlobServiceClient.class);
  private final BlobServiceAsyncClient serviceAsyncClient = mock(BlobServiceAsyncClient.class);
  private volatile BlobErrorCode injectedError;
  private volatile BlobErrorCode injectedCommitError;

  InMemoryBlobStore() {
    when(serviceClient.getBlobContainerClient(anyString())).thenAnswer(
        invocation -> containerClients.computeIfAbsent(invocation.getArgument(0), this::newContainerClient));
    when(serviceAsyncClient.getBlobContainerAsyncClient(anyString())).thenAnswer(
        invocation -> containerAsyncClients.computeIfAbsent(invocation.getArgument(0), this::newContainerAsyncClient));
  }

  BlobServiceClient getServiceClient() {
    return serviceClient;
  }

  BlobServiceAsyncClient getServiceAsyncClient() {
    return serviceAsyncClient;
  }

  /**
   * Make every following blob request fail with the given error code, or succeed again if {@code null}.
   */
  void injectError(BlobErrorCode errorCode) {
    injectedError = errorCode;
  }

  /**
   * Make every following commit fail with the given error code, or succeed again if {@code null}.
   */
  void injectCommitError(BlobErrorCode errorCode) {
    injectedCommitError = errorCode;
  }

  boolean containerExists(String containerName) {
    return containers.containsKey(containerName);
  }

  /**
   * @return the committed content of a blob, or {@code null} if it is not committed.
   */
  byte[] getContent(String containerName, String blobId) {
    StoredBlob blob = getBlobs(containerName).get(blobId);
    return blob == null ? null : blob.content;
  }

  Map<String, String> getMetadata(String containerName, String blobId) {
    StoredBlob blob = getBlobs(containerName).get(blobId);
    return blob == null ? null : blob.metadata;
  }

  int getStagedBlockCount(String containerName, String blobId) {
    StoredBlob blob = getBlobs(containerName).get(blobId);
    return blob == null ? 0 : blob.stagedBlocks.size();
  }

  /**
   * @return the Content-MD5 values sent with the staged blocks of a blob, in request order.
   */
  List<byte[]> getReceivedMd5s(String containerName, String blobId) {
    StoredBlob blob = getBlobs(containerName).get(blobId);
    return blob == null ? Collections.emptyList() : blob.receivedMd5s;
  }

  static BlobStorageException storageException(BlobErrorCode errorCode, int statusCode) {
    HttpResponse response = mock(HttpResponse.class);
    HttpHeaders headers = new HttpHeaders().set("x-ms-error-code", errorCode.toString());
    when(response.getStatusCode()).thenReturn(statusCode);
    when(response.getHeaders()).thenReturn(headers);
    when(response.getHeaderValue(anyString())).thenAnswer(
        invocation -> headers.getValue(invocation.<String>getArgument(0)));
    when(response.getHeaderValue(any(HttpHeaderName.class))).thenAnswer(
        invocation -> headers.getValue((HttpHeaderName) invocation.getArgument(0)));
    return new BlobStorageException("Status code " + statusCode + ", " + errorCode, response, null);
  }

  private Map<String, StoredBlob> getBlobs(String containerName) {
    Map<String, StoredBlob> blobs = containers.get(containerName);
    if (blobs == null) {
      throw storageException(BlobErrorCode.CONTAINER_NOT_FOUND, 404);
    }
    return blobs;
  }

  private BlobContainerClient newContainerClient(String containerName) {
    BlobContainerClient containerClient = mock(BlobContainerClient.class);
    when(containerClient.exists()).thenAnswer(invocation -> containers.containsKey(containerName));
    doAnswer(invocation -> {
      if (containers.putIfAbsent(containerName, new ConcurrentHashMap<>()) != null) {
        throw storageException(BlobErrorCode.CONTAINER_ALREADY_EXISTS, 409);
      }
      return null;
    }).when(containerClient).create();
    when(containerClient.listBlobs()).thenAnswer(invocation -> {
      PagedFlux<BlobItem> pages = new PagedFlux<>(() -> Mono.fromCallable(() -> listCommittedBlobs(containerName)));
      return new PagedIterable<>(pages);
    });
    Map<String, BlobClient> blobClients = new ConcurrentHashMap<>();
    when(containerClient.getBlobClient(anyString())).thenAnswer(
        invocation -> blobClients.computeIfAbsent(invocation.getArgument(0), blobId -> {
          BlobClient blobClient = mock(BlobClient.class);
          BlockBlobClient blockBlobClient = newBlockBlobClient(containerName, blobId);
          when(blobClient.getBlockBlobClient()).thenReturn(blockBlobClient);
          return blobClient;
        }));
    return containerClient;
  }

  private BlobContainerAsyncClient newContainerAsyncClient(String containerName) {
    BlobContainerAsyncClient containerAsyncClient = mock(BlobContainerAsyncClient.class);
    Map<String, BlobAsyncClient> blobAsyncClients = new ConcurrentHashMap<>();
    when(containerAsyncClient.getBlobAsyncClient(anyString())).thenAnswer(
        invocation -> blobAsyncClients.computeIfAbsent(invocation.getArgument(0), blobId -> {
          BlobAsyncClient blobAsyncClient = mock(BlobAsyncClient.class);
          BlockBlobAsyncClient blockBlobAsyncClient = newBlockBlobAsyncClient(containerName, blobId);
          when(blobAsyncClient.getBlockBlobAsyncClient()).thenReturn(blockBlobAsyncClient);
          return blobAsyncClient;
        }));
    return containerAsyncClient;
  }

  private BlockBlobClient newBlockBlobClient(String containerName, String blobId) {
    BlockBlobClient client = mock(BlockBlobClient.class);
    when(client.stageBlockWithResponse(anyString(), any(InputStream.class), anyLong(), any(), any(), any(),
        any())).thenAnswer(invocation -> {
      InputStream data = invocation.getArgument(1);
      stageBlock(containerName, blobId, invocation.getArgument(0), data.readAllBytes(), invocation.getArgument(2),
          invocation.getArgument(3));
      return null;
    });
    when(client.commitBlockListWithResponse(any(BlockBlobCommitBlockListOptions.class), any(), any())).thenAnswer(
        invocation -> {
          commitBlockList(containerName, blobId, invocation.getArgument(0));
          return null;
        });
    doAnswer(invocation -> {
      delete(containerName, blobId);
      return null;
    }).when(client).delete();
    when(client.exists()).thenAnswer(invocation -> {
      checkInjectedError();
      return getContent(containerName, blobId) != null;
    });
    when(client.openInputStream()).thenAnswer(invocation -> openInputStream(containerName, blobId));
    when(client.getBlobOutputStream(any(), any(), any(), any(), any())).thenAnswer(
        invocation -> openOutputStream(containerName, blobId, invocation.getArgument(2)));
    return client;
  }

  private BlockBlobAsyncClient newBlockBlobAsyncClient(String containerName, String blobId) {
    BlockBlobAsyncClient client = mock(BlockBlobAsyncClient.class);
    when(client.stageBlockWithResponse(anyString(), any(), anyLong(), any(), any())).thenAnswer(invocation -> {
      String blockId = invocation.getArgument(0);
      Flux<ByteBuffer> data = invocation.getArgument(1);
      long length = invocation.getArgument(2);
      byte[] contentMd5 = invocation.getArgument(3);
      return FluxUtil.collectBytesInByteBufferStream(data).flatMap(bytes -> {
        stageBlock(containerName, blobId, blockId, bytes, length, contentMd5);
        return Mono.empty();
      });
    });
    when(client.commitBlockListWithResponse(any(BlockBlobCommitBlockListOptions.class))).thenAnswer(invocation -> {
      BlockBlobCommitBlockListOptions options = invocation.getArgument(0);
      return Mono.fromRunnable(() -> commitBlockList(containerName, blobId, options));
    });
    when(client.delete()).thenAnswer(invocation -> Mono.fromRunnable(() -> delete(containerName, blobId)));
    return client;
  }

  private void checkInjectedError() {
    BlobErrorCode errorCode = injectedError;
    if (errorCode != null) {
      throw storageException(errorCode, 500);
    }
  }

  private synchronized void stageBlock(String containerName, String blobId, String blockId, byte[] data, long length,
      byte[] contentMd5) {
    checkInjectedError();
    if (data.length != length) {
      throw storageException(BlobErrorCode.INVALID_HEADER_VALUE, 400);
    }
    if (contentMd5 != null && !Arrays.equals(contentMd5, DigestUtils.md5(data))) {
      throw storageException(BlobErrorCode.MD5MISMATCH, 400);
    }
    StoredBlob blob = getBlobs(containerName).computeIfAbsent(blobId, id -> new StoredBlob());
    blob.stagedBlocks.put(blockId, data);
    blob.receivedMd5s.add(contentMd5);
  }

  /**
   * Commit the listed blocks and set the metadata in one step, the way Put Block List does.
   */
  private synchronized void commitBlockList(String containerName, String blobId,
      BlockBlobCommitBlockListOptions options) {
    checkInjectedError();
    BlobErrorCode errorCode = injectedCommitError;
    if (errorCode != null) {
      throw storageException(errorCode, 503);
    }
    StoredBlob blob = getBlobs(containerName).computeIfAbsent(blobId, id -> new StoredBlob());
    ByteArrayOutputStream content = new ByteArrayOutputStream();
    for (String blockId : options.getBase64BlockIds()) {
      byte[] block = blob.stagedBlocks.get(blockId);
      if (block == null) {
        throw storageException(BlobErrorCode.INVALID_BLOCK_LIST, 400);
      }
      content.write(block, 0, block.length);
    }
    blob.content = content.toByteArray();
    blob.metadata = options.getMetadata() == null ? new HashMap<>() : new HashMap<>(options.getMetadata());
    blob.stagedBlocks.clear();
  }

  private PagedResponse<BlobItem> listCommittedBlobs(String containerName) {
    checkInjectedError();
    List<BlobItem> items = new ArrayList<>();
    getBlobs(containerName).forEach((name, blob) -> {
      if (blob.content != null) {
        items.add(new BlobItem().setName(name));
      }
    });
    return new PagedResponseBase<Void, BlobItem>(null, 200, new HttpHeaders(), items, null, null);
  }

  private synchronized void delete(String containerName, String blobId) {
    checkInjectedError();
    StoredBlob blob = getBlobs(containerName).get(blobId);
    if (blob == null || blob.content == null) {
      throw storageException(BlobErrorCode.BLOB_NOT_FOUND, 404);
    }
    getBlobs(containerName).remove(blobId);
  }

  private BlobInputStream openInputStream(String containerName, String blobId) throws IOException {
    checkInjectedError();
    byte[] content = getContent(containerName, blobId);
    if (content == null) {
      throw storageException(BlobErrorCode.BLOB_NOT_FOUND, 404);
    }
    ByteArrayInputStream delegate = new ByteArrayInputStream(content);
    BlobProperties properties = mock(BlobProperties.class);
    when(properties.getBlobSize()).thenReturn((long) content.length);
    BlobInputStream stream = mock(BlobInputStream.class);
    when(stream.getProperties()).thenReturn(properties);
    when(stream.read()).thenAnswer(invocation -> delegate.read());
    when(stream.read(any(byte[].class))).thenAnswer(invocation -> delegate.read(invocation.getArgument(0)));
    when(stream.read(any(byte[].class), anyInt(), anyInt())).thenAnswer(
        invocation -> delegate.read(invocation.getArgument(0), invocation.getArgument(1), invocation.getArgument(2)));
    when(stream.skip(anyLong())).thenAnswer(invocation -> delegate.skip(invocation.getArgument(0)));
    return stream;
  }

  private BlobOutputStream openOutputStream(String containerName, String blobId, Map<String, String> metadata)
      throws IOException {
    checkInjectedError();
    getBlobs(containerName);
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    BlobOutputStream stream = mock(BlobOutputStream.class);
    doAnswer(invocation -> {
      buffer.write(invocation.<Integer>getArgument(0));
      return null;
    }).when(stream).write(anyInt());
    doAnswer(invocation -> {
      byte[] bytes = invocation.getArgument(0);
      buffer.write(bytes, 0, bytes.length);
      return null;
    }).when(stream).write(any(byte[].class));
    doAnswer(invocation -> {
      buffer.write(invocation.getArgument(0), invocation.getArgument(1), invocation.getArgument(2));
      return null;
    }).when(stream).write(any(byte[].class), anyInt(), anyInt());
    doAnswer(invocation -> {
      synchronized (this) {
        StoredBlob blob = getBlobs(containerName).computeIfAbsent(blobId, id -> new StoredBlob());
        blob.content = buffer.toByteArray();
        blob.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        blob.stagedBlocks.clear();
      }
      return null;
    }).when(stream).close();
    return stream;
  }

  private static class StoredBlob {
    private final Map<String, byte[]> stagedBlocks = new HashMap<>();
    private final List<byte[]> receivedMd5s = new ArrayList<>();
    private volatile byte[] content;
    private volatile Map<String, String> metadata;
  }
}
