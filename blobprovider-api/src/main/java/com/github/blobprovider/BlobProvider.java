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

import java.io.Closeable;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;


/**
 * Stores, reads and deletes the binaries of a content repository in an external blob store. A provider instance
 * serves exactly one tenant; use a {@link BlobProviderFactory} to obtain the provider for another tenant.
 * <p>
 * A binary is written either as a sequence of chunks through {@link #write(BlobStorageContext, long, byte[])}, in
 * non-decreasing offset order from a single caller, or through {@link #getStreamForWrite(BlobStorageContext)}. Both
 * require a prior {@link #allocate(BlobStorageContext)}. Calls for different blobs may run concurrently; calls for
 * the same blob must be serialized by the caller.
 * <p>
 * Every asynchronous variant has the same semantics as its synchronous counterpart. Returned futures complete
 * exceptionally with a {@link BlobProviderException}; cancelling one cancels the pending store request.
 */
public interface BlobProvider {

  /**
   * Assign a blob to the context: reuse the blob id already present in its provider data, or mint a new one, and
   * record the chunk size every later write must use.
   * @param context the {@link BlobStorageContext} whose provider data is replaced.
   * @throws BlobProviderException if the provider data belongs to another provider or the store fails.
   */
  void allocate(BlobStorageContext context) throws BlobProviderException;

  /**
   * Asynchronous variant of {@link #allocate(BlobStorageContext)}.
   * @param context the {@link BlobStorageContext} whose provider data is replaced.
   * @return a {@link CompletableFuture} that completes once the provider data is set.
   */
  CompletableFuture<Void> allocateAsync(BlobStorageContext context);

  /**
   * Write one chunk of the binary. The chunk ending the binary finalizes it; until then nothing is readable.
   * @param context the allocated {@link BlobStorageContext}.
   * @param offset the position of the chunk in the binary. Must be a multiple of the allocated chunk size.
   * @param buffer the chunk. No longer than the allocated chunk size.
   * @throws BlobProviderException with {@link BlobProviderErrorCode#ConfigurationMismatch} if the chunk does not fit
   * the allocated chunk size, or another code if the store fails.
   */
  void write(BlobStorageContext context, long offset, byte[] buffer) throws BlobProviderException;

  /**
   * Asynchronous variant of {@link #write(BlobStorageContext, long, byte[])}.
   * @param context the allocated {@link BlobStorageContext}.
   * @param offset the position of the chunk in the binary.
   * @param buffer the chunk.
   * @return a {@link CompletableFuture} that completes when the chunk (and, for the last one, the binary) is stored.
   */
  CompletableFuture<Void> writeAsync(BlobStorageContext context, long offset, byte[] buffer);

  /**
   * Delete the blob referenced by the context.
   * @param context the {@link BlobStorageContext} of the blob.
   * @throws BlobProviderException with {@link BlobProviderErrorCode#BlobNotFound} if the blob does not exist.
   */
  void delete(BlobStorageContext context) throws BlobProviderException;

  /**
   * Asynchronous variant of {@link #delete(BlobStorageContext)}.
   * @param context the {@link BlobStorageContext} of the blob.
   * @return a {@link CompletableFuture} that completes when the blob is deleted.
   */
  CompletableFuture<Void> deleteAsync(BlobStorageContext context);

  /**
   * @param context the {@link BlobStorageContext} of a stored blob.
   * @return a lazily reading stream over the blob.
   * @throws BlobProviderException with {@link BlobProviderErrorCode#BlobNotFound} if the blob does not exist.
   */
  InputStream getStreamForRead(BlobStorageContext context) throws BlobProviderException;

  /**
   * Open a stream that replaces the content of the allocated blob. The blob is tagged before the first byte is
   * written and becomes readable when the stream is closed.
   * @param context the allocated {@link BlobStorageContext}.
   * @return the write stream.
   * @throws BlobProviderException if the provider data is invalid or the store fails.
   */
  OutputStream getStreamForWrite(BlobStorageContext context) throws BlobProviderException;

  /**
   * Open a new handle over the same blob as {@code stream}: a write stream for an {@link OutputStream}, a read stream
   * otherwise. The returned handle is never {@code stream} itself.
   * @param context the {@link BlobStorageContext} of the blob.
   * @param stream a stream previously opened by this provider.
   * @return the new stream.
   * @throws BlobProviderException if the new stream cannot be opened.
   */
  Closeable cloneStream(BlobStorageContext context, Closeable stream) throws BlobProviderException;

  /**
   * @param blobId the id of a blob.
   * @return {@code true} if a committed blob with that id exists.
   * @throws BlobProviderException if the store fails.
   */
  boolean exists(String blobId) throws BlobProviderException;

  /**
   * List the ids of all blobs of this provider's tenant. The listing is lazy; each call to
   * {@link Iterable#iterator()} issues a fresh listing. A store failure during iteration surfaces as an unchecked
   * exception of the underlying store client.
   * @return the blob ids.
   */
  Iterable<String> getBlobIds();

  /**
   * Parse the text form of this provider's data.
   * @param providerData text produced by {@link #serializeData(Object)}.
   * @return the provider data.
   * @throws BlobProviderException with {@link BlobProviderErrorCode#InvalidProviderData} if the text is malformed.
   */
  Object parseData(String providerData) throws BlobProviderException;

  /**
   * @param providerData provider data set by {@link #allocate(BlobStorageContext)}.
   * @return its text form, suitable for {@link #parseData(String)}.
   * @throws BlobProviderException with {@link BlobProviderErrorCode#InvalidProviderData} for foreign data.
   */
  String serializeData(Object providerData) throws BlobProviderException;
}
