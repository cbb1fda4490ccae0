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
 * All the error codes that accompany a {@link BlobProviderException}.
 */
public enum BlobProviderErrorCode {
  /**
   * The chunk size recorded for a transfer disagrees with the offset or buffer of a write. Retrying the same call
   * reproduces the same block boundaries, so this is fatal to the transfer.
   */
  ConfigurationMismatch,
  /**
   * The derived container name violates the store's naming rules. Raised before any request reaches the store.
   */
  InvalidContainerName,
  /**
   * The store (or the I/O channel to it) failed and the client retry policy gave up.
   */
  StorageError,
  /**
   * A read or delete targeted a blob that does not exist. Callers may treat delete of an absent blob as success.
   */
  BlobNotFound,
  /**
   * Provider data is missing, belongs to another provider, or its text form could not be parsed.
   */
  InvalidProviderData
}
