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
 * Exceptions thrown by a {@link BlobProvider}. All exceptions are accompanied by a {@link BlobProviderErrorCode}.
 */
public class BlobProviderException extends Exception {
  private static final long serialVersionUID = 1;
  private final BlobProviderErrorCode errorCode;

  public BlobProviderException(String message, BlobProviderErrorCode errorCode) {
    super(message + " Error: " + errorCode);
    this.errorCode = errorCode;
  }

  public BlobProviderException(String message, Throwable e, BlobProviderErrorCode errorCode) {
    super(message + " Error: " + errorCode, e);
    this.errorCode = errorCode;
  }

  public BlobProviderErrorCode getErrorCode() {
    return errorCode;
  }
}
