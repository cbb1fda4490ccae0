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

import com.github.blobprovider.BlobProviderErrorCode;
import com.github.blobprovider.BlobProviderException;
import java.util.regex.Pattern;


/**
 * Decides which Azure container holds the blobs of a tenant: {@code <prefix><tenantId>}. Several repositories can
 * share one storage account this way, each in its own container.
 */
class AzureContainerNamespace {

  static final int MIN_CONTAINER_NAME_LENGTH = 3;
  static final int MAX_CONTAINER_NAME_LENGTH = 63;
  // Lowercase letters, digits and single hyphens; starts and ends with a letter or digit.
  private static final Pattern CONTAINER_NAME_PATTERN = Pattern.compile("[a-z0-9](?:[a-z0-9]|-(?=[a-z0-9]))*");
  private final String prefix;

  /**
   * @param prefix the prefix shared by the container names of all tenants.
   */
  AzureContainerNamespace(String prefix) {
    this.prefix = prefix == null ? "" : prefix;
  }

  /**
   * Resolve and validate the container name of a tenant.
   * @param tenantId the tenant id, {@code null} or empty for single-tenant deployments.
   * @return the container name.
   * @throws BlobProviderException with {@link BlobProviderErrorCode#InvalidContainerName} if the name is not a valid
   * Azure container name.
   */
  String getContainerName(String tenantId) throws BlobProviderException {
    String containerName = prefix + (tenantId == null ? "" : tenantId);
    validate(containerName);
    return containerName;
  }

  /**
   * @param containerName the name to check.
   * @throws BlobProviderException with {@link BlobProviderErrorCode#InvalidContainerName} if the name is not a valid
   * Azure container name.
   */
  static void validate(String containerName) throws BlobProviderException {
    int length = containerName.length();
    if (length < MIN_CONTAINER_NAME_LENGTH || length > MAX_CONTAINER_NAME_LENGTH) {
      throw new BlobProviderException(
          "Container name '" + containerName + "' must be " + MIN_CONTAINER_NAME_LENGTH + "-"
              + MAX_CONTAINER_NAME_LENGTH + " characters long but is " + length + ".",
          BlobProviderErrorCode.InvalidContainerName);
    }
    if (!CONTAINER_NAME_PATTERN.matcher(containerName).matches()) {
      throw new BlobProviderException("Container name '" + containerName
          + "' may only contain lowercase letters, digits and single hyphens, and must start and end with a letter or"
          + " digit.", BlobProviderErrorCode.InvalidContainerName);
    }
  }

  String getPrefix() {
    return prefix;
  }
}
