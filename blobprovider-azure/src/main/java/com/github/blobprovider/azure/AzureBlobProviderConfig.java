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

import com.github.blobprovider.config.Config;
import com.github.blobprovider.config.Default;
import com.github.blobprovider.config.VerifiableProperties;


/**
 * The configs for the Azure Blob Storage provider.
 */
public class AzureBlobProviderConfig {

  public static final String AZURE_STORAGE_CONNECTION_STRING = "azure.storage.connection.string";
  public static final String AZURE_CONTAINER_PREFIX = "azure.container.prefix";
  public static final String AZURE_RETRY_MAX_TRIES = "azure.retry.max.tries";
  public static final String AZURE_RETRY_DELAY_MS = "azure.retry.delay.ms";
  public static final String AZURE_TRY_TIMEOUT_SECONDS = "azure.try.timeout.seconds";
  public static final String AZURE_TRANSACTIONAL_MD5_ENABLED = "azure.transactional.md5.enabled";
  public static final String AZURE_PROXY_HOST = "azure.proxy.host";
  public static final String AZURE_PROXY_PORT = "azure.proxy.port";

  public static final String DEFAULT_CONTAINER_PREFIX = "blobs";
  // One initial try plus three retries.
  public static final int DEFAULT_RETRY_MAX_TRIES = 4;
  public static final long DEFAULT_RETRY_DELAY_MS = 1000;
  public static final int DEFAULT_TRY_TIMEOUT_SECONDS = 60;
  public static final int DEFAULT_PROXY_PORT = 3128;

  /**
   * The Azure Blob Storage connection string.
   */
  @Config(AZURE_STORAGE_CONNECTION_STRING)
  public final String azureStorageConnectionString;

  /**
   * Prefix of every container name. The tenant id is appended to it.
   */
  @Config(AZURE_CONTAINER_PREFIX)
  @Default(DEFAULT_CONTAINER_PREFIX)
  public final String azureContainerPrefix;

  /**
   * Number of tries of one request, including the first one.
   */
  @Config(AZURE_RETRY_MAX_TRIES)
  @Default("4")
  public final int azureRetryMaxTries;

  /**
   * Fixed delay between two tries of a request. At least one millisecond.
   */
  @Config(AZURE_RETRY_DELAY_MS)
  @Default("1000")
  public final long azureRetryDelayMs;

  @Config(AZURE_TRY_TIMEOUT_SECONDS)
  @Default("60")
  public final int azureTryTimeoutSeconds;

  /**
   * Whether each staged block is sent with its MD5 so that the service rejects corrupted transfers.
   */
  @Config(AZURE_TRANSACTIONAL_MD5_ENABLED)
  @Default("true")
  public final boolean azureTransactionalMd5Enabled;

  /**
   * Host of the HTTP proxy to reach the storage account through, if any.
   */
  @Config(AZURE_PROXY_HOST)
  public final String azureProxyHost;

  @Config(AZURE_PROXY_PORT)
  @Default("3128")
  public final int azureProxyPort;

  public AzureBlobProviderConfig(VerifiableProperties verifiableProperties) {
    azureStorageConnectionString = verifiableProperties.getString(AZURE_STORAGE_CONNECTION_STRING);
    azureContainerPrefix = verifiableProperties.getString(AZURE_CONTAINER_PREFIX, DEFAULT_CONTAINER_PREFIX);
    azureRetryMaxTries = verifiableProperties.getIntInRange(AZURE_RETRY_MAX_TRIES, DEFAULT_RETRY_MAX_TRIES, 1, 10);
    azureRetryDelayMs =
        verifiableProperties.getLongInRange(AZURE_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS, 1, Long.MAX_VALUE);
    azureTryTimeoutSeconds =
        verifiableProperties.getIntInRange(AZURE_TRY_TIMEOUT_SECONDS, DEFAULT_TRY_TIMEOUT_SECONDS, 1,
            Integer.MAX_VALUE);
    azureTransactionalMd5Enabled = verifiableProperties.getBoolean(AZURE_TRANSACTIONAL_MD5_ENABLED, true);
    azureProxyHost = verifiableProperties.getString(AZURE_PROXY_HOST, null);
    azureProxyPort = verifiableProperties.getIntInRange(AZURE_PROXY_PORT, DEFAULT_PROXY_PORT, 1, 65535);
  }
}
