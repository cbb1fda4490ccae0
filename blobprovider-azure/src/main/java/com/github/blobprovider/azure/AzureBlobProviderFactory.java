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

import com.azure.core.http.HttpClient;
import com.azure.core.http.ProxyOptions;
import com.azure.core.http.netty.NettyAsyncHttpClientBuilder;
import com.azure.storage.blob.BlobServiceAsyncClient;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.common.policy.RequestRetryOptions;
import com.azure.storage.common.policy.RetryPolicyType;
import com.codahale.metrics.MetricRegistry;
import com.github.blobprovider.BlobProvider;
import com.github.blobprovider.BlobProviderException;
import com.github.blobprovider.BlobProviderFactory;
import com.github.blobprovider.config.BlobProviderConfig;
import com.github.blobprovider.config.VerifiableProperties;
import com.github.blobprovider.utils.Utils;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Factory for constructing {@link AzureBlobProvider} instances. The storage account clients are built once and shared
 * by the providers of all tenants.
 */
public class AzureBlobProviderFactory implements BlobProviderFactory {

  private static final Logger logger = LoggerFactory.getLogger(AzureBlobProviderFactory.class);
  private final BlobProviderConfig blobProviderConfig;
  private final AzureBlobProviderConfig azureConfig;
  private final AzureBlobProviderMetrics metrics;
  private final BlobServiceClient serviceClient;
  private final BlobServiceAsyncClient serviceAsyncClient;
  private final Map<String, AzureBlobProvider> providers = new ConcurrentHashMap<>();

  public AzureBlobProviderFactory(VerifiableProperties verifiableProperties, MetricRegistry metricRegistry) {
    this.blobProviderConfig = new BlobProviderConfig(verifiableProperties);
    this.azureConfig = new AzureBlobProviderConfig(verifiableProperties);
    this.metrics = new AzureBlobProviderMetrics(metricRegistry);
    Utils.checkNotNullOrEmpty(azureConfig.azureStorageConnectionString,
        AzureBlobProviderConfig.AZURE_STORAGE_CONNECTION_STRING + " must not be empty");
    BlobServiceClientBuilder builder = new BlobServiceClientBuilder().connectionString(
        azureConfig.azureStorageConnectionString)
        .httpClient(buildHttpClient(azureConfig))
        .retryOptions(buildRetryOptions(azureConfig));
    this.serviceClient = builder.buildClient();
    this.serviceAsyncClient = builder.buildAsyncClient();
    logger.info("Created Azure blob provider factory for container prefix '{}' with chunk size {}",
        azureConfig.azureContainerPrefix, blobProviderConfig.blobProviderChunkSize);
  }

  /**
   * Test constructor.
   */
  AzureBlobProviderFactory(BlobProviderConfig blobProviderConfig, AzureBlobProviderConfig azureConfig,
      BlobServiceClient serviceClient, BlobServiceAsyncClient serviceAsyncClient, AzureBlobProviderMetrics metrics) {
    this.blobProviderConfig = blobProviderConfig;
    this.azureConfig = azureConfig;
    this.serviceClient = serviceClient;
    this.serviceAsyncClient = serviceAsyncClient;
    this.metrics = metrics;
  }

  @Override
  public BlobProvider getBlobProvider() throws BlobProviderException {
    return getBlobProvider(blobProviderConfig.blobProviderTenantId);
  }

  @Override
  public AzureBlobProvider getBlobProvider(String tenantId) throws BlobProviderException {
    String key = tenantId == null ? "" : tenantId;
    AzureBlobProvider provider = providers.get(key);
    if (provider == null) {
      synchronized (providers) {
        provider = providers.get(key);
        if (provider == null) {
          provider = new AzureBlobProvider(key, blobProviderConfig, azureConfig, serviceClient, serviceAsyncClient,
              metrics);
          providers.put(key, provider);
          logger.info("Created blob provider for tenant '{}' on container {}", key, provider.getContainerName());
        }
      }
    }
    return provider;
  }

  static HttpClient buildHttpClient(AzureBlobProviderConfig azureConfig) {
    NettyAsyncHttpClientBuilder httpClientBuilder = new NettyAsyncHttpClientBuilder();
    if (azureConfig.azureProxyHost != null && !azureConfig.azureProxyHost.isEmpty()) {
      logger.info("Using proxy {}:{}", azureConfig.azureProxyHost, azureConfig.azureProxyPort);
      httpClientBuilder.proxy(new ProxyOptions(ProxyOptions.Type.HTTP,
          new InetSocketAddress(azureConfig.azureProxyHost, azureConfig.azureProxyPort)));
    }
    return httpClientBuilder.build();
  }

  static RequestRetryOptions buildRetryOptions(AzureBlobProviderConfig azureConfig) {
    return new RequestRetryOptions(RetryPolicyType.FIXED, azureConfig.azureRetryMaxTries,
        azureConfig.azureTryTimeoutSeconds, azureConfig.azureRetryDelayMs, azureConfig.azureRetryDelayMs, null);
  }
}
