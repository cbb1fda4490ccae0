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
 * A factory for {@link BlobProvider} instances. Implementations are expected to have a constructor taking a
 * {@link com.github.blobprovider.config.VerifiableProperties} and a {@code MetricRegistry}.
 */
public interface BlobProviderFactory {

  /**
   * @return the provider of the tenant named by the configuration.
   * @throws BlobProviderException if the provider cannot be constructed.
   */
  BlobProvider getBlobProvider() throws BlobProviderException;

  /**
   * Returns the provider of a tenant. Repeated calls with the same tenant return the same instance.
   * @param tenantId the tenant id, or the empty string for single-tenant deployments.
   * @return the provider.
   * @throws BlobProviderException with {@link BlobProviderErrorCode#InvalidContainerName} if the tenant id yields an
   * invalid container name, or another code if the provider cannot be constructed.
   */
  BlobProvider getBlobProvider(String tenantId) throws BlobProviderException;
}
