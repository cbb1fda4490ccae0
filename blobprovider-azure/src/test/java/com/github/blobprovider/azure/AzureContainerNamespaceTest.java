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
import org.junit.Test;

import static org.junit.Assert.*;


public class AzureContainerNamespaceTest {

  @Test
  public void testGetContainerName() throws Exception {
    AzureContainerNamespace namespace = new AzureContainerNamespace("blobs");
    assertEquals("blobs", namespace.getContainerName(""));
    assertEquals("blobs", namespace.getContainerName(null));
    assertEquals("blobs-tenant1", new AzureContainerNamespace("blobs-").getContainerName("tenant1"));
    assertEquals("abc", new AzureContainerNamespace(null).getContainerName("abc"));
    assertEquals("blobs", namespace.getPrefix());
  }

  /** Names at the length limits are accepted. */
  @Test
  public void testValidNames() throws Exception {
    AzureContainerNamespace.validate("abc");
    AzureContainerNamespace.validate("a-b-c");
    AzureContainerNamespace.validate("0blobs9");
    AzureContainerNamespace.validate(repeat('a', AzureContainerNamespace.MAX_CONTAINER_NAME_LENGTH));
  }

  @Test
  public void testInvalidNames() {
    String[] invalidNames =
        {"", "ab", repeat('a', AzureContainerNamespace.MAX_CONTAINER_NAME_LENGTH + 1), "Blobs", "blobs_1", "blobs--1",
            "-blobs", "blobs-", "blob s", "blöbs"};
    for (String name : invalidNames) {
      BlobProviderException e =
          assertThrows("Expected failure for '" + name + "'", BlobProviderException.class,
              () -> AzureContainerNamespace.validate(name));
      assertEquals(BlobProviderErrorCode.InvalidContainerName, e.getErrorCode());
    }
  }

  /** Uppercase tenant ids are not folded to lowercase. */
  @Test
  public void testTenantIdIsNotNormalized() {
    BlobProviderException e = assertThrows(BlobProviderException.class,
        () -> new AzureContainerNamespace("blobs").getContainerName("Tenant"));
    assertEquals(BlobProviderErrorCode.InvalidContainerName, e.getErrorCode());
  }

  private static String repeat(char c, int count) {
    StringBuilder builder = new StringBuilder(count);
    for (int i = 0; i < count; i++) {
      builder.append(c);
    }
    return builder.toString();
  }
}
