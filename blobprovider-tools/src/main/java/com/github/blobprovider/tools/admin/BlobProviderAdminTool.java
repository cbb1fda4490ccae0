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
package com.github.blobprovider.tools.admin;

import com.codahale.metrics.MetricRegistry;
import com.github.blobprovider.BlobProvider;
import com.github.blobprovider.BlobProviderErrorCode;
import com.github.blobprovider.BlobProviderException;
import com.github.blobprovider.BlobProviderFactory;
import com.github.blobprovider.BlobStorageContext;
import com.github.blobprovider.config.VerifiableProperties;
import com.github.blobprovider.tools.util.ToolUtils;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Locale;
import joptsimple.ArgumentAcceptingOptionSpec;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Maintenance tool for the blobs of one tenant. Supported operations:
 * <ul>
 *   <li>{@code list}: print the ids of all committed blobs.</li>
 *   <li>{@code exists}: check whether the blob named by {@code --blobId} exists.</li>
 *   <li>{@code delete}: delete the blob referenced by the provider data text given in {@code --providerData}, in the
 *   form the repository persisted it.</li>
 * </ul>
 * The exit code is 0 on success and 1 if the blob does not exist.
 */
public class BlobProviderAdminTool {

  private static final Logger logger = LoggerFactory.getLogger(BlobProviderAdminTool.class);

  enum Operation {
    LIST, EXISTS, DELETE
  }

  public static void main(String[] args) throws Exception {
    OptionParser parser = new OptionParser();
    ArgumentAcceptingOptionSpec<String> propsFileOpt = parser.accepts("propsFile", "Properties file path")
        .withRequiredArg()
        .describedAs("propsFile")
        .ofType(String.class);
    ArgumentAcceptingOptionSpec<String> operationOpt =
        parser.accepts("operation", "The operation to run: list, exists or delete")
            .withRequiredArg()
            .describedAs("operation")
            .ofType(String.class);
    ArgumentAcceptingOptionSpec<String> tenantIdOpt =
        parser.accepts("tenantId", "The tenant to operate on. Defaults to blob.provider.tenant.id")
            .withRequiredArg()
            .describedAs("tenant_id")
            .ofType(String.class);
    ArgumentAcceptingOptionSpec<String> blobIdOpt = parser.accepts("blobId", "The blob id, for exists")
        .withRequiredArg()
        .describedAs("blob_id")
        .ofType(String.class);
    ArgumentAcceptingOptionSpec<String> providerDataOpt =
        parser.accepts("providerData", "The persisted provider data of the blob, for delete")
            .withRequiredArg()
            .describedAs("provider_data")
            .ofType(String.class);
    parser.accepts("help", "print this help message.");
    parser.accepts("h", "print this help message.");

    OptionSet options = parser.parse(args);
    if (options.has("help") || options.has("h")) {
      parser.printHelpOn(System.out);
      System.exit(0);
    }
    ToolUtils.ensureOrExit(Arrays.<OptionSpec<?>>asList(propsFileOpt, operationOpt), options, parser);

    Operation operation = Operation.valueOf(options.valueOf(operationOpt).toUpperCase(Locale.ROOT));
    VerifiableProperties verifiableProperties = ToolUtils.getVerifiableProperties(options.valueOf(propsFileOpt));
    BlobProviderFactory factory = ToolUtils.getBlobProviderFactory(verifiableProperties, new MetricRegistry());
    BlobProvider provider =
        options.has(tenantIdOpt) ? factory.getBlobProvider(options.valueOf(tenantIdOpt)) : factory.getBlobProvider();
    String argument = operation == Operation.DELETE ? options.valueOf(providerDataOpt) : options.valueOf(blobIdOpt);
    System.exit(execute(provider, operation, argument, System.out));
  }

  /**
   * Run one operation against a provider.
   * @param provider the {@link BlobProvider} of the tenant.
   * @param operation the {@link Operation} to run.
   * @param argument the blob id for {@link Operation#EXISTS}, the provider data text for {@link Operation#DELETE}.
   * @param out where results are printed.
   * @return the exit code of the tool.
   * @throws BlobProviderException if the operation fails for any other reason than a missing blob.
   */
  static int execute(BlobProvider provider, Operation operation, String argument, PrintStream out)
      throws BlobProviderException {
    switch (operation) {
      case LIST:
        long count = 0;
        for (String blobId : provider.getBlobIds()) {
          out.println(blobId);
          count++;
        }
        logger.info("Listed {} blobs", count);
        return 0;
      case EXISTS:
        if (argument == null) {
          throw new IllegalArgumentException("Operation exists requires --blobId");
        }
        boolean exists = provider.exists(argument);
        out.println(argument + (exists ? " exists" : " does not exist"));
        return exists ? 0 : 1;
      case DELETE:
        if (argument == null) {
          throw new IllegalArgumentException("Operation delete requires --providerData");
        }
        BlobStorageContext context = new BlobStorageContext(0, 0, 0, 0).setBlobProviderData(
            provider.parseData(argument));
        try {
          provider.delete(context);
        } catch (BlobProviderException e) {
          if (e.getErrorCode() != BlobProviderErrorCode.BlobNotFound) {
            throw e;
          }
          out.println("Blob not found: " + argument);
          return 1;
        }
        logger.info("Deleted blob {}", context.getBlobProviderData());
        out.println("Deleted " + argument);
        return 0;
      default:
        throw new IllegalArgumentException("Unknown operation " + operation);
    }
  }
}
