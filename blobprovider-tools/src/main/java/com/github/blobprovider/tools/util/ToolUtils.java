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
package com.github.blobprovider.tools.util;

import com.codahale.metrics.MetricRegistry;
import com.github.blobprovider.BlobProviderFactory;
import com.github.blobprovider.config.BlobProviderConfig;
import com.github.blobprovider.config.VerifiableProperties;
import com.github.blobprovider.utils.Utils;
import java.io.IOException;
import java.util.List;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;


/**
 * util functions for blob provider tools
 */
public final class ToolUtils {

  private ToolUtils() {
  }

  /**
   * Ensure that the given argument list has all the required arguments. If not, exit.
   * @param requiredArgs the list of required arguments.
   * @param actualArgs the set of actual arguments.
   * @param parser the {@link OptionParser} used to parse arguments.
   * @throws IOException if there is a problem writing out usage information.
   */
  public static void ensureOrExit(List<OptionSpec<?>> requiredArgs, OptionSet actualArgs, OptionParser parser)
      throws IOException {
    for (OptionSpec<?> opt : requiredArgs) {
      if (!actualArgs.has(opt)) {
        System.err.println("Missing required argument \"" + opt + "\"");
        parser.printHelpOn(System.err);
        System.exit(1);
      }
    }
  }

  /**
   * Load the {@link VerifiableProperties} of a tool from a properties file.
   * @param propsFilePath the path of the properties file.
   * @return the {@link VerifiableProperties}.
   * @throws IOException if the file cannot be read.
   */
  public static VerifiableProperties getVerifiableProperties(String propsFilePath) throws IOException {
    Utils.checkNotNullOrEmpty(propsFilePath, "Missing required arg: propsFile");
    return new VerifiableProperties(Utils.loadProps(propsFilePath));
  }

  /**
   * Instantiate the {@link BlobProviderFactory} named by {@link BlobProviderConfig#blobProviderFactory}.
   * @param verifiableProperties the configuration handed to the factory.
   * @param metricRegistry the {@link MetricRegistry} handed to the factory.
   * @return the factory.
   * @throws Exception if the factory class cannot be loaded or constructed.
   */
  public static BlobProviderFactory getBlobProviderFactory(VerifiableProperties verifiableProperties,
      MetricRegistry metricRegistry) throws Exception {
    BlobProviderConfig blobProviderConfig = new BlobProviderConfig(verifiableProperties);
    return Utils.getObj(blobProviderConfig.blobProviderFactory, verifiableProperties, metricRegistry);
  }
}
