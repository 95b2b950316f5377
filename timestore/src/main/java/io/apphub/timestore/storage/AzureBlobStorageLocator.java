/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.apphub.timestore.storage;

import io.apphub.timestore.metadata.PartitionRecord;
import io.apphub.timestore.metadata.StorageTargetKind;
import io.apphub.timestore.metadata.StorageTargetRecord;
import io.apphub.timestore.util.ConfigValues;
import io.apphub.timestore.util.SqlIdentifiers;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Partitions in an Azure Blob Storage container, read through DuckDB's
 * {@code azure} extension with fully qualified
 * {@code azure://<host>/<container>/<path>} locations.
 */
public class AzureBlobStorageLocator implements StorageLocator {
  private final StorageDefaults defaults;

  public AzureBlobStorageLocator(StorageDefaults defaults) {
    this.defaults = defaults;
  }

  @Override public StorageTargetKind getKind() {
    return StorageTargetKind.AZURE_BLOB;
  }

  @Override public String resolveLocation(PartitionRecord partition, StorageTargetRecord target) {
    Options options = resolveOptions(target);
    return "azure://" + options.host() + "/" + options.container + "/" + partition.getFilePath();
  }

  @Override public RemoteBackend describeBackend(StorageTargetRecord target) {
    Options options = resolveOptions(target);
    String scope = "azure://" + options.host() + "/" + options.container;
    String connectionString = options.effectiveConnectionString();
    String definition = null;
    if (connectionString != null) {
      definition = "TYPE azure, CONNECTION_STRING " + SqlIdentifiers.literal(connectionString)
          + ", SCOPE " + SqlIdentifiers.literal(scope);
    } else if (options.accountName != null) {
      definition = "TYPE azure, PROVIDER config, ACCOUNT_NAME "
          + SqlIdentifiers.literal(options.accountName)
          + ", SCOPE " + SqlIdentifiers.literal(scope);
    }
    return new RemoteBackend(StorageTargetKind.AZURE_BLOB, "azure:" + scope, scope,
        ImmutableList.of("azure"), definition);
  }

  /**
   * Splits an Azure connection string into lower-cased keys.
   */
  static Map<String, String> parseConnectionString(String connectionString) {
    Map<String, String> properties = new LinkedHashMap<>();
    for (String segment : connectionString.split(";")) {
      int separator = segment.indexOf('=');
      if (separator <= 0) {
        continue;
      }
      String key = segment.substring(0, separator).trim().toLowerCase(Locale.ROOT);
      if (!key.isEmpty()) {
        properties.put(key, segment.substring(separator + 1).trim());
      }
    }
    return properties;
  }

  private Options resolveOptions(StorageTargetRecord target) {
    Map<String, Object> config = target.getConfig();
    String container = ConfigValues.getString(config, "container", defaults.getAzureContainer());
    if (container == null) {
      throw new UnresolvedStorageTargetException(
          "Azure Blob storage target missing container configuration");
    }
    Options options = new Options(container);
    options.connectionString =
        ConfigValues.getString(config, "connectionString", defaults.getAzureConnectionString());
    options.accountName =
        ConfigValues.getString(config, "accountName", defaults.getAzureAccountName());
    options.accountKey =
        ConfigValues.getString(config, "accountKey", defaults.getAzureAccountKey());
    options.sasToken = ConfigValues.getString(config, "sasToken", defaults.getAzureSasToken());
    options.endpoint = ConfigValues.getString(config, "endpoint", defaults.getAzureEndpoint());
    if (options.connectionString != null) {
      Map<String, String> properties = parseConnectionString(options.connectionString);
      if (options.accountName == null) {
        options.accountName = properties.get("accountname");
      }
      if (options.endpoint == null) {
        options.endpoint = properties.get("blobendpoint");
      }
      if (options.sasToken == null) {
        options.sasToken = properties.get("sharedaccesssignature");
      }
    }
    return options;
  }

  /** Settings of one container after applying defaults. */
  private static final class Options {
    final String container;
    String connectionString;
    String accountName;
    String accountKey;
    String sasToken;
    String endpoint;

    Options(String container) {
      this.container = container;
    }

    String host() {
      if (endpoint != null) {
        return hostOf(endpoint);
      }
      if (accountName != null) {
        return accountName + ".blob.core.windows.net";
      }
      throw new UnresolvedStorageTargetException(
          "Azure Blob storage target missing account information for location resolution");
    }

    @Nullable String effectiveConnectionString() {
      if (connectionString != null) {
        return connectionString;
      }
      if (accountName != null && accountKey != null) {
        return "DefaultEndpointsProtocol=https;AccountName=" + accountName
            + ";AccountKey=" + accountKey + ";EndpointSuffix=core.windows.net";
      }
      if (sasToken != null) {
        String blobEndpoint = endpoint != null
            ? endpoint.replaceAll("/+$", "")
            : "https://" + host();
        return "BlobEndpoint=" + blobEndpoint + ";SharedAccessSignature=" + sasToken;
      }
      return null;
    }

    private static String hostOf(String endpoint) {
      try {
        URI uri = new URI(endpoint);
        if (uri.getHost() != null) {
          return uri.getPort() > 0 ? uri.getHost() + ":" + uri.getPort() : uri.getHost();
        }
      } catch (URISyntaxException e) {
        // not a URI; strip the scheme by hand below
        return endpoint.replaceAll("/+$", "").replaceFirst("(?i)^https?://", "");
      }
      return endpoint.replaceAll("/+$", "").replaceFirst("(?i)^https?://", "");
    }
  }
}
