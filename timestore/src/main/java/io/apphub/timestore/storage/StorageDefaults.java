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

import io.apphub.timestore.util.ConfigValues;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Service-wide storage settings used when a storage target record does
 * not carry a value itself.
 *
 * <p>Example configuration:
 * <pre>{@code
 * "storage": {
 *   "root": "/var/lib/timestore",
 *   "s3": {"bucket": "timestore", "region": "us-east-1", "endpoint": "http://minio:9000"},
 *   "gcs": {"bucket": "timestore", "hmacKeyId": "...", "hmacSecret": "..."},
 *   "azure": {"container": "timestore", "connectionString": "..."}
 * }
 * }</pre>
 */
public final class StorageDefaults {
  private final @Nullable String root;
  private final @Nullable String s3Bucket;
  private final @Nullable String s3Region;
  private final @Nullable String s3Endpoint;
  private final @Nullable String s3AccessKeyId;
  private final @Nullable String s3SecretAccessKey;
  private final @Nullable String s3SessionToken;
  private final @Nullable String gcsBucket;
  private final @Nullable String gcsHmacKeyId;
  private final @Nullable String gcsHmacSecret;
  private final @Nullable String azureContainer;
  private final @Nullable String azureConnectionString;
  private final @Nullable String azureAccountName;
  private final @Nullable String azureAccountKey;
  private final @Nullable String azureSasToken;
  private final @Nullable String azureEndpoint;

  private StorageDefaults(Builder builder) {
    this.root = builder.root;
    this.s3Bucket = builder.s3Bucket;
    this.s3Region = builder.s3Region;
    this.s3Endpoint = builder.s3Endpoint;
    this.s3AccessKeyId = builder.s3AccessKeyId;
    this.s3SecretAccessKey = builder.s3SecretAccessKey;
    this.s3SessionToken = builder.s3SessionToken;
    this.gcsBucket = builder.gcsBucket;
    this.gcsHmacKeyId = builder.gcsHmacKeyId;
    this.gcsHmacSecret = builder.gcsHmacSecret;
    this.azureContainer = builder.azureContainer;
    this.azureConnectionString = builder.azureConnectionString;
    this.azureAccountName = builder.azureAccountName;
    this.azureAccountKey = builder.azureAccountKey;
    this.azureSasToken = builder.azureSasToken;
    this.azureEndpoint = builder.azureEndpoint;
  }

  public @Nullable String getRoot() {
    return root;
  }

  public @Nullable String getS3Bucket() {
    return s3Bucket;
  }

  public @Nullable String getS3Region() {
    return s3Region;
  }

  public @Nullable String getS3Endpoint() {
    return s3Endpoint;
  }

  public @Nullable String getS3AccessKeyId() {
    return s3AccessKeyId;
  }

  public @Nullable String getS3SecretAccessKey() {
    return s3SecretAccessKey;
  }

  public @Nullable String getS3SessionToken() {
    return s3SessionToken;
  }

  public @Nullable String getGcsBucket() {
    return gcsBucket;
  }

  public @Nullable String getGcsHmacKeyId() {
    return gcsHmacKeyId;
  }

  public @Nullable String getGcsHmacSecret() {
    return gcsHmacSecret;
  }

  public @Nullable String getAzureContainer() {
    return azureContainer;
  }

  public @Nullable String getAzureConnectionString() {
    return azureConnectionString;
  }

  public @Nullable String getAzureAccountName() {
    return azureAccountName;
  }

  public @Nullable String getAzureAccountKey() {
    return azureAccountKey;
  }

  public @Nullable String getAzureSasToken() {
    return azureSasToken;
  }

  public @Nullable String getAzureEndpoint() {
    return azureEndpoint;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static StorageDefaults defaults() {
    return builder().build();
  }

  public static StorageDefaults fromMap(@Nullable Map<String, Object> map) {
    if (map == null || map.isEmpty()) {
      return defaults();
    }
    Map<String, Object> s3 = ConfigValues.getMap(map, "s3");
    Map<String, Object> gcs = ConfigValues.getMap(map, "gcs");
    Map<String, Object> azure = ConfigValues.getMap(map, "azure");
    return builder()
        .root(ConfigValues.getString(map, "root"))
        .s3Bucket(ConfigValues.getString(s3, "bucket"))
        .s3Region(ConfigValues.getString(s3, "region"))
        .s3Endpoint(ConfigValues.getString(s3, "endpoint"))
        .s3AccessKeyId(ConfigValues.getString(s3, "accessKeyId"))
        .s3SecretAccessKey(ConfigValues.getString(s3, "secretAccessKey"))
        .s3SessionToken(ConfigValues.getString(s3, "sessionToken"))
        .gcsBucket(ConfigValues.getString(gcs, "bucket"))
        .gcsHmacKeyId(ConfigValues.getString(gcs, "hmacKeyId"))
        .gcsHmacSecret(ConfigValues.getString(gcs, "hmacSecret"))
        .azureContainer(ConfigValues.getString(azure, "container"))
        .azureConnectionString(ConfigValues.getString(azure, "connectionString"))
        .azureAccountName(ConfigValues.getString(azure, "accountName"))
        .azureAccountKey(ConfigValues.getString(azure, "accountKey"))
        .azureSasToken(ConfigValues.getString(azure, "sasToken"))
        .azureEndpoint(ConfigValues.getString(azure, "endpoint"))
        .build();
  }

  /**
   * Builder for {@link StorageDefaults}.
   */
  public static class Builder {
    private String root;
    private String s3Bucket;
    private String s3Region;
    private String s3Endpoint;
    private String s3AccessKeyId;
    private String s3SecretAccessKey;
    private String s3SessionToken;
    private String gcsBucket;
    private String gcsHmacKeyId;
    private String gcsHmacSecret;
    private String azureContainer;
    private String azureConnectionString;
    private String azureAccountName;
    private String azureAccountKey;
    private String azureSasToken;
    private String azureEndpoint;

    public Builder root(@Nullable String root) {
      this.root = root;
      return this;
    }

    public Builder s3Bucket(@Nullable String s3Bucket) {
      this.s3Bucket = s3Bucket;
      return this;
    }

    public Builder s3Region(@Nullable String s3Region) {
      this.s3Region = s3Region;
      return this;
    }

    public Builder s3Endpoint(@Nullable String s3Endpoint) {
      this.s3Endpoint = s3Endpoint;
      return this;
    }

    public Builder s3AccessKeyId(@Nullable String s3AccessKeyId) {
      this.s3AccessKeyId = s3AccessKeyId;
      return this;
    }

    public Builder s3SecretAccessKey(@Nullable String s3SecretAccessKey) {
      this.s3SecretAccessKey = s3SecretAccessKey;
      return this;
    }

    public Builder s3SessionToken(@Nullable String s3SessionToken) {
      this.s3SessionToken = s3SessionToken;
      return this;
    }

    public Builder gcsBucket(@Nullable String gcsBucket) {
      this.gcsBucket = gcsBucket;
      return this;
    }

    public Builder gcsHmacKeyId(@Nullable String gcsHmacKeyId) {
      this.gcsHmacKeyId = gcsHmacKeyId;
      return this;
    }

    public Builder gcsHmacSecret(@Nullable String gcsHmacSecret) {
      this.gcsHmacSecret = gcsHmacSecret;
      return this;
    }

    public Builder azureContainer(@Nullable String azureContainer) {
      this.azureContainer = azureContainer;
      return this;
    }

    public Builder azureConnectionString(@Nullable String azureConnectionString) {
      this.azureConnectionString = azureConnectionString;
      return this;
    }

    public Builder azureAccountName(@Nullable String azureAccountName) {
      this.azureAccountName = azureAccountName;
      return this;
    }

    public Builder azureAccountKey(@Nullable String azureAccountKey) {
      this.azureAccountKey = azureAccountKey;
      return this;
    }

    public Builder azureSasToken(@Nullable String azureSasToken) {
      this.azureSasToken = azureSasToken;
      return this;
    }

    public Builder azureEndpoint(@Nullable String azureEndpoint) {
      this.azureEndpoint = azureEndpoint;
      return this;
    }

    public StorageDefaults build() {
      return new StorageDefaults(this);
    }
  }
}
