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

import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSSessionCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.regions.DefaultAwsRegionProviderChain;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Partitions in an S3 (or S3-compatible) bucket, read through DuckDB's
 * {@code httpfs} extension.
 *
 * <p>Credentials come from the storage target, then the service defaults,
 * then the AWS default credential chain. Region falls back to
 * {@code AWS_REGION}, the AWS default region chain and finally
 * {@code us-east-1}. A custom endpoint switches to path-style URLs.
 */
public class S3StorageLocator implements StorageLocator {
  private static final Logger LOGGER = LoggerFactory.getLogger(S3StorageLocator.class);

  private static final String DEFAULT_REGION = "us-east-1";

  private final StorageDefaults defaults;

  public S3StorageLocator(StorageDefaults defaults) {
    this.defaults = defaults;
  }

  @Override public StorageTargetKind getKind() {
    return StorageTargetKind.S3;
  }

  @Override public String resolveLocation(PartitionRecord partition, StorageTargetRecord target) {
    return "s3://" + bucket(target) + "/" + partition.getFilePath();
  }

  @Override public RemoteBackend describeBackend(StorageTargetRecord target) {
    Map<String, Object> config = target.getConfig();
    String bucket = bucket(target);

    String endpoint = ConfigValues.getString(config, "endpoint", defaults.getS3Endpoint());
    if (endpoint == null) {
      endpoint = System.getenv("AWS_ENDPOINT_OVERRIDE");
    }
    String region = resolveRegion(ConfigValues.getString(config, "region", defaults.getS3Region()));

    String accessKeyId = ConfigValues.getString(config, "accessKeyId", defaults.getS3AccessKeyId());
    String secretAccessKey =
        ConfigValues.getString(config, "secretAccessKey", defaults.getS3SecretAccessKey());
    String sessionToken =
        ConfigValues.getString(config, "sessionToken", defaults.getS3SessionToken());
    if (accessKeyId == null || secretAccessKey == null) {
      AWSCredentials credentials = defaultCredentials();
      if (credentials != null) {
        accessKeyId = credentials.getAWSAccessKeyId();
        secretAccessKey = credentials.getAWSSecretKey();
        if (credentials instanceof AWSSessionCredentials) {
          sessionToken = ((AWSSessionCredentials) credentials).getSessionToken();
        }
      }
    }

    String scope = "s3://" + bucket;
    StringBuilder secret = new StringBuilder("TYPE s3");
    if (accessKeyId != null && secretAccessKey != null) {
      secret.append(", KEY_ID ").append(SqlIdentifiers.literal(accessKeyId));
      secret.append(", SECRET ").append(SqlIdentifiers.literal(secretAccessKey));
      if (sessionToken != null) {
        secret.append(", SESSION_TOKEN ").append(SqlIdentifiers.literal(sessionToken));
      }
    }
    secret.append(", REGION ").append(SqlIdentifiers.literal(region));
    if (endpoint != null) {
      // DuckDB wants host:port; the scheme only decides USE_SSL
      boolean useSsl = !endpoint.startsWith("http://");
      String hostPort = endpoint.replaceFirst("^https?://", "").replaceAll("/+$", "");
      secret.append(", ENDPOINT ").append(SqlIdentifiers.literal(hostPort));
      secret.append(", URL_STYLE 'path'");
      secret.append(", USE_SSL ").append(useSsl);
    }
    secret.append(", SCOPE ").append(SqlIdentifiers.literal(scope));

    String identity = "s3:" + bucket + "@" + (endpoint != null ? endpoint : "aws");
    return new RemoteBackend(StorageTargetKind.S3, identity, scope,
        ImmutableList.of("httpfs"), secret.toString());
  }

  private String bucket(StorageTargetRecord target) {
    String bucket = ConfigValues.getString(target.getConfig(), "bucket", defaults.getS3Bucket());
    if (bucket == null) {
      throw new UnresolvedStorageTargetException(
          "S3 storage target missing bucket configuration");
    }
    return bucket;
  }

  private static String resolveRegion(@Nullable String configured) {
    if (configured != null) {
      return configured;
    }
    String region = System.getenv("AWS_REGION");
    if (region != null && !region.isEmpty()) {
      return region;
    }
    try {
      region = new DefaultAwsRegionProviderChain().getRegion();
    } catch (SdkClientException e) {
      LOGGER.debug("No AWS region configured, using {}: {}", DEFAULT_REGION, e.getMessage());
    }
    return region != null ? region : DEFAULT_REGION;
  }

  private static @Nullable AWSCredentials defaultCredentials() {
    try {
      return DefaultAWSCredentialsProviderChain.getInstance().getCredentials();
    } catch (SdkClientException e) {
      LOGGER.debug("No AWS credentials available, S3 access will be anonymous: {}",
          e.getMessage());
      return null;
    }
  }
}
