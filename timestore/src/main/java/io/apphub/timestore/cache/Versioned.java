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
package io.apphub.timestore.cache;

import java.util.Objects;

/**
 * A cached value with the signature of the inputs it was built from and a
 * version that increases with every distinct build.
 *
 * @param <T> Type of the cached value
 */
public final class Versioned<T> {
  private final T value;
  private final String signature;
  private final long version;

  public Versioned(T value, String signature, long version) {
    this.value = Objects.requireNonNull(value, "value");
    this.signature = Objects.requireNonNull(signature, "signature");
    this.version = version;
  }

  public T getValue() {
    return value;
  }

  public String getSignature() {
    return signature;
  }

  public long getVersion() {
    return version;
  }

  @Override public String toString() {
    return "Versioned{signature=" + signature + ", version=" + version + "}";
  }
}
