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
package io.apphub.timestore.query.filter;

import io.apphub.timestore.query.ColumnValue;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Predicate over an ordered type supporting {@code eq}, {@code in} and the
 * four range comparisons. All given comparisons must hold.
 *
 * @param <T> Type values are compared as
 */
public abstract class RangePredicate<T extends Comparable<T>> implements FilterPredicate {
  private final @Nullable T eq;
  private final List<T> in;
  private final @Nullable T gt;
  private final @Nullable T gte;
  private final @Nullable T lt;
  private final @Nullable T lte;

  protected RangePredicate(Builder<T, ?> builder) {
    this.eq = builder.eq;
    this.in = ImmutableList.copyOf(builder.in);
    this.gt = builder.gt;
    this.gte = builder.gte;
    this.lt = builder.lt;
    this.lte = builder.lte;
    if (eq == null && in.isEmpty() && gt == null && gte == null && lt == null && lte == null) {
      throw new IllegalArgumentException("Predicate must define at least one comparison");
    }
  }

  /** Reads a value as {@code T}, or returns null if it cannot be. */
  protected abstract @Nullable T coerce(ColumnValue value);

  /** Renders a value as a SQL literal. */
  protected abstract String literal(T value);

  public @Nullable T getEq() {
    return eq;
  }

  public List<T> getIn() {
    return in;
  }

  public @Nullable T getGt() {
    return gt;
  }

  public @Nullable T getGte() {
    return gte;
  }

  public @Nullable T getLt() {
    return lt;
  }

  public @Nullable T getLte() {
    return lte;
  }

  @Override public boolean matches(ColumnValue value) {
    T v = coerce(value);
    if (v == null) {
      return false;
    }
    if (eq != null && v.compareTo(eq) != 0) {
      return false;
    }
    if (!in.isEmpty() && !containedIn(v)) {
      return false;
    }
    if (gt != null && v.compareTo(gt) <= 0) {
      return false;
    }
    if (gte != null && v.compareTo(gte) < 0) {
      return false;
    }
    if (lt != null && v.compareTo(lt) >= 0) {
      return false;
    }
    return lte == null || v.compareTo(lte) <= 0;
  }

  @Override public boolean mayMatchRange(ColumnValue min, ColumnValue max) {
    T lo = coerce(min);
    T hi = coerce(max);
    if (lo == null || hi == null) {
      return true;
    }
    if (eq != null && !within(eq, lo, hi)) {
      return false;
    }
    if (!in.isEmpty()) {
      boolean any = false;
      for (T candidate : in) {
        any |= within(candidate, lo, hi);
      }
      if (!any) {
        return false;
      }
    }
    if (gt != null && hi.compareTo(gt) <= 0) {
      return false;
    }
    if (gte != null && hi.compareTo(gte) < 0) {
      return false;
    }
    if (lt != null && lo.compareTo(lt) >= 0) {
      return false;
    }
    return lte == null || lo.compareTo(lte) <= 0;
  }

  @Override public String toSql(String quotedColumn) {
    List<String> conditions = new ArrayList<>();
    if (eq != null) {
      conditions.add(quotedColumn + " = " + literal(eq));
    }
    if (!in.isEmpty()) {
      List<String> literals = new ArrayList<>(in.size());
      for (T value : in) {
        literals.add(literal(value));
      }
      conditions.add(quotedColumn + " IN (" + String.join(", ", literals) + ")");
    }
    if (gt != null) {
      conditions.add(quotedColumn + " > " + literal(gt));
    }
    if (gte != null) {
      conditions.add(quotedColumn + " >= " + literal(gte));
    }
    if (lt != null) {
      conditions.add(quotedColumn + " < " + literal(lt));
    }
    if (lte != null) {
      conditions.add(quotedColumn + " <= " + literal(lte));
    }
    return conditions.size() == 1
        ? conditions.get(0)
        : "(" + String.join(" AND ", conditions) + ")";
  }

  private boolean containedIn(T value) {
    for (T candidate : in) {
      if (value.compareTo(candidate) == 0) {
        return true;
      }
    }
    return false;
  }

  private static <T extends Comparable<T>> boolean within(T value, T lo, T hi) {
    return value.compareTo(lo) >= 0 && value.compareTo(hi) <= 0;
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "{" + toSql("value") + "}";
  }

  /**
   * Builder shared by the concrete predicates.
   *
   * @param <T> Compared type
   * @param <P> Predicate built
   */
  public abstract static class Builder<T extends Comparable<T>, P extends RangePredicate<T>> {
    private @Nullable T eq;
    private final List<T> in = new ArrayList<>();
    private @Nullable T gt;
    private @Nullable T gte;
    private @Nullable T lt;
    private @Nullable T lte;

    public Builder<T, P> eq(T value) {
      this.eq = value;
      return this;
    }

    public Builder<T, P> in(List<T> values) {
      this.in.addAll(values);
      return this;
    }

    @SafeVarargs
    public final Builder<T, P> in(T... values) {
      return in(Arrays.asList(values));
    }

    public Builder<T, P> gt(T value) {
      this.gt = value;
      return this;
    }

    public Builder<T, P> gte(T value) {
      this.gte = value;
      return this;
    }

    public Builder<T, P> lt(T value) {
      this.lt = value;
      return this;
    }

    public Builder<T, P> lte(T value) {
      this.lte = value;
      return this;
    }

    public abstract P build();
  }
}
