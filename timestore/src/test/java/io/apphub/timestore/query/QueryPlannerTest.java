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
package io.apphub.timestore.query;

import io.apphub.timestore.TimestoreConfig;
import io.apphub.timestore.TimestoreFixtures;
import io.apphub.timestore.cache.SqlContextCache;
import io.apphub.timestore.metadata.DatasetRecord;
import io.apphub.timestore.metadata.InMemoryMetadataStore;
import io.apphub.timestore.query.filter.BooleanPredicate;
import io.apphub.timestore.query.filter.QueryFilters;
import io.apphub.timestore.query.filter.StringPredicate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static io.apphub.timestore.TimestoreFixtures.DAY_1;
import static io.apphub.timestore.TimestoreFixtures.DAY_2;
import static io.apphub.timestore.TimestoreFixtures.DAY_3;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for QueryPlanner.
 */
@Tag("unit")
public class QueryPlannerTest {
  private InMemoryMetadataStore store;
  private SqlContextCache cache;
  private QueryPlanner planner;

  @BeforeEach void setUp() {
    store = new InMemoryMetadataStore();
    store.putStorageTarget(TimestoreFixtures.localTarget(Paths.get("/data")));
    TimestoreFixtures.publish(store, TimestoreFixtures.dataset("ds-1", "observatory"), 1,
        TimestoreFixtures.partition("p-1", "ds-1", DAY_1, DAY_2.minusSeconds(1),
            ImmutableMap.of("site", "north")),
        TimestoreFixtures.partition("p-2", "ds-1", DAY_2, DAY_3.minusSeconds(1),
            ImmutableMap.of("site", "south")));
    cache = SqlContextCache.create(TimestoreConfig.defaults(), store);
    planner = new QueryPlanner(cache);
  }

  @AfterEach void tearDown() {
    cache.close();
  }

  private static QueryRequest.Builder day1() {
    return QueryRequest.builder().timeRange(DAY_1, DAY_1.plusSeconds(3600));
  }

  private static DownsampleSpec hourly(AggregationSpec... aggregations) {
    return DownsampleSpec.of(1, IntervalUnit.HOUR, aggregations);
  }

  @Test void testRawPlan() {
    QueryPlan plan = planner.buildPlan("observatory",
        day1().columns("temperature_c").limit(10).build());
    assertEquals(QueryMode.RAW, plan.getMode());
    assertEquals("timestamp", plan.getTimestampColumn());
    assertEquals(1, plan.getPartitions().size());
    assertEquals("p-1", plan.getPartitions().get(0).getId());
    assertEquals(2, plan.getPartitionSelection().getTotal());
    assertEquals(1, plan.getPartitionSelection().getPrunedByTime());
    assertEquals("duckdb", plan.getExecutionBackend());
    assertEquals(Integer.valueOf(10), plan.getLimit());
    assertTrue(plan.getWarnings().isEmpty(), plan.getWarnings().toString());
  }

  @Test void testDownsampledPlanWithPartitionKeyFilter() {
    QueryPlan plan = planner.buildPlan("observatory", QueryRequest.builder()
        .timeRange(DAY_1, DAY_3)
        .timestampColumn("observed_at")
        .filters(QueryFilters.builder().partitionKey("site", StringPredicate.eq("south")).build())
        .downsample(hourly(AggregationSpec.of(AggregationFunction.AVG, "temperature_c")))
        .build());
    assertEquals(QueryMode.DOWNSAMPLED, plan.getMode());
    assertEquals("observed_at", plan.getTimestampColumn());
    assertEquals(1, plan.getPartitions().size());
    assertEquals("p-2", plan.getPartitions().get(0).getId());
    assertEquals(1, plan.getPartitionSelection().getPrunedByPartitionKey());
  }

  @Test void testUnknownDataset() {
    DatasetNotFoundException error = assertThrows(DatasetNotFoundException.class,
        () -> planner.buildPlan("missing", day1().build()));
    assertEquals("missing", error.getDatasetSlug());
  }

  @Test void testDatasetOutsideContextGivesEmptyPlan() {
    store.putDataset(TimestoreFixtures.dataset("ds-2", "events").toBuilder()
        .writeFormat("clickhouse").build());
    cache.invalidateAll("new dataset");

    QueryPlan plan = planner.buildPlan("events", day1().build());
    assertNull(plan.getDatasetContext());
    assertTrue(plan.getPartitions().isEmpty());
    assertEquals(ImmutableList.of(
        "Dataset events is not backed by DuckDB partitions; skipping.",
        "Dataset events has no queryable partitions."), plan.getWarnings());
  }

  @Test void testRejectsInvalidRequests() {
    assertThrows(InvalidQueryException.class,
        () -> planner.buildPlan("observatory",
            QueryRequest.builder().timeRange(DAY_2, DAY_1).build()));
    assertThrows(InvalidQueryException.class,
        () -> planner.buildPlan("observatory", day1().limit(0).build()));
    assertThrows(InvalidQueryException.class,
        () -> QueryRequest.builder().build());
    assertThrows(InvalidQueryException.class,
        () -> planner.buildPlan("observatory", day1()
            .filters(QueryFilters.builder()
                .partitionKey("site", BooleanPredicate.eq(true)).build())
            .build()));
  }

  @Test void testRejectsInvalidDownsample() {
    assertThrows(InvalidQueryException.class,
        () -> planner.buildPlan("observatory", day1()
            .downsample(DownsampleSpec.of(0, IntervalUnit.MINUTE, AggregationSpec.count()))
            .build()));
    assertThrows(InvalidQueryException.class,
        () -> planner.buildPlan("observatory", day1().downsample(hourly()).build()));

    InvalidQueryException missingColumn = assertThrows(InvalidQueryException.class,
        () -> planner.buildPlan("observatory", day1()
            .downsample(hourly(new AggregationSpec(AggregationFunction.MAX, null, null, null)))
            .build()));
    assertEquals("Aggregation max requires a column", missingColumn.getMessage());

    assertThrows(InvalidQueryException.class,
        () -> planner.buildPlan("observatory", day1()
            .downsample(hourly(AggregationSpec.percentile("temperature_c", 1.5)))
            .build()));
    assertThrows(InvalidQueryException.class,
        () -> planner.buildPlan("observatory", day1()
            .downsample(hourly(AggregationSpec.count().withAlias("n"),
                AggregationSpec.of(AggregationFunction.SUM, "temperature_c").withAlias("n")))
            .build()));
    // planning never reached the cache
    assertEquals(0, cache.getFullBuildCount());
  }

  @Test void testExecutionBackendOverride() {
    DatasetRecord dataset = TimestoreFixtures.dataset("ds-1", "observatory").toBuilder()
        .metadata(ImmutableMap.of("execution", ImmutableMap.of("backend", "ClickHouse")))
        .build();
    InvalidQueryException error = assertThrows(InvalidQueryException.class,
        () -> planner.resolveExecutionBackend(dataset));
    assertEquals("Unsupported query execution backend: ClickHouse", error.getMessage());

    DatasetRecord duck = dataset.toBuilder()
        .metadata(ImmutableMap.of("execution", ImmutableMap.of("backend", " DuckDB ")))
        .build();
    assertEquals("duckdb", planner.resolveExecutionBackend(duck));
  }

  @Test void testAliases() {
    assertEquals("avg_temperature_c",
        AggregationSpec.of(AggregationFunction.AVG, "temperature_c").resolveAlias());
    assertEquals("count", AggregationSpec.count().resolveAlias());
    assertEquals("p50_temperature_c",
        AggregationSpec.percentile("temperature_c", 0.5).resolveAlias());
    assertEquals("p12_5_temperature_c",
        AggregationSpec.percentile("temperature_c", 0.125).resolveAlias());
    assertEquals(IntervalUnit.MINUTE, IntervalUnit.of("Minutes"));
    assertEquals(AggregationFunction.COUNT_DISTINCT, AggregationFunction.of("count_distinct"));
    assertThrows(InvalidQueryException.class, () -> AggregationFunction.of("mode"));
  }
}
