/*
 * Licensed to Crate.io GmbH ("Crate") under one or more contributor
 * license agreements.  See the NOTICE file distributed with this work for
 * additional information regarding copyright ownership.  Crate licenses
 * this file to you under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.  You may
 * obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.  See the
 * License for the specific language governing permissions and limitations
 * under the License.
 *
 * However, if you have executed another commercial license agreement
 * with Crate these terms will supersede the license and you may use the
 * software solely pursuant to the terms of the relevant commercial agreement.
 */

package io.onlineagg.common.settings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.Properties;

import org.junit.Test;

import io.onlineagg.execution.engine.aggregation.AccumulatorFactory;
import io.onlineagg.execution.engine.aggregation.SplitAggregationExecutor;

public class SettingsTest {

    @Test
    public void test_defaults_apply_for_missing_keys() {
        assertThat(AccumulatorFactory.DISTINCT_INITIAL_CAPACITY.get(Settings.EMPTY)).isEqualTo(16);
        assertThat(AccumulatorFactory.DISTINCT_WARN_THRESHOLD.get(Settings.EMPTY)).isEqualTo(1_000_000);
        assertThat(SplitAggregationExecutor.SERIALIZE_PARTIALS.get(Settings.EMPTY)).isTrue();
    }

    @Test
    public void test_settings_from_properties() {
        Properties properties = new Properties();
        properties.setProperty("aggregation.distinct.initial_capacity", "128");
        properties.setProperty("aggregation.transport.serialize_partials", "false");
        Settings settings = Settings.fromProperties(properties);

        assertThat(AccumulatorFactory.DISTINCT_INITIAL_CAPACITY.get(settings)).isEqualTo(128);
        assertThat(SplitAggregationExecutor.SERIALIZE_PARTIALS.get(settings)).isFalse();
        assertThat(settings.keySet()).containsExactlyInAnyOrder(
            "aggregation.distinct.initial_capacity",
            "aggregation.transport.serialize_partials"
        );
    }

    @Test
    public void test_missing_classpath_resource_yields_empty_settings() throws IOException {
        assertThat(Settings.fromClasspath("does-not-exist.properties")).isEqualTo(Settings.EMPTY);
    }

    @Test
    public void test_int_setting_below_minimum_is_rejected() {
        Settings settings = Settings.builder().put("aggregation.distinct.initial_capacity", 0).build();
        assertThatThrownBy(() -> AccumulatorFactory.DISTINCT_INITIAL_CAPACITY.get(settings))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Failed to parse value [0] for setting [aggregation.distinct.initial_capacity] must be >= 1");
    }

    @Test
    public void test_unparsable_values_are_rejected() {
        Settings settings = Settings.builder()
            .put("aggregation.distinct.initial_capacity", "many")
            .put("aggregation.transport.serialize_partials", "yes")
            .build();
        assertThatThrownBy(() -> AccumulatorFactory.DISTINCT_INITIAL_CAPACITY.get(settings))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Failed to parse value [many] for setting [aggregation.distinct.initial_capacity]");
        assertThatThrownBy(() -> SplitAggregationExecutor.SERIALIZE_PARTIALS.get(settings))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Failed to parse value [yes] as only [true] or [false] are allowed for setting " +
                        "[aggregation.transport.serialize_partials]");
    }

    @Test
    public void test_builder_merges_settings() {
        Settings base = Settings.builder().put("a", "1").put("b", "2").build();
        Settings merged = Settings.builder().put(base).put("b", "3").build();
        assertThat(merged.get("a")).isEqualTo("1");
        assertThat(merged.get("b")).isEqualTo("3");
        assertThat(merged.get("c", "default")).isEqualTo("default");
        assertThat(merged).hasToString("{a=1, b=3}");
    }
}
