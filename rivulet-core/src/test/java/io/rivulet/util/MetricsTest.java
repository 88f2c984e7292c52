/*
 * Copyright (c) 2026 The Rivulet Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.rivulet.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rivulet.core.publisher.Hooks;
import io.rivulet.core.publisher.Operators;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsTest {

	SimpleMeterRegistry registry;
	MeterRegistry       previousRegistry;

	@BeforeEach
	void useSimpleRegistry() {
		registry = new SimpleMeterRegistry();
		previousRegistry = Metrics.MicrometerConfiguration.useRegistry(registry);
		Hooks.onNextDropped(v -> { });
		Hooks.onErrorDropped(e -> { });
	}

	@AfterEach
	void restoreRegistry() {
		Metrics.MicrometerConfiguration.useRegistry(previousRegistry);
		registry.close();
	}

	@Test
	void micrometerIsDetected() {
		assertThat(Metrics.isInstrumentationAvailable()).isTrue();
	}

	@Test
	void droppedSignalsAreCountedPerType() {
		Operators.onNextDropped("a");
		Operators.onNextDropped("b");
		Operators.onErrorDropped(new IllegalStateException("boom"));
		Operators.onCompleteDropped();

		assertThat(registry.get(Metrics.DROPPED_SIGNALS)
		                   .tag(Metrics.TAG_SIGNAL_TYPE, "onNext")
		                   .counter()
		                   .count()).isEqualTo(2d);
		assertThat(registry.get(Metrics.DROPPED_SIGNALS)
		                   .tag(Metrics.TAG_SIGNAL_TYPE, "onError")
		                   .counter()
		                   .count()).isEqualTo(1d);
		assertThat(registry.get(Metrics.DROPPED_SIGNALS)
		                   .tag(Metrics.TAG_SIGNAL_TYPE, "onComplete")
		                   .counter()
		                   .count()).isEqualTo(1d);
	}

	@Test
	void contractViolationsAreCounted() {
		Operators.onContractViolation("twice");

		assertThat(registry.get(Metrics.CONTRACT_VIOLATIONS).counter().count()).isEqualTo(1d);
	}
}
