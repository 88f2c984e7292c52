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

import java.util.Objects;

import io.micrometer.core.instrument.MeterRegistry;

import static io.micrometer.core.instrument.Metrics.globalRegistry;

/**
 * Utilities around instrumentation and metrics with Micrometer. Micrometer is an optional
 * dependency: when it is absent from the classpath every recording method is a no-op.
 * <p>
 * Recording can also be turned off with the {@value #ENABLED_PROPERTY} System property set
 * to {@code false}.
 */
public final class Metrics {

	/**
	 * The system property that can disable metrics recording even if Micrometer is present.
	 */
	public static final String ENABLED_PROPERTY = "rivulet.metrics.enabled";

	/**
	 * Name of the counter incremented for each signal dropped after its subscription
	 * terminated or was disposed. Tagged with {@value #TAG_SIGNAL_TYPE}.
	 */
	public static final String DROPPED_SIGNALS = "rivulet.signals.dropped";

	/**
	 * Name of the counter incremented for each bounded-cardinality contract violation.
	 */
	public static final String CONTRACT_VIOLATIONS = "rivulet.contract.violations";

	public static final String TAG_SIGNAL_TYPE = "type";

	static final boolean isMicrometerAvailable;

	static {
		boolean micrometer;
		try {
			globalRegistry.getRegistries();
			micrometer = true;
		}
		catch (Throwable t) {
			micrometer = false;
		}
		isMicrometerAvailable = micrometer &&
				!"false".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY));
	}

	private Metrics() {
	}

	/**
	 * Check if the current runtime supports metrics / instrumentation, by verifying if
	 * Micrometer is on the classpath and recording wasn't disabled.
	 *
	 * @return true if the Micrometer instrumentation facade is available
	 */
	public static boolean isInstrumentationAvailable() {
		return isMicrometerAvailable;
	}

	/**
	 * Increment the {@value #DROPPED_SIGNALS} counter for the given signal type name.
	 *
	 * @param signalType the type of the dropped signal, eg. {@code onNext}
	 */
	public static void recordDroppedSignal(String signalType) {
		if (isMicrometerAvailable) {
			MicrometerConfiguration.getRegistry()
			                       .counter(DROPPED_SIGNALS, TAG_SIGNAL_TYPE, signalType)
			                       .increment();
		}
	}

	/**
	 * Increment the {@value #CONTRACT_VIOLATIONS} counter.
	 */
	public static void recordContractViolation() {
		if (isMicrometerAvailable) {
			MicrometerConfiguration.getRegistry()
			                       .counter(CONTRACT_VIOLATIONS)
			                       .increment();
		}
	}

	/**
	 * Holds the {@link MeterRegistry} used for recording. Only touch this class when
	 * Micrometer is known to be on the classpath.
	 */
	public static final class MicrometerConfiguration {

		private static MeterRegistry registry = globalRegistry;

		private MicrometerConfiguration() {
		}

		/**
		 * Set the registry to use for metrics recording.
		 *
		 * @param registry the registry to use
		 * @return the previously configured registry.
		 */
		public static synchronized MeterRegistry useRegistry(MeterRegistry registry) {
			Objects.requireNonNull(registry, "registry");
			MeterRegistry previous = MicrometerConfiguration.registry;
			MicrometerConfiguration.registry = registry;
			return previous;
		}

		/**
		 * Get the registry used for metrics recording.
		 *
		 * @return the configured registry, the global one by default
		 */
		public static synchronized MeterRegistry getRegistry() {
			return registry;
		}
	}
}
