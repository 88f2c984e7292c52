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

package io.rivulet.core;

import java.util.concurrent.atomic.AtomicInteger;

import io.rivulet.test.RaceTestUtils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TerminalGuardTest {

	@Test
	void onlyFirstStopWins() {
		TerminalGuard guard = new TerminalGuard();

		assertThat(guard.isOpen()).isTrue();
		assertThat(guard.stop()).isTrue();
		assertThat(guard.stop()).isFalse();
		assertThat(guard.isStopped()).isTrue();
		assertThat(guard.isOpen()).isFalse();
	}

	@Test
	void racingStopsHaveASingleWinner() {
		for (int i = 0; i < 1000; i++) {
			TerminalGuard guard = new TerminalGuard();
			AtomicInteger winners = new AtomicInteger();
			Runnable stop = () -> {
				if (guard.stop()) {
					winners.incrementAndGet();
				}
			};

			RaceTestUtils.race(stop, stop, stop, stop);

			assertThat(winners).as("round " + i).hasValue(1);
		}
	}

	@Test
	void toStringReflectsState() {
		TerminalGuard guard = new TerminalGuard();
		assertThat(guard).hasToString("TerminalGuard[open]");
		guard.stop();
		assertThat(guard).hasToString("TerminalGuard[stopped]");
	}
}
