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

package io.rivulet;

import io.rivulet.test.LoggerUtils;
import io.rivulet.util.Loggers;
import org.junit.platform.launcher.LauncherSession;
import org.junit.platform.launcher.LauncherSessionListener;

public class RivuletLauncherSessionListener implements LauncherSessionListener {

	/**
	 * Reset the {@link Loggers} factory to defaults suitable for rivulet-core tests.
	 * Notably, it installs an indirection via {@link LoggerUtils#useCurrentLoggersWithCapture()}.
	 */
	public static void resetLoggersFactory() {
		Loggers.resetLoggerFactory();
		LoggerUtils.useCurrentLoggersWithCapture();
	}

	@Override
	public void launcherSessionOpened(LauncherSession session) {
		RivuletLauncherSessionListener.resetLoggersFactory();
	}
}
