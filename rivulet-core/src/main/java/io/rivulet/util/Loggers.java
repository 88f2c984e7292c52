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

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.regex.Matcher;

import org.jspecify.annotations.Nullable;

/**
 * Expose static methods to get a logger depending on the environment. If SLF4J is on the
 * classpath, it will be used. Otherwise Rivulet falls back to logging on the console, or
 * to {@link java.util.logging.Logger java.util.logging} when the
 * {@value #FALLBACK_PROPERTY} {@link System#setProperty(String, String) System property}
 * is set to "{@code JDK}".
 * <p>
 * All three backends share the level mapping of {@link LevelLogger}: DEBUG, INFO, WARN
 * and ERROR are expressed as {@link Level#FINE}, {@link Level#INFO},
 * {@link Level#WARNING} and {@link Level#SEVERE}.
 */
public abstract class Loggers {

	/**
	 * The system property that determines which fallback implementation to use for loggers
	 * when SLF4J isn't available. Use {@code JDK} for the JDK-backed logging and anything
	 * else for Console-based (the default).
	 */
	public static final String FALLBACK_PROPERTY = "rivulet.logging.fallback";

	private static Function<String, ? extends Logger> LOGGER_FACTORY;

	static final Map<String, Logger> CONSOLE_LOGGERS = new ConcurrentHashMap<>();

	static {
		resetLoggerFactory();
	}

	/**
	 * Activate the best available {@link Logger} factory: SLF4J when it is on the
	 * classpath, otherwise the fallback selected by {@value #FALLBACK_PROPERTY}.
	 */
	public static void resetLoggerFactory() {
		try {
			install(Loggers::slf4j, "Using Slf4j logging framework");
		}
		catch (NoClassDefFoundError slf4jMissing) {
			if (isFallbackToJdk()) {
				useJdkLoggers();
			}
			else {
				install(Loggers::console, "Using Console logging");
			}
		}
	}

	static boolean isFallbackToJdk() {
		return "JDK".equalsIgnoreCase(System.getProperty(FALLBACK_PROPERTY));
	}

	/**
	 * Use a custom type of {@link Logger} created through the provided {@link Function},
	 * which takes a logger name as input. The function must be thread-safe.
	 *
	 * @param loggerFactory the {@link Function} that provides a (possibly cached) {@link Logger}
	 * given a name.
	 */
	public static void useCustomLoggers(final Function<String, ? extends Logger> loggerFactory) {
		install(loggerFactory, "Using custom logging");
	}

	/**
	 * Force the usage of JDK-based {@link Logger Loggers}, even if SLF4J is available
	 * on the classpath.
	 */
	public static void useJdkLoggers() {
		install(Loggers::jdk, "Using JDK logging framework");
	}

	private static void install(Function<String, ? extends Logger> loggerFactory, String message) {
		//resolve first so that a missing SLF4J fails before the swap
		Logger self = loggerFactory.apply(Loggers.class.getName());
		LOGGER_FACTORY = loggerFactory;
		self.debug(message);
	}

	/**
	 * Get a {@link Logger} for the given category.
	 *
	 * @param name the category or logger name to use
	 * @return a new {@link Logger} instance
	 */
	public static Logger getLogger(String name) {
		return LOGGER_FACTORY.apply(name);
	}

	/**
	 * Get a {@link Logger} named after the given class.
	 *
	 * @param cls the source {@link Class} to derive the logger name from.
	 * @return a new {@link Logger} instance
	 */
	public static Logger getLogger(Class<?> cls) {
		return LOGGER_FACTORY.apply(cls.getName());
	}

	static Logger slf4j(String name) {
		return new Slf4JLogger(org.slf4j.LoggerFactory.getLogger(name));
	}

	static Logger jdk(String name) {
		return new JdkLogger(java.util.logging.Logger.getLogger(name));
	}

	static Logger console(String name) {
		return CONSOLE_LOGGERS.computeIfAbsent(name, n -> new ConsoleLogger(n, System.out, System.err));
	}

	@Nullable
	static String format(@Nullable String from, @Nullable Object... arguments) {
		if (from == null) {
			return null;
		}
		String computed = from;
		if (arguments != null) {
			for (Object argument : arguments) {
				computed = computed.replaceFirst("\\{\\}", Matcher.quoteReplacement(String.valueOf(argument)));
			}
		}
		return computed;
	}

	/**
	 * Base of the built-in backends: every {@link Logger} method funnels into a level
	 * check and a single write, placeholders being resolved only for enabled levels.
	 */
	abstract static class LevelLogger implements Logger {

		final String name;

		LevelLogger(String name) {
			this.name = name;
		}

		abstract boolean isEnabled(Level level);

		abstract void write(Level level, String msg, @Nullable Throwable t);

		final void log(Level level, String msg, @Nullable Throwable t) {
			if (isEnabled(level)) {
				write(level, msg, t);
			}
		}

		final void logFormatted(Level level, String format, Object... arguments) {
			if (isEnabled(level)) {
				write(level, String.valueOf(format(format, arguments)), null);
			}
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		public boolean isDebugEnabled() {
			return isEnabled(Level.FINE);
		}

		@Override
		public void debug(String msg) {
			log(Level.FINE, msg, null);
		}

		@Override
		public void debug(String format, Object... arguments) {
			logFormatted(Level.FINE, format, arguments);
		}

		@Override
		public void debug(String msg, Throwable t) {
			log(Level.FINE, msg, t);
		}

		@Override
		public boolean isInfoEnabled() {
			return isEnabled(Level.INFO);
		}

		@Override
		public void info(String msg) {
			log(Level.INFO, msg, null);
		}

		@Override
		public void info(String format, Object... arguments) {
			logFormatted(Level.INFO, format, arguments);
		}

		@Override
		public void info(String msg, Throwable t) {
			log(Level.INFO, msg, t);
		}

		@Override
		public boolean isWarnEnabled() {
			return isEnabled(Level.WARNING);
		}

		@Override
		public void warn(String msg) {
			log(Level.WARNING, msg, null);
		}

		@Override
		public void warn(String format, Object... arguments) {
			logFormatted(Level.WARNING, format, arguments);
		}

		@Override
		public void warn(String msg, Throwable t) {
			log(Level.WARNING, msg, t);
		}

		@Override
		public boolean isErrorEnabled() {
			return isEnabled(Level.SEVERE);
		}

		@Override
		public void error(String msg) {
			log(Level.SEVERE, msg, null);
		}

		@Override
		public void error(String format, Object... arguments) {
			logFormatted(Level.SEVERE, format, arguments);
		}

		@Override
		public void error(String msg, Throwable t) {
			log(Level.SEVERE, msg, t);
		}

		@Override
		public String toString() {
			return getClass().getSimpleName() + "[" + name + "]";
		}
	}

	static final class Slf4JLogger extends LevelLogger {

		final org.slf4j.Logger logger;

		Slf4JLogger(org.slf4j.Logger logger) {
			super(logger.getName());
			this.logger = logger;
		}

		@Override
		boolean isEnabled(Level level) {
			if (level == Level.SEVERE) {
				return logger.isErrorEnabled();
			}
			if (level == Level.WARNING) {
				return logger.isWarnEnabled();
			}
			if (level == Level.INFO) {
				return logger.isInfoEnabled();
			}
			return logger.isDebugEnabled();
		}

		@Override
		void write(Level level, String msg, @Nullable Throwable t) {
			if (level == Level.SEVERE) {
				logger.error(msg, t);
			}
			else if (level == Level.WARNING) {
				logger.warn(msg, t);
			}
			else if (level == Level.INFO) {
				logger.info(msg, t);
			}
			else {
				logger.debug(msg, t);
			}
		}
	}

	static final class JdkLogger extends LevelLogger {

		final java.util.logging.Logger logger;

		JdkLogger(java.util.logging.Logger logger) {
			super(logger.getName());
			this.logger = logger;
		}

		@Override
		boolean isEnabled(Level level) {
			return logger.isLoggable(level);
		}

		@Override
		void write(Level level, String msg, @Nullable Throwable t) {
			logger.log(level, msg, t);
		}
	}

	/**
	 * ERROR and WARN go to the error stream, INFO to the output stream, DEBUG is off.
	 */
	static final class ConsoleLogger extends LevelLogger {

		final PrintStream out;
		final PrintStream err;

		ConsoleLogger(String name, PrintStream out, PrintStream err) {
			super(name);
			this.out = out;
			this.err = err;
		}

		@Override
		boolean isEnabled(Level level) {
			return level.intValue() >= Level.INFO.intValue();
		}

		@Override
		synchronized void write(Level level, String msg, @Nullable Throwable t) {
			PrintStream target = level == Level.INFO ? out : err;
			String label = level == Level.SEVERE ? "ERROR" : level == Level.WARNING ? " WARN" : " INFO";
			target.format("[%s] (%s) %s%n", label, Thread.currentThread().getName(), msg);
			if (t != null) {
				t.printStackTrace(target);
			}
		}
	}
}
