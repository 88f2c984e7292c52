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

/**
 * Logger interface used internally by Rivulet. Obtain instances through
 * {@link Loggers#getLogger(Class)}.
 * <p>
 * Format strings use the SLF4J {@code {}} placeholder convention whatever the backing
 * implementation.
 */
public interface Logger {

	/**
	 * Return the name of this {@link Logger} instance.
	 *
	 * @return name of this logger instance
	 */
	String getName();

	/**
	 * Is the logger instance enabled for the DEBUG level?
	 *
	 * @return true if this Logger is enabled for the DEBUG level, false otherwise.
	 */
	boolean isDebugEnabled();

	/**
	 * Log a message at the DEBUG level.
	 *
	 * @param msg the message string to be logged
	 */
	void debug(String msg);

	/**
	 * Log a message at the DEBUG level according to the specified format and arguments.
	 *
	 * @param format the format string
	 * @param arguments a list of arguments
	 */
	void debug(String format, Object... arguments);

	/**
	 * Log an exception at the DEBUG level with an accompanying message.
	 *
	 * @param msg the message accompanying the exception
	 * @param t the exception to be logged
	 */
	void debug(String msg, Throwable t);

	boolean isInfoEnabled();

	void info(String msg);

	void info(String format, Object... arguments);

	void info(String msg, Throwable t);

	boolean isWarnEnabled();

	void warn(String msg);

	void warn(String format, Object... arguments);

	void warn(String msg, Throwable t);

	boolean isErrorEnabled();

	void error(String msg);

	void error(String format, Object... arguments);

	/**
	 * Log an exception at the ERROR level with an accompanying message.
	 *
	 * @param msg the message accompanying the exception
	 * @param t the exception to be logged
	 */
	void error(String msg, Throwable t);
}
