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

/**
 * Core primitives: {@link io.rivulet.core.Disposable} handles and their composite
 * container, the {@link io.rivulet.core.TerminalGuard} once-only latch and the
 * {@link io.rivulet.core.Exceptions} utilities.
 */
@NullMarked
package io.rivulet.core;

import org.jspecify.annotations.NullMarked;
