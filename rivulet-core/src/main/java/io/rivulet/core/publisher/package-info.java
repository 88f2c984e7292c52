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
 * {@link io.rivulet.core.publisher.EventStream}, the hot
 * {@link io.rivulet.core.publisher.Subject} family and the bounded
 * {@link io.rivulet.core.publisher.Single}, {@link io.rivulet.core.publisher.Maybe}
 * and {@link io.rivulet.core.publisher.Completable} sources.
 */
@NullMarked
package io.rivulet.core.publisher;

import org.jspecify.annotations.NullMarked;
