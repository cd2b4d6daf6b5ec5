/// Embedded Jetty server hosting an in-memory DVID store for client tests.
///
/// The store models repositories, grayscale and label volumes, key-value,
/// ROI and labelgraph instances, and answers the store's REST endpoints with
/// the same binary and JSON payloads a real server sends.
package io.dvid.testserver;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

