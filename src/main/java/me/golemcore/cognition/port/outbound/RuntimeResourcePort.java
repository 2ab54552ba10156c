package me.golemcore.cognition.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Port for reading process memory pressure and asking the runtime to reclaim
 * memory.
 */
public interface RuntimeResourcePort {

    /**
     * Used heap divided by the maximum heap, in {@code [0, 1]}.
     */
    double heapUtilization();

    long usedHeapBytes();

    /**
     * Request a collection. The runtime may ignore the request.
     */
    void requestReclaim();
}
