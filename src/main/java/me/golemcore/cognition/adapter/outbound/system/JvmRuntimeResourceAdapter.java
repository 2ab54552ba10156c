package me.golemcore.cognition.adapter.outbound.system;

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

import me.golemcore.cognition.port.outbound.RuntimeResourcePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * Reads heap usage from the platform {@link MemoryMXBean}.
 */
@Component
@Slf4j
public class JvmRuntimeResourceAdapter implements RuntimeResourcePort {

    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

    @Override
    public double heapUtilization() {
        MemoryUsage usage = memoryBean.getHeapMemoryUsage();
        long max = usage.getMax() > 0 ? usage.getMax() : usage.getCommitted();
        if (max <= 0) {
            return 0.0;
        }
        return (double) usage.getUsed() / max;
    }

    @Override
    public long usedHeapBytes() {
        return memoryBean.getHeapMemoryUsage().getUsed();
    }

    @Override
    public void requestReclaim() {
        log.debug("[Runtime] Requesting garbage collection");
        memoryBean.gc();
    }
}
