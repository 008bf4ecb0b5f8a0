/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.codelibs.taste.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memory utilities.
 */
public final class MemoryUtil {

    private static final Logger log = LoggerFactory.getLogger(MemoryUtil.class);

    private static final long MEGABYTE = 1024L * 1024L;

    private MemoryUtil() {
    }

    /**
     * Logs current heap memory statistics.
     *
     * @see Runtime
     */
    public static void logMemoryStatistics() {
        final Runtime runtime = Runtime.getRuntime();
        final long freeBytes = runtime.freeMemory();
        final long maxBytes = runtime.maxMemory();
        final long totalBytes = runtime.totalMemory();
        final long usedBytes = totalBytes - freeBytes;
        log.info("Memory (MB): {} used, {} heap, {} max", usedBytes
                / MEGABYTE, totalBytes / MEGABYTE, maxBytes / MEGABYTE);
    }

}
