/*
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
package org.textmerge.commons.io;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown to the consumer of a merge when one of the source readers failed,
 * after every source has been closed and every other reader cancelled.
 */
public class SourceScanException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SourceScanException(@NotNull String source, @NotNull Throwable cause) {
        super("Failed to read records of " + source + ": " + cause.getMessage(), cause);
        this.source = source;
    }

    /**
     * @return the name of the source that failed, usually its path
     */
    @NotNull
    public String getSource() {
        return source;
    }
}
