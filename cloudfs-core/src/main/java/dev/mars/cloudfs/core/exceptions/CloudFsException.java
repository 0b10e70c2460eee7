/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.cloudfs.core.exceptions;

import java.io.IOException;

/**
 * Base exception class for all CloudFS-related exceptions.
 * Provides a common hierarchy for error handling throughout the library.
 *
 * <p>Extends {@link IOException} so the filesystem adapter can let these
 * errors propagate unchanged through I/O-shaped method signatures.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class CloudFsException extends IOException {

    public CloudFsException(String message) {
        super(message);
    }

    public CloudFsException(String message, Throwable cause) {
        super(message, cause);
    }

    public CloudFsException(Throwable cause) {
        super(cause);
    }
}
