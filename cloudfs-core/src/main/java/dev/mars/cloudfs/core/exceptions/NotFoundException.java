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

/**
 * Thrown when a path does not resolve to a remote entry.
 *
 * <p>{@link Kind#FOLDER} means a folder that had to exist for the lookup
 * (the parent of the requested leaf) is missing; {@link Kind#FILE} means the
 * parent exists but holds no file or folder with the requested name.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class NotFoundException extends CloudFsException {

    public enum Kind {
        FILE,
        FOLDER
    }

    private final Kind kind;
    private final String path;

    public NotFoundException(Kind kind, String path) {
        super(String.format("No %s found at '%s'", kind == Kind.FILE ? "file" : "folder", path));
        this.kind = kind;
        this.path = path;
    }

    public static NotFoundException noFile(String path) {
        return new NotFoundException(Kind.FILE, path);
    }

    public static NotFoundException noFolder(String path) {
        return new NotFoundException(Kind.FOLDER, path);
    }

    public Kind getKind() {
        return kind;
    }

    public String getPath() {
        return path;
    }
}
