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

package dev.mars.cloudfs.path;

/**
 * A slash-delimited path split into the folder that contains the last segment and
 * the last segment itself.
 *
 * @param parent absolute parent folder path, {@code "/"} for top-level entries
 * @param leaf   last segment, empty for the root
 */
public record PathSegments(String parent, String leaf) {

    public boolean isRoot() {
        return leaf.isEmpty();
    }

    public boolean hasRootParent() {
        return PathResolver.ROOT.equals(parent);
    }

    public String fullPath() {
        return PathResolver.join(parent, leaf);
    }
}
