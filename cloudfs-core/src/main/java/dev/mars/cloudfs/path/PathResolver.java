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

import dev.mars.cloudfs.client.RemoteTreeClient;
import dev.mars.cloudfs.core.DirEntry;
import dev.mars.cloudfs.core.RemoteFile;
import dev.mars.cloudfs.core.RemoteFolder;
import dev.mars.cloudfs.core.exceptions.CloudFsException;
import dev.mars.cloudfs.core.exceptions.NotFoundException;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Maps slash-delimited paths onto the remote folder tree.
 *
 * <p>Resolution fetches the parent folder of the requested path and scans its direct
 * children. Files are matched before folders, so a file shadows a folder with the same
 * name in the same parent.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public class PathResolver {
    private static final Logger logger = Logger.getLogger(PathResolver.class.getName());

    public static final String ROOT = "/";

    private final RemoteTreeClient client;

    public PathResolver(RemoteTreeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Splits {@code path} into its parent folder and last segment. Leading and trailing
     * slashes are ignored.
     *
     * <pre>
     * parse("/some/full/path")  -> ("/some/full", "path")
     * parse("/something/")      -> ("/", "something")
     * parse("/")                -> ("/", "")
     * </pre>
     */
    public static PathSegments parse(String path) {
        String trimmed = trimSlashes(path == null ? "" : path);
        if (trimmed.isEmpty()) {
            return new PathSegments(ROOT, "");
        }

        int lastSlash = trimmed.lastIndexOf('/');
        if (lastSlash < 0) {
            return new PathSegments(ROOT, trimmed);
        }
        return new PathSegments(ROOT + trimmed.substring(0, lastSlash), trimmed.substring(lastSlash + 1));
    }

    /**
     * Joins a folder path and a child name with exactly one slash between them.
     */
    public static String join(String parent, String name) {
        String base = trimSlashes(parent == null ? "" : parent);
        String child = trimSlashes(name == null ? "" : name);

        if (base.isEmpty()) {
            return ROOT + child;
        }
        if (child.isEmpty()) {
            return ROOT + base;
        }
        return ROOT + base + "/" + child;
    }

    /**
     * Resolves {@code path} to the file or folder it names.
     *
     * @throws NotFoundException kind {@code FOLDER} if the parent folder is missing,
     *                           kind {@code FILE} if the parent has no such child
     */
    public DirEntry resolve(String path) throws CloudFsException {
        PathSegments segments = parse(path);
        RemoteFolder parent = fetchFolder(segments.parent());

        if (segments.isRoot()) {
            return DirEntry.of(parent);
        }

        Optional<RemoteFile> file = parent.file(segments.leaf());
        if (file.isPresent()) {
            return DirEntry.of(file.get());
        }

        Optional<RemoteFolder> folder = parent.subfolder(segments.leaf());
        if (folder.isPresent()) {
            return DirEntry.of(folder.get());
        }

        throw NotFoundException.noFile(segments.fullPath());
    }

    /**
     * Like {@link #resolve} but reports absence as {@link DirEntry.Missing}, whether the
     * leaf or one of its parents is missing.
     */
    public DirEntry find(String path) throws CloudFsException {
        try {
            return resolve(path);
        } catch (NotFoundException e) {
            logger.fine("Nothing at " + path + ": " + e.getMessage());
            return DirEntry.missing(parse(path).fullPath());
        }
    }

    /**
     * Fetches a folder by absolute path; the root comes from the full listing.
     */
    public RemoteFolder fetchFolder(String folderPath) throws CloudFsException {
        if (folderPath == null || trimSlashes(folderPath).isEmpty()) {
            return client.getRootFolder();
        }
        return client.getFolder(join(folderPath, ""));
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
