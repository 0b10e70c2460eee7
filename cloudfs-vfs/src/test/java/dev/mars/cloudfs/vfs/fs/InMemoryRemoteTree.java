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

package dev.mars.cloudfs.vfs.fs;

import dev.mars.cloudfs.client.BackendApi;
import dev.mars.cloudfs.client.RemoteTreeClient;
import dev.mars.cloudfs.core.DiskUsage;
import dev.mars.cloudfs.core.RemoteFile;
import dev.mars.cloudfs.core.RemoteFolder;
import dev.mars.cloudfs.core.exceptions.ApiException;
import dev.mars.cloudfs.core.exceptions.CloudFsException;
import dev.mars.cloudfs.core.exceptions.NotFoundException;
import dev.mars.cloudfs.core.exceptions.UnexpectedStatusException;
import dev.mars.cloudfs.path.PathResolver;
import dev.mars.cloudfs.path.PathSegments;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Remote tree client backed by an in-memory folder tree instead of HTTP.
 *
 * <p>Mutating calls are recorded as short strings, e.g. {@code "createFolder / Docs"},
 * so tests can assert which requests a file system operation issued.</p>
 */
class InMemoryRemoteTree extends RemoteTreeClient {

    private static final Instant CREATED = Instant.parse("2026-10-01T10:00:00Z");

    private final Folder root = new Folder("Home", "/");
    private final Map<String, byte[]> contents = new HashMap<>();
    private final List<String> calls = new ArrayList<>();
    private boolean createReturnsNothing;

    InMemoryRemoteTree() {
        super(new BackendApi("http://offline.test/", request -> {
            throw new IOException("offline");
        }, () -> "unused"));
    }

    // ==================== Setup and inspection ====================

    synchronized void createFolders(String path) {
        Folder current = root;
        for (String segment : segments(path)) {
            Folder parent = current;
            current = parent.subfolders.computeIfAbsent(segment,
                    name -> new Folder(name, PathResolver.join(parent.path, name)));
        }
    }

    synchronized RemoteFile putFile(String folderPath, String name, byte[] content) {
        createFolders(folderPath);
        Folder folder = folder(folderPath);
        RemoteFile file = new RemoteFile(UUID.randomUUID().toString(), name, "application/octet-stream",
                content.length, CREATED, folder.path);
        folder.files.add(file);
        contents.put(file.id(), content.clone());
        return file;
    }

    synchronized byte[] read(String path) {
        PathSegments segments = PathResolver.parse(path);
        Folder folder = folder(segments.parent());
        if (folder == null) {
            return null;
        }
        for (RemoteFile file : folder.files) {
            if (file.name().equals(segments.leaf())) {
                return contents.get(file.id()).clone();
            }
        }
        return null;
    }

    synchronized boolean folderExists(String path) {
        return folder(path) != null;
    }

    synchronized List<String> getCalls() {
        return new ArrayList<>(calls);
    }

    void setCreateReturnsNothing(boolean createReturnsNothing) {
        this.createReturnsNothing = createReturnsNothing;
    }

    // ==================== Client ====================

    @Override
    public synchronized DiskUsage diskUsage() {
        long used = contents.values().stream().mapToLong(content -> content.length).sum();
        return new DiskUsage(1_000_000, used, 1, 0, 0, 0, 0, used, 0, 0);
    }

    @Override
    public synchronized List<RemoteFolder> getFolders() {
        return root.snapshot().flatten();
    }

    @Override
    public synchronized RemoteFolder getRootFolder() {
        return root.snapshot();
    }

    @Override
    public synchronized RemoteFolder getFolder(String path) throws CloudFsException {
        Folder folder = folder(path);
        if (folder == null) {
            throw NotFoundException.noFolder(path);
        }
        return folder.snapshot();
    }

    @Override
    public synchronized List<RemoteFile> getFiles(String... ids) {
        List<RemoteFile> result = new ArrayList<>();
        for (String id : ids) {
            RemoteFile file = findById(root, id);
            if (file != null) {
                result.add(file);
            }
        }
        return result;
    }

    @Override
    public synchronized void deleteFiles(String... ids) {
        calls.add("deleteFiles " + String.join(",", ids));
        for (String id : ids) {
            removeById(root, id);
            contents.remove(id);
        }
    }

    @Override
    public synchronized InputStream downloadFile(String id, Map<String, String> headers) throws CloudFsException {
        calls.add("download " + id);
        byte[] content = contents.get(id);
        if (content == null) {
            throw new UnexpectedStatusException("download", 404, "File not found");
        }
        return new ByteArrayInputStream(content);
    }

    @Override
    public InputStream downloadFile(String id) throws CloudFsException {
        return downloadFile(id, Map.of());
    }

    @Override
    public synchronized RemoteFolder createFolder(String parentFolder, String name) throws CloudFsException {
        calls.add("createFolder " + parentFolder + " " + name);
        Folder parent = folder(parentFolder);
        if (parent == null) {
            throw new ApiException("create folder", "Folder not found");
        }
        if (parent.subfolders.containsKey(name)) {
            throw new ApiException("create folder", "Folder already exists");
        }
        Folder created = new Folder(name, PathResolver.join(parent.path, name));
        parent.subfolders.put(name, created);
        return createReturnsNothing ? null : created.snapshot();
    }

    @Override
    public synchronized void deleteFolder(String parentFolder, String name) throws CloudFsException {
        calls.add("deleteFolder " + parentFolder + " " + name);
        Folder parent = folder(parentFolder);
        Folder removed = parent == null ? null : parent.subfolders.remove(name);
        if (removed == null) {
            throw new ApiException("delete folder", "Folder not found");
        }
        dropContents(removed);
    }

    @Override
    public synchronized void moveFiles(String targetFolder, String... ids) throws CloudFsException {
        calls.add("moveFiles " + targetFolder + " " + String.join(",", ids));
        Folder target = folder(targetFolder);
        if (target == null) {
            throw new ApiException("move files", "Folder not found");
        }
        for (String id : ids) {
            RemoteFile file = removeById(root, id);
            if (file != null) {
                target.files.add(new RemoteFile(file.id(), file.name(), file.type(), file.size(),
                        file.dateAdded(), target.path));
            }
        }
    }

    @Override
    public synchronized void renameFile(String fileId, String newName) throws CloudFsException {
        calls.add("renameFile " + fileId + " " + newName);
        RemoteFile file = findById(root, fileId);
        if (file == null) {
            throw new UnexpectedStatusException("rename file", 404, "File not found");
        }
        Folder folder = folder(file.folderPath());
        folder.files.set(folder.files.indexOf(file), new RemoteFile(file.id(), newName, file.type(), file.size(),
                file.dateAdded(), file.folderPath()));
    }

    @Override
    public synchronized void moveFolder(String folderPath, String newParentFolder, String newName)
            throws CloudFsException {
        calls.add("moveFolder " + folderPath + " " + newParentFolder + " " + newName);
        PathSegments source = PathResolver.parse(folderPath);
        Folder oldParent = folder(source.parent());
        Folder moved = oldParent == null ? null : oldParent.subfolders.remove(source.leaf());
        Folder newParent = newParentFolder == null ? oldParent : folder(newParentFolder);
        if (moved == null || newParent == null) {
            throw new ApiException("move folder", "Folder not found");
        }
        moved.name = newName;
        newParent.subfolders.put(newName, moved);
        relocate(moved, PathResolver.join(newParent.path, newName));
    }

    /**
     * Adds an uploaded file the way the upload endpoint does on its final chunk.
     */
    synchronized RemoteFile store(String destinationPath, byte[] content) throws CloudFsException {
        PathSegments segments = PathResolver.parse(destinationPath);
        Folder folder = folder(segments.parent());
        if (folder == null) {
            throw new ApiException("upload", "Folder not found");
        }
        calls.add("upload " + segments.fullPath());
        RemoteFile file = new RemoteFile(UUID.randomUUID().toString(), segments.leaf(), "application/octet-stream",
                content.length, CREATED, folder.path);
        folder.files.add(file);
        contents.put(file.id(), content.clone());
        return file;
    }

    // ==================== Helpers ====================

    private Folder folder(String path) {
        Folder current = root;
        for (String segment : segments(path)) {
            current = current.subfolders.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static RemoteFile findById(Folder folder, String id) {
        for (RemoteFile file : folder.files) {
            if (file.id().equals(id)) {
                return file;
            }
        }
        for (Folder child : folder.subfolders.values()) {
            RemoteFile found = findById(child, id);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static RemoteFile removeById(Folder folder, String id) {
        RemoteFile file = findById(folder, id);
        if (file != null) {
            removeFrom(folder, file);
        }
        return file;
    }

    private static boolean removeFrom(Folder folder, RemoteFile file) {
        if (folder.files.remove(file)) {
            return true;
        }
        for (Folder child : folder.subfolders.values()) {
            if (removeFrom(child, file)) {
                return true;
            }
        }
        return false;
    }

    private void dropContents(Folder folder) {
        folder.files.forEach(file -> contents.remove(file.id()));
        folder.subfolders.values().forEach(this::dropContents);
    }

    private static void relocate(Folder folder, String newPath) {
        folder.path = newPath;
        List<RemoteFile> moved = new ArrayList<>();
        for (RemoteFile file : folder.files) {
            moved.add(new RemoteFile(file.id(), file.name(), file.type(), file.size(), file.dateAdded(), newPath));
        }
        folder.files.clear();
        folder.files.addAll(moved);
        for (Folder child : folder.subfolders.values()) {
            relocate(child, PathResolver.join(newPath, child.name));
        }
    }

    private static List<String> segments(String path) {
        List<String> result = new ArrayList<>();
        for (String segment : (path == null ? "" : path).split("/")) {
            if (!segment.isEmpty()) {
                result.add(segment);
            }
        }
        return result;
    }

    private static final class Folder {
        private String name;
        private String path;
        private final Map<String, Folder> subfolders = new LinkedHashMap<>();
        private final List<RemoteFile> files = new ArrayList<>();

        private Folder(String name, String path) {
            this.name = name;
            this.path = path;
        }

        private RemoteFolder snapshot() {
            List<RemoteFolder> children = new ArrayList<>();
            subfolders.values().forEach(child -> children.add(child.snapshot()));
            long size = files.stream().mapToLong(RemoteFile::size).sum();
            return new RemoteFolder(name, path, size, "1", files.size(), children, files);
        }
    }
}
