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

package dev.mars.cloudfs.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.cloudfs.core.DiskUsage;
import dev.mars.cloudfs.core.EditFileParams;
import dev.mars.cloudfs.core.FileLink;
import dev.mars.cloudfs.core.RemoteFile;
import dev.mars.cloudfs.core.RemoteFolder;
import dev.mars.cloudfs.core.exceptions.ApiException;
import dev.mars.cloudfs.core.exceptions.CloudFsException;
import dev.mars.cloudfs.core.exceptions.NotFoundException;
import dev.mars.cloudfs.core.exceptions.UnexpectedStatusException;
import dev.mars.cloudfs.transport.ApiRequest;
import dev.mars.cloudfs.transport.ApiResponse;

import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Client for the folder and file endpoints of the storage backend.
 *
 * <p>Folder listings are whole-tree snapshots: a returned {@link RemoteFolder} is never
 * updated and must be fetched again to observe later changes.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * RemoteTreeClient client = new RemoteTreeClient(api);
 * RemoteFolder docs = client.getFolder("/Documents");
 * client.createFolder("/Documents", "Invoices");
 * client.moveFiles("/Documents/Invoices", docs.file("march.pdf").orElseThrow().id());
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public class RemoteTreeClient {
    private static final Logger logger = Logger.getLogger(RemoteTreeClient.class.getName());

    static final String DISK_USAGE_PATH = "api/v1/filestorage/disk-usage-summary";
    static final String FILES_PATH = "api/v1/filestorage/files";
    static final String DELETE_FILES_PATH = "api/v1/filestorage/delete-files";
    static final String MOVE_FILES_PATH = "api/v1/filestorage/move-files";
    static final String EDIT_FILE_PATH = "api/v1/filestorage/%s/edit";
    static final String FILE_LINK_PATH = "api/v1/filestorage/%s/getlink";
    static final String FOLDER_PATH = "api/v1/filestorage/folder";
    static final String FOLDERS_PATH = "api/v1/filestorage/folders";
    static final String PUT_FOLDER_PATH = "api/v1/filestorage/folder-put";
    static final String DELETE_FOLDER_PATH = "api/v1/filestorage/delete-folder";
    static final String PATCH_FOLDER_PATH = "api/v1/filestorage/folder-patch";
    static final String DOWNLOAD_PATH = "api/v1/filestorage/%s/download";

    static final String FOLDER_NOT_FOUND = "Folder not found";

    private final BackendApi api;

    public RemoteTreeClient(BackendApi api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    public BackendApi getApi() {
        return api;
    }

    public DiskUsage diskUsage() throws CloudFsException {
        BackendResponses.DiskUsageResult result = api.call("disk usage", ApiRequest.GET, DISK_USAGE_PATH,
                null, BackendResponses.DiskUsageResult.class);
        if (result.diskUsage() == null) {
            throw new ApiException("disk usage", result.message() == null ? "no usage data" : result.message());
        }
        return result.diskUsage();
    }

    /**
     * Lists every folder of the account, root first, parents before their children.
     */
    public List<RemoteFolder> getFolders() throws CloudFsException {
        BackendResponses.FolderResult result = api.call("list folders", ApiRequest.GET, FOLDERS_PATH,
                null, BackendResponses.FolderResult.class);
        if (result.folder() == null) {
            throw new ApiException("list folders", result.message() == null ? "no root folder" : result.message());
        }
        return result.folder().flatten();
    }

    public RemoteFolder getRootFolder() throws CloudFsException {
        return getFolders().get(0);
    }

    /**
     * Fetches one folder with its subtree.
     *
     * @throws NotFoundException if the backend reports that the folder does not exist
     */
    public RemoteFolder getFolder(String path) throws CloudFsException {
        BackendResponses.FolderResult result = api.call("get folder", ApiRequest.POST, FOLDER_PATH,
                new FolderRequest(null, path), BackendResponses.FolderResult.class);
        if (!result.success()) {
            if (FOLDER_NOT_FOUND.equals(result.message())) {
                throw NotFoundException.noFolder(path);
            }
            throw new ApiException("get folder", result.message());
        }
        return result.folder();
    }

    public List<RemoteFile> getFiles(String... ids) throws CloudFsException {
        return api.call("get files", ApiRequest.POST, FILES_PATH,
                new FileIdsRequest(Arrays.asList(ids)), BackendResponses.FileList.class).files();
    }

    public void deleteFiles(String... ids) throws CloudFsException {
        api.call("delete files", ApiRequest.POST, DELETE_FILES_PATH,
                new FileIdsRequest(Arrays.asList(ids)), BackendResponses.Status.class);
        logger.fine("Deleted files " + Arrays.toString(ids));
    }

    /**
     * Opens the content of a file as a stream. {@code headers} are passed through, e.g. a
     * {@code Range} header; a partial-content answer is accepted alongside 200.
     * The caller must close the stream.
     */
    public InputStream downloadFile(String id, Map<String, String> headers) throws CloudFsException {
        ApiResponse response = api.get("download", String.format(DOWNLOAD_PATH, id), headers);
        int status = response.getStatusCode();
        if (status != 200 && status != 206) {
            throw new UnexpectedStatusException("download", status, api.readQuietly(response));
        }
        return response.getBody();
    }

    public InputStream downloadFile(String id) throws CloudFsException {
        return downloadFile(id, Map.of());
    }

    /**
     * Looks up the id of the file named {@code fileName} directly inside {@code folderPath}.
     *
     * @throws NotFoundException if the folder or the file is missing
     */
    public String getFileId(String folderPath, String fileName) throws CloudFsException {
        RemoteFolder folder = folderPath == null || folderPath.isEmpty() || "/".equals(folderPath)
                ? getRootFolder()
                : getFolder(folderPath);

        return folder.file(fileName)
                .map(RemoteFile::id)
                .orElseThrow(() -> NotFoundException.noFile(folder.path() + "/" + fileName));
    }

    public RemoteFolder createFolder(String parentFolder, String name) throws CloudFsException {
        BackendResponses.FolderResult result = api.call("create folder", ApiRequest.POST, PUT_FOLDER_PATH,
                new FolderRequest(parentFolder, name), BackendResponses.FolderResult.class);
        requireSuccess("create folder", result);
        logger.info("Created folder " + name + " in " + parentFolder);
        return result.folder();
    }

    public void deleteFolder(String parentFolder, String name) throws CloudFsException {
        BackendResponses.Status result = api.call("delete folder", ApiRequest.POST, DELETE_FOLDER_PATH,
                new FolderRequest(parentFolder, name), BackendResponses.Status.class);
        requireSuccess("delete folder", result);
        logger.info("Deleted folder " + name + " from " + parentFolder);
    }

    public void moveFiles(String targetFolder, String... ids) throws CloudFsException {
        BackendResponses.Status result = api.call("move files", ApiRequest.POST, MOVE_FILES_PATH,
                new MoveFilesRequest(targetFolder, Arrays.asList(ids)), BackendResponses.Status.class);
        requireSuccess("move files", result);
    }

    public void renameFile(String fileId, String newName) throws CloudFsException {
        BackendResponses.Status result = api.call("rename file", ApiRequest.POST, String.format(EDIT_FILE_PATH, fileId),
                new RenameFileRequest(newName), BackendResponses.Status.class);
        requireSuccess("rename file", result);
    }

    public void editFile(String fileId, EditFileParams params) throws CloudFsException {
        BackendResponses.Status result = api.call("edit file", ApiRequest.POST, String.format(EDIT_FILE_PATH, fileId),
                params, BackendResponses.Status.class);
        requireSuccess("edit file", result);
    }

    public FileLink getLink(String fileId) throws CloudFsException {
        BackendResponses.LinkResult result = api.call("get link", ApiRequest.GET, String.format(FILE_LINK_PATH, fileId),
                null, BackendResponses.LinkResult.class);
        requireSuccess("get link", result);
        return new FileLink(result.shortLink(), result.publicLink(), result.isPublic());
    }

    /**
     * Moves and/or renames a folder in one request.
     *
     * @param folderPath      absolute path of the folder to move
     * @param newParentFolder destination parent, or {@code null} to keep the current parent
     * @param newName         name of the folder after the move
     */
    public void moveFolder(String folderPath, String newParentFolder, String newName) throws CloudFsException {
        BackendResponses.Status result = api.call("move folder", ApiRequest.POST, PATCH_FOLDER_PATH,
                new PatchFolderRequest(folderPath, newParentFolder, newName), BackendResponses.Status.class);
        requireSuccess("move folder", result);
        logger.info("Moved folder " + folderPath + " to " + (newParentFolder == null ? "same parent" : newParentFolder)
                + " as " + newName);
    }

    private static void requireSuccess(String operation, BackendResponses.Envelope envelope) throws ApiException {
        if (!envelope.success()) {
            throw new ApiException(operation, envelope.message());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record FolderRequest(
            @JsonProperty("parentFolder") String parentFolder,
            @JsonProperty("folder") String folder) {
    }

    record FileIdsRequest(@JsonProperty("fileIds") List<String> fileIds) {
    }

    record MoveFilesRequest(
            @JsonProperty("newFolder") String newFolder,
            @JsonProperty("fileIDs") List<String> fileIds) {
    }

    record RenameFileRequest(@JsonProperty("newFilename") String newFilename) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PatchFolderRequest(
            @JsonProperty("folder") String folder,
            @JsonProperty("newParentFolder") String newParentFolder,
            @JsonProperty("newFolderName") String newFolderName) {
    }
}
