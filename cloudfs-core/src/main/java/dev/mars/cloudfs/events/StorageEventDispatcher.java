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

package dev.mars.cloudfs.events;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.cloudfs.core.exceptions.CloudFsException;
import dev.mars.cloudfs.transport.JsonMapper;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes {@link StorageEvent}s to registered listeners.
 *
 * <p>Events can be dispatched as typed values or as the raw hub message the backend
 * pushes (method name plus JSON arguments). A listener that throws does not prevent
 * delivery to the remaining listeners.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class StorageEventDispatcher {
    private static final Logger logger = Logger.getLogger(StorageEventDispatcher.class.getName());

    public static final String FILES_ADDED = "FilesAdded";
    public static final String FILES_DELETED = "FilesDeleted";
    public static final String FILES_MODIFIED = "FilesModified";
    public static final String FOLDER_CHANGED = "FsFolderChange";
    public static final String MAILBOX_SIZE_UPDATED = "MailboxSizeUpdate";

    private final List<StorageEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ObjectMapper objectMapper;

    public StorageEventDispatcher() {
        this.objectMapper = JsonMapper.create();
    }

    public void addListener(StorageEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(StorageEventListener listener) {
        listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public void dispatch(StorageEvent event) {
        logger.fine("Dispatching " + event);
        for (StorageEventListener listener : listeners) {
            try {
                deliver(listener, event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Listener " + listener + " failed on " + event, e);
            }
        }
    }

    /**
     * Decodes a raw hub message and dispatches it. Unknown methods are logged and ignored.
     *
     * @param method  hub method name, e.g. {@value #FILES_ADDED}
     * @param payload JSON argument of the call
     * @throws CloudFsException if the payload does not match the method
     */
    public void dispatch(String method, JsonNode payload) throws CloudFsException {
        StorageEvent event;
        try {
            event = decode(method, payload);
        } catch (IOException e) {
            throw new CloudFsException("Malformed " + method + " event: " + e.getMessage(), e);
        }

        if (event == null) {
            logger.fine("Ignoring unsupported event " + method);
            return;
        }
        dispatch(event);
    }

    StorageEvent decode(String method, JsonNode payload) throws IOException {
        switch (method) {
            case FILES_ADDED:
                return new StorageEvent.FilesAdded(fileRefs(payload));
            case FILES_DELETED:
                return new StorageEvent.FilesDeleted(fileRefs(payload));
            case FILES_MODIFIED:
                return new StorageEvent.FilesModified(fileRefs(payload));
            case FOLDER_CHANGED:
                return objectMapper.treeToValue(payload, StorageEvent.FolderChanged.class);
            case MAILBOX_SIZE_UPDATED:
                // pushed as an array holding one update
                JsonNode update = payload.isArray() ? payload.path(0) : payload;
                return objectMapper.treeToValue(update, StorageEvent.MailboxSizeUpdated.class);
            default:
                return null;
        }
    }

    private List<StorageEvent.FileRef> fileRefs(JsonNode payload) throws IOException {
        JavaType type = objectMapper.getTypeFactory().constructCollectionType(List.class, StorageEvent.FileRef.class);
        List<StorageEvent.FileRef> files = objectMapper.readerFor(type).readValue(payload);
        return files == null ? List.of() : files;
    }

    private static void deliver(StorageEventListener listener, StorageEvent event) {
        if (event instanceof StorageEvent.FilesAdded added) {
            listener.onFilesAdded(added.files());
        } else if (event instanceof StorageEvent.FilesDeleted deleted) {
            listener.onFilesDeleted(deleted.files());
        } else if (event instanceof StorageEvent.FilesModified modified) {
            listener.onFilesModified(modified.files());
        } else if (event instanceof StorageEvent.FolderChanged changed) {
            listener.onFolderChanged(changed);
        } else if (event instanceof StorageEvent.MailboxSizeUpdated update) {
            listener.onMailboxSizeUpdated(update);
        }
    }
}
