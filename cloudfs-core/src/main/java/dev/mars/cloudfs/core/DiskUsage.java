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

package dev.mars.cloudfs.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Account-wide storage quota and usage, in bytes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiskUsage(
        @JsonProperty("allowed") long allowed,
        @JsonProperty("used") long used,
        @JsonProperty("mailboxes") long mailboxes,
        @JsonProperty("appointmentsUsed") long appointments,
        @JsonProperty("contactsUsed") long contacts,
        @JsonProperty("notesUsed") long notes,
        @JsonProperty("tasksUsed") long tasks,
        @JsonProperty("fileStorageUsed") long fileStorage,
        @JsonProperty("meetingWorkspaceUsed") long meetingWorkspace,
        @JsonProperty("chatFilesUsed") long chatFiles
) {

    public long available() {
        return Math.max(0, allowed - used);
    }
}
