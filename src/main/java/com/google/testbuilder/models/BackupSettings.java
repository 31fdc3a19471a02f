package com.google.testbuilder.models;
/*
Copyright 2025 Google LLC

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    https://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * Whether global and static state should be backed up around a test. An empty value leaves the
 * runner's default in place.
 */
public record BackupSettings(Optional<Boolean> backupGlobals, Optional<Boolean> backupStaticAttributes) {

    public static final BackupSettings NONE = new BackupSettings(Optional.empty(), Optional.empty());

    public BackupSettings {
        Preconditions.checkNotNull(backupGlobals, "backupGlobals must not be null, use Optional.empty()");
        Preconditions.checkNotNull(backupStaticAttributes,
                "backupStaticAttributes must not be null, use Optional.empty()");
    }
}
