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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for test classes.
 * <p>
 * Subclasses declare the constructors the builder may call:
 * <ul>
 * <li>{@code ()} or {@code (String name)} for plain tests</li>
 * <li>{@code (String name, List<Object> data, Object dataName)} for tests fed by a data provider</li>
 * </ul>
 * The isolation and backup settings are only recorded here. Acting on them is up to the runner.
 */
public abstract non-sealed class TestCase implements Test {

    private String name;
    private final List<Object> providedData;
    private final Object dataName;
    private boolean runTestInSeparateProcess;
    private boolean runClassInSeparateProcess;
    private Boolean preserveGlobalState;
    private Boolean backupGlobals;
    private Boolean backupStaticAttributes;

    protected TestCase() {
        this(null);
    }

    protected TestCase(String name) {
        this.name = name;
        this.providedData = List.of();
        this.dataName = null;
    }

    protected TestCase(String name, List<?> data, Object dataName) {
        Preconditions.checkNotNull(data, "data must not be null");
        Preconditions.checkNotNull(dataName, "dataName must not be null");
        this.name = name;
        this.providedData = Collections.unmodifiableList(new ArrayList<>(data));
        this.dataName = dataName;
    }

    @Override
    public Kind kind() {
        return dataName == null ? Kind.PLAIN_CASE : Kind.PARAMETERIZED_CASE;
    }

    @Override
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return the name followed by the data set it runs with, e.g. {@code testAdd with data set #2}
     */
    public String getDisplayName() {
        if (dataName == null) {
            return String.valueOf(name);
        }
        return "%s with data set %s".formatted(name, DataSet.Row.describeKey(dataName));
    }

    @Override
    public int count() {
        return 1;
    }

    public List<Object> getProvidedData() {
        return providedData;
    }

    public Optional<Object> getDataName() {
        return Optional.ofNullable(dataName);
    }

    public boolean isRunTestInSeparateProcess() {
        return runTestInSeparateProcess;
    }

    public void setRunTestInSeparateProcess(boolean runTestInSeparateProcess) {
        this.runTestInSeparateProcess = runTestInSeparateProcess;
    }

    public boolean isRunClassInSeparateProcess() {
        return runClassInSeparateProcess;
    }

    public void setRunClassInSeparateProcess(boolean runClassInSeparateProcess) {
        this.runClassInSeparateProcess = runClassInSeparateProcess;
    }

    public Optional<Boolean> getPreserveGlobalState() {
        return Optional.ofNullable(preserveGlobalState);
    }

    public void setPreserveGlobalState(boolean preserveGlobalState) {
        this.preserveGlobalState = preserveGlobalState;
    }

    public Optional<Boolean> getBackupGlobals() {
        return Optional.ofNullable(backupGlobals);
    }

    public void setBackupGlobals(boolean backupGlobals) {
        this.backupGlobals = backupGlobals;
    }

    public Optional<Boolean> getBackupStaticAttributes() {
        return Optional.ofNullable(backupStaticAttributes);
    }

    public void setBackupStaticAttributes(boolean backupStaticAttributes) {
        this.backupStaticAttributes = backupStaticAttributes;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        var that = (TestCase) obj;
        return Objects.equals(this.name, that.name) &&
                Objects.equals(this.providedData, that.providedData) &&
                Objects.equals(this.dataName, that.dataName) &&
                this.runTestInSeparateProcess == that.runTestInSeparateProcess &&
                this.runClassInSeparateProcess == that.runClassInSeparateProcess &&
                Objects.equals(this.preserveGlobalState, that.preserveGlobalState) &&
                Objects.equals(this.backupGlobals, that.backupGlobals) &&
                Objects.equals(this.backupStaticAttributes, that.backupStaticAttributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), name, providedData, dataName, runTestInSeparateProcess,
                runClassInSeparateProcess, preserveGlobalState, backupGlobals, backupStaticAttributes);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" +
                "name=" + name + ", " +
                "dataName=" + dataName + ", " +
                "providedData=" + providedData + ", " +
                "runTestInSeparateProcess=" + runTestInSeparateProcess + ", " +
                "runClassInSeparateProcess=" + runClassInSeparateProcess + ", " +
                "preserveGlobalState=" + preserveGlobalState + ", " +
                "backupGlobals=" + backupGlobals + ", " +
                "backupStaticAttributes=" + backupStaticAttributes + ']';
    }
}
