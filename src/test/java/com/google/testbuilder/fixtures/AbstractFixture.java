package com.google.testbuilder.fixtures;

import com.google.testbuilder.models.TestCase;

public abstract class AbstractFixture extends TestCase {

    protected AbstractFixture() {
        super();
    }
}
