package com.google.testbuilder.fixtures;

import com.google.testbuilder.models.TestCase;

/** Only the name constructor, as plain tests written against older runners do. */
public class NamedOnlyFixture extends TestCase {

    public NamedOnlyFixture(String name) {
        super(name);
    }
}
