package com.google.testbuilder.fixtures;

import com.google.testbuilder.annotations.DataProvider;
import com.google.testbuilder.models.TestCase;

import java.util.List;

/** Its static initializer fails the first time a data provider is called. */
public class StaticInitFailureFixture extends TestCase {

    static final int LIMIT = Integer.parseInt("not a number");

    public StaticInitFailureFixture() {
        super();
    }

    public StaticInitFailureFixture(String name) {
        super(name);
    }

    public StaticInitFailureFixture(String name, List<Object> data, Object dataName) {
        super(name, data, dataName);
    }

    @DataProvider("rows")
    public void testRows(int value) {
    }

    public static Object[][] rows() {
        return new Object[][]{{LIMIT}};
    }
}
