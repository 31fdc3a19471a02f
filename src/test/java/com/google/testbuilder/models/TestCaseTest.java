package com.google.testbuilder.models;

import com.google.testbuilder.fixtures.DataDrivenFixture;
import com.google.testbuilder.fixtures.PlainFixture;
import com.google.testbuilder.models.Test.Kind;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class TestCaseTest {

    @Test
    void plainCase_hasNoData() {
        PlainFixture test = new PlainFixture("testSomething");

        assertEquals(Kind.PLAIN_CASE, test.kind());
        assertEquals(List.of(), test.getProvidedData());
        assertEquals(Optional.empty(), test.getDataName());
        assertEquals("testSomething", test.getDisplayName());
        assertEquals(1, test.count());
    }

    @Test
    void parameterizedCase_describesDataSetInDisplayName() {
        DataDrivenFixture byIndex = new DataDrivenFixture("testAdd", List.of(1), 3);
        DataDrivenFixture byName = new DataDrivenFixture("testAdd", List.of(1), "ones");

        assertEquals(Kind.PARAMETERIZED_CASE, byIndex.kind());
        assertEquals("testAdd with data set #3", byIndex.getDisplayName());
        assertEquals("testAdd with data set \"ones\"", byName.getDisplayName());
    }

    @Test
    void parameterizedCase_acceptsNullArguments() {
        DataDrivenFixture test = new DataDrivenFixture("testNull", Arrays.asList(null, "x"), 0);

        assertEquals(Arrays.asList(null, "x"), test.getProvidedData());
    }

    @Test
    void equals_differsByClassAndSettings() {
        PlainFixture plain = new PlainFixture("testA");
        DataDrivenFixture other = new DataDrivenFixture("testA");
        assertNotEquals(plain, other);

        PlainFixture isolated = new PlainFixture("testA");
        isolated.setRunTestInSeparateProcess(true);
        assertNotEquals(plain, isolated);

        plain.setRunTestInSeparateProcess(true);
        assertEquals(plain, isolated);
        assertEquals(plain.hashCode(), isolated.hashCode());
    }
}
