package com.google.testbuilder.fixtures;

import com.google.testbuilder.annotations.BackupGlobals;
import com.google.testbuilder.annotations.DataProvider;
import com.google.testbuilder.annotations.Group;
import com.google.testbuilder.annotations.PreserveGlobalState;
import com.google.testbuilder.annotations.RunInSeparateProcess;
import com.google.testbuilder.metadata.MarkedIncompleteException;
import com.google.testbuilder.metadata.MarkedSkippedException;
import com.google.testbuilder.models.TestCase;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * A test class fed by data providers of every supported shape and failure mode.
 */
@Group("math")
public class DataDrivenFixture extends TestCase {

    public static final AtomicBoolean CLOSING_ROWS_CLOSED = new AtomicBoolean();

    public DataDrivenFixture() {
        super();
    }

    public DataDrivenFixture(String name) {
        super(name);
    }

    public DataDrivenFixture(String name, List<Object> data, Object dataName) {
        super(name, data, dataName);
    }

    @Group({"slow", "math"})
    @DataProvider("additions")
    public void testAdd(int a, int b, int sum) {
    }

    @DataProvider("noRows")
    public void testEmpty() {
    }

    @DataProvider("notReady")
    public void testIncomplete() {
    }

    @DataProvider("skipQuietly")
    public void testSkipped() {
    }

    @DataProvider("broken")
    public void testBroken() {
    }

    @DataProvider("arrayRows")
    @DataProvider(value = "listRows", location = ExternalRows.class)
    public void testMerged(int value) {
    }

    @DataProvider("additions")
    @DataProvider("moreAdditions")
    public void testDuplicateKeys(int a, int b, int sum) {
    }

    @DataProvider("scalarRows")
    public void testScalarRows(int value) {
    }

    @DataProvider("instanceRows")
    public void testInstanceProvider(int value) {
    }

    @DataProvider("doesNotExist")
    public void testMissingProvider(int value) {
    }

    @DataProvider("streamedRows")
    public void testStreamed(String value) {
    }

    @DataProvider("lazilyBroken")
    public void testLazilyBroken(String value) {
    }

    @DataProvider("nullRows")
    public void testNullRows(String value) {
    }

    @RunInSeparateProcess
    @PreserveGlobalState(false)
    @BackupGlobals(false)
    @DataProvider("additions")
    public void testIsolated(int a, int b, int sum) {
    }

    public void testWithoutProvider() {
    }

    @DataProvider("lazilyAsserting")
    public void testLazyAssertion(String value) {
    }

    @DataProvider("closingRows")
    public void testClosingStream(String value) {
    }

    public void testOverloaded() {
    }

    @DataProvider("arrayRows")
    public void testOverloaded(int value) {
    }

    public void testOverloaded(String value) {
    }

    public static Map<String, Object[]> additions() {
        Map<String, Object[]> rows = new LinkedHashMap<>();
        rows.put("zeros", new Object[]{0, 0, 0});
        rows.put("ones", new Object[]{1, 1, 2});
        rows.put("mixed", new Object[]{2, -1, 1});
        return rows;
    }

    public static Map<String, List<Object>> moreAdditions() {
        return Map.of("ones", List.of(1, 1, 2));
    }

    public static List<Object[]> noRows() {
        return List.of();
    }

    public static Object[][] notReady() {
        throw new MarkedIncompleteException("waiting on fixtures");
    }

    public static Object[][] skipQuietly() {
        throw new MarkedSkippedException();
    }

    public static Object[][] broken() {
        throw new IllegalStateException("provider exploded");
    }

    public static Object[][] arrayRows() {
        return new Object[][]{{1}, {2}};
    }

    public static List<Object> scalarRows() {
        return List.of(1, 2);
    }

    public Object[][] instanceRows() {
        return new Object[][]{{1}};
    }

    public static Stream<List<String>> streamedRows() {
        return Stream.of(List.of("a"), List.of("b"));
    }

    public static Iterator<Object[]> lazilyBroken() {
        return Stream.<Object[]>generate(() -> {
            throw new MarkedSkippedException("no network");
        }).iterator();
    }

    public static Stream<Object[]> lazilyAsserting() {
        return Stream.generate(() -> {
            throw new AssertionError("lazy boom");
        });
    }

    public static Stream<List<String>> closingRows() {
        return Stream.of(List.of("a"), List.of("b")).onClose(() -> CLOSING_ROWS_CLOSED.set(true));
    }

    public static Object nullRows() {
        return null;
    }

    public static class ExternalRows {

        public static List<List<Object>> listRows() {
            return List.of(List.of(3));
        }
    }
}
