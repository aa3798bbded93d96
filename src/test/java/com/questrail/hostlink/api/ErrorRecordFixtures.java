package com.questrail.hostlink.api;

/**
 * Sample records for tests.
 */
public final class ErrorRecordFixtures {

    private ErrorRecordFixtures() {
    }

    public static ErrorRecord record(String packageName, long timestamp) {
        return new ErrorRecord(
            packageName,
            0,
            false,
            "java.lang.IllegalStateException",
            "boom at " + timestamp,
            "MainActivity.java",
            packageName + ".MainActivity",
            "onCreate",
            42,
            "java.lang.IllegalStateException: boom\n\tat " + packageName + ".MainActivity.onCreate(MainActivity.java:42)",
            timestamp);
    }

    public static ErrorRecord nativeCrash(String packageName, long timestamp) {
        return new ErrorRecord(
            packageName,
            10,
            true,
            "NativeCrash",
            "SIGSEGV",
            null,
            null,
            null,
            -1,
            null,
            timestamp);
    }
}
