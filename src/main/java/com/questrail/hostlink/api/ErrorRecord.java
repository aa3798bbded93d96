package com.questrail.hostlink.api;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * ErrorRecord
 * =============================================================================
 * One captured application error, as recorded by the host module and shown by
 * the management application.
 *
 * <p>This is the "serializable record" shape carried by the bus: a single record
 * travels with a remove request, a sequence of them with a fetch reply. The
 * record is immutable and compares by value.</p>
 *
 * <h2>Identity</h2>
 * Two records describe the same captured error when their {@link #identity()}
 * matches. The remote side removes by identity, not by full equality, so a
 * record whose message text was truncated on one side still matches.
 *
 * @param packageName        package of the application that failed
 * @param userId             OS user the application ran as
 * @param nativeCrash        {@code true} for a native (signal) crash
 * @param exceptionClassName fully qualified exception class name
 * @param exceptionMessage   exception message, may be empty
 * @param throwFileName      source file of the top frame
 * @param throwClassName     class of the top frame
 * @param throwMethodName    method of the top frame
 * @param throwLineNumber    line of the top frame, {@code -1} when unknown
 * @param stackTrace         full stack trace text
 * @param timestamp          capture time in epoch milliseconds
 */
public record ErrorRecord(
        String packageName,
        int userId,
        boolean nativeCrash,
        String exceptionClassName,
        String exceptionMessage,
        String throwFileName,
        String throwClassName,
        String throwMethodName,
        int throwLineNumber,
        String stackTrace,
        long timestamp
) implements Serializable
{
    @Serial
    private static final long serialVersionUID = 1L;

    public ErrorRecord {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(exceptionClassName, "exceptionClassName");
        exceptionMessage = exceptionMessage == null ? "" : exceptionMessage;
        throwFileName = throwFileName == null ? "" : throwFileName;
        throwClassName = throwClassName == null ? "" : throwClassName;
        throwMethodName = throwMethodName == null ? "" : throwMethodName;
        stackTrace = stackTrace == null ? "" : stackTrace;
    }

    /**
     * Key the remote side uses to match a remove request against its stored records.
     */
    public Identity identity() {
        return new Identity(packageName, userId, timestamp);
    }

    /**
     * Identity key of an {@link ErrorRecord}.
     */
    public record Identity(String packageName, int userId, long timestamp) implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;
    }
}
