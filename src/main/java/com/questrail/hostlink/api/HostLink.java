package com.questrail.hostlink.api;

import java.util.List;
import java.util.function.Consumer;

/**
 * HostLink
 * =============================================================================
 * Consumer-facing request API of the host link.
 *
 * <p>The management application talks to the instrumented host module only
 * through this interface. Every operation is a fire-and-forget request: it
 * stores the supplied callback and publishes one request envelope, then
 * returns. The result surfaces later, on the transport's dispatch thread, when
 * the matching reply arrives.</p>
 *
 * <h2>Callback semantics</h2>
 * <ul>
 *   <li>One pending callback per operation kind. Issuing a second request of
 *       the same kind before the first reply arrives replaces the first
 *       callback; the first is never invoked.</li>
 *   <li>Fetch, remove and clear callbacks run at most once per request.</li>
 *   <li>The activation callback stays installed and runs for every activation
 *       reply, including unsolicited status pushes.</li>
 *   <li>If no reply ever arrives the callback is never invoked. There is no
 *       error path; callers that need one configure a reply timeout.</li>
 * </ul>
 *
 * <h2>Registration</h2>
 * The reply receiver must be registered (bound to an owning component) before
 * replies can be observed. Registration calls in the wrong state are absorbed
 * and reported, never thrown.
 */
public interface HostLink
{
    /**
     * Bind the reply receiver to {@code owner} and start listening for replies.
     *
     * @param owner the component whose lifetime bounds the registration
     * @return {@code true} if the receiver was registered by this call
     */
    boolean register(Object owner);

    /**
     * Stop listening for replies and drop every pending callback.
     *
     * @param owner the component that registered the receiver
     * @return {@code true} if the receiver was unregistered by this call
     */
    boolean unregister(Object owner);

    /**
     * Ask the host module whether it is active.
     *
     * @param callback receives {@code true} when the host answered with the
     *                 expected activation token
     */
    void checkActivation(Consumer<Boolean> callback);

    /**
     * Fetch the captured error records.
     *
     * @param callback receives the records in host order; an empty list when
     *                 the reply could not be decoded
     */
    void fetchList(Consumer<List<ErrorRecord>> callback);

    /**
     * Remove one captured error record, matched by {@link ErrorRecord#identity()}.
     *
     * @param record   the record to remove
     * @param callback runs once the host acknowledges the removal
     */
    void removeOne(ErrorRecord record, Runnable callback);

    /**
     * Clear every captured error record.
     *
     * @param callback runs once the host acknowledges the clear
     */
    void clearAll(Runnable callback);
}
