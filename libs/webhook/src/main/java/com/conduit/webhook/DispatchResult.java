package com.conduit.webhook;

import java.util.List;

/**
 * Outcome of dispatching one event.
 *
 * @param topic     the event's topic
 * @param succeeded handlers that processed the event
 * @param failed    handlers that threw while matching or processing it
 */
public record DispatchResult(String topic, List<String> succeeded, List<String> failed) {

    public DispatchResult {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    /** Number of handlers whose topic matched, whether or not they succeeded. */
    public int matched() {
        return succeeded.size() + failed.size();
    }

    public boolean unhandled() {
        return matched() == 0;
    }
}
