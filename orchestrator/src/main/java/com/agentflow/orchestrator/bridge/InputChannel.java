package com.agentflow.orchestrator.bridge;

import java.io.IOException;
import java.io.OutputStream;
import java.util.function.BooleanSupplier;

/**
 * Write end of the side channel an agent reads its initial message from.
 *
 * The agent reads until end-of-stream, so whoever opens the channel must
 * close it once the message is written.
 */
public interface InputChannel {

    /**
     * Open the write end. May block until the reading side is ready.
     *
     * @param keepWaiting polled while blocked; returning false abandons the open
     * @throws IOException if the channel cannot be opened or the wait was abandoned
     */
    OutputStream open(BooleanSupplier keepWaiting) throws IOException;

    /** Short description for logs, e.g. the pipe path. */
    String describe();
}
