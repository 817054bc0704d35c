package com.ryuqq.ingest.application.runtime;

/**
 * Long-running consume-and-flush loop of one worker.
 *
 * <p>This interface defines the runtime behaviour of a single ingest worker: pull
 * documents from the durable channel, flush them in batches to the search backend,
 * and acknowledge each successfully indexed document.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * runFlushLoop() starts
 *   ↓
 * while (not stopped):
 *   1. CONNECTING: open backend connection + channel consumer
 *   2. STREAMING: pull messages until a batch is full (or the channel idles)
 *   3. Submit batch, one result per document in submission order
 *   4. ACK_OR_SKIP: ack successes, leave failures un-acked for redelivery
 *   5. On any failure: log, drop connections and pending acks, back off, reconnect
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>runFlushLoop() blocks its calling thread until {@link #stop()} is called</li>
 *   <li>Each instance belongs to exactly one worker thread and is not shared</li>
 *   <li>Multiple instances consume the same channel concurrently; the broker delivers
 *       each message to one of them</li>
 * </ul>
 *
 * <p><strong>Processing Guarantees:</strong></p>
 * <ul>
 *   <li>At-least-once: a message is acknowledged only after the backend indexed it</li>
 *   <li>Acknowledgments within a worker happen in pull order</li>
 *   <li>Interrupted workers leave their un-acked messages to broker redelivery</li>
 * </ul>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public interface FlushLoop {

    /**
     * Runs until {@link #stop()} is called or the thread is interrupted.
     *
     * <p>Transient channel and backend failures are handled internally. Anything
     * thrown out of this method is an unexpected worker exit.</p>
     */
    void runFlushLoop();

    /**
     * Requests the loop to exit after its current blocking call.
     */
    void stop();

    /**
     * @return current state
     */
    FlusherState state();
}
