/**
 * Asynchronous journal of routing decisions on an LMAX Disruptor ring buffer.
 *
 * <h2>Flow</h2>
 * <pre>
 * request thread -- tryNext/publish --&gt; [ring buffer] --&gt; DecisionRecordingHandler
 *                                                          (bounded, keyed by request id)
 * </pre>
 *
 * <p>Publishing never blocks: a full buffer drops the decision and increments
 * {@code decisions_dropped_total}. On completion the monitor takes the decision back out
 * and records how far its response time estimate was from the observed duration.
 */
package fr.lapetina.airouting.journal;
