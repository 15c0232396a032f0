/**
 * Transactional outbox: staging, publishing, dead entry handling and purge.
 *
 * @see eventflow.outbox.OutboxWriter
 * @see eventflow.outbox.OutboxPublisher
 */
package eventflow.outbox;
