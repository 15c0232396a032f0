/**
 * Inbound routing and idempotent consumption of bus events.
 */
package eventflow.consumer;
