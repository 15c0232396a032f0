/**
 * Read-only records returned by the store SPIs and the status enums they carry.
 */
package eventflow.model;
