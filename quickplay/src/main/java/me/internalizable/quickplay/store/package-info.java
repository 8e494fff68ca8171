/**
 * Key-value storage and the registries built on it.
 *
 * <p>Bans, anycast networks, reputation and geolocation overrides are owned by
 * the operator and read by the pipeline. Values are JSON trees so a single
 * file can hold every table.</p>
 */
package me.internalizable.quickplay.store;
