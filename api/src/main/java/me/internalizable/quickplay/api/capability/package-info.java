/**
 * Capabilities consumed by the quickplay pipeline.
 *
 * <p>Each interface stands for an external system the pipeline talks to but
 * does not implement: the server directory, the direct probe, geolocation,
 * the schema document source, and the downstream snapshot consumer.</p>
 */
package me.internalizable.quickplay.api.capability;
