/**
 * Outbound snapshot model.
 */
package me.internalizable.quickplay.api.snapshot;
