/**
 * Public API for the quickplay matchmaking service.
 *
 * <p>Embedders obtain a {@link me.internalizable.quickplay.api.QuickplayAPI}
 * to read the latest ranked snapshot and to trigger an out-of-band refresh.</p>
 */
package me.internalizable.quickplay.api;
