/**
 * Implementation of the embedder-facing {@link me.internalizable.quickplay.api.QuickplayAPI}.
 */
package me.internalizable.quickplay.impl;
