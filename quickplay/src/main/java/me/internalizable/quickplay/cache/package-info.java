/**
 * Expiring containers for per-server state kept across ticks.
 */
package me.internalizable.quickplay.cache;
