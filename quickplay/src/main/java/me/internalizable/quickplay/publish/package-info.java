/**
 * Ranking and publication of the snapshot: the local artifacts and the
 * downstream HTTP consumer.
 */
package me.internalizable.quickplay.publish;
