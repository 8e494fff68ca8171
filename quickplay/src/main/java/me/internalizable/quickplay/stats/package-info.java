/**
 * Population statistics of each directory listing, written next to the
 * ranked snapshot.
 */
package me.internalizable.quickplay.stats;
