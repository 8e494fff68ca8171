/**
 * Pipeline stage types.
 *
 * <p>A {@link me.internalizable.quickplay.candidate.RawCandidate} becomes a
 * {@link me.internalizable.quickplay.candidate.ClassifiedServer} once it passes
 * every filter, and a {@link me.internalizable.quickplay.candidate.ScoredServer}
 * once scored. Each conversion builds a new value; nothing is mutated in place.</p>
 */
package me.internalizable.quickplay.candidate;
