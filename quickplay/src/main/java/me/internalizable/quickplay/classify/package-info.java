/**
 * Eligibility filtering.
 *
 * <p>The {@link me.internalizable.quickplay.classify.Classifier} runs an ordered
 * predicate chain over each candidate; the first failing predicate decides the
 * {@link me.internalizable.quickplay.classify.RejectionReason}.</p>
 */
package me.internalizable.quickplay.classify;
