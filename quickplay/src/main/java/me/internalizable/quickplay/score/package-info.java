/**
 * Scoring model.
 *
 * <p>The {@link me.internalizable.quickplay.score.Scorer} combines the
 * population curve with reputation, penalties, the trend bonus and jitter.
 * Trend and jitter state lives in expiring caches and is only touched from the
 * scheduling thread.</p>
 */
package me.internalizable.quickplay.score;
