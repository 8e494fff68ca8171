/**
 * Steam Web API client: server directory and schema document source.
 */
package me.internalizable.quickplay.steam;
