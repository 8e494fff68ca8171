/**
 * Geographic estimates: server location and the ping overhead beyond what
 * distance alone explains.
 */
package me.internalizable.quickplay.geo;
