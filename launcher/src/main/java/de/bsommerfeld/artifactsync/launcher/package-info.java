/**
 * Command line entry point and Guice wiring.
 *
 * <h2>Startup</h2>
 * <ol>
 * <li>Resolve the application data directory and the configuration file</li>
 * <li>Build the injector; an invalid configuration fails here</li>
 * <li>Run the requested mode: daemon, single cycle or status</li>
 * </ol>
 *
 * Logs go to the console and to {@code <app-data>/logs/artifact-sync.log}.
 */
package de.bsommerfeld.artifactsync.launcher;
