/**
 * Immutable domain model: tracks, fingerprint entries, detections, stations and stats.
 *
 * <p>All types are records; mutation is expressed as copy-with-changes so that stores can
 * swap whole values atomically.
 */
package com.phillippitts.airplay.domain;
