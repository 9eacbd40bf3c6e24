/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.airplay.exception.AirplayException}, an
 * unchecked base, so that station-level failures can be contained at the worker-pool boundary
 * with a single catch.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.airplay.exception.CaptureException} - no audio for this poll</li>
 *   <li>{@link com.phillippitts.airplay.exception.FingerprintException} - fpcalc failed</li>
 *   <li>{@link com.phillippitts.airplay.exception.AdapterException} - external service failure,
 *       with {@link com.phillippitts.airplay.exception.AdapterTimeoutException} and
 *       {@link com.phillippitts.airplay.exception.AdapterQuotaExceededException}</li>
 *   <li>{@link com.phillippitts.airplay.exception.RegistryConflictException} - unique ISRC
 *       violation, resolved inside the registry</li>
 *   <li>{@link com.phillippitts.airplay.exception.RecorderWriteException} - atomic write failed,
 *       detection discarded</li>
 *   <li>{@link com.phillippitts.airplay.exception.PersistenceUnavailableException} - fatal</li>
 *   <li>{@link com.phillippitts.airplay.exception.PollDeadlineExceededException} and
 *       {@link com.phillippitts.airplay.exception.PipelineSaturatedException} - scheduling</li>
 * </ul>
 *
 * <p>A recognition "no match" is an outcome, never an exception.
 *
 * @since 1.0
 */
package com.phillippitts.airplay.exception;
