/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.critfumble.fumblebot.exception.FumbleBotException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.critfumble.fumblebot.exception.SessionAlreadyActiveException} and
 *       {@link com.critfumble.fumblebot.exception.SessionNotActiveException} - session-state errors,
 *       returned to callers of start/stop only</li>
 *   <li>{@link com.critfumble.fumblebot.exception.ProviderUnavailableException} - no usable transcription
 *       provider at start time</li>
 *   <li>{@link com.critfumble.fumblebot.exception.ProviderException} - a speech or language model call
 *       failed; always caught and converted to a result value</li>
 *   <li>{@link com.critfumble.fumblebot.exception.GuildNotAllowedException} - the guild is outside the
 *       configured allow-list</li>
 * </ul>
 *
 * @since 1.0
 */
package com.critfumble.fumblebot.exception;
