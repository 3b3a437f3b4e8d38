/**
 * Debounced live subtitles in the session's companion text channel.
 */
package com.critfumble.fumblebot.service.subtitle;
