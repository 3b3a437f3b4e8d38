/**
 * Per-guild serialized speech playback.
 */
package com.critfumble.fumblebot.service.playback;
