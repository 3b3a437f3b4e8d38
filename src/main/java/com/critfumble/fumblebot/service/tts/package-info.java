/**
 * Text-to-speech providers backed by vendor HTTP APIs.
 */
package com.critfumble.fumblebot.service.tts;
