/**
 * Transcription stream control and routing of recognized speech.
 */
package com.critfumble.fumblebot.service.transcription;
