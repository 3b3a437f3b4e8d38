/**
 * Transcript recording, markdown export and session summaries.
 */
package com.critfumble.fumblebot.service.transcript;
