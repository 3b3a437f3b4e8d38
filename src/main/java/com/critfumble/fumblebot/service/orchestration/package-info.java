/**
 * Session lifecycle facade and its outward events.
 *
 * <p>{@link com.critfumble.fumblebot.service.orchestration.VoiceSessionOrchestrator} is what a command
 * handler calls. The records in the {@code event} sub-package are published through Spring's
 * {@code ApplicationEventPublisher} for observers; no part of the pipeline listens to them.
 */
package com.critfumble.fumblebot.service.orchestration;
