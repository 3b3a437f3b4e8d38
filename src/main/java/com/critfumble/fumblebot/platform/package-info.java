/**
 * Chat-platform gateway capabilities consumed by the voice orchestrator.
 *
 * <p>Nothing in this package talks to the network; the hosting bot supplies a
 * {@link com.critfumble.fumblebot.platform.ChatPlatform} bean.
 */
package com.critfumble.fumblebot.platform;
