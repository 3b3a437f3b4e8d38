/**
 * Immutable domain types shared by the voice session components: transcript entries, session modes,
 * addressed utterances, intent results and response pairs.
 *
 * @since 1.0
 */
package com.critfumble.fumblebot.domain;
