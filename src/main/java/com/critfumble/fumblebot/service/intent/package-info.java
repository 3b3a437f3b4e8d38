/**
 * Intent resolution for addressed utterances: a deterministic fast matcher, a language-model stage and
 * a last-resort heuristic.
 *
 * @see com.critfumble.fumblebot.service.intent.IntentResolver
 */
package com.critfumble.fumblebot.service.intent;
