/**
 * Micrometer meters for the voice pipeline.
 */
package com.critfumble.fumblebot.service.metrics;
