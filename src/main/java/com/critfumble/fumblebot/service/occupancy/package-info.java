/**
 * Pause and resume of sessions by voice channel occupancy.
 */
package com.critfumble.fumblebot.service.occupancy;
