/**
 * Intent execution and the small capabilities it drives (dice, message search, channel lookup).
 */
package com.critfumble.fumblebot.service.action;
