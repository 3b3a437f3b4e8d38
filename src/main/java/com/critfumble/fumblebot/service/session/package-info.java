/**
 * Session state and the guild-keyed registry that owns it.
 *
 * <p>{@link com.critfumble.fumblebot.service.session.SessionRegistry} is the single owner of per-guild
 * mutable state. Everything else looks sessions up by guild id and re-checks the session id after
 * every asynchronous hop.
 */
package com.critfumble.fumblebot.service.session;
