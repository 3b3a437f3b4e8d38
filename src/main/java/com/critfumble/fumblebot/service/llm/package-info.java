/**
 * Language model access (LangChain4j OpenAI client).
 */
package com.critfumble.fumblebot.service.llm;
