package com.critfumble.fumblebot.service.tts;

import com.critfumble.fumblebot.config.properties.TtsProperties;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

/**
 * OpenAI speech API ({@code POST /audio/speech}).
 */
@Component
public class OpenAiSpeechSynthesizer extends AbstractHttpSpeechSynthesizer {

    public static final String NAME = "openai";

    public OpenAiSpeechSynthesizer(TtsProperties properties) {
        super(properties.getOpenai());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Request buildRequest(String text, VoiceParams params) {
        JSONObject json = new JSONObject()
                .put("model", config.getModel())
                .put("input", text)
                .put("voice", voiceOrDefault(params))
                .put("response_format", config.getFormat())
                .put("speed", speedOrDefault(params));

        return new Request.Builder()
                .url(endpoint("/audio/speech"))
                .addHeader("Authorization", "Bearer " + config.getApiKey())
                .post(RequestBody.create(json.toString(), JSON_MEDIA_TYPE))
                .build();
    }
}
