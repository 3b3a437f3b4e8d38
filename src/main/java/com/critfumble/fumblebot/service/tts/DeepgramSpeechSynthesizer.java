package com.critfumble.fumblebot.service.tts;

import com.critfumble.fumblebot.config.properties.TtsProperties;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Deepgram Aura speech API ({@code POST /speak?model=...}).
 *
 * <p>Aura selects the voice through the model name, so {@link VoiceParams#voiceId()} replaces the model.
 * Speed is not supported by the API and is ignored.
 */
@Component
public class DeepgramSpeechSynthesizer extends AbstractHttpSpeechSynthesizer {

    public static final String NAME = "deepgram";

    public DeepgramSpeechSynthesizer(TtsProperties properties) {
        super(properties.getDeepgram());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Request buildRequest(String text, VoiceParams params) {
        HttpUrl url = Objects.requireNonNull(HttpUrl.parse(endpoint("/speak")), "invalid deepgram base url")
                .newBuilder()
                .addQueryParameter("model", params.voiceId() != null ? params.voiceId() : config.getModel())
                .addQueryParameter("encoding", config.getFormat())
                .build();

        JSONObject json = new JSONObject().put("text", text);

        return new Request.Builder()
                .url(url)
                .addHeader("Authorization", "Token " + config.getApiKey())
                .post(RequestBody.create(json.toString(), JSON_MEDIA_TYPE))
                .build();
    }
}
