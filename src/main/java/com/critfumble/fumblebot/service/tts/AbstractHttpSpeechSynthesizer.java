package com.critfumble.fumblebot.service.tts;

import com.critfumble.fumblebot.config.properties.TtsProperties;
import com.critfumble.fumblebot.exception.ProviderException;
import com.critfumble.fumblebot.exception.ProviderExceptionBuilder;
import com.critfumble.fumblebot.util.LogSanitizer;
import com.critfumble.fumblebot.util.TimeUtils;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Base class for speech synthesizers that call a vendor HTTP API with OkHttp.
 *
 * <p>Subclasses build the vendor request; this class executes it, maps non-2xx responses and I/O
 * failures to {@link ProviderException}, and returns the raw audio body.
 *
 * <p><b>Thread Safety:</b> {@link OkHttpClient} is thread-safe and shared by all calls.
 */
public abstract class AbstractHttpSpeechSynthesizer implements SpeechSynthesizer {

    private static final Logger LOG = LogManager.getLogger(AbstractHttpSpeechSynthesizer.class);

    protected static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json; charset=utf-8");
    private static final int ERROR_BODY_PREVIEW = 200;

    protected final TtsProperties.Endpoint config;
    private final OkHttpClient httpClient;

    protected AbstractHttpSpeechSynthesizer(TtsProperties.Endpoint config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public boolean isAvailable() {
        return config.hasApiKey();
    }

    @Override
    public final byte[] synthesize(String text, VoiceParams params) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        if (!isAvailable()) {
            throw new ProviderException("Speech provider not configured", name());
        }
        VoiceParams effective = params != null ? params : VoiceParams.defaults();
        Request request = buildRequest(text, effective);

        long start = System.nanoTime();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String errorBody = body != null ? body.string() : "";
                throw ProviderExceptionBuilder.create("Speech synthesis failed")
                        .provider(name())
                        .statusCode(response.code())
                        .durationMs(TimeUtils.elapsedMillis(start))
                        .metadata("body", LogSanitizer.truncate(errorBody, ERROR_BODY_PREVIEW))
                        .build();
            }
            byte[] audio = body != null ? body.bytes() : new byte[0];
            if (audio.length == 0) {
                throw ProviderExceptionBuilder.create("Speech synthesis returned no audio")
                        .provider(name())
                        .durationMs(TimeUtils.elapsedMillis(start))
                        .build();
            }
            LOG.debug("{} synthesized {} chars into {} bytes in {} ms",
                    name(), text.length(), audio.length, TimeUtils.elapsedMillis(start));
            return audio;
        } catch (IOException e) {
            throw ProviderExceptionBuilder.create("Speech synthesis request failed")
                    .provider(name())
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        }
    }

    /**
     * Builds the vendor-specific HTTP request.
     *
     * @param text text to speak, never blank
     * @param params voice overrides, never null
     * @return request ready to execute
     */
    protected abstract Request buildRequest(String text, VoiceParams params);

    /**
     * Joins the configured base URL and a path, tolerating a trailing slash on the base.
     */
    protected String endpoint(String path) {
        String base = config.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    protected String voiceOrDefault(VoiceParams params) {
        return params.voiceId() != null ? params.voiceId() : config.getVoice();
    }

    protected double speedOrDefault(VoiceParams params) {
        return params.speed() != null ? params.speed() : config.getSpeed();
    }
}
