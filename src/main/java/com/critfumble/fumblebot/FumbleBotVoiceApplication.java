package com.critfumble.fumblebot;

import com.critfumble.fumblebot.config.properties.LlmProperties;
import com.critfumble.fumblebot.config.properties.ProviderProperties;
import com.critfumble.fumblebot.config.properties.SubtitleProperties;
import com.critfumble.fumblebot.config.properties.ThreadPoolProperties;
import com.critfumble.fumblebot.config.properties.TtsProperties;
import com.critfumble.fumblebot.config.properties.VoiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        VoiceProperties.class,
        ProviderProperties.class,
        SubtitleProperties.class,
        ThreadPoolProperties.class,
        LlmProperties.class,
        TtsProperties.class
})
public class FumbleBotVoiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FumbleBotVoiceApplication.class, args);
    }

}
