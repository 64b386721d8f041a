package com.phillippitts.voicenotes;

import com.phillippitts.voicenotes.config.properties.AudioValidationProperties;
import com.phillippitts.voicenotes.config.properties.CredentialProperties;
import com.phillippitts.voicenotes.config.properties.OpenAiProperties;
import com.phillippitts.voicenotes.config.properties.RateLimitProperties;
import com.phillippitts.voicenotes.config.properties.RetryProperties;
import com.phillippitts.voicenotes.config.properties.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioValidationProperties.class,
        RateLimitProperties.class,
        RetryProperties.class,
        OpenAiProperties.class,
        CredentialProperties.class,
        StorageProperties.class
})
public class VoiceNotesApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceNotesApplication.class, args);
    }

}
