package com.phillippitts.voicenotes.config.client;

import com.phillippitts.voicenotes.config.properties.OpenAiProperties;
import com.phillippitts.voicenotes.service.credential.CredentialResolver;
import com.phillippitts.voicenotes.service.credential.CredentialVerifier;
import com.phillippitts.voicenotes.service.extraction.ExtractionGateway;
import com.phillippitts.voicenotes.service.extraction.OpenAiExtractionGateway;
import com.phillippitts.voicenotes.service.transcription.OpenAiTranscriptionGateway;
import com.phillippitts.voicenotes.service.transcription.TranscriptionGateway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP clients for the speech-to-text and chat-completion provider.
 *
 * <p>Two clients share the base URL: the pipeline client allows long reads for large uploads,
 * the verification client is bounded by {@code voicenotes.openai.verify-timeout-ms}.
 */
@Configuration
public class OpenAiClientConfig {

    private final OpenAiProperties props;

    public OpenAiClientConfig(OpenAiProperties props) {
        this.props = props;
    }

    @Bean
    public RestClient openAiRestClient() {
        return build(props.getConnectTimeoutMs(), props.getReadTimeoutMs());
    }

    @Bean
    public RestClient openAiVerifyRestClient() {
        return build(props.getVerifyTimeoutMs(), props.getVerifyTimeoutMs());
    }

    @Bean
    public TranscriptionGateway transcriptionGateway(@Qualifier("openAiRestClient") RestClient restClient) {
        return new OpenAiTranscriptionGateway(restClient, props);
    }

    @Bean
    public ExtractionGateway extractionGateway(@Qualifier("openAiRestClient") RestClient restClient) {
        return new OpenAiExtractionGateway(restClient, props);
    }

    @Bean
    public CredentialVerifier credentialVerifier(@Qualifier("openAiVerifyRestClient") RestClient restClient,
                                                 CredentialResolver credentialResolver) {
        return new CredentialVerifier(restClient, credentialResolver);
    }

    private RestClient build(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(factory)
                .build();
    }
}
