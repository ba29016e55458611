package com.phillippitts.truthtell.config;

import com.phillippitts.truthtell.service.audio.AudioSource;
import com.phillippitts.truthtell.service.transcription.TranscriptionClient;
import com.phillippitts.truthtell.testutil.FakeAudioSource;
import com.phillippitts.truthtell.testutil.FakeTranscriptionClient;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Test configuration replacing the external collaborators (yt-dlp, AssemblyAI) with fakes.
 *
 * <p><b>Usage:</b>
 * <pre>
 * {@literal @}SpringBootTest
 * {@literal @}Import(IntegrationTestConfiguration.class)
 * class MyIntegrationTest { ... }
 * </pre>
 */
@TestConfiguration
public class IntegrationTestConfiguration {

    @Bean
    @Primary
    public FakeAudioSource fakeAudioSource() {
        return new FakeAudioSource();
    }

    @Bean
    @Primary
    public FakeTranscriptionClient fakeTranscriptionClient() {
        return new FakeTranscriptionClient();
    }
}
