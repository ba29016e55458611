package com.phillippitts.truthtell;

import com.phillippitts.truthtell.config.properties.AssemblyAiProperties;
import com.phillippitts.truthtell.config.properties.AudioSourceProperties;
import com.phillippitts.truthtell.config.properties.CacheProperties;
import com.phillippitts.truthtell.config.properties.CredibilityProperties;
import com.phillippitts.truthtell.config.properties.LiveStreamProperties;
import com.phillippitts.truthtell.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        LiveStreamProperties.class,
        CacheProperties.class,
        CredibilityProperties.class,
        AssemblyAiProperties.class,
        AudioSourceProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class TruthTellApplication {

    public static void main(String[] args) {
        SpringApplication.run(TruthTellApplication.class, args);
    }

}
