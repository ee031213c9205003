package com.neoexplorer.backend.config;

import com.neoexplorer.backend.service.NeoDatabase;
import com.neoexplorer.backend.service.NeoExtractor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(QueryProperties.class)
public class NeoDataConfig {

    @Value("${neo.data.neos:data/neos.csv}")
    private String neoFile;

    @Value("${neo.data.approaches:data/cad.json}")
    private String approachFile;

    // Loaded once at startup; read-only afterwards.
    @Bean
    public NeoDatabase neoDatabase(NeoExtractor extractor) {
        return new NeoDatabase(
                extractor.loadNeos(Path.of(neoFile)),
                extractor.loadApproaches(Path.of(approachFile)));
    }
}
