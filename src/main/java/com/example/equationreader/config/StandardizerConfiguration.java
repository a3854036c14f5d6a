package com.example.equationreader.config;

import com.example.equationreader.service.standardizer.NoOpTextStandardizer;
import com.example.equationreader.service.standardizer.OllamaTextStandardizer;
import com.example.equationreader.service.standardizer.TextStandardizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StandardizerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StandardizerConfiguration.class);

    @Bean
    public TextStandardizer textStandardizer(EquationReaderProperties properties, RestTemplateBuilder restTemplateBuilder) {
        EquationReaderProperties.Standardizer settings = properties.getStandardizer();
        if (!settings.isEnabled()) {
            log.info("Text standardizer disabled. Markup is repaired by the rule table only.");
            return new NoOpTextStandardizer();
        }
        log.info("Using Ollama model '{}' at {} as text standardizer", settings.getModel(), settings.getBaseUrl());
        return new OllamaTextStandardizer(restTemplateBuilder
                .rootUri(settings.getBaseUrl())
                .setConnectTimeout(settings.getTimeout())
                .setReadTimeout(settings.getTimeout())
                .build(), settings.getModel());
    }
}
