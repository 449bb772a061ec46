package com.vidnyan.vetree.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.vetree.IndexProperties;
import com.vidnyan.vetree.domain.extract.DesignParser;
import com.vidnyan.vetree.domain.extract.KeywordDenylist;
import com.vidnyan.vetree.domain.extract.StructuralExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Spring configuration for vetree components.
 * Wires the pure domain parsers and the refresh scheduler.
 */
@Slf4j
@Configuration
public class VetreeConfiguration {

    /**
     * ObjectMapper for JSON output.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Bean
    public KeywordDenylist keywordDenylist(IndexProperties properties) {
        KeywordDenylist denylist = KeywordDenylist.defaults().with(properties.getExtraKeywords());
        log.info("Instantiation keyword denylist: {} entries", denylist.keywords().size());
        return denylist;
    }

    @Bean
    public DesignParser designParser(KeywordDenylist keywordDenylist) {
        return new DesignParser(new StructuralExtractor(keywordDenylist));
    }

    /**
     * Single thread, so at most one rescan runs at a time.
     */
    @Bean
    public ThreadPoolTaskScheduler refreshTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("vetree-refresh-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
