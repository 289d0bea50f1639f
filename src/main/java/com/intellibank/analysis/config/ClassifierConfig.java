package com.intellibank.analysis.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import com.intellibank.analysis.classification.CategoryCatalog;
import com.intellibank.analysis.classification.ClassifierBackend;
import com.intellibank.analysis.classification.HttpClassifierBackend;
import com.intellibank.analysis.classification.KeywordScoringClassifierBackend;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class ClassifierConfig {

    @Bean
    public CategoryCatalog categoryCatalog(AnalysisProperties properties) {
        CategoryCatalog catalog = CategoryCatalog.withExtras(properties.categorization().extraCategories());
        log.info("[ClassifierConfig] categories={}", catalog.categories());
        return catalog;
    }

    /**
     * Remote classifier when {@code intellibank.analysis.classifier.http.base-url} is set, local
     * keyword scoring otherwise.
     */
    @Bean
    public ClassifierBackend classifierBackend(AnalysisProperties properties,
                                               ObjectProvider<RestTemplateBuilder> builderProvider) {
        AnalysisProperties.Classifier.Http http = properties.classifier().http();
        if (!http.enabled()) {
            log.info("[ClassifierConfig] backend=keyword-scoring");
            return new KeywordScoringClassifierBackend();
        }

        RestTemplateBuilder builder = builderProvider.getIfAvailable(RestTemplateBuilder::new);
        RestTemplate restTemplate = builder
                .setConnectTimeout(http.timeout())
                .setReadTimeout(http.timeout())
                .build();
        log.info("[ClassifierConfig] backend=http baseUrl={} timeout={}", http.baseUrl(), http.timeout());
        return new HttpClassifierBackend(http.baseUrl(), restTemplate);
    }
}
