package com.dragnet.service.core.config;

import com.dragnet.core.datasource.DatasourceFactory;
import com.dragnet.service.core.service.DatasourceRegistry;
import com.dragnet.service.core.service.DragnetService;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(DragnetProperties.class)
public class DragnetAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DatasourceFactory dragnetDatasourceFactory() {
        return DatasourceFactory.fromServiceLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    public DragnetConfig dragnetConfig() {
        return DragnetConfig.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public DatasourceRegistry datasourceRegistry(
            DragnetConfig dragnetConfig, DatasourceFactory factory, DragnetProperties properties) {
        return new DatasourceRegistry(dragnetConfig, factory, properties.toSettings());
    }

    @Bean
    @ConditionalOnMissingBean
    public DragnetService dragnetService(DatasourceRegistry registry) {
        return new DragnetService(registry);
    }
}
