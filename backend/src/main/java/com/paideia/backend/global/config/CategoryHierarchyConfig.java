package com.paideia.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.paideia.backend.modules.category.application.CategoryHierarchySettings;

@Configuration
public class CategoryHierarchyConfig {

    @Bean
    public CategoryHierarchySettings categoryHierarchySettings(
            @Value("${app.category.max-depth:0}") int maxDepth
    ) {
        return maxDepth > 0 ? CategoryHierarchySettings.withMaxDepth(maxDepth) : CategoryHierarchySettings.unlimited();
    }
}
