package com.bmsedge.analytics.config;

import com.bmsedge.analytics.service.WeatherCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ApplicationConfig {

    /**
     * Worker pool for multi-product batch analysis
     */
    @Bean
    public ThreadPoolTaskExecutor analysisExecutor(AnalyticsProperties properties) {
        int poolSize = properties.getBatch().getPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }

    /**
     * Shared weather cache; lives as long as the application context and evicts least recently
     * used ranges beyond analytics.weather.cache-max-entries
     */
    @Bean
    public WeatherCache weatherCache(AnalyticsProperties properties) {
        return new WeatherCache(properties.getWeather().getCacheMaxEntries());
    }
}
