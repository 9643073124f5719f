package com.kpisentinel.detection.config;

import com.kpisentinel.detection.analytics.IqrDetector;
import com.kpisentinel.detection.analytics.SeasonalDecomposer;
import com.kpisentinel.detection.analytics.TrendAnalyzer;
import com.kpisentinel.detection.analytics.ZScoreDetector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DetectionConfig {

    @Bean
    public ZScoreDetector zScoreDetector(DetectionProperties properties) {
        DetectionProperties.ZScore zscore = properties.zscore();
        return new ZScoreDetector(zscore.threshold(), zscore.minSamples(), zscore.bands(), zscore.leaveOneOutBaseline());
    }

    @Bean
    public IqrDetector iqrDetector(DetectionProperties properties) {
        DetectionProperties.Iqr iqr = properties.iqr();
        return new IqrDetector(iqr.multiplier(), iqr.minSamples(), iqr.bands());
    }

    @Bean
    public SeasonalDecomposer seasonalDecomposer(DetectionProperties properties) {
        DetectionProperties.Seasonal seasonal = properties.seasonal();
        return new SeasonalDecomposer(seasonal.period(), seasonal.threshold(), seasonal.bands());
    }

    @Bean
    public TrendAnalyzer trendAnalyzer(DetectionProperties properties) {
        DetectionProperties.TrendSettings trend = properties.trend();
        return new TrendAnalyzer(trend.significanceThreshold(), trend.bands());
    }

    @Bean(name = "detectionExecutor")
    public ThreadPoolTaskExecutor detectionExecutor(DetectionProperties properties) {
        int parallelism = properties.batch().parallelism();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setThreadNamePrefix("detection-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
