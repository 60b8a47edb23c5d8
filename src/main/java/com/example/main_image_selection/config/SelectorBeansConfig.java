package com.example.main_image_selection.config;

import com.example.main_image_selection.selector.MainImageSelector;
import com.example.main_image_selection.selector.RankingMainImageSelector;
import com.example.main_image_selection.selector.SelectorConfig;
import com.example.main_image_selection.selector.TieBreakChain;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SelectorBeansConfig {

    @Bean
    public SelectorConfig selectorConfig(SelectorProperties properties) {
        return new SelectorConfig(properties.getDisqualifiedPolicy(), properties.getPartitions());
    }

    @Bean
    public MainImageSelector mainImageSelector(SelectorConfig selectorConfig) {
        return new RankingMainImageSelector(TieBreakChain.standard(), selectorConfig);
    }
}
