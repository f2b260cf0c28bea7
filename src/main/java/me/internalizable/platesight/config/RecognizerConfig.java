package me.internalizable.platesight.config;

import me.internalizable.platesight.recognizer.DashScopeRecognizer;
import me.internalizable.platesight.recognizer.PlateResponseParser;
import me.internalizable.platesight.recognizer.Recognizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Configuration
public class RecognizerConfig {

    @Value("${recognition.dashscope.api-key:}")
    private String apiKey;

    @Value("${recognition.dashscope.api-url:https://dashscope.aliyuncs.com/api/v1/services/aigc/multimodal-generation/generation}")
    private String apiUrl;

    @Bean
    public RestClient dashScopeRestClient() {
        return RestClient.builder()
                .baseUrl(apiUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Bean
    public Recognizer recognizer(RestClient dashScopeRestClient,
                                 PlateResponseParser plateResponseParser,
                                 Clock clock,
                                 @Value("${recognition.dashscope.model:qwen-vl-plus}") String model) {
        return new DashScopeRecognizer(dashScopeRestClient, plateResponseParser, model, !apiKey.isBlank(), clock);
    }
}
