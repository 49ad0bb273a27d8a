package com.fhi.my_pets.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.fhi.my_pets.service.translation.MyMemoryTranslationClient;
import com.fhi.my_pets.service.translation.TranslationClient;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class TranslationConfig
{
    @Bean
    public TranslationClient translationClient(WebClient.Builder webClientBuilder,
                                               @Value("${app.translation.base-url:https://api.mymemory.translated.net}") String baseUrl)
    {
        log.debug("Translation client on {}", baseUrl);
        return new MyMemoryTranslationClient(webClientBuilder.baseUrl(baseUrl).build());
    }
}
