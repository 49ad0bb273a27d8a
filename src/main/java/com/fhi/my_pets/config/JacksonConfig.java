package com.fhi.my_pets.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig
{
   /**
    * The application-wide {@link ObjectMapper}, used by the REST layer, the translation
    * client and the test fixture loader alike.
    *
    * Pet dates of birth go out as "2018-06-10", never as [2018,6,10].
    */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(JsonParser.Feature.ALLOW_COMMENTS, true)                       // fixture files carry comments
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)     // translation API answers carry much more than we read
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .registerModule(new JavaTimeModule());
    }
}
