package com.fhi.my_pets.service.translation;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * {@link TranslationClient} backed by the MyMemory public API:
 * <pre>
 *   GET {base-url}/get?q=Black%20cat&amp;langpair=en|fr
 *   => { "responseData": { "translatedText": "Chat noir", ... }, ... }
 * </pre>
 * No API key is sent; the anonymous quota is enough for single-pet lookups.
 */
@Slf4j
public class MyMemoryTranslationClient implements TranslationClient
{
    private final WebClient webClient;

    /**
     * @param webClient a client whose base URL points at the MyMemory API
     */
    public MyMemoryTranslationClient(WebClient webClient)
    {   this.webClient = webClient;
    }


    @Override
    public Mono<String> translate(String text, String sourceLang, String targetLang)
    {
        if (text == null || text.isBlank())
        {   return Mono.justOrEmpty(text);
        }

        return webClient.get()
                        .uri(uriBuilder -> uriBuilder.path("/get")
                                                     .queryParam("q", "{q}")
                                                     .queryParam("langpair", "{langpair}")
                                                     .build(text, sourceLang + "|" + targetLang))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .bodyToMono(MyMemoryResponse.class)
                        .flatMap(response -> {
                            String translated = response.getResponseData() != null 
                                              ? response.getResponseData().getTranslatedText() 
                                              : null;
                            // On quota or rate limit errors, translatedText holds the warning text
                            if (!response.isSuccess() || translated == null || translated.isBlank())
                            {   return Mono.error(new TranslationException(
                                        "No translation for '" + text + "' (" + sourceLang + "|" + targetLang 
                                        + "), responseStatus=" + response.getResponseStatus()));
                            }
                            log.debug("Translated '{}' ({}|{}) as '{}'", text, sourceLang, targetLang, translated);
                            return Mono.just(translated);
                        });
    }



    // ===== Wire format =====

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MyMemoryResponse {
        private ResponseData responseData;
        private String responseStatus;   // sometimes a number, sometimes a string

        /**
         * A missing status counts as success, any other status than 200 as a failure.
         */
        public boolean isSuccess() {
            return responseStatus == null || responseStatus.trim().equals("200");
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseData {
        private String translatedText;
    }
}
