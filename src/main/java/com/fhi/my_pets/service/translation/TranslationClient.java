package com.fhi.my_pets.service.translation;

import reactor.core.publisher.Mono;

/**
 * A remote text translation service.
 */
public interface TranslationClient
{
    /**
     * Translates a short text.
     *
     * @param text       the text to translate
     * @param sourceLang language code of {@code text}, e.g. "en"
     * @param targetLang language code to translate to, e.g. "fr"
     * @return the translation; errors if the service cannot be reached or gives no translation
     */
    Mono<String> translate(String text, String sourceLang, String targetLang);
}
