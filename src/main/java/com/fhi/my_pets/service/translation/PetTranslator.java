package com.fhi.my_pets.service.translation;

import java.time.Duration;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.fhi.my_pets.dto.TranslatedPetDto;
import com.fhi.my_pets.model.Owner;
import com.fhi.my_pets.model.Pet;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Adds translations of a pet's breed, color and species to the pet's description.
 *
 * <p>The three translations are requested concurrently. A translation that fails or
 * times out is replaced by the original text: translating never fails the lookup.</p>
 */
@Slf4j
@Component
public class PetTranslator
{
    private final TranslationClient translationClient;
    private final String sourceLang;
    private final String targetLang;
    private final Duration timeout;

    public PetTranslator(TranslationClient translationClient,
                         @Value("${app.translation.source-lang:en}")    String sourceLang,
                         @Value("${app.translation.target-lang:fr}")    String targetLang,
                         @Value("${app.translation.timeout-ms:3000}")   long timeoutMs)
    {   this.translationClient = translationClient;
        this.sourceLang        = sourceLang;
        this.targetLang        = targetLang;
        this.timeout           = Duration.ofMillis(timeoutMs);
    }


    /**
     * Blocks until the three translations have settled.
     */
    public TranslatedPetDto translate(Pet pet, Owner owner)
    {
        TranslatedPetDto dto = TranslatedPetDto.from(pet, owner);

        // Color is the only field normalized before translation
        String color = pet.getColor().toLowerCase(Locale.ROOT);

        Mono.zip(translateOrKeep(pet.getBreed()),
                 translateOrKeep(color),
                 translateOrKeep(pet.getSpecies()))
            .doOnNext(translations -> {
                dto.setBreedTranslated  (translations.getT1());
                dto.setColorTranslated  (translations.getT2());
                dto.setSpeciesTranslated(translations.getT3());
            })
            .block();

        return dto;
    }


    /**
     * @return the translation of {@code text}, or {@code text} itself if anything goes wrong.
     */
    private Mono<String> translateOrKeep(String text)
    {
        // defer: a client throwing instead of erroring is handled the same way
        return Mono.defer(() -> translationClient.translate(text, sourceLang, targetLang))
                   .timeout(timeout)
                   .defaultIfEmpty(text)
                   .onErrorResume(e -> {
                       log.warn("Translation of '{}' ({}|{}) failed, keeping original text: {}",
                                text, sourceLang, targetLang, e.toString());
                       return Mono.just(text);
                   });
    }
}
