package com.fhi.my_pets.service.translation;

/**
 * The translation service answered, but without a usable translation.
 */
public class TranslationException extends RuntimeException
{
    public TranslationException(String message)
    {   super(message);
    }
}
