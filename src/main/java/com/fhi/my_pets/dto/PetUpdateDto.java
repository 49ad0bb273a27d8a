package com.fhi.my_pets.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Partial update of a pet: null fields are left untouched.
 *
 * <p>Bean validation treats null as valid, so the constraints below only bite on
 * fields that are actually provided.
 */
@Data
public class PetUpdateDto {

    @Pattern(regexp = NOT_BLANK, message = "must not be blank") @Size(max = 50)
    private String name;

    @PastOrPresent
    private LocalDate dateOfBirth;

    @Pattern(regexp = NOT_BLANK, message = "must not be blank") @Size(max = 50)
    private String species;

    @Pattern(regexp = NOT_BLANK, message = "must not be blank") @Size(max = 50)
    private String breed;

    @Pattern(regexp = NOT_BLANK, message = "must not be blank") @Size(max = 50)
    private String color;

    @PositiveOrZero
    private Double weight;

    /**
     * Moves the pet to another, existing, owner.
     */
    private Long ownerId;

    static final String NOT_BLANK = "(?s).*\\S.*";
}
