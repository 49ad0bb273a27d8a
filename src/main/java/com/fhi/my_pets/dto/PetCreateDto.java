package com.fhi.my_pets.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Payload for creating a pet. The owner must already exist.
 */
@Data
public class PetCreateDto {

    @NotBlank @Size(max = 50)
    private String name;

    @NotNull @PastOrPresent
    private LocalDate dateOfBirth;

    @NotBlank @Size(max = 50)
    private String species;

    @NotBlank @Size(max = 50)
    private String breed;

    @NotBlank @Size(max = 50)
    private String color;

    @NotNull @PositiveOrZero
    private Double weight;

    @NotNull
    private Long ownerId;
}
