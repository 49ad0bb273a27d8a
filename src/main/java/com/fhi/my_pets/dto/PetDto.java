package com.fhi.my_pets.dto;

import java.time.LocalDate;

import com.fhi.my_pets.model.Pet;

import lombok.Data;

@Data
public class PetDto {

    private Long id;
    private String name;
    private LocalDate dateOfBirth;
    private String species;      // e.g. "Dog", "Cat", etc.
    private String breed;
    private String color;
    private Double weight;

    private Long ownerId;


    public static PetDto from(Pet pet) {
        PetDto dto = new PetDto();
        dto.copyFrom(pet);
        return dto;
    }

    protected void copyFrom(Pet pet) {
        this.id          = pet.getId();
        this.name        = pet.getName();
        this.dateOfBirth = pet.getDateOfBirth();
        this.species     = pet.getSpecies();
        this.breed       = pet.getBreed();
        this.color       = pet.getColor();
        this.weight      = pet.getWeight();
        this.ownerId     = pet.getOwnerId();
    }
}
