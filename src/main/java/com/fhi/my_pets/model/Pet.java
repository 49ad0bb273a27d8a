package com.fhi.my_pets.model;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;


@Entity
@Setter
@Getter
public class Pet 
{
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank                      // Prevent null or empty name
    @Size(max = 50)
    private String name;

    /**
     * LocalDate is the "modern" Java type to use for dates.
     */
    @NotNull
    private LocalDate dateOfBirth;

    /**
     * Free text, stored as entered (e.g. "Dog", "Cat").
     * Statistics group on it case-sensitively, filters compare it case-insensitively.
     */
    @NotBlank
    @Size(max = 50)
    private String species;

    @NotBlank
    @Size(max = 50)
    private String breed;

    @NotBlank
    @Size(max = 50)
    private String color;

    /**
     * In kilograms.
     */
    @NotNull
    @PositiveOrZero
    private Double weight;

    /**
     * Owning side of the pet -> owner relationship.
     * FK to owner.id, see the liquibase changelog.
     */
    @NotNull
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;
}
