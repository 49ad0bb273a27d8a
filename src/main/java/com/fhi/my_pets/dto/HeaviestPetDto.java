package com.fhi.my_pets.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeaviestPetDto {

    private Long petId;
    private String name;
    private String species;
    private Double weight;
    private Long ownerId;
    private String ownerFullName;
}
