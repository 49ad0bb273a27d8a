package com.fhi.my_pets.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeaviestGroupDto {

    private Long ownerId;
    private String fullName;
    private double totalWeight;  // sum of the owner's pets' weights, in kg
}
