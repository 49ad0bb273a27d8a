package com.fhi.my_pets.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TopOwnerDto {

    private Long ownerId;
    private String fullName;
    private long count;          // nb of pets, possibly of a single species
}
