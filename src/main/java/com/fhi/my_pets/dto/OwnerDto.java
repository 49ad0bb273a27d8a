package com.fhi.my_pets.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fhi.my_pets.model.Owner;
import com.fhi.my_pets.model.Pet;

import lombok.Data;

@Data
public class OwnerDto {

    private Long id;
    private String lastName;
    private String firstName;
    private String email;
    private String phoneNumber;

    // Only filled in when the owner is fetched "with pets"
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<PetDto> pets;


    public static OwnerDto from(Owner owner) {
        OwnerDto dto = new OwnerDto();
        dto.setId(owner.getId());
        dto.setLastName(owner.getLastName());
        dto.setFirstName(owner.getFirstName());
        dto.setEmail(owner.getEmail());
        dto.setPhoneNumber(owner.getPhoneNumber());
        return dto;
    }

    public static OwnerDto from(Owner owner, List<Pet> pets) {
        OwnerDto dto = from(owner);
        dto.setPets(pets.stream().map(PetDto::from).toList());
        return dto;
    }
}
