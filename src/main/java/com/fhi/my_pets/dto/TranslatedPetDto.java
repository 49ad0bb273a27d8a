package com.fhi.my_pets.dto;

import com.fhi.my_pets.model.Owner;
import com.fhi.my_pets.model.Pet;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A pet with its owner and the translations of its descriptive fields.
 * A translated field holds the original text when its translation failed.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TranslatedPetDto extends PetDto {

    private OwnerDto owner;

    private String breedTranslated;
    private String colorTranslated;
    private String speciesTranslated;


    public static TranslatedPetDto from(Pet pet, Owner owner) {
        TranslatedPetDto dto = new TranslatedPetDto();
        dto.copyFrom(pet);
        dto.setOwner(OwnerDto.from(owner));
        return dto;
    }
}
