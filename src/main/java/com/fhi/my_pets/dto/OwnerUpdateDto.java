package com.fhi.my_pets.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Partial update of an owner: null fields are left untouched.
 */
@Data
public class OwnerUpdateDto {

    @Pattern(regexp = PetUpdateDto.NOT_BLANK, message = "must not be blank") @Size(max = 100)
    private String lastName;

    @Pattern(regexp = PetUpdateDto.NOT_BLANK, message = "must not be blank") @Size(max = 100)
    private String firstName;

    @Email @Pattern(regexp = PetUpdateDto.NOT_BLANK, message = "must not be blank") @Size(max = 255)
    private String email;

    @Pattern(regexp = PetUpdateDto.NOT_BLANK, message = "must not be blank") @Size(max = 50)
    private String phoneNumber;
}
